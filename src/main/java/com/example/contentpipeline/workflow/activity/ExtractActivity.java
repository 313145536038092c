package com.example.contentpipeline.workflow.activity;

import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.domain.model.WorkItem;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

@ActivityInterface
public interface ExtractActivity {

    String TYPE = "Extract";

    /**
     * Looks up the source-language transcript of the item.
     * Fails with a non-retryable {@code NotFound} for unknown items.
     */
    @ActivityMethod(name = TYPE)
    Transcript extract(WorkItem workItem);
}
