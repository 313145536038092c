package com.example.contentpipeline.workflow.activity;

import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.Transcript;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

@ActivityInterface
public interface SummarizeActivity {

    String TYPE = "Summarize";

    /**
     * Derives the overview, key takeaways and action items of a transcript, in the
     * transcript's language. Fails with {@code MalformedOutput} when the generated content
     * does not have that shape.
     */
    @ActivityMethod(name = TYPE)
    Summary summarize(Transcript transcript);
}
