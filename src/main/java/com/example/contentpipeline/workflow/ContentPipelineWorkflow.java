package com.example.contentpipeline.workflow;

import com.example.contentpipeline.domain.model.PipelineResult;
import com.example.contentpipeline.domain.model.PipelineStage;
import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.WorkItem;
import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

@WorkflowInterface
public interface ContentPipelineWorkflow {

    /**
     * Runs extraction, summarization and both translations for one item.
     * Fails with an {@code ApplicationFailure} typed after the {@code PipelineFailureKind}
     * of the stage that could not complete.
     */
    @WorkflowMethod
    PipelineResult process(WorkItem workItem);

    @QueryMethod
    PipelineStage getStage();

    /** Source-language summary, available once summarization has completed even if translation fails. */
    @QueryMethod
    Summary getSummary();
}
