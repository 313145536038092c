package com.example.contentpipeline.domain.model;

/**
 * Terminal outcome of one execution as reported to the submitter: either a complete result
 * or a single failure kind with the stage it happened in.
 */
public record PipelineOutcome(String workflowId,
                              WorkItem workItem,
                              OutcomeStatus status,
                              PipelineResult result,
                              PipelineFailureKind failureKind,
                              PipelineStage failedStage,
                              String causeType,
                              boolean retriesExhausted,
                              String message) {

    public static PipelineOutcome completed(String workflowId, WorkItem workItem, PipelineResult result) {
        return new PipelineOutcome(workflowId, workItem, OutcomeStatus.COMPLETED, result,
                null, null, null, false, null);
    }

    public static PipelineOutcome failed(String workflowId, WorkItem workItem, PipelineFailureKind kind,
                                         StageFailure failure) {
        PipelineStage stage = failure != null && failure.stage() != null ? failure.stage()
                : kind != null ? kind.stage() : null;
        return new PipelineOutcome(workflowId, workItem, OutcomeStatus.FAILED, null, kind, stage,
                failure == null ? null : failure.causeType(),
                failure != null && failure.retriesExhausted(),
                failure == null ? null : failure.message());
    }

    public static PipelineOutcome failed(String workflowId, WorkItem workItem, String message) {
        return new PipelineOutcome(workflowId, workItem, OutcomeStatus.FAILED, null, null, null, null, false, message);
    }

    public static PipelineOutcome cancelled(String workflowId, WorkItem workItem) {
        return new PipelineOutcome(workflowId, workItem, OutcomeStatus.CANCELLED, null,
                null, PipelineStage.CANCELLED, null, false, "Execution was cancelled");
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.COMPLETED;
    }
}
