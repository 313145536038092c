package com.example.contentpipeline.domain.model;

/**
 * Details attached to a failed execution.
 *
 * @param stage            stage the execution was in when the activity call failed
 * @param causeType        error type of the last attempt, see {@code ActivityErrorType}
 * @param retriesExhausted whether the retry budget was used up, as opposed to a non-retryable failure
 * @param message          message of the last attempt
 */
public record StageFailure(PipelineStage stage, String causeType, boolean retriesExhausted, String message) {
}
