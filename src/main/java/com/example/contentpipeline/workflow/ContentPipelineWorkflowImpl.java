package com.example.contentpipeline.workflow;

import com.example.contentpipeline.domain.model.*;
import com.example.contentpipeline.workflow.activity.ActivityErrorType;
import com.example.contentpipeline.workflow.activity.ExtractActivity;
import com.example.contentpipeline.workflow.activity.SummarizeActivity;
import com.example.contentpipeline.workflow.activity.TranslateActivity;
import io.temporal.api.enums.v1.RetryState;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.failure.CanceledFailure;
import io.temporal.failure.TimeoutFailure;
import io.temporal.workflow.Async;
import io.temporal.workflow.CancellationScope;
import io.temporal.workflow.Functions;
import io.temporal.workflow.Promise;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

/**
 * Pipeline state machine for one work item:
 * PENDING → EXTRACTING → SUMMARIZING → TRANSLATING → COMPLETED, or FAILED / CANCELLED.
 *
 * Decisions depend only on the activity results seen so far. Retries and timeouts belong to
 * the activity options, the workflow makes one logical call per activity.
 */
public class ContentPipelineWorkflowImpl implements ContentPipelineWorkflow {

    private static final Logger logger = Workflow.getLogger(ContentPipelineWorkflowImpl.class);

    private final ExtractActivity extractActivity;
    private final SummarizeActivity summarizeActivity;
    private final TranslateActivity translateActivity;

    private PipelineStage stage = PipelineStage.PENDING;
    private Summary summary;

    public ContentPipelineWorkflowImpl() {
        // Fallback options; workers override them per activity type from configuration
        this.extractActivity = Workflow.newActivityStub(ExtractActivity.class,
                ActivityPolicies.fallback(ActivityPolicies.EXTRACT_TIMEOUT));
        this.summarizeActivity = Workflow.newActivityStub(SummarizeActivity.class,
                ActivityPolicies.fallback(ActivityPolicies.SUMMARIZE_TIMEOUT));
        this.translateActivity = Workflow.newActivityStub(TranslateActivity.class,
                ActivityPolicies.fallback(ActivityPolicies.TRANSLATE_TIMEOUT));
    }

    @Override
    public PipelineResult process(WorkItem workItem) {
        logger.info("Pipeline started for item {} ({} -> {})",
                workItem.itemId(), workItem.sourceLanguage(), workItem.targetLanguage());

        Transcript transcript = runStage(PipelineStage.EXTRACTING, PipelineFailureKind.ExtractionFailed,
                () -> extractActivity.extract(workItem));

        this.summary = runStage(PipelineStage.SUMMARIZING, PipelineFailureKind.SummarizationFailed,
                () -> summarizeActivity.summarize(transcript));

        enter(PipelineStage.TRANSLATING);
        // both branches are outstanding together; neither result is used until both settle
        Promise<TranslatedTranscript> transcriptBranch = Async.function(
                translateActivity::translateTranscript, transcript, workItem.targetLanguage());
        Promise<TranslatedSummary> summaryBranch = Async.function(
                translateActivity::translateSummary, summary, workItem.targetLanguage());

        RuntimeException transcriptFailure = transcriptBranch.getFailure();
        RuntimeException summaryFailure = summaryBranch.getFailure();
        TranslationJoin join = TranslationJoin.of(transcriptFailure == null, summaryFailure == null);
        logger.info("Translation join for item {}: {}", workItem.itemId(), join);

        switch (join) {
            case BOTH_OK:
                break;
            case TRANSCRIPT_FAILED:
            case BOTH_FAILED:
                throw fail(PipelineFailureKind.TranslationFailed, transcriptFailure);
            case SUMMARY_FAILED:
                throw fail(PipelineFailureKind.TranslationFailed, summaryFailure);
            default:
                throw new IllegalStateException("Unexpected translation join " + join);
        }
        checkCancellation();

        PipelineResult result = new PipelineResult(workItem, transcript, summary,
                transcriptBranch.get(), summaryBranch.get());
        stage = PipelineStage.COMPLETED;
        logger.info("Pipeline completed for item {}", workItem.itemId());
        return result;
    }

    @Override
    public PipelineStage getStage() {
        return stage;
    }

    @Override
    public Summary getSummary() {
        return summary;
    }

    private <R> R runStage(PipelineStage next, PipelineFailureKind failureKind, Functions.Func<R> call) {
        enter(next);
        try {
            return call.apply();
        } catch (ActivityFailure e) {
            throw fail(failureKind, e);
        }
    }

    private void enter(PipelineStage next) {
        checkCancellation();
        logger.info("Stage {} -> {}", stage, next);
        stage = next;
    }

    private void checkCancellation() {
        if (CancellationScope.current().isCancelRequested()) {
            PipelineStage interrupted = stage;
            logger.info("Cancellation requested in stage {}, no further activities are scheduled", interrupted);
            stage = PipelineStage.CANCELLED;
            throw new CanceledFailure("Pipeline cancelled in stage " + interrupted);
        }
    }

    private RuntimeException fail(PipelineFailureKind kind, RuntimeException failure) {
        if (failure instanceof CanceledFailure
                || failure.getCause() instanceof CanceledFailure
                || CancellationScope.current().isCancelRequested()) {
            stage = PipelineStage.CANCELLED;
            logger.info("Activity call ended by cancellation");
            return failure instanceof CanceledFailure ? failure : new CanceledFailure("Pipeline cancelled");
        }
        StageFailure details = classify(stage, failure);
        logger.warn("Stage {} failed: {} ({}, retries exhausted: {})",
                stage, details.message(), details.causeType(), details.retriesExhausted());
        stage = PipelineStage.FAILED;
        return ApplicationFailure.newNonRetryableFailureWithCause(
                kind.name() + ": " + details.message(), kind.name(), failure, details);
    }

    static StageFailure classify(PipelineStage stage, RuntimeException failure) {
        Throwable cause = failure instanceof ActivityFailure ? failure.getCause() : failure;
        boolean retriesExhausted = failure instanceof ActivityFailure
                && ((ActivityFailure) failure).getRetryState() == RetryState.RETRY_STATE_MAXIMUM_ATTEMPTS_REACHED;

        String causeType;
        String message;
        if (cause instanceof TimeoutFailure) {
            causeType = ActivityErrorType.ACTIVITY_TIMEOUT.type();
            message = "activity timed out (" + ((TimeoutFailure) cause).getTimeoutType() + ")";
        } else if (cause instanceof ApplicationFailure) {
            causeType = ((ApplicationFailure) cause).getType();
            message = ((ApplicationFailure) cause).getOriginalMessage();
        } else {
            causeType = cause == null ? failure.getClass().getSimpleName() : cause.getClass().getSimpleName();
            message = cause == null ? failure.getMessage() : cause.getMessage();
        }
        if (retriesExhausted) {
            message = ActivityErrorType.RETRIES_EXHAUSTED.type() + " after last attempt failure: " + message;
        }
        return new StageFailure(stage, causeType, retriesExhausted, message);
    }
}
