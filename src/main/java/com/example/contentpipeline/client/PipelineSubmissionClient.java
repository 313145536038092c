package com.example.contentpipeline.client;

import com.example.contentpipeline.config.PipelineProperties;
import com.example.contentpipeline.domain.model.*;
import com.example.contentpipeline.domain.repository.ExecutionRecordRepository;
import com.example.contentpipeline.workflow.ActivityPolicies;
import com.example.contentpipeline.workflow.ContentPipelineWorkflow;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowExecutionAlreadyStarted;
import io.temporal.client.WorkflowFailedException;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import io.temporal.failure.ApplicationFailure;
import io.temporal.failure.CanceledFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Client role of the pipeline: starts one workflow execution per (item, target language)
 * and collects terminal outcomes. Never executes activities.
 */
@Service
public class PipelineSubmissionClient {

    private static final Logger logger = LoggerFactory.getLogger(PipelineSubmissionClient.class);

    static final String WORKFLOW_ID_PREFIX = "content-pipeline-";
    private static final String WORKFLOW_TYPE = "ContentPipelineWorkflow";

    private final WorkflowClient workflowClient;
    private final ExecutionRecordRepository executionRecordRepository;
    private final String taskQueue;
    private final Duration executionTimeout;

    @Autowired
    public PipelineSubmissionClient(WorkflowClient workflowClient,
                                    ExecutionRecordRepository executionRecordRepository,
                                    PipelineProperties properties) {
        this.workflowClient = workflowClient;
        this.executionRecordRepository = executionRecordRepository;
        this.taskQueue = properties.getTaskQueue();
        this.executionTimeout = resolveExecutionTimeout(properties);
    }

    /**
     * The configured execution timeout, or else the retry budget of all activities. A timeout
     * shorter than that budget cuts activity retries short.
     */
    static Duration resolveExecutionTimeout(PipelineProperties properties) {
        Optional<Duration> budget = ActivityPolicies.executionBudget(properties.getActivities());
        Duration configured = properties.getClient().getExecutionTimeout();
        if (configured == null) {
            return budget.orElse(null);
        }
        budget.filter(required -> configured.compareTo(required) < 0).ifPresent(required ->
                logger.warn("Execution timeout {} is shorter than the activity retry budget {}; retries may be cut short",
                        configured, required));
        return configured;
    }

    public static String workflowIdFor(WorkItem workItem) {
        return WORKFLOW_ID_PREFIX + workItem.itemId() + "-" + workItem.targetLanguage();
    }

    /**
     * Starts the execution for one item. If an execution with the same id is still running,
     * the submission attaches to it instead of starting a second one.
     */
    public Submission submit(WorkItem workItem) {
        validate(workItem);
        String workflowId = workflowIdFor(workItem);
        ContentPipelineWorkflow workflow = workflowClient.newWorkflowStub(
                ContentPipelineWorkflow.class,
                WorkflowOptions.newBuilder()
                        .setWorkflowId(workflowId)
                        .setTaskQueue(taskQueue)
                        .setWorkflowExecutionTimeout(executionTimeout)
                        .build());

        WorkflowStub stub;
        try {
            WorkflowClient.start(workflow::process, workItem);
            stub = WorkflowStub.fromTyped(workflow);
            logger.info("Started workflow {} for item {} -> {}", workflowId, workItem.itemId(), workItem.targetLanguage());
        } catch (WorkflowExecutionAlreadyStarted e) {
            logger.info("Workflow {} is already running, attaching to it", workflowId);
            stub = workflowClient.newUntypedWorkflowStub(workflowId, Optional.empty(), Optional.of(WORKFLOW_TYPE));
        }
        record(workflowId, workItem);
        return new Submission(workflowId, workItem, stub);
    }

    /**
     * Runs every item as its own execution and waits for all of them. A failed execution
     * does not cancel or delay the others; outcomes come back in submission order.
     */
    public BatchReport submitBatch(List<WorkItem> workItems) {
        logger.info("Submitting batch of {} work items", workItems.size());
        List<CompletableFuture<PipelineOutcome>> pending = new ArrayList<>();
        for (WorkItem workItem : workItems) {
            try {
                pending.add(submit(workItem).outcome());
            } catch (RuntimeException e) {
                logger.error("Could not submit item {}: {}", workItem == null ? null : workItem.itemId(), e.getMessage(), e);
                String workflowId = workItem == null ? null : workflowIdFor(workItem);
                pending.add(CompletableFuture.completedFuture(
                        PipelineOutcome.failed(workflowId, workItem, "Submission failed: " + e.getMessage())));
            }
        }
        List<PipelineOutcome> outcomes = pending.stream().map(CompletableFuture::join).collect(Collectors.toList());
        BatchReport report = new BatchReport(outcomes);
        logger.info("Batch finished: {} completed, {} failed", report.completedCount(), report.failedCount());
        return report;
    }

    /** Blocks until the execution reaches a terminal state. */
    public PipelineOutcome awaitOutcome(String workflowId) {
        WorkItem workItem = executionRecordRepository.findByWorkflowId(workflowId)
                .map(record -> new WorkItem(record.getItemId(), record.getSourceLanguage(), record.getTargetLanguage()))
                .orElse(null);
        WorkflowStub stub = workflowClient.newUntypedWorkflowStub(workflowId, Optional.empty(), Optional.of(WORKFLOW_TYPE));
        try {
            return new Submission(workflowId, workItem, stub).outcome().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + workflowId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Could not read outcome of " + workflowId, e.getCause());
        }
    }

    public PipelineStage stage(String workflowId) {
        return workflowClient.newWorkflowStub(ContentPipelineWorkflow.class, workflowId).getStage();
    }

    public void cancel(String workflowId) {
        logger.info("Requesting cancellation of workflow {}", workflowId);
        workflowClient.newUntypedWorkflowStub(workflowId, Optional.empty(), Optional.of(WORKFLOW_TYPE)).cancel();
    }

    public List<ExecutionRecord> executions() {
        return executionRecordRepository.findAll();
    }

    static PipelineOutcome toOutcome(String workflowId, WorkItem workItem, PipelineResult result, Throwable error) {
        if (error == null) {
            return PipelineOutcome.completed(workflowId, result.workItem(), result);
        }
        Throwable failure = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (failure instanceof WorkflowFailedException) {
            Throwable cause = failure.getCause();
            if (cause instanceof CanceledFailure) {
                return PipelineOutcome.cancelled(workflowId, workItem);
            }
            if (cause instanceof ApplicationFailure) {
                ApplicationFailure applicationFailure = (ApplicationFailure) cause;
                PipelineFailureKind kind = PipelineFailureKind.fromType(applicationFailure.getType());
                StageFailure details = readDetails(applicationFailure);
                if (kind != null) {
                    return PipelineOutcome.failed(workflowId, workItem, kind, details);
                }
                return PipelineOutcome.failed(workflowId, workItem, applicationFailure.getOriginalMessage());
            }
            return PipelineOutcome.failed(workflowId, workItem,
                    cause == null ? failure.getMessage() : cause.getMessage());
        }
        return PipelineOutcome.failed(workflowId, workItem, failure.getMessage());
    }

    private static StageFailure readDetails(ApplicationFailure failure) {
        try {
            return failure.getDetails().get(StageFailure.class);
        } catch (RuntimeException e) {
            logger.warn("Failure details could not be read: {}", e.getMessage());
            return null;
        }
    }

    private void validate(WorkItem workItem) {
        if (workItem == null || workItem.itemId() == null || workItem.itemId().isBlank()) {
            throw new IllegalArgumentException("Work item must have an itemId");
        }
        if (workItem.targetLanguage() == null || workItem.targetLanguage().isBlank()) {
            throw new IllegalArgumentException("Work item " + workItem.itemId() + " must have a targetLanguage");
        }
    }

    private void record(String workflowId, WorkItem workItem) {
        try {
            ExecutionRecord record = executionRecordRepository.findByWorkflowId(workflowId)
                    .orElseGet(() -> new ExecutionRecord(workflowId, workItem));
            record.setStatus(OutcomeStatus.SUBMITTED);
            executionRecordRepository.save(record);
        } catch (RuntimeException e) {
            logger.error("Could not record submission of {}", workflowId, e);
        }
    }

    private void recordOutcome(PipelineOutcome outcome) {
        try {
            executionRecordRepository.findByWorkflowId(outcome.workflowId()).ifPresent(record -> {
                record.applyOutcome(outcome);
                executionRecordRepository.save(record);
            });
        } catch (RuntimeException e) {
            logger.error("Could not record outcome of {}", outcome.workflowId(), e);
        }
    }

    /**
     * A started (or attached) execution.
     */
    public final class Submission {

        private final String workflowId;
        private final WorkItem workItem;
        private final WorkflowStub stub;

        Submission(String workflowId, WorkItem workItem, WorkflowStub stub) {
            this.workflowId = workflowId;
            this.workItem = workItem;
            this.stub = stub;
        }

        public String getWorkflowId() {
            return workflowId;
        }

        public CompletableFuture<PipelineOutcome> outcome() {
            return stub.getResultAsync(PipelineResult.class)
                    .handle((result, error) -> toOutcome(workflowId, workItem, result, error))
                    .thenApply(outcome -> {
                        logger.info("Workflow {} finished with status {}{}", workflowId, outcome.status(),
                                outcome.failureKind() == null ? "" : " (" + outcome.failureKind() + ")");
                        recordOutcome(outcome);
                        return outcome;
                    });
        }
    }
}
