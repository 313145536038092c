package com.example.contentpipeline.workflow;

import com.example.contentpipeline.config.PipelineProperties;
import com.example.contentpipeline.workflow.activity.ActivityErrorType;
import com.example.contentpipeline.workflow.activity.ExtractActivity;
import com.example.contentpipeline.workflow.activity.SummarizeActivity;
import com.example.contentpipeline.workflow.activity.TranslateActivity;
import io.temporal.activity.ActivityCancellationType;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.worker.WorkflowImplementationOptions;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Timeout and retry options of the pipeline activities.
 *
 * The workflow builds its stubs from {@link #fallback(Duration)}. Workers override those per
 * activity type with {@link #workflowImplementationOptions(PipelineProperties.Activities)},
 * so the values stay configurable without the workflow reading configuration.
 */
public final class ActivityPolicies {

    public static final Duration EXTRACT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration SUMMARIZE_TIMEOUT = Duration.ofSeconds(25);
    public static final Duration TRANSLATE_TIMEOUT = Duration.ofSeconds(20);

    public static final int DEFAULT_MAXIMUM_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofSeconds(1);
    public static final double DEFAULT_BACKOFF_COEFFICIENT = 2;
    public static final Duration DEFAULT_MAXIMUM_INTERVAL = Duration.ofSeconds(30);

    private ActivityPolicies() {
    }

    public static RetryOptions retryOptions(int maximumAttempts, Duration initialInterval,
                                            double backoffCoefficient, Duration maximumInterval) {
        return RetryOptions.newBuilder()
                .setInitialInterval(initialInterval)
                .setMaximumInterval(maximumInterval)
                .setBackoffCoefficient(backoffCoefficient)
                .setMaximumAttempts(maximumAttempts)
                .setDoNotRetry(ActivityErrorType.NOT_FOUND.type(), ActivityErrorType.UNSUPPORTED_LANGUAGE.type())
                .build();
    }

    public static ActivityOptions activityOptions(Duration startToCloseTimeout, RetryOptions retryOptions) {
        return ActivityOptions.newBuilder()
                .setStartToCloseTimeout(startToCloseTimeout)
                .setRetryOptions(retryOptions)
                // outstanding calls settle before a cancelled execution stops
                .setCancellationType(ActivityCancellationType.WAIT_CANCELLATION_COMPLETED)
                .build();
    }

    public static ActivityOptions fallback(Duration startToCloseTimeout) {
        return activityOptions(startToCloseTimeout, retryOptions(DEFAULT_MAXIMUM_ATTEMPTS,
                DEFAULT_INITIAL_INTERVAL, DEFAULT_BACKOFF_COEFFICIENT, DEFAULT_MAXIMUM_INTERVAL));
    }

    public static ActivityOptions fromPolicy(PipelineProperties.ActivityPolicy policy) {
        return activityOptions(policy.getTimeout(), retryOptions(policy.getMaximumAttempts(),
                policy.getInitialInterval(), policy.getBackoffCoefficient(), policy.getMaximumInterval()));
    }

    /**
     * Longest time one activity type can take with every attempt timing out and every retry
     * waiting its full backoff. Empty when attempts are unlimited.
     */
    public static Optional<Duration> retryBudget(PipelineProperties.ActivityPolicy policy) {
        if (policy.getMaximumAttempts() <= 0) {
            return Optional.empty();
        }
        Duration budget = policy.getTimeout().multipliedBy(policy.getMaximumAttempts());
        double interval = policy.getInitialInterval().toMillis();
        long maximumInterval = policy.getMaximumInterval().toMillis();
        for (int attempt = 1; attempt < policy.getMaximumAttempts(); attempt++) {
            budget = budget.plusMillis(Math.min((long) interval, maximumInterval));
            interval *= policy.getBackoffCoefficient();
        }
        return Optional.of(budget);
    }

    /**
     * Retry budget of a whole execution: extract, then summarize, then the slower of the two
     * translations. Empty when any activity type retries without limit.
     */
    public static Optional<Duration> executionBudget(PipelineProperties.Activities activities) {
        Optional<Duration> extract = retryBudget(activities.getExtract());
        Optional<Duration> summarize = retryBudget(activities.getSummarize());
        Optional<Duration> translateTranscript = retryBudget(activities.getTranslateTranscript());
        Optional<Duration> translateSummary = retryBudget(activities.getTranslateSummary());
        if (extract.isEmpty() || summarize.isEmpty() || translateTranscript.isEmpty() || translateSummary.isEmpty()) {
            return Optional.empty();
        }
        Duration translate = translateTranscript.get().compareTo(translateSummary.get()) >= 0
                ? translateTranscript.get() : translateSummary.get();
        return Optional.of(extract.get().plus(summarize.get()).plus(translate));
    }

    public static Map<String, ActivityOptions> byActivityType(PipelineProperties.Activities activities) {
        return Map.of(
                ExtractActivity.TYPE, fromPolicy(activities.getExtract()),
                SummarizeActivity.TYPE, fromPolicy(activities.getSummarize()),
                TranslateActivity.TRANSLATE_TRANSCRIPT_TYPE, fromPolicy(activities.getTranslateTranscript()),
                TranslateActivity.TRANSLATE_SUMMARY_TYPE, fromPolicy(activities.getTranslateSummary()));
    }

    public static WorkflowImplementationOptions workflowImplementationOptions(PipelineProperties.Activities activities) {
        return WorkflowImplementationOptions.newBuilder()
                .setActivityOptions(byActivityType(activities))
                .build();
    }
}
