package com.example.contentpipeline.workflow.activity;

import com.example.contentpipeline.service.ContentNotFoundException;
import com.example.contentpipeline.service.MalformedOutputException;
import com.example.contentpipeline.service.UnsupportedLanguageException;
import io.temporal.failure.ApplicationFailure;

/**
 * Turns backend exceptions into typed Temporal failures at the activity boundary.
 */
public final class PipelineErrors {

    private PipelineErrors() {
    }

    public static ApplicationFailure notFound(ContentNotFoundException e) {
        return ApplicationFailure.newNonRetryableFailureWithCause(e.getMessage(),
                ActivityErrorType.NOT_FOUND.type(), e, e.getItemId());
    }

    /** Retryable: a generator may produce well-formed content on the next attempt. */
    public static ApplicationFailure malformedOutput(MalformedOutputException e) {
        return ApplicationFailure.newFailureWithCause(e.getMessage(),
                ActivityErrorType.MALFORMED_OUTPUT.type(), e);
    }

    public static ApplicationFailure unsupportedLanguage(UnsupportedLanguageException e) {
        return ApplicationFailure.newNonRetryableFailureWithCause(e.getMessage(),
                ActivityErrorType.UNSUPPORTED_LANGUAGE.type(), e, e.getLanguageCode());
    }
}
