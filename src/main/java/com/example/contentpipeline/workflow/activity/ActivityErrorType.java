package com.example.contentpipeline.workflow.activity;

/**
 * Error taxonomy of the pipeline activities. {@link #type()} is the {@code ApplicationFailure}
 * type string seen by the workflow and reported to clients.
 */
public enum ActivityErrorType {
    NOT_FOUND("NotFound"),
    MALFORMED_OUTPUT("MalformedOutput"),
    UNSUPPORTED_LANGUAGE("UnsupportedLanguage"),
    ACTIVITY_TIMEOUT("ActivityTimeout"),
    RETRIES_EXHAUSTED("RetriesExhausted");

    private final String type;

    ActivityErrorType(String type) {
        this.type = type;
    }

    public String type() {
        return type;
    }
}
