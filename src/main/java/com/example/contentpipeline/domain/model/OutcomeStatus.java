package com.example.contentpipeline.domain.model;

public enum OutcomeStatus {
    SUBMITTED,
    COMPLETED,
    FAILED,
    CANCELLED
}
