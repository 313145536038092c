package com.example.contentpipeline.domain.model;

public enum PipelineStage {
    PENDING,
    EXTRACTING,
    SUMMARIZING,
    TRANSLATING,
    COMPLETED,
    FAILED,
    CANCELLED
}
