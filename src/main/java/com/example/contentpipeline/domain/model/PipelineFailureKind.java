package com.example.contentpipeline.domain.model;

/**
 * Terminal failure kinds of a pipeline execution. The name is used verbatim as the
 * {@code ApplicationFailure} type the workflow fails with.
 */
public enum PipelineFailureKind {
    ExtractionFailed(PipelineStage.EXTRACTING),
    SummarizationFailed(PipelineStage.SUMMARIZING),
    TranslationFailed(PipelineStage.TRANSLATING);

    private final PipelineStage stage;

    PipelineFailureKind(PipelineStage stage) {
        this.stage = stage;
    }

    public PipelineStage stage() {
        return stage;
    }

    public static PipelineFailureKind fromType(String type) {
        for (PipelineFailureKind kind : values()) {
            if (kind.name().equals(type)) {
                return kind;
            }
        }
        return null;
    }
}
