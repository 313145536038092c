package com.example.contentpipeline.domain.model;

import java.util.Objects;

/**
 * Complete output of one pipeline execution. Every field is required; the workflow either
 * returns all five or fails.
 */
public record PipelineResult(WorkItem workItem,
                             Transcript transcript,
                             Summary summary,
                             TranslatedTranscript translatedTranscript,
                             TranslatedSummary translatedSummary) {

    public PipelineResult {
        Objects.requireNonNull(workItem, "workItem");
        Objects.requireNonNull(transcript, "transcript");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(translatedTranscript, "translatedTranscript");
        Objects.requireNonNull(translatedSummary, "translatedSummary");
    }
}
