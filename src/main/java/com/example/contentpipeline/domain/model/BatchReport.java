package com.example.contentpipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Outcomes of a submitted batch, in submission order. */
public record BatchReport(List<PipelineOutcome> outcomes) {

    public BatchReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    @JsonProperty("completed")
    public long completedCount() {
        return outcomes.stream().filter(PipelineOutcome::isSuccess).count();
    }

    @JsonProperty("failed")
    public long failedCount() {
        return outcomes.size() - completedCount();
    }
}
