package com.example.contentpipeline.domain.model;

import java.util.List;

public record TranslatedSummary(String itemId, String language, List<SummarySection> sections) {

    public TranslatedSummary {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
