package com.example.contentpipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Input of one pipeline execution. The target language is kept as its wire code so that
 * the translation activities remain the only place where it gets validated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkItem(String itemId, String sourceLanguage, String targetLanguage, String description) {

    public static final String DEFAULT_SOURCE_LANGUAGE = "en";

    public WorkItem {
        if (sourceLanguage == null || sourceLanguage.isBlank()) {
            sourceLanguage = DEFAULT_SOURCE_LANGUAGE;
        }
    }

    public WorkItem(String itemId, String sourceLanguage, String targetLanguage) {
        this(itemId, sourceLanguage, targetLanguage, null);
    }

    public static WorkItem of(String itemId, String targetLanguage) {
        return new WorkItem(itemId, DEFAULT_SOURCE_LANGUAGE, targetLanguage, null);
    }
}
