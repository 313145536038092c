package com.example.contentpipeline.domain.model;

public record TranslatedTranscript(String itemId, String language, String text, String sourceLanguage) {
}
