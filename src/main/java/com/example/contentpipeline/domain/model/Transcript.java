package com.example.contentpipeline.domain.model;

/**
 * Source-language transcript of an item. {@code provenance} names the backend that
 * produced it and is kept for audit only.
 */
public record Transcript(String itemId, String language, String text, String provenance) {
}
