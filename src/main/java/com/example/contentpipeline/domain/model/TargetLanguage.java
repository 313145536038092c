package com.example.contentpipeline.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Languages the pipeline knows how to translate into. Which of them are actually accepted
 * is decided by configuration.
 */
public enum TargetLanguage {
    ES("es", "Spanish"),
    JA("ja", "Japanese"),
    PT("pt", "Portuguese");

    private final String code;
    private final String displayName;

    TargetLanguage(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<TargetLanguage> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(language -> language.code.equals(normalized)).findFirst();
    }
}
