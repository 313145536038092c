package com.example.contentpipeline.service;

import java.util.Collection;

public class UnsupportedLanguageException extends RuntimeException {

    private final String languageCode;

    public UnsupportedLanguageException(String languageCode, Collection<String> supported) {
        super("Unsupported language '" + languageCode + "'. Supported: " + String.join(", ", supported) + ".");
        this.languageCode = languageCode;
    }

    public String getLanguageCode() {
        return languageCode;
    }
}
