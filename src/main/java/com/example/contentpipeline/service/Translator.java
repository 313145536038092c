package com.example.contentpipeline.service;

import com.example.contentpipeline.domain.model.TargetLanguage;
import com.example.contentpipeline.domain.model.Transcript;

/**
 * Backend that translates text into one of the pipeline's target languages.
 * Implementations must be deterministic for a given input when used with retries.
 */
public interface Translator {

    String translateTranscript(Transcript transcript, TargetLanguage language);

    String translate(String text, TargetLanguage language);

    String provenance();
}
