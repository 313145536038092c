package com.example.contentpipeline.service.impl;

import com.example.contentpipeline.domain.model.TargetLanguage;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.service.Translator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Template translator. Transcripts are wrapped in a per-language template; summary phrases
 * come from the {@link PhraseBook}, and anything it does not know is tagged with the
 * language code instead.
 */
@Service
@ConditionalOnProperty(prefix = "pipeline", name = "backend", havingValue = "mock", matchIfMissing = true)
public class MockTranslator implements Translator {

    private static final Map<TargetLanguage, String> TRANSCRIPT_TEMPLATES = Map.of(
            TargetLanguage.ES, "Transcripción traducida (ES) del video %s: %s",
            TargetLanguage.JA, "ビデオ%sの翻訳済み文字起こし（JA）: %s",
            TargetLanguage.PT, "Transcrição traduzida (PT) do vídeo %s: %s");

    private final PhraseBook phraseBook = PhraseBook.standard();

    @Override
    public String translateTranscript(Transcript transcript, TargetLanguage language) {
        return String.format(TRANSCRIPT_TEMPLATES.get(language), transcript.itemId(), transcript.text());
    }

    @Override
    public String translate(String text, TargetLanguage language) {
        String known = phraseBook.lookup(text, language);
        if (known != null) {
            return known;
        }
        return "[" + language.code().toUpperCase(Locale.ROOT) + "] " + text;
    }

    @Override
    public String provenance() {
        return "mock";
    }
}
