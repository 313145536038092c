package com.example.contentpipeline.service.impl;

import com.example.contentpipeline.domain.model.TargetLanguage;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.integration.llm.OpenAiContentService;
import com.example.contentpipeline.service.Translator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(prefix = "pipeline", name = "backend", havingValue = "openai")
public class OpenAiTranslator implements Translator {

    private final OpenAiContentService contentService;

    @Autowired
    public OpenAiTranslator(OpenAiContentService contentService) {
        this.contentService = contentService;
    }

    @Override
    public String translateTranscript(Transcript transcript, TargetLanguage language) {
        return contentService.translate(transcript.text(), language.displayName());
    }

    @Override
    public String translate(String text, TargetLanguage language) {
        return contentService.translate(text, language.displayName());
    }

    @Override
    public String provenance() {
        return "openai";
    }
}
