package com.example.contentpipeline.workflow.activity.impl;

import com.example.contentpipeline.domain.model.*;
import com.example.contentpipeline.service.SupportedLanguages;
import com.example.contentpipeline.service.Translator;
import com.example.contentpipeline.service.UnsupportedLanguageException;
import com.example.contentpipeline.workflow.activity.PipelineErrors;
import com.example.contentpipeline.workflow.activity.TranslateActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;


@Component
public class TranslateActivityImpl implements TranslateActivity {

    private static final Logger logger = LoggerFactory.getLogger(TranslateActivityImpl.class);

    private final Translator translator;
    private final SupportedLanguages supportedLanguages;

    @Autowired
    public TranslateActivityImpl(Translator translator, SupportedLanguages supportedLanguages) {
        this.translator = translator;
        this.supportedLanguages = supportedLanguages;
    }

    @Override
    public TranslatedTranscript translateTranscript(Transcript transcript, String targetLanguage) {
        TargetLanguage language = resolve(targetLanguage);
        logger.info("Translating transcript of item {} from {} to {} via {}",
                transcript.itemId(), transcript.language(), language.code(), translator.provenance());
        String text = translator.translateTranscript(transcript, language);
        return new TranslatedTranscript(transcript.itemId(), language.code(), text, transcript.language());
    }

    @Override
    public TranslatedSummary translateSummary(Summary summary, String targetLanguage) {
        TargetLanguage language = resolve(targetLanguage);
        logger.info("Translating summary of item {} from {} to {} via {}",
                summary.itemId(), summary.language(), language.code(), translator.provenance());

        List<SummarySection> sections = List.of(
                new SummarySection(SectionHeading.OVERVIEW.label(language),
                        translator.translate(summary.highLevel(), language)),
                new SummarySection(SectionHeading.KEY_TAKEAWAYS.label(language),
                        SummarySection.bulletList(translateItems(summary.keyTakeaways(), language))),
                new SummarySection(SectionHeading.ACTION_ITEMS.label(language),
                        SummarySection.bulletList(translateItems(summary.actionItems(), language))));
        return new TranslatedSummary(summary.itemId(), language.code(), sections);
    }

    // item by item so list order and count survive translation
    private List<String> translateItems(List<String> items, TargetLanguage language) {
        return items.stream()
                .map(item -> translator.translate(item, language))
                .collect(Collectors.toList());
    }

    private TargetLanguage resolve(String targetLanguage) {
        try {
            return supportedLanguages.require(targetLanguage);
        } catch (UnsupportedLanguageException e) {
            logger.warn("Rejected translation request: {}", e.getMessage());
            throw PipelineErrors.unsupportedLanguage(e);
        }
    }
}
