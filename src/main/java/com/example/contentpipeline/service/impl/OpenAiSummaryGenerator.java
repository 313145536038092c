package com.example.contentpipeline.service.impl;

import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.integration.llm.OpenAiContentService;
import com.example.contentpipeline.integration.llm.SummaryDraft;
import com.example.contentpipeline.service.MalformedOutputException;
import com.example.contentpipeline.service.SummaryGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(prefix = "pipeline", name = "backend", havingValue = "openai")
public class OpenAiSummaryGenerator implements SummaryGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSummaryGenerator.class);

    private final OpenAiContentService contentService;

    @Autowired
    public OpenAiSummaryGenerator(OpenAiContentService contentService) {
        this.contentService = contentService;
    }

    @Override
    public Summary summarize(Transcript transcript) {
        SummaryDraft draft = contentService.summarize(transcript.text(), transcript.language());
        if (draft == null) {
            throw new MalformedOutputException("Model returned no summary for item '" + transcript.itemId() + "'");
        }
        log.debug("Model summary for item {}: {} takeaways, {} action items", transcript.itemId(),
                draft.getKeyTakeaways() == null ? 0 : draft.getKeyTakeaways().size(),
                draft.getActionItems() == null ? 0 : draft.getActionItems().size());
        String highLevel = draft.getHighLevel() == null ? null : draft.getHighLevel().trim();
        return new Summary(transcript.itemId(), transcript.language(), highLevel,
                draft.getKeyTakeaways(), draft.getActionItems());
    }
}
