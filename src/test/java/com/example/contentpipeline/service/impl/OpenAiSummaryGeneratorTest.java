package com.example.contentpipeline.service.impl;

import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.TargetLanguage;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.integration.llm.OpenAiContentService;
import com.example.contentpipeline.integration.llm.SummaryDraft;
import com.example.contentpipeline.service.MalformedOutputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class OpenAiSummaryGeneratorTest {

    private static final Transcript TRANSCRIPT = new Transcript("demo-001", "en", "Some transcript.", "mock");

    private final OpenAiContentService contentService = mock(OpenAiContentService.class);

    @Test
    public void testDraftBecomesSummaryInTranscriptLanguage() {
        SummaryDraft draft = new SummaryDraft();
        draft.setHighLevel("  One sentence overview.  ");
        draft.setKeyTakeaways(List.of("a", "b", "c"));
        draft.setActionItems(List.of("x", "y"));
        when(contentService.summarize("Some transcript.", "en")).thenReturn(draft);

        Summary summary = new OpenAiSummaryGenerator(contentService).summarize(TRANSCRIPT);

        assertEquals("demo-001", summary.itemId());
        assertEquals("en", summary.language());
        assertEquals("One sentence overview.", summary.highLevel());
        assertEquals(List.of("a", "b", "c"), summary.keyTakeaways());
    }

    @Test
    public void testMissingDraftIsMalformed() {
        when(contentService.summarize("Some transcript.", "en")).thenReturn(null);

        assertThrows(MalformedOutputException.class, () -> new OpenAiSummaryGenerator(contentService).summarize(TRANSCRIPT));
    }

    @Test
    public void testTranslatorPassesLanguageName() {
        when(contentService.translate("Hello.", "Japanese")).thenReturn("こんにちは。");

        OpenAiTranslator translator = new OpenAiTranslator(contentService);

        assertEquals("こんにちは。", translator.translate("Hello.", TargetLanguage.JA));
        assertEquals("openai", translator.provenance());
    }
}
