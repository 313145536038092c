package com.example.contentpipeline.workflow.activity.impl;

import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.service.SummaryGenerator;
import com.example.contentpipeline.service.impl.MockSummaryGenerator;
import io.temporal.failure.ApplicationFailure;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SummarizeActivityImplTest {

    private static final Transcript TRANSCRIPT = new Transcript("demo-001", "en",
            "This is a mock English transcript for video demo-001. It covers product updates and next steps.", "mock");

    @Test
    public void testSummaryKeepsTranscriptLanguage() {
        Summary summary = new SummarizeActivityImpl(new MockSummaryGenerator()).summarize(TRANSCRIPT);

        assertEquals("en", summary.language());
        assertEquals("demo-001", summary.itemId());
        assertEquals(3, summary.keyTakeaways().size());
        assertEquals(2, summary.actionItems().size());
    }

    @Test
    public void testTooManyActionItemsIsRetryableMalformedOutput() {
        SummaryGenerator generator = mock(SummaryGenerator.class);
        when(generator.summarize(any())).thenReturn(new Summary("demo-001", "en", "Overview.",
                List.of("a", "b", "c"), List.of("1", "2", "3", "4", "5")));

        ApplicationFailure failure = assertThrows(ApplicationFailure.class,
                () -> new SummarizeActivityImpl(generator).summarize(TRANSCRIPT));

        assertEquals("MalformedOutput", failure.getType());
        assertFalse(failure.isNonRetryable());
    }

    @Test
    public void testSummaryInWrongLanguageIsMalformed() {
        SummaryGenerator generator = mock(SummaryGenerator.class);
        when(generator.summarize(any())).thenReturn(new Summary("demo-001", "es", "Resumen.",
                List.of("a", "b", "c"), List.of("1", "2")));

        ApplicationFailure failure = assertThrows(ApplicationFailure.class,
                () -> new SummarizeActivityImpl(generator).summarize(TRANSCRIPT));

        assertEquals("MalformedOutput", failure.getType());
    }
}
