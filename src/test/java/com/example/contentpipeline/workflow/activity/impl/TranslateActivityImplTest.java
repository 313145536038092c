package com.example.contentpipeline.workflow.activity.impl;

import com.example.contentpipeline.domain.model.*;
import com.example.contentpipeline.service.SupportedLanguages;
import com.example.contentpipeline.service.Translator;
import com.example.contentpipeline.service.impl.MockTranslator;
import io.temporal.failure.ApplicationFailure;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class TranslateActivityImplTest {

    private static final Transcript TRANSCRIPT = new Transcript("demo-001", "en",
            "This is a mock English transcript for video demo-001. It covers product updates and next steps.", "mock");
    private static final Summary SUMMARY = new Summary("demo-001", "en",
            "Video demo-001 presents product updates and next steps.",
            List.of("Recent progress on the product was highlighted.",
                    "The team is aligned on upcoming priorities.",
                    "A brand new point the phrase book does not know."),
            List.of("Schedule a review meeting.", "Share notes with the stakeholders."));

    private final SupportedLanguages supportedLanguages = new SupportedLanguages(List.of("es", "ja", "pt"));
    private final TranslateActivityImpl activity = new TranslateActivityImpl(new MockTranslator(), supportedLanguages);

    private static List<String> bulletItems(String text) {
        return text.lines().map(line -> line.substring(2)).collect(Collectors.toList());
    }

    @Test
    public void testTranscriptIsTaggedWithTargetLanguage() {
        TranslatedTranscript translated = activity.translateTranscript(TRANSCRIPT, "pt");

        assertEquals("pt", translated.language());
        assertEquals("en", translated.sourceLanguage());
        assertEquals("demo-001", translated.itemId());
        assertTrue(translated.text().startsWith("Transcrição traduzida (PT) do vídeo demo-001: "));
    }

    @Test
    public void testHeadingsAreLocalizedInOrderForEveryLanguage() {
        for (TargetLanguage language : TargetLanguage.values()) {
            TranslatedSummary translated = activity.translateSummary(SUMMARY, language.code());

            assertEquals(language.code(), translated.language());
            List<String> headings = translated.sections().stream().map(SummarySection::heading).collect(Collectors.toList());
            assertEquals(Arrays.stream(SectionHeading.values()).map(h -> h.label(language)).collect(Collectors.toList()),
                    headings);
            for (String english : List.of("Overview", "Key takeaways", "Action items")) {
                assertFalse(headings.contains(english), "English heading left in " + language);
            }
        }
    }

    @Test
    public void testBulletItemsKeepOrderAndCount() {
        TranslatedSummary translated = activity.translateSummary(SUMMARY, "ja");

        List<String> takeaways = bulletItems(translated.sections().get(1).text());
        assertEquals(3, takeaways.size());
        assertEquals("製品の最近の進捗が強調されました。", takeaways.get(0));
        assertEquals("チームは今後の優先事項について足並みがそろっています。", takeaways.get(1));
        assertEquals("[JA] A brand new point the phrase book does not know.", takeaways.get(2));

        List<String> actions = bulletItems(translated.sections().get(2).text());
        assertEquals(List.of("レビュー会議を予定する。", "関係者にメモを共有する。"), actions);
    }

    @Test
    public void testMultiLineItemIsTranslatedAsOneItem() {
        Translator translator = mock(Translator.class);
        when(translator.translate(anyString(), eq(TargetLanguage.ES)))
                .thenAnswer(invocation -> "ES:" + invocation.getArgument(0));
        TranslateActivityImpl translating = new TranslateActivityImpl(translator, supportedLanguages);
        Summary summary = new Summary("demo-001", "en", "Overview.",
                List.of("First takeaway.", "Second takeaway,\ncontinued on a new line.", "Third takeaway."),
                List.of("Act.", "Follow up."));

        TranslatedSummary translated = translating.translateSummary(summary, "es");

        verify(translator).translate("Second takeaway,\ncontinued on a new line.", TargetLanguage.ES);
        verify(translator, times(6)).translate(anyString(), eq(TargetLanguage.ES));
        assertEquals("- ES:First takeaway.\n- ES:Second takeaway,\ncontinued on a new line.\n- ES:Third takeaway.",
                translated.sections().get(1).text());
    }

    @Test
    public void testUnsupportedLanguageAlwaysFails() {
        for (String code : Arrays.asList("fr", "de", "", null)) {
            ApplicationFailure transcriptFailure = assertThrows(ApplicationFailure.class,
                    () -> activity.translateTranscript(TRANSCRIPT, code));
            assertEquals("UnsupportedLanguage", transcriptFailure.getType());
            assertTrue(transcriptFailure.isNonRetryable());

            ApplicationFailure summaryFailure = assertThrows(ApplicationFailure.class,
                    () -> activity.translateSummary(SUMMARY, code));
            assertEquals("UnsupportedLanguage", summaryFailure.getType());
        }
    }

    @Test
    public void testLanguageOutsideConfiguredSetIsRejectedBeforeTranslating() {
        Translator translator = mock(Translator.class);
        TranslateActivityImpl spanishOnly = new TranslateActivityImpl(translator, new SupportedLanguages(List.of("es")));

        ApplicationFailure failure = assertThrows(ApplicationFailure.class,
                () -> spanishOnly.translateSummary(SUMMARY, "ja"));

        assertEquals("UnsupportedLanguage", failure.getType());
        verifyNoInteractions(translator);
    }
}
