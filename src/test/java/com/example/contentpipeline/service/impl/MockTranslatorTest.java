package com.example.contentpipeline.service.impl;

import com.example.contentpipeline.domain.model.TargetLanguage;
import com.example.contentpipeline.domain.model.Transcript;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MockTranslatorTest {

    private final MockTranslator translator = new MockTranslator();

    @Test
    public void testOverviewPlaceholderIsCarriedOver() {
        assertEquals("O vídeo webinar-2024-q1 apresenta atualizações do produto e próximos passos.",
                translator.translate("Video webinar-2024-q1 presents product updates and next steps.", TargetLanguage.PT));
    }

    @Test
    public void testUnknownPhraseIsTaggedWithLanguage() {
        assertEquals("[ES] Something else entirely.", translator.translate("Something else entirely.", TargetLanguage.ES));
    }

    @Test
    public void testTranscriptTemplatePerLanguage() {
        Transcript transcript = new Transcript("demo-001", "en", "Hello.", "mock");

        assertEquals("Transcripción traducida (ES) del video demo-001: Hello.",
                translator.translateTranscript(transcript, TargetLanguage.ES));
        assertEquals("ビデオdemo-001の翻訳済み文字起こし（JA）: Hello.",
                translator.translateTranscript(transcript, TargetLanguage.JA));
        assertEquals("Transcrição traduzida (PT) do vídeo demo-001: Hello.",
                translator.translateTranscript(transcript, TargetLanguage.PT));
    }

    @Test
    public void testPhraseBookMissReturnsNull() {
        assertNull(PhraseBook.standard().lookup("Not in the book.", TargetLanguage.JA));
    }
}
