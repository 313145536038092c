package com.example.contentpipeline.workflow.activity;

import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.domain.model.TranslatedSummary;
import com.example.contentpipeline.domain.model.TranslatedTranscript;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/**
 * Translation activities. Both fail with a non-retryable {@code UnsupportedLanguage} when
 * the target language is outside the configured set.
 */
@ActivityInterface
public interface TranslateActivity {

    String TRANSLATE_TRANSCRIPT_TYPE = "TranslateTranscript";
    String TRANSLATE_SUMMARY_TYPE = "TranslateSummary";

    @ActivityMethod(name = TRANSLATE_TRANSCRIPT_TYPE)
    TranslatedTranscript translateTranscript(Transcript transcript, String targetLanguage);

    /** Headings are localized along with the section bodies. */
    @ActivityMethod(name = TRANSLATE_SUMMARY_TYPE)
    TranslatedSummary translateSummary(Summary summary, String targetLanguage);
}
