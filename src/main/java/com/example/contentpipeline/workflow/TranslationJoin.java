package com.example.contentpipeline.workflow;

/**
 * Joint outcome of the two translation branches.
 */
public enum TranslationJoin {
    BOTH_OK,
    TRANSCRIPT_FAILED,
    SUMMARY_FAILED,
    BOTH_FAILED;

    public static TranslationJoin of(boolean transcriptOk, boolean summaryOk) {
        if (transcriptOk) {
            return summaryOk ? BOTH_OK : SUMMARY_FAILED;
        }
        return summaryOk ? TRANSCRIPT_FAILED : BOTH_FAILED;
    }
}
