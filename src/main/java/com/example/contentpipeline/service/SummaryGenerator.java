package com.example.contentpipeline.service;

import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.Transcript;

/**
 * Backend that derives a structured summary from a transcript, in the transcript's language.
 */
public interface SummaryGenerator {

    /**
     * @throws MalformedOutputException if the generated content does not parse into
     *                                  an overview, key takeaways and action items
     */
    Summary summarize(Transcript transcript);
}
