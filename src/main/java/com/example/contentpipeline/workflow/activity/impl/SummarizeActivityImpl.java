package com.example.contentpipeline.workflow.activity.impl;

import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.service.MalformedOutputException;
import com.example.contentpipeline.service.SummaryGenerator;
import com.example.contentpipeline.service.SummaryValidator;
import com.example.contentpipeline.workflow.activity.PipelineErrors;
import com.example.contentpipeline.workflow.activity.SummarizeActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;


@Component
public class SummarizeActivityImpl implements SummarizeActivity {

    private static final Logger logger = LoggerFactory.getLogger(SummarizeActivityImpl.class);

    private final SummaryGenerator summaryGenerator;

    @Autowired
    public SummarizeActivityImpl(SummaryGenerator summaryGenerator) {
        this.summaryGenerator = summaryGenerator;
    }

    @Override
    public Summary summarize(Transcript transcript) {
        logger.info("Summarizing transcript of item {} ({})", transcript.itemId(), transcript.language());
        try {
            Summary summary = SummaryValidator.validate(summaryGenerator.summarize(transcript));
            if (!transcript.language().equals(summary.language())) {
                throw new MalformedOutputException("Summary language '" + summary.language()
                        + "' differs from transcript language '" + transcript.language() + "'");
            }
            logger.info("Summary for item {}: {} takeaways, {} action items",
                    transcript.itemId(), summary.keyTakeaways().size(), summary.actionItems().size());
            return summary;
        } catch (MalformedOutputException e) {
            logger.warn("Malformed summary for item {}: {}", transcript.itemId(), e.getMessage());
            throw PipelineErrors.malformedOutput(e);
        }
    }
}
