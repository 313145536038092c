package com.example.contentpipeline.service.impl;

import com.example.contentpipeline.domain.model.Summary;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.service.SummaryGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@ConditionalOnProperty(prefix = "pipeline", name = "backend", havingValue = "mock", matchIfMissing = true)
public class MockSummaryGenerator implements SummaryGenerator {

    static final String HIGH_LEVEL = "Video %s presents product updates and next steps.";
    static final List<String> KEY_TAKEAWAYS = List.of(
            "Recent progress on the product was highlighted.",
            "The team is aligned on upcoming priorities.",
            "Next steps were agreed for the coming release.");
    static final List<String> ACTION_ITEMS = List.of(
            "Schedule a review meeting.",
            "Share notes with the stakeholders.");

    @Override
    public Summary summarize(Transcript transcript) {
        return new Summary(transcript.itemId(), transcript.language(),
                String.format(HIGH_LEVEL, transcript.itemId()), KEY_TAKEAWAYS, ACTION_ITEMS);
    }
}
