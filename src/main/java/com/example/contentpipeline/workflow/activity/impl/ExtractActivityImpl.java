package com.example.contentpipeline.workflow.activity.impl;

import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.domain.model.WorkItem;
import com.example.contentpipeline.service.ContentNotFoundException;
import com.example.contentpipeline.service.TranscriptSource;
import com.example.contentpipeline.workflow.activity.ExtractActivity;
import com.example.contentpipeline.workflow.activity.PipelineErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;


@Component
public class ExtractActivityImpl implements ExtractActivity {

    private static final Logger logger = LoggerFactory.getLogger(ExtractActivityImpl.class);

    private final TranscriptSource transcriptSource;

    @Autowired
    public ExtractActivityImpl(TranscriptSource transcriptSource) {
        this.transcriptSource = transcriptSource;
    }

    @Override
    public Transcript extract(WorkItem workItem) {
        logger.info("Extracting transcript for item {}", workItem.itemId());
        try {
            Transcript transcript = transcriptSource.fetch(workItem);
            logger.info("Extracted {} characters for item {} (provenance: {})",
                    transcript.text().length(), workItem.itemId(), transcript.provenance());
            return transcript;
        } catch (ContentNotFoundException e) {
            logger.warn("Transcript lookup failed: {}", e.getMessage());
            throw PipelineErrors.notFound(e);
        }
    }
}
