package com.example.contentpipeline.service.impl;

import com.example.contentpipeline.config.PipelineProperties;
import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.domain.model.WorkItem;
import com.example.contentpipeline.service.ContentNotFoundException;
import com.example.contentpipeline.service.TranscriptSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Set;

/**
 * Transcript source over a configured catalog of known items. The transcript text is a
 * fixed template, so repeated lookups of an item return identical content.
 */
@Service
public class CatalogTranscriptSource implements TranscriptSource {

    public static final String PROVENANCE = "mock";
    private static final String TRANSCRIPT_TEMPLATE =
            "This is a mock English transcript for video %s. It covers product updates and next steps.";

    private final Set<String> knownItems;

    @Autowired
    public CatalogTranscriptSource(PipelineProperties properties) {
        this(properties.getMock().getKnownItems());
    }

    public CatalogTranscriptSource(Collection<String> knownItems) {
        this.knownItems = Set.copyOf(knownItems);
    }

    @Override
    public Transcript fetch(WorkItem workItem) {
        String itemId = workItem.itemId();
        if (itemId == null || !knownItems.contains(itemId)) {
            throw new ContentNotFoundException(itemId);
        }
        return new Transcript(itemId, workItem.sourceLanguage(), String.format(TRANSCRIPT_TEMPLATE, itemId), PROVENANCE);
    }
}
