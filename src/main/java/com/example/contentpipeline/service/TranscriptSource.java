package com.example.contentpipeline.service;

import com.example.contentpipeline.domain.model.Transcript;
import com.example.contentpipeline.domain.model.WorkItem;

/**
 * Backend that produces the source-language transcript of an item.
 */
public interface TranscriptSource {

    /**
     * @throws ContentNotFoundException if the item is unknown to this source
     */
    Transcript fetch(WorkItem workItem);
}
