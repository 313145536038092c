/**
 * Data model of the content pipeline.
 *
 * Pipeline artifacts (WorkItem, Transcript, Summary, TranslatedTranscript, TranslatedSummary,
 * PipelineResult) are immutable records passed through Temporal's Jackson data converter.
 * ExecutionRecord is the JPA entity of the execution ledger kept by the submission client.
 */
package com.example.contentpipeline.domain.model;
