/**
 * Temporal activity interfaces of the content pipeline.
 *
 * Activities hold the non-deterministic work:
 * - ExtractActivity: source transcript lookup
 * - SummarizeActivity: structured summary generation
 * - TranslateActivity: transcript and summary translation
 *
 * Implementations are located in the impl subpackage and delegate to the backends in
 * the service package.
 */
package com.example.contentpipeline.workflow.activity;
