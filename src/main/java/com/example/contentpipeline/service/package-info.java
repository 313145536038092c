/**
 * Backends behind the pipeline activities.
 *
 * TranscriptSource, SummaryGenerator and Translator are the capability interfaces the
 * activities call. The mock implementations in the impl subpackage are template based and
 * fully deterministic; the OpenAI-backed ones are enabled with {@code pipeline.backend=openai}.
 */
package com.example.contentpipeline.service;
