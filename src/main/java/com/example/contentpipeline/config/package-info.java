/**
 * Configuration classes for application setup.
 *
 * Key configurations:
 * - PipelineProperties: the {@code pipeline.*} settings (task queue, backend, languages,
 *   per-activity timeouts and retries)
 * - TemporalConfig: Temporal service stubs, workflow client and worker
 */
package com.example.contentpipeline.config;
