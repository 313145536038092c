/**
 * Integrations with external services.
 *
 * llm: OpenAI chat model access through Spring AI, used by the model-backed summary
 * generator and translator.
 */
package com.example.contentpipeline.integration;
