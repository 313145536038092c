/**
 * Submission client: starts pipeline executions on the task queue and aggregates their
 * terminal outcomes.
 */
package com.example.contentpipeline.client;
