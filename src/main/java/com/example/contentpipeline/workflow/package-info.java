/**
 * Temporal workflow definition of the content pipeline.
 *
 * This package contains:
 * - ContentPipelineWorkflow: interface defining the workflow contract and its queries
 * - ContentPipelineWorkflowImpl: the per-item state machine with the translation fan-out
 * - ActivityPolicies: timeout and retry options of each activity type
 * - activity: Temporal activities used by the workflow
 */
package com.example.contentpipeline.workflow;
