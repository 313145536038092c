package com.example.contentpipeline.config;

import com.example.contentpipeline.workflow.ActivityPolicies;
import com.example.contentpipeline.workflow.ContentPipelineWorkflowImpl;
import com.example.contentpipeline.workflow.activity.ExtractActivity;
import com.example.contentpipeline.workflow.activity.SummarizeActivity;
import com.example.contentpipeline.workflow.activity.TranslateActivity;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TemporalConfig {

    private static final Logger logger = LoggerFactory.getLogger(TemporalConfig.class);

    @Bean(destroyMethod = "shutdown")
    public WorkflowServiceStubs workflowServiceStubs(PipelineProperties properties) {
        String target = properties.getTemporal().getTarget();
        WorkflowServiceStubsOptions options = WorkflowServiceStubsOptions.newBuilder()
                .setTarget(target)
                .build();
        logger.info("Configuring WorkflowServiceStubs to target: {}", target);
        return WorkflowServiceStubs.newServiceStubs(options);
    }

    @Bean
    public WorkflowClient workflowClient(WorkflowServiceStubs serviceStubs, PipelineProperties properties) {
        logger.info("Configuring WorkflowClient for namespace {}", properties.getTemporal().getNamespace());
        return WorkflowClient.newInstance(serviceStubs, WorkflowClientOptions.newBuilder()
                .setNamespace(properties.getTemporal().getNamespace())
                .build());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "pipeline.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WorkerFactory workerFactory(WorkflowClient workflowClient) {
        logger.info("Configuring WorkerFactory");
        return WorkerFactory.newInstance(workflowClient);
    }

    /**
     * The worker only executes; it never starts workflow executions.
     */
    @Bean
    @ConditionalOnProperty(prefix = "pipeline.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public Worker pipelineWorker(WorkerFactory workerFactory,
                                 PipelineProperties properties,
                                 ExtractActivity extractActivity,
                                 SummarizeActivity summarizeActivity,
                                 TranslateActivity translateActivity) {
        String taskQueue = properties.getTaskQueue();
        logger.info("Starting Temporal worker on task queue {} with {} backend", taskQueue, properties.getBackend());
        Worker worker = workerFactory.newWorker(taskQueue);

        worker.registerWorkflowImplementationTypes(
                ActivityPolicies.workflowImplementationOptions(properties.getActivities()),
                ContentPipelineWorkflowImpl.class);
        logger.info("Registered workflow implementation: {}", ContentPipelineWorkflowImpl.class.getName());

        worker.registerActivitiesImplementations(extractActivity, summarizeActivity, translateActivity);
        logger.info("Registered activity implementations: {}, {}, {}",
                extractActivity.getClass().getSimpleName(),
                summarizeActivity.getClass().getSimpleName(),
                translateActivity.getClass().getSimpleName());

        workerFactory.start();
        logger.info("Temporal WorkerFactory started for task queue: {}", taskQueue);
        return worker;
    }
}
