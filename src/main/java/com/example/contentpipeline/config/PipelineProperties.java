package com.example.contentpipeline.config;

import com.example.contentpipeline.workflow.ActivityPolicies;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code pipeline} prefix of application.yml.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    public static final String DEFAULT_TASK_QUEUE = "ContentPipelineTaskQueue";

    private String taskQueue = DEFAULT_TASK_QUEUE;

    /** mock or openai */
    private String backend = "mock";

    private List<String> supportedLanguages = new ArrayList<>(List.of("es", "ja", "pt"));

    private final Temporal temporal = new Temporal();
    private final Worker worker = new Worker();
    private final Mock mock = new Mock();
    private final Activities activities = new Activities();
    private final Client client = new Client();
    private final OpenAi openai = new OpenAi();

    public String getTaskQueue() { return taskQueue; }
    public void setTaskQueue(String taskQueue) { this.taskQueue = taskQueue; }

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public List<String> getSupportedLanguages() { return supportedLanguages; }
    public void setSupportedLanguages(List<String> supportedLanguages) { this.supportedLanguages = supportedLanguages; }

    public Temporal getTemporal() { return temporal; }
    public Worker getWorker() { return worker; }
    public Mock getMock() { return mock; }
    public Activities getActivities() { return activities; }
    public Client getClient() { return client; }
    public OpenAi getOpenai() { return openai; }

    public static class Temporal {
        private String target = "127.0.0.1:7233";
        private String namespace = "default";

        public String getTarget() { return target; }
        public void setTarget(String target) { this.target = target; }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }
    }

    public static class Worker {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Mock {
        private List<String> knownItems = new ArrayList<>(List.of(
                "demo-001",
                "webinar-2024-q1",
                "customer-success-story",
                "onboarding-101",
                "quarterly-review",
                "meeting-product-roadmap",
                "meeting-customer-success",
                "meeting-incident-retro"));

        public List<String> getKnownItems() { return knownItems; }
        public void setKnownItems(List<String> knownItems) { this.knownItems = knownItems; }
    }

    public static class Activities {
        private ActivityPolicy extract = new ActivityPolicy(ActivityPolicies.EXTRACT_TIMEOUT);
        private ActivityPolicy summarize = new ActivityPolicy(ActivityPolicies.SUMMARIZE_TIMEOUT);
        private ActivityPolicy translateTranscript = new ActivityPolicy(ActivityPolicies.TRANSLATE_TIMEOUT);
        private ActivityPolicy translateSummary = new ActivityPolicy(ActivityPolicies.TRANSLATE_TIMEOUT);

        public ActivityPolicy getExtract() { return extract; }
        public void setExtract(ActivityPolicy extract) { this.extract = extract; }

        public ActivityPolicy getSummarize() { return summarize; }
        public void setSummarize(ActivityPolicy summarize) { this.summarize = summarize; }

        public ActivityPolicy getTranslateTranscript() { return translateTranscript; }
        public void setTranslateTranscript(ActivityPolicy translateTranscript) { this.translateTranscript = translateTranscript; }

        public ActivityPolicy getTranslateSummary() { return translateSummary; }
        public void setTranslateSummary(ActivityPolicy translateSummary) { this.translateSummary = translateSummary; }
    }

    /**
     * Timeout and retry budget of one activity type. A timed out attempt counts against
     * {@code maximumAttempts} like any other failed attempt.
     */
    public static class ActivityPolicy {
        private Duration timeout;
        private int maximumAttempts = ActivityPolicies.DEFAULT_MAXIMUM_ATTEMPTS;
        private Duration initialInterval = ActivityPolicies.DEFAULT_INITIAL_INTERVAL;
        private double backoffCoefficient = ActivityPolicies.DEFAULT_BACKOFF_COEFFICIENT;
        private Duration maximumInterval = ActivityPolicies.DEFAULT_MAXIMUM_INTERVAL;

        public ActivityPolicy() {
        }

        public ActivityPolicy(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public int getMaximumAttempts() { return maximumAttempts; }
        public void setMaximumAttempts(int maximumAttempts) { this.maximumAttempts = maximumAttempts; }

        public Duration getInitialInterval() { return initialInterval; }
        public void setInitialInterval(Duration initialInterval) { this.initialInterval = initialInterval; }

        public double getBackoffCoefficient() { return backoffCoefficient; }
        public void setBackoffCoefficient(double backoffCoefficient) { this.backoffCoefficient = backoffCoefficient; }

        public Duration getMaximumInterval() { return maximumInterval; }
        public void setMaximumInterval(Duration maximumInterval) { this.maximumInterval = maximumInterval; }
    }

    public static class Client {
        /** Unset: derived from the activity retry budgets. */
        private Duration executionTimeout;

        public Duration getExecutionTimeout() { return executionTimeout; }
        public void setExecutionTimeout(Duration executionTimeout) { this.executionTimeout = executionTimeout; }
    }

    public static class OpenAi {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-4.1-mini";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }
}
