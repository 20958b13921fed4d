package leadflow.workflow.config;

import leadflow.workflow.model.ProcessingOrder;

import java.time.Duration;

/**
 * Configuration holder for the workflow service.
 * All settings have sensible defaults.
 */
public final class WorkflowConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/leadflow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Run settings
    private int defaultBatchSize = 10;
    private int maxBatchSize = 500;
    private ProcessingOrder defaultOrder = ProcessingOrder.NEWEST_FIRST;
    private int defaultMaxBatches = 100;
    private Duration interBatchDelay = Duration.ofSeconds(1);
    private int maxErrorsPerJob = 100;
    private int runnerThreads = 4;

    // Continuation sweeper (zero disables it)
    private Duration continuationInterval = Duration.ZERO;

    // Link check settings
    private Duration linkCheckTimeout = Duration.ofSeconds(10);
    private Duration recheckAfter = Duration.ofDays(7);

    // Auth settings (optional)
    private String apiKey = null; // If set, mutating requests must provide X-Leadflow-Key header

    private WorkflowConfig() {
    }

    public static WorkflowConfig defaults() {
        return new WorkflowConfig();
    }

    public static WorkflowConfig fromEnv() {
        WorkflowConfig config = new WorkflowConfig();

        // Override from environment variables
        String dbUrl = System.getenv("LEADFLOW_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("LEADFLOW_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String batchSize = System.getenv("LEADFLOW_DEFAULT_BATCH_SIZE");
        if (batchSize != null && !batchSize.isBlank()) {
            config.defaultBatchSize = Integer.parseInt(batchSize);
        }

        String maxBatches = System.getenv("LEADFLOW_MAX_BATCHES");
        if (maxBatches != null && !maxBatches.isBlank()) {
            config.defaultMaxBatches = Integer.parseInt(maxBatches);
        }

        String delayMs = System.getenv("LEADFLOW_BATCH_DELAY_MS");
        if (delayMs != null && !delayMs.isBlank()) {
            config.interBatchDelay = Duration.ofMillis(Long.parseLong(delayMs));
        }

        String sweepSeconds = System.getenv("LEADFLOW_SWEEP_INTERVAL_S");
        if (sweepSeconds != null && !sweepSeconds.isBlank()) {
            config.continuationInterval = Duration.ofSeconds(Long.parseLong(sweepSeconds));
        }

        String apiKey = System.getenv("LEADFLOW_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int defaultBatchSize() {
        return defaultBatchSize;
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }

    public ProcessingOrder defaultOrder() {
        return defaultOrder;
    }

    public int defaultMaxBatches() {
        return defaultMaxBatches;
    }

    public Duration interBatchDelay() {
        return interBatchDelay;
    }

    public int maxErrorsPerJob() {
        return maxErrorsPerJob;
    }

    public int runnerThreads() {
        return runnerThreads;
    }

    public Duration continuationInterval() {
        return continuationInterval;
    }

    public boolean continuationEnabled() {
        return !continuationInterval.isZero() && !continuationInterval.isNegative();
    }

    public Duration linkCheckTimeout() {
        return linkCheckTimeout;
    }

    public Duration recheckAfter() {
        return recheckAfter;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // Fluent setters for testing/customization
    public WorkflowConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public WorkflowConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public WorkflowConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public WorkflowConfig withDefaultBatchSize(int batchSize) {
        this.defaultBatchSize = batchSize;
        return this;
    }

    public WorkflowConfig withDefaultMaxBatches(int maxBatches) {
        this.defaultMaxBatches = maxBatches;
        return this;
    }

    public WorkflowConfig withInterBatchDelay(Duration delay) {
        this.interBatchDelay = delay;
        return this;
    }

    public WorkflowConfig withMaxErrorsPerJob(int maxErrors) {
        this.maxErrorsPerJob = maxErrors;
        return this;
    }

    public WorkflowConfig withContinuationInterval(Duration interval) {
        this.continuationInterval = interval;
        return this;
    }

    public WorkflowConfig withRecheckAfter(Duration recheckAfter) {
        this.recheckAfter = recheckAfter;
        return this;
    }

    public WorkflowConfig withLinkCheckTimeout(Duration timeout) {
        this.linkCheckTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "WorkflowConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", defaultBatchSize=" + defaultBatchSize +
                ", defaultMaxBatches=" + defaultMaxBatches +
                ", interBatchDelay=" + interBatchDelay +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
