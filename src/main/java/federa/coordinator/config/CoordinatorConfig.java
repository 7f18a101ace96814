package federa.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for the orchestrator, the queue store and in-process nodes.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:mem:federa;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Remote call settings
    private Duration pollInterval = Duration.ofMillis(200);
    private Duration callTimeout = Duration.ofMinutes(10);
    private String groupId = "";
    private int roundParallelism = 8;

    // Node settings
    private Duration nodePollInterval = Duration.ofMillis(500);

    // Retention settings
    private Duration taskRetention = Duration.ofHours(1);
    private Duration taskReaperInterval = Duration.ofSeconds(30);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        // Override from environment variables
        String dbUrl = System.getenv("FEDERA_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String pollMs = System.getenv("FEDERA_POLL_INTERVAL_MS");
        if (pollMs != null && !pollMs.isBlank()) {
            config.pollInterval = Duration.ofMillis(Long.parseLong(pollMs));
        }

        String groupId = System.getenv("FEDERA_GROUP_ID");
        if (groupId != null) {
            config.groupId = groupId;
        }

        String parallelism = System.getenv("FEDERA_ROUND_PARALLELISM");
        if (parallelism != null && !parallelism.isBlank()) {
            config.roundParallelism = Integer.parseInt(parallelism);
        }

        String retention = System.getenv("FEDERA_TASK_RETENTION_SECONDS");
        if (retention != null && !retention.isBlank()) {
            config.taskRetention = Duration.ofSeconds(Long.parseLong(retention));
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

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration callTimeout() {
        return callTimeout;
    }

    public String groupId() {
        return groupId;
    }

    public int roundParallelism() {
        return roundParallelism;
    }

    public Duration nodePollInterval() {
        return nodePollInterval;
    }

    public Duration taskRetention() {
        return taskRetention;
    }

    public Duration taskReaperInterval() {
        return taskReaperInterval;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withPollInterval(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = interval;
        return this;
    }

    public CoordinatorConfig withCallTimeout(Duration timeout) {
        this.callTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withGroupId(String groupId) {
        this.groupId = groupId;
        return this;
    }

    public CoordinatorConfig withRoundParallelism(int parallelism) {
        this.roundParallelism = parallelism;
        return this;
    }

    public CoordinatorConfig withNodePollInterval(Duration interval) {
        this.nodePollInterval = interval;
        return this;
    }

    public CoordinatorConfig withTaskRetention(Duration retention) {
        this.taskRetention = retention;
        return this;
    }

    public CoordinatorConfig withTaskReaperInterval(Duration interval) {
        this.taskReaperInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", pollInterval=" + pollInterval +
                ", callTimeout=" + callTimeout +
                ", groupId='" + groupId + '\'' +
                ", roundParallelism=" + roundParallelism +
                ", taskRetention=" + taskRetention +
                '}';
    }
}
