package fractal.compute.config;

import java.time.Duration;

/**
 * Configuration holder for the compute engine.
 * All settings have sensible defaults.
 */
public final class ComputeConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/fractal;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Task queue settings
    private int managerTasksClaimLimit = 200;

    // Service settings
    private Duration serviceFrequency = Duration.ofSeconds(60);
    private int maxActiveServices = 20;

    // Manager settings
    private Duration heartbeatFrequency = Duration.ofSeconds(60);
    private int heartbeatMaxMissed = 5;

    private AutoResetConfig autoReset = AutoResetConfig.defaults();

    private ComputeConfig() {
    }

    public static ComputeConfig defaults() {
        return new ComputeConfig();
    }

    public static ComputeConfig fromEnv() {
        ComputeConfig config = new ComputeConfig();

        // Override from environment variables
        String dbUrl = System.getenv("FRACTAL_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String claimLimit = System.getenv("FRACTAL_CLAIM_LIMIT");
        if (claimLimit != null && !claimLimit.isBlank()) {
            config.managerTasksClaimLimit = Integer.parseInt(claimLimit);
        }

        String serviceFrequency = System.getenv("FRACTAL_SERVICE_FREQUENCY");
        if (serviceFrequency != null && !serviceFrequency.isBlank()) {
            config.serviceFrequency = Duration.ofSeconds(Long.parseLong(serviceFrequency));
        }

        String maxActive = System.getenv("FRACTAL_MAX_ACTIVE_SERVICES");
        if (maxActive != null && !maxActive.isBlank()) {
            config.maxActiveServices = Integer.parseInt(maxActive);
        }

        String heartbeatFrequency = System.getenv("FRACTAL_HEARTBEAT_FREQUENCY");
        if (heartbeatFrequency != null && !heartbeatFrequency.isBlank()) {
            config.heartbeatFrequency = Duration.ofSeconds(Long.parseLong(heartbeatFrequency));
        }

        String maxMissed = System.getenv("FRACTAL_HEARTBEAT_MAX_MISSED");
        if (maxMissed != null && !maxMissed.isBlank()) {
            config.heartbeatMaxMissed = Integer.parseInt(maxMissed);
        }

        config.autoReset = AutoResetConfig.fromEnv();

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int managerTasksClaimLimit() {
        return managerTasksClaimLimit;
    }

    public Duration serviceFrequency() {
        return serviceFrequency;
    }

    public int maxActiveServices() {
        return maxActiveServices;
    }

    public Duration heartbeatFrequency() {
        return heartbeatFrequency;
    }

    public int heartbeatMaxMissed() {
        return heartbeatMaxMissed;
    }

    /**
     * A manager that has not sent a heartbeat for this long is considered dead.
     */
    public Duration heartbeatTimeout() {
        return heartbeatFrequency.multipliedBy(heartbeatMaxMissed);
    }

    public AutoResetConfig autoReset() {
        return autoReset;
    }

    // Fluent setters for testing/customization
    public ComputeConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public ComputeConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public ComputeConfig withManagerTasksClaimLimit(int limit) {
        this.managerTasksClaimLimit = limit;
        return this;
    }

    public ComputeConfig withServiceFrequency(Duration frequency) {
        this.serviceFrequency = frequency;
        return this;
    }

    public ComputeConfig withMaxActiveServices(int maxActiveServices) {
        this.maxActiveServices = maxActiveServices;
        return this;
    }

    public ComputeConfig withHeartbeatFrequency(Duration frequency) {
        this.heartbeatFrequency = frequency;
        return this;
    }

    public ComputeConfig withHeartbeatMaxMissed(int maxMissed) {
        this.heartbeatMaxMissed = maxMissed;
        return this;
    }

    public ComputeConfig withAutoReset(AutoResetConfig autoReset) {
        this.autoReset = autoReset;
        return this;
    }

    @Override
    public String toString() {
        return "ComputeConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", claimLimit=" + managerTasksClaimLimit +
                ", maxActiveServices=" + maxActiveServices +
                ", heartbeatTimeout=" + heartbeatTimeout() +
                ", autoReset=" + autoReset +
                '}';
    }
}
