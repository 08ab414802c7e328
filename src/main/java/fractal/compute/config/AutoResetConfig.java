package fractal.compute.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for automatically resetting records whose computation failed.
 * Disabled by default.
 */
public final class AutoResetConfig {

    private boolean enabled = false;
    private Integer maxResetAttempts = null; // null = unbounded
    private boolean onlyNew = false;
    private final Map<String, Integer> errorTypeLimits = new LinkedHashMap<>();

    private AutoResetConfig() {
        errorTypeLimits.put("unknown_error", 2);
        errorTypeLimits.put("compute_lost", 5);
        errorTypeLimits.put("random_error", 5);
    }

    public static AutoResetConfig defaults() {
        return new AutoResetConfig();
    }

    public static AutoResetConfig fromEnv() {
        AutoResetConfig config = new AutoResetConfig();

        String enabled = System.getenv("FRACTAL_AUTO_RESET_ENABLED");
        if (enabled != null && !enabled.isBlank()) {
            config.enabled = Boolean.parseBoolean(enabled);
        }

        String maxAttempts = System.getenv("FRACTAL_AUTO_RESET_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.maxResetAttempts = Integer.parseInt(maxAttempts);
        }

        String onlyNew = System.getenv("FRACTAL_AUTO_RESET_ONLY_NEW");
        if (onlyNew != null && !onlyNew.isBlank()) {
            config.onlyNew = Boolean.parseBoolean(onlyNew);
        }

        // FRACTAL_AUTO_RESET_LIMITS=unknown_error:2,compute_lost:5
        String limits = System.getenv("FRACTAL_AUTO_RESET_LIMITS");
        if (limits != null && !limits.isBlank()) {
            config.errorTypeLimits.clear();
            for (String entry : limits.split(",")) {
                String[] kv = entry.trim().split(":");
                if (kv.length != 2) {
                    throw new IllegalArgumentException("Invalid auto reset limit entry: " + entry);
                }
                config.errorTypeLimits.put(kv[0].trim(), Integer.parseInt(kv[1].trim()));
            }
        }

        return config;
    }

    public boolean enabled() {
        return enabled;
    }

    public Integer maxResetAttempts() {
        return maxResetAttempts;
    }

    public boolean onlyNew() {
        return onlyNew;
    }

    public Map<String, Integer> errorTypeLimits() {
        return Collections.unmodifiableMap(errorTypeLimits);
    }

    public AutoResetConfig withEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public AutoResetConfig withMaxResetAttempts(Integer maxResetAttempts) {
        this.maxResetAttempts = maxResetAttempts;
        return this;
    }

    public AutoResetConfig withOnlyNew(boolean onlyNew) {
        this.onlyNew = onlyNew;
        return this;
    }

    public AutoResetConfig withErrorTypeLimit(String errorType, int limit) {
        this.errorTypeLimits.put(errorType, limit);
        return this;
    }

    public AutoResetConfig withoutErrorTypeLimits() {
        this.errorTypeLimits.clear();
        return this;
    }

    @Override
    public String toString() {
        return "AutoResetConfig{" +
                "enabled=" + enabled +
                ", maxResetAttempts=" + maxResetAttempts +
                ", onlyNew=" + onlyNew +
                ", limits=" + errorTypeLimits +
                '}';
    }
}
