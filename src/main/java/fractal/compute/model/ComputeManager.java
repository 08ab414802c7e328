package fractal.compute.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model representing a compute manager (a remote worker process).
 */
public final class ComputeManager {
    private final String name;
    private final ManagerStatus status;
    private final Map<String, String> programs; // program -> version (may be null)
    private final List<String> tags; // in the order the manager serves them
    private final long successes;
    private final long failures;
    private final long rejected;
    private final long claimed;
    private final Instant createdOn;
    private final Instant modifiedOn;
    private final Instant lastHeartbeat;

    private ComputeManager(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.programs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.programs));
        this.tags = List.copyOf(builder.tags);
        this.successes = builder.successes;
        this.failures = builder.failures;
        this.rejected = builder.rejected;
        this.claimed = builder.claimed;
        this.createdOn = builder.createdOn;
        this.modifiedOn = builder.modifiedOn;
        this.lastHeartbeat = builder.lastHeartbeat;
    }

    public String name() {
        return name;
    }

    public ManagerStatus status() {
        return status;
    }

    public Map<String, String> programs() {
        return programs;
    }

    public Set<String> programNames() {
        return programs.keySet();
    }

    public List<String> tags() {
        return tags;
    }

    public long successes() {
        return successes;
    }

    public long failures() {
        return failures;
    }

    public long rejected() {
        return rejected;
    }

    public long claimed() {
        return claimed;
    }

    public Instant createdOn() {
        return createdOn;
    }

    public Instant modifiedOn() {
        return modifiedOn;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public boolean isActive() {
        return status == ManagerStatus.ACTIVE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private ManagerStatus status = ManagerStatus.ACTIVE;
        private Map<String, String> programs = Map.of();
        private List<String> tags = List.of();
        private long successes;
        private long failures;
        private long rejected;
        private long claimed;
        private Instant createdOn;
        private Instant modifiedOn;
        private Instant lastHeartbeat;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(ManagerStatus status) {
            this.status = status;
            return this;
        }

        public Builder programs(Map<String, String> programs) {
            this.programs = programs;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder successes(long successes) {
            this.successes = successes;
            return this;
        }

        public Builder failures(long failures) {
            this.failures = failures;
            return this;
        }

        public Builder rejected(long rejected) {
            this.rejected = rejected;
            return this;
        }

        public Builder claimed(long claimed) {
            this.claimed = claimed;
            return this;
        }

        public Builder createdOn(Instant createdOn) {
            this.createdOn = createdOn;
            return this;
        }

        public Builder modifiedOn(Instant modifiedOn) {
            this.modifiedOn = modifiedOn;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public ComputeManager build() {
            return new ComputeManager(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ComputeManager that))
            return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ComputeManager{name='" + name + "', status=" + status + ", tags=" + tags + "}";
    }
}
