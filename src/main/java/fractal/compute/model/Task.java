package fractal.compute.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A claimable unit of work, bound 1:1 to a record.
 */
public final class Task {
    private final long id;
    private final long recordId;
    private final String tag;
    private final TaskPriority priority;
    private final Set<String> requiredPrograms;
    private final boolean available; // mirrors record status == WAITING
    private final JsonNode function; // execution instructions, generated at claim time
    private final Instant createdOn;

    private Task(Builder builder) {
        this.id = builder.id;
        this.recordId = builder.recordId;
        this.tag = Objects.requireNonNull(builder.tag, "tag is required");
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.requiredPrograms = Set.copyOf(new TreeSet<>(builder.requiredPrograms));
        this.available = builder.available;
        this.function = builder.function;
        this.createdOn = builder.createdOn;
    }

    public long id() {
        return id;
    }

    public long recordId() {
        return recordId;
    }

    public String tag() {
        return tag;
    }

    public TaskPriority priority() {
        return priority;
    }

    public Set<String> requiredPrograms() {
        return requiredPrograms;
    }

    public boolean isAvailable() {
        return available;
    }

    public JsonNode function() {
        return function;
    }

    public Instant createdOn() {
        return createdOn;
    }

    /** Check whether a manager with the given programs can run this task */
    public boolean canRunWith(Set<String> programs) {
        return programs.containsAll(requiredPrograms);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .recordId(recordId)
                .tag(tag)
                .priority(priority)
                .requiredPrograms(requiredPrograms)
                .available(available)
                .function(function)
                .createdOn(createdOn);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private long recordId;
        private String tag = "*";
        private TaskPriority priority = TaskPriority.NORMAL;
        private Set<String> requiredPrograms = Set.of();
        private boolean available = true;
        private JsonNode function;
        private Instant createdOn;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder recordId(long recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder requiredPrograms(Set<String> requiredPrograms) {
            this.requiredPrograms = requiredPrograms;
            return this;
        }

        public Builder available(boolean available) {
            this.available = available;
            return this;
        }

        public Builder function(JsonNode function) {
            this.function = function;
            return this;
        }

        public Builder createdOn(Instant createdOn) {
            this.createdOn = createdOn;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return id == task.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", recordId=" + recordId + ", tag='" + tag + "', priority=" + priority + "}";
    }
}
