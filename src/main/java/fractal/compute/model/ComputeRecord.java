package fractal.compute.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one computation's lifecycle.
 * Specification and properties are opaque JSON documents interpreted by the
 * record type handler (or service driver) registered for {@link #recordType()}.
 */
public final class ComputeRecord {
    private final long id;
    private final String recordType;
    private final boolean service;
    private final RecordStatus status;
    private final String managerName; // owner while running
    private final String computeTag;
    private final TaskPriority computePriority;
    private final JsonNode specification;
    private final String specificationHash;
    private final JsonNode properties; // result summary, set on completion
    private final Instant createdOn;
    private final Instant modifiedOn;

    private ComputeRecord(Builder builder) {
        this.id = builder.id;
        this.recordType = Objects.requireNonNull(builder.recordType, "recordType is required");
        this.service = builder.service;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.managerName = builder.managerName;
        this.computeTag = Objects.requireNonNull(builder.computeTag, "computeTag is required");
        this.computePriority = Objects.requireNonNull(builder.computePriority, "computePriority is required");
        this.specification = Objects.requireNonNull(builder.specification, "specification is required");
        this.specificationHash = builder.specificationHash;
        this.properties = builder.properties;
        this.createdOn = builder.createdOn;
        this.modifiedOn = builder.modifiedOn;
    }

    public long id() {
        return id;
    }

    public String recordType() {
        return recordType;
    }

    public boolean isService() {
        return service;
    }

    public RecordStatus status() {
        return status;
    }

    public String managerName() {
        return managerName;
    }

    public String computeTag() {
        return computeTag;
    }

    public TaskPriority computePriority() {
        return computePriority;
    }

    public JsonNode specification() {
        return specification;
    }

    public String specificationHash() {
        return specificationHash;
    }

    public JsonNode properties() {
        return properties;
    }

    public Instant createdOn() {
        return createdOn;
    }

    public Instant modifiedOn() {
        return modifiedOn;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .recordType(recordType)
                .service(service)
                .status(status)
                .managerName(managerName)
                .computeTag(computeTag)
                .computePriority(computePriority)
                .specification(specification)
                .specificationHash(specificationHash)
                .properties(properties)
                .createdOn(createdOn)
                .modifiedOn(modifiedOn);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String recordType;
        private boolean service;
        private RecordStatus status = RecordStatus.WAITING;
        private String managerName;
        private String computeTag = "*";
        private TaskPriority computePriority = TaskPriority.NORMAL;
        private JsonNode specification;
        private String specificationHash;
        private JsonNode properties;
        private Instant createdOn;
        private Instant modifiedOn;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder recordType(String recordType) {
            this.recordType = recordType;
            return this;
        }

        public Builder service(boolean service) {
            this.service = service;
            return this;
        }

        public Builder status(RecordStatus status) {
            this.status = status;
            return this;
        }

        public Builder managerName(String managerName) {
            this.managerName = managerName;
            return this;
        }

        public Builder computeTag(String computeTag) {
            this.computeTag = computeTag;
            return this;
        }

        public Builder computePriority(TaskPriority computePriority) {
            this.computePriority = computePriority;
            return this;
        }

        public Builder specification(JsonNode specification) {
            this.specification = specification;
            return this;
        }

        public Builder specificationHash(String specificationHash) {
            this.specificationHash = specificationHash;
            return this;
        }

        public Builder properties(JsonNode properties) {
            this.properties = properties;
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

        public ComputeRecord build() {
            return new ComputeRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ComputeRecord that))
            return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "ComputeRecord{id=" + id + ", type='" + recordType + "', status=" + status
                + ", manager='" + managerName + "'}";
    }
}
