package fractal.compute.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Auxiliary state of a service-backed record.
 * The service state is owned by the workflow driver and is always rewritten in full.
 */
public record ServiceQueueEntry(
        long recordId,
        String computeTag,
        TaskPriority computePriority,
        boolean findExisting,
        JsonNode serviceState,
        Instant createdOn) {

    public boolean isInitialized() {
        return serviceState != null && !serviceState.isNull();
    }

    public ServiceQueueEntry withServiceState(JsonNode newState) {
        return new ServiceQueueEntry(recordId, computeTag, computePriority, findExisting, newState, createdOn);
    }
}
