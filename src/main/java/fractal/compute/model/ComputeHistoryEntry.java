package fractal.compute.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One attempt at computing a record: the status it ended with, who ran it,
 * and what it produced.
 */
public record ComputeHistoryEntry(
        long id,
        long recordId,
        RecordStatus status,
        String managerName,
        Instant modifiedOn,
        JsonNode provenance,
        String stdout,
        ComputeError error) {

    public boolean isError() {
        return status == RecordStatus.ERROR;
    }
}
