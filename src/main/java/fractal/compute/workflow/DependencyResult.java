package fractal.compute.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.model.RecordStatus;

/**
 * Status and result of a sub-record, together with the correlation data the driver
 * attached when it requested the sub-record.
 */
public record DependencyResult(
        long recordId,
        String recordType,
        RecordStatus status,
        JsonNode properties,
        JsonNode extras) {

    public boolean isComplete() {
        return status == RecordStatus.COMPLETE;
    }
}
