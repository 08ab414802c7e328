package fractal.compute.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Set;

/**
 * What a manager receives for each task it claimed.
 */
public record ClaimedTask(
        long taskId,
        long recordId,
        String recordType,
        String tag,
        TaskPriority priority,
        Set<String> requiredPrograms,
        JsonNode function,
        Instant createdOn) {

    public static ClaimedTask from(Task task, ComputeRecord record, JsonNode function) {
        return new ClaimedTask(
                task.id(),
                record.id(),
                record.recordType(),
                task.tag(),
                task.priority(),
                task.requiredPrograms(),
                function,
                task.createdOn());
    }
}
