package fractal.compute.record;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.TaskResult;

import java.util.Set;

/**
 * Per-record-type behavior of task-backed records.
 *
 * <p>
 * Handlers interpret the opaque specification of their record type. They are called
 * inside the transaction of the operation that needs them and must not commit.
 */
public interface RecordTypeHandler {

    /**
     * The record type tag this handler serves, e.g. {@code singlepoint}.
     */
    String recordType();

    /**
     * Programs a manager must have installed to run a task of this record.
     * Names are lower-case.
     */
    Set<String> requiredPrograms(ComputeRecord record);

    /**
     * Build the execution-ready instructions sent to a manager at claim time.
     */
    JsonNode generateTaskFunction(ComputeRecord record);

    /**
     * Result summary stored on the record after a successful computation.
     *
     * @throws IllegalArgumentException if the result lacks data this record type needs
     */
    JsonNode extractProperties(ComputeRecord record, TaskResult result);
}
