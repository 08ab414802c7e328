package fractal.compute.workflow;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A sub-record a service wants computed before its next iteration.
 *
 * @param recordType    record type of the sub-record, e.g. {@code optimization}
 * @param specification full specification of the sub-record
 * @param extras        driver correlation data, handed back with the dependency result
 * @param childKey      key under which the sub-record is kept in the service's child history
 */
public record SubTaskRequest(
        String recordType,
        JsonNode specification,
        JsonNode extras,
        String childKey) {
}
