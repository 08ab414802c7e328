package fractal.compute.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A sub-record awaited by a service during the current iteration.
 *
 * @param extras driver-defined correlation data (which logical sub-job this is)
 */
public record ServiceDependency(
        long serviceId,
        long recordId,
        int position,
        JsonNode extras) {
}
