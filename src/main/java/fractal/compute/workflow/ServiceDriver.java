package fractal.compute.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fractal.compute.util.Jsons;

/**
 * Domain logic of one service (workflow) type.
 *
 * <p>
 * Drivers are stateless; everything they need between steps lives in the service
 * state they return. They must not touch the database.
 */
public interface ServiceDriver {

    /**
     * The record type tag this driver serves, e.g. {@code torsiondrive}.
     */
    String serviceType();

    /**
     * Whether the driver can run in this process. Evaluated once, when the registry is built.
     */
    boolean available();

    /**
     * Build the initial state from the record specification.
     */
    ServiceIteration initialize(ServiceContext context);

    /**
     * Consume the results of the previous batch and produce the next one.
     * An empty batch finishes the service.
     */
    ServiceIteration iterate(ServiceContext context);

    /**
     * Provenance stored on the compute history entry of the service.
     */
    default JsonNode provenance() {
        ObjectNode provenance = Jsons.object();
        provenance.put("creator", serviceType());
        provenance.put("routine", getClass().getName());
        return provenance;
    }
}
