package fractal.compute.repository;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.model.RecordChild;
import fractal.compute.model.ServiceDependency;
import fractal.compute.model.ServiceQueueEntry;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for service state, dependencies and child links.
 */
public interface ServiceRepository {

    void insert(ServiceQueueEntry entry);

    Optional<ServiceQueueEntry> findByRecordId(long recordId);

    /**
     * Replace the stored service state in full.
     */
    void updateState(long recordId, JsonNode serviceState);

    /**
     * Waiting services in start order: priority descending, then creation time.
     */
    List<Long> findWaiting(int limit);

    int countRunning();

    /**
     * Running services none of whose dependencies is still waiting or running.
     */
    List<Long> findRunningReady();

    /**
     * Current dependencies of a service, in position order.
     */
    List<ServiceDependency> findDependencies(long serviceId);

    /**
     * Delete all dependencies of a service and insert the given ones.
     */
    void replaceDependencies(long serviceId, List<ServiceDependency> dependencies);

    void addChildren(List<RecordChild> children);

    /**
     * All sub-records a service has spawned, in position order.
     */
    List<RecordChild> findChildren(long parentId);

    /**
     * Drop state, dependencies and child links so the service starts over.
     */
    void clear(long recordId);
}
