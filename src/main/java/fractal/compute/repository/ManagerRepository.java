package fractal.compute.repository;

import fractal.compute.model.ComputeManager;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for compute managers.
 */
public interface ManagerRepository {

    /**
     * Insert a new manager.
     */
    void insert(ComputeManager manager);

    /**
     * Find a manager by name.
     */
    Optional<ComputeManager> findByName(String name);

    /**
     * Find a manager by name, waiting for and then holding its row lock.
     * This lock serializes claims and result submissions of one manager.
     */
    Optional<ComputeManager> findByNameForUpdate(String name);

    List<ComputeManager> findAll();

    /**
     * Add to the claimed counter.
     */
    void incrementClaimed(String name, int claimed);

    /**
     * Add to the result counters.
     */
    void incrementCounters(String name, int successes, int failures, int rejected);

    /**
     * Record a heartbeat of an active manager.
     *
     * @return false if the manager does not exist or is not active
     */
    boolean heartbeat(String name, Instant at);

    /**
     * Mark a manager inactive.
     *
     * @return true if the manager was active
     */
    boolean deactivate(String name);

    /**
     * Names of active managers whose last heartbeat is older than the cutoff.
     */
    List<String> findStale(Instant cutoff);
}
