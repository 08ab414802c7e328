package fractal.compute.repository;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.model.Task;

import java.util.Optional;
import java.util.Set;
import java.util.List;

/**
 * Repository interface for the task queue.
 * All methods join the calling thread's transaction when one is active.
 */
public interface TaskRepository {

    /**
     * Insert a task together with its required programs.
     *
     * @return the generated task id
     */
    long insert(Task task);

    /**
     * Find a task by ID.
     */
    Optional<Task> findById(long taskId);

    /**
     * Find a task by ID, waiting for and then holding its row lock.
     */
    Optional<Task> findByIdForUpdate(long taskId);

    /**
     * Find the task of a record.
     */
    Optional<Task> findByRecordId(long recordId);

    /**
     * Select and lock up to {@code limit} available tasks that a manager with the given
     * programs may run under the given tag. Rows locked by other transactions are skipped.
     *
     * <p>
     * Ordering: priority descending, then creation time, then id.
     *
     * @param tag      manager tag; {@code "*"} matches any task tag
     * @param programs programs the manager has installed
     * @param limit    maximum number of tasks
     */
    List<Task> lockClaimable(String tag, Set<String> programs, int limit);

    /**
     * Atomically flip a task from available to unavailable.
     *
     * @return true if this call made the change
     */
    boolean markClaimed(long taskId);

    /**
     * Set the availability of the task belonging to a record.
     */
    void setAvailable(long recordId, boolean available);

    /**
     * Store the generated execution instructions of a task.
     */
    void updateFunction(long taskId, JsonNode function);

    /**
     * Delete the task of a record, if any.
     *
     * @return true if a task was deleted
     */
    boolean deleteByRecordId(long recordId);

    /**
     * Number of tasks currently available for claiming.
     */
    int countAvailable();
}
