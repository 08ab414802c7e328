package fractal.compute.service;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.config.ComputeConfig;
import fractal.compute.core.RecordEventBus;
import fractal.compute.exception.ComputeManagerException;
import fractal.compute.model.ClaimedTask;
import fractal.compute.model.ComputeError;
import fractal.compute.model.ComputeHistoryEntry;
import fractal.compute.model.ComputeManager;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordStatus;
import fractal.compute.model.Task;
import fractal.compute.record.RecordHandlerRegistry;
import fractal.compute.repository.ManagerRepository;
import fractal.compute.repository.RecordRepository;
import fractal.compute.repository.TaskRepository;
import fractal.compute.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for the task queue.
 * Hands out waiting tasks to compute managers.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final Database db;
    private final TaskRepository taskRepository;
    private final RecordRepository recordRepository;
    private final ManagerRepository managerRepository;
    private final RecordHandlerRegistry handlers;
    private final ComputeConfig config;
    private final RecordEventBus eventBus;

    public TaskService(Database db, TaskRepository taskRepository, RecordRepository recordRepository,
            ManagerRepository managerRepository, RecordHandlerRegistry handlers, ComputeConfig config,
            RecordEventBus eventBus) {
        this.db = db;
        this.taskRepository = taskRepository;
        this.recordRepository = recordRepository;
        this.managerRepository = managerRepository;
        this.handlers = handlers;
        this.config = config;
        this.eventBus = eventBus;
    }

    /**
     * Claim tasks for a compute manager.
     *
     * <p>
     * The manager's tags are served in the order the manager listed them; within a tag
     * tasks go out by priority, then age. Only tasks whose required programs the manager
     * has are handed out. The claimed records become running and owned by the manager.
     *
     * @param managerName name of an active manager
     * @param limit       maximum number of tasks; capped by the configured claim limit
     * @throws ComputeManagerException if the manager does not exist or is not active
     */
    public List<ClaimedTask> claimTasks(String managerName, int limit) {
        if (managerName == null || managerName.isBlank()) {
            throw new IllegalArgumentException("managerName is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }

        int effectiveLimit = Math.min(limit, config.managerTasksClaimLimit());
        List<Long> failed = new ArrayList<>();

        List<ClaimedTask> claimed = db.required(conn -> {
            ComputeManager manager = managerRepository.findByNameForUpdate(managerName)
                    .orElseThrow(() -> ComputeManagerException.doesNotExist(managerName));
            if (!manager.isActive()) {
                throw ComputeManagerException.notActive(managerName);
            }

            List<ClaimedTask> result = new ArrayList<>();
            for (String tag : manager.tags()) {
                int remaining = effectiveLimit - result.size();
                if (remaining <= 0) {
                    break;
                }
                for (Task task : taskRepository.lockClaimable(tag, manager.programNames(), remaining)) {
                    claimOne(manager, task, failed).ifPresent(result::add);
                }
            }

            if (!result.isEmpty()) {
                managerRepository.incrementClaimed(managerName, result.size());
            }
            return result;
        });

        for (long recordId : failed) {
            eventBus.notifyStatus(recordId, RecordStatus.ERROR);
        }
        if (!claimed.isEmpty()) {
            log.info("Manager {} claimed {} tasks", managerName, claimed.size());
        } else {
            log.debug("No tasks available for manager {}", managerName);
        }
        return claimed;
    }

    private Optional<ClaimedTask> claimOne(ComputeManager manager, Task task, List<Long> failed) {
        if (!taskRepository.markClaimed(task.id())) {
            return Optional.empty();
        }

        if (!recordRepository.updateStatusIf(task.recordId(), RecordStatus.WAITING, RecordStatus.RUNNING,
                manager.name())) {
            repairTask(task);
            return Optional.empty();
        }

        ComputeRecord record = recordRepository.findById(task.recordId()).orElseThrow();

        JsonNode function = task.function();
        if (function == null) {
            try {
                function = db.withSavepoint(conn -> {
                    JsonNode generated = handlers.get(record.recordType()).generateTaskFunction(record);
                    taskRepository.updateFunction(task.id(), generated);
                    return generated;
                });
            } catch (RuntimeException e) {
                log.error("Failed to generate task function for record {}", record.id(), e);
                failUnrunnable(record, manager, e);
                failed.add(record.id());
                return Optional.empty();
            }
        }

        return Optional.of(ClaimedTask.from(task, record, function));
    }

    /**
     * An available task whose record is not waiting. A task exists only while its record
     * is waiting or running, and is available only while it is waiting.
     */
    private void repairTask(Task task) {
        RecordStatus status = recordRepository.findById(task.recordId())
                .map(ComputeRecord::status)
                .orElse(null);
        if (status == null || !status.isPending()) {
            taskRepository.deleteByRecordId(task.recordId());
            log.warn("Task {} was available but record {} is {}; removed from queue", task.id(), task.recordId(),
                    status);
        } else if (status == RecordStatus.WAITING) {
            taskRepository.setAvailable(task.recordId(), true);
        } else {
            log.warn("Task {} was available but record {} is already running", task.id(), task.recordId());
        }
    }

    /**
     * A record whose task cannot be built is taken out of the queue with an internal error,
     * so it does not block the queue for every manager. The caller publishes the status
     * change after commit.
     */
    private void failUnrunnable(ComputeRecord record, ComputeManager manager, RuntimeException cause) {
        recordRepository.appendHistory(new ComputeHistoryEntry(0, record.id(), RecordStatus.ERROR, manager.name(),
                Instant.now(), null, null,
                ComputeError.internal("Unable to generate task: " + cause.getMessage())));
        recordRepository.updateStatus(record.id(), RecordStatus.ERROR, null);
        taskRepository.deleteByRecordId(record.id());
    }

    public Optional<Task> findById(long taskId) {
        return taskRepository.findById(taskId);
    }

    public Optional<Task> findByRecordId(long recordId) {
        return taskRepository.findByRecordId(recordId);
    }

    public int countAvailable() {
        return taskRepository.countAvailable();
    }
}
