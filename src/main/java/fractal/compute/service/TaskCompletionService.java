package fractal.compute.service;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.config.ComputeConfig;
import fractal.compute.core.RecordEventBus;
import fractal.compute.exception.ComputeManagerException;
import fractal.compute.exception.InvalidStateTransitionException;
import fractal.compute.model.ComputeError;
import fractal.compute.model.ComputeHistoryEntry;
import fractal.compute.model.ComputeManager;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordStatus;
import fractal.compute.model.Task;
import fractal.compute.model.TaskResult;
import fractal.compute.model.TaskReturnMetadata;
import fractal.compute.model.TaskReturnMetadata.RejectedTask;
import fractal.compute.record.RecordHandlerRegistry;
import fractal.compute.repository.ManagerRepository;
import fractal.compute.repository.RecordRepository;
import fractal.compute.repository.TaskRepository;
import fractal.compute.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies the results compute managers return for their claimed tasks.
 *
 * <p>
 * The manager row stays locked for the whole batch. Every result is applied inside its
 * own savepoint, so one bad result is rejected without touching the others. Status change
 * notifications are published once the batch has committed.
 */
public class TaskCompletionService {

    private static final Logger log = LoggerFactory.getLogger(TaskCompletionService.class);

    static final String REASON_MISSING = "Task does not exist in the task queue";
    static final String REASON_NOT_RUNNING = "Task is not in a running state";
    static final String REASON_OTHER_MANAGER = "Task is claimed by another manager";
    static final String REASON_BAD_FAILURE = "Returned success=False, but not a failure payload";
    static final String REASON_INTERNAL = "Internal server error";

    private final Database db;
    private final TaskRepository taskRepository;
    private final RecordRepository recordRepository;
    private final ManagerRepository managerRepository;
    private final RecordService recordService;
    private final RecordHandlerRegistry handlers;
    private final AutoResetPolicy resetPolicy;
    private final RecordEventBus eventBus;

    public TaskCompletionService(Database db, TaskRepository taskRepository, RecordRepository recordRepository,
            ManagerRepository managerRepository, RecordService recordService, RecordHandlerRegistry handlers,
            ComputeConfig config, RecordEventBus eventBus) {
        this.db = db;
        this.taskRepository = taskRepository;
        this.recordRepository = recordRepository;
        this.managerRepository = managerRepository;
        this.recordService = recordService;
        this.handlers = handlers;
        this.resetPolicy = new AutoResetPolicy(config.autoReset());
        this.eventBus = eventBus;
    }

    private enum Kind {
        SUCCESS, FAILURE, REJECTED
    }

    private record Outcome(Kind kind, long recordId, String reason, boolean resetRecommended) {
        static Outcome rejected(long recordId, String reason) {
            return new Outcome(Kind.REJECTED, recordId, reason, false);
        }
    }

    private record StatusEvent(long recordId, RecordStatus status) {
    }

    private record Batch(TaskReturnMetadata metadata, Set<StatusEvent> events) {
    }

    /**
     * Apply a batch of results from one manager.
     *
     * @param managerName name of an active manager
     * @param results     results by task id, applied in iteration order
     * @return accepted task ids and rejected tasks with their reasons
     * @throws ComputeManagerException if the manager does not exist or is not active
     */
    public TaskReturnMetadata submitResults(String managerName, Map<Long, TaskResult> results) {
        if (managerName == null || managerName.isBlank()) {
            throw new IllegalArgumentException("managerName is required");
        }

        Batch batch = db.required(conn -> {
            ComputeManager manager = managerRepository.findByNameForUpdate(managerName)
                    .orElseThrow(() -> ComputeManagerException.doesNotExist(managerName));
            if (!manager.isActive()) {
                throw ComputeManagerException.notActive(managerName);
            }

            List<Long> accepted = new ArrayList<>();
            List<RejectedTask> rejected = new ArrayList<>();
            Set<StatusEvent> events = new LinkedHashSet<>();
            List<Long> toReset = new ArrayList<>();
            int successes = 0;
            int failures = 0;

            for (Map.Entry<Long, TaskResult> entry : results.entrySet()) {
                long taskId = entry.getKey();
                Outcome outcome;
                try {
                    outcome = db.withSavepoint(c -> applyResult(manager, taskId, entry.getValue()));
                } catch (RuntimeException e) {
                    log.error("Internal error applying result of task {} from manager {}", taskId, managerName, e);
                    outcome = applyInternalFailure(manager, taskId,
                            "Error processing result of task " + taskId + ": " + e);
                }

                switch (outcome.kind()) {
                    case SUCCESS -> {
                        successes++;
                        accepted.add(taskId);
                        events.add(new StatusEvent(outcome.recordId(), RecordStatus.COMPLETE));
                    }
                    case FAILURE -> {
                        failures++;
                        accepted.add(taskId);
                        events.add(new StatusEvent(outcome.recordId(), RecordStatus.ERROR));
                        if (outcome.resetRecommended()) {
                            toReset.add(outcome.recordId());
                        }
                    }
                    case REJECTED -> {
                        rejected.add(new RejectedTask(taskId, outcome.reason()));
                        if (outcome.recordId() > 0) {
                            events.add(new StatusEvent(outcome.recordId(), RecordStatus.ERROR));
                        }
                    }
                }
            }

            managerRepository.incrementCounters(managerName, successes, failures, rejected.size());

            if (!toReset.isEmpty()) {
                List<Long> reset = recordService.resetInTransaction(toReset);
                reset.forEach(id -> events.add(new StatusEvent(id, RecordStatus.WAITING)));
                log.info("Automatically reset {} records", reset.size());
            }

            log.info("Manager {} returned {} results: {} successes, {} failures, {} rejected",
                    managerName, results.size(), successes, failures, rejected.size());
            return new Batch(new TaskReturnMetadata(accepted, rejected), events);
        });

        for (StatusEvent event : batch.events()) {
            eventBus.notifyStatus(event.recordId(), event.status());
        }
        return batch.metadata();
    }

    private Outcome applyResult(ComputeManager manager, long taskId, TaskResult result) {
        Optional<Task> task = taskRepository.findByIdForUpdate(taskId);
        if (task.isEmpty()) {
            return Outcome.rejected(0, REASON_MISSING);
        }

        ComputeRecord record = recordRepository.findByIdForUpdate(task.get().recordId())
                .orElseThrow(() -> new IllegalStateException("Task " + taskId + " has no record"));
        if (record.status() != RecordStatus.RUNNING) {
            return Outcome.rejected(0, REASON_NOT_RUNNING);
        }
        if (!manager.name().equals(record.managerName())) {
            return Outcome.rejected(0, REASON_OTHER_MANAGER);
        }

        if (result.isSuccess()) {
            JsonNode properties = handlers.get(record.recordType()).extractProperties(record, result);
            recordRepository.appendHistory(new ComputeHistoryEntry(0, record.id(), RecordStatus.COMPLETE,
                    manager.name(), Instant.now(), result.provenance(), result.stdout(), null));
            recordRepository.updateProperties(record.id(), properties);
            finish(record, RecordStatus.COMPLETE);
            return new Outcome(Kind.SUCCESS, record.id(), null, false);
        }

        Optional<ComputeError> failure = result.failure();
        if (failure.isPresent()) {
            applyFailure(record, manager.name(), failure.get(), result);
            boolean reset = resetPolicy.shouldReset(recordRepository.findHistory(record.id()));
            return new Outcome(Kind.FAILURE, record.id(), null, reset);
        }

        log.warn("Task {} from manager {} returned success=false without a failure payload", taskId,
                manager.name());
        applyFailure(record, manager.name(),
                ComputeError.internal("Task returned success=False, but the result is not a failure payload"), result);
        return Outcome.rejected(record.id(), REASON_BAD_FAILURE);
    }

    /**
     * The savepoint of the task has been rolled back; record the failure in a fresh one.
     */
    private Outcome applyInternalFailure(ComputeManager manager, long taskId, String message) {
        try {
            return db.withSavepoint(c -> {
                Optional<Task> task = taskRepository.findByIdForUpdate(taskId);
                if (task.isEmpty()) {
                    return Outcome.rejected(0, REASON_INTERNAL);
                }
                Optional<ComputeRecord> record = recordRepository.findByIdForUpdate(task.get().recordId());
                if (record.isEmpty() || record.get().status() != RecordStatus.RUNNING
                        || !manager.name().equals(record.get().managerName())) {
                    return Outcome.rejected(0, REASON_INTERNAL);
                }
                applyFailure(record.get(), manager.name(), ComputeError.internal(message), null);
                return Outcome.rejected(record.get().id(), REASON_INTERNAL);
            });
        } catch (RuntimeException e) {
            log.error("Unable to record internal error for task {}", taskId, e);
            return Outcome.rejected(0, REASON_INTERNAL);
        }
    }

    private void applyFailure(ComputeRecord record, String managerName, ComputeError error, TaskResult result) {
        recordRepository.appendHistory(new ComputeHistoryEntry(0, record.id(), RecordStatus.ERROR, managerName,
                Instant.now(),
                result != null ? result.provenance() : null,
                result != null ? result.stdout() : null,
                error));
        finish(record, RecordStatus.ERROR);
    }

    private void finish(ComputeRecord record, RecordStatus status) {
        if (!record.status().canTransitionTo(status)) {
            throw new InvalidStateTransitionException(record.id(), record.status(), status);
        }
        recordRepository.updateStatus(record.id(), status, null);
        taskRepository.deleteByRecordId(record.id());
    }
}
