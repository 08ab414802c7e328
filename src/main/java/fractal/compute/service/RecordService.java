package fractal.compute.service;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.core.RecordEventBus;
import fractal.compute.exception.FractalException;
import fractal.compute.exception.MissingDataException;
import fractal.compute.model.ComputeHistoryEntry;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.InsertResult;
import fractal.compute.model.RecordChild;
import fractal.compute.model.RecordStatus;
import fractal.compute.model.ServiceQueueEntry;
import fractal.compute.model.Task;
import fractal.compute.model.TaskPriority;
import fractal.compute.record.RecordHandlerRegistry;
import fractal.compute.record.RecordTypeHandler;
import fractal.compute.repository.RecordRepository;
import fractal.compute.repository.ServiceRepository;
import fractal.compute.repository.TaskRepository;
import fractal.compute.store.Database;
import fractal.compute.util.Jsons;
import fractal.compute.workflow.ServiceDriverRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.LinkedHashMap;

/**
 * Service layer for records: creation with deduplication, lookups and the manual
 * status operations (reset, cancel, invalidate, delete, ...).
 *
 * <p>
 * Status operations silently skip records whose current status does not allow the
 * change and return the ids that were actually changed. Every change keeps the queue
 * consistent: a record has a task exactly while it is waiting or running.
 */
public class RecordService {

    private static final Logger log = LoggerFactory.getLogger(RecordService.class);

    private final Database db;
    private final RecordRepository recordRepository;
    private final TaskRepository taskRepository;
    private final ServiceRepository serviceRepository;
    private final RecordHandlerRegistry handlers;
    private final ServiceDriverRegistry drivers;
    private final RecordEventBus eventBus;

    public RecordService(Database db, RecordRepository recordRepository, TaskRepository taskRepository,
            ServiceRepository serviceRepository, RecordHandlerRegistry handlers, ServiceDriverRegistry drivers,
            RecordEventBus eventBus) {
        this.db = db;
        this.recordRepository = recordRepository;
        this.taskRepository = taskRepository;
        this.serviceRepository = serviceRepository;
        this.handlers = handlers;
        this.drivers = drivers;
        this.eventBus = eventBus;
    }

    /**
     * Add records of one type.
     *
     * @param recordType     record type tag
     * @param specifications one specification per record
     * @param computeTag     tag managers must serve to claim the task (lower-cased)
     * @param priority       queue priority
     * @param findExisting   reuse an existing record with an identical specification
     */
    public InsertResult addRecords(String recordType, List<JsonNode> specifications, String computeTag,
            TaskPriority priority, boolean findExisting) {
        if (recordType == null || recordType.isBlank()) {
            throw new IllegalArgumentException("recordType is required");
        }
        if (computeTag == null || computeTag.isBlank()) {
            throw new IllegalArgumentException("computeTag is required");
        }
        boolean service = drivers.supports(recordType);
        if (!service && !handlers.supports(recordType)) {
            throw new FractalException("UNKNOWN_RECORD_TYPE", "Unknown record type: " + recordType);
        }

        String tag = computeTag.toLowerCase(Locale.ROOT);
        List<Long> ids = new ArrayList<>();
        List<Integer> inserted = new ArrayList<>();
        List<Integer> existing = new ArrayList<>();

        db.inTransaction(conn -> {
            for (int i = 0; i < specifications.size(); i++) {
                JsonNode spec = specifications.get(i);
                String hash = Jsons.hash(spec);

                if (findExisting) {
                    var found = recordRepository.findExisting(recordType, hash);
                    if (found.isPresent()) {
                        ids.add(found.get());
                        existing.add(i);
                        continue;
                    }
                }

                ComputeRecord record = ComputeRecord.builder()
                        .recordType(recordType)
                        .service(service)
                        .status(RecordStatus.WAITING)
                        .computeTag(tag)
                        .computePriority(priority)
                        .specification(spec)
                        .specificationHash(hash)
                        .createdOn(Instant.now())
                        .build();

                // validate before anything is written
                Set<String> programs = service ? Set.of() : handlers.get(recordType).requiredPrograms(record);

                long id = recordRepository.insert(record);
                if (service) {
                    serviceRepository.insert(new ServiceQueueEntry(id, tag, priority, findExisting, null, null));
                } else {
                    insertTask(id, tag, priority, programs);
                }
                ids.add(id);
                inserted.add(i);
            }
        });

        log.info("Added {} {} records ({} new, {} existing)", ids.size(), recordType, inserted.size(),
                existing.size());
        return new InsertResult(ids, inserted, existing);
    }

    public ComputeRecord get(long recordId) {
        return recordRepository.findById(recordId)
                .orElseThrow(() -> new MissingDataException("Record", recordId));
    }

    public List<ComputeRecord> get(Collection<Long> recordIds) {
        return recordRepository.findByIds(recordIds);
    }

    public List<ComputeHistoryEntry> getHistory(long recordId) {
        get(recordId);
        return recordRepository.findHistory(recordId);
    }

    public List<RecordChild> getChildren(long recordId) {
        return serviceRepository.findChildren(recordId);
    }

    /**
     * Put errored records back in the queue. Resetting a service also resets its
     * errored children and restarts the service from its specification.
     */
    public List<Long> reset(Collection<Long> recordIds) {
        List<Long> changed = db.required(conn -> resetInTransaction(recordIds));
        publish(changed, RecordStatus.WAITING);
        return changed;
    }

    /**
     * Reset within the caller's transaction. The caller publishes notifications.
     */
    List<Long> resetInTransaction(Collection<Long> recordIds) {
        List<Long> changed = new ArrayList<>();
        for (long recordId : new LinkedHashSet<>(recordIds)) {
            ComputeRecord record = recordRepository.findByIdForUpdate(recordId).orElse(null);
            if (record == null || record.status() != RecordStatus.ERROR) {
                continue;
            }
            // children must be read before requeue() clears the links
            List<Long> childIds = new ArrayList<>();
            if (record.isService()) {
                for (RecordChild child : serviceRepository.findChildren(recordId)) {
                    childIds.add(child.childId());
                }
            }

            requeue(record);
            changed.add(recordId);
            changed.addAll(resetInTransaction(childIds));
        }
        return changed;
    }

    public List<Long> cancel(Collection<Long> recordIds) {
        return transition(recordIds, RecordStatus.CANCELLED);
    }

    public List<Long> uncancel(Collection<Long> recordIds) {
        List<Long> changed = db.required(conn -> {
            List<Long> ids = new ArrayList<>();
            for (long recordId : new LinkedHashSet<>(recordIds)) {
                ComputeRecord record = recordRepository.findByIdForUpdate(recordId).orElse(null);
                if (record == null || record.status() != RecordStatus.CANCELLED) {
                    continue;
                }
                requeue(record);
                ids.add(recordId);
            }
            return ids;
        });
        publish(changed, RecordStatus.WAITING);
        return changed;
    }

    public List<Long> invalidate(Collection<Long> recordIds) {
        return transition(recordIds, RecordStatus.INVALID);
    }

    public List<Long> uninvalidate(Collection<Long> recordIds) {
        List<Long> changed = db.required(conn -> {
            List<Long> ids = new ArrayList<>();
            for (long recordId : new LinkedHashSet<>(recordIds)) {
                ComputeRecord record = recordRepository.findByIdForUpdate(recordId).orElse(null);
                if (record == null || record.status() != RecordStatus.INVALID) {
                    continue;
                }
                recordRepository.updateStatus(recordId, RecordStatus.COMPLETE, null);
                ids.add(recordId);
            }
            return ids;
        });
        publish(changed, RecordStatus.COMPLETE);
        return changed;
    }

    /**
     * Soft-delete records. Their tasks are removed from the queue.
     */
    public List<Long> delete(Collection<Long> recordIds) {
        return transition(recordIds, RecordStatus.DELETED);
    }

    /**
     * Put the records currently running on the given managers back in the queue.
     * Used after managers have been deactivated; nothing requeues them automatically.
     */
    public List<Long> resetAssigned(Collection<String> managerNames) {
        List<Long> changed = db.required(conn -> {
            List<Long> ids = new ArrayList<>();
            for (ComputeRecord running : recordRepository.findRunningByManagers(managerNames)) {
                ComputeRecord record = recordRepository.findByIdForUpdate(running.id()).orElse(null);
                if (record == null || record.status() != RecordStatus.RUNNING || record.isService()) {
                    continue;
                }
                recordRepository.updateStatus(record.id(), RecordStatus.WAITING, null);
                taskRepository.setAvailable(record.id(), true);
                ids.add(record.id());
            }
            return ids;
        });
        if (!changed.isEmpty()) {
            log.info("Requeued {} records from managers {}", changed.size(), managerNames);
        }
        publish(changed, RecordStatus.WAITING);
        return changed;
    }

    /**
     * Create the queue entry of a task-backed record.
     */
    void insertTask(long recordId, String tag, TaskPriority priority, Set<String> requiredPrograms) {
        taskRepository.insert(Task.builder()
                .recordId(recordId)
                .tag(tag)
                .priority(priority)
                .requiredPrograms(requiredPrograms)
                .available(true)
                .createdOn(Instant.now())
                .build());
    }

    private void requeue(ComputeRecord record) {
        recordRepository.updateStatus(record.id(), RecordStatus.WAITING, null);
        if (record.isService()) {
            serviceRepository.clear(record.id());
        } else {
            RecordTypeHandler handler = handlers.get(record.recordType());
            taskRepository.deleteByRecordId(record.id());
            insertTask(record.id(), record.computeTag(), record.computePriority(), handler.requiredPrograms(record));
        }
    }

    private List<Long> transition(Collection<Long> recordIds, RecordStatus target) {
        List<Long> changed = db.required(conn -> {
            List<Long> ids = new ArrayList<>();
            for (long recordId : new LinkedHashSet<>(recordIds)) {
                ComputeRecord record = recordRepository.findByIdForUpdate(recordId).orElse(null);
                if (record == null || !record.status().canTransitionTo(target)) {
                    continue;
                }
                recordRepository.updateStatus(recordId, target, null);
                taskRepository.deleteByRecordId(recordId);
                ids.add(recordId);
            }
            return ids;
        });
        log.debug("Records {} -> {}", changed, target);
        publish(changed, target);
        return changed;
    }

    void publish(Collection<Long> recordIds, RecordStatus status) {
        Map<Long, RecordStatus> events = new LinkedHashMap<>();
        for (Long id : recordIds) {
            events.put(id, status);
        }
        events.forEach(eventBus::notifyStatus);
    }
}
