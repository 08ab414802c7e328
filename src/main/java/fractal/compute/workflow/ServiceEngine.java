package fractal.compute.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.config.ComputeConfig;
import fractal.compute.core.RecordEventBus;
import fractal.compute.exception.InvalidStateTransitionException;
import fractal.compute.exception.MissingDataException;
import fractal.compute.exception.ServiceIterationException;
import fractal.compute.model.ComputeError;
import fractal.compute.model.ComputeHistoryEntry;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.InsertResult;
import fractal.compute.model.RecordChild;
import fractal.compute.model.RecordStatus;
import fractal.compute.model.ServiceDependency;
import fractal.compute.model.ServiceQueueEntry;
import fractal.compute.repository.RecordRepository;
import fractal.compute.repository.ServiceRepository;
import fractal.compute.service.RecordService;
import fractal.compute.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives service records through their iterations.
 *
 * <p>
 * A service starts waiting, is initialized by its driver and becomes running, then is
 * iterated each time all of its current sub-records have finished. Every step runs in
 * its own transaction with the service record locked; if the driver throws, the step is
 * rolled back and the service goes to error.
 */
public class ServiceEngine {

    private static final Logger log = LoggerFactory.getLogger(ServiceEngine.class);

    public static final String SERVICE_ERROR_TYPE = "service_iteration_error";

    private final Database db;
    private final RecordRepository recordRepository;
    private final ServiceRepository serviceRepository;
    private final RecordService recordService;
    private final ServiceDriverRegistry drivers;
    private final RecordEventBus eventBus;
    private final ComputeConfig config;

    public ServiceEngine(Database db, RecordRepository recordRepository, ServiceRepository serviceRepository,
            RecordService recordService, ServiceDriverRegistry drivers, RecordEventBus eventBus,
            ComputeConfig config) {
        this.db = db;
        this.recordRepository = recordRepository;
        this.serviceRepository = serviceRepository;
        this.recordService = recordService;
        this.drivers = drivers;
        this.eventBus = eventBus;
        this.config = config;
    }

    /**
     * One pass over all services: start waiting services while fewer than the configured
     * maximum are running, then iterate every running service whose sub-records have all
     * finished.
     *
     * @return number of services that were started or iterated
     */
    public int iterateServices() {
        Set<Long> progressed = new LinkedHashSet<>();

        int slots = config.maxActiveServices() - serviceRepository.countRunning();
        if (slots > 0) {
            for (long recordId : serviceRepository.findWaiting(slots)) {
                try {
                    if (initialize(recordId)) {
                        progressed.add(recordId);
                        iterate(recordId);
                    }
                } catch (RuntimeException e) {
                    log.error("Unable to start service {}", recordId, e);
                }
            }
        }

        for (long recordId : serviceRepository.findRunningReady()) {
            try {
                iterate(recordId);
                progressed.add(recordId);
            } catch (RuntimeException e) {
                log.error("Unable to iterate service {}", recordId, e);
            }
        }

        if (!progressed.isEmpty()) {
            log.info("Service pass progressed {} services", progressed.size());
        }
        return progressed.size();
    }

    /**
     * Initialize a waiting service: its driver builds the initial state and the record
     * becomes running.
     *
     * @return true if the service was initialized, false if it was not waiting or the
     *         driver failed (the service is then in error)
     */
    public boolean initialize(long recordId) {
        recordService.get(recordId);
        try {
            boolean initialized = db.required(conn -> {
                ComputeRecord record = lock(recordId);
                if (record.status() != RecordStatus.WAITING) {
                    return false;
                }
                ServiceDriver driver = driverFor(record);
                serviceEntry(recordId);

                ServiceIteration init = driver.initialize(new ServiceContext(record, null, List.of(),
                        () -> serviceRepository.findChildren(recordId), () -> childProperties(recordId)));

                transition(record, RecordStatus.RUNNING);
                recordRepository.appendHistory(new ComputeHistoryEntry(0, recordId, RecordStatus.RUNNING, null,
                        Instant.now(), driver.provenance(), init.stdout(), null));
                serviceRepository.updateState(recordId, init.state());
                return true;
            });
            if (initialized) {
                log.info("Service {} initialized", recordId);
                eventBus.notifyStatus(recordId, RecordStatus.RUNNING);
            }
            return initialized;
        } catch (RuntimeException e) {
            markError(recordId, e);
            return false;
        }
    }

    /**
     * Run one iteration of a running service. Nothing happens while any of its current
     * sub-records is still waiting or running.
     *
     * @return true if the service finished with this iteration; false if it submitted
     *         more sub-records, was not running or not ready, or failed (the service is
     *         then in error)
     */
    public boolean iterate(long recordId) {
        recordService.get(recordId);
        try {
            boolean done = db.required(conn -> {
                ComputeRecord record = lock(recordId);
                if (record.status() != RecordStatus.RUNNING) {
                    return false;
                }
                List<DependencyResult> dependencies = dependencyResults(recordId);
                if (dependencies.stream().anyMatch(d -> d.status().isPending())) {
                    log.debug("Service {} still has unfinished sub-records", recordId);
                    return false;
                }
                ServiceDriver driver = driverFor(record);
                ServiceQueueEntry entry = serviceEntry(recordId);

                ServiceContext context = new ServiceContext(record, entry.serviceState(), dependencies,
                        () -> serviceRepository.findChildren(recordId), () -> childProperties(recordId));
                ServiceIteration iteration = driver.iterate(context);
                return apply(record, entry, iteration);
            });
            if (done) {
                log.info("Service {} complete", recordId);
                eventBus.notifyStatus(recordId, RecordStatus.COMPLETE);
            }
            return done;
        } catch (RuntimeException e) {
            markError(recordId, e);
            return false;
        }
    }

    private boolean apply(ComputeRecord record, ServiceQueueEntry entry, ServiceIteration iteration) {
        long recordId = record.id();
        ComputeHistoryEntry history = latestHistory(recordId);

        if (!iteration.isDone()) {
            int base = serviceRepository.findChildren(recordId).size();
            List<ServiceDependency> dependencies = new ArrayList<>();
            List<RecordChild> children = new ArrayList<>();
            int position = 0;
            for (SubTaskRequest request : iteration.nextTasks()) {
                InsertResult inserted = recordService.addRecords(request.recordType(),
                        List.of(request.specification()), entry.computeTag(), entry.computePriority(),
                        entry.findExisting());
                long childId = inserted.singleId();
                dependencies.add(new ServiceDependency(recordId, childId, position, request.extras()));
                children.add(new RecordChild(recordId, childId, request.childKey(), base + position));
                position++;
            }

            serviceRepository.replaceDependencies(recordId, dependencies);
            serviceRepository.addChildren(children);
            serviceRepository.updateState(recordId, iteration.state());
            if (history != null && iteration.stdout() != null) {
                recordRepository.updateHistory(history.id(), RecordStatus.RUNNING,
                        appendOutput(history.stdout(), iteration.stdout()), null);
            }
            log.debug("Service {} submitted {} sub-records", recordId, dependencies.size());
            return false;
        }

        serviceRepository.updateState(recordId, iteration.state());
        serviceRepository.replaceDependencies(recordId, List.of());
        if (iteration.properties() != null) {
            recordRepository.updateProperties(recordId, iteration.properties());
        }
        transition(record, RecordStatus.COMPLETE);
        if (history != null) {
            recordRepository.updateHistory(history.id(), RecordStatus.COMPLETE,
                    appendOutput(history.stdout(), iteration.stdout()), null);
        }
        return true;
    }

    /**
     * Put a service in error after a failed step. Runs in a new transaction, after the
     * failed step has been rolled back.
     */
    private void markError(long recordId, RuntimeException cause) {
        log.error("Service {} failed", recordId, cause);
        ComputeError error = new ComputeError(SERVICE_ERROR_TYPE, describe(cause));

        boolean changed = db.required(conn -> {
            ComputeRecord record = recordRepository.findByIdForUpdate(recordId).orElse(null);
            if (record == null || !record.status().isPending()) {
                return false;
            }
            ComputeHistoryEntry history = latestHistory(recordId);
            if (history != null && history.status() == RecordStatus.RUNNING) {
                recordRepository.updateHistory(history.id(), RecordStatus.ERROR, history.stdout(), error);
            } else {
                recordRepository.appendHistory(new ComputeHistoryEntry(0, recordId, RecordStatus.ERROR, null,
                        Instant.now(), null, null, error));
            }
            recordRepository.updateStatus(recordId, RecordStatus.ERROR, null);
            return true;
        });
        if (changed) {
            eventBus.notifyStatus(recordId, RecordStatus.ERROR);
        }
    }

    private ComputeRecord lock(long recordId) {
        ComputeRecord record = recordRepository.findByIdForUpdate(recordId)
                .orElseThrow(() -> new MissingDataException("Record", recordId));
        if (!record.isService()) {
            throw new IllegalArgumentException("Record " + recordId + " is not a service");
        }
        return record;
    }

    private ServiceDriver driverFor(ComputeRecord record) {
        ServiceDriver driver = drivers.get(record.recordType());
        if (!drivers.isAvailable(record.recordType())) {
            throw new ServiceIterationException("Service driver for " + record.recordType() + " is not available");
        }
        return driver;
    }

    private ServiceQueueEntry serviceEntry(long recordId) {
        return serviceRepository.findByRecordId(recordId)
                .orElseThrow(() -> new MissingDataException("Service", recordId));
    }

    private List<DependencyResult> dependencyResults(long serviceId) {
        List<ServiceDependency> dependencies = serviceRepository.findDependencies(serviceId);
        Map<Long, ComputeRecord> records = recordRepository.findByIds(
                dependencies.stream().map(ServiceDependency::recordId).collect(Collectors.toCollection(LinkedHashSet::new)))
                .stream()
                .collect(Collectors.toMap(ComputeRecord::id, Function.identity()));

        List<DependencyResult> results = new ArrayList<>();
        for (ServiceDependency dep : dependencies) {
            ComputeRecord child = records.get(dep.recordId());
            if (child == null) {
                throw new ServiceIterationException("Sub-record " + dep.recordId() + " no longer exists");
            }
            results.add(new DependencyResult(child.id(), child.recordType(), child.status(), child.properties(),
                    dep.extras()));
        }
        return results;
    }

    private Map<Long, JsonNode> childProperties(long serviceId) {
        Set<Long> childIds = new LinkedHashSet<>();
        for (RecordChild child : serviceRepository.findChildren(serviceId)) {
            childIds.add(child.childId());
        }
        Map<Long, JsonNode> properties = new HashMap<>();
        for (ComputeRecord child : recordRepository.findByIds(childIds)) {
            properties.put(child.id(), child.properties());
        }
        return properties;
    }

    private ComputeHistoryEntry latestHistory(long recordId) {
        List<ComputeHistoryEntry> history = recordRepository.findHistory(recordId);
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    private void transition(ComputeRecord record, RecordStatus target) {
        if (!record.status().canTransitionTo(target)) {
            throw new InvalidStateTransitionException(record.id(), record.status(), target);
        }
        recordRepository.updateStatus(record.id(), target, null);
    }

    private static String appendOutput(String existing, String addition) {
        if (addition == null || addition.isEmpty()) {
            return existing;
        }
        if (existing == null || existing.isEmpty()) {
            return addition;
        }
        return existing + "\n" + addition;
    }

    private static String describe(RuntimeException e) {
        if (e instanceof ServiceIterationException) {
            return e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
