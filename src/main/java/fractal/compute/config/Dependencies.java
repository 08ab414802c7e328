package fractal.compute.config;

import fractal.compute.core.RecordEventBus;
import fractal.compute.record.RecordHandlerRegistry;
import fractal.compute.repository.ManagerRepository;
import fractal.compute.repository.RecordRepository;
import fractal.compute.repository.ServiceRepository;
import fractal.compute.repository.TaskRepository;
import fractal.compute.scheduler.Scheduler;
import fractal.compute.service.ManagerService;
import fractal.compute.service.RecordService;
import fractal.compute.service.TaskCompletionService;
import fractal.compute.service.TaskService;
import fractal.compute.store.Database;
import fractal.compute.store.JdbcManagerRepository;
import fractal.compute.store.JdbcRecordRepository;
import fractal.compute.store.JdbcServiceRepository;
import fractal.compute.store.JdbcTaskRepository;
import fractal.compute.workflow.ServiceDriver;
import fractal.compute.workflow.ServiceDriverRegistry;
import fractal.compute.workflow.ServiceEngine;
import fractal.compute.workflow.gridoptimization.GridOptimizationDriver;
import fractal.compute.workflow.torsiondrive.TorsionDriveDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ComputeConfig.fromEnv());
 * deps.startScheduler(); // periodic service iteration and heartbeat checks
 * TaskService taskService = deps.taskService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ComputeConfig config;
    private final Database database;
    private final RecordEventBus eventBus;

    private final RecordRepository recordRepository;
    private final TaskRepository taskRepository;
    private final ManagerRepository managerRepository;
    private final ServiceRepository serviceRepository;

    private final RecordHandlerRegistry handlers;
    private final ServiceDriverRegistry drivers;

    private final RecordService recordService;
    private final TaskService taskService;
    private final TaskCompletionService taskCompletionService;
    private final ManagerService managerService;
    private final ServiceEngine serviceEngine;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(ComputeConfig config, RecordHandlerRegistry handlers, List<ServiceDriver> drivers) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.eventBus = new RecordEventBus();

        // Repositories
        this.recordRepository = new JdbcRecordRepository(database);
        this.taskRepository = new JdbcTaskRepository(database);
        this.managerRepository = new JdbcManagerRepository(database);
        this.serviceRepository = new JdbcServiceRepository(database);

        // Strategies
        this.handlers = handlers;
        this.drivers = new ServiceDriverRegistry(drivers);

        // Services
        this.recordService = new RecordService(database, recordRepository, taskRepository, serviceRepository,
                handlers, this.drivers, eventBus);
        this.taskService = new TaskService(database, taskRepository, recordRepository, managerRepository,
                handlers, config, eventBus);
        this.taskCompletionService = new TaskCompletionService(database, taskRepository, recordRepository,
                managerRepository, recordService, handlers, config, eventBus);
        this.managerService = new ManagerService(database, managerRepository, config);
        this.serviceEngine = new ServiceEngine(database, recordRepository, serviceRepository, recordService,
                this.drivers, eventBus, config);

        log.info("Dependencies initialized successfully (record types: {}, services: {})",
                handlers.all().size(), this.drivers.serviceTypes());
    }

    /**
     * Create dependencies with the given config and the built-in record types and drivers.
     */
    public static Dependencies create(ComputeConfig config) {
        return create(config, RecordHandlerRegistry.defaults(), defaultDrivers());
    }

    /**
     * Create dependencies with custom record type handlers and service drivers.
     */
    public static Dependencies create(ComputeConfig config, RecordHandlerRegistry handlers,
            List<ServiceDriver> drivers) {
        return new Dependencies(config, handlers, drivers);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(ComputeConfig.fromEnv());
    }

    public static List<ServiceDriver> defaultDrivers() {
        return List.of(new TorsionDriveDriver(), new GridOptimizationDriver());
    }

    // Getters
    public ComputeConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public RecordEventBus eventBus() {
        return eventBus;
    }

    public RecordRepository recordRepository() {
        return recordRepository;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public ManagerRepository managerRepository() {
        return managerRepository;
    }

    public ServiceRepository serviceRepository() {
        return serviceRepository;
    }

    public RecordHandlerRegistry handlers() {
        return handlers;
    }

    public ServiceDriverRegistry drivers() {
        return drivers;
    }

    public RecordService recordService() {
        return recordService;
    }

    public TaskService taskService() {
        return taskService;
    }

    public TaskCompletionService taskCompletionService() {
        return taskCompletionService;
    }

    public ManagerService managerService() {
        return managerService;
    }

    public ServiceEngine serviceEngine() {
        return serviceEngine;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(serviceEngine::iterateServices, managerService::reapStaleManagers, config);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
