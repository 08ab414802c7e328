package fractal.compute.scheduler;

import fractal.compute.config.ComputeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background periodic jobs:
 * - service iteration (ServiceEngine.iterateServices)
 * - manager heartbeat check (ManagerService.reapStaleManagers)
 *
 * Uses a single-threaded executor so two service iterations never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Runnable serviceIteration;
    private final Runnable managerReaper;
    private final ComputeConfig config;

    private volatile boolean running = false;

    /**
     * @param serviceIteration runnable that iterates services (typically
     *                         ServiceEngine::iterateServices)
     * @param managerReaper    runnable that deactivates managers with missed
     *                         heartbeats (typically ManagerService::reapStaleManagers)
     * @param config           configuration
     */
    public Scheduler(Runnable serviceIteration, Runnable managerReaper, ComputeConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fractal-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.serviceIteration = serviceIteration;
        this.managerReaper = managerReaper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long serviceIntervalMs = config.serviceFrequency().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("service-iteration", serviceIteration),
                serviceIntervalMs,
                serviceIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Service iteration scheduled every {}ms", serviceIntervalMs);

        long heartbeatIntervalMs = config.heartbeatFrequency().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("manager-reaper", managerReaper),
                heartbeatIntervalMs,
                heartbeatIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Manager heartbeat check scheduled every {}ms", heartbeatIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler, waiting up to five seconds for a running job.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
