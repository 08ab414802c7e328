package fractal.compute.service;

import fractal.compute.config.ComputeConfig;
import fractal.compute.exception.ComputeManagerException;
import fractal.compute.model.ComputeManager;
import fractal.compute.model.ManagerStatus;
import fractal.compute.repository.ManagerRepository;
import fractal.compute.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Service layer for compute managers.
 * Handles activation, heartbeats and staleness detection.
 */
public class ManagerService {

    private static final Logger log = LoggerFactory.getLogger(ManagerService.class);

    private final Database db;
    private final ManagerRepository managerRepository;
    private final ComputeConfig config;

    public ManagerService(Database db, ManagerRepository managerRepository, ComputeConfig config) {
        this.db = db;
        this.managerRepository = managerRepository;
        this.config = config;
    }

    /**
     * Register a new active manager.
     *
     * @param name     unique manager name
     * @param programs installed programs and their versions (versions may be null)
     * @param tags     tags the manager serves, in priority order; {@code "*"} serves every tag
     */
    public ComputeManager activate(String name, Map<String, String> programs, List<String> tags) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("Manager " + name + " does not serve any tags");
        }

        Map<String, String> normalizedPrograms = new LinkedHashMap<>();
        programs.forEach((program, version) -> normalizedPrograms.put(program.toLowerCase(Locale.ROOT), version));
        List<String> normalizedTags = new ArrayList<>(new LinkedHashSet<>(tags.stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList()));

        Instant now = Instant.now();
        ComputeManager manager = ComputeManager.builder()
                .name(name)
                .status(ManagerStatus.ACTIVE)
                .programs(normalizedPrograms)
                .tags(normalizedTags)
                .createdOn(now)
                .modifiedOn(now)
                .lastHeartbeat(now)
                .build();

        db.inTransaction(conn -> {
            if (managerRepository.findByNameForUpdate(name).isPresent()) {
                throw new ComputeManagerException("Manager already exists: " + name);
            }
            managerRepository.insert(manager);
        });

        log.info("Activated manager {} (tags={}, programs={})", name, normalizedTags, normalizedPrograms.keySet());
        return manager;
    }

    /**
     * Process a heartbeat from a manager.
     *
     * @throws ComputeManagerException if the manager does not exist or is not active
     */
    public void heartbeat(String name) {
        if (!managerRepository.heartbeat(name, Instant.now())) {
            ComputeManager manager = managerRepository.findByName(name)
                    .orElseThrow(() -> ComputeManagerException.doesNotExist(name));
            throw ComputeManagerException.notActive(manager.name());
        }
        log.debug("Heartbeat from manager {}", name);
    }

    /**
     * Deactivate managers. Tasks they are running stay assigned to them.
     *
     * @return names of managers that were active
     */
    public List<String> deactivate(Collection<String> names) {
        List<String> deactivated = db.required(conn -> {
            List<String> result = new ArrayList<>();
            for (String name : names) {
                if (managerRepository.deactivate(name)) {
                    result.add(name);
                }
            }
            return result;
        });
        if (!deactivated.isEmpty()) {
            log.info("Deactivated managers: {}", deactivated);
        }
        return deactivated;
    }

    /**
     * Deactivate active managers that missed too many heartbeats.
     *
     * @return names of deactivated managers
     */
    public List<String> reapStaleManagers() {
        Instant cutoff = Instant.now().minus(config.heartbeatTimeout());
        List<String> stale = managerRepository.findStale(cutoff);
        if (stale.isEmpty()) {
            return List.of();
        }
        log.warn("Managers missed heartbeats since {}: {}", cutoff, stale);
        return deactivate(stale);
    }

    public Optional<ComputeManager> findByName(String name) {
        return managerRepository.findByName(name);
    }

    public List<ComputeManager> findAll() {
        return managerRepository.findAll();
    }
}
