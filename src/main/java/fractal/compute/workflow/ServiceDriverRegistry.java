package fractal.compute.workflow;

import fractal.compute.exception.FractalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registered service drivers by service type. Driver availability is resolved
 * when the registry is built and does not change afterwards.
 */
public class ServiceDriverRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceDriverRegistry.class);

    private final Map<String, ServiceDriver> drivers = new LinkedHashMap<>();
    private final Map<String, Boolean> availability = new LinkedHashMap<>();

    public ServiceDriverRegistry(List<ServiceDriver> drivers) {
        for (ServiceDriver driver : drivers) {
            if (this.drivers.putIfAbsent(driver.serviceType(), driver) != null) {
                throw new IllegalArgumentException("Driver already registered for " + driver.serviceType());
            }
            boolean available = driver.available();
            availability.put(driver.serviceType(), available);
            if (!available) {
                log.warn("Service driver {} is not available", driver.serviceType());
            }
        }
        log.info("Service drivers: {}", availability);
    }

    public boolean supports(String serviceType) {
        return drivers.containsKey(serviceType);
    }

    public boolean isAvailable(String serviceType) {
        return availability.getOrDefault(serviceType, false);
    }

    public ServiceDriver get(String serviceType) {
        ServiceDriver driver = drivers.get(serviceType);
        if (driver == null) {
            throw new FractalException("UNKNOWN_SERVICE_TYPE", "No driver for service type: " + serviceType);
        }
        return driver;
    }

    public Set<String> serviceTypes() {
        return Collections.unmodifiableSet(drivers.keySet());
    }
}
