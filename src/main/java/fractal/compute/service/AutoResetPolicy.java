package fractal.compute.service;

import fractal.compute.config.AutoResetConfig;
import fractal.compute.model.ComputeError;
import fractal.compute.model.ComputeHistoryEntry;
import fractal.compute.model.RecordStatus;

import java.util.List;

/**
 * Decides whether a record that has just failed is put back in the queue.
 *
 * <p>
 * The decision depends only on the record's compute history and the configuration:
 * <ul>
 * <li>the latest history entry must be a failure reported by a manager, not an
 * {@code internal_fractal_error};</li>
 * <li>if its error type has a limit, the number of failures of that type (or of all
 * failures, with {@code onlyNew}) must not exceed it;</li>
 * <li>an error type without a limit is reset only when {@code maxResetAttempts} is set;</li>
 * <li>the total number of failures must not exceed {@code maxResetAttempts}.</li>
 * </ul>
 * With {@code maxResetAttempts = n} a record that keeps failing is therefore reset
 * exactly {@code n} times.
 */
public final class AutoResetPolicy {

    private final AutoResetConfig config;

    public AutoResetPolicy(AutoResetConfig config) {
        this.config = config;
    }

    public boolean shouldReset(List<ComputeHistoryEntry> history) {
        if (!config.enabled() || history.isEmpty()) {
            return false;
        }

        ComputeHistoryEntry latest = history.get(history.size() - 1);
        if (latest.status() != RecordStatus.ERROR || latest.error() == null) {
            return false;
        }

        String errorType = latest.error().errorType();
        if (ComputeError.INTERNAL_ERROR.equals(errorType)) {
            return false;
        }
        long totalFailures = history.stream().filter(ComputeHistoryEntry::isError).count();

        Integer typeLimit = config.errorTypeLimits().get(errorType);
        if (typeLimit == null) {
            if (config.maxResetAttempts() == null) {
                return false;
            }
        } else {
            long counted = config.onlyNew()
                    ? totalFailures
                    : history.stream()
                            .filter(ComputeHistoryEntry::isError)
                            .filter(e -> e.error() != null && errorType.equals(e.error().errorType()))
                            .count();
            if (counted > typeLimit) {
                return false;
            }
        }

        Integer maxAttempts = config.maxResetAttempts();
        return maxAttempts == null || totalFailures <= maxAttempts;
    }
}
