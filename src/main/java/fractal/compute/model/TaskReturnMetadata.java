package fractal.compute.model;

import java.util.List;

/**
 * Outcome of a result submission.
 *
 * @param acceptedIds ids of tasks whose results were applied (successes and failures)
 * @param rejected    tasks whose results were rejected, with the reason
 */
public record TaskReturnMetadata(
        List<Long> acceptedIds,
        List<RejectedTask> rejected) {

    public TaskReturnMetadata {
        acceptedIds = List.copyOf(acceptedIds);
        rejected = List.copyOf(rejected);
    }

    public record RejectedTask(long taskId, String reason) {
    }

    public boolean isRejected(long taskId) {
        return rejected.stream().anyMatch(r -> r.taskId() == taskId);
    }

    public String rejectionReason(long taskId) {
        return rejected.stream()
                .filter(r -> r.taskId() == taskId)
                .map(RejectedTask::reason)
                .findFirst()
                .orElse(null);
    }
}
