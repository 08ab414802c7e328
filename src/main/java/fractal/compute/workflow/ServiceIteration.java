package fractal.compute.workflow;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * What a driver returns from one step: the complete new state, the next batch of
 * sub-records and any output to append to the service's stdout.
 * An empty batch from {@code iterate} means the service is finished.
 *
 * @param properties result summary stored on the service record when it finishes
 */
public record ServiceIteration(
        JsonNode state,
        List<SubTaskRequest> nextTasks,
        String stdout,
        JsonNode properties) {

    public ServiceIteration {
        nextTasks = List.copyOf(nextTasks);
    }

    public static ServiceIteration initialized(JsonNode state, String stdout) {
        return new ServiceIteration(state, List.of(), stdout, null);
    }

    public static ServiceIteration submit(JsonNode state, List<SubTaskRequest> nextTasks, String stdout) {
        if (nextTasks.isEmpty()) {
            throw new IllegalArgumentException("A submitting iteration needs at least one sub-task");
        }
        return new ServiceIteration(state, nextTasks, stdout, null);
    }

    public static ServiceIteration done(JsonNode state, JsonNode properties, String stdout) {
        return new ServiceIteration(state, List.of(), stdout, properties);
    }

    public boolean isDone() {
        return nextTasks.isEmpty();
    }
}
