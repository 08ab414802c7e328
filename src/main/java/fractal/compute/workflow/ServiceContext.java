package fractal.compute.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.exception.ServiceIterationException;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordChild;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Everything a driver may look at during one step.
 */
public final class ServiceContext {

    private final ComputeRecord record;
    private final JsonNode state;
    private final List<DependencyResult> dependencies;
    private final Supplier<List<RecordChild>> children;
    private final Supplier<Map<Long, JsonNode>> childProperties;

    public ServiceContext(ComputeRecord record, JsonNode state, List<DependencyResult> dependencies,
            Supplier<List<RecordChild>> children, Supplier<Map<Long, JsonNode>> childProperties) {
        this.record = record;
        this.state = state;
        this.dependencies = List.copyOf(dependencies);
        this.children = children;
        this.childProperties = childProperties;
    }

    public ComputeRecord record() {
        return record;
    }

    public JsonNode specification() {
        return record.specification();
    }

    /**
     * Service state as persisted after the previous step, null before initialization.
     */
    public JsonNode state() {
        return state;
    }

    /**
     * Sub-records requested by the previous step.
     */
    public List<DependencyResult> dependencies() {
        return dependencies;
    }

    /**
     * Every sub-record this service has ever requested.
     */
    public List<RecordChild> children() {
        return children.get();
    }

    /**
     * Stored properties of every child, by child record id.
     */
    public Map<Long, JsonNode> childProperties() {
        return childProperties.get();
    }

    /**
     * Fail the step unless every dependency completed successfully.
     */
    public void requireCompleteDependencies() {
        for (DependencyResult dep : dependencies) {
            if (!dep.isComplete()) {
                throw new ServiceIterationException(
                        "Sub-record " + dep.recordId() + " (" + dep.recordType() + ") is " + dep.status()
                                + ", expected COMPLETE");
            }
        }
    }
}
