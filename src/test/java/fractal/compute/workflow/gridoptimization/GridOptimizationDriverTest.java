package fractal.compute.workflow.gridoptimization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fractal.compute.TestData;
import fractal.compute.exception.ServiceIterationException;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordStatus;
import fractal.compute.util.Jsons;
import fractal.compute.workflow.DependencyResult;
import fractal.compute.workflow.ServiceContext;
import fractal.compute.workflow.ServiceIteration;
import fractal.compute.workflow.SubTaskRequest;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GridOptimizationDriverTest {

    private final GridOptimizationDriver driver = new GridOptimizationDriver();
    private long nextChildId = 100;

    private static ServiceContext context(JsonNode spec, JsonNode state, List<DependencyResult> deps) {
        ComputeRecord record = ComputeRecord.builder()
                .id(1)
                .recordType(GridOptimizationDriver.SERVICE_TYPE)
                .service(true)
                .status(RecordStatus.RUNNING)
                .specification(spec)
                .build();
        return new ServiceContext(record, state, deps, List::of, Map::of);
    }

    private List<DependencyResult> run(List<SubTaskRequest> requests) {
        List<DependencyResult> results = new ArrayList<>();
        for (SubTaskRequest request : requests) {
            JsonNode set = request.specification().path("keywords").path("constraints").path("set");
            double energy = set.isArray() && !set.isEmpty()
                    ? -1.0 + 0.01 * Math.cos(Math.toRadians(set.get(0).path("value").asDouble()))
                    : -1.5;
            ObjectNode properties = Jsons.object();
            properties.put("final_energy", energy);
            properties.set("final_molecule", request.specification().get("initial_molecule"));
            results.add(new DependencyResult(nextChildId++, request.recordType(), RecordStatus.COMPLETE,
                    properties, request.extras()));
        }
        return results;
    }

    @Test
    void initializeCountsGridPoints() {
        JsonNode spec = TestData.gridOptimization(false, -90, 0, 90);
        ServiceIteration init = driver.initialize(context(spec, null, List.of()));
        assertTrue(init.stdout().contains("3 grid points"));
    }

    @Test
    void initializeRejectsMissingScans() {
        ObjectNode spec = (ObjectNode) TestData.gridOptimization(false, 0);
        ((ObjectNode) spec.get("keywords")).putArray("scans");
        assertThrows(ServiceIterationException.class, () -> driver.initialize(context(spec, null, List.of())));
    }

    @Test
    @DisplayName("Without pre-optimization the scan starts at the step nearest the molecule")
    void scanStartsNearestToMolecule() {
        JsonNode spec = TestData.gridOptimization(false, -90, 0, 90);
        JsonNode state = driver.initialize(context(spec, null, List.of())).state();

        ServiceIteration first = driver.iterate(context(spec, state, List.of()));

        assertEquals(1, first.nextTasks().size());
        SubTaskRequest start = first.nextTasks().get(0);
        assertEquals("2", start.childKey());
        JsonNode constraint = start.specification().path("keywords").path("constraints").path("set").get(0);
        assertEquals("dihedral", constraint.path("type").asText());
        assertEquals(90.0, constraint.path("value").asDouble(), 1e-12);
    }

    @Test
    void scanGrowsOutwardsUntilEveryPointIsDone() {
        JsonNode spec = TestData.gridOptimization(false, -90, 0, 90);
        ServiceIteration step = driver.initialize(context(spec, null, List.of()));
        step = driver.iterate(context(spec, step.state(), List.of()));

        List<String> submitted = new ArrayList<>();
        int iterations = 1;
        while (!step.isDone()) {
            step.nextTasks().forEach(r -> submitted.add(r.childKey()));
            step = driver.iterate(context(spec, step.state(), run(step.nextTasks())));
            iterations++;
        }

        assertEquals(List.of("2", "1", "0"), submitted);
        assertEquals(4, iterations);
        JsonNode energies = step.properties().get("final_energies");
        assertEquals(3, energies.size());
        assertEquals(-0.99, energies.get("1").asDouble(), 1e-12);
        assertFalse(step.properties().has("preoptimization_energy"));
        assertEquals(TestData.molecule(), step.properties().get("starting_molecule"));
    }

    @Test
    @DisplayName("Pre-optimization runs unconstrained before the scan")
    void preoptimizationFirst() {
        JsonNode spec = TestData.gridOptimization(true, -90, 0, 90);
        ServiceIteration init = driver.initialize(context(spec, null, List.of()));

        ServiceIteration first = driver.iterate(context(spec, init.state(), List.of()));
        assertEquals(1, first.nextTasks().size());
        SubTaskRequest preopt = first.nextTasks().get(0);
        assertEquals(GridOptimizationDriver.PREOPTIMIZATION_KEY, preopt.childKey());
        assertTrue(preopt.specification().path("keywords").path("constraints").isMissingNode());

        ServiceIteration second = driver.iterate(context(spec, first.state(), run(first.nextTasks())));
        assertEquals(List.of("2"), second.nextTasks().stream().map(SubTaskRequest::childKey).toList());

        ServiceIteration step = second;
        for (int i = 0; i < 10 && !step.isDone(); i++) {
            step = driver.iterate(context(spec, step.state(), run(step.nextTasks())));
        }
        assertTrue(step.isDone());
        assertEquals(-1.5, step.properties().get("preoptimization_energy").asDouble(), 1e-12);
        assertEquals(3, step.properties().get("final_energies").size());
    }

    @Test
    void relativeScanIsOffsetFromTheStartingValue() {
        ObjectNode spec = (ObjectNode) TestData.gridOptimization(false, -10, 0, 10);
        ObjectNode scan = (ObjectNode) spec.get("keywords").get("scans").get(0);
        scan.put("step_type", "relative");
        JsonNode state = driver.initialize(context(spec, null, List.of())).state();

        ServiceIteration first = driver.iterate(context(spec, state, List.of()));
        assertEquals("1", first.nextTasks().get(0).childKey());

        ServiceIteration second = driver.iterate(context(spec, first.state(), run(first.nextTasks())));
        List<Double> values = second.nextTasks().stream()
                .map(r -> r.specification().path("keywords").path("constraints").path("set").get(0)
                        .path("value").asDouble())
                .sorted()
                .toList();
        assertEquals(2, values.size());
        assertEquals(80.0, values.get(0), 1e-6);
        assertEquals(100.0, values.get(1), 1e-6);
    }

    @Test
    void failedGridPointFailsTheIteration() {
        JsonNode spec = TestData.gridOptimization(false, -90, 0, 90);
        JsonNode state = driver.initialize(context(spec, null, List.of())).state();
        ServiceIteration first = driver.iterate(context(spec, state, List.of()));

        DependencyResult failed = new DependencyResult(7, "optimization", RecordStatus.ERROR, null,
                first.nextTasks().get(0).extras());
        assertThrows(ServiceIterationException.class,
                () -> driver.iterate(context(spec, first.state(), List.of(failed))));
    }

    @Test
    void keysAndNeighbours() {
        List<ScanDimension> scans = GridOptimizationDriver.scans(Jsons.read("""
                {"keywords": {"scans": [
                  {"type": "distance", "indices": [0, 1], "steps": [1.0, 1.5, 2.0]},
                  {"type": "angle", "indices": [0, 1, 2], "steps": [90, 120]}]}}
                """));

        assertEquals("2,0", GridOptimizationDriver.key(new int[] { 2, 0 }));
        assertArrayEquals(new int[] { 2, 0 }, GridOptimizationDriver.parse("2,0"));

        List<String> corner = GridOptimizationDriver.neighbours(new int[] { 0, 0 }, scans).stream()
                .map(GridOptimizationDriver::key)
                .toList();
        assertEquals(List.of("1,0", "0,1"), corner);

        List<String> middle = GridOptimizationDriver.neighbours(new int[] { 1, 1 }, scans).stream()
                .map(GridOptimizationDriver::key)
                .toList();
        assertEquals(List.of("0,1", "2,1", "1,0"), middle);
    }
}
