package fractal.compute.workflow.torsiondrive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fractal.compute.TestData;
import fractal.compute.exception.ServiceIterationException;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordChild;
import fractal.compute.model.RecordStatus;
import fractal.compute.util.Jsons;
import fractal.compute.workflow.DependencyResult;
import fractal.compute.workflow.ServiceContext;
import fractal.compute.workflow.ServiceIteration;
import fractal.compute.workflow.SubTaskRequest;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TorsionDriveDriverTest {

    private final TorsionDriveDriver driver = new TorsionDriveDriver();

    private final List<RecordChild> children = new ArrayList<>();
    private final Map<Long, JsonNode> childProperties = new HashMap<>();
    private long nextChildId = 100;

    private ServiceContext context(JsonNode spec, JsonNode state, List<DependencyResult> deps) {
        ComputeRecord record = ComputeRecord.builder()
                .id(1)
                .recordType(TorsionDriveDriver.SERVICE_TYPE)
                .service(true)
                .status(RecordStatus.RUNNING)
                .specification(spec)
                .build();
        return new ServiceContext(record, state, deps, () -> List.copyOf(children), () -> Map.copyOf(childProperties));
    }

    private static double constraintValue(SubTaskRequest request) {
        return request.specification().path("keywords").path("constraints").path("set").get(0).path("value")
                .asDouble();
    }

    /**
     * "Run" the requested optimizations: the energy depends only on the constrained dihedral.
     */
    private List<DependencyResult> run(List<SubTaskRequest> requests) {
        List<DependencyResult> results = new ArrayList<>();
        for (SubTaskRequest request : requests) {
            long id = nextChildId++;
            double energy = -1.0 + 0.01 * Math.cos(Math.toRadians(constraintValue(request)));
            ObjectNode properties = Jsons.object();
            properties.put("final_energy", energy);
            properties.set("final_molecule", request.specification().get("initial_molecule"));
            children.add(new RecordChild(1, id, request.childKey(), children.size()));
            childProperties.put(id, properties);
            results.add(new DependencyResult(id, request.recordType(), RecordStatus.COMPLETE, properties,
                    request.extras()));
        }
        return results;
    }

    @Test
    void initializeValidatesSpecification() {
        JsonNode spec = TestData.torsionDrive(90);
        ServiceIteration init = driver.initialize(context(spec, null, List.of()));
        assertTrue(init.nextTasks().isEmpty());
        assertTrue(init.stdout().contains("4 grid points"));

        ObjectNode noMolecules = (ObjectNode) TestData.torsionDrive(90);
        noMolecules.putArray("initial_molecules");
        assertThrows(ServiceIterationException.class, () -> driver.initialize(context(noMolecules, null, List.of())));
    }

    @Test
    @DisplayName("First iteration optimizes the initial molecule at its nearest grid point")
    void firstIterationSubmitsInitialOptimization() {
        JsonNode spec = TestData.torsionDrive(90);
        JsonNode state = driver.initialize(context(spec, null, List.of())).state();

        ServiceIteration first = driver.iterate(context(spec, state, List.of()));

        assertEquals(1, first.nextTasks().size());
        SubTaskRequest request = first.nextTasks().get(0);
        assertEquals("optimization", request.recordType());
        assertEquals("90", request.childKey());
        assertEquals("90", request.extras().get("grid_key").asText());
        assertEquals(90.0, constraintValue(request), 1e-12);
        assertEquals("dihedral",
                request.specification().path("keywords").path("constraints").path("set").get(0).path("type")
                        .asText());
        assertEquals("tric", request.specification().path("keywords").path("coordsys").asText(),
                "optimization keywords are kept");
        assertEquals(TestData.molecule(), request.specification().get("initial_molecule"));
    }

    @Test
    void resultsPropagateToNeighbours() {
        JsonNode spec = TestData.torsionDrive(90);
        JsonNode state = driver.initialize(context(spec, null, List.of())).state();
        ServiceIteration first = driver.iterate(context(spec, state, List.of()));

        ServiceIteration second = driver.iterate(context(spec, first.state(), run(first.nextTasks())));

        assertEquals(List.of("0", "180"), second.nextTasks().stream().map(SubTaskRequest::childKey).sorted().toList());
    }

    @Test
    @DisplayName("The drive finishes once every grid point has been reached")
    void driveConverges() {
        JsonNode spec = TestData.torsionDrive(90);
        ServiceIteration step = driver.initialize(context(spec, null, List.of()));
        step = driver.iterate(context(spec, step.state(), List.of()));

        int iterations = 1;
        while (!step.isDone()) {
            assertTrue(iterations++ < 20, "torsion drive must converge");
            step = driver.iterate(context(spec, step.state(), run(step.nextTasks())));
        }

        JsonNode energies = step.properties().get("final_energies");
        assertEquals(4, energies.size());
        assertEquals(-0.99, energies.get("0").asDouble(), 1e-12);
        assertEquals(-1.01, energies.get("180").asDouble(), 1e-12);
        assertEquals(4, step.properties().get("grid_points").asInt());
        assertEquals(4, step.properties().get("optimizations").asInt(), "each grid point optimized once");
    }

    @Test
    void lowerEnergyIsPropagatedAgain() {
        JsonNode spec = TestData.torsionDrive(90);
        JsonNode state = driver.initialize(context(spec, null, List.of())).state();
        ServiceIteration first = driver.iterate(context(spec, state, List.of()));
        ServiceIteration second = driver.iterate(context(spec, first.state(), run(first.nextTasks())));

        // a better geometry turns up at 90 degrees
        ObjectNode better = (ObjectNode) TestData.molecule();
        better.put("comment", "lower energy conformer");
        ObjectNode properties = Jsons.object();
        properties.put("final_energy", -2.0);
        properties.set("final_molecule", better);
        ObjectNode extras = Jsons.object();
        extras.put("grid_key", "90");
        List<DependencyResult> deps = new ArrayList<>(run(second.nextTasks()));
        deps.add(new DependencyResult(999, "optimization", RecordStatus.COMPLETE, properties, extras));

        ServiceIteration third = driver.iterate(context(spec, second.state(), deps));

        List<SubTaskRequest> fromBetter = third.nextTasks().stream()
                .filter(r -> better.equals(r.specification().get("initial_molecule")))
                .toList();
        assertEquals(List.of("0", "180"), fromBetter.stream().map(SubTaskRequest::childKey).sorted().toList());
    }

    @Test
    void incompleteDependencyFailsTheIteration() {
        JsonNode spec = TestData.torsionDrive(90);
        JsonNode state = driver.initialize(context(spec, null, List.of())).state();
        ServiceIteration first = driver.iterate(context(spec, state, List.of()));

        DependencyResult failed = new DependencyResult(5, "optimization", RecordStatus.ERROR, null,
                first.nextTasks().get(0).extras());

        assertThrows(ServiceIterationException.class,
                () -> driver.iterate(context(spec, first.state(), List.of(failed))));
    }

    @Test
    @DisplayName("Final check fails when the kept energies disagree with the optimizations")
    void finalConsistencyCheck() {
        JsonNode spec = TestData.torsionDrive(90);
        ServiceIteration init = driver.initialize(context(spec, null, List.of()));
        ServiceIteration first = driver.iterate(context(spec, init.state(), List.of()));
        List<DependencyResult> firstResults = run(first.nextTasks());

        // tamper with the stored result of the first optimization
        long firstChild = children.get(0).childId();
        ObjectNode tampered = childProperties.get(firstChild).deepCopy();
        tampered.put("final_energy", -5.0);
        childProperties.put(firstChild, tampered);

        assertThrows(ServiceIterationException.class, () -> {
            ServiceIteration step = driver.iterate(context(spec, first.state(), firstResults));
            for (int i = 0; i < 20 && !step.isDone(); i++) {
                step = driver.iterate(context(spec, step.state(), run(step.nextTasks())));
            }
        });
    }
}
