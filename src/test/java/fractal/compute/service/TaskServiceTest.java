package fractal.compute.service;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.TestData;
import fractal.compute.config.ComputeConfig;
import fractal.compute.config.Dependencies;
import fractal.compute.exception.ComputeManagerException;
import fractal.compute.model.ClaimedTask;
import fractal.compute.model.ComputeError;
import fractal.compute.model.ComputeHistoryEntry;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordStatus;
import fractal.compute.model.TaskPriority;
import fractal.compute.model.TaskResult;
import fractal.compute.record.RecordHandlerRegistry;
import fractal.compute.record.RecordTypeHandler;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    /** A record type whose task can never be built. */
    private static final class BrokenHandler implements RecordTypeHandler {
        @Override
        public String recordType() {
            return "broken";
        }

        @Override
        public Set<String> requiredPrograms(ComputeRecord record) {
            return Set.of();
        }

        @Override
        public JsonNode generateTaskFunction(ComputeRecord record) {
            throw new IllegalStateException("cannot build task");
        }

        @Override
        public JsonNode extractProperties(ComputeRecord record, TaskResult result) {
            return result.payload();
        }
    }

    private Dependencies deps;

    @BeforeEach
    void setUp() {
        ComputeConfig config = TestData.config("task-service").withManagerTasksClaimLimit(5);
        deps = Dependencies.create(config, RecordHandlerRegistry.defaults().register(new BrokenHandler()),
                Dependencies.defaultDrivers());
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private List<Long> addSinglepoints(int count, String tag, TaskPriority priority) {
        List<JsonNode> specs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            specs.add(TestData.singlepoint("psi4", "method-" + tag + "-" + priority + "-" + i));
        }
        return deps.recordService().addRecords("singlepoint", specs, tag, priority, false).ids();
    }

    private void activate(String name, List<String> tags, String... programs) {
        Map<String, String> programMap = new LinkedHashMap<>();
        for (String program : programs) {
            programMap.put(program, null);
        }
        deps.managerService().activate(name, programMap, tags);
    }

    @Test
    @DisplayName("Claiming marks records running and owned by the manager")
    void claimMarksRecordsRunning() {
        List<Long> ids = addSinglepoints(3, "*", TaskPriority.NORMAL);
        activate("manager-1", List.of("*"), "psi4");

        List<ClaimedTask> claimed = deps.taskService().claimTasks("manager-1", 10);

        assertEquals(3, claimed.size());
        for (ClaimedTask task : claimed) {
            assertTrue(ids.contains(task.recordId()));
            assertEquals("singlepoint", task.recordType());
            assertEquals(Set.of("psi4"), task.requiredPrograms());
            assertEquals("compute", task.function().get("function").asText());

            ComputeRecord record = deps.recordService().get(task.recordId());
            assertEquals(RecordStatus.RUNNING, record.status());
            assertEquals("manager-1", record.managerName());
            assertFalse(deps.taskService().findById(task.taskId()).orElseThrow().isAvailable());
        }
        assertEquals(0, deps.taskService().countAvailable());
        assertEquals(3, deps.managerService().findByName("manager-1").orElseThrow().claimed());
    }

    @Test
    void claimedTaskKeepsGeneratedFunction() {
        addSinglepoints(1, "*", TaskPriority.NORMAL);
        activate("manager-1", List.of("*"), "psi4");

        ClaimedTask task = deps.taskService().claimTasks("manager-1", 1).get(0);

        assertEquals(task.function(), deps.taskService().findById(task.taskId()).orElseThrow().function());
    }

    @Test
    void claimOrderFollowsPriorityThenAge() {
        List<Long> low = addSinglepoints(2, "*", TaskPriority.LOW);
        List<Long> high = addSinglepoints(2, "*", TaskPriority.HIGH);
        List<Long> normal = addSinglepoints(2, "*", TaskPriority.NORMAL);
        activate("manager-1", List.of("*"), "psi4");

        List<Long> claimedOrder = deps.taskService().claimTasks("manager-1", 5).stream()
                .map(ClaimedTask::recordId)
                .toList();

        assertEquals(List.of(high.get(0), high.get(1), normal.get(0), normal.get(1), low.get(0)), claimedOrder);
    }

    @Test
    void claimLimitIsCappedByConfiguration() {
        addSinglepoints(8, "*", TaskPriority.NORMAL);
        activate("manager-1", List.of("*"), "psi4");

        assertEquals(5, deps.taskService().claimTasks("manager-1", 100).size());
        assertEquals(2, deps.taskService().claimTasks("manager-1", 2).size());
        assertEquals(1, deps.taskService().claimTasks("manager-1", 100).size());
    }

    @Test
    @DisplayName("Managers only get tasks whose programs they have")
    void capabilityGating() {
        addSinglepoints(2, "*", TaskPriority.NORMAL);
        deps.recordService().addRecords("optimization", List.of(TestData.optimization()), "*", TaskPriority.HIGH,
                false);
        activate("psi4-only", List.of("*"), "psi4");
        activate("full", List.of("*"), "psi4", "geometric");

        List<ClaimedTask> psi4Only = deps.taskService().claimTasks("psi4-only", 10);
        assertEquals(2, psi4Only.size());
        assertTrue(psi4Only.stream().allMatch(t -> t.recordType().equals("singlepoint")));

        List<ClaimedTask> full = deps.taskService().claimTasks("full", 10);
        assertEquals(1, full.size());
        assertEquals("optimization", full.get(0).recordType());
    }

    @Test
    void programNamesAreCaseInsensitive() {
        addSinglepoints(1, "*", TaskPriority.NORMAL);
        activate("manager-1", List.of("*"), "Psi4");

        assertEquals(1, deps.taskService().claimTasks("manager-1", 1).size());
    }

    @Test
    @DisplayName("Program and tag matching does not depend on the default locale")
    void matchingIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            long id = deps.recordService().addRecords("singlepoint",
                    List.of(TestData.singlepoint("PSI4", "locale")), "Intel", TaskPriority.NORMAL, false).singleId();
            activate("manager-1", List.of("INTEL"), "PSI4");

            List<ClaimedTask> claimed = deps.taskService().claimTasks("manager-1", 1);

            assertEquals(1, claimed.size());
            assertEquals(id, claimed.get(0).recordId());
            assertEquals(Set.of("psi4"), claimed.get(0).requiredPrograms());
            assertEquals("intel", deps.recordService().get(id).computeTag());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("Tags are served in the order the manager lists them")
    void tagsServedInOrder() {
        List<Long> other = addSinglepoints(2, "other", TaskPriority.HIGH);
        List<Long> urgent = addSinglepoints(2, "urgent", TaskPriority.LOW);
        addSinglepoints(2, "ignored", TaskPriority.HIGH);
        activate("manager-1", List.of("URGENT", "other"), "psi4");

        List<Long> claimed = deps.taskService().claimTasks("manager-1", 5).stream()
                .map(ClaimedTask::recordId)
                .toList();

        assertEquals(List.of(urgent.get(0), urgent.get(1), other.get(0), other.get(1)), claimed);
    }

    @Test
    void wildcardTagServesEverything() {
        List<Long> gpu = addSinglepoints(1, "gpu", TaskPriority.NORMAL);
        List<Long> any = addSinglepoints(1, "*", TaskPriority.NORMAL);
        activate("manager-1", List.of("gpu", "*"), "psi4");

        List<Long> claimed = deps.taskService().claimTasks("manager-1", 5).stream()
                .map(ClaimedTask::recordId)
                .toList();

        assertEquals(List.of(gpu.get(0), any.get(0)), claimed);
    }

    @Test
    void unknownManagerIsRejected() {
        addSinglepoints(1, "*", TaskPriority.NORMAL);

        ComputeManagerException e = assertThrows(ComputeManagerException.class,
                () -> deps.taskService().claimTasks("ghost", 1));
        assertTrue(e.getMessage().contains("does not exist"));
        assertEquals(1, deps.taskService().countAvailable());
    }

    @Test
    void inactiveManagerIsRejectedWithoutSideEffects() {
        List<Long> ids = addSinglepoints(1, "*", TaskPriority.NORMAL);
        activate("manager-1", List.of("*"), "psi4");
        deps.managerService().deactivate(List.of("manager-1"));

        ComputeManagerException e = assertThrows(ComputeManagerException.class,
                () -> deps.taskService().claimTasks("manager-1", 1));
        assertTrue(e.getMessage().contains("not active"));
        assertEquals(RecordStatus.WAITING, deps.recordService().get(ids.get(0)).status());
        assertEquals(0, deps.managerService().findByName("manager-1").orElseThrow().claimed());
    }

    @Test
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> deps.taskService().claimTasks("", 1));
        assertThrows(IllegalArgumentException.class, () -> deps.taskService().claimTasks("manager-1", 0));
    }

    @Test
    @DisplayName("A record whose task cannot be built goes to error and does not block the queue")
    void unrunnableRecordGoesToError() {
        long broken = deps.recordService().addRecords("broken", List.of(TestData.molecule()), "*",
                TaskPriority.HIGH, false).singleId();
        List<Long> good = addSinglepoints(1, "*", TaskPriority.NORMAL);
        activate("manager-1", List.of("*"), "psi4");
        List<String> events = new ArrayList<>();
        deps.eventBus().subscribe((id, status) -> events.add(id + ":" + status));

        List<ClaimedTask> claimed = deps.taskService().claimTasks("manager-1", 5);

        assertEquals(1, claimed.size());
        assertEquals(good.get(0), claimed.get(0).recordId());
        assertEquals(RecordStatus.ERROR, deps.recordService().get(broken).status());
        assertEquals(List.of(broken + ":ERROR"), events);
        assertTrue(deps.taskService().findByRecordId(broken).isEmpty());

        List<ComputeHistoryEntry> history = deps.recordService().getHistory(broken);
        assertEquals(1, history.size());
        assertEquals(ComputeError.INTERNAL_ERROR, history.get(0).error().errorType());
    }

    @Test
    @DisplayName("An available task whose record is no longer waiting is dropped from the queue")
    void taskOfRestingRecordIsRemovedAtClaim() {
        List<Long> ids = addSinglepoints(2, "*", TaskPriority.NORMAL);
        long stale = ids.get(0);
        // status changed behind the queue's back; the task is still available
        deps.recordRepository().updateStatus(stale, RecordStatus.CANCELLED, null);
        assertTrue(deps.taskService().findByRecordId(stale).orElseThrow().isAvailable());
        activate("manager-1", List.of("*"), "psi4");

        List<ClaimedTask> claimed = deps.taskService().claimTasks("manager-1", 5);

        assertEquals(List.of(ids.get(1)), claimed.stream().map(ClaimedTask::recordId).toList());
        assertTrue(deps.taskService().findByRecordId(stale).isEmpty());
        assertEquals(RecordStatus.CANCELLED, deps.recordService().get(stale).status());
        assertEquals(1, deps.managerService().findByName("manager-1").orElseThrow().claimed());
    }

    @Test
    @DisplayName("Concurrent managers never claim the same task twice")
    void concurrentClaimsAreDisjoint() throws Exception {
        int totalTasks = 60;
        int managers = 6;
        List<Long> ids = addSinglepoints(totalTasks, "*", TaskPriority.NORMAL);
        for (int i = 0; i < managers; i++) {
            activate("manager-" + i, List.of("*"), "psi4");
        }

        ConcurrentLinkedQueue<Long> claimedRecords = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(managers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < managers; i++) {
                String name = "manager-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    while (true) {
                        List<ClaimedTask> claimed = deps.taskService().claimTasks(name, 3);
                        if (claimed.isEmpty()) {
                            return null;
                        }
                        claimed.forEach(t -> claimedRecords.add(t.recordId()));
                    }
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(totalTasks, claimedRecords.size(), "every task claimed exactly once");
        assertEquals(new HashSet<>(ids), new HashSet<>(claimedRecords));

        long totalClaimed = deps.managerService().findAll().stream().mapToLong(m -> m.claimed()).sum();
        assertEquals(totalTasks, totalClaimed);
    }
}
