package fractal.compute.store;

import fractal.compute.TestData;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordStatus;
import fractal.compute.model.Task;
import fractal.compute.model.TaskPriority;
import fractal.compute.util.Jsons;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static Database db;
    private static JdbcRecordRepository records;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(TestData.config("tasks"));
        records = new JdbcRecordRepository(db);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanRecords() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM records");
            conn.commit();
        }
    }

    private long newRecord() {
        return records.insert(ComputeRecord.builder()
                .recordType("singlepoint")
                .status(RecordStatus.WAITING)
                .computeTag("*")
                .computePriority(TaskPriority.NORMAL)
                .specification(Jsons.object())
                .specificationHash("hash-" + System.nanoTime())
                .createdOn(Instant.now())
                .build());
    }

    private long newTask(String tag, TaskPriority priority, Instant createdOn, String... programs) {
        long recordId = newRecord();
        return repo.insert(Task.builder()
                .recordId(recordId)
                .tag(tag)
                .priority(priority)
                .requiredPrograms(Set.of(programs))
                .createdOn(createdOn)
                .build());
    }

    @Test
    void insertAndFindById() {
        long id = newTask("gpu", TaskPriority.HIGH, Instant.now(), "psi4", "geometric");

        Optional<Task> found = repo.findById(id);
        assertTrue(found.isPresent());
        assertEquals("gpu", found.get().tag());
        assertEquals(TaskPriority.HIGH, found.get().priority());
        assertEquals(Set.of("psi4", "geometric"), found.get().requiredPrograms());
        assertTrue(found.get().isAvailable());
        assertNull(found.get().function());
    }

    @Test
    void findByRecordId() {
        long id = newTask("*", TaskPriority.NORMAL, Instant.now());
        long recordId = repo.findById(id).orElseThrow().recordId();

        assertEquals(id, repo.findByRecordId(recordId).orElseThrow().id());
        assertTrue(repo.findByRecordId(recordId + 1000).isEmpty());
    }

    @Test
    @DisplayName("Claimable tasks come out by priority, then oldest first")
    void lockClaimableOrdering() {
        Instant now = Instant.now();
        long oldLow = newTask("*", TaskPriority.LOW, now.minusSeconds(30));
        long newHigh = newTask("*", TaskPriority.HIGH, now.minusSeconds(10));
        long oldHigh = newTask("*", TaskPriority.HIGH, now.minusSeconds(20));
        long normal = newTask("*", TaskPriority.NORMAL, now.minusSeconds(40));

        List<Task> tasks = repo.lockClaimable("*", Set.of(), 10);

        assertEquals(List.of(oldHigh, newHigh, normal, oldLow), tasks.stream().map(Task::id).toList());
    }

    @Test
    void lockClaimableRespectsLimit() {
        for (int i = 0; i < 5; i++) {
            newTask("*", TaskPriority.NORMAL, Instant.now());
        }
        assertEquals(3, repo.lockClaimable("*", Set.of(), 3).size());
        assertTrue(repo.lockClaimable("*", Set.of(), 0).isEmpty());
    }

    @Test
    void lockClaimableFiltersByTag() {
        long gpu = newTask("gpu", TaskPriority.NORMAL, Instant.now());
        newTask("cpu", TaskPriority.NORMAL, Instant.now());

        List<Task> tasks = repo.lockClaimable("gpu", Set.of(), 10);
        assertEquals(1, tasks.size());
        assertEquals(gpu, tasks.get(0).id());

        assertEquals(2, repo.lockClaimable("*", Set.of(), 10).size());
    }

    @Test
    @DisplayName("Only tasks whose required programs are a subset of the manager's are claimable")
    void lockClaimableRequiresPrograms() {
        long psi4Only = newTask("*", TaskPriority.NORMAL, Instant.now(), "psi4");
        long optimization = newTask("*", TaskPriority.NORMAL, Instant.now(), "psi4", "geometric");
        long noPrograms = newTask("*", TaskPriority.NORMAL, Instant.now());

        assertEquals(Set.of(noPrograms),
                Set.copyOf(repo.lockClaimable("*", Set.of(), 10).stream().map(Task::id).toList()));
        assertEquals(Set.of(psi4Only, noPrograms),
                Set.copyOf(repo.lockClaimable("*", Set.of("psi4"), 10).stream().map(Task::id).toList()));
        assertEquals(Set.of(psi4Only, optimization, noPrograms),
                Set.copyOf(repo.lockClaimable("*", Set.of("psi4", "geometric", "rdkit"), 10).stream()
                        .map(Task::id).toList()));
    }

    @Test
    void markClaimedIsCompareAndSet() {
        long id = newTask("*", TaskPriority.NORMAL, Instant.now());

        assertTrue(repo.markClaimed(id));
        assertFalse(repo.markClaimed(id), "second claim must not succeed");
        assertFalse(repo.findById(id).orElseThrow().isAvailable());
        assertTrue(repo.lockClaimable("*", Set.of(), 10).isEmpty());
        assertEquals(0, repo.countAvailable());
    }

    @Test
    void setAvailableRequeues() {
        long id = newTask("*", TaskPriority.NORMAL, Instant.now());
        long recordId = repo.findById(id).orElseThrow().recordId();
        repo.markClaimed(id);

        repo.setAvailable(recordId, true);

        assertEquals(1, repo.countAvailable());
    }

    @Test
    void updateFunction() {
        long id = newTask("*", TaskPriority.NORMAL, Instant.now());

        repo.updateFunction(id, Jsons.read("{\"function\": \"compute\"}"));

        assertEquals("compute", repo.findById(id).orElseThrow().function().get("function").asText());
    }

    @Test
    void deleteByRecordId() {
        long id = newTask("*", TaskPriority.NORMAL, Instant.now(), "psi4");
        long recordId = repo.findById(id).orElseThrow().recordId();

        assertTrue(repo.deleteByRecordId(recordId));
        assertFalse(repo.deleteByRecordId(recordId));
        assertTrue(repo.findById(id).isEmpty());
    }
}
