package fractal.compute.service;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.TestData;
import fractal.compute.config.Dependencies;
import fractal.compute.exception.FractalException;
import fractal.compute.exception.MissingDataException;
import fractal.compute.model.ClaimedTask;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.InsertResult;
import fractal.compute.model.RecordStatus;
import fractal.compute.model.Task;
import fractal.compute.model.TaskPriority;
import fractal.compute.model.TaskResult;
import fractal.compute.util.Jsons;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecordServiceTest {

    private Dependencies deps;
    private RecordService records;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(TestData.config("records"));
        records = deps.recordService();
        deps.managerService().activate("manager-1", Map.of("psi4", "1.9"), List.of("*"));
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private long addSinglepoint(String method) {
        return records.addRecords("singlepoint", List.of(TestData.singlepoint("psi4", method)), "*",
                TaskPriority.NORMAL, false).singleId();
    }

    private void fail(long recordId) {
        ClaimedTask task = deps.taskService().claimTasks("manager-1", 1).stream()
                .filter(t -> t.recordId() == recordId)
                .findFirst()
                .orElseThrow();
        deps.taskCompletionService().submitResults("manager-1", Map.of(task.taskId(), TaskResult.of(Jsons.read("""
                {"success": false, "error": {"error_type": "random_error", "error_message": "boom"}}
                """))));
    }

    @Test
    void addRecordsCreatesWaitingRecordsWithTasks() {
        InsertResult result = records.addRecords("singlepoint",
                List.of(TestData.singlepoint("PSI4", "hf"), TestData.singlepoint("psi4", "mp2")), "GPU",
                TaskPriority.HIGH, false);

        assertEquals(2, result.ids().size());
        assertEquals(List.of(0, 1), result.insertedIdx());
        assertTrue(result.existingIdx().isEmpty());

        for (long id : result.ids()) {
            ComputeRecord record = records.get(id);
            assertEquals(RecordStatus.WAITING, record.status());
            assertEquals("gpu", record.computeTag());
            assertEquals(TaskPriority.HIGH, record.computePriority());
            assertFalse(record.isService());

            Task task = deps.taskService().findByRecordId(id).orElseThrow();
            assertTrue(task.isAvailable());
            assertEquals("gpu", task.tag());
            assertEquals(Set.of("psi4"), task.requiredPrograms());
        }
    }

    @Test
    @DisplayName("findExisting returns the existing record for an identical specification")
    void findExistingDeduplicates() {
        JsonNode spec = TestData.singlepoint("psi4", "hf");
        long first = records.addRecords("singlepoint", List.of(spec), "*", TaskPriority.NORMAL, true).singleId();

        // same content, different key order
        JsonNode reordered = Jsons.read(Jsons.canonical(spec));
        InsertResult again = records.addRecords("singlepoint", List.of(reordered, TestData.singlepoint("psi4", "mp2")),
                "*", TaskPriority.NORMAL, true);

        assertEquals(first, again.ids().get(0));
        assertEquals(List.of(0), again.existingIdx());
        assertEquals(List.of(1), again.insertedIdx());

        InsertResult duplicate = records.addRecords("singlepoint", List.of(spec), "*", TaskPriority.NORMAL, false);
        assertNotEquals(first, duplicate.singleId());
    }

    @Test
    void servicesDoNotGetTasks() {
        long id = records.addRecords("torsiondrive", List.of(TestData.torsionDrive(90)), "*", TaskPriority.NORMAL,
                true).singleId();

        ComputeRecord record = records.get(id);
        assertTrue(record.isService());
        assertEquals(RecordStatus.WAITING, record.status());
        assertTrue(deps.taskService().findByRecordId(id).isEmpty());
        assertTrue(deps.serviceRepository().findByRecordId(id).isPresent());
    }

    @Test
    void unknownRecordTypeIsRejected() {
        FractalException e = assertThrows(FractalException.class, () -> records.addRecords("mystery",
                List.of(Jsons.object()), "*", TaskPriority.NORMAL, false));
        assertEquals("UNKNOWN_RECORD_TYPE", e.getErrorCode());
    }

    @Test
    void invalidSpecificationWritesNothing() {
        List<JsonNode> specs = new ArrayList<>();
        specs.add(TestData.singlepoint("psi4", "hf"));
        specs.add(Jsons.read("{\"method\": \"hf\"}"));

        assertThrows(IllegalArgumentException.class,
                () -> records.addRecords("singlepoint", specs, "*", TaskPriority.NORMAL, false));
        assertEquals(0, deps.taskService().countAvailable());
    }

    @Test
    void missingRecord() {
        assertThrows(MissingDataException.class, () -> records.get(12345));
        assertThrows(MissingDataException.class, () -> records.getHistory(12345));
    }

    @Test
    @DisplayName("Reset puts an errored record back in the queue and keeps its history")
    void resetErroredRecord() {
        long id = addSinglepoint("hf");
        fail(id);

        List<Long> reset = records.reset(List.of(id));

        assertEquals(List.of(id), reset);
        ComputeRecord record = records.get(id);
        assertEquals(RecordStatus.WAITING, record.status());
        assertNull(record.managerName());
        assertTrue(deps.taskService().findByRecordId(id).orElseThrow().isAvailable());
        assertEquals(1, records.getHistory(id).size());

        assertEquals(1, deps.taskService().claimTasks("manager-1", 5).size());
    }

    @Test
    void resetIgnoresRecordsNotInError() {
        long waiting = addSinglepoint("hf");
        assertTrue(records.reset(List.of(waiting, 999L)).isEmpty());
        assertEquals(RecordStatus.WAITING, records.get(waiting).status());
    }

    @Test
    void cancelAndUncancel() {
        long id = addSinglepoint("hf");

        assertEquals(List.of(id), records.cancel(List.of(id)));
        assertEquals(RecordStatus.CANCELLED, records.get(id).status());
        assertTrue(deps.taskService().findByRecordId(id).isEmpty());
        assertTrue(deps.taskService().claimTasks("manager-1", 5).isEmpty());

        assertEquals(List.of(id), records.uncancel(List.of(id)));
        assertEquals(RecordStatus.WAITING, records.get(id).status());
        assertEquals(1, deps.taskService().claimTasks("manager-1", 5).size());
    }

    @Test
    void cancelRunningRecordRejectsLateResult() {
        long id = addSinglepoint("hf");
        ClaimedTask task = deps.taskService().claimTasks("manager-1", 1).get(0);

        records.cancel(List.of(id));

        var metadata = deps.taskCompletionService().submitResults("manager-1",
                Map.of(task.taskId(), TaskResult.of(Jsons.read("{\"success\": true}"))));
        assertTrue(metadata.isRejected(task.taskId()));
        assertEquals(RecordStatus.CANCELLED, records.get(id).status());
    }

    @Test
    void invalidateAndUninvalidate() {
        long id = addSinglepoint("hf");
        ClaimedTask task = deps.taskService().claimTasks("manager-1", 1).get(0);
        deps.taskCompletionService().submitResults("manager-1",
                Map.of(task.taskId(), TaskResult.of(Jsons.read("{\"success\": true, \"return_result\": 1.0}"))));

        assertTrue(records.invalidate(List.of(addSinglepoint("mp2"))).isEmpty(), "only complete records");
        assertEquals(List.of(id), records.invalidate(List.of(id)));
        assertEquals(RecordStatus.INVALID, records.get(id).status());

        assertEquals(List.of(id), records.uninvalidate(List.of(id)));
        assertEquals(RecordStatus.COMPLETE, records.get(id).status());
    }

    @Test
    void deleteRemovesTask() {
        long id = addSinglepoint("hf");

        assertEquals(List.of(id), records.delete(List.of(id)));
        assertEquals(RecordStatus.DELETED, records.get(id).status());
        assertTrue(deps.taskService().findByRecordId(id).isEmpty());
        assertTrue(records.delete(List.of(id)).isEmpty());
    }

    @Test
    @DisplayName("Records running on deactivated managers can be requeued")
    void resetAssignedRequeuesRunningRecords() {
        long id = addSinglepoint("hf");
        deps.taskService().claimTasks("manager-1", 1);
        deps.managerService().deactivate(List.of("manager-1"));

        assertEquals(RecordStatus.RUNNING, records.get(id).status(), "deactivation alone does not requeue");

        assertEquals(List.of(id), records.resetAssigned(List.of("manager-1")));
        assertEquals(RecordStatus.WAITING, records.get(id).status());
        assertTrue(deps.taskService().findByRecordId(id).orElseThrow().isAvailable());
    }

    @Test
    void statusChangesAreNotified() {
        long id = addSinglepoint("hf");
        List<RecordStatus> events = new ArrayList<>();
        deps.eventBus().subscribe((recordId, status) -> events.add(status));

        records.cancel(List.of(id));
        records.uncancel(List.of(id));
        records.delete(List.of(id));

        assertEquals(List.of(RecordStatus.CANCELLED, RecordStatus.WAITING, RecordStatus.DELETED), events);
    }
}
