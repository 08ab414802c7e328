package fractal.compute.repository;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.model.ComputeError;
import fractal.compute.model.ComputeHistoryEntry;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for records and their compute history.
 * All methods join the calling thread's transaction when one is active.
 */
public interface RecordRepository {

    /**
     * Insert a new record.
     *
     * @param record the record to insert (its id is ignored)
     * @return the generated record id
     */
    long insert(ComputeRecord record);

    /**
     * Find a record by ID.
     */
    Optional<ComputeRecord> findById(long recordId);

    /**
     * Find a record by ID and lock its row until the transaction ends.
     */
    Optional<ComputeRecord> findByIdForUpdate(long recordId);

    /**
     * Find records by ID. Missing ids are skipped; the result follows id order.
     */
    List<ComputeRecord> findByIds(Collection<Long> recordIds);

    /**
     * Find a non-deleted record of the given type with the given specification hash.
     *
     * @return the id of the oldest matching record
     */
    Optional<Long> findExisting(String recordType, String specificationHash);

    /**
     * Find the records running on any of the given managers.
     */
    List<ComputeRecord> findRunningByManagers(Collection<String> managerNames);

    /**
     * Set status and owner unconditionally, bumping modified_on.
     */
    void updateStatus(long recordId, RecordStatus status, String managerName);

    /**
     * Compare-and-set on the record status.
     *
     * @return true if the record was in the expected status and has been updated
     */
    boolean updateStatusIf(long recordId, RecordStatus expected, RecordStatus status, String managerName);

    /**
     * Replace the result summary of a record.
     */
    void updateProperties(long recordId, JsonNode properties);

    /**
     * Append an entry to the compute history of a record.
     *
     * @return the generated history entry id
     */
    long appendHistory(ComputeHistoryEntry entry);

    /**
     * Rewrite status and outputs of an existing history entry.
     */
    void updateHistory(long historyId, RecordStatus status, String stdout, ComputeError error);

    /**
     * Compute history of a record, oldest first.
     */
    List<ComputeHistoryEntry> findHistory(long recordId);

    /**
     * Compute history of several records at once, oldest first per record.
     */
    List<ComputeHistoryEntry> findHistory(Collection<Long> recordIds);
}
