package fractal.compute.store;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.model.ComputeError;
import fractal.compute.model.ComputeHistoryEntry;
import fractal.compute.model.ComputeRecord;
import fractal.compute.model.RecordStatus;
import fractal.compute.model.TaskPriority;
import fractal.compute.repository.RecordRepository;
import fractal.compute.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static fractal.compute.store.JdbcSupport.generatedId;
import static fractal.compute.store.JdbcSupport.placeholders;
import static fractal.compute.store.JdbcSupport.setStringOrNull;
import static fractal.compute.store.JdbcSupport.setTimestamp;
import static fractal.compute.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of RecordRepository.
 */
public class JdbcRecordRepository implements RecordRepository {

    private final Database db;

    public JdbcRecordRepository(Database db) {
        this.db = db;
    }

    @Override
    public long insert(ComputeRecord record) {
        String sql = """
                    INSERT INTO records (record_type, is_service, status, manager_name, compute_tag, compute_priority,
                                         specification, specification_hash, properties, created_on, modified_on)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql, new String[] { "id" })) {
                Instant now = Instant.now();
                ps.setString(1, record.recordType());
                ps.setBoolean(2, record.isService());
                ps.setString(3, record.status().name());
                setStringOrNull(ps, 4, record.managerName());
                ps.setString(5, record.computeTag());
                ps.setInt(6, record.computePriority().value());
                ps.setString(7, Jsons.write(record.specification()));
                setStringOrNull(ps, 8, record.specificationHash());
                setStringOrNull(ps, 9, Jsons.write(record.properties()));
                setTimestamp(ps, 10, record.createdOn() != null ? record.createdOn() : now);
                setTimestamp(ps, 11, now);
                ps.executeUpdate();
                return generatedId(ps);
            }
        });
    }

    @Override
    public Optional<ComputeRecord> findById(long recordId) {
        return findOne("SELECT * FROM records WHERE id = ?", recordId);
    }

    @Override
    public Optional<ComputeRecord> findByIdForUpdate(long recordId) {
        return findOne("SELECT * FROM records WHERE id = ? FOR UPDATE", recordId);
    }

    @Override
    public List<ComputeRecord> findByIds(Collection<Long> recordIds) {
        if (recordIds.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT * FROM records WHERE id IN (" + placeholders(recordIds) + ") ORDER BY id";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int i = 1;
                for (Long id : recordIds) {
                    ps.setLong(i++, id);
                }
                return queryRecords(ps);
            }
        });
    }

    @Override
    public Optional<Long> findExisting(String recordType, String specificationHash) {
        String sql = """
                    SELECT id FROM records
                    WHERE record_type = ? AND specification_hash = ? AND status <> 'DELETED'
                    ORDER BY id
                    LIMIT 1
                """;

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, recordType);
                ps.setString(2, specificationHash);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<ComputeRecord> findRunningByManagers(Collection<String> managerNames) {
        if (managerNames.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT * FROM records WHERE status = 'RUNNING' AND manager_name IN ("
                + placeholders(managerNames) + ") ORDER BY id";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int i = 1;
                for (String name : managerNames) {
                    ps.setString(i++, name);
                }
                return queryRecords(ps);
            }
        });
    }

    @Override
    public void updateStatus(long recordId, RecordStatus status, String managerName) {
        String sql = "UPDATE records SET status = ?, manager_name = ?, modified_on = ? WHERE id = ?";

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, status.name());
                setStringOrNull(ps, 2, managerName);
                setTimestamp(ps, 3, Instant.now());
                ps.setLong(4, recordId);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public boolean updateStatusIf(long recordId, RecordStatus expected, RecordStatus status, String managerName) {
        String sql = """
                    UPDATE records SET status = ?, manager_name = ?, modified_on = ?
                    WHERE id = ? AND status = ?
                """;

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, status.name());
                setStringOrNull(ps, 2, managerName);
                setTimestamp(ps, 3, Instant.now());
                ps.setLong(4, recordId);
                ps.setString(5, expected.name());
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public void updateProperties(long recordId, JsonNode properties) {
        String sql = "UPDATE records SET properties = ?, modified_on = ? WHERE id = ?";

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setStringOrNull(ps, 1, Jsons.write(properties));
                setTimestamp(ps, 2, Instant.now());
                ps.setLong(3, recordId);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public long appendHistory(ComputeHistoryEntry entry) {
        String sql = """
                    INSERT INTO record_compute_history (record_id, status, manager_name, modified_on, provenance, stdout, error)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql, new String[] { "id" })) {
                ps.setLong(1, entry.recordId());
                ps.setString(2, entry.status().name());
                setStringOrNull(ps, 3, entry.managerName());
                setTimestamp(ps, 4, entry.modifiedOn() != null ? entry.modifiedOn() : Instant.now());
                setStringOrNull(ps, 5, Jsons.write(entry.provenance()));
                setStringOrNull(ps, 6, entry.stdout());
                setStringOrNull(ps, 7, entry.error() != null ? Jsons.write(entry.error()) : null);
                ps.executeUpdate();
                return generatedId(ps);
            }
        });
    }

    @Override
    public void updateHistory(long historyId, RecordStatus status, String stdout, ComputeError error) {
        String sql = """
                    UPDATE record_compute_history SET status = ?, stdout = ?, error = ?, modified_on = ?
                    WHERE id = ?
                """;

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, status.name());
                setStringOrNull(ps, 2, stdout);
                setStringOrNull(ps, 3, error != null ? Jsons.write(error) : null);
                setTimestamp(ps, 4, Instant.now());
                ps.setLong(5, historyId);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public List<ComputeHistoryEntry> findHistory(long recordId) {
        return findHistory(List.of(recordId));
    }

    @Override
    public List<ComputeHistoryEntry> findHistory(Collection<Long> recordIds) {
        if (recordIds.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT * FROM record_compute_history WHERE record_id IN (" + placeholders(recordIds)
                + ") ORDER BY record_id, id";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int i = 1;
                for (Long id : recordIds) {
                    ps.setLong(i++, id);
                }
                List<ComputeHistoryEntry> entries = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        entries.add(mapHistory(rs));
                    }
                }
                return entries;
            }
        });
    }

    private Optional<ComputeRecord> findOne(String sql, long recordId) {
        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, recordId);
                List<ComputeRecord> found = queryRecords(ps);
                return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
            }
        });
    }

    private List<ComputeRecord> queryRecords(PreparedStatement ps) throws SQLException {
        List<ComputeRecord> records = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                records.add(mapRow(rs));
            }
        }
        return records;
    }

    private ComputeRecord mapRow(ResultSet rs) throws SQLException {
        return ComputeRecord.builder()
                .id(rs.getLong("id"))
                .recordType(rs.getString("record_type"))
                .service(rs.getBoolean("is_service"))
                .status(RecordStatus.valueOf(rs.getString("status")))
                .managerName(rs.getString("manager_name"))
                .computeTag(rs.getString("compute_tag"))
                .computePriority(TaskPriority.fromValue(rs.getInt("compute_priority")))
                .specification(Jsons.read(rs.getString("specification")))
                .specificationHash(rs.getString("specification_hash"))
                .properties(Jsons.read(rs.getString("properties")))
                .createdOn(toInstant(rs.getTimestamp("created_on")))
                .modifiedOn(toInstant(rs.getTimestamp("modified_on")))
                .build();
    }

    private ComputeHistoryEntry mapHistory(ResultSet rs) throws SQLException {
        Timestamp modified = rs.getTimestamp("modified_on");
        return new ComputeHistoryEntry(
                rs.getLong("id"),
                rs.getLong("record_id"),
                RecordStatus.valueOf(rs.getString("status")),
                rs.getString("manager_name"),
                toInstant(modified),
                Jsons.read(rs.getString("provenance")),
                rs.getString("stdout"),
                Jsons.read(rs.getString("error"), ComputeError.class));
    }
}
