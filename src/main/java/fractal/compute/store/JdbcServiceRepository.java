package fractal.compute.store;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.model.RecordChild;
import fractal.compute.model.ServiceDependency;
import fractal.compute.model.ServiceQueueEntry;
import fractal.compute.model.TaskPriority;
import fractal.compute.repository.ServiceRepository;
import fractal.compute.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static fractal.compute.store.JdbcSupport.setStringOrNull;
import static fractal.compute.store.JdbcSupport.setTimestamp;
import static fractal.compute.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of ServiceRepository.
 */
public class JdbcServiceRepository implements ServiceRepository {

    private final Database db;

    public JdbcServiceRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insert(ServiceQueueEntry entry) {
        String sql = """
                    INSERT INTO services (record_id, compute_tag, compute_priority, find_existing, service_state, created_on)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, entry.recordId());
                ps.setString(2, entry.computeTag());
                ps.setInt(3, entry.computePriority().value());
                ps.setBoolean(4, entry.findExisting());
                setStringOrNull(ps, 5, Jsons.write(entry.serviceState()));
                setTimestamp(ps, 6, entry.createdOn() != null ? entry.createdOn() : Instant.now());
                ps.executeUpdate();
            }
        });
    }

    @Override
    public Optional<ServiceQueueEntry> findByRecordId(long recordId) {
        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM services WHERE record_id = ?")) {
                ps.setLong(1, recordId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new ServiceQueueEntry(
                            rs.getLong("record_id"),
                            rs.getString("compute_tag"),
                            TaskPriority.fromValue(rs.getInt("compute_priority")),
                            rs.getBoolean("find_existing"),
                            Jsons.read(rs.getString("service_state")),
                            toInstant(rs.getTimestamp("created_on"))));
                }
            }
        });
    }

    @Override
    public void updateState(long recordId, JsonNode serviceState) {
        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE services SET service_state = ? WHERE record_id = ?")) {
                setStringOrNull(ps, 1, Jsons.write(serviceState));
                ps.setLong(2, recordId);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public List<Long> findWaiting(int limit) {
        String sql = """
                    SELECT s.record_id FROM services s
                    JOIN records r ON r.id = s.record_id
                    WHERE r.status = 'WAITING'
                    ORDER BY s.compute_priority DESC, s.created_on, s.record_id
                    LIMIT ?
                """;

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, limit);
                return queryIds(ps);
            }
        });
    }

    @Override
    public int countRunning() {
        String sql = """
                    SELECT COUNT(*) FROM services s
                    JOIN records r ON r.id = s.record_id
                    WHERE r.status = 'RUNNING'
                """;

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql);
                    ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }

    @Override
    public List<Long> findRunningReady() {
        String sql = """
                    SELECT s.record_id FROM services s
                    JOIN records r ON r.id = s.record_id
                    WHERE r.status = 'RUNNING'
                      AND NOT EXISTS (
                          SELECT 1 FROM service_dependencies d
                          JOIN records dr ON dr.id = d.record_id
                          WHERE d.service_id = s.record_id AND dr.status IN ('WAITING', 'RUNNING')
                      )
                    ORDER BY s.compute_priority DESC, s.created_on, s.record_id
                """;

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                return queryIds(ps);
            }
        });
    }

    @Override
    public List<ServiceDependency> findDependencies(long serviceId) {
        String sql = "SELECT * FROM service_dependencies WHERE service_id = ? ORDER BY position, id";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, serviceId);
                List<ServiceDependency> deps = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        deps.add(new ServiceDependency(
                                rs.getLong("service_id"),
                                rs.getLong("record_id"),
                                rs.getInt("position"),
                                Jsons.read(rs.getString("extras"))));
                    }
                }
                return deps;
            }
        });
    }

    @Override
    public void replaceDependencies(long serviceId, List<ServiceDependency> dependencies) {
        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM service_dependencies WHERE service_id = ?")) {
                ps.setLong(1, serviceId);
                ps.executeUpdate();
            }
            if (dependencies.isEmpty()) {
                return;
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO service_dependencies (service_id, record_id, position, extras) VALUES (?, ?, ?, ?)")) {
                for (ServiceDependency dep : dependencies) {
                    ps.setLong(1, serviceId);
                    ps.setLong(2, dep.recordId());
                    ps.setInt(3, dep.position());
                    setStringOrNull(ps, 4, Jsons.write(dep.extras()));
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        });
    }

    @Override
    public void addChildren(List<RecordChild> children) {
        if (children.isEmpty()) {
            return;
        }
        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO record_children (parent_id, child_id, child_key, position) VALUES (?, ?, ?, ?)")) {
                for (RecordChild child : children) {
                    ps.setLong(1, child.parentId());
                    ps.setLong(2, child.childId());
                    setStringOrNull(ps, 3, child.childKey());
                    ps.setInt(4, child.position());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        });
    }

    @Override
    public List<RecordChild> findChildren(long parentId) {
        String sql = "SELECT * FROM record_children WHERE parent_id = ? ORDER BY position, id";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, parentId);
                List<RecordChild> children = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        children.add(new RecordChild(
                                rs.getLong("parent_id"),
                                rs.getLong("child_id"),
                                rs.getString("child_key"),
                                rs.getInt("position")));
                    }
                }
                return children;
            }
        });
    }

    @Override
    public void clear(long recordId) {
        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE services SET service_state = NULL WHERE record_id = ?")) {
                ps.setLong(1, recordId);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM service_dependencies WHERE service_id = ?")) {
                ps.setLong(1, recordId);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM record_children WHERE parent_id = ?")) {
                ps.setLong(1, recordId);
                ps.executeUpdate();
            }
        });
    }

    private static List<Long> queryIds(PreparedStatement ps) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getLong(1));
            }
        }
        return ids;
    }
}
