package fractal.compute.store;

import com.fasterxml.jackson.core.type.TypeReference;
import fractal.compute.model.ComputeManager;
import fractal.compute.model.ManagerStatus;
import fractal.compute.repository.ManagerRepository;
import fractal.compute.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static fractal.compute.store.JdbcSupport.setTimestamp;
import static fractal.compute.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of ManagerRepository.
 * Programs and tags are stored as JSON documents.
 */
public class JdbcManagerRepository implements ManagerRepository {

    private static final TypeReference<LinkedHashMap<String, String>> PROGRAMS = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> TAGS = new TypeReference<>() {
    };

    private final Database db;

    public JdbcManagerRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insert(ComputeManager manager) {
        String sql = """
                    INSERT INTO compute_managers (name, status, programs, tags, successes, failures, rejected, claimed,
                                                  created_on, modified_on, last_heartbeat)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                Instant now = Instant.now();
                ps.setString(1, manager.name());
                ps.setString(2, manager.status().name());
                ps.setString(3, Jsons.write(manager.programs()));
                ps.setString(4, Jsons.write(manager.tags()));
                ps.setLong(5, manager.successes());
                ps.setLong(6, manager.failures());
                ps.setLong(7, manager.rejected());
                ps.setLong(8, manager.claimed());
                setTimestamp(ps, 9, manager.createdOn() != null ? manager.createdOn() : now);
                setTimestamp(ps, 10, now);
                setTimestamp(ps, 11, manager.lastHeartbeat() != null ? manager.lastHeartbeat() : now);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public Optional<ComputeManager> findByName(String name) {
        return findOne("SELECT * FROM compute_managers WHERE name = ?", name);
    }

    @Override
    public Optional<ComputeManager> findByNameForUpdate(String name) {
        return findOne("SELECT * FROM compute_managers WHERE name = ? FOR UPDATE", name);
    }

    @Override
    public List<ComputeManager> findAll() {
        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM compute_managers ORDER BY name")) {
                return query(ps);
            }
        });
    }

    @Override
    public void incrementClaimed(String name, int claimed) {
        String sql = "UPDATE compute_managers SET claimed = claimed + ?, modified_on = ? WHERE name = ?";

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, claimed);
                setTimestamp(ps, 2, Instant.now());
                ps.setString(3, name);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public void incrementCounters(String name, int successes, int failures, int rejected) {
        String sql = """
                    UPDATE compute_managers
                    SET successes = successes + ?, failures = failures + ?, rejected = rejected + ?, modified_on = ?
                    WHERE name = ?
                """;

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setInt(1, successes);
                ps.setInt(2, failures);
                ps.setInt(3, rejected);
                setTimestamp(ps, 4, Instant.now());
                ps.setString(5, name);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public boolean heartbeat(String name, Instant at) {
        String sql = "UPDATE compute_managers SET last_heartbeat = ?, modified_on = ? WHERE name = ? AND status = 'ACTIVE'";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, at);
                setTimestamp(ps, 2, at);
                ps.setString(3, name);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public boolean deactivate(String name) {
        String sql = "UPDATE compute_managers SET status = 'INACTIVE', modified_on = ? WHERE name = ? AND status = 'ACTIVE'";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, Instant.now());
                ps.setString(2, name);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public List<String> findStale(Instant cutoff) {
        String sql = "SELECT name FROM compute_managers WHERE status = 'ACTIVE' AND last_heartbeat < ? ORDER BY name";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, cutoff);
                List<String> names = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        names.add(rs.getString(1));
                    }
                }
                return names;
            }
        });
    }

    private Optional<ComputeManager> findOne(String sql, String name) {
        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, name);
                List<ComputeManager> found = query(ps);
                return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
            }
        });
    }

    private List<ComputeManager> query(PreparedStatement ps) throws SQLException {
        List<ComputeManager> managers = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                managers.add(mapRow(rs));
            }
        }
        return managers;
    }

    private ComputeManager mapRow(ResultSet rs) throws SQLException {
        Map<String, String> programs = Jsons.MAPPER.convertValue(Jsons.read(rs.getString("programs")), PROGRAMS);
        List<String> tags = Jsons.MAPPER.convertValue(Jsons.read(rs.getString("tags")), TAGS);
        return ComputeManager.builder()
                .name(rs.getString("name"))
                .status(ManagerStatus.valueOf(rs.getString("status")))
                .programs(programs)
                .tags(tags)
                .successes(rs.getLong("successes"))
                .failures(rs.getLong("failures"))
                .rejected(rs.getLong("rejected"))
                .claimed(rs.getLong("claimed"))
                .createdOn(toInstant(rs.getTimestamp("created_on")))
                .modifiedOn(toInstant(rs.getTimestamp("modified_on")))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .build();
    }
}
