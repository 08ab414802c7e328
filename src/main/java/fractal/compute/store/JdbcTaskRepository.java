package fractal.compute.store;

import com.fasterxml.jackson.databind.JsonNode;
import fractal.compute.model.Task;
import fractal.compute.model.TaskPriority;
import fractal.compute.repository.TaskRepository;
import fractal.compute.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static fractal.compute.store.JdbcSupport.generatedId;
import static fractal.compute.store.JdbcSupport.placeholders;
import static fractal.compute.store.JdbcSupport.setStringOrNull;
import static fractal.compute.store.JdbcSupport.setTimestamp;
import static fractal.compute.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of TaskRepository.
 * Claiming uses {@code FOR UPDATE SKIP LOCKED} so concurrent managers never wait on
 * each other's candidate rows.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public long insert(Task task) {
        String sql = """
                    INSERT INTO tasks (record_id, tag, priority, available, task_function, created_on)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        return db.required(conn -> {
            long taskId;
            try (PreparedStatement ps = conn.prepareStatement(sql, new String[] { "id" })) {
                ps.setLong(1, task.recordId());
                ps.setString(2, task.tag());
                ps.setInt(3, task.priority().value());
                ps.setBoolean(4, task.isAvailable());
                setStringOrNull(ps, 5, Jsons.write(task.function()));
                setTimestamp(ps, 6, task.createdOn() != null ? task.createdOn() : Instant.now());
                ps.executeUpdate();
                taskId = generatedId(ps);
            }

            if (!task.requiredPrograms().isEmpty()) {
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO task_required_programs (task_id, program) VALUES (?, ?)")) {
                    for (String program : task.requiredPrograms()) {
                        ps.setLong(1, taskId);
                        ps.setString(2, program);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
            }

            log.debug("Created task {} for record {}", taskId, task.recordId());
            return taskId;
        });
    }

    @Override
    public Optional<Task> findById(long taskId) {
        return findOne("SELECT * FROM tasks WHERE id = ?", taskId);
    }

    @Override
    public Optional<Task> findByIdForUpdate(long taskId) {
        return findOne("SELECT * FROM tasks WHERE id = ? FOR UPDATE", taskId);
    }

    @Override
    public Optional<Task> findByRecordId(long recordId) {
        return findOne("SELECT * FROM tasks WHERE record_id = ?", recordId);
    }

    @Override
    public List<Task> lockClaimable(String tag, Set<String> programs, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM tasks t WHERE t.available = TRUE");
        if (!"*".equals(tag)) {
            sql.append(" AND t.tag = ?");
        }
        // every required program must be one the manager has
        sql.append(" AND NOT EXISTS (SELECT 1 FROM task_required_programs p WHERE p.task_id = t.id");
        if (!programs.isEmpty()) {
            sql.append(" AND p.program NOT IN (").append(placeholders(programs)).append(")");
        }
        sql.append(")");
        sql.append(" ORDER BY t.priority DESC, t.created_on, t.id LIMIT ? FOR UPDATE SKIP LOCKED");

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                int i = 1;
                if (!"*".equals(tag)) {
                    ps.setString(i++, tag);
                }
                for (String program : programs) {
                    ps.setString(i++, program);
                }
                ps.setInt(i, limit);
                return queryTasks(conn, ps);
            }
        });
    }

    @Override
    public boolean markClaimed(long taskId) {
        String sql = "UPDATE tasks SET available = FALSE WHERE id = ? AND available = TRUE";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, taskId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public void setAvailable(long recordId, boolean available) {
        String sql = "UPDATE tasks SET available = ? WHERE record_id = ?";

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setBoolean(1, available);
                ps.setLong(2, recordId);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public void updateFunction(long taskId, JsonNode function) {
        String sql = "UPDATE tasks SET task_function = ? WHERE id = ?";

        db.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setStringOrNull(ps, 1, Jsons.write(function));
                ps.setLong(2, taskId);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public boolean deleteByRecordId(long recordId) {
        String sql = "DELETE FROM tasks WHERE record_id = ?";

        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, recordId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public int countAvailable() {
        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM tasks WHERE available = TRUE");
                    ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }

    private Optional<Task> findOne(String sql, long id) {
        return db.required(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, id);
                List<Task> tasks = queryTasks(conn, ps);
                return tasks.isEmpty() ? Optional.empty() : Optional.of(tasks.get(0));
            }
        });
    }

    private List<Task> queryTasks(Connection conn, PreparedStatement ps) throws SQLException {
        Map<Long, Task.Builder> builders = new LinkedHashMap<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Task.Builder builder = Task.builder()
                        .id(rs.getLong("id"))
                        .recordId(rs.getLong("record_id"))
                        .tag(rs.getString("tag"))
                        .priority(TaskPriority.fromValue(rs.getInt("priority")))
                        .available(rs.getBoolean("available"))
                        .function(Jsons.read(rs.getString("task_function")))
                        .createdOn(toInstant(rs.getTimestamp("created_on")));
                builders.put(rs.getLong("id"), builder);
            }
        }
        if (builders.isEmpty()) {
            return List.of();
        }

        Map<Long, Set<String>> programs = loadPrograms(conn, builders.keySet());
        List<Task> tasks = new ArrayList<>(builders.size());
        builders.forEach((id, builder) -> tasks.add(builder.requiredPrograms(programs.getOrDefault(id, Set.of())).build()));
        return tasks;
    }

    private Map<Long, Set<String>> loadPrograms(Connection conn, Set<Long> taskIds) throws SQLException {
        String sql = "SELECT task_id, program FROM task_required_programs WHERE task_id IN ("
                + placeholders(taskIds) + ")";
        Map<Long, Set<String>> programs = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            for (Long id : taskIds) {
                ps.setLong(i++, id);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    programs.computeIfAbsent(rs.getLong("task_id"), k -> new TreeSet<>()).add(rs.getString("program"));
                }
            }
        }
        return programs;
    }
}
