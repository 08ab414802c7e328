package fractal.compute.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import fractal.compute.config.ComputeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;

/**
 * Database connection pool, schema management and transaction demarcation.
 * Uses HikariCP for connection pooling.
 *
 * <p>
 * {@link #required(SqlWork)} binds a connection to the calling thread: nested calls
 * join the outer transaction, the outermost call commits or rolls back.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final ThreadLocal<Connection> current = new ThreadLocal<>();

    public Database(ComputeConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("fractal-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Run work in the current thread's transaction, opening one if none is active.
     * A transaction opened here is committed when the work returns and rolled back
     * when it throws.
     */
    public <T> T required(SqlWork<T> work) {
        Connection outer = current.get();
        if (outer != null) {
            try {
                return work.execute(outer);
            } catch (SQLException e) {
                throw new RuntimeException("Database operation failed", e);
            }
        }

        try (Connection conn = getConnection()) {
            current.set(conn);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw new RuntimeException("Database operation failed", e);
            } catch (RuntimeException | Error e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                current.remove();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to obtain database connection", e);
        }
    }

    /**
     * Void variant of {@link #required(SqlWork)}.
     */
    public void inTransaction(SqlAction action) {
        required(conn -> {
            action.execute(conn);
            return null;
        });
    }

    /**
     * Run work inside a savepoint of the current transaction. If the work throws,
     * everything it did is rolled back while the enclosing transaction stays usable.
     */
    public <T> T withSavepoint(SqlWork<T> work) {
        return required(conn -> {
            Savepoint savepoint = conn.setSavepoint();
            T result;
            try {
                result = work.execute(conn);
            } catch (SQLException | RuntimeException e) {
                conn.rollback(savepoint);
                throw e;
            }
            conn.releaseSavepoint(savepoint);
            return result;
        });
    }

    public boolean inActiveTransaction() {
        return current.get() != null;
    }

    private static void rollbackQuietly(Connection conn, Throwable cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    /**
     * Void unit of work.
     */
    @FunctionalInterface
    public interface SqlAction {
        void execute(Connection conn) throws SQLException;
    }

    /**
     * Initialize database schema.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- RECORDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS records (
                            id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            record_type         VARCHAR(64) NOT NULL,
                            is_service          BOOLEAN DEFAULT FALSE NOT NULL,
                            status              VARCHAR(20) NOT NULL,
                            manager_name        VARCHAR(255),
                            compute_tag         VARCHAR(255) NOT NULL,
                            compute_priority    INT NOT NULL,
                            specification       CLOB NOT NULL,
                            specification_hash  VARCHAR(64),
                            properties          CLOB,
                            created_on          TIMESTAMP NOT NULL,
                            modified_on         TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- COMPUTE HISTORY ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS record_compute_history (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            record_id       BIGINT NOT NULL REFERENCES records(id) ON DELETE CASCADE,
                            status          VARCHAR(20) NOT NULL,
                            manager_name    VARCHAR(255),
                            modified_on     TIMESTAMP NOT NULL,
                            provenance      CLOB,
                            stdout          CLOB,
                            error           CLOB
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            record_id       BIGINT NOT NULL UNIQUE REFERENCES records(id) ON DELETE CASCADE,
                            tag             VARCHAR(255) NOT NULL,
                            priority        INT NOT NULL,
                            available       BOOLEAN NOT NULL,
                            task_function   CLOB,
                            created_on      TIMESTAMP NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_required_programs (
                            task_id     BIGINT NOT NULL REFERENCES tasks(id) ON DELETE CASCADE,
                            program     VARCHAR(128) NOT NULL,
                            PRIMARY KEY (task_id, program)
                        );
                    """);

            // ---------- MANAGERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS compute_managers (
                            name            VARCHAR(255) PRIMARY KEY,
                            status          VARCHAR(20) NOT NULL,
                            programs        CLOB NOT NULL,
                            tags            CLOB NOT NULL,
                            successes       BIGINT DEFAULT 0 NOT NULL,
                            failures        BIGINT DEFAULT 0 NOT NULL,
                            rejected        BIGINT DEFAULT 0 NOT NULL,
                            claimed         BIGINT DEFAULT 0 NOT NULL,
                            created_on      TIMESTAMP NOT NULL,
                            modified_on     TIMESTAMP NOT NULL,
                            last_heartbeat  TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- SERVICES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS services (
                            record_id           BIGINT PRIMARY KEY REFERENCES records(id) ON DELETE CASCADE,
                            compute_tag         VARCHAR(255) NOT NULL,
                            compute_priority    INT NOT NULL,
                            find_existing       BOOLEAN DEFAULT TRUE NOT NULL,
                            service_state       CLOB,
                            created_on          TIMESTAMP NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS service_dependencies (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            service_id  BIGINT NOT NULL REFERENCES services(record_id) ON DELETE CASCADE,
                            record_id   BIGINT NOT NULL REFERENCES records(id),
                            position    INT NOT NULL,
                            extras      CLOB
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS record_children (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            parent_id   BIGINT NOT NULL REFERENCES records(id) ON DELETE CASCADE,
                            child_id    BIGINT NOT NULL REFERENCES records(id),
                            child_key   VARCHAR(255),
                            position    INT NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_tasks_claim ON tasks(available, tag, priority DESC, created_on);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_records_status ON records(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_records_hash ON records(record_type, specification_hash);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_records_manager ON records(manager_name, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_history_record ON record_compute_history(record_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_service_deps ON service_dependencies(service_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_record_children ON record_children(parent_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
