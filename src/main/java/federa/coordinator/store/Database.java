package federa.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import federa.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management for the task queue.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("federa-db-pool");
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

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS runs (
                            id              BIGINT PRIMARY KEY,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- NODES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS nodes (
                            id              BIGINT PRIMARY KEY,
                            anonymous       BOOLEAN DEFAULT FALSE,
                            registered_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- INSTRUCTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_ins (
                            id              VARCHAR(64) PRIMARY KEY,
                            group_id        VARCHAR(256) NOT NULL,
                            run_id          BIGINT NOT NULL,
                            node_id         BIGINT NOT NULL,
                            task_type       VARCHAR(32) NOT NULL,
                            ttl             VARCHAR(64) NOT NULL,
                            content         CLOB NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            delivered_at    TIMESTAMP
                        );
                    """);

            // ---------- RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_res (
                            id              VARCHAR(64) PRIMARY KEY,
                            group_id        VARCHAR(256) NOT NULL,
                            run_id          BIGINT NOT NULL,
                            node_id         BIGINT NOT NULL,
                            task_ins_id     VARCHAR(64) NOT NULL,
                            task_type       VARCHAR(32) NOT NULL,
                            content         CLOB NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            delivered_at    TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_ins_node_pending ON task_ins(node_id, delivered_at, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_res_ins ON task_res(task_ins_id, delivered_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_ins_created ON task_ins(created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_res_created ON task_res(created_at);");

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
