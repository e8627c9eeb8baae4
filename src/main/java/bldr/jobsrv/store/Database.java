package bldr.jobsrv.store;

import bldr.jobsrv.config.JobServerConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(JobServerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("jobsrv-db-pool");
        hikariConfig.setAutoCommit(false);
        hikariConfig.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

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

            // ---------- GROUPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_groups (
                            id               VARCHAR(64) PRIMARY KEY,
                            target           VARCHAR(128) NOT NULL,
                            state            VARCHAR(20) DEFAULT 'QUEUED' NOT NULL,
                            cancel_requested BOOLEAN DEFAULT FALSE NOT NULL,
                            version          BIGINT DEFAULT 0 NOT NULL,
                            created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            completed_at     TIMESTAMP
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            group_id        VARCHAR(64) NOT NULL REFERENCES job_groups(id),
                            job_order       INT DEFAULT 0 NOT NULL,
                            project_name    VARCHAR(512) NOT NULL,
                            project_target  VARCHAR(128) NOT NULL,
                            required_tags   VARCHAR(1024),
                            inputs_ref      VARCHAR(1024),
                            state           VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            worker_id       VARCHAR(64),
                            retry_count     INT DEFAULT 0 NOT NULL,
                            max_retries     INT DEFAULT 3 NOT NULL,
                            failure_reason  VARCHAR(2048),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            dispatched_at   TIMESTAMP,
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP
                        );
                    """);

            // ---------- DEPENDENCY EDGES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_dependencies (
                            job_id            VARCHAR(64) NOT NULL REFERENCES jobs(id),
                            depends_on_job_id VARCHAR(64) NOT NULL REFERENCES jobs(id),
                            dep_order         INT DEFAULT 0 NOT NULL,
                            PRIMARY KEY (job_id, depends_on_job_id)
                        );
                    """);

            // ---------- WORKERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workers (
                            id              VARCHAR(64) PRIMARY KEY,
                            tags            VARCHAR(1024),
                            capacity        INT DEFAULT 1 NOT NULL,
                            endpoint        VARCHAR(1024),
                            status          VARCHAR(20) DEFAULT 'ALIVE' NOT NULL,
                            suspect         BOOLEAN DEFAULT FALSE NOT NULL,
                            active_jobs     INT DEFAULT 0 NOT NULL,
                            last_heartbeat  TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            idle_since      TIMESTAMP,
                            registered_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT chk_worker_load CHECK (active_jobs >= 0)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_group ON jobs(group_id, job_order);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_state_created ON jobs(state, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_worker_state ON jobs(worker_id, state);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_deps_target ON job_dependencies(depends_on_job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_groups_state ON job_groups(state);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workers_heartbeat ON workers(status, last_heartbeat);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
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
