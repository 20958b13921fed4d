package leadflow.workflow.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import leadflow.workflow.config.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(WorkflowConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("leadflow-db-pool");
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

    /**
     * Get the underlying DataSource (for frameworks that need it).
     */
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

    /**
     * Initialize database schema.
     * Sort keys and cursors use TIMESTAMP WITH TIME ZONE so equality lookups on the
     * pagination key do not depend on the JVM's default zone.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            status              VARCHAR(20) DEFAULT 'PENDING',
                            batch_size          INT NOT NULL,
                            processing_order    VARCHAR(20) NOT NULL,
                            cursor_sort_key     TIMESTAMP WITH TIME ZONE,
                            cursor_tiebreak_id  VARCHAR(128),
                            processed_count     INT DEFAULT 0,
                            succeeded_count     INT DEFAULT 0,
                            skipped_count       INT DEFAULT 0,
                            failed_count        INT DEFAULT 0,
                            current_task        VARCHAR(1024),
                            current_batch       INT DEFAULT 0,
                            total_records       INT DEFAULT 0,
                            max_batches         INT,
                            review_required     BOOLEAN DEFAULT FALSE,
                            cancel_requested    BOOLEAN DEFAULT FALSE,
                            started_by          VARCHAR(256),
                            last_error          VARCHAR(4096),
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at          TIMESTAMP,
                            completed_at        TIMESTAMP
                        );
                    """);

            // ---------- JOB ERRORS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_errors (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id      VARCHAR(64) NOT NULL,
                            record_id   VARCHAR(128),
                            message     VARCHAR(4096),
                            created_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- RECORDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS records (
                            id               VARCHAR(128) PRIMARY KEY,
                            created_at       TIMESTAMP WITH TIME ZONE NOT NULL,
                            title            VARCHAR(1024),
                            source_url       VARCHAR(2048),
                            last_checked_at  TIMESTAMP,
                            viability        VARCHAR(20) DEFAULT 'UNREVIEWED'
                        );
                    """);

            // ---------- VERIFICATION RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS verification_results (
                            id            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id        VARCHAR(64) NOT NULL,
                            record_id     VARCHAR(128) NOT NULL,
                            outcome       VARCHAR(20) NOT NULL,
                            before_value  VARCHAR(2048),
                            after_value   VARCHAR(2048),
                            detail        CLOB,
                            duration_ms   BIGINT,
                            error         VARCHAR(4096),
                            verified_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- PENDING REVIEWS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS pending_reviews (
                            id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id     VARCHAR(64) NOT NULL,
                            record_id  VARCHAR(128) NOT NULL,
                            added_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_pending_reviews UNIQUE (job_id, record_id)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_records_created ON records(created_at, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_errors_job ON job_errors(job_id, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_job ON verification_results(job_id, id);");

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
