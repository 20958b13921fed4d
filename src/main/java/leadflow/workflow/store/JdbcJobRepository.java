package leadflow.workflow.store;

import leadflow.workflow.model.Cursor;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobError;
import leadflow.workflow.model.JobPatch;
import leadflow.workflow.model.JobStatus;
import leadflow.workflow.model.ProcessingOrder;
import leadflow.workflow.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final String TERMINAL_STATUSES = Arrays.stream(JobStatus.values())
            .filter(JobStatus::isTerminal)
            .map(status -> "'" + status.name() + "'")
            .collect(Collectors.joining(", "));

    private final Database db;
    private final int maxErrorsPerJob;

    public JdbcJobRepository(Database db, int maxErrorsPerJob) {
        if (maxErrorsPerJob <= 0) {
            throw new IllegalArgumentException("maxErrorsPerJob must be positive");
        }
        this.db = db;
        this.maxErrorsPerJob = maxErrorsPerJob;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, status, batch_size, processing_order, cursor_sort_key, cursor_tiebreak_id,
                                      processed_count, succeeded_count, skipped_count, failed_count,
                                      current_task, current_batch, total_records, max_batches,
                                      review_required, cancel_requested, started_by, last_error,
                                      created_at, updated_at, started_at, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = Instant.now();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Cursor cursor = job.cursor();
            ps.setString(1, job.id());
            ps.setString(2, job.status().name());
            ps.setInt(3, job.batchSize());
            ps.setString(4, job.order().name());
            ps.setObject(5, cursor != null ? toOffset(cursor.sortKey()) : null);
            ps.setString(6, cursor != null ? cursor.tiebreakId() : null);
            ps.setInt(7, job.processed());
            ps.setInt(8, job.succeeded());
            ps.setInt(9, job.skipped());
            ps.setInt(10, job.failed());
            ps.setString(11, job.currentTask());
            ps.setInt(12, job.currentBatch());
            ps.setInt(13, job.totalRecords());
            setNullableInt(ps, 14, job.maxBatchesThisRun());
            ps.setBoolean(15, job.reviewRequired());
            ps.setBoolean(16, job.cancelRequested());
            ps.setString(17, job.startedBy());
            ps.setString(18, job.error());
            ps.setTimestamp(19, Timestamp.from(job.createdAt() != null ? job.createdAt() : now));
            ps.setTimestamp(20, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : now));
            ps.setTimestamp(21, toTimestamp(job.startedAt()));
            ps.setTimestamp(22, toTimestamp(job.completedAt()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                Job job = mapRow(rs);
                List<JobError> errors = loadErrors(conn, jobId);
                return Optional.of(job.toBuilder().errors(errors).build());
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findAll() {
        String sql = "SELECT * FROM jobs ORDER BY created_at DESC";
        return executeQuery(sql);
    }

    @Override
    public List<Job> findByStatus(JobStatus status, int limit) {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs by status", e);
        }
    }

    @Override
    public List<Job> findRecent(int limit) {
        String sql = "SELECT * FROM jobs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent jobs", e);
        }
    }

    @Override
    public boolean updateStatus(String jobId, JobPatch patch) {
        List<String> sets = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (patch.status() != null) {
            sets.add("status = ?");
            params.add(patch.status().name());
        }
        if (patch.cursor() != null) {
            sets.add("cursor_sort_key = ?");
            params.add(toOffset(patch.cursor().sortKey()));
            sets.add("cursor_tiebreak_id = ?");
            params.add(patch.cursor().tiebreakId());
        }
        if (patch.hasCounterDeltas()) {
            sets.add("processed_count = processed_count + ?");
            params.add(patch.processedDelta());
            sets.add("succeeded_count = succeeded_count + ?");
            params.add(patch.succeededDelta());
            sets.add("skipped_count = skipped_count + ?");
            params.add(patch.skippedDelta());
            sets.add("failed_count = failed_count + ?");
            params.add(patch.failedDelta());
        }
        if (patch.currentTask() != null) {
            sets.add("current_task = ?");
            params.add(patch.currentTask());
        }
        if (patch.currentBatch() != null) {
            sets.add("current_batch = ?");
            params.add(patch.currentBatch());
        }
        if (patch.maxBatchesThisRun() != null) {
            sets.add("max_batches = ?");
            params.add(patch.maxBatchesThisRun());
        }
        if (patch.cancelRequested() != null) {
            sets.add("cancel_requested = ?");
            params.add(patch.cancelRequested());
        }
        if (patch.startedAt() != null) {
            sets.add("started_at = COALESCE(started_at, ?)");
            params.add(Timestamp.from(patch.startedAt()));
        }
        if (patch.completedAt() != null) {
            sets.add("completed_at = ?");
            params.add(Timestamp.from(patch.completedAt()));
        }
        if (patch.error() != null) {
            sets.add("last_error = ?");
            params.add(patch.error());
        } else if (patch.isClearError()) {
            sets.add("last_error = NULL");
        }
        sets.add("updated_at = ?");
        params.add(Timestamp.from(Instant.now()));

        String sql = "UPDATE jobs SET " + String.join(", ", sets) + " WHERE id = ?";
        if (patch.isOnlyIfActive()) {
            sql += " AND status NOT IN (" + TERMINAL_STATUSES + ")";
        }

        try (Connection conn = db.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int i = 1;
                for (Object param : params) {
                    ps.setObject(i++, param);
                }
                ps.setString(i, jobId);
                updated = ps.executeUpdate();
            }

            if (updated == 0) {
                conn.rollback();
                return false;
            }

            List<JobError> newErrors = patch.newErrors();
            if (!newErrors.isEmpty()) {
                insertErrors(conn, jobId, newErrors);
                trimErrors(conn, jobId);
            }

            conn.commit();
            return true;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + jobId, e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        // Children first, then the job
        try (Connection conn = db.getConnection()) {
            for (String child : List.of(
                    "DELETE FROM verification_results WHERE job_id = ?",
                    "DELETE FROM pending_reviews WHERE job_id = ?",
                    "DELETE FROM job_errors WHERE job_id = ?")) {
                try (PreparedStatement ps = conn.prepareStatement(child)) {
                    ps.setString(1, jobId);
                    ps.executeUpdate();
                }
            }

            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                ps.setString(1, jobId);
                int deleted = ps.executeUpdate();
                conn.commit();
                return deleted > 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete job: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Errors ---

    private void insertErrors(Connection conn, String jobId, List<JobError> errors) throws SQLException {
        String sql = "INSERT INTO job_errors (job_id, record_id, message, created_at) VALUES (?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (JobError error : errors) {
                ps.setString(1, jobId);
                ps.setString(2, error.recordId());
                ps.setString(3, truncate(error.message(), 4096));
                ps.setTimestamp(4, Timestamp.from(error.timestamp() != null ? error.timestamp() : Instant.now()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    /** Keep only the newest {@code maxErrorsPerJob} entries. */
    private void trimErrors(Connection conn, String jobId) throws SQLException {
        String boundarySql = "SELECT id FROM job_errors WHERE job_id = ? ORDER BY id DESC LIMIT 1 OFFSET ?";
        Long boundary = null;
        try (PreparedStatement ps = conn.prepareStatement(boundarySql)) {
            ps.setString(1, jobId);
            ps.setInt(2, maxErrorsPerJob);
            ResultSet rs = ps.executeQuery();
            if (rs.next()) {
                boundary = rs.getLong(1);
            }
        }
        if (boundary == null) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM job_errors WHERE job_id = ? AND id <= ?")) {
            ps.setString(1, jobId);
            ps.setLong(2, boundary);
            int trimmed = ps.executeUpdate();
            log.debug("Trimmed {} old errors of job {}", trimmed, jobId);
        }
    }

    private List<JobError> loadErrors(Connection conn, String jobId) throws SQLException {
        String sql = "SELECT record_id, message, created_at FROM job_errors WHERE job_id = ? ORDER BY id ASC";
        List<JobError> errors = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();
            while (rs.next()) {
                errors.add(new JobError(
                        rs.getString("record_id"),
                        rs.getString("message"),
                        toInstant(rs.getTimestamp("created_at"))));
            }
        }
        return errors;
    }

    // --- Helpers ---

    private List<Job> executeQuery(String sql) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to execute query", e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        ResultSet rs = ps.executeQuery();
        while (rs.next()) {
            jobs.add(mapRow(rs));
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        OffsetDateTime sortKey = rs.getObject("cursor_sort_key", OffsetDateTime.class);
        String tiebreakId = rs.getString("cursor_tiebreak_id");
        Cursor cursor = sortKey != null && tiebreakId != null
                ? new Cursor(sortKey.toInstant(), tiebreakId)
                : null;

        int maxBatches = rs.getInt("max_batches");
        Integer maxBatchesThisRun = rs.wasNull() ? null : maxBatches;

        return Job.builder()
                .id(rs.getString("id"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .batchSize(rs.getInt("batch_size"))
                .order(ProcessingOrder.valueOf(rs.getString("processing_order")))
                .cursor(cursor)
                .processed(rs.getInt("processed_count"))
                .succeeded(rs.getInt("succeeded_count"))
                .skipped(rs.getInt("skipped_count"))
                .failed(rs.getInt("failed_count"))
                .currentTask(rs.getString("current_task"))
                .currentBatch(rs.getInt("current_batch"))
                .totalRecords(rs.getInt("total_records"))
                .maxBatchesThisRun(maxBatchesThisRun)
                .reviewRequired(rs.getBoolean("review_required"))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .startedBy(rs.getString("started_by"))
                .error(rs.getString("last_error"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    static OffsetDateTime toOffset(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
