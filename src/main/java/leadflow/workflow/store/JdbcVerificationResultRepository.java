package leadflow.workflow.store;

import leadflow.workflow.model.JobStats;
import leadflow.workflow.model.Outcome;
import leadflow.workflow.model.VerificationResult;
import leadflow.workflow.repository.VerificationResultRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static leadflow.workflow.store.JdbcJobRepository.toInstant;

/**
 * JDBC implementation of VerificationResultRepository.
 */
public class JdbcVerificationResultRepository implements VerificationResultRepository {

    private final Database db;

    public JdbcVerificationResultRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(VerificationResult result) {
        String sql = """
                    INSERT INTO verification_results (job_id, record_id, outcome, before_value, after_value,
                                                      detail, duration_ms, error, verified_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result.jobId());
            ps.setString(2, result.recordId());
            ps.setString(3, result.outcome().name());
            ps.setString(4, result.beforeValue());
            ps.setString(5, result.afterValue());
            ps.setString(6, result.detail());
            if (result.durationMs() != null) {
                ps.setLong(7, result.durationMs());
            } else {
                ps.setNull(7, Types.BIGINT);
            }
            ps.setString(8, result.error());
            ps.setTimestamp(9, Timestamp.from(result.verifiedAt() != null ? result.verifiedAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save verification result for record: " + result.recordId(), e);
        }
    }

    @Override
    public List<VerificationResult> findByJobId(String jobId, Outcome outcome, int limit) {
        String sql = outcome == null
                ? "SELECT * FROM verification_results WHERE job_id = ? ORDER BY id DESC LIMIT ?"
                : "SELECT * FROM verification_results WHERE job_id = ? AND outcome = ? ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, jobId);
            if (outcome != null) {
                ps.setString(i++, outcome.name());
            }
            ps.setInt(i, limit);

            List<VerificationResult> results = new ArrayList<>();
            ResultSet rs = ps.executeQuery();
            while (rs.next()) {
                results.add(mapRow(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find verification results for job: " + jobId, e);
        }
    }

    @Override
    public JobStats stats(String jobId) {
        String sql = """
                    SELECT COUNT(*) AS total,
                           SUM(CASE WHEN outcome = 'SKIPPED' THEN 1 ELSE 0 END) AS skipped,
                           SUM(CASE WHEN outcome = 'UPDATED' THEN 1 ELSE 0 END) AS updated,
                           SUM(CASE WHEN outcome = 'NO_CHANGE' THEN 1 ELSE 0 END) AS no_change,
                           SUM(CASE WHEN outcome = 'FAILED' THEN 1 ELSE 0 END) AS failed,
                           COALESCE(AVG(duration_ms), 0) AS avg_duration
                    FROM verification_results
                    WHERE job_id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();
            if (!rs.next()) {
                return new JobStats(jobId, 0, 0, 0, 0, 0, 0);
            }
            return new JobStats(
                    jobId,
                    rs.getInt("total"),
                    rs.getInt("skipped"),
                    rs.getInt("updated"),
                    rs.getInt("no_change"),
                    rs.getInt("failed"),
                    Math.round(rs.getDouble("avg_duration")));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute stats for job: " + jobId, e);
        }
    }

    private VerificationResult mapRow(ResultSet rs) throws SQLException {
        long duration = rs.getLong("duration_ms");
        Long durationMs = rs.wasNull() ? null : duration;

        return VerificationResult.builder()
                .id(rs.getLong("id"))
                .jobId(rs.getString("job_id"))
                .recordId(rs.getString("record_id"))
                .outcome(Outcome.valueOf(rs.getString("outcome")))
                .beforeValue(rs.getString("before_value"))
                .afterValue(rs.getString("after_value"))
                .detail(rs.getString("detail"))
                .durationMs(durationMs)
                .error(rs.getString("error"))
                .verifiedAt(toInstant(rs.getTimestamp("verified_at")))
                .build();
    }
}
