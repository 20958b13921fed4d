package leadflow.workflow.store;

import leadflow.workflow.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JDBC implementation of ReviewRepository.
 */
public class JdbcReviewRepository implements ReviewRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcReviewRepository.class);

    private final Database db;

    public JdbcReviewRepository(Database db) {
        this.db = db;
    }

    @Override
    public int addAll(String jobId, Collection<String> recordIds) {
        if (recordIds.isEmpty()) {
            return 0;
        }

        String existsSql = "SELECT 1 FROM pending_reviews WHERE job_id = ? AND record_id = ?";
        String insertSql = "INSERT INTO pending_reviews (job_id, record_id, added_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement exists = conn.prepareStatement(existsSql);
                PreparedStatement insert = conn.prepareStatement(insertSql)) {

            int added = 0;
            Timestamp now = Timestamp.from(Instant.now());
            for (String recordId : recordIds) {
                exists.setString(1, jobId);
                exists.setString(2, recordId);
                if (exists.executeQuery().next()) {
                    continue;
                }
                insert.setString(1, jobId);
                insert.setString(2, recordId);
                insert.setTimestamp(3, now);
                insert.executeUpdate();
                added++;
            }
            conn.commit();

            log.debug("Added {} pending reviews to job {}", added, jobId);
            return added;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to add pending reviews for job: " + jobId, e);
        }
    }

    @Override
    public List<String> findByJobId(String jobId) {
        String sql = "SELECT record_id FROM pending_reviews WHERE job_id = ? ORDER BY id ASC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<String> ids = new ArrayList<>();
            ResultSet rs = ps.executeQuery();
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find pending reviews for job: " + jobId, e);
        }
    }

    @Override
    public boolean remove(String jobId, String recordId) {
        String sql = "DELETE FROM pending_reviews WHERE job_id = ? AND record_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, recordId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove pending review: " + recordId, e);
        }
    }

    @Override
    public int count(String jobId) {
        String sql = "SELECT COUNT(*) FROM pending_reviews WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count pending reviews for job: " + jobId, e);
        }
    }
}
