package leadflow.workflow.store;

import leadflow.workflow.model.ProcessingOrder;
import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.model.Viability;
import leadflow.workflow.repository.RecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static leadflow.workflow.store.JdbcJobRepository.toInstant;
import static leadflow.workflow.store.JdbcJobRepository.toOffset;
import static leadflow.workflow.store.JdbcJobRepository.toTimestamp;

/**
 * JDBC implementation of RecordRepository.
 * Ordered queries run on the {@code (created_at, id)} index.
 */
public class JdbcRecordRepository implements RecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordRepository.class);

    private final Database db;

    public JdbcRecordRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(SourceRecord record) {
        saveAll(List.of(record));
    }

    @Override
    public void saveAll(List<SourceRecord> records) {
        if (records.isEmpty()) {
            return;
        }

        String sql = """
                    INSERT INTO records (id, created_at, title, source_url, last_checked_at, viability)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        Set<String> ids = new HashSet<>();
        for (SourceRecord record : records) {
            if (!ids.add(record.id())) {
                throw new IllegalArgumentException("Duplicate record id in request: " + record.id());
            }
        }

        try (Connection conn = db.getConnection()) {
            for (SourceRecord record : records) {
                if (exists(conn, record.id())) {
                    conn.rollback();
                    throw new IllegalArgumentException("Record already exists: " + record.id());
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (SourceRecord record : records) {
                    ps.setString(1, record.id());
                    ps.setObject(2, toOffset(record.createdAt()));
                    ps.setString(3, record.title());
                    ps.setString(4, record.sourceUrl());
                    ps.setTimestamp(5, toTimestamp(record.lastCheckedAt()));
                    ps.setString(6, record.viability().name());
                    ps.addBatch();
                }
                ps.executeBatch();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            conn.commit();

            log.debug("Saved {} records", records.size());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save records", e);
        }
    }

    @Override
    public Optional<SourceRecord> findById(String recordId) {
        String sql = "SELECT * FROM records WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, recordId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find record: " + recordId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM records")) {
            ResultSet rs = ps.executeQuery();
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count records", e);
        }
    }

    @Override
    public boolean updateSourceUrl(String recordId, String sourceUrl, Instant checkedAt) {
        String sql = "UPDATE records SET source_url = ?, last_checked_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sourceUrl);
            ps.setTimestamp(2, toTimestamp(checkedAt));
            ps.setString(3, recordId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update source url: " + recordId, e);
        }
    }

    @Override
    public boolean markChecked(String recordId, Instant checkedAt) {
        String sql = "UPDATE records SET last_checked_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, toTimestamp(checkedAt));
            ps.setString(2, recordId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark record checked: " + recordId, e);
        }
    }

    @Override
    public boolean updateViability(String recordId, Viability viability) {
        String sql = "UPDATE records SET viability = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, viability.name());
            ps.setString(2, recordId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update viability: " + recordId, e);
        }
    }

    // --- RecordSource ---

    @Override
    public List<SourceRecord> fetchFirst(ProcessingOrder order, int limit) {
        String direction = direction(order);
        String sql = "SELECT * FROM records ORDER BY created_at " + direction + ", id " + direction + " LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fetch first records", e);
        }
    }

    @Override
    public List<SourceRecord> fetchBeyond(ProcessingOrder order, Instant sortKey, int limit) {
        String direction = direction(order);
        String comparison = order.isDescending() ? "<" : ">";
        String sql = "SELECT * FROM records WHERE created_at " + comparison + " ?"
                + " ORDER BY created_at " + direction + ", id " + direction + " LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, toOffset(sortKey));
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fetch records beyond " + sortKey, e);
        }
    }

    @Override
    public List<SourceRecord> fetchTies(ProcessingOrder order, Instant sortKey, String afterId, int limit) {
        String comparison = order.isDescending() ? "<" : ">";
        String sql = "SELECT * FROM records WHERE created_at = ? AND id " + comparison + " ?"
                + " ORDER BY id " + direction(order) + " LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, toOffset(sortKey));
            ps.setString(2, afterId);
            ps.setInt(3, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fetch records tied at " + sortKey, e);
        }
    }

    // --- Helpers ---

    private boolean exists(Connection conn, String recordId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM records WHERE id = ?")) {
            ps.setString(1, recordId);
            return ps.executeQuery().next();
        }
    }

    private static String direction(ProcessingOrder order) {
        return order.isDescending() ? "DESC" : "ASC";
    }

    private List<SourceRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<SourceRecord> records = new ArrayList<>();
        ResultSet rs = ps.executeQuery();
        while (rs.next()) {
            records.add(mapRow(rs));
        }
        return records;
    }

    private SourceRecord mapRow(ResultSet rs) throws SQLException {
        String viability = rs.getString("viability");
        return new SourceRecord(
                rs.getString("id"),
                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getString("title"),
                rs.getString("source_url"),
                toInstant(rs.getTimestamp("last_checked_at")),
                viability != null ? Viability.valueOf(viability) : Viability.UNREVIEWED);
    }
}
