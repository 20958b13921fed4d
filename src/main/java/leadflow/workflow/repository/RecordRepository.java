package leadflow.workflow.repository;

import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.model.Viability;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the lead records walked by verification jobs.
 */
public interface RecordRepository extends RecordSource {

    void save(SourceRecord record);

    /**
     * Insert records in one transaction.
     *
     * @throws IllegalArgumentException if an id already exists
     */
    void saveAll(List<SourceRecord> records);

    Optional<SourceRecord> findById(String recordId);

    int count();

    /** Replace the source link and stamp the check time. */
    boolean updateSourceUrl(String recordId, String sourceUrl, Instant checkedAt);

    /** Stamp the check time without changing the link. */
    boolean markChecked(String recordId, Instant checkedAt);

    boolean updateViability(String recordId, Viability viability);
}
