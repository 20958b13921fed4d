package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import leadflow.workflow.model.SourceRecord;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for adding leads to the collection.
 * POST /api/v1/records
 */
public record IngestRecordsRequest(
        @JsonProperty("records") List<RecordEntry> records) {

    public record RecordEntry(
            @JsonProperty("id") String id,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("title") String title,
            @JsonProperty("sourceUrl") String sourceUrl) {

        SourceRecord toModel() {
            return SourceRecord.of(id.trim(), createdAt, title, sourceUrl);
        }
    }

    /** Validate the request */
    public void validate() {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("records must not be empty");
        }
        for (int i = 0; i < records.size(); i++) {
            RecordEntry entry = records.get(i);
            if (entry == null) {
                throw new IllegalArgumentException("records[" + i + "] is null");
            }
            if (entry.id() == null || entry.id().isBlank()) {
                throw new IllegalArgumentException("records[" + i + "].id is required");
            }
            if (entry.createdAt() == null) {
                throw new IllegalArgumentException("records[" + i + "].createdAt is required");
            }
        }
    }

    public List<SourceRecord> toModels() {
        return records.stream()
                .map(RecordEntry::toModel)
                .toList();
    }
}
