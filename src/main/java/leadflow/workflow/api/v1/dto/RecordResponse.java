package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import leadflow.workflow.model.SourceRecord;

import java.time.Instant;

/**
 * Response DTO for a lead record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordResponse(
        @JsonProperty("id") String id,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("title") String title,
        @JsonProperty("sourceUrl") String sourceUrl,
        @JsonProperty("lastCheckedAt") Instant lastCheckedAt,
        @JsonProperty("viability") String viability) {

    public static RecordResponse from(SourceRecord record) {
        return new RecordResponse(
                record.id(),
                record.createdAt(),
                record.title(),
                record.sourceUrl(),
                record.lastCheckedAt(),
                record.viability().name());
    }
}
