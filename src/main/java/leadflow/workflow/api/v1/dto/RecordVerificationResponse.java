package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import leadflow.workflow.model.RecordVerification;

/**
 * Response DTO for an on-demand check of one record.
 * POST /api/v1/records/{recordId}/verify
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordVerificationResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("recordId") String recordId,
        @JsonProperty("result") String result,
        @JsonProperty("originalUrl") String originalUrl,
        @JsonProperty("newUrl") String newUrl,
        @JsonProperty("reasoning") String reasoning) {

    public static RecordVerificationResponse from(RecordVerification verification) {
        return new RecordVerificationResponse(
                verification.success(),
                verification.jobId(),
                verification.recordId(),
                verification.outcome().wireName(),
                verification.originalUrl(),
                verification.newUrl(),
                verification.detail());
    }
}
