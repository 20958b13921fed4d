package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import leadflow.workflow.model.VerificationResult;

import java.time.Instant;

/**
 * Response DTO for one verification result.
 * GET /api/v1/jobs/{jobId}/results
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResultResponse(
        @JsonProperty("recordId") String recordId,
        @JsonProperty("result") String result,
        @JsonProperty("originalUrl") String originalUrl,
        @JsonProperty("newUrl") String newUrl,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("durationMs") Long durationMs,
        @JsonProperty("error") String error,
        @JsonProperty("verifiedAt") Instant verifiedAt) {

    public static VerificationResultResponse from(VerificationResult result) {
        return new VerificationResultResponse(
                result.recordId(),
                result.outcome().wireName(),
                result.beforeValue(),
                result.afterValue(),
                result.detail(),
                result.durationMs(),
                result.error(),
                result.verifiedAt());
    }
}
