package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for resuming a run.
 * POST /api/v1/jobs/{jobId}/resume
 */
public record ResumeRunRequest(
        @JsonProperty("maxBatches") Integer maxBatches) {

    public void validate() {
        if (maxBatches != null && maxBatches <= 0) {
            throw new IllegalArgumentException("maxBatches must be positive");
        }
    }
}
