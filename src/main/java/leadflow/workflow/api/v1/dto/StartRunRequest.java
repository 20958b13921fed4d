package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import leadflow.workflow.model.ProcessingOrder;

/**
 * Request DTO for starting a run.
 * POST /api/v1/jobs
 * All fields are optional.
 */
public record StartRunRequest(
        @JsonProperty("batchSize") Integer batchSize,
        @JsonProperty("order") String order,
        @JsonProperty("maxBatches") Integer maxBatches,
        @JsonProperty("reviewRequired") Boolean reviewRequired,
        @JsonProperty("startedBy") String startedBy) {

    /** Empty request: every setting takes its default */
    public static StartRunRequest defaults() {
        return new StartRunRequest(null, null, null, null, null);
    }

    /** Parsed order, or null for the default */
    public ProcessingOrder processingOrder() {
        return ProcessingOrder.fromWire(order);
    }

    public boolean isReviewRequired() {
        return Boolean.TRUE.equals(reviewRequired);
    }

    /** Validate the request */
    public void validate() {
        if (batchSize != null && batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (maxBatches != null && maxBatches <= 0) {
            throw new IllegalArgumentException("maxBatches must be positive");
        }
        processingOrder();
    }
}
