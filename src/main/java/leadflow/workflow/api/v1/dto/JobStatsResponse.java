package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import leadflow.workflow.model.JobStats;

/**
 * Response DTO for per-outcome result counts.
 * GET /api/v1/jobs/{jobId}/stats
 */
public record JobStatsResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("total") int total,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("updated") int updated,
        @JsonProperty("noChange") int noChange,
        @JsonProperty("failed") int failed,
        @JsonProperty("averageDurationMs") long averageDurationMs) {

    public static JobStatsResponse from(JobStats stats) {
        return new JobStatsResponse(
                stats.jobId(),
                stats.total(),
                stats.skipped(),
                stats.updated(),
                stats.noChange(),
                stats.failed(),
                stats.averageDurationMs());
    }
}
