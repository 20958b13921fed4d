package leadflow.workflow.model;

/**
 * Aggregates over a job's verification results.
 */
public record JobStats(
        String jobId,
        int total,
        int skipped,
        int updated,
        int noChange,
        int failed,
        long averageDurationMs) {
}
