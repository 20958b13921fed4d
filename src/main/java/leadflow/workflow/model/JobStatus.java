package leadflow.workflow.model;

/**
 * Lifecycle state of a batch workflow job.
 */
public enum JobStatus {
    /** Job created, orchestrator has not picked it up yet */
    PENDING,
    /** An orchestrator invocation is walking the record set */
    RUNNING,
    /** Traversal finished, waiting for a reviewer's resume signal */
    PAUSED,
    /** All pages processed (and reviewed, for review jobs) */
    COMPLETED,
    /** Cancellation observed by the orchestrator */
    CANCELED,
    /** Page-level failure; resumable from the last committed cursor */
    FAILED;

    /** Terminal statuses allow deletion and reject cancellation. */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELED || this == FAILED;
    }

    /** Case-insensitive parse that also accepts the British spelling used by older clients. */
    public static JobStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        String normalized = value.trim().toUpperCase();
        if ("CANCELLED".equals(normalized)) {
            return CANCELED;
        }
        try {
            return JobStatus.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + value);
        }
    }
}
