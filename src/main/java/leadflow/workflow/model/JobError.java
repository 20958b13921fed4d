package leadflow.workflow.model;

import java.time.Instant;

/**
 * Per-record error kept on the job for display. Only the most recent entries are retained.
 */
public record JobError(String recordId, String message, Instant timestamp) {
}
