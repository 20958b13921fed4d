package leadflow.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import leadflow.workflow.model.Cursor;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobError;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") String status,
        @JsonProperty("batchSize") int batchSize,
        @JsonProperty("order") String order,
        @JsonProperty("processed") int processed,
        @JsonProperty("updated") int updated,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("failed") int failed,
        @JsonProperty("totalRecords") int totalRecords,
        @JsonProperty("progressPercent") int progressPercent,
        @JsonProperty("currentTask") String currentTask,
        @JsonProperty("currentBatch") int currentBatch,
        @JsonProperty("cursor") CursorResponse cursor,
        @JsonProperty("reviewRequired") boolean reviewRequired,
        @JsonProperty("cancelRequested") boolean cancelRequested,
        @JsonProperty("startedBy") String startedBy,
        @JsonProperty("error") String error,
        @JsonProperty("lastError") ErrorEntry lastError,
        @JsonProperty("errors") List<ErrorEntry> errors,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public record CursorResponse(
            @JsonProperty("sortKey") Instant sortKey,
            @JsonProperty("tiebreakId") String tiebreakId) {
        static CursorResponse from(Cursor cursor) {
            return cursor != null ? new CursorResponse(cursor.sortKey(), cursor.tiebreakId()) : null;
        }
    }

    public record ErrorEntry(
            @JsonProperty("recordId") String recordId,
            @JsonProperty("error") String error,
            @JsonProperty("timestamp") Instant timestamp) {
        public static ErrorEntry from(JobError error) {
            return new ErrorEntry(error.recordId(), error.message(), error.timestamp());
        }
    }

    /** Create response from domain model, including recent errors */
    public static JobResponse from(Job job) {
        List<ErrorEntry> errors = job.errors().stream()
                .map(ErrorEntry::from)
                .toList();
        ErrorEntry lastError = errors.isEmpty() ? null : errors.get(errors.size() - 1);

        return new JobResponse(
                job.id(),
                job.status().name(),
                job.batchSize(),
                job.order().wireName(),
                job.processed(),
                job.succeeded(),
                job.skipped(),
                job.failed(),
                job.totalRecords(),
                job.progressPercent(),
                job.currentTask(),
                job.currentBatch(),
                CursorResponse.from(job.cursor()),
                job.reviewRequired(),
                job.cancelRequested(),
                job.startedBy(),
                job.error(),
                lastError,
                errors,
                job.createdAt(),
                job.updatedAt(),
                job.startedAt(),
                job.completedAt());
    }

    /** Compact version for list responses */
    public JobResponse compact() {
        return new JobResponse(
                jobId, status, batchSize, order, processed, updated, skipped, failed, totalRecords,
                progressPercent, currentTask, currentBatch, cursor, reviewRequired, cancelRequested,
                startedBy, error, lastError, null, createdAt, updatedAt, startedAt, completedAt);
    }
}
