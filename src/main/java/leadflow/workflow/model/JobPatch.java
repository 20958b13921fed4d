package leadflow.workflow.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Merge-patch for a job record. Unset fields are left unchanged; counter fields are
 * increments rather than absolute values so a page commit can be applied in one statement.
 */
public final class JobPatch {
    private JobStatus status;
    private Cursor cursor;
    private int processedDelta;
    private int succeededDelta;
    private int skippedDelta;
    private int failedDelta;
    private String currentTask;
    private Integer currentBatch;
    private Integer maxBatchesThisRun;
    private Boolean cancelRequested;
    private Instant startedAt;
    private Instant completedAt;
    private String error;
    private boolean clearError;
    private boolean onlyIfActive;
    private final List<JobError> newErrors = new ArrayList<>();

    private JobPatch() {
    }

    public static JobPatch create() {
        return new JobPatch();
    }

    /** Patch that records one committed page: new cursor plus counter increments and errors. */
    public static JobPatch pageCommitted(Cursor cursor, BatchResult result, int batchNumber, String currentTask) {
        return create()
                .cursor(cursor)
                .counters(result)
                .currentBatch(batchNumber)
                .currentTask(currentTask)
                .errors(result.errors());
    }

    public JobPatch status(JobStatus status) {
        this.status = status;
        return this;
    }

    public JobPatch cursor(Cursor cursor) {
        this.cursor = cursor;
        return this;
    }

    public JobPatch counters(BatchResult result) {
        this.processedDelta += result.processed();
        this.succeededDelta += result.updated();
        this.skippedDelta += result.skipped();
        this.failedDelta += result.failed();
        return this;
    }

    public JobPatch currentTask(String currentTask) {
        this.currentTask = currentTask;
        return this;
    }

    public JobPatch currentBatch(int currentBatch) {
        this.currentBatch = currentBatch;
        return this;
    }

    public JobPatch maxBatchesThisRun(int maxBatchesThisRun) {
        this.maxBatchesThisRun = maxBatchesThisRun;
        return this;
    }

    public JobPatch cancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
        return this;
    }

    public JobPatch startedAt(Instant startedAt) {
        this.startedAt = startedAt;
        return this;
    }

    public JobPatch completedAt(Instant completedAt) {
        this.completedAt = completedAt;
        return this;
    }

    public JobPatch error(String error) {
        this.error = error;
        this.clearError = false;
        return this;
    }

    public JobPatch clearError() {
        this.error = null;
        this.clearError = true;
        return this;
    }

    /** Apply only while the job is not in a terminal status. */
    public JobPatch onlyIfActive() {
        this.onlyIfActive = true;
        return this;
    }

    public JobPatch errors(List<JobError> errors) {
        this.newErrors.addAll(errors);
        return this;
    }

    public JobStatus status() {
        return status;
    }

    public Cursor cursor() {
        return cursor;
    }

    public int processedDelta() {
        return processedDelta;
    }

    public int succeededDelta() {
        return succeededDelta;
    }

    public int skippedDelta() {
        return skippedDelta;
    }

    public int failedDelta() {
        return failedDelta;
    }

    public boolean hasCounterDeltas() {
        return processedDelta != 0 || succeededDelta != 0 || skippedDelta != 0 || failedDelta != 0;
    }

    public String currentTask() {
        return currentTask;
    }

    public Integer currentBatch() {
        return currentBatch;
    }

    public Integer maxBatchesThisRun() {
        return maxBatchesThisRun;
    }

    public Boolean cancelRequested() {
        return cancelRequested;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public String error() {
        return error;
    }

    public boolean isClearError() {
        return clearError;
    }

    public boolean isOnlyIfActive() {
        return onlyIfActive;
    }

    public List<JobError> newErrors() {
        return List.copyOf(newErrors);
    }

    @Override
    public String toString() {
        return "JobPatch{status=" + status + ", cursor=" + cursor + ", processed+=" + processedDelta
                + ", errors+=" + newErrors.size() + "}";
    }
}
