package leadflow.workflow.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a batch workflow job.
 * A job walks the record collection page by page and keeps its progress cursor,
 * counters and recent errors so any later invocation can continue where the last one stopped.
 */
public final class Job {
    private final String id;
    private final JobStatus status;
    private final int batchSize;
    private final ProcessingOrder order;
    private final Cursor cursor;
    private final int processed;
    private final int succeeded;
    private final int skipped;
    private final int failed;
    private final String currentTask;
    private final int currentBatch;
    private final int totalRecords;
    private final Integer maxBatchesThisRun;
    private final boolean reviewRequired;
    private final boolean cancelRequested;
    private final String startedBy;
    private final String error;
    private final List<JobError> errors;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.order = Objects.requireNonNull(builder.order, "order is required");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = builder.batchSize;
        this.cursor = builder.cursor;
        this.processed = builder.processed;
        this.succeeded = builder.succeeded;
        this.skipped = builder.skipped;
        this.failed = builder.failed;
        this.currentTask = builder.currentTask;
        this.currentBatch = builder.currentBatch;
        this.totalRecords = builder.totalRecords;
        this.maxBatchesThisRun = builder.maxBatchesThisRun;
        this.reviewRequired = builder.reviewRequired;
        this.cancelRequested = builder.cancelRequested;
        this.startedBy = builder.startedBy;
        this.error = builder.error;
        this.errors = builder.errors != null ? List.copyOf(builder.errors) : List.of();
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public JobStatus status() {
        return status;
    }

    public int batchSize() {
        return batchSize;
    }

    public ProcessingOrder order() {
        return order;
    }

    public Cursor cursor() {
        return cursor;
    }

    public int processed() {
        return processed;
    }

    public int succeeded() {
        return succeeded;
    }

    public int skipped() {
        return skipped;
    }

    public int failed() {
        return failed;
    }

    public String currentTask() {
        return currentTask;
    }

    public int currentBatch() {
        return currentBatch;
    }

    public int totalRecords() {
        return totalRecords;
    }

    public Integer maxBatchesThisRun() {
        return maxBatchesThisRun;
    }

    public boolean reviewRequired() {
        return reviewRequired;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public String startedBy() {
        return startedBy;
    }

    public String error() {
        return error;
    }

    public List<JobError> errors() {
        return errors;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /** Calculate progress percentage against the collection size seen at creation */
    public int progressPercent() {
        if (totalRecords == 0)
            return 0;
        return Math.min(100, processed * 100 / totalRecords);
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .batchSize(batchSize)
                .order(order)
                .cursor(cursor)
                .processed(processed)
                .succeeded(succeeded)
                .skipped(skipped)
                .failed(failed)
                .currentTask(currentTask)
                .currentBatch(currentBatch)
                .totalRecords(totalRecords)
                .maxBatchesThisRun(maxBatchesThisRun)
                .reviewRequired(reviewRequired)
                .cancelRequested(cancelRequested)
                .startedBy(startedBy)
                .error(error)
                .errors(errors)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private JobStatus status = JobStatus.PENDING;
        private int batchSize = 10;
        private ProcessingOrder order = ProcessingOrder.NEWEST_FIRST;
        private Cursor cursor;
        private int processed;
        private int succeeded;
        private int skipped;
        private int failed;
        private String currentTask;
        private int currentBatch;
        private int totalRecords;
        private Integer maxBatchesThisRun;
        private boolean reviewRequired;
        private boolean cancelRequested;
        private String startedBy;
        private String error;
        private List<JobError> errors;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder order(ProcessingOrder order) {
            this.order = order;
            return this;
        }

        public Builder cursor(Cursor cursor) {
            this.cursor = cursor;
            return this;
        }

        public Builder processed(int processed) {
            this.processed = processed;
            return this;
        }

        public Builder succeeded(int succeeded) {
            this.succeeded = succeeded;
            return this;
        }

        public Builder skipped(int skipped) {
            this.skipped = skipped;
            return this;
        }

        public Builder failed(int failed) {
            this.failed = failed;
            return this;
        }

        public Builder currentTask(String currentTask) {
            this.currentTask = currentTask;
            return this;
        }

        public Builder currentBatch(int currentBatch) {
            this.currentBatch = currentBatch;
            return this;
        }

        public Builder totalRecords(int totalRecords) {
            this.totalRecords = totalRecords;
            return this;
        }

        public Builder maxBatchesThisRun(Integer maxBatchesThisRun) {
            this.maxBatchesThisRun = maxBatchesThisRun;
            return this;
        }

        public Builder reviewRequired(boolean reviewRequired) {
            this.reviewRequired = reviewRequired;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder startedBy(String startedBy) {
            this.startedBy = startedBy;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder errors(List<JobError> errors) {
            this.errors = errors;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + status + ", processed=" + processed + ", cursor=" + cursor + "}";
    }
}
