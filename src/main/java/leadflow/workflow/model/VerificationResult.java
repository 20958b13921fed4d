package leadflow.workflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only audit row written by the enrichment capability for each record it handles.
 * The orchestrator never reads these.
 */
public final class VerificationResult {
    private final long id;
    private final String jobId;
    private final String recordId;
    private final Outcome outcome;
    private final String beforeValue;
    private final String afterValue;
    private final String detail;
    private final Long durationMs;
    private final String error;
    private final Instant verifiedAt;

    private VerificationResult(Builder builder) {
        this.id = builder.id;
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.recordId = Objects.requireNonNull(builder.recordId, "recordId is required");
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome is required");
        this.beforeValue = builder.beforeValue;
        this.afterValue = builder.afterValue;
        this.detail = builder.detail;
        this.durationMs = builder.durationMs;
        this.error = builder.error;
        this.verifiedAt = builder.verifiedAt;
    }

    public long id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public String recordId() {
        return recordId;
    }

    public Outcome outcome() {
        return outcome;
    }

    public String beforeValue() {
        return beforeValue;
    }

    public String afterValue() {
        return afterValue;
    }

    public String detail() {
        return detail;
    }

    public Long durationMs() {
        return durationMs;
    }

    public String error() {
        return error;
    }

    public Instant verifiedAt() {
        return verifiedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String jobId;
        private String recordId;
        private Outcome outcome;
        private String beforeValue;
        private String afterValue;
        private String detail;
        private Long durationMs;
        private String error;
        private Instant verifiedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder beforeValue(String beforeValue) {
            this.beforeValue = beforeValue;
            return this;
        }

        public Builder afterValue(String afterValue) {
            this.afterValue = afterValue;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder verifiedAt(Instant verifiedAt) {
            this.verifiedAt = verifiedAt;
            return this;
        }

        public VerificationResult build() {
            return new VerificationResult(this);
        }
    }

    @Override
    public String toString() {
        return "VerificationResult{jobId='" + jobId + "', recordId='" + recordId + "', outcome=" + outcome + "}";
    }
}
