package leadflow.workflow.service;

import leadflow.workflow.config.WorkflowConfig;
import leadflow.workflow.core.ResumeSignalBus;
import leadflow.workflow.core.RunOrchestrator;
import leadflow.workflow.enrichment.EnrichmentCapability;
import leadflow.workflow.model.BatchResult;
import leadflow.workflow.model.EnrichmentResult;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobError;
import leadflow.workflow.model.JobPatch;
import leadflow.workflow.model.JobStats;
import leadflow.workflow.model.JobStatus;
import leadflow.workflow.model.Outcome;
import leadflow.workflow.model.ProcessingOrder;
import leadflow.workflow.model.RecordVerification;
import leadflow.workflow.model.RunResult;
import leadflow.workflow.model.SignalType;
import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.model.VerificationResult;
import leadflow.workflow.model.Viability;
import leadflow.workflow.repository.JobRepository;
import leadflow.workflow.repository.RecordRepository;
import leadflow.workflow.repository.ReviewRepository;
import leadflow.workflow.repository.VerificationResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for starting, resuming, cancelling and inspecting batch workflow runs.
 *
 * <p>
 * Runs execute on a fixed pool of runner threads. At most one invocation of a job is
 * live in this process; the durable state of a job (status, cursor, counters) lives
 * in the job record, so a job whose invocation died with a previous process is picked
 * up again through {@link #resumeRun}.
 *
 * <p>
 * Precondition failures throw {@link JobNotFoundException},
 * {@link IllegalArgumentException} or {@link IllegalStateException} and leave the job
 * untouched.
 */
public class WorkflowService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private static final int DEFAULT_LIST_LIMIT = 50;
    private static final int DEFAULT_RESULTS_LIMIT = 100;
    private static final int MAX_LIMIT = 1000;
    private static final String DEFAULT_STARTED_BY = "api";
    private static final String SINGLE_CHECK_STARTED_BY = "single_check";

    private final JobRepository jobRepository;
    private final RecordRepository recordRepository;
    private final VerificationResultRepository resultRepository;
    private final ReviewRepository reviewRepository;
    private final RunOrchestrator orchestrator;
    private final EnrichmentCapability capability;
    private final ResumeSignalBus signalBus;
    private final WorkflowConfig config;
    private final ExecutorService runners;

    private final ConcurrentMap<String, Invocation> live = new ConcurrentHashMap<>();

    public WorkflowService(JobRepository jobRepository,
            RecordRepository recordRepository,
            VerificationResultRepository resultRepository,
            ReviewRepository reviewRepository,
            RunOrchestrator orchestrator,
            EnrichmentCapability capability,
            ResumeSignalBus signalBus,
            WorkflowConfig config) {
        this.jobRepository = jobRepository;
        this.recordRepository = recordRepository;
        this.resultRepository = resultRepository;
        this.reviewRepository = reviewRepository;
        this.orchestrator = orchestrator;
        this.capability = capability;
        this.signalBus = signalBus;
        this.config = config;

        AtomicInteger threadCounter = new AtomicInteger();
        this.runners = Executors.newFixedThreadPool(config.runnerThreads(), r -> {
            Thread t = new Thread(r, "leadflow-runner-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== Runs ====================

    /**
     * Create a job and start its first invocation.
     *
     * @param batchSize      records per page, null for the configured default
     * @param order          traversal direction, null for the configured default
     * @param maxBatches     page budget of the first invocation, null for the configured default
     * @param reviewRequired pause for human review once traversal is exhausted
     * @param startedBy      free-form initiator, null for "api"
     * @return the created job
     */
    public Job startRun(Integer batchSize, ProcessingOrder order, Integer maxBatches,
            boolean reviewRequired, String startedBy) {
        int size = batchSize != null ? batchSize : config.defaultBatchSize();
        if (size <= 0 || size > config.maxBatchSize()) {
            throw new IllegalArgumentException("batchSize must be between 1 and " + config.maxBatchSize());
        }
        int budget = budgetOrDefault(maxBatches);

        Job job = Job.builder()
                .id(jobRepository.generateId())
                .status(JobStatus.PENDING)
                .batchSize(size)
                .order(order != null ? order : config.defaultOrder())
                .totalRecords(recordRepository.count())
                .maxBatchesThisRun(budget)
                .reviewRequired(reviewRequired)
                .startedBy(startedBy != null && !startedBy.isBlank() ? startedBy : DEFAULT_STARTED_BY)
                .currentTask("Queued")
                .createdAt(Instant.now())
                .build();

        jobRepository.save(job);
        log.info("Created job {}: batchSize={}, order={}, maxBatches={}, review={}, totalRecords={}",
                job.id(), size, job.order().wireName(), budget, reviewRequired, job.totalRecords());

        submit(job.id());
        return job;
    }

    /**
     * Continue a job from its stored cursor.
     * A paused job with a waiting run is woken as if its review had finished.
     *
     * @throws IllegalStateException if the job is terminal, already running, or paused with
     *                               a run that has already taken a signal
     *
     * @param maxBatches page budget of the new invocation, null for the configured default
     * @return the job as stored after the request was accepted
     */
    public Job resumeRun(String jobId, Integer maxBatches) {
        Job job = requireJob(jobId);
        int budget = budgetOrDefault(maxBatches);

        switch (job.status()) {
            case COMPLETED, CANCELED ->
                throw new IllegalStateException("Cannot resume job " + jobId + " in status " + job.status());
            case PAUSED -> {
                if (isLive(jobId)) {
                    if (!signalBus.deliver(jobId, SignalType.RESUME)) {
                        throw new IllegalStateException("Paused job " + jobId
                                + " has already been signaled and is finishing");
                    }
                    log.info("Resume of paused job {} delivered to its waiting run", jobId);
                    return requireJob(jobId);
                }
            }
            case PENDING, RUNNING, FAILED -> {
                if (isLive(jobId)) {
                    throw new IllegalStateException("Job " + jobId + " is already running");
                }
            }
        }

        jobRepository.updateStatus(jobId, JobPatch.create().maxBatchesThisRun(budget));
        submit(jobId);
        log.info("Resumed job {} from {} (status {}, budget {})", jobId, job.cursor(), job.status(), budget);
        return requireJob(jobId);
    }

    /**
     * Request cancellation. A run observes the flag at its next page boundary; a paused
     * run is woken immediately; a job with no live run is finalized here.
     *
     * @throws IllegalStateException if the job is already terminal
     */
    public Job cancelRun(String jobId) {
        Job job = requireJob(jobId);
        if (job.isTerminal()) {
            throw new IllegalStateException("Cannot cancel job " + jobId + " in status " + job.status());
        }

        jobRepository.updateStatus(jobId, JobPatch.create().cancelRequested(true));
        boolean woken = signalBus.deliver(jobId, SignalType.CANCEL);

        if (!woken && !isLive(jobId)) {
            boolean finalized = jobRepository.updateStatus(jobId, JobPatch.create()
                    .status(JobStatus.CANCELED)
                    .completedAt(Instant.now())
                    .currentTask("Canceled")
                    .onlyIfActive());
            if (finalized) {
                log.info("Canceled job {} (no live run)", jobId);
            } else {
                log.info("Job {} finished before the cancellation took effect", jobId);
            }
        } else {
            log.info("Cancellation requested for job {}", jobId);
        }
        return requireJob(jobId);
    }

    /**
     * Wake a paused run with a resume signal.
     *
     * @return true if a waiting run received it; false for a job that is not paused,
     *         has no waiting run, or was already signaled
     */
    public boolean deliverResumeSignal(String jobId) {
        Job job = requireJob(jobId);
        if (job.status() != JobStatus.PAUSED) {
            log.debug("Resume signal for job {} in status {} ignored", jobId, job.status());
            return false;
        }
        return signalBus.deliver(jobId, SignalType.RESUME);
    }

    /**
     * True if an invocation of the job is executing or waiting in this process.
     */
    public boolean isLive(String jobId) {
        Invocation invocation = live.get(jobId);
        return invocation != null && !invocation.isDone();
    }

    /**
     * Handle to the live invocation of a job, if any.
     */
    public Optional<Future<RunResult>> liveRun(String jobId) {
        Invocation invocation = live.get(jobId);
        return invocation != null && !invocation.isDone() ? Optional.of(invocation) : Optional.empty();
    }

    // ==================== Queries ====================

    public Job getJobStatus(String jobId) {
        return requireJob(jobId);
    }

    public List<Job> listJobs(JobStatus status, Integer limit) {
        int max = clampLimit(limit, DEFAULT_LIST_LIMIT);
        return status != null ? jobRepository.findByStatus(status, max) : jobRepository.findRecent(max);
    }

    /** Most recent errors of a job, oldest first. */
    public List<JobError> getJobErrors(String jobId) {
        return requireJob(jobId).errors();
    }

    public List<VerificationResult> listResults(String jobId, Outcome outcome, Integer limit) {
        requireJob(jobId);
        return resultRepository.findByJobId(jobId, outcome, clampLimit(limit, DEFAULT_RESULTS_LIMIT));
    }

    public JobStats getJobStats(String jobId) {
        requireJob(jobId);
        return resultRepository.stats(jobId);
    }

    // ==================== Review ====================

    /** Records of a job awaiting review, in the order they were added. */
    public List<SourceRecord> listPendingReviews(String jobId) {
        requireJob(jobId);
        List<SourceRecord> records = new ArrayList<>();
        for (String recordId : reviewRepository.findByJobId(jobId)) {
            recordRepository.findById(recordId).ifPresent(records::add);
        }
        return records;
    }

    public SourceRecord acceptReview(String jobId, String recordId) {
        return review(jobId, recordId, Viability.VIABLE);
    }

    public SourceRecord rejectReview(String jobId, String recordId) {
        return review(jobId, recordId, Viability.NOT_VIABLE);
    }

    private SourceRecord review(String jobId, String recordId, Viability viability) {
        requireJob(jobId);
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId is required");
        }
        if (!reviewRepository.remove(jobId, recordId)) {
            throw new IllegalStateException("Record " + recordId + " is not pending review in job " + jobId);
        }
        if (!recordRepository.updateViability(recordId, viability)) {
            log.warn("Reviewed record {} of job {} no longer exists", recordId, jobId);
        }
        log.info("Job {}: record {} marked {}", jobId, recordId, viability);
        return recordRepository.findById(recordId).orElse(null);
    }

    // ==================== Maintenance ====================

    /**
     * Delete a finished job with its results, review entries and errors.
     *
     * @throws IllegalStateException if the job is not terminal or still has a live run
     */
    public void deleteJob(String jobId) {
        Job job = requireJob(jobId);
        if (!job.isTerminal() || isLive(jobId)) {
            throw new IllegalStateException("Cannot delete job " + jobId + " in status " + job.status());
        }
        jobRepository.delete(jobId);
        log.info("Deleted job {}", jobId);
    }

    /**
     * Add records to the traversed collection.
     *
     * @return number of records stored
     * @throws IllegalArgumentException if the list is empty or an id already exists
     */
    public int ingestRecords(List<SourceRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("records must not be empty");
        }
        for (SourceRecord record : records) {
            if (record.id().isBlank()) {
                throw new IllegalArgumentException("record id must not be blank");
            }
        }
        recordRepository.saveAll(records);
        log.info("Ingested {} records", records.size());
        return records.size();
    }

    public int countRecords() {
        return recordRepository.count();
    }

    /**
     * Run the enrichment step on one record now, outside any traversal. The check is
     * tracked under a one-record job that ends COMPLETED whatever the outcome.
     *
     * @throws RecordNotFoundException if the record does not exist
     */
    public RecordVerification verifyRecord(String recordId) {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId is required");
        }
        SourceRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new RecordNotFoundException(recordId));

        Job job = Job.builder()
                .id(jobRepository.generateId())
                .status(JobStatus.RUNNING)
                .batchSize(1)
                .order(ProcessingOrder.NEWEST_FIRST)
                .totalRecords(1)
                .maxBatchesThisRun(1)
                .startedBy(SINGLE_CHECK_STARTED_BY)
                .currentTask("Verifying " + recordId)
                .createdAt(Instant.now())
                .startedAt(Instant.now())
                .build();
        jobRepository.save(job);

        EnrichmentResult result = EnrichmentResult.failed("Interrupted");
        try {
            result = enrichOne(job, record);
        } finally {
            BatchResult tally = singleTally(recordId, result);
            jobRepository.updateStatus(job.id(), JobPatch.create()
                    .status(JobStatus.COMPLETED)
                    .completedAt(Instant.now())
                    .counters(tally)
                    .errors(tally.errors())
                    .currentTask("Completed: " + result.outcome().wireName())
                    .onlyIfActive());
        }

        String newUrl = recordRepository.findById(recordId)
                .map(SourceRecord::sourceUrl)
                .filter(url -> !url.equals(record.sourceUrl()))
                .orElse(null);
        log.info("Single check of record {} under job {}: {}", recordId, job.id(), result.outcome().wireName());
        return new RecordVerification(job.id(), recordId, result.outcome(), record.sourceUrl(), newUrl,
                result.detail());
    }

    private EnrichmentResult enrichOne(Job job, SourceRecord record) {
        try {
            EnrichmentResult result = capability.enrich(job, record);
            return result != null ? result : EnrichmentResult.failed("No result returned");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while verifying record " + record.id(), e);
        } catch (Exception e) {
            log.warn("Single check of record {} failed: {}", record.id(), e.getMessage());
            return EnrichmentResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static BatchResult singleTally(String recordId, EnrichmentResult result) {
        Outcome outcome = result.outcome();
        List<JobError> errors = outcome == Outcome.FAILED
                ? List.of(new JobError(recordId, result.detail() != null ? result.detail() : "Unknown error",
                        Instant.now()))
                : List.of();
        return new BatchResult(1,
                outcome == Outcome.UPDATED ? 1 : 0,
                outcome == Outcome.SKIPPED ? 1 : 0,
                outcome == Outcome.NO_CHANGE ? 1 : 0,
                outcome == Outcome.FAILED ? 1 : 0,
                errors,
                List.of());
    }

    /**
     * Jobs left RUNNING with no live invocation in this process.
     */
    public List<Job> findStalled(int limit) {
        List<Job> stalled = new ArrayList<>();
        for (Job job : jobRepository.findByStatus(JobStatus.RUNNING, limit)) {
            if (!isLive(job.id())) {
                stalled.add(job);
            }
        }
        return stalled;
    }

    @Override
    public void close() {
        runners.shutdownNow();
        try {
            if (!runners.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Runner threads did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Workflow service stopped");
    }

    // ==================== Helpers ====================

    private void submit(String jobId) {
        Invocation invocation = new Invocation(jobId, orchestrator);
        Invocation existing = live.putIfAbsent(jobId, invocation);
        if (existing != null && !(existing.isDone() && live.replace(jobId, existing, invocation))) {
            throw new IllegalStateException("Job " + jobId + " is already running");
        }

        try {
            runners.execute(invocation);
        } catch (RejectedExecutionException e) {
            live.remove(jobId, invocation);
            throw new IllegalStateException("Workflow service is shut down", e);
        }
    }

    private Job requireJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private int budgetOrDefault(Integer maxBatches) {
        int budget = maxBatches != null ? maxBatches : config.defaultMaxBatches();
        if (budget <= 0) {
            throw new IllegalArgumentException("maxBatches must be positive");
        }
        return budget;
    }

    private static int clampLimit(Integer limit, int defaultLimit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(limit, MAX_LIMIT);
    }

    /** One orchestrator invocation; deregisters itself when it ends. */
    private final class Invocation extends FutureTask<RunResult> {
        private final String jobId;

        Invocation(String jobId, RunOrchestrator orchestrator) {
            super(() -> orchestrator.run(jobId));
            this.jobId = jobId;
        }

        @Override
        protected void done() {
            live.remove(jobId, this);
            if (isCancelled()) {
                return;
            }
            try {
                RunResult result = get();
                log.info("Run of job {} ended {}: {} batches, {} processed, {} updated, {} skipped, {} failed",
                        jobId, result.outcome(), result.batches(), result.processed(), result.updated(),
                        result.skipped(), result.failed());
            } catch (Exception e) {
                log.error("Run of job {} aborted", jobId, e);
            }
        }
    }
}
