package leadflow.workflow.core;

import leadflow.workflow.model.BatchResult;
import leadflow.workflow.model.Cursor;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobPatch;
import leadflow.workflow.model.JobStatus;
import leadflow.workflow.model.Page;
import leadflow.workflow.model.RunOutcome;
import leadflow.workflow.model.RunResult;
import leadflow.workflow.model.SignalType;
import leadflow.workflow.repository.JobRepository;
import leadflow.workflow.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one invocation of a job: fetch a page, process it, commit progress, repeat
 * until the collection is exhausted, the page budget is spent, cancellation is
 * observed or a page-level failure occurs.
 *
 * <p>
 * All progress lives in the job record, so any number of invocations (including
 * ones in a fresh process) continue from the last committed cursor. A crash between
 * processing a page and committing it redoes that page.
 */
public class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    static final String WAITING_FOR_REVIEW = "Waiting for user review";

    private final JobRepository jobRepository;
    private final ReviewRepository reviewRepository;
    private final CursorPaginator paginator;
    private final BatchProcessor batchProcessor;
    private final CancellationMonitor cancellationMonitor;
    private final ResumeSignalBus signalBus;
    private final int defaultMaxBatches;
    private final Duration interBatchDelay;

    public RunOrchestrator(JobRepository jobRepository,
            ReviewRepository reviewRepository,
            CursorPaginator paginator,
            BatchProcessor batchProcessor,
            CancellationMonitor cancellationMonitor,
            ResumeSignalBus signalBus,
            int defaultMaxBatches,
            Duration interBatchDelay) {
        this.jobRepository = jobRepository;
        this.reviewRepository = reviewRepository;
        this.paginator = paginator;
        this.batchProcessor = batchProcessor;
        this.cancellationMonitor = cancellationMonitor;
        this.signalBus = signalBus;
        this.defaultMaxBatches = defaultMaxBatches;
        this.interBatchDelay = interBatchDelay;
    }

    /**
     * Run the job from its stored cursor.
     *
     * @param jobId the job ID
     * @return what this invocation did; counters cover this invocation only
     */
    public RunResult run(String jobId) {
        Optional<Job> loaded = jobRepository.findById(jobId);
        if (loaded.isEmpty()) {
            log.warn("Job {} not found, nothing to run", jobId);
            return new Tally().result(jobId, RunOutcome.NOT_FOUND, "Job not found");
        }

        Job job = loaded.get();
        Tally tally = new Tally();
        try {
            if (job.status() == JobStatus.COMPLETED) {
                return tally.result(jobId, RunOutcome.COMPLETED, "Job already completed");
            }
            if (job.status() == JobStatus.CANCELED || CancellationMonitor.isCanceled(job)) {
                return finishCanceled(jobId, tally);
            }
            if (job.status() == JobStatus.PAUSED) {
                // Paused by an earlier process whose waiter is gone; the resume request is the review signal
                return finishReview(jobId, SignalType.RESUME, tally);
            }
            return traverse(job, tally);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} interrupted after {} batches, left resumable", jobId, tally.batches);
            return tally.result(jobId, RunOutcome.INTERRUPTED, "Interrupted");
        } catch (RuntimeException e) {
            return fail(jobId, e, tally);
        }
    }

    private RunResult traverse(Job job, Tally tally) throws InterruptedException {
        String jobId = job.id();
        int budget = job.maxBatchesThisRun() != null ? job.maxBatchesThisRun() : defaultMaxBatches;

        if (!jobRepository.updateStatus(jobId, JobPatch.create()
                .status(JobStatus.RUNNING)
                .startedAt(Instant.now())
                .clearError()
                .currentTask("Starting from " + (job.cursor() != null ? job.cursor() : "the beginning")))) {
            return tally.result(jobId, RunOutcome.NOT_FOUND, "Job not found");
        }
        log.info("Job {} running: batchSize={}, order={}, budget={} batches, cursor={}",
                jobId, job.batchSize(), job.order().wireName(), budget, job.cursor());

        Cursor cursor = job.cursor();
        int batchNumber = job.currentBatch();
        int processedTotal = job.processed();
        boolean exhausted = false;

        while (tally.batches < budget) {
            if (cancellationMonitor.isCancellationRequested(jobId)) {
                return finishCanceled(jobId, tally);
            }

            Page page = paginator.next(job.batchSize(), job.order(), cursor);
            if (page.isEmpty()) {
                exhausted = true;
                break;
            }

            BatchResult result = batchProcessor.process(job, page);
            batchNumber++;
            processedTotal += result.processed();
            tally.add(result);

            // Review entries go in before the cursor moves so a redone page re-adds them idempotently
            if (job.reviewRequired() && !result.reviewCandidates().isEmpty()) {
                reviewRepository.addAll(jobId, result.reviewCandidates());
            }

            String progress = "Processing batch " + batchNumber
                    + " (" + processedTotal + "/" + job.totalRecords() + " leads)";
            if (!jobRepository.updateStatus(jobId,
                    JobPatch.pageCommitted(page.nextCursor(), result, batchNumber, progress))) {
                return tally.result(jobId, RunOutcome.NOT_FOUND, "Job not found");
            }
            cursor = page.nextCursor();
            log.debug("Job {}: committed batch {} at {}", jobId, batchNumber, cursor);

            if (cancellationMonitor.isCancellationRequested(jobId)) {
                return finishCanceled(jobId, tally);
            }

            if (tally.batches < budget) {
                pause();
            }
        }

        if (!exhausted) {
            log.info("Job {} used its budget of {} batches at {}, left resumable", jobId, budget, cursor);
            return tally.result(jobId, RunOutcome.BUDGET_EXHAUSTED, "Page budget of " + budget + " reached");
        }

        if (job.reviewRequired()) {
            return awaitReview(jobId, tally);
        }
        return finishCompleted(jobId, tally);
    }

    private RunResult awaitReview(String jobId, Tally tally) throws InterruptedException {
        int pending = reviewRepository.count(jobId);
        AtomicBoolean paused = new AtomicBoolean();

        SignalType signal = signalBus.await(jobId,
                () -> cancellationMonitor.isCancellationRequested(jobId),
                () -> {
                    paused.set(jobRepository.updateStatus(jobId, JobPatch.create()
                            .status(JobStatus.PAUSED)
                            .currentTask(WAITING_FOR_REVIEW)
                            .onlyIfActive()));
                    if (!paused.get()) {
                        // Gone or finalized elsewhere; release the waiter at once
                        signalBus.deliver(jobId, SignalType.CANCEL);
                    } else {
                        log.info("Job {} paused with {} records pending review", jobId, pending);
                    }
                });
        if (!paused.get()) {
            return tally.result(jobId, RunOutcome.NOT_FOUND, "Job not found or already finished");
        }
        return finishReview(jobId, signal, tally);
    }

    private RunResult finishReview(String jobId, SignalType signal, Tally tally) {
        if (signal == SignalType.CANCEL) {
            return finishCanceled(jobId, tally);
        }
        // Re-read: a cancel may have landed while the run was paused
        return finishCompleted(jobId, tally);
    }

    private RunResult finishCompleted(String jobId, Tally tally) {
        if (cancellationMonitor.isCancellationRequested(jobId)) {
            return finishCanceled(jobId, tally);
        }

        Optional<Job> current = jobRepository.findById(jobId);
        if (current.isEmpty()) {
            return tally.result(jobId, RunOutcome.NOT_FOUND, "Job not found");
        }
        Job job = current.get();
        String summary = "Completed: " + job.processed() + " processed, " + job.succeeded() + " updated, "
                + job.skipped() + " skipped, " + job.failed() + " failed";

        jobRepository.updateStatus(jobId, JobPatch.create()
                .status(JobStatus.COMPLETED)
                .completedAt(Instant.now())
                .currentTask(summary)
                .onlyIfActive());
        log.info("Job {} {}", jobId, summary);
        return tally.result(jobId, RunOutcome.COMPLETED, summary);
    }

    private RunResult finishCanceled(String jobId, Tally tally) {
        jobRepository.updateStatus(jobId, JobPatch.create()
                .status(JobStatus.CANCELED)
                .completedAt(Instant.now())
                .currentTask("Canceled")
                .onlyIfActive());
        log.info("Job {} canceled after {} batches in this run", jobId, tally.batches);
        return tally.result(jobId, RunOutcome.CANCELED, "Canceled");
    }

    private RunResult fail(String jobId, RuntimeException e, Tally tally) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("Job {} failed after {} batches in this run", jobId, tally.batches, e);
        try {
            jobRepository.updateStatus(jobId, JobPatch.create()
                    .status(JobStatus.FAILED)
                    .error(message)
                    .currentTask("Failed: " + message));
        } catch (RuntimeException updateError) {
            log.error("Could not record failure of job {}", jobId, updateError);
        }
        return tally.result(jobId, RunOutcome.FAILED, message);
    }

    private void pause() throws InterruptedException {
        if (!interBatchDelay.isZero() && !interBatchDelay.isNegative()) {
            Thread.sleep(interBatchDelay.toMillis());
        }
    }

    /** Counters for the current invocation. */
    private static final class Tally {
        private int batches;
        private int processed;
        private int updated;
        private int skipped;
        private int failed;

        void add(BatchResult result) {
            batches++;
            processed += result.processed();
            updated += result.updated();
            skipped += result.skipped();
            failed += result.failed();
        }

        RunResult result(String jobId, RunOutcome outcome, String message) {
            return new RunResult(jobId, outcome, batches, processed, updated, skipped, failed, message);
        }
    }
}
