package leadflow.workflow.core;

import leadflow.workflow.enrichment.EnrichmentCapability;
import leadflow.workflow.model.BatchResult;
import leadflow.workflow.model.EnrichmentResult;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobError;
import leadflow.workflow.model.Page;
import leadflow.workflow.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies the enrichment capability to each record of a page, in order, and tallies outcomes.
 * A failing record never stops the page; an interrupt abandons it, so nothing of the page is
 * committed and the next invocation redoes it.
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final EnrichmentCapability capability;

    public BatchProcessor(EnrichmentCapability capability) {
        this.capability = capability;
    }

    /**
     * @throws InterruptedException if the thread is interrupted while the page is in progress;
     *                              the interrupt flag is cleared as usual for this exception
     */
    public BatchResult process(Job job, Page page) throws InterruptedException {
        int processed = 0;
        int updated = 0;
        int skipped = 0;
        int noChange = 0;
        int failed = 0;
        List<JobError> errors = new ArrayList<>();
        List<String> reviewCandidates = new ArrayList<>();

        for (SourceRecord record : page.records()) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted before record " + record.id());
            }
            processed++;

            EnrichmentResult result;
            try {
                result = capability.enrich(job, record);
            } catch (InterruptedException e) {
                log.info("Job {}: interrupted at record {}, abandoning page", job.id(), record.id());
                throw e;
            } catch (Exception e) {
                log.warn("Job {}: record {} failed: {}", job.id(), record.id(), e.getMessage());
                result = EnrichmentResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            if (Thread.interrupted()) {
                // The capability swallowed the interrupt; its result cannot be trusted
                throw new InterruptedException("Interrupted at record " + record.id());
            }
            if (result == null) {
                result = EnrichmentResult.failed("No result returned");
            }

            switch (result.outcome()) {
                case UPDATED -> {
                    updated++;
                    reviewCandidates.add(record.id());
                }
                case SKIPPED -> skipped++;
                case NO_CHANGE -> noChange++;
                case FAILED -> {
                    failed++;
                    String message = result.detail() != null ? result.detail() : "Unknown error";
                    errors.add(new JobError(record.id(), message, Instant.now()));
                }
            }
        }

        log.debug("Job {}: batch processed={} updated={} skipped={} noChange={} failed={}",
                job.id(), processed, updated, skipped, noChange, failed);
        return new BatchResult(processed, updated, skipped, noChange, failed, errors, reviewCandidates);
    }
}
