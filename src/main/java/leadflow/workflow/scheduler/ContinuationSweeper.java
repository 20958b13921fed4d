package leadflow.workflow.scheduler;

import leadflow.workflow.model.Job;
import leadflow.workflow.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Background task that continues jobs nobody is running.
 *
 * A job is left RUNNING without a live invocation when:
 * - an invocation spent its page budget
 * - the process stopped in the middle of a run
 *
 * Each such job gets a fresh invocation with its own page budget. PENDING, PAUSED and
 * FAILED jobs are left for an operator.
 */
public class ContinuationSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ContinuationSweeper.class);

    private static final int SWEEP_LIMIT = 100;

    private final WorkflowService workflowService;

    public ContinuationSweeper(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Continuation sweeper error", e);
        }
    }

    /**
     * Resume stalled jobs.
     *
     * @return number of jobs resumed
     */
    public int sweep() {
        List<Job> stalled = workflowService.findStalled(SWEEP_LIMIT);

        if (stalled.isEmpty()) {
            log.debug("No stalled jobs found");
            return 0;
        }

        int resumed = 0;
        for (Job job : stalled) {
            try {
                workflowService.resumeRun(job.id(), job.maxBatchesThisRun());
                resumed++;
                log.info("Continued job {} from {} ({} processed so far)", job.id(), job.cursor(), job.processed());
            } catch (IllegalStateException e) {
                // Picked up or finished between the scan and the resume
                log.debug("Skipped job {}: {}", job.id(), e.getMessage());
            } catch (Exception e) {
                log.error("Failed to continue job {}", job.id(), e);
            }
        }

        log.info("Continuation sweeper: {} resumed, {} stalled", resumed, stalled.size());
        return resumed;
    }
}
