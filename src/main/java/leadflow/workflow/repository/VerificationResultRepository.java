package leadflow.workflow.repository;

import leadflow.workflow.model.JobStats;
import leadflow.workflow.model.Outcome;
import leadflow.workflow.model.VerificationResult;

import java.util.List;

/**
 * Append-only store of per-record verification results.
 */
public interface VerificationResultRepository {

    void save(VerificationResult result);

    /**
     * Results of a job, newest first.
     *
     * @param jobId   the job ID
     * @param outcome optional filter, null for all outcomes
     * @param limit   maximum results
     */
    List<VerificationResult> findByJobId(String jobId, Outcome outcome, int limit);

    JobStats stats(String jobId);
}
