package leadflow.workflow.core;

import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobStatus;
import leadflow.workflow.repository.JobRepository;

import java.util.Optional;

/**
 * Reads the persisted cancellation flag. Polled at page boundaries only.
 */
public class CancellationMonitor {

    private final JobRepository jobRepository;

    public CancellationMonitor(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    /**
     * True if the flag is set or the job was already finalized as canceled.
     * A job that no longer exists counts as canceled.
     */
    public boolean isCancellationRequested(String jobId) {
        Optional<Job> job = jobRepository.findById(jobId);
        return job.isEmpty() || isCanceled(job.get());
    }

    static boolean isCanceled(Job job) {
        return job.cancelRequested() || job.status() == JobStatus.CANCELED;
    }
}
