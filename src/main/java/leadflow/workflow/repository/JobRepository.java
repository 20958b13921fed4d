package leadflow.workflow.repository;

import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobPatch;
import leadflow.workflow.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 */
public interface JobRepository {

    /**
     * Save a new job.
     * 
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID, including its recent error entries.
     * 
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Get all jobs, most recent first. Error entries are not loaded.
     * 
     * @return list of all jobs
     */
    List<Job> findAll();

    /**
     * Get jobs by status, most recent first.
     * 
     * @param status the status filter
     * @param limit  maximum results
     * @return list of jobs
     */
    List<Job> findByStatus(JobStatus status, int limit);

    /**
     * Get recent jobs ordered by creation time.
     * 
     * @param limit maximum results
     * @return list of jobs
     */
    List<Job> findRecent(int limit);

    /**
     * Apply a merge-patch to a job in a single transaction.
     * Counter fields in the patch are added to the stored values; error entries are
     * appended and the list trimmed to the configured maximum.
     * 
     * @param jobId the job ID
     * @param patch fields to change
     * @return true if the job exists and was updated
     */
    boolean updateStatus(String jobId, JobPatch patch);

    /**
     * Delete a job together with its results, review entries and errors.
     * 
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Generate a new unique Job ID.
     * 
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
