package leadflow.workflow.repository;

import java.util.Collection;
import java.util.List;

/**
 * Pending review set of a job: record ids awaiting a reviewer's disposition.
 */
public interface ReviewRepository {

    /**
     * Add ids to the set. Ids already present are ignored.
     *
     * @return number of ids actually added
     */
    int addAll(String jobId, Collection<String> recordIds);

    /** Pending ids in insertion order. */
    List<String> findByJobId(String jobId);

    /**
     * Remove one id from the set.
     *
     * @return true if the id was pending
     */
    boolean remove(String jobId, String recordId);

    int count(String jobId);
}
