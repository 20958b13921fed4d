package leadflow.workflow.repository;

import leadflow.workflow.model.ProcessingOrder;
import leadflow.workflow.model.SourceRecord;

import java.time.Instant;
import java.util.List;

/**
 * Ordered, range-scannable view of the traversed collection.
 * Results of the ordered queries follow {@code (createdAt, id)} in the direction of {@code order}.
 */
public interface RecordSource {

    /**
     * First records of the traversal.
     */
    List<SourceRecord> fetchFirst(ProcessingOrder order, int limit);

    /**
     * Records whose sort key lies strictly beyond {@code sortKey} in traversal direction.
     */
    List<SourceRecord> fetchBeyond(ProcessingOrder order, Instant sortKey, int limit);

    /**
     * Records sharing exactly {@code sortKey} whose id lies strictly beyond {@code afterId}
     * in traversal direction.
     */
    List<SourceRecord> fetchTies(ProcessingOrder order, Instant sortKey, String afterId, int limit);
}
