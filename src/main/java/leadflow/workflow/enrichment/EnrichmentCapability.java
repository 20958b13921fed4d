package leadflow.workflow.enrichment;

import leadflow.workflow.model.EnrichmentResult;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.SourceRecord;

/**
 * Per-record work applied by a batch workflow.
 *
 * <p>
 * Implementations perform their own side effects (record updates, audit rows) and
 * report a closed outcome. Throwing is equivalent to returning
 * {@link EnrichmentResult#failed(String)} with the exception message; the failure is
 * isolated to the record.
 */
@FunctionalInterface
public interface EnrichmentCapability {

    /**
     * Enrich a single record.
     *
     * @param job    the job the record is processed for
     * @param record the record, as read by the paginator
     * @return the outcome
     * @throws Exception on any failure, counted against this record only
     */
    EnrichmentResult enrich(Job job, SourceRecord record) throws Exception;
}
