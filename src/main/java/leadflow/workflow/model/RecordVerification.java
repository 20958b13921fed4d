package leadflow.workflow.model;

/**
 * Outcome of enriching a single record on demand.
 *
 * @param jobId       the one-record job the check was tracked under
 * @param recordId    the record
 * @param outcome     what the enrichment step reported
 * @param originalUrl source link before the check
 * @param newUrl      source link after the check, null when it did not change
 * @param detail      reasoning or error text, may be null
 */
public record RecordVerification(
        String jobId,
        String recordId,
        Outcome outcome,
        String originalUrl,
        String newUrl,
        String detail) {

    public boolean success() {
        return outcome != Outcome.FAILED;
    }
}
