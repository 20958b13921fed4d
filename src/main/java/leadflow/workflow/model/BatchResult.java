package leadflow.workflow.model;

import java.util.List;

/**
 * Counters produced by processing one page.
 *
 * @param processed        records the capability was applied to
 * @param updated          records whose outcome was {@link Outcome#UPDATED}
 * @param skipped          records whose outcome was {@link Outcome#SKIPPED}
 * @param noChange         records whose outcome was {@link Outcome#NO_CHANGE}
 * @param failed           records that failed or whose call threw
 * @param errors           per-record error entries, in processing order
 * @param reviewCandidates ids of updated records, in processing order
 */
public record BatchResult(
        int processed,
        int updated,
        int skipped,
        int noChange,
        int failed,
        List<JobError> errors,
        List<String> reviewCandidates) {

    public BatchResult {
        errors = List.copyOf(errors);
        reviewCandidates = List.copyOf(reviewCandidates);
    }

    public static BatchResult empty() {
        return new BatchResult(0, 0, 0, 0, 0, List.of(), List.of());
    }
}
