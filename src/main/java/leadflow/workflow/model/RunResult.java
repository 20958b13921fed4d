package leadflow.workflow.model;

/**
 * Summary returned by one orchestrator invocation. Counters cover this invocation only.
 */
public record RunResult(
        String jobId,
        RunOutcome outcome,
        int batches,
        int processed,
        int updated,
        int skipped,
        int failed,
        String message) {

    public boolean success() {
        return outcome == RunOutcome.COMPLETED || outcome == RunOutcome.BUDGET_EXHAUSTED;
    }
}
