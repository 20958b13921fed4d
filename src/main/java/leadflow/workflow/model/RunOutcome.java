package leadflow.workflow.model;

/**
 * How a single orchestrator invocation ended.
 */
public enum RunOutcome {
    /** Traversal exhausted (and review finished, for review jobs) */
    COMPLETED,
    /** Cancellation observed */
    CANCELED,
    /** Page-level failure, job marked FAILED */
    FAILED,
    /** Page budget reached; job stays RUNNING and can be resumed */
    BUDGET_EXHAUSTED,
    /** Job record disappeared during the run */
    NOT_FOUND,
    /** Runner thread interrupted (shutdown); job keeps its status and can be resumed */
    INTERRUPTED
}
