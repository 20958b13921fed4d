package leadflow.workflow.model;

/**
 * Events a paused run can be woken with.
 */
public enum SignalType {
    RESUME,
    CANCEL
}
