package leadflow.workflow.model;

/**
 * Reviewer disposition of a record.
 */
public enum Viability {
    UNREVIEWED,
    VIABLE,
    NOT_VIABLE
}
