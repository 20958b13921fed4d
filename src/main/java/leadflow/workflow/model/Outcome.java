package leadflow.workflow.model;

/**
 * Result of enriching one record.
 */
public enum Outcome {
    SKIPPED("skipped"),
    UPDATED("updated"),
    NO_CHANGE("no_change"),
    FAILED("failed");

    private final String wireName;

    Outcome(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Outcome fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (Outcome outcome : values()) {
            if (outcome.wireName.equalsIgnoreCase(value.trim()) || outcome.name().equalsIgnoreCase(value.trim())) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("unknown outcome: " + value);
    }
}
