package leadflow.workflow.model;

import java.util.Comparator;

/**
 * Traversal direction over the {@code (sortKey, tiebreakId)} key.
 * Both key parts follow the same direction.
 */
public enum ProcessingOrder {
    NEWEST_FIRST("newest_first"),
    OLDEST_FIRST("oldest_first");

    private static final Comparator<SourceRecord> ASCENDING = Comparator
            .comparing(SourceRecord::createdAt)
            .thenComparing(SourceRecord::id);

    private final String wireName;

    ProcessingOrder(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isDescending() {
        return this == NEWEST_FIRST;
    }

    /** Comparator over records in traversal order. */
    public Comparator<SourceRecord> comparator() {
        return isDescending() ? ASCENDING.reversed() : ASCENDING;
    }

    /**
     * True if {@code candidate} lies strictly beyond {@code reference} in traversal order.
     * Used for tiebreak ids, which are compared lexicographically.
     */
    public boolean isBeyond(String candidate, String reference) {
        int cmp = candidate.compareTo(reference);
        return isDescending() ? cmp < 0 : cmp > 0;
    }

    public static ProcessingOrder fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ProcessingOrder order : values()) {
            if (order.wireName.equalsIgnoreCase(value.trim()) || order.name().equalsIgnoreCase(value.trim())) {
                return order;
            }
        }
        throw new IllegalArgumentException("order must be newest_first or oldest_first, got: " + value);
    }
}
