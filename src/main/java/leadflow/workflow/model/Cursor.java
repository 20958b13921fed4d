package leadflow.workflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Compound traversal position: sort key of the last committed record plus its
 * unique tiebreak id. A job without a cursor has not committed any page yet.
 *
 * @param sortKey    creation time of the last record in the last committed page
 * @param tiebreakId id of that record, unique across the collection
 */
public record Cursor(Instant sortKey, String tiebreakId) {

    public Cursor {
        Objects.requireNonNull(sortKey, "sortKey must not be null");
        Objects.requireNonNull(tiebreakId, "tiebreakId must not be null");
    }

    public static Cursor of(SourceRecord record) {
        return new Cursor(record.createdAt(), record.id());
    }

    @Override
    public String toString() {
        return "(" + sortKey + ", " + tiebreakId + ")";
    }
}
