package leadflow.workflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A lead in the traversed collection.
 *
 * @param id            unique id, doubles as the pagination tiebreak
 * @param createdAt     pagination sort key, not unique
 * @param title         display title
 * @param sourceUrl     link being verified, may be null
 * @param lastCheckedAt last time the enrichment step looked at this record
 * @param viability     reviewer disposition
 */
public record SourceRecord(
        String id,
        Instant createdAt,
        String title,
        String sourceUrl,
        Instant lastCheckedAt,
        Viability viability) {

    public SourceRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (viability == null) {
            viability = Viability.UNREVIEWED;
        }
    }

    public static SourceRecord of(String id, Instant createdAt, String title, String sourceUrl) {
        return new SourceRecord(id, createdAt, title, sourceUrl, null, Viability.UNREVIEWED);
    }

    public boolean hasSourceUrl() {
        return sourceUrl != null && !sourceUrl.isBlank();
    }
}
