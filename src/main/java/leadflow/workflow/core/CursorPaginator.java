package leadflow.workflow.core;

import leadflow.workflow.model.Cursor;
import leadflow.workflow.model.Page;
import leadflow.workflow.model.ProcessingOrder;
import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.repository.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Yields successive pages of the record collection in {@code (createdAt, id)} order,
 * strictly after a persisted cursor.
 *
 * <p>
 * The sort key is not unique, so continuing from a cursor takes up to two bounded
 * reads: the records that share the cursor's sort key and lie beyond its tiebreak id,
 * then records whose sort key lies strictly beyond it. Records inserted behind the
 * cursor after it passed are not visited.
 */
public class CursorPaginator {

    private static final Logger log = LoggerFactory.getLogger(CursorPaginator.class);

    private final RecordSource source;

    public CursorPaginator(RecordSource source) {
        this.source = source;
    }

    /**
     * Fetch the next page.
     *
     * @param batchSize maximum records in the page, must be positive
     * @param order     traversal direction
     * @param cursor    last committed position, or null for the first page
     * @return the page; empty when the traversal is complete
     * @throws IllegalStateException if the source returns duplicate keys or the page does not advance
     */
    public Page next(int batchSize, ProcessingOrder order, Cursor cursor) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }

        List<SourceRecord> records = new ArrayList<>(batchSize);

        if (cursor == null) {
            records.addAll(source.fetchFirst(order, batchSize));
        } else {
            records.addAll(source.fetchTies(order, cursor.sortKey(), cursor.tiebreakId(), batchSize));
            if (records.size() < batchSize) {
                records.addAll(source.fetchBeyond(order, cursor.sortKey(), batchSize - records.size()));
            }
        }

        if (records.size() > batchSize) {
            records = new ArrayList<>(records.subList(0, batchSize));
        }
        if (records.isEmpty()) {
            return Page.empty();
        }

        validate(records, order, cursor);

        Cursor nextCursor = Cursor.of(records.get(records.size() - 1));
        log.debug("Fetched page of {} records after {} -> {}", records.size(), cursor, nextCursor);
        return new Page(records, nextCursor);
    }

    private void validate(List<SourceRecord> records, ProcessingOrder order, Cursor cursor) {
        Set<String> seen = new HashSet<>();
        SourceRecord previous = null;
        for (SourceRecord record : records) {
            if (!seen.add(record.id())) {
                throw new IllegalStateException("Duplicate record key in page: " + Cursor.of(record));
            }
            if (previous != null && order.comparator().compare(previous, record) >= 0) {
                throw new IllegalStateException("Page not in traversal order at " + Cursor.of(record));
            }
            previous = record;
        }

        if (cursor != null && !isAfter(records.get(0), cursor, order)) {
            throw new IllegalStateException("Page does not advance past cursor " + cursor);
        }
    }

    private static boolean isAfter(SourceRecord record, Cursor cursor, ProcessingOrder order) {
        int cmp = record.createdAt().compareTo(cursor.sortKey());
        if (cmp == 0) {
            return order.isBeyond(record.id(), cursor.tiebreakId());
        }
        return order.isDescending() ? cmp < 0 : cmp > 0;
    }
}
