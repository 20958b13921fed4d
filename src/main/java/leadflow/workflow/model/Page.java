package leadflow.workflow.model;

import java.util.List;

/**
 * One page of the traversal and the cursor to continue from.
 *
 * @param records    records in traversal order, at most the job's batch size
 * @param nextCursor key of the last record, or null when the page is empty
 */
public record Page(List<SourceRecord> records, Cursor nextCursor) {

    public Page {
        records = List.copyOf(records);
    }

    public static Page empty() {
        return new Page(List.of(), null);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
