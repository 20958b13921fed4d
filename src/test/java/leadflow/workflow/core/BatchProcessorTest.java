package leadflow.workflow.core;

import leadflow.workflow.model.BatchResult;
import leadflow.workflow.model.Cursor;
import leadflow.workflow.model.EnrichmentResult;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.Page;
import leadflow.workflow.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static leadflow.workflow.core.CursorPaginatorTest.record;
import static org.junit.jupiter.api.Assertions.*;

class BatchProcessorTest {

    private final Job job = Job.builder().id("job-test").batchSize(5).build();

    @Test
    @DisplayName("Outcomes are tallied per record and updated records become review candidates")
    void talliesOutcomes() throws Exception {
        BatchProcessor processor = new BatchProcessor((j, r) -> switch (r.id()) {
            case "u1", "u2" -> EnrichmentResult.updated("moved");
            case "s" -> EnrichmentResult.skipped("recent");
            case "n" -> EnrichmentResult.noChange("HTTP 200");
            default -> EnrichmentResult.failed("HTTP 404");
        });

        BatchResult result = processor.process(job, page("u1", "s", "n", "f", "u2"));

        assertEquals(5, result.processed());
        assertEquals(2, result.updated());
        assertEquals(1, result.skipped());
        assertEquals(1, result.noChange());
        assertEquals(1, result.failed());
        assertEquals(List.of("u1", "u2"), result.reviewCandidates());
        assertEquals(1, result.errors().size());
        assertEquals("f", result.errors().get(0).recordId());
        assertEquals("HTTP 404", result.errors().get(0).message());
    }

    @Test
    @DisplayName("A throwing record is counted as failed and the rest of the page still runs")
    void failureIsolation() throws Exception {
        List<String> called = new ArrayList<>();
        BatchProcessor processor = new BatchProcessor((j, r) -> {
            called.add(r.id());
            if (r.id().equals("b")) {
                throw new IllegalStateException("boom");
            }
            return EnrichmentResult.noChange("ok");
        });

        BatchResult result = processor.process(job, page("a", "b", "c"));

        assertEquals(List.of("a", "b", "c"), called);
        assertEquals(3, result.processed());
        assertEquals(1, result.failed());
        assertEquals(2, result.noChange());
        assertEquals("boom", result.errors().get(0).message());
    }

    @Test
    void nullResultCountsAsFailure() throws Exception {
        BatchProcessor processor = new BatchProcessor((j, r) -> null);

        BatchResult result = processor.process(job, page("a"));

        assertEquals(1, result.failed());
        assertEquals("No result returned", result.errors().get(0).message());
    }

    @Test
    void interruptAbandonsPage() {
        List<String> visited = new ArrayList<>();
        BatchProcessor processor = new BatchProcessor((j, r) -> {
            visited.add(r.id());
            if (r.id().equals("b")) {
                throw new InterruptedException("stop");
            }
            return EnrichmentResult.updated("ok");
        });

        assertThrows(InterruptedException.class, () -> processor.process(job, page("a", "b", "c")));
        assertEquals(List.of("a", "b"), visited);
    }

    @Test
    void swallowedInterruptStillAbandonsPage() {
        List<String> visited = new ArrayList<>();
        BatchProcessor processor = new BatchProcessor((j, r) -> {
            visited.add(r.id());
            Thread.currentThread().interrupt();
            return EnrichmentResult.failed("Interrupted");
        });

        try {
            assertThrows(InterruptedException.class, () -> processor.process(job, page("a", "b")));
            assertEquals(List.of("a"), visited);
        } finally {
            Thread.interrupted();
        }
    }

    private static Page page(String... ids) {
        List<SourceRecord> records = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            records.add(record(ids[i], 100 - i));
        }
        return new Page(records, Cursor.of(records.get(records.size() - 1)));
    }
}
