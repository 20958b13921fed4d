package leadflow.workflow.store;

import leadflow.workflow.model.ProcessingOrder;
import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.model.Viability;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRecordRepositoryTest {

    private static final Instant BASE = Instant.parse("2024-03-01T10:00:00Z");

    private Database db;
    private JdbcRecordRepository repo;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-records-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcRecordRepository(db);
        repo.saveAll(List.of(
                SourceRecord.of("a", BASE, "A", "https://a.example"),
                SourceRecord.of("b", BASE.plusSeconds(10), "B", "https://b.example"),
                SourceRecord.of("c", BASE.plusSeconds(10), "C", null),
                SourceRecord.of("d", BASE.plusSeconds(20), "D", "https://d.example")));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void saveAndCount() {
        assertEquals(4, repo.count());
        SourceRecord c = repo.findById("c").orElseThrow();
        assertEquals(BASE.plusSeconds(10), c.createdAt());
        assertNull(c.sourceUrl());
        assertEquals(Viability.UNREVIEWED, c.viability());
    }

    @Test
    @DisplayName("Ingest rejects ids that already exist and stores nothing from that request")
    void duplicateIdsRejected() {
        assertThrows(IllegalArgumentException.class, () -> repo.saveAll(List.of(
                SourceRecord.of("e", BASE, "E", null),
                SourceRecord.of("a", BASE, "A again", null))));
        assertThrows(IllegalArgumentException.class, () -> repo.saveAll(List.of(
                SourceRecord.of("f", BASE, "F", null),
                SourceRecord.of("f", BASE, "F again", null))));

        assertEquals(4, repo.count());
        assertTrue(repo.findById("e").isEmpty());
    }

    @Test
    void fetchFirstHonoursOrder() {
        assertEquals(List.of("d", "c", "b"),
                repo.fetchFirst(ProcessingOrder.NEWEST_FIRST, 3).stream().map(SourceRecord::id).toList());
        assertEquals(List.of("a", "b"),
                repo.fetchFirst(ProcessingOrder.OLDEST_FIRST, 2).stream().map(SourceRecord::id).toList());
    }

    @Test
    void fetchBeyondIsStrict() {
        assertEquals(List.of("a"),
                repo.fetchBeyond(ProcessingOrder.NEWEST_FIRST, BASE.plusSeconds(10), 10)
                        .stream().map(SourceRecord::id).toList());
        assertEquals(List.of("d"),
                repo.fetchBeyond(ProcessingOrder.OLDEST_FIRST, BASE.plusSeconds(10), 10)
                        .stream().map(SourceRecord::id).toList());
    }

    @Test
    void fetchTiesBoundedByTiebreakAndLimit() {
        Instant tied = BASE.plusSeconds(10);

        assertEquals(List.of("b", "c"),
                repo.fetchTies(ProcessingOrder.OLDEST_FIRST, tied, "", 10)
                        .stream().map(SourceRecord::id).toList());
        assertEquals(List.of("c"),
                repo.fetchTies(ProcessingOrder.OLDEST_FIRST, tied, "b", 10)
                        .stream().map(SourceRecord::id).toList());
        assertEquals(List.of("b"),
                repo.fetchTies(ProcessingOrder.NEWEST_FIRST, tied, "c", 10)
                        .stream().map(SourceRecord::id).toList());
        assertEquals(List.of("c"),
                repo.fetchTies(ProcessingOrder.NEWEST_FIRST, tied, "zzz", 1)
                        .stream().map(SourceRecord::id).toList());
        assertTrue(repo.fetchTies(ProcessingOrder.OLDEST_FIRST, BASE.plusSeconds(5), "", 10).isEmpty());
    }

    @Test
    void updatesSourceUrlAndViability() {
        Instant checked = Instant.parse("2024-06-01T00:00:00Z");

        assertTrue(repo.updateSourceUrl("a", "https://a.example/new", checked));
        assertTrue(repo.updateViability("a", Viability.VIABLE));
        assertFalse(repo.updateViability("zzz", Viability.VIABLE));

        SourceRecord a = repo.findById("a").orElseThrow();
        assertEquals("https://a.example/new", a.sourceUrl());
        assertEquals(checked, a.lastCheckedAt());
        assertEquals(Viability.VIABLE, a.viability());
    }
}
