package leadflow.workflow.enrichment;

import com.sun.net.httpserver.HttpServer;
import leadflow.workflow.model.EnrichmentResult;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.Outcome;
import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.model.VerificationResult;
import leadflow.workflow.model.Viability;
import leadflow.workflow.store.Database;
import leadflow.workflow.store.JdbcRecordRepository;
import leadflow.workflow.store.JdbcVerificationResultRepository;
import org.junit.jupiter.api.*;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkCheckCapabilityTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:00:00Z");

    private HttpServer server;
    private String baseUrl;
    private Database db;
    private JdbcRecordRepository records;
    private JdbcVerificationResultRepository results;
    private LinkCheckCapability capability;
    private final Job job = Job.builder().id("job-links").build();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.createContext("/old", exchange -> {
            exchange.getResponseHeaders().add("Location", baseUrl + "/ok");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/gone", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        db = new Database("jdbc:h2:mem:test-links-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        records = new JdbcRecordRepository(db);
        results = new JdbcVerificationResultRepository(db);
        capability = new LinkCheckCapability(records, results, Duration.ofSeconds(5), Duration.ofDays(7));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        db.close();
    }

    @Test
    void reachableLinkIsNoChange() throws Exception {
        SourceRecord record = store("lead-ok", baseUrl + "/ok", null);

        EnrichmentResult result = capability.enrich(job, record);

        assertEquals(Outcome.NO_CHANGE, result.outcome());
        assertNotNull(records.findById("lead-ok").orElseThrow().lastCheckedAt());
        assertEquals(1, results.stats(job.id()).noChange());
    }

    @Test
    @DisplayName("Redirected link is stored under its final URL")
    void redirectedLinkIsUpdated() throws Exception {
        SourceRecord record = store("lead-moved", baseUrl + "/old", null);

        EnrichmentResult result = capability.enrich(job, record);

        assertEquals(Outcome.UPDATED, result.outcome());
        assertEquals(baseUrl + "/ok", records.findById("lead-moved").orElseThrow().sourceUrl());

        List<VerificationResult> saved = results.findByJobId(job.id(), Outcome.UPDATED, 10);
        assertEquals(1, saved.size());
        assertEquals(baseUrl + "/old", saved.get(0).beforeValue());
        assertEquals(baseUrl + "/ok", saved.get(0).afterValue());
    }

    @Test
    void errorStatusFails() throws Exception {
        SourceRecord record = store("lead-gone", baseUrl + "/gone", null);

        EnrichmentResult result = capability.enrich(job, record);

        assertEquals(Outcome.FAILED, result.outcome());
        assertTrue(result.detail().startsWith("HTTP 404"));
        assertEquals(result.detail(), results.findByJobId(job.id(), null, 10).get(0).error());
    }

    @Test
    void missingUrlFails() throws Exception {
        SourceRecord record = store("lead-nourl", null, null);

        EnrichmentResult result = capability.enrich(job, record);

        assertEquals(Outcome.FAILED, result.outcome());
        assertEquals("Lead has no source URL", result.detail());
    }

    @Test
    void recentlyCheckedIsSkipped() throws Exception {
        SourceRecord record = store("lead-fresh", baseUrl + "/gone", Instant.now().minus(Duration.ofHours(1)));

        EnrichmentResult result = capability.enrich(job, record);

        assertEquals(Outcome.SKIPPED, result.outcome());
        assertEquals(1, results.stats(job.id()).skipped());
    }

    @Test
    void unreachableHostFails() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        SourceRecord record = store("lead-down", "http://127.0.0.1:" + port + "/ok", null);

        EnrichmentResult result = capability.enrich(job, record);

        assertEquals(Outcome.FAILED, result.outcome());
        assertTrue(result.detail().startsWith("Request failed"));
    }

    private SourceRecord store(String id, String url, Instant lastCheckedAt) {
        SourceRecord record = new SourceRecord(id, CREATED, "Lead " + id, url, lastCheckedAt, Viability.UNREVIEWED);
        records.save(record);
        return record;
    }
}
