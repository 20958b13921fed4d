package leadflow.workflow.store;

import leadflow.workflow.model.BatchResult;
import leadflow.workflow.model.Cursor;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobError;
import leadflow.workflow.model.JobPatch;
import leadflow.workflow.model.JobStatus;
import leadflow.workflow.model.Outcome;
import leadflow.workflow.model.ProcessingOrder;
import leadflow.workflow.model.VerificationResult;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static final int MAX_ERRORS = 5;

    private Database db;
    private JdbcJobRepository repo;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-jobs-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        repo = new JdbcJobRepository(db, MAX_ERRORS);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void saveAndFindById() {
        repo.save(Job.builder()
                .id("job-1")
                .batchSize(25)
                .order(ProcessingOrder.OLDEST_FIRST)
                .totalRecords(120)
                .maxBatchesThisRun(3)
                .reviewRequired(true)
                .startedBy("ops")
                .currentTask("Queued")
                .build());

        Optional<Job> found = repo.findById("job-1");
        assertTrue(found.isPresent());
        Job job = found.get();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(25, job.batchSize());
        assertEquals(ProcessingOrder.OLDEST_FIRST, job.order());
        assertEquals(120, job.totalRecords());
        assertEquals(Integer.valueOf(3), job.maxBatchesThisRun());
        assertTrue(job.reviewRequired());
        assertFalse(job.cancelRequested());
        assertEquals("ops", job.startedBy());
        assertNull(job.cursor());
        assertNotNull(job.createdAt());
    }

    @Test
    void findByIdMissing() {
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    @DisplayName("Page commits add counter deltas and store the compound cursor")
    void pageCommitAccumulates() {
        repo.save(Job.builder().id("job-1").status(JobStatus.RUNNING).build());
        Instant sortKey = Instant.parse("2024-05-01T12:30:00.123456Z");

        BatchResult first = new BatchResult(10, 4, 3, 2, 1,
                List.of(new JobError("r7", "HTTP 404", Instant.now())), List.of());
        BatchResult second = new BatchResult(5, 1, 1, 3, 0, List.of(), List.of());
        assertTrue(repo.updateStatus("job-1",
                JobPatch.pageCommitted(new Cursor(Instant.parse("2024-05-02T00:00:00Z"), "r10"), first, 1, "b1")));
        assertTrue(repo.updateStatus("job-1",
                JobPatch.pageCommitted(new Cursor(sortKey, "r15"), second, 2, "b2")));

        Job job = repo.findById("job-1").orElseThrow();
        assertEquals(15, job.processed());
        assertEquals(5, job.succeeded());
        assertEquals(4, job.skipped());
        assertEquals(1, job.failed());
        assertEquals(2, job.currentBatch());
        assertEquals("b2", job.currentTask());
        assertEquals(new Cursor(sortKey, "r15"), job.cursor());
        assertEquals(1, job.errors().size());
        assertEquals("r7", job.errors().get(0).recordId());
    }

    @Test
    @DisplayName("A conditional finalize never overwrites a terminal status")
    void onlyIfActiveKeepsTerminalStatus() {
        repo.save(Job.builder().id("job-done").status(JobStatus.COMPLETED).build());
        repo.save(Job.builder().id("job-live").status(JobStatus.RUNNING).build());

        assertFalse(repo.updateStatus("job-done", JobPatch.create()
                .status(JobStatus.CANCELED)
                .currentTask("Canceled")
                .onlyIfActive()));
        assertTrue(repo.updateStatus("job-live", JobPatch.create()
                .status(JobStatus.CANCELED)
                .onlyIfActive()));

        assertEquals(JobStatus.COMPLETED, repo.findById("job-done").orElseThrow().status());
        assertEquals(JobStatus.CANCELED, repo.findById("job-live").orElseThrow().status());
    }

    @Test
    void updateMissingJobReturnsFalse() {
        assertFalse(repo.updateStatus("ghost", JobPatch.create().status(JobStatus.RUNNING)));
    }

    @Test
    @DisplayName("Only the most recent errors are kept")
    void errorsTrimmedToMax() {
        repo.save(Job.builder().id("job-1").build());

        for (int i = 0; i < 8; i++) {
            List<JobError> errors = new ArrayList<>();
            errors.add(new JobError("r" + i, "error " + i, Instant.now()));
            repo.updateStatus("job-1", JobPatch.create().errors(errors));
        }

        List<JobError> kept = repo.findById("job-1").orElseThrow().errors();
        assertEquals(MAX_ERRORS, kept.size());
        assertEquals("r3", kept.get(0).recordId());
        assertEquals("r7", kept.get(MAX_ERRORS - 1).recordId());
    }

    @Test
    void startedAtKeepsFirstValueAndErrorCanBeCleared() {
        repo.save(Job.builder().id("job-1").build());
        Instant first = Instant.parse("2024-01-01T00:00:00Z");

        repo.updateStatus("job-1", JobPatch.create().startedAt(first).error("broke"));
        repo.updateStatus("job-1", JobPatch.create().startedAt(Instant.now()));
        assertEquals("broke", repo.findById("job-1").orElseThrow().error());

        repo.updateStatus("job-1", JobPatch.create().clearError());

        Job job = repo.findById("job-1").orElseThrow();
        assertEquals(first, job.startedAt());
        assertNull(job.error());
    }

    @Test
    void findByStatusAndRecent() {
        repo.save(Job.builder().id("a").status(JobStatus.RUNNING).createdAt(Instant.now().minusSeconds(30)).build());
        repo.save(Job.builder().id("b").status(JobStatus.PAUSED).createdAt(Instant.now().minusSeconds(20)).build());
        repo.save(Job.builder().id("c").status(JobStatus.RUNNING).createdAt(Instant.now().minusSeconds(10)).build());

        List<Job> running = repo.findByStatus(JobStatus.RUNNING, 10);
        assertEquals(List.of("c", "a"), running.stream().map(Job::id).toList());

        List<Job> recent = repo.findRecent(2);
        assertEquals(List.of("c", "b"), recent.stream().map(Job::id).toList());
        assertEquals(3, repo.findAll().size());
    }

    @Test
    @DisplayName("Delete removes the job with its results, review entries and errors")
    void deleteCascades() {
        repo.save(Job.builder().id("job-1").status(JobStatus.COMPLETED).build());
        repo.updateStatus("job-1", JobPatch.create()
                .errors(List.of(new JobError("r1", "bad", Instant.now()))));
        JdbcVerificationResultRepository results = new JdbcVerificationResultRepository(db);
        results.save(VerificationResult.builder()
                .jobId("job-1").recordId("r1").outcome(Outcome.FAILED).verifiedAt(Instant.now()).build());
        JdbcReviewRepository reviews = new JdbcReviewRepository(db);
        reviews.addAll("job-1", List.of("r1"));

        assertTrue(repo.delete("job-1"));

        assertTrue(repo.findById("job-1").isEmpty());
        assertEquals(0, results.stats("job-1").total());
        assertEquals(0, reviews.count("job-1"));
        assertFalse(repo.delete("job-1"));
    }

    @Test
    void generatedIdsAreUnique() {
        assertNotEquals(repo.generateId(), repo.generateId());
        assertTrue(repo.generateId().startsWith("job-"));
    }
}
