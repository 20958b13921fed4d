package leadflow.workflow.core;

import leadflow.workflow.enrichment.EnrichmentCapability;
import leadflow.workflow.model.Cursor;
import leadflow.workflow.model.EnrichmentResult;
import leadflow.workflow.model.Job;
import leadflow.workflow.model.JobPatch;
import leadflow.workflow.model.JobStatus;
import leadflow.workflow.model.ProcessingOrder;
import leadflow.workflow.model.RunOutcome;
import leadflow.workflow.model.RunResult;
import leadflow.workflow.model.SignalType;
import leadflow.workflow.model.SourceRecord;
import leadflow.workflow.repository.RecordSource;
import leadflow.workflow.store.Database;
import leadflow.workflow.store.JdbcJobRepository;
import leadflow.workflow.store.JdbcRecordRepository;
import leadflow.workflow.store.JdbcReviewRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the orchestrator against H2 with a scripted capability.
 */
class RunOrchestratorTest {

        private static final Instant BASE = Instant.parse("2024-03-01T10:00:00Z");

        private Database db;
        private JdbcJobRepository jobs;
        private JdbcRecordRepository records;
        private JdbcReviewRepository reviews;
        private InMemoryResumeSignalBus bus;
        private ExecutorService executor;

        private final List<String> visited = new CopyOnWriteArrayList<>();
        private EnrichmentCapability behaviour;

        @BeforeEach
        void setUp() {
                db = new Database("jdbc:h2:mem:test-orchestrator-" + System.nanoTime()
                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
                jobs = new JdbcJobRepository(db, 100);
                records = new JdbcRecordRepository(db);
                reviews = new JdbcReviewRepository(db);
                bus = new InMemoryResumeSignalBus();
                executor = Executors.newSingleThreadExecutor();
                behaviour = (job, record) -> EnrichmentResult.noChange("ok");

                List<SourceRecord> seed = new ArrayList<>();
                for (int i = 0; i < 25; i++) {
                        // Pairs share a timestamp so page boundaries fall inside ties
                        seed.add(SourceRecord.of(String.format("lead-%02d", i), BASE.plusSeconds(i / 2),
                                        "Lead " + i, "https://example.org/" + i));
                }
                records.saveAll(seed);
        }

        @AfterEach
        void tearDown() {
                executor.shutdownNow();
                db.close();
        }

        private RunOrchestrator orchestrator() {
                EnrichmentCapability recording = (job, record) -> {
                        visited.add(record.id());
                        return behaviour.enrich(job, record);
                };
                return new RunOrchestrator(jobs, reviews,
                                new CursorPaginator(records),
                                new BatchProcessor(recording),
                                new CancellationMonitor(jobs),
                                bus,
                                100,
                                Duration.ZERO);
        }

        private String createJob(int batchSize, Integer maxBatches, boolean review) {
                String id = jobs.generateId();
                jobs.save(Job.builder()
                                .id(id)
                                .batchSize(batchSize)
                                .order(ProcessingOrder.NEWEST_FIRST)
                                .totalRecords(records.count())
                                .maxBatchesThisRun(maxBatches)
                                .reviewRequired(review)
                                .build());
                return id;
        }

        @Test
        @DisplayName("25 records in batches of 10: three pages, every record once, COMPLETED")
        void completesFullTraversal() {
                String jobId = createJob(10, null, false);

                RunResult result = orchestrator().run(jobId);

                assertEquals(RunOutcome.COMPLETED, result.outcome());
                assertEquals(3, result.batches());
                assertEquals(25, visited.size());
                assertEquals(25, new HashSet<>(visited).size());
                assertEquals("lead-24", visited.get(0));

                Job job = jobs.findById(jobId).orElseThrow();
                assertEquals(JobStatus.COMPLETED, job.status());
                assertEquals(25, job.processed());
                assertEquals(3, job.currentBatch());
                assertNotNull(job.completedAt());
                assertNotNull(job.startedAt());
                assertTrue(job.currentTask().startsWith("Completed: 25 processed"));
        }

        @Test
        @DisplayName("Oldest first: pages of 10, 10, 5 and the cursor ends on the 25th record")
        void oldestFirstCursorEndsOnLastRecord() {
                String jobId = jobs.generateId();
                jobs.save(Job.builder().id(jobId).batchSize(10).order(ProcessingOrder.OLDEST_FIRST).build());

                RunResult result = orchestrator().run(jobId);

                assertEquals(RunOutcome.COMPLETED, result.outcome());
                assertEquals(3, result.batches());
                assertEquals("lead-00", visited.get(0));
                assertEquals("lead-24", visited.get(24));
                Job job = jobs.findById(jobId).orElseThrow();
                assertEquals(25, job.processed());
                assertEquals(new Cursor(BASE.plusSeconds(12), "lead-24"), job.cursor());
        }

        @Test
        @DisplayName("Budget stop leaves the job resumable and the next run covers exactly the rest")
        void budgetStopAndResume() {
                String jobId = createJob(4, 2, false);
                RunOrchestrator orchestrator = orchestrator();

                RunResult first = orchestrator.run(jobId);
                assertEquals(RunOutcome.BUDGET_EXHAUSTED, first.outcome());
                assertEquals(2, first.batches());
                assertEquals(8, visited.size());

                Job paused = jobs.findById(jobId).orElseThrow();
                assertEquals(JobStatus.RUNNING, paused.status());
                assertEquals(8, paused.processed());
                assertNotNull(paused.cursor());

                jobs.updateStatus(jobId, JobPatch.create().maxBatchesThisRun(100));
                RunResult second = orchestrator.run(jobId);

                assertEquals(RunOutcome.COMPLETED, second.outcome());
                assertEquals(17, second.processed());
                assertEquals(25, visited.size());
                assertEquals(25, new HashSet<>(visited).size());
                assertEquals(25, jobs.findById(jobId).orElseThrow().processed());
        }

        @Test
        @DisplayName("Cancellation between pages ends CANCELED, never COMPLETED")
        void cancelDuringRun() {
                String jobId = createJob(5, null, false);
                behaviour = (job, record) -> {
                        if (record.id().equals("lead-20")) {
                                jobs.updateStatus(job.id(), JobPatch.create().cancelRequested(true));
                        }
                        return EnrichmentResult.noChange("ok");
                };

                RunResult result = orchestrator().run(jobId);

                assertEquals(RunOutcome.CANCELED, result.outcome());
                assertEquals(1, result.batches());
                Job job = jobs.findById(jobId).orElseThrow();
                assertEquals(JobStatus.CANCELED, job.status());
                assertEquals(5, job.processed());
        }

        @Test
        @DisplayName("An interrupt mid-page commits nothing of that page; the next run redoes it")
        void interruptMidPageRedoesPage() {
                String jobId = createJob(10, null, false);
                behaviour = (job, record) -> {
                        if (record.id().equals("lead-12")) {
                                throw new InterruptedException("shutting down");
                        }
                        return EnrichmentResult.noChange("ok");
                };

                RunResult interrupted;
                try {
                        interrupted = orchestrator().run(jobId);
                        assertTrue(Thread.currentThread().isInterrupted());
                } finally {
                        Thread.interrupted();
                }

                assertEquals(RunOutcome.INTERRUPTED, interrupted.outcome());
                Job job = jobs.findById(jobId).orElseThrow();
                assertEquals(JobStatus.RUNNING, job.status());
                assertEquals(10, job.processed());
                assertEquals(0, job.failed());
                assertEquals(1, job.currentBatch());
                assertTrue(job.errors().isEmpty());
                assertEquals(new Cursor(BASE.plusSeconds(7), "lead-15"), job.cursor());

                behaviour = (j, record) -> EnrichmentResult.noChange("ok");
                visited.clear();
                RunResult resumed = orchestrator().run(jobId);

                assertEquals(RunOutcome.COMPLETED, resumed.outcome());
                assertEquals(15, resumed.processed());
                assertEquals("lead-14", visited.get(0));
                Job done = jobs.findById(jobId).orElseThrow();
                assertEquals(25, done.processed());
                assertEquals(0, done.failed());
        }

        @Test
        void canceledJobIsNotRunAgain() {
                String jobId = createJob(5, null, false);
                jobs.updateStatus(jobId, JobPatch.create().cancelRequested(true));

                RunResult result = orchestrator().run(jobId);

                assertEquals(RunOutcome.CANCELED, result.outcome());
                assertTrue(visited.isEmpty());
        }

        @Test
        void missingJobReportsNotFound() {
                assertEquals(RunOutcome.NOT_FOUND, orchestrator().run("job-missing").outcome());
        }

        @Test
        @DisplayName("Record failures are counted and logged without stopping the run")
        void recordFailuresDoNotStopRun() {
                String jobId = createJob(10, null, false);
                behaviour = (job, record) -> {
                        if (record.id().endsWith("3")) {
                                throw new IllegalStateException("timeout on " + record.id());
                        }
                        return EnrichmentResult.updated("moved");
                };

                RunResult result = orchestrator().run(jobId);

                assertEquals(RunOutcome.COMPLETED, result.outcome());
                Job job = jobs.findById(jobId).orElseThrow();
                assertEquals(3, job.failed());
                assertEquals(22, job.succeeded());
                assertEquals(3, job.errors().size());
        }

        @Test
        @DisplayName("Page-level failure marks the job FAILED at the last committed cursor; resume finishes it")
        void pageFailureThenResume() {
                String jobId = createJob(10, null, false);
                AtomicBoolean storeDown = new AtomicBoolean(false);
                RunOrchestrator flaky = new RunOrchestrator(jobs, reviews,
                                new CursorPaginator(new RecordSource() {
                                        @Override
                                        public List<SourceRecord> fetchFirst(ProcessingOrder order, int limit) {
                                                return records.fetchFirst(order, limit);
                                        }

                                        @Override
                                        public List<SourceRecord> fetchBeyond(ProcessingOrder order, Instant sortKey,
                                                        int limit) {
                                                if (storeDown.get()) {
                                                        throw new RuntimeException("Failed to fetch records");
                                                }
                                                return records.fetchBeyond(order, sortKey, limit);
                                        }

                                        @Override
                                        public List<SourceRecord> fetchTies(ProcessingOrder order, Instant sortKey,
                                                        String afterId, int limit) {
                                                return records.fetchTies(order, sortKey, afterId, limit);
                                        }
                                }),
                                new BatchProcessor((job, record) -> {
                                        visited.add(record.id());
                                        return EnrichmentResult.noChange("ok");
                                }),
                                new CancellationMonitor(jobs), bus, 100, Duration.ZERO);
                storeDown.set(true);

                RunResult failed = flaky.run(jobId);

                assertEquals(RunOutcome.FAILED, failed.outcome());
                Job job = jobs.findById(jobId).orElseThrow();
                assertEquals(JobStatus.FAILED, job.status());
                assertEquals(10, job.processed());
                assertEquals("Failed to fetch records", job.error());

                storeDown.set(false);
                RunResult resumed = flaky.run(jobId);

                assertEquals(RunOutcome.COMPLETED, resumed.outcome());
                assertEquals(25, new HashSet<>(visited).size());
                assertEquals(25, visited.size());
                assertNull(jobs.findById(jobId).orElseThrow().error());
        }

        @Test
        @DisplayName("Review jobs pause with pending items and complete on RESUME")
        void reviewPauseThenResume() throws Exception {
                String jobId = createJob(10, null, true);
                behaviour = (job, record) -> record.id().equals("lead-07") || record.id().equals("lead-11")
                                ? EnrichmentResult.updated("moved")
                                : EnrichmentResult.noChange("ok");

                Future<RunResult> run = executor.submit(() -> orchestrator().run(jobId));
                awaitStatus(jobId, JobStatus.PAUSED);
                awaitWaiter(jobId);

                Job paused = jobs.findById(jobId).orElseThrow();
                assertEquals(RunOrchestrator.WAITING_FOR_REVIEW, paused.currentTask());
                Set<String> pending = new HashSet<>(reviews.findByJobId(jobId));
                assertEquals(Set.of("lead-07", "lead-11"), pending);

                assertTrue(bus.deliver(jobId, SignalType.RESUME));
                assertFalse(bus.deliver(jobId, SignalType.RESUME));

                RunResult result = run.get(5, TimeUnit.SECONDS);
                assertEquals(RunOutcome.COMPLETED, result.outcome());
                assertEquals(JobStatus.COMPLETED, jobs.findById(jobId).orElseThrow().status());
        }

        @Test
        @DisplayName("Cancel while paused for review ends CANCELED")
        void cancelWhilePaused() throws Exception {
                String jobId = createJob(10, null, true);

                Future<RunResult> run = executor.submit(() -> orchestrator().run(jobId));
                awaitWaiter(jobId);

                jobs.updateStatus(jobId, JobPatch.create().cancelRequested(true));
                assertTrue(bus.deliver(jobId, SignalType.CANCEL));

                assertEquals(RunOutcome.CANCELED, run.get(5, TimeUnit.SECONDS).outcome());
                assertEquals(JobStatus.CANCELED, jobs.findById(jobId).orElseThrow().status());
        }

        @Test
        @DisplayName("A paused job with no waiter completes when run again")
        void pausedWithoutWaiterCompletes() {
                String jobId = createJob(10, null, true);
                jobs.updateStatus(jobId, JobPatch.create().status(JobStatus.PAUSED));

                RunResult result = orchestrator().run(jobId);

                assertEquals(RunOutcome.COMPLETED, result.outcome());
                assertTrue(visited.isEmpty());
        }

        @Test
        void completedJobIsNotReprocessed() {
                String jobId = createJob(10, null, false);
                orchestrator().run(jobId);
                visited.clear();

                RunResult again = orchestrator().run(jobId);

                assertEquals(RunOutcome.COMPLETED, again.outcome());
                assertEquals(0, again.batches());
                assertTrue(visited.isEmpty());
        }

        private void awaitStatus(String jobId, JobStatus status) throws InterruptedException {
                long deadline = System.currentTimeMillis() + 5000;
                while (jobs.findById(jobId).orElseThrow().status() != status) {
                        if (System.currentTimeMillis() > deadline) {
                                fail("job " + jobId + " never reached " + status);
                        }
                        TimeUnit.MILLISECONDS.sleep(10);
                }
        }

        private void awaitWaiter(String jobId) throws InterruptedException {
                long deadline = System.currentTimeMillis() + 5000;
                while (!bus.isWaiting(jobId)) {
                        if (System.currentTimeMillis() > deadline) {
                                fail("no waiter for " + jobId);
                        }
                        TimeUnit.MILLISECONDS.sleep(10);
                }
        }
}
