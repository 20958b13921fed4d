package leadflow.workflow.config;

import leadflow.workflow.api.v1.HealthController;
import leadflow.workflow.api.v1.JobController;
import leadflow.workflow.api.v1.RecordController;
import leadflow.workflow.api.v1.ReviewController;
import leadflow.workflow.core.BatchProcessor;
import leadflow.workflow.core.CancellationMonitor;
import leadflow.workflow.core.CursorPaginator;
import leadflow.workflow.core.InMemoryResumeSignalBus;
import leadflow.workflow.core.ResumeSignalBus;
import leadflow.workflow.core.RunOrchestrator;
import leadflow.workflow.enrichment.EnrichmentCapability;
import leadflow.workflow.enrichment.LinkCheckCapability;
import leadflow.workflow.repository.JobRepository;
import leadflow.workflow.repository.RecordRepository;
import leadflow.workflow.repository.ReviewRepository;
import leadflow.workflow.repository.VerificationResultRepository;
import leadflow.workflow.scheduler.Scheduler;
import leadflow.workflow.server.RouterHandler;
import leadflow.workflow.service.WorkflowService;
import leadflow.workflow.store.Database;
import leadflow.workflow.store.JdbcJobRepository;
import leadflow.workflow.store.JdbcRecordRepository;
import leadflow.workflow.store.JdbcReviewRepository;
import leadflow.workflow.store.JdbcVerificationResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the store, the run engine, the service and the HTTP controllers by hand.
 * One instance per server; {@link #close()} releases everything it created.
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    /**
     * Builds the per-record capability once the repositories exist.
     */
    @FunctionalInterface
    public interface CapabilityFactory {
        EnrichmentCapability create(RecordRepository records, VerificationResultRepository results,
                WorkflowConfig config);
    }

    /** Link verification over HTTP */
    public static final CapabilityFactory LINK_CHECK = (records, results, config) -> new LinkCheckCapability(
            records, results, config.linkCheckTimeout(), config.recheckAfter());

    private final WorkflowConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final RecordRepository recordRepository;
    private final VerificationResultRepository resultRepository;
    private final ReviewRepository reviewRepository;
    private final ResumeSignalBus signalBus;
    private final RunOrchestrator orchestrator;
    private final WorkflowService workflowService;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final ReviewController reviewController;
    private final RecordController recordController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(WorkflowConfig config, CapabilityFactory capabilityFactory) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database, config.maxErrorsPerJob());
        this.recordRepository = new JdbcRecordRepository(database);
        this.resultRepository = new JdbcVerificationResultRepository(database);
        this.reviewRepository = new JdbcReviewRepository(database);

        // Run engine
        EnrichmentCapability capability = capabilityFactory.create(recordRepository, resultRepository, config);
        this.signalBus = new InMemoryResumeSignalBus();
        this.orchestrator = new RunOrchestrator(
                jobRepository,
                reviewRepository,
                new CursorPaginator(recordRepository),
                new BatchProcessor(capability),
                new CancellationMonitor(jobRepository),
                signalBus,
                config.defaultMaxBatches(),
                config.interBatchDelay());

        // Services
        this.workflowService = new WorkflowService(
                jobRepository, recordRepository, resultRepository, reviewRepository,
                orchestrator, capability, signalBus, config);

        // Controllers (public API)
        this.healthController = new HealthController(database, workflowService);
        this.jobController = new JobController(workflowService);
        this.reviewController = new ReviewController(workflowService);
        this.recordController = new RecordController(workflowService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and the link check capability.
     */
    public static Dependencies create(WorkflowConfig config) {
        return new Dependencies(config, LINK_CHECK);
    }

    /**
     * Create dependencies with a custom per-record capability.
     */
    public static Dependencies create(WorkflowConfig config, CapabilityFactory capabilityFactory) {
        return new Dependencies(config, capabilityFactory);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(WorkflowConfig.fromEnv());
    }

    // Getters
    public WorkflowConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public RecordRepository recordRepository() {
        return recordRepository;
    }

    public VerificationResultRepository resultRepository() {
        return resultRepository;
    }

    public ReviewRepository reviewRepository() {
        return reviewRepository;
    }

    public ResumeSignalBus signalBus() {
        return signalBus;
    }

    public RunOrchestrator orchestrator() {
        return orchestrator;
    }

    public WorkflowService workflowService() {
        return workflowService;
    }

    /**
     * Router with every controller registered. Review routes go before job routes.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(reviewController)
                    .registerController(jobController)
                    .registerController(recordController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(workflowService, config);
        }
        return scheduler;
    }

    /** Start continuing stalled jobs in the background. */
    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Stops the sweeper, then live runs, then the pool, so no run touches a closed pool.
     */
    @Override
    public void close() {
        log.info("Closing dependencies...");
        if (scheduler != null) {
            closeStep("scheduler", scheduler);
        }
        closeStep("workflow service", workflowService);
        closeStep("database", database);
        log.info("Dependencies closed");
    }

    private static void closeStep(String name, AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", name, e.getMessage(), e);
        }
    }
}
