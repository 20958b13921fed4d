package leadflow.workflow.scheduler;

import leadflow.workflow.config.WorkflowConfig;
import leadflow.workflow.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@link ContinuationSweeper} on a single daemon thread, once per
 * continuation interval. A zero interval turns it off.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "leadflow-scheduler");
        t.setDaemon(true);
        return t;
    });
    private final ContinuationSweeper sweeper;
    private final Duration interval;

    private ScheduledFuture<?> sweep;

    public Scheduler(WorkflowService workflowService, WorkflowConfig config) {
        this.sweeper = new ContinuationSweeper(workflowService);
        this.interval = config.continuationEnabled() ? config.continuationInterval() : Duration.ZERO;
    }

    public synchronized void start() {
        if (sweep != null) {
            log.warn("Scheduler already running");
            return;
        }
        if (interval.isZero()) {
            log.info("Continuation sweeper disabled");
            return;
        }
        long periodMs = interval.toMillis();
        sweep = executor.scheduleWithFixedDelay(sweeper, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Continuation sweeper scheduled every {}ms", periodMs);
    }

    /**
     * Cancel the sweep and wait briefly for one in progress to finish.
     */
    public synchronized void stop() {
        sweep = null;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sweep still running after {}s, interrupting", SHUTDOWN_GRACE.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isRunning() {
        return sweep != null;
    }

    public ContinuationSweeper continuationSweeper() {
        return sweeper;
    }
}
