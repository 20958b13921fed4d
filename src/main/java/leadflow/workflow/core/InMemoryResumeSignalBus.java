package leadflow.workflow.core;

import leadflow.workflow.model.SignalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.BooleanSupplier;

/**
 * Process-local signal bus. Waiters do not survive a restart; a job left PAUSED by a
 * previous process is continued through {@code resumeRun} instead.
 */
public class InMemoryResumeSignalBus implements ResumeSignalBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResumeSignalBus.class);

    private final ConcurrentMap<String, CompletableFuture<SignalType>> waiters = new ConcurrentHashMap<>();

    @Override
    public SignalType await(String jobId, BooleanSupplier canceled, Runnable onWaiting)
            throws InterruptedException {
        CompletableFuture<SignalType> slot = new CompletableFuture<>();
        if (waiters.putIfAbsent(jobId, slot) != null) {
            throw new IllegalStateException("A run is already waiting for job " + jobId);
        }

        log.debug("Waiting for signal on job {}", jobId);
        try {
            onWaiting.run();
            if (canceled.getAsBoolean()) {
                slot.complete(SignalType.CANCEL);
            }
            return slot.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Signal wait failed for job " + jobId, e.getCause());
        } finally {
            waiters.remove(jobId, slot);
        }
    }

    @Override
    public boolean deliver(String jobId, SignalType signal) {
        CompletableFuture<SignalType> slot = waiters.get(jobId);
        if (slot == null) {
            log.debug("No waiter for job {}, {} dropped", jobId, signal);
            return false;
        }
        boolean delivered = slot.complete(signal);
        if (delivered) {
            log.info("Delivered {} to job {}", signal, jobId);
        } else {
            log.debug("Job {} already signaled, {} ignored", jobId, signal);
        }
        return delivered;
    }

    @Override
    public boolean isWaiting(String jobId) {
        CompletableFuture<SignalType> slot = waiters.get(jobId);
        return slot != null && !slot.isDone();
    }
}
