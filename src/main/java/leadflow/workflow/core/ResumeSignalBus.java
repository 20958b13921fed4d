package leadflow.workflow.core;

import leadflow.workflow.model.SignalType;

import java.util.function.BooleanSupplier;

/**
 * Delivers resume and cancel signals to a run paused for review.
 * At most one waiter per job.
 */
public interface ResumeSignalBus {

    /**
     * Block until a signal for the job is delivered.
     *
     * @throws IllegalStateException if another thread is already waiting for this job
     * @throws InterruptedException  if the waiting thread is interrupted
     */
    default SignalType await(String jobId) throws InterruptedException {
        return await(jobId, () -> false, () -> {
        });
    }

    /**
     * Block until a signal is delivered, returning {@link SignalType#CANCEL} right away if
     * {@code canceled} is true once the waiter is registered. A cancellation flag set
     * before the wait is therefore never missed.
     *
     * @throws IllegalStateException if another thread is already waiting for this job
     * @throws InterruptedException  if the waiting thread is interrupted
     */
    default SignalType await(String jobId, BooleanSupplier canceled) throws InterruptedException {
        return await(jobId, canceled, () -> {
        });
    }

    /**
     * As {@link #await(String, BooleanSupplier)}, running {@code onWaiting} once the waiter
     * is registered and before the cancellation check. Anything {@code onWaiting} makes
     * visible (such as the PAUSED status) is only seen while a delivery can reach the waiter.
     *
     * @throws IllegalStateException if another thread is already waiting for this job
     * @throws InterruptedException  if the waiting thread is interrupted
     */
    SignalType await(String jobId, BooleanSupplier canceled, Runnable onWaiting) throws InterruptedException;

    /**
     * Wake the waiter of a job.
     *
     * @return true if a waiter received the signal, false if nobody was waiting
     */
    boolean deliver(String jobId, SignalType signal);

    /** True if a run of the job is currently waiting. */
    boolean isWaiting(String jobId);
}
