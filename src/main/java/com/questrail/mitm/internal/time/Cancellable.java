package com.questrail.mitm.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled task.
 *
 * <p>Held releases in the attack engine and the source pacing timer are both
 * represented by one of these. Implementations exist for a deterministic test
 * scheduler and for a JVM {@code ScheduledExecutorService}.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
