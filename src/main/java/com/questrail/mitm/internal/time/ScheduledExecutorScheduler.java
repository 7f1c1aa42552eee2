package com.questrail.mitm.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted into relative delays with the supplied
 * {@link MonotonicClock}. Callers computing deadlines must use the same clock
 * instance, typically {@link SystemMonotonicClock#INSTANCE}.</p>
 *
 * <p>This class does <strong>not</strong> own the executor. The composition
 * root that created it shuts it down.</p>
 *
 * <p>Tasks may run slightly after their deadline under load, never before.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return new FutureCancellable(future);
    }

    private static final class FutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private FutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // A release that is already writing is left to finish.
            return future.cancel(false);
        }
    }
}
