package com.questrail.mitm.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for operational timing.
 *
 * <h2>Binding invariant</h2>
 * Hold durations, pacing intervals and any other scheduling decision MUST use a
 * monotonic time source. Wall-clock time is reserved for message timestamps and
 * observability (see {@link WallClock}).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
