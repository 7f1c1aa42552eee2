package com.questrail.mitm.attack;

/**
 * Snapshot of an attack engine's per-session counters.
 *
 * @param received            frames submitted from upstream
 * @param forwarded           frames written downstream, by any path
 * @param dropped             frames discarded by the {@code drop} policy
 * @param delayed             frames released after a {@code random_delay} hold
 * @param reordered           frames released by a full reorder buffer
 * @param discardedAtShutdown frames still held when the session was cancelled;
 *                            never counted as {@code dropped}
 */
public record AttackStats(
        long received,
        long forwarded,
        long dropped,
        long delayed,
        long reordered,
        long discardedAtShutdown
) {
    /**
     * Frames currently held: delayed, buffered, or not yet accounted for.
     */
    public long inFlight() {
        return received - forwarded - dropped - discardedAtShutdown;
    }
}
