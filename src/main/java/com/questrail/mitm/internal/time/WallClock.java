package com.questrail.mitm.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source.
 *
 * <p>The source stamps messages with it and the destination compares its own
 * reading against that stamp to estimate transit delay. Both sides therefore
 * depend on roughly synchronized clocks, which holds trivially when all roles
 * share a host.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();

    /**
     * Current wall-clock time as floating-point seconds since the epoch.
     */
    default double nowEpochSeconds()
    {
        Instant now = now();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    }
}
