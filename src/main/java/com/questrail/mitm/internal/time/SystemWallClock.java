package com.questrail.mitm.internal.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>May jump under NTP or manual adjustment. Used for message timestamps,
 * transit-delay estimation and log lines; never for scheduling.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
