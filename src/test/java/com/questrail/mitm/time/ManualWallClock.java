package com.questrail.mitm.time;

import com.questrail.mitm.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall clock that only moves when told to.
 */
public final class ManualWallClock implements WallClock {

    private volatile Instant now;

    public ManualWallClock(Instant start) {
        this.now = start;
    }

    @Override
    public Instant now() {
        return now;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    public void set(Instant instant) {
        now = instant;
    }
}
