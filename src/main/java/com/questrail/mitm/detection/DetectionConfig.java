package com.questrail.mitm.detection;

/**
 * Detection settings handed to a {@link DetectionEngine} as a read-only snapshot.
 *
 * @param enabled         when false state is still tracked but no alert is emitted
 * @param maxDelaySeconds transit delay above which a message is flagged
 * @param replayWindow    how many recent sequence numbers are remembered for replay detection
 * @param initialSequence first sequence number considered in order for a new source
 */
public record DetectionConfig(
        boolean enabled,
        double maxDelaySeconds,
        int replayWindow,
        long initialSequence
) {
    public static final int DEFAULT_REPLAY_WINDOW = 1024;
    public static final double DEFAULT_MAX_DELAY_SECONDS = 6.0;

    public DetectionConfig {
        if (!(maxDelaySeconds >= 0.0) || Double.isInfinite(maxDelaySeconds)) {
            throw new IllegalArgumentException("max_delay must be a finite value >= 0: " + maxDelaySeconds);
        }
        if (replayWindow <= 0) {
            throw new IllegalArgumentException("replay_window must be > 0: " + replayWindow);
        }
        if (initialSequence < 0) {
            throw new IllegalArgumentException("initial sequence must be >= 0: " + initialSequence);
        }
    }

    public DetectionConfig(boolean enabled, double maxDelaySeconds) {
        this(enabled, maxDelaySeconds, DEFAULT_REPLAY_WINDOW, 1L);
    }

    public static DetectionConfig defaults() {
        return new DetectionConfig(true, DEFAULT_MAX_DELAY_SECONDS);
    }

    public DetectionConfig withEnabled(boolean value) {
        return new DetectionConfig(value, maxDelaySeconds, replayWindow, initialSequence);
    }
}
