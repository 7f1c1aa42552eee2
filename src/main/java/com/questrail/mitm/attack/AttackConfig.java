package com.questrail.mitm.attack;

import java.time.Duration;
import java.util.Objects;

/**
 * AttackConfig
 * -----------------------------------------------------------------------------
 * Immutable snapshot applied to one relay session.
 *
 * <p>All parameters are validated here, so a session can never be constructed
 * from a violating configuration and no socket I/O happens for it. Parameters
 * that the selected mode does not use are still validated.</p>
 *
 * <p>A session keeps its snapshot for its whole lifetime. Changing mode means
 * starting a new session.</p>
 *
 * @param mode          transformation policy
 * @param delayMin      lower bound of the per-frame delay under {@link AttackMode#RANDOM_DELAY}
 * @param delayMax      upper bound of the per-frame delay; {@code delayMin <= delayMax}
 * @param dropRate      discard probability under {@link AttackMode#DROP}, in {@code [0, 1]}
 * @param reorderWindow reorder buffer capacity under {@link AttackMode#REORDER}; positive
 */
public record AttackConfig(
        AttackMode mode,
        Duration delayMin,
        Duration delayMax,
        double dropRate,
        int reorderWindow
) {
    /** Upper bound for {@code delayMax}; keeps delay arithmetic in nanoseconds exact. */
    public static final Duration MAX_DELAY = Duration.ofHours(24);

    public AttackConfig {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(delayMin, "delayMin");
        Objects.requireNonNull(delayMax, "delayMax");

        if (delayMin.isNegative()) {
            throw new IllegalArgumentException("delay_min must be >= 0: " + delayMin);
        }
        if (delayMax.compareTo(MAX_DELAY) > 0) {
            throw new IllegalArgumentException("delay_max must be <= " + MAX_DELAY.toSeconds() + "s: " + delayMax);
        }
        if (delayMax.compareTo(delayMin) < 0) {
            throw new IllegalArgumentException("delay_max (" + delayMax + ") must be >= delay_min (" + delayMin + ")");
        }
        if (!(dropRate >= 0.0 && dropRate <= 1.0)) {
            throw new IllegalArgumentException("drop_rate must be within [0, 1]: " + dropRate);
        }
        if (reorderWindow <= 0) {
            throw new IllegalArgumentException("reorder_window must be > 0: " + reorderWindow);
        }
    }

    /**
     * Factory defaults: {@code random_delay} between 2 and 10 seconds, 30% drop
     * rate, reorder window of 5.
     */
    public static AttackConfig defaults() {
        return new AttackConfig(AttackMode.RANDOM_DELAY, Duration.ofSeconds(2), Duration.ofSeconds(10), 0.3, 5);
    }

    public static AttackConfig transparent() {
        return defaults().withMode(AttackMode.TRANSPARENT);
    }

    public AttackConfig withMode(AttackMode newMode) {
        return new AttackConfig(newMode, delayMin, delayMax, dropRate, reorderWindow);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AttackMode mode = AttackMode.RANDOM_DELAY;
        private Duration delayMin = Duration.ofSeconds(2);
        private Duration delayMax = Duration.ofSeconds(10);
        private double dropRate = 0.3;
        private int reorderWindow = 5;

        public Builder withMode(AttackMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder withDelayBounds(Duration min, Duration max) {
            this.delayMin = min;
            this.delayMax = max;
            return this;
        }

        public Builder withDropRate(double dropRate) {
            this.dropRate = dropRate;
            return this;
        }

        public Builder withReorderWindow(int reorderWindow) {
            this.reorderWindow = reorderWindow;
            return this;
        }

        public AttackConfig build() {
            return new AttackConfig(mode, delayMin, delayMax, dropRate, reorderWindow);
        }
    }
}
