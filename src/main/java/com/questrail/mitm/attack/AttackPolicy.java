package com.questrail.mitm.attack;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * AttackPolicy
 * -----------------------------------------------------------------------------
 * Per-mode decision rule. Pure apart from its random source.
 *
 * <ul>
 *   <li>{@code transparent}: always {@link AttackDecision.ForwardNow}</li>
 *   <li>{@code random_delay}: {@link AttackDecision.ForwardAfter} with a delay
 *       drawn uniformly from {@code [delay_min, delay_max]}, independently
 *       per frame</li>
 *   <li>{@code drop}: {@link AttackDecision.Drop} with probability
 *       {@code drop_rate}, else {@link AttackDecision.ForwardNow}</li>
 *   <li>{@code reorder}: always {@link AttackDecision.Hold}</li>
 * </ul>
 *
 * <p>Not thread-safe; the owning engine serializes calls.</p>
 */
public final class AttackPolicy
{
    private final AttackConfig config;
    private final Random random;

    public AttackPolicy(AttackConfig config, Random random) {
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
    }

    public AttackMode mode() {
        return config.mode();
    }

    public AttackDecision decide() {
        return switch (config.mode()) {
            case TRANSPARENT -> AttackDecision.FORWARD_NOW;
            case RANDOM_DELAY -> new AttackDecision.ForwardAfter(drawDelay());
            // nextDouble() is in [0, 1): a rate of 1.0 drops everything, 0.0 nothing.
            case DROP -> random.nextDouble() < config.dropRate()
                    ? AttackDecision.DROP
                    : AttackDecision.FORWARD_NOW;
            case REORDER -> AttackDecision.HOLD;
        };
    }

    Duration drawDelay() {
        long min = config.delayMin().toNanos();
        long max = config.delayMax().toNanos();
        if (max == min) {
            return Duration.ofNanos(min);
        }
        // Inclusive upper bound.
        long offset = (long) (random.nextDouble() * (max - min + 1));
        return Duration.ofNanos(Math.min(max, min + offset));
    }
}
