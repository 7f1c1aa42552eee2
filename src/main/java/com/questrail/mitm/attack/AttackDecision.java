package com.questrail.mitm.attack;

import java.time.Duration;
import java.util.Objects;

/**
 * What the attack engine does with one frame.
 *
 * <p>Produced by {@link AttackPolicy}; realized by {@link AttackEngine}. Keeping
 * the decision a plain value lets the per-mode rules be tested without any
 * scheduling or I/O.</p>
 */
public sealed interface AttackDecision
        permits AttackDecision.ForwardNow, AttackDecision.ForwardAfter,
                AttackDecision.Drop, AttackDecision.Hold
{
    ForwardNow FORWARD_NOW = new ForwardNow();
    Drop DROP = new Drop();
    Hold HOLD = new Hold();

    /** Write downstream immediately. */
    record ForwardNow() implements AttackDecision {}

    /** Write downstream once {@code delay} has elapsed, without blocking later frames. */
    record ForwardAfter(Duration delay) implements AttackDecision {
        public ForwardAfter {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must be >= 0");
            }
        }
    }

    /** Discard permanently. */
    record Drop() implements AttackDecision {}

    /** Place in the reorder buffer for later out-of-order release. */
    record Hold() implements AttackDecision {}
}
