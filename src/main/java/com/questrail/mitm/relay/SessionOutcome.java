package com.questrail.mitm.relay;

import com.questrail.mitm.attack.AttackStats;

/**
 * How a relay session ended.
 *
 * @param kind  termination kind
 * @param stats final engine counters
 * @param cause failure cause; {@code null} unless {@code kind} is {@link Kind#FAILED}
 */
public record SessionOutcome(Kind kind, AttackStats stats, Throwable cause)
{
    public enum Kind {
        /** Upstream closed normally and every held frame was delivered. */
        COMPLETED,
        /** A stop was requested. */
        STOPPED,
        /** A socket failed or the downstream side went away. */
        FAILED
    }
}
