package com.questrail.mitm.model;

import java.util.Objects;

/**
 * Message
 * -----------------------------------------------------------------------------
 * The unit exchanged between source and destination.
 *
 * <ul>
 *   <li>{@code sequence} is assigned by the source at send time. A healthy
 *       source increments it by exactly one per message.</li>
 *   <li>{@code timestamp} is the source's wall clock at send time, in
 *       floating-point seconds since the epoch. It never decreases at the
 *       source. Negative zero is normalized to zero.</li>
 *   <li>{@code payload} is opaque text.</li>
 * </ul>
 *
 * <p>A {@code Message} only exists for well-formed input. Bytes that cannot be
 * decoded never become a {@code Message}; they stay raw frames and surface as
 * {@link AlertKind#MALFORMED} at the destination.</p>
 */
public record Message(long sequence, double timestamp, String payload)
{
    public Message {
        Objects.requireNonNull(payload, "payload");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative: " + sequence);
        }
        if (!Double.isFinite(timestamp)) {
            throw new IllegalArgumentException("timestamp must be finite: " + timestamp);
        }
        // -0.0 has no distinct text form on the wire; store it as 0.0.
        if (timestamp == 0.0) {
            timestamp = 0.0;
        }
    }
}
