package com.questrail.mitm.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Alert
 * -----------------------------------------------------------------------------
 * One classified anomaly observed at the destination.
 *
 * <p>Alerts are append-only observations. Once emitted an alert is never
 * retracted or amended.</p>
 *
 * @param kind          classification
 * @param sourceId      identity of the observed source (remote address)
 * @param sequence      sequence number of the offending message; {@code null}
 *                      for {@link AlertKind#MALFORMED}
 * @param observedDelay estimated transit delay in seconds; {@code null} unless
 *                      {@code kind} is {@link AlertKind#EXCESSIVE_DELAY}
 * @param rawMessage    the frame as received, for forensic display
 * @param detectedAt    wall-clock time of classification
 */
public record Alert(
        AlertKind kind,
        String sourceId,
        Long sequence,
        Double observedDelay,
        String rawMessage,
        Instant detectedAt
) {
    public Alert {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(rawMessage, "rawMessage");
        Objects.requireNonNull(detectedAt, "detectedAt");
    }

    public static Alert outOfOrder(String sourceId, long sequence, String raw, Instant at) {
        return new Alert(AlertKind.OUT_OF_ORDER, sourceId, sequence, null, raw, at);
    }

    public static Alert duplicate(String sourceId, long sequence, String raw, Instant at) {
        return new Alert(AlertKind.DUPLICATE, sourceId, sequence, null, raw, at);
    }

    public static Alert excessiveDelay(String sourceId, long sequence, double delaySeconds, String raw, Instant at) {
        return new Alert(AlertKind.EXCESSIVE_DELAY, sourceId, sequence, delaySeconds, raw, at);
    }

    public static Alert malformed(String sourceId, String raw, Instant at) {
        return new Alert(AlertKind.MALFORMED, sourceId, null, null, raw, at);
    }

    /**
     * One-line human-readable description, without the {@code [ALERT]} tag.
     */
    public String summary() {
        return switch (kind) {
            case OUT_OF_ORDER -> "out_of_order (SEQ=" + sequence + ") from " + sourceId;
            case DUPLICATE -> "duplicate/replay (SEQ=" + sequence + ") from " + sourceId;
            case EXCESSIVE_DELAY -> "excessive_delay (SEQ=" + sequence + ", "
                    + String.format(Locale.ROOT, "%.3f", observedDelay) + "s) from " + sourceId;
            case MALFORMED -> "malformed from " + sourceId + ": " + rawMessage;
        };
    }
}
