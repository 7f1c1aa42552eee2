package com.questrail.mitm.detection;

import com.questrail.mitm.model.Alert;
import com.questrail.mitm.model.Message;

import java.util.List;

/**
 * Result of classifying one received frame.
 *
 * @param sourceId       source identity the frame arrived from
 * @param rawFrame       the frame as text, terminator removed
 * @param message        decoded message; {@code null} when the frame is malformed
 * @param delaySeconds   receive time minus message timestamp; {@code NaN} when malformed
 * @param decodeError    reason the frame could not be decoded; {@code null} otherwise
 * @param alerts         alerts emitted for this frame; empty while detection is disabled
 */
public record Observation(
        String sourceId,
        String rawFrame,
        Message message,
        double delaySeconds,
        String decodeError,
        List<Alert> alerts
) {
    public Observation {
        alerts = List.copyOf(alerts);
    }

    public boolean isMalformed() {
        return message == null;
    }
}
