package com.questrail.mitm.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Source role settings.
 *
 * @param messageInterval pause between two messages; positive
 * @param payload         payload carried by every message
 * @param messageLimit    number of messages to send before closing; {@code 0} means unlimited
 */
public record SourceConfig(Duration messageInterval, String payload, long messageLimit) {

    public static final String DEFAULT_PAYLOAD = "Username=ROOT=, Password=SSHTERMINAL";

    public SourceConfig {
        Objects.requireNonNull(messageInterval, "messageInterval");
        Objects.requireNonNull(payload, "payload");
        if (messageInterval.isZero() || messageInterval.isNegative()) {
            throw new IllegalArgumentException("message_interval must be > 0: " + messageInterval);
        }
        if (messageLimit < 0) {
            throw new IllegalArgumentException("message limit must be >= 0: " + messageLimit);
        }
    }

    public static SourceConfig defaults() {
        return new SourceConfig(Duration.ofSeconds(10), DEFAULT_PAYLOAD, 0);
    }

    public boolean unlimited() {
        return messageLimit == 0;
    }
}
