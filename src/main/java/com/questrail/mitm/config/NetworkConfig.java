package com.questrail.mitm.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Listen addresses and transport limits.
 *
 * @param relayListen          where the relay accepts upstream connections
 * @param destinationListen    where the destination accepts connections
 * @param maxFrameLength       longest accepted frame in bytes, terminator excluded
 * @param connectTimeoutMillis TCP connect timeout for outbound connections
 */
public record NetworkConfig(
        InetSocketAddress relayListen,
        InetSocketAddress destinationListen,
        int maxFrameLength,
        int connectTimeoutMillis
) {
    public static final int DEFAULT_RELAY_PORT = 9000;
    public static final int DEFAULT_DESTINATION_PORT = 9001;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 4096;
    public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 5000;

    public NetworkConfig {
        Objects.requireNonNull(relayListen, "relayListen");
        Objects.requireNonNull(destinationListen, "destinationListen");
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("max frame length must be > 0: " + maxFrameLength);
        }
        if (connectTimeoutMillis <= 0) {
            throw new IllegalArgumentException("connect timeout must be > 0: " + connectTimeoutMillis);
        }
    }

    public static NetworkConfig defaults() {
        return new NetworkConfig(
                new InetSocketAddress("0.0.0.0", DEFAULT_RELAY_PORT),
                new InetSocketAddress("0.0.0.0", DEFAULT_DESTINATION_PORT),
                DEFAULT_MAX_FRAME_LENGTH,
                DEFAULT_CONNECT_TIMEOUT_MILLIS);
    }

    /**
     * Both roles on the loopback interface with ephemeral ports.
     */
    public static NetworkConfig loopbackEphemeral() {
        return new NetworkConfig(
                new InetSocketAddress("127.0.0.1", 0),
                new InetSocketAddress("127.0.0.1", 0),
                DEFAULT_MAX_FRAME_LENGTH,
                DEFAULT_CONNECT_TIMEOUT_MILLIS);
    }
}
