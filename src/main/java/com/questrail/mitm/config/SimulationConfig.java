package com.questrail.mitm.config;

import com.questrail.mitm.attack.AttackConfig;
import com.questrail.mitm.detection.DetectionConfig;

import java.util.Objects;

/**
 * Aggregated configuration for one simulation session.
 */
public record SimulationConfig(
    AttackConfig attack,
    DetectionConfig detection,
    SourceConfig source,
    NetworkConfig network,
    boolean useRelay,
    int logTailCapacity
) {
    public static final int DEFAULT_LOG_TAIL_CAPACITY = 1000;

    public SimulationConfig {
        Objects.requireNonNull(attack, "attack");
        Objects.requireNonNull(detection, "detection");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(network, "network");
        if (logTailCapacity <= 0) {
            throw new IllegalArgumentException("log tail capacity must be > 0: " + logTailCapacity);
        }
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AttackConfig attack = AttackConfig.defaults();
        private DetectionConfig detection = DetectionConfig.defaults();
        private SourceConfig source = SourceConfig.defaults();
        private NetworkConfig network = NetworkConfig.defaults();
        private boolean useRelay = true;
        private int logTailCapacity = DEFAULT_LOG_TAIL_CAPACITY;

        public Builder withAttack(AttackConfig attack) {
            this.attack = attack;
            return this;
        }

        public Builder withDetection(DetectionConfig detection) {
            this.detection = detection;
            return this;
        }

        public Builder withSource(SourceConfig source) {
            this.source = source;
            return this;
        }

        public Builder withNetwork(NetworkConfig network) {
            this.network = network;
            return this;
        }

        public Builder withUseRelay(boolean useRelay) {
            this.useRelay = useRelay;
            return this;
        }

        public Builder withLogTailCapacity(int capacity) {
            this.logTailCapacity = capacity;
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(attack, detection, source, network, useRelay, logTailCapacity);
        }
    }
}
