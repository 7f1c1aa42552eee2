package com.questrail.mitm.runtime;

import com.questrail.mitm.config.ConfigurationException;
import com.questrail.mitm.config.SimulationConfig;
import com.questrail.mitm.config.SimulationConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Runs one simulation from environment configuration until the process is
 * interrupted.
 */
public final class SimulationMain
{
    private static final Logger log = LoggerFactory.getLogger(SimulationMain.class);

    private SimulationMain() {}

    public static void main(String[] args) throws InterruptedException
    {
        final SimulationConfig config;
        try {
            config = SimulationConfigLoader.fromEnvironment();
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        log.info("Starting simulation: mode={}, relay={}, max_delay={}s, detection={}",
                config.attack().mode().wireName(),
                config.useRelay() ? "on" : "bypassed",
                config.detection().maxDelaySeconds(),
                config.detection().enabled() ? "enabled" : "disabled");

        SimulationRuntime runtime = SimulationRuntime.builder()
                .withConfig(config)
                .build();

        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            runtime.stop();
            done.countDown();
        }, "mitm-shutdown"));

        try {
            runtime.start();
        } catch (RuntimeException e) {
            log.error("Simulation failed to start", e);
            System.exit(1);
            return;
        }

        done.await();
    }
}
