package com.questrail.mitm.runtime;

import com.questrail.mitm.attack.AttackConfig;
import com.questrail.mitm.attack.AttackMode;
import com.questrail.mitm.config.NetworkConfig;
import com.questrail.mitm.config.SimulationConfig;
import com.questrail.mitm.config.SourceConfig;
import com.questrail.mitm.detection.DetectionConfig;
import com.questrail.mitm.model.Alert;
import com.questrail.mitm.model.AlertKind;
import com.questrail.mitm.status.Role;
import com.questrail.mitm.status.RoleState;
import com.questrail.mitm.status.SimulationStatus;
import com.questrail.mitm.transport.TransportBindException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end sessions over real loopback sockets.
 *
 * <p>The source sends a bounded number of messages at a short interval; each
 * test waits on a deadline loop rather than fixed sleeps.</p>
 */
class SimulationRuntimeIntegrationTest {

    private static final int MESSAGES = 6;
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private SimulationRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    @Test
    void transparentRelayDeliversEverythingInOrder() throws InterruptedException {
        runtime = start(config(AttackConfig.transparent(), DetectionConfig.defaults(), true));

        awaitTrue(() -> received().size() == MESSAGES, "all messages received");

        List<String> lines = received();
        for (int i = 0; i < MESSAGES; i++) {
            assertTrue(lines.get(i).startsWith("SEQ=" + (i + 1) + " | "), lines.get(i));
            assertTrue(lines.get(i).endsWith("DATA=hello"), lines.get(i));
        }
        assertTrue(runtime.alerts().isEmpty(), runtime.alerts().toString());
        assertEquals(MESSAGES, runtime.messagesSent());
        assertNotNull(runtime.relayAddress());
    }

    @Test
    void dropEverythingDeliversNothing() throws InterruptedException {
        AttackConfig drop = AttackConfig.builder().withMode(AttackMode.DROP).withDropRate(1.0).build();
        runtime = start(config(drop, DetectionConfig.defaults(), true));

        awaitTrue(() -> runtime.status().role(Role.SOURCE).state() == RoleState.STOPPED, "source finished");
        awaitTrue(() -> runtime.status().role(Role.RELAY).status().contains("ended normally"), "relay session ended");

        assertTrue(received().isEmpty(), received().toString());
        assertTrue(runtime.alerts().isEmpty());
        assertEquals(0, runtime.detection().trackedSources());
        assertTrue(runtime.logTail(Role.RELAY, 100).stream().anyMatch(l -> l.contains("dropped=" + MESSAGES)),
                runtime.logTail(Role.RELAY, 100).toString());
    }

    @Test
    void reorderWindowIsDetectedAsOutOfOrder() throws InterruptedException {
        AttackConfig reorder = AttackConfig.builder().withMode(AttackMode.REORDER).withReorderWindow(3).build();
        runtime = start(config(reorder, DetectionConfig.defaults(), true));

        awaitTrue(() -> received().size() == MESSAGES, "all messages received");

        List<Long> order = received().stream()
                .map(l -> Long.parseLong(l.substring("SEQ=".length(), l.indexOf(' '))))
                .collect(Collectors.toList());
        assertEquals(List.of(3L, 2L, 1L, 6L, 5L, 4L), order);

        // Every arrival differs from the expected sequence at that point.
        awaitTrue(() -> runtime.status().alertCount() == MESSAGES, "one alert per message");
        List<Alert> alerts = runtime.alerts();
        assertEquals(MESSAGES, alerts.size());
        assertTrue(alerts.stream().allMatch(a -> a.kind() == AlertKind.OUT_OF_ORDER), alerts.toString());
        assertEquals(3L, alerts.get(0).sequence());
        assertTrue(runtime.logTail(Role.DESTINATION, 100).stream().anyMatch(l -> l.startsWith("[ALERT] out_of_order")));
    }

    @Test
    void heldFramesBeyondThresholdRaiseExcessiveDelay() throws InterruptedException {
        AttackConfig delay = AttackConfig.builder()
                .withMode(AttackMode.RANDOM_DELAY)
                .withDelayBounds(Duration.ofMillis(300), Duration.ofMillis(300))
                .build();
        runtime = start(config(delay, new DetectionConfig(true, 0.1), true));

        awaitTrue(() -> runtime.alerts().stream().filter(a -> a.kind() == AlertKind.EXCESSIVE_DELAY).count() == MESSAGES,
                "one excessive_delay alert per message");

        List<Alert> alerts = runtime.alerts();
        assertTrue(alerts.stream().allMatch(a -> a.kind() != AlertKind.EXCESSIVE_DELAY || a.observedDelay() > 0.1));
    }

    @Test
    void pollReturnsEachAlertOnce() throws InterruptedException {
        AttackConfig reorder = AttackConfig.builder().withMode(AttackMode.REORDER).withReorderWindow(2).build();
        runtime = start(config(reorder, DetectionConfig.defaults(), true));

        // Pairs arrive swapped: 2,1,4,3,6,5, each one out of order.
        awaitTrue(() -> runtime.alerts().size() == MESSAGES, "alerts emitted");

        List<Alert> first = runtime.pollAlerts();
        assertEquals(runtime.alerts(), first);
        assertTrue(runtime.pollAlerts().isEmpty());
    }

    @Test
    void disabledDetectionStaysQuiet() throws InterruptedException {
        AttackConfig reorder = AttackConfig.builder().withMode(AttackMode.REORDER).withReorderWindow(3).build();
        runtime = start(config(reorder, DetectionConfig.defaults().withEnabled(false), true));

        awaitTrue(() -> received().size() == MESSAGES, "all messages received");

        assertTrue(runtime.alerts().isEmpty());
        assertEquals(0, runtime.status().alertCount());
    }

    @Test
    void bypassConnectsSourceStraightToDestination() throws InterruptedException {
        runtime = start(config(AttackConfig.defaults(), DetectionConfig.defaults(), false));

        awaitTrue(() -> received().size() == MESSAGES, "all messages received");

        assertNull(runtime.relayAddress());
        SimulationStatus status = runtime.status();
        assertTrue(status.running());
        assertEquals(RoleState.STOPPED, status.role(Role.RELAY).state());
        assertTrue(status.role(Role.RELAY).status().startsWith("bypassed"));
        assertEquals(RoleState.RUNNING, status.role(Role.DESTINATION).state());
        assertTrue(runtime.alerts().isEmpty());
    }

    @Test
    void stopMarksEveryRoleStopped() throws InterruptedException {
        runtime = start(config(AttackConfig.transparent(), DetectionConfig.defaults(), true));
        awaitTrue(() -> !received().isEmpty(), "first message received");

        runtime.stop();

        SimulationStatus status = runtime.status();
        assertFalse(status.running());
        for (Role role : Role.values()) {
            assertEquals(RoleState.STOPPED, status.role(role).state(), role.toString());
        }
        runtime.stop();
    }

    @Test
    void secondStartIsRejected() {
        runtime = start(config(AttackConfig.transparent(), DetectionConfig.defaults(), true));

        assertThrows(IllegalStateException.class, runtime::start);
    }

    @Test
    void occupiedDestinationPortFailsStartAndReportsError() throws IOException {
        try (ServerSocket occupied = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            NetworkConfig network = new NetworkConfig(
                    new InetSocketAddress("127.0.0.1", 0),
                    new InetSocketAddress("127.0.0.1", occupied.getLocalPort()),
                    NetworkConfig.DEFAULT_MAX_FRAME_LENGTH,
                    NetworkConfig.DEFAULT_CONNECT_TIMEOUT_MILLIS);
            SimulationConfig config = SimulationConfig.builder()
                    .withAttack(AttackConfig.transparent())
                    .withSource(new SourceConfig(Duration.ofMillis(50), "hello", MESSAGES))
                    .withNetwork(network)
                    .build();
            runtime = SimulationRuntime.builder().withConfig(config).build();

            assertThrows(TransportBindException.class, runtime::start);

            SimulationStatus status = runtime.status();
            assertFalse(status.running());
            assertEquals(RoleState.ERROR, status.role(Role.DESTINATION).state());
            assertNull(runtime.relayAddress());
        }
    }

    // -------------------------------------------------------------------------

    private static SimulationConfig config(AttackConfig attack, DetectionConfig detection, boolean useRelay) {
        return SimulationConfig.builder()
                .withAttack(attack)
                .withDetection(detection)
                .withSource(new SourceConfig(Duration.ofMillis(50), "hello", MESSAGES))
                .withNetwork(NetworkConfig.loopbackEphemeral())
                .withUseRelay(useRelay)
                .build();
    }

    private static SimulationRuntime start(SimulationConfig config) {
        SimulationRuntime r = SimulationRuntime.builder()
                .withConfig(config)
                .withRandomSource(() -> new Random(7))
                .build();
        r.start();
        return r;
    }

    private List<String> received() {
        return runtime.logTail(Role.DESTINATION, 1000).stream()
                .filter(l -> l.startsWith("SEQ="))
                .collect(Collectors.toList());
    }

    private static void awaitTrue(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("timed out waiting for: " + what);
            }
            Thread.sleep(20);
        }
    }
}
