package com.questrail.mitm.relay;

import com.questrail.mitm.attack.AttackConfig;
import com.questrail.mitm.attack.AttackMode;
import com.questrail.mitm.internal.time.SystemWallClock;
import com.questrail.mitm.observability.RecordingObservabilitySink;
import com.questrail.mitm.observability.RoleReporter;
import com.questrail.mitm.status.Role;
import com.questrail.mitm.status.RoleState;
import com.questrail.mitm.time.DeterministicScheduler;
import com.questrail.mitm.time.ManualMonotonicClock;
import com.questrail.mitm.transport.FakeFrameChannel;
import com.questrail.mitm.transport.FakeStreamConnector;
import com.questrail.mitm.transport.FakeStreamServer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RelayServerTest {

    private static final InetSocketAddress LISTEN = new InetSocketAddress("127.0.0.1", 9000);
    private static final InetSocketAddress DOWNSTREAM = new InetSocketAddress("127.0.0.1", 9001);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakeStreamConnector connector = new FakeStreamConnector();

    private FakeStreamServer server;

    private RelayServer relay(AttackConfig config) {
        return new RelayServer(
            DOWNSTREAM,
            config,
            () -> new Random(11),
            acceptor -> server = new FakeStreamServer(acceptor, LISTEN),
            connector,
            scheduler,
            clock,
            new RoleReporter(Role.RELAY, sink, SystemWallClock.INSTANCE));
    }

    @Test
    void startReportsRunningWithMode() {
        RelayServer relay = relay(AttackConfig.defaults().withMode(AttackMode.REORDER));

        assertEquals(LISTEN, relay.start());

        assertTrue(server.isStarted());
        assertEquals(RoleState.RUNNING, sink.lastState(Role.RELAY));
        assertTrue(sink.lines(Role.RELAY).stream().anyMatch(l -> l.contains("MODE=reorder")));
    }

    @Test
    void upstreamIsPausedUntilDownstreamConnects() {
        RelayServer relay = relay(AttackConfig.transparent());
        relay.start();

        FakeFrameChannel upstream = server.accept(new FakeFrameChannel("10.0.0.1", 40000));

        assertFalse(upstream.isReadable());
        assertEquals(DOWNSTREAM, connector.lastAttempt().remote());
        assertEquals(1, relay.activeSessions());

        FakeFrameChannel downstream = connector.lastAttempt().succeed(new FakeFrameChannel("127.0.0.1", 9001));

        assertTrue(upstream.isReadable());
        upstream.inject("SEQ=1|TS=1.0|DATA=x");
        assertEquals(List.of("SEQ=1|TS=1.0|DATA=x\n"), downstream.sentLines());
    }

    @Test
    void everyConnectionIsItsOwnSession() {
        RelayServer relay = relay(AttackConfig.transparent());
        relay.start();

        server.accept(new FakeFrameChannel("10.0.0.1", 40000));
        server.accept(new FakeFrameChannel("10.0.0.1", 40001));

        assertEquals(2, connector.attempts().size());
        assertEquals(2, relay.activeSessions());
    }

    @Test
    void orderlySessionEndKeepsRoleRunning() {
        RelayServer relay = relay(AttackConfig.transparent());
        relay.start();
        FakeFrameChannel upstream = server.accept(new FakeFrameChannel("10.0.0.1", 40000));
        connector.lastAttempt().succeed(new FakeFrameChannel("127.0.0.1", 9001));

        upstream.closeWith(null);

        assertEquals(0, relay.activeSessions());
        assertEquals(RoleState.RUNNING, sink.lastState(Role.RELAY));
    }

    @Test
    void failedDownstreamConnectPutsRoleInError() {
        RelayServer relay = relay(AttackConfig.transparent());
        relay.start();
        FakeFrameChannel upstream = server.accept(new FakeFrameChannel("10.0.0.1", 40000));

        connector.lastAttempt().fail(new IOException("Connection refused"));

        assertFalse(upstream.isOpen());
        assertEquals(RoleState.ERROR, sink.lastState(Role.RELAY));
        assertEquals(0, relay.activeSessions());
    }

    @Test
    void stopClosesSessionsListenerAndConnector() {
        RelayServer relay = relay(AttackConfig.transparent());
        relay.start();
        FakeFrameChannel upstream = server.accept(new FakeFrameChannel("10.0.0.1", 40000));
        FakeFrameChannel downstream = connector.lastAttempt().succeed(new FakeFrameChannel("127.0.0.1", 9001));

        relay.stop();

        assertFalse(upstream.isOpen());
        assertFalse(downstream.isOpen());
        assertTrue(server.isStopped());
        assertTrue(connector.isShutdown());
        assertEquals(RoleState.STOPPED, sink.lastState(Role.RELAY));
    }

    @Test
    void startTwiceIsRejected() {
        RelayServer relay = relay(AttackConfig.transparent());
        relay.start();
        assertThrows(IllegalStateException.class, relay::start);
    }
}
