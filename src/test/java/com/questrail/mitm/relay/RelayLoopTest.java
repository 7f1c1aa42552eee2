package com.questrail.mitm.relay;

import com.questrail.mitm.attack.AttackConfig;
import com.questrail.mitm.attack.AttackMode;
import com.questrail.mitm.attack.AttackPolicy;
import com.questrail.mitm.internal.time.SystemWallClock;
import com.questrail.mitm.observability.RecordingObservabilitySink;
import com.questrail.mitm.observability.RoleReporter;
import com.questrail.mitm.status.Role;
import com.questrail.mitm.time.DeterministicScheduler;
import com.questrail.mitm.time.ManualMonotonicClock;
import com.questrail.mitm.transport.FakeFrameChannel;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RelayLoopTest
 * -----------------------------------------------------------------------------
 * One relay session between two fake channels. Closing a fake channel
 * notifies its listener synchronously, so every termination path runs to
 * completion inside the test thread.
 */
class RelayLoopTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<SessionOutcome> outcomes = new ArrayList<>();

    private final FakeFrameChannel upstream = new FakeFrameChannel("10.0.0.1", 40000);
    private final FakeFrameChannel downstream = new FakeFrameChannel("10.0.0.2", 9001);

    private RelayLoop loop(AttackConfig config) {
        RelayLoop loop = new RelayLoop(
            "session 1",
            upstream,
            config,
            new AttackPolicy(config, new Random(5)),
            scheduler,
            clock,
            new RoleReporter(Role.RELAY, sink, SystemWallClock.INSTANCE),
            outcomes::add);
        upstream.setListener(loop.upstreamListener());
        downstream.setListener(loop.downstreamListener());
        return loop;
    }

    private static AttackConfig fixedDelay(long seconds) {
        return AttackConfig.builder()
            .withMode(AttackMode.RANDOM_DELAY)
            .withDelayBounds(Duration.ofSeconds(seconds), Duration.ofSeconds(seconds))
            .build();
    }

    @Test
    void attachingDownstreamResumesUpstreamReads() {
        upstream.setReadable(false);
        RelayLoop loop = loop(AttackConfig.transparent());

        loop.attachDownstream(downstream);

        assertTrue(upstream.isReadable());
    }

    @Test
    void transparentFramesReachDownstreamWithTerminatorRestored() {
        RelayLoop loop = loop(AttackConfig.transparent());
        loop.attachDownstream(downstream);

        upstream.inject("SEQ=1|TS=1.0|DATA=a");
        upstream.inject("SEQ=2|TS=2.0|DATA=b");

        assertEquals(List.of("SEQ=1|TS=1.0|DATA=a\n", "SEQ=2|TS=2.0|DATA=b\n"), downstream.sentLines());
    }

    @Test
    void malformedFramesAreForwardedUnchanged() {
        RelayLoop loop = loop(AttackConfig.transparent());
        loop.attachDownstream(downstream);

        upstream.inject("this is not a message");

        assertEquals(List.of("this is not a message\n"), downstream.sentLines());
    }

    @Test
    void reverseDirectionIsRelayedUnmodified() {
        RelayLoop loop = loop(AttackConfig.builder().withMode(AttackMode.DROP).withDropRate(1.0).build());
        loop.attachDownstream(downstream);

        downstream.inject("ACK 1");

        assertEquals(List.of("ACK 1\n"), upstream.sentLines());
    }

    @Test
    void upstreamEofDrainsDelayedFramesThenClosesDownstream() {
        RelayLoop loop = loop(fixedDelay(3));
        loop.attachDownstream(downstream);

        upstream.inject("SEQ=1|TS=1.0|DATA=a");
        upstream.closeWith(null);

        assertTrue(downstream.isOpen(), "Held frame still on its way");
        assertTrue(outcomes.isEmpty());

        clock.advance(Duration.ofSeconds(3));
        scheduler.runDueTasks();

        assertEquals(List.of("SEQ=1|TS=1.0|DATA=a\n"), downstream.sentLines());
        assertFalse(downstream.isOpen());
        assertEquals(1, outcomes.size());
        assertEquals(SessionOutcome.Kind.COMPLETED, outcomes.get(0).kind());
        assertEquals(0, outcomes.get(0).stats().discardedAtShutdown());
    }

    @Test
    void downstreamClosingWhileDrainingDiscardsHeldFrames() {
        RelayLoop loop = loop(fixedDelay(3));
        loop.attachDownstream(downstream);

        upstream.inject("SEQ=1|TS=1.0|DATA=a");
        upstream.inject("SEQ=2|TS=2.0|DATA=b");
        upstream.closeWith(null);
        downstream.closeWith(null);

        assertEquals(1, outcomes.size());
        SessionOutcome outcome = outcomes.get(0);
        assertEquals(SessionOutcome.Kind.FAILED, outcome.kind());
        assertEquals(2, outcome.stats().discardedAtShutdown());

        clock.advance(Duration.ofSeconds(5));
        scheduler.runDueTasks();

        assertTrue(downstream.sentLines().isEmpty());
        assertEquals(0, loop.stats().forwarded());
        assertEquals(2, loop.stats().discardedAtShutdown());
        assertEquals(1, outcomes.size());
    }

    @Test
    void upstreamEofFlushesReorderBuffer() {
        RelayLoop loop = loop(AttackConfig.builder().withMode(AttackMode.REORDER).withReorderWindow(5).build());
        loop.attachDownstream(downstream);

        upstream.inject("1");
        upstream.inject("2");
        upstream.closeWith(null);

        assertEquals(List.of("1\n", "2\n"), downstream.sentLines());
        assertEquals(SessionOutcome.Kind.COMPLETED, outcomes.get(0).kind());
    }

    @Test
    void downstreamLossDiscardsHeldFrames() {
        RelayLoop loop = loop(fixedDelay(3));
        loop.attachDownstream(downstream);

        upstream.inject("SEQ=1|TS=1.0|DATA=a");
        upstream.inject("SEQ=2|TS=2.0|DATA=b");
        downstream.closeWith(null);

        clock.advance(Duration.ofSeconds(5));
        scheduler.runDueTasks();

        assertTrue(downstream.sentLines().isEmpty());
        assertFalse(upstream.isOpen());
        assertEquals(1, outcomes.size());
        SessionOutcome outcome = outcomes.get(0);
        assertEquals(SessionOutcome.Kind.FAILED, outcome.kind());
        assertNotNull(outcome.cause());
        assertEquals(2, outcome.stats().discardedAtShutdown());
        assertEquals(0, outcome.stats().dropped());
    }

    @Test
    void upstreamFailureCancelsSession() {
        RelayLoop loop = loop(fixedDelay(3));
        loop.attachDownstream(downstream);

        upstream.inject("SEQ=1|TS=1.0|DATA=a");
        IOException reset = new IOException("Connection reset by peer");
        upstream.closeWith(reset);

        assertFalse(downstream.isOpen());
        assertEquals(SessionOutcome.Kind.FAILED, outcomes.get(0).kind());
        assertSame(reset, outcomes.get(0).cause());
        assertEquals(1, outcomes.get(0).stats().discardedAtShutdown());
    }

    @Test
    void stopCancelsPendingWorkAndClosesBothSides() {
        RelayLoop loop = loop(fixedDelay(3));
        loop.attachDownstream(downstream);
        upstream.inject("SEQ=1|TS=1.0|DATA=a");

        loop.stop();
        loop.stop();

        assertFalse(upstream.isOpen());
        assertFalse(downstream.isOpen());
        assertEquals(1, outcomes.size());
        assertEquals(SessionOutcome.Kind.STOPPED, outcomes.get(0).kind());
        assertTrue(sink.lines(Role.RELAY).stream().anyMatch(l -> l.contains("discardedAtShutdown=1")));
    }

    @Test
    void downstreamConnectFailureEndsSession() {
        RelayLoop loop = loop(AttackConfig.transparent());

        loop.downstreamConnectFailed(new IOException("Connection refused"));

        assertFalse(upstream.isOpen());
        assertEquals(SessionOutcome.Kind.FAILED, outcomes.get(0).kind());
    }

    @Test
    void downstreamArrivingAfterStopIsClosed() {
        RelayLoop loop = loop(AttackConfig.transparent());
        loop.stop();

        loop.attachDownstream(downstream);

        assertFalse(downstream.isOpen());
        assertEquals(1, outcomes.size());
    }

    @Test
    void upstreamClosingBeforeDownstreamConnectsCompletesEmpty() {
        RelayLoop loop = loop(AttackConfig.transparent());

        upstream.closeWith(null);

        assertEquals(SessionOutcome.Kind.COMPLETED, outcomes.get(0).kind());
        assertEquals(0, outcomes.get(0).stats().received());
        assertNotNull(loop.stats());
    }
}
