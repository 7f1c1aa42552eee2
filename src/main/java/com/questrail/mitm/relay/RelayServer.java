package com.questrail.mitm.relay;

import com.questrail.mitm.attack.AttackConfig;
import com.questrail.mitm.attack.AttackPolicy;
import com.questrail.mitm.internal.time.MonotonicClock;
import com.questrail.mitm.internal.time.MonotonicScheduler;
import com.questrail.mitm.observability.RoleReporter;
import com.questrail.mitm.status.RoleState;
import com.questrail.mitm.transport.ConnectionAcceptor;
import com.questrail.mitm.transport.FrameChannel;
import com.questrail.mitm.transport.FrameListener;
import com.questrail.mitm.transport.StreamConnector;
import com.questrail.mitm.transport.StreamServer;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * RelayServer
 * =============================================================================
 * The relay role. Listens for upstream connections and turns each one into a
 * {@link RelayLoop} wired to the fixed downstream address.
 *
 * <h2>Per-session state</h2>
 * Every accepted connection gets its own {@link AttackPolicy} (with its own
 * random source) and its own engine, built from the same immutable
 * {@link AttackConfig}. Nothing attack-related is shared between sessions.
 *
 * <h2>Role state</h2>
 * <ul>
 *   <li>{@code running}: listening (also after a session ends normally)</li>
 *   <li>{@code error}: the most recent session ended on a socket failure</li>
 *   <li>{@code stopped}: {@link #stop()} was called</li>
 * </ul>
 */
public final class RelayServer
{
    private final InetSocketAddress downstreamAddress;
    private final AttackConfig config;
    private final Supplier<Random> randomSource;
    private final Function<ConnectionAcceptor, StreamServer> serverFactory;
    private final StreamConnector connector;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final RoleReporter reporter;

    private final Set<RelayLoop> sessions = ConcurrentHashMap.newKeySet();
    private final AtomicLong sessionCounter = new AtomicLong();

    private volatile StreamServer server;
    private volatile boolean stopping;
    private volatile boolean bindFailed;

    /**
     * @param downstreamAddress where every session connects to
     * @param config            attack snapshot applied to every session
     * @param randomSource      supplies one random source per session
     * @param serverFactory     builds the listening server around an acceptor
     * @param connector         opens downstream connections; owned by this role
     * @param scheduler         scheduler for delayed releases
     * @param clock             clock matching {@code scheduler}
     * @param reporter          relay role reporter
     */
    public RelayServer(InetSocketAddress downstreamAddress,
                       AttackConfig config,
                       Supplier<Random> randomSource,
                       Function<ConnectionAcceptor, StreamServer> serverFactory,
                       StreamConnector connector,
                       MonotonicScheduler scheduler,
                       MonotonicClock clock,
                       RoleReporter reporter)
    {
        this.downstreamAddress = Objects.requireNonNull(downstreamAddress, "downstreamAddress");
        this.config = Objects.requireNonNull(config, "config");
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
        this.serverFactory = Objects.requireNonNull(serverFactory, "serverFactory");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    /**
     * Bind and start accepting.
     *
     * @return the bound listen address
     */
    public InetSocketAddress start()
    {
        if (server != null) {
            throw new IllegalStateException("relay already started");
        }
        StreamServer s = serverFactory.apply(this::accept);
        InetSocketAddress bound;
        try {
            bound = s.start();
        } catch (RuntimeException e) {
            reporter.error("relay failed to bind", e);
            reporter.state(RoleState.ERROR, "bind failed: " + e.getMessage());
            bindFailed = true;
            connector.shutdown();
            throw e;
        }
        server = s;

        reporter.info("listening on " + bound + ", forwarding to " + downstreamAddress
                + " (MODE=" + config.mode().wireName() + ")");
        reporter.state(RoleState.RUNNING, "listening on " + bound + ", MODE=" + config.mode().wireName());
        return bound;
    }

    /**
     * Stop every session (pending work is discarded), close the listener and
     * release the connector. Idempotent.
     */
    public void stop()
    {
        if (stopping) {
            return;
        }
        stopping = true;

        List<RelayLoop> active = new ArrayList<>(sessions);
        for (RelayLoop loop : active) {
            loop.stop();
        }

        StreamServer s = server;
        if (s != null) {
            s.stop();
        }
        connector.shutdown();
        if (!bindFailed) {
            // A role that never bound keeps its error state.
            reporter.state(RoleState.STOPPED, "stopped");
        }
    }

    /**
     * Sessions currently open. Intended for tests and status displays.
     */
    public int activeSessions()
    {
        return sessions.size();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private FrameListener accept(FrameChannel upstream)
    {
        // Hold upstream input until there is somewhere to send it.
        upstream.setReadable(false);

        String label = "session " + sessionCounter.incrementAndGet();
        reporter.info("[" + label + "] accepted upstream " + upstream.remoteAddress());

        RelayLoop loop = new RelayLoop(
                label,
                upstream,
                config,
                new AttackPolicy(config, randomSource.get()),
                scheduler,
                clock,
                reporter,
                outcome -> onSessionEnded(label, outcome));
        sessions.add(loop);

        if (stopping) {
            loop.stop();
            return loop.upstreamListener();
        }

        connector.connect(downstreamAddress, loop.downstreamListener())
                .whenComplete((channel, failure) -> {
                    if (failure != null) {
                        reporter.error("[" + label + "] cannot connect downstream " + downstreamAddress, failure);
                        loop.downstreamConnectFailed(failure);
                    } else {
                        loop.attachDownstream(channel);
                    }
                });

        return loop.upstreamListener();
    }

    private void onSessionEnded(String label, SessionOutcome outcome)
    {
        sessions.removeIf(l -> l.label().equals(label));
        if (stopping) {
            return;
        }

        if (outcome.kind() == SessionOutcome.Kind.FAILED) {
            String why = outcome.cause() == null ? "unknown" : String.valueOf(outcome.cause().getMessage());
            reporter.state(RoleState.ERROR, label + " failed: " + why);
        } else {
            reporter.state(RoleState.RUNNING, "idle; " + label + " ended normally");
        }
    }
}
