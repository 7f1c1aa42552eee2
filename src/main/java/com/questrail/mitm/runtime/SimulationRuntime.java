package com.questrail.mitm.runtime;

import com.questrail.mitm.codec.MessageDecoder;
import com.questrail.mitm.codec.MessageEncoder;
import com.questrail.mitm.codec.impl.DefaultMessageDecoder;
import com.questrail.mitm.codec.impl.DefaultMessageEncoder;
import com.questrail.mitm.config.NetworkConfig;
import com.questrail.mitm.config.SimulationConfig;
import com.questrail.mitm.destination.DestinationServer;
import com.questrail.mitm.detection.AlertJournal;
import com.questrail.mitm.detection.DetectionEngine;
import com.questrail.mitm.internal.time.MonotonicClock;
import com.questrail.mitm.internal.time.MonotonicScheduler;
import com.questrail.mitm.internal.time.ScheduledExecutorScheduler;
import com.questrail.mitm.internal.time.SystemMonotonicClock;
import com.questrail.mitm.internal.time.SystemWallClock;
import com.questrail.mitm.internal.time.WallClock;
import com.questrail.mitm.model.Alert;
import com.questrail.mitm.observability.CompositeObservabilitySink;
import com.questrail.mitm.observability.NullObservabilitySink;
import com.questrail.mitm.observability.ObservabilitySink;
import com.questrail.mitm.observability.RoleReporter;
import com.questrail.mitm.observability.Slf4jObservabilitySink;
import com.questrail.mitm.relay.RelayServer;
import com.questrail.mitm.source.MessageSource;
import com.questrail.mitm.status.Role;
import com.questrail.mitm.status.RoleState;
import com.questrail.mitm.status.SimulationStatus;
import com.questrail.mitm.status.StatusBoard;
import com.questrail.mitm.transport.tcp.netty.NettyTcpConnector;
import com.questrail.mitm.transport.tcp.netty.NettyTcpServer;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * SimulationRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one simulation session.
 *
 * <h2>Start order</h2>
 * destination, then relay (unless bypassed), then source, so every role
 * finds its peer listening. {@link #stop()} runs in reverse order.
 *
 * <h2>Surfaces</h2>
 * Status, log tail and alert queries are read-only and may be polled from any
 * thread while the session runs.
 */
public final class SimulationRuntime
{
    private final SimulationConfig config;
    private final StatusBoard board;
    private final ObservabilitySink sink;
    private final AlertJournal journal = new AlertJournal();
    private final DetectionEngine detection;
    private final MessageEncoder encoder;
    private final Supplier<Random> randomSource;
    private final WallClock wallClock;
    private final MonotonicClock clock;

    private final Object lifecycle = new Object();

    private ScheduledExecutorService schedulerExecutor;
    private DestinationServer destination;
    private RelayServer relay;
    private MessageSource source;
    private InetSocketAddress destinationAddress;
    private InetSocketAddress relayAddress;
    private boolean started;
    private boolean stopped;

    private SimulationRuntime(SimulationConfig config,
                              ObservabilitySink extraSink,
                              Supplier<Random> randomSource,
                              WallClock wallClock)
    {
        this.config = config;
        this.board = new StatusBoard(config.logTailCapacity());
        this.sink = CompositeObservabilitySink.of(board, new Slf4jObservabilitySink(), extraSink);
        this.encoder = new DefaultMessageEncoder();
        MessageDecoder decoder = new DefaultMessageDecoder();
        this.detection = new DetectionEngine(config.detection(), decoder, encoder, wallClock);
        this.randomSource = randomSource;
        this.wallClock = wallClock;
        this.clock = SystemMonotonicClock.INSTANCE;
    }

    /**
     * Start every role. On failure the roles already started are stopped and
     * the failure is rethrown.
     */
    public void start()
    {
        synchronized (lifecycle) {
            if (started) {
                throw new IllegalStateException("simulation already started");
            }
            started = true;
        }

        NetworkConfig net = config.network();
        schedulerExecutor = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "mitm-scheduler");
            t.setDaemon(true);
            return t;
        });
        MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExecutor, clock);

        board.setRunning(true);
        try {
            destination = new DestinationServer(
                    detection,
                    journal,
                    acceptor -> new NettyTcpServer(net.destinationListen(), acceptor, net.maxFrameLength()),
                    reporter(Role.DESTINATION));
            destinationAddress = destination.start();

            InetSocketAddress sourceTarget = connectable(destinationAddress);
            if (config.useRelay()) {
                relay = new RelayServer(
                        connectable(destinationAddress),
                        config.attack(),
                        randomSource,
                        acceptor -> new NettyTcpServer(net.relayListen(), acceptor, net.maxFrameLength()),
                        new NettyTcpConnector(net.maxFrameLength(), net.connectTimeoutMillis()),
                        scheduler,
                        clock,
                        reporter(Role.RELAY));
                relayAddress = relay.start();
                sourceTarget = connectable(relayAddress);
            } else {
                reporter(Role.RELAY).state(RoleState.STOPPED, "bypassed; source connects to the destination directly");
            }

            source = new MessageSource(
                    sourceTarget,
                    config.source(),
                    encoder,
                    new NettyTcpConnector(net.maxFrameLength(), net.connectTimeoutMillis()),
                    scheduler,
                    clock,
                    wallClock,
                    reporter(Role.SOURCE));
            source.start().join();
        } catch (CompletionException e) {
            stop();
            throw new IllegalStateException("simulation failed to start", e.getCause());
        } catch (RuntimeException e) {
            stop();
            throw e;
        }
    }

    /**
     * Stop every role, source first. Idempotent.
     */
    public void stop()
    {
        synchronized (lifecycle) {
            if (!started || stopped) {
                return;
            }
            stopped = true;
        }

        if (source != null) {
            source.stop();
        }
        if (relay != null) {
            relay.stop();
        }
        if (destination != null) {
            destination.stop();
        }

        schedulerExecutor.shutdownNow();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                reporter(Role.RELAY).warn("scheduler did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        board.setRunning(false);
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public SimulationStatus status()
    {
        return board.status();
    }

    /**
     * The most recent {@code count} output lines of {@code role}, oldest first.
     */
    public List<String> logTail(Role role, int count)
    {
        return board.logTail(role, count);
    }

    /**
     * Every alert since the session started.
     */
    public List<Alert> alerts()
    {
        return journal.all();
    }

    /**
     * Alerts emitted since the previous call.
     */
    public List<Alert> pollAlerts()
    {
        return journal.pollNew();
    }

    public void setDetectionEnabled(boolean enabled)
    {
        detection.setEnabled(enabled);
        reporter(Role.DESTINATION).info("detection " + (enabled ? "enabled" : "disabled"));
    }

    public DetectionEngine detection()
    {
        return detection;
    }

    public SimulationConfig config()
    {
        return config;
    }

    public InetSocketAddress destinationAddress()
    {
        return destinationAddress;
    }

    /**
     * Bound relay address; {@code null} when the relay is bypassed.
     */
    public InetSocketAddress relayAddress()
    {
        return relayAddress;
    }

    public long messagesSent()
    {
        return source == null ? 0 : source.lastSequence();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private RoleReporter reporter(Role role)
    {
        return new RoleReporter(role, sink, wallClock);
    }

    /** A wildcard bind address is reached through loopback. */
    private static InetSocketAddress connectable(InetSocketAddress bound)
    {
        if (bound.getAddress() != null && bound.getAddress().isAnyLocalAddress()) {
            return new InetSocketAddress(InetAddress.getLoopbackAddress(), bound.getPort());
        }
        return bound;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private SimulationConfig config = SimulationConfig.defaults();
        private ObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Supplier<Random> randomSource = Random::new;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(SimulationConfig config)
        {
            this.config = config;
            return this;
        }

        /**
         * Additional sink; status and SLF4J sinks are always installed.
         */
        public Builder withObservabilitySink(ObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withRandomSource(Supplier<Random> randomSource)
        {
            this.randomSource = randomSource;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public SimulationRuntime build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(randomSource, "randomSource");
            Objects.requireNonNull(wallClock, "wallClock");
            return new SimulationRuntime(config, observabilitySink, randomSource, wallClock);
        }
    }
}
