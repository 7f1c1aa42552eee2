package com.questrail.mitm.destination;

import com.questrail.mitm.detection.AlertJournal;
import com.questrail.mitm.detection.DetectionEngine;
import com.questrail.mitm.detection.Observation;
import com.questrail.mitm.model.Alert;
import com.questrail.mitm.model.Message;
import com.questrail.mitm.observability.RoleReporter;
import com.questrail.mitm.status.RoleState;
import com.questrail.mitm.transport.ConnectionAcceptor;
import com.questrail.mitm.transport.FrameChannel;
import com.questrail.mitm.transport.FrameListener;
import com.questrail.mitm.transport.StreamServer;

import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * DestinationServer
 * =============================================================================
 * The destination role. Accepts connections and runs every received frame
 * through the {@link DetectionEngine}.
 *
 * <h2>Source identity</h2>
 * One accepted connection is one source identity, named by its remote
 * address. Its detection state lives as long as the connection.
 *
 * <h2>Output</h2>
 * <ul>
 *   <li>each decoded message: {@code SEQ=… | TS=… | Delay=…s | DATA=…}</li>
 *   <li>each malformed frame: a warning, whether or not detection is enabled</li>
 *   <li>each alert: the {@link AlertJournal} and
 *       {@link com.questrail.mitm.observability.ObservabilitySink#onAlert},
 *       which renders the {@code [ALERT]} line</li>
 * </ul>
 */
public final class DestinationServer
{
    private final DetectionEngine detection;
    private final AlertJournal journal;
    private final Function<ConnectionAcceptor, StreamServer> serverFactory;
    private final RoleReporter reporter;

    private final AtomicInteger openConnections = new AtomicInteger();

    private volatile StreamServer server;
    private volatile boolean stopping;
    private volatile boolean bindFailed;

    public DestinationServer(DetectionEngine detection,
                             AlertJournal journal,
                             Function<ConnectionAcceptor, StreamServer> serverFactory,
                             RoleReporter reporter)
    {
        this.detection = Objects.requireNonNull(detection, "detection");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.serverFactory = Objects.requireNonNull(serverFactory, "serverFactory");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public InetSocketAddress start()
    {
        if (server != null) {
            throw new IllegalStateException("destination already started");
        }
        StreamServer s = serverFactory.apply(this::accept);
        InetSocketAddress bound;
        try {
            bound = s.start();
        } catch (RuntimeException e) {
            reporter.error("destination failed to bind", e);
            reporter.state(RoleState.ERROR, "bind failed: " + e.getMessage());
            bindFailed = true;
            throw e;
        }
        server = s;

        reporter.info("listening on " + bound);
        reporter.info("MAX_DELAY is set to " + detection.config().maxDelaySeconds() + "s, detection "
                + (detection.isEnabled() ? "enabled" : "disabled"));
        reporter.state(RoleState.RUNNING, "listening on " + bound);
        return bound;
    }

    public void stop()
    {
        if (stopping) {
            return;
        }
        stopping = true;
        StreamServer s = server;
        if (s != null) {
            s.stop();
        }
        if (!bindFailed) {
            // A role that never bound keeps its error state.
            reporter.state(RoleState.STOPPED, "stopped");
        }
    }

    public DetectionEngine detection()
    {
        return detection;
    }

    public int openConnections()
    {
        return openConnections.get();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private FrameListener accept(FrameChannel channel)
    {
        final String sourceId = String.valueOf(channel.remoteAddress());
        openConnections.incrementAndGet();
        reporter.info("connected with " + sourceId);

        return new FrameListener() {
            @Override
            public void onFrame(byte[] frame) {
                handle(sourceId, frame);
            }

            @Override
            public void onClosed(Throwable cause) {
                openConnections.decrementAndGet();
                detection.endSession(sourceId);
                if (cause == null || stopping) {
                    reporter.info(sourceId + " disconnected");
                } else {
                    reporter.error("connection " + sourceId + " failed", cause);
                    reporter.state(RoleState.ERROR, "connection " + sourceId + " failed: " + cause.getMessage());
                }
            }
        };
    }

    void handle(String sourceId, byte[] frame)
    {
        Observation obs = detection.observe(sourceId, frame);

        if (obs.isMalformed()) {
            reporter.warn("malformed frame from " + sourceId + " (" + obs.decodeError() + "): " + obs.rawFrame());
        } else {
            Message m = obs.message();
            reporter.info("SEQ=" + m.sequence()
                    + " | TS=" + BigDecimal.valueOf(m.timestamp()).toPlainString()
                    + " | Delay=" + String.format(Locale.ROOT, "%.3f", obs.delaySeconds()) + "s"
                    + " | DATA=" + m.payload());
        }

        for (Alert alert : obs.alerts()) {
            journal.append(alert);
            reporter.sink().onAlert(alert);
        }
    }
}
