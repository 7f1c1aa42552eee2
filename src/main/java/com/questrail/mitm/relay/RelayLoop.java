package com.questrail.mitm.relay;

import com.questrail.mitm.attack.AttackConfig;
import com.questrail.mitm.attack.AttackEngine;
import com.questrail.mitm.attack.AttackPolicy;
import com.questrail.mitm.attack.AttackStats;
import com.questrail.mitm.codec.impl.MessageFraming;
import com.questrail.mitm.internal.time.MonotonicClock;
import com.questrail.mitm.internal.time.MonotonicScheduler;
import com.questrail.mitm.observability.RoleReporter;
import com.questrail.mitm.transport.FrameChannel;
import com.questrail.mitm.transport.FrameListener;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * RelayLoop
 * =============================================================================
 * One relay session: an upstream connection (from the source), a downstream
 * connection (to the destination) and the {@link AttackEngine} between them.
 *
 * <h2>Data flow</h2>
 * <pre>
 *   upstream frame
 *        → AttackEngine.submit   (forward / delay / drop / hold)
 *            → downstream.send   (in the engine's order and timing)
 *
 *   downstream frame
 *        → upstream.send         (unmodified)
 * </pre>
 *
 * <p>Frames are never decoded here. Malformed input travels exactly like valid
 * input, so the destination stays the only judge of validity.</p>
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>Upstream closes normally: the engine drains (see
 *       {@link AttackEngine#finish(Runnable)}), then downstream is closed.</li>
 *   <li>Downstream closes, either side fails, or the downstream connect
 *       fails: the engine is cancelled and both sides are closed. Held frames
 *       are discarded, never delivered to a dead socket.</li>
 *   <li>{@link #stop()}: same as a failure, but reported as requested.</li>
 * </ul>
 * The outcome callback fires exactly once.
 */
public final class RelayLoop
{
    private enum State { CONNECTING, ACTIVE, DRAINING, CLOSED }

    private final String label;
    private final FrameChannel upstream;
    private final AttackEngine engine;
    private final RoleReporter reporter;
    private final Consumer<SessionOutcome> onEnded;

    private final Object lock = new Object();
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private State state = State.CONNECTING;
    private FrameChannel downstream;
    /** Set by the drain callback just before it closes downstream. */
    private boolean drained;

    public RelayLoop(String label,
                     FrameChannel upstream,
                     AttackConfig config,
                     AttackPolicy policy,
                     MonotonicScheduler scheduler,
                     MonotonicClock clock,
                     RoleReporter reporter,
                     Consumer<SessionOutcome> onEnded)
    {
        this.label = Objects.requireNonNull(label, "label");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.onEnded = Objects.requireNonNull(onEnded, "onEnded");
        this.engine = new AttackEngine(config, policy, scheduler, clock, this::sendDownstream, reporter, label);
    }

    public String label() {
        return label;
    }

    public AttackStats stats() {
        return engine.stats();
    }

    /**
     * Listener to install on the upstream channel.
     */
    public FrameListener upstreamListener() {
        return new FrameListener() {
            @Override
            public void onFrame(byte[] frame) {
                // The transport stripped the terminator; restore it, nothing else.
                engine.submit(MessageFraming.terminate(frame));
            }

            @Override
            public void onClosed(Throwable cause) {
                if (cause != null) {
                    abort(SessionOutcome.Kind.FAILED, cause, "upstream failed");
                } else {
                    upstreamEnded();
                }
            }
        };
    }

    /**
     * Listener to install on the downstream channel.
     */
    public FrameListener downstreamListener() {
        return new FrameListener() {
            @Override
            public void onFrame(byte[] frame) {
                upstream.send(MessageFraming.terminate(frame));
            }

            @Override
            public void onClosed(Throwable cause) {
                downstreamClosed(cause);
            }
        };
    }

    /**
     * The downstream connection is up; start reading upstream.
     */
    public void attachDownstream(FrameChannel channel) {
        Objects.requireNonNull(channel, "channel");
        synchronized (lock) {
            if (state != State.CONNECTING) {
                // Session already ended while connecting.
                channel.close();
                return;
            }
            downstream = channel;
            state = State.ACTIVE;
        }
        reporter.info("[" + label + "] connected downstream " + channel.remoteAddress());
        upstream.setReadable(true);
    }

    /**
     * The downstream connect attempt failed. The session never carried a frame.
     */
    public void downstreamConnectFailed(Throwable cause) {
        abort(SessionOutcome.Kind.FAILED, cause, "downstream connect failed");
    }

    /**
     * Explicit stop. Pending work is cancelled and discarded.
     */
    public void stop() {
        abort(SessionOutcome.Kind.STOPPED, null, "stop requested");
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void sendDownstream(byte[] frame) {
        FrameChannel ch;
        synchronized (lock) {
            ch = downstream;
        }
        if (ch != null) {
            ch.send(frame);
        }
    }

    private void upstreamEnded() {
        FrameChannel ch;
        synchronized (lock) {
            if (state != State.ACTIVE) {
                if (state == State.CONNECTING) {
                    state = State.DRAINING;
                    ch = null;
                } else {
                    return;
                }
            } else {
                state = State.DRAINING;
                ch = downstream;
            }
        }

        if (ch == null) {
            // Nothing was read before downstream came up; nothing to drain.
            abort(SessionOutcome.Kind.COMPLETED, null, "upstream closed before downstream connected");
            return;
        }

        reporter.info("[" + label + "] upstream closed, draining");
        engine.finish(() -> {
            synchronized (lock) {
                drained = true;
            }
            ch.close();
        });
    }

    private void downstreamClosed(Throwable cause) {
        boolean closedByDrain;
        synchronized (lock) {
            closedByDrain = state == State.DRAINING && drained;
        }

        if (closedByDrain && cause == null) {
            // Every held frame was delivered before the close.
            if (ended.compareAndSet(false, true)) {
                synchronized (lock) {
                    state = State.CLOSED;
                }
                upstream.close();
                finishWith(SessionOutcome.Kind.COMPLETED, null);
            }
            return;
        }

        // A peer close while draining still has frames to deliver; they are discarded.
        Throwable reason = cause != null ? cause : new IOException("downstream closed the connection");
        abort(SessionOutcome.Kind.FAILED, reason, "downstream gone");
    }

    private void abort(SessionOutcome.Kind kind, Throwable cause, String why) {
        if (!ended.compareAndSet(false, true)) {
            return;
        }

        FrameChannel ch;
        synchronized (lock) {
            state = State.CLOSED;
            ch = downstream;
        }

        int discarded = engine.cancel();
        if (discarded > 0) {
            reporter.warn("[" + label + "] " + why + ": discarded " + discarded
                    + " held frames at shutdown (not attack drops)");
        }

        upstream.close();
        if (ch != null) {
            ch.close();
        }
        finishWith(kind, cause);
    }

    private void finishWith(SessionOutcome.Kind kind, Throwable cause) {
        AttackStats s = engine.stats();
        reporter.info("[" + label + "] session " + kind.name().toLowerCase(Locale.ROOT)
                + ": received=" + s.received()
                + " forwarded=" + s.forwarded()
                + " dropped=" + s.dropped()
                + " delayed=" + s.delayed()
                + " reordered=" + s.reordered()
                + " discardedAtShutdown=" + s.discardedAtShutdown());
        onEnded.accept(new SessionOutcome(kind, s, cause));
    }
}
