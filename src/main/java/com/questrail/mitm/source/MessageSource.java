package com.questrail.mitm.source;

import com.questrail.mitm.codec.MessageEncoder;
import com.questrail.mitm.config.SourceConfig;
import com.questrail.mitm.internal.time.Cancellable;
import com.questrail.mitm.internal.time.MonotonicClock;
import com.questrail.mitm.internal.time.MonotonicScheduler;
import com.questrail.mitm.internal.time.WallClock;
import com.questrail.mitm.model.Message;
import com.questrail.mitm.observability.RoleReporter;
import com.questrail.mitm.status.RoleState;
import com.questrail.mitm.transport.FrameChannel;
import com.questrail.mitm.transport.FrameListener;
import com.questrail.mitm.transport.StreamConnector;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * MessageSource
 * =============================================================================
 * The source role: one connection, one message every {@code message_interval}.
 *
 * <p>Sequences start at 1 and increase by exactly 1. Each message is stamped
 * with the wall clock at send time. Pacing is monotonic: the n-th send is
 * due {@code n * interval} after the first, so a late tick does not push
 * every later one back.</p>
 *
 * <p>When a message limit is configured the source closes its connection
 * after the last message. Otherwise it runs until {@link #stop()}.</p>
 */
public final class MessageSource
{
    private final InetSocketAddress target;
    private final SourceConfig config;
    private final MessageEncoder encoder;
    private final StreamConnector connector;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final RoleReporter reporter;

    private final Object lock = new Object();

    private FrameChannel channel;
    private Cancellable nextTick;
    private long nextDeadlineNanos;
    private long lastSequence;
    private boolean finished;

    public MessageSource(InetSocketAddress target,
                         SourceConfig config,
                         MessageEncoder encoder,
                         StreamConnector connector,
                         MonotonicScheduler scheduler,
                         MonotonicClock clock,
                         WallClock wallClock,
                         RoleReporter reporter)
    {
        this.target = Objects.requireNonNull(target, "target");
        this.config = Objects.requireNonNull(config, "config");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    /**
     * Connect and start sending. The returned future completes once connected,
     * or exceptionally if the connection cannot be established.
     */
    public CompletableFuture<Void> start()
    {
        reporter.info("connecting to " + target);
        return connector.connect(target, new Listener())
                .handle((ch, failure) -> {
                    if (failure != null) {
                        synchronized (lock) {
                            finished = true;
                        }
                        reporter.error("cannot connect to " + target, failure);
                        reporter.state(RoleState.ERROR, "connect to " + target + " failed: " + failure.getMessage());
                        throw new IllegalStateException("source cannot connect to " + target, failure);
                    }
                    onConnected(ch);
                    return null;
                });
    }

    /**
     * Cancel pacing and close the connection. Idempotent.
     */
    public void stop()
    {
        finish(RoleState.STOPPED, "stopped after " + lastSequence() + " messages");
        connector.shutdown();
    }

    public long lastSequence()
    {
        synchronized (lock) {
            return lastSequence;
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void onConnected(FrameChannel ch)
    {
        synchronized (lock) {
            if (finished) {
                ch.close();
                return;
            }
            channel = ch;
            nextDeadlineNanos = clock.nowNanos();
        }
        reporter.info("connected to " + target);
        reporter.state(RoleState.RUNNING, "sending to " + target + " every "
                + config.messageInterval().toMillis() / 1000.0 + "s");
        tick();
    }

    private void tick()
    {
        Message message;
        FrameChannel ch;
        boolean last;
        synchronized (lock) {
            if (finished) {
                return;
            }
            lastSequence++;
            message = new Message(lastSequence, wallClock.nowEpochSeconds(), config.payload());
            ch = channel;
            last = !config.unlimited() && lastSequence >= config.messageLimit();
            if (!last) {
                nextDeadlineNanos += config.messageInterval().toNanos();
                nextTick = scheduler.scheduleAtNanos(nextDeadlineNanos, this::tick);
            }
        }

        try {
            ch.send(encoder.encode(message));
            reporter.info("Sent: SEQ=" + message.sequence() + " DATA=" + message.payload());
        } catch (RuntimeException e) {
            reporter.error("send of SEQ=" + message.sequence() + " failed", e);
            finish(RoleState.ERROR, "send failed: " + e.getMessage());
            return;
        }

        if (last) {
            finish(RoleState.STOPPED, "sent " + message.sequence() + " messages");
        }
    }

    private void finish(RoleState state, String status)
    {
        FrameChannel ch;
        Cancellable tick;
        synchronized (lock) {
            if (finished) {
                return;
            }
            finished = true;
            ch = channel;
            tick = nextTick;
            nextTick = null;
        }
        if (tick != null) {
            tick.cancel();
        }
        if (ch != null) {
            ch.close();
        }
        reporter.state(state, status);
    }

    private final class Listener implements FrameListener
    {
        @Override
        public void onFrame(byte[] frame)
        {
            reporter.debug("received " + frame.length + " bytes from " + target);
        }

        @Override
        public void onClosed(Throwable cause)
        {
            if (cause != null) {
                reporter.error("connection to " + target + " failed", cause);
                finish(RoleState.ERROR, "connection failed: " + cause.getMessage());
            } else {
                finish(RoleState.ERROR, "connection closed by peer");
            }
        }
    }
}
