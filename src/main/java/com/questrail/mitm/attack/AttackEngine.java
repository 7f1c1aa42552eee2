package com.questrail.mitm.attack;

import com.questrail.mitm.internal.time.Cancellable;
import com.questrail.mitm.internal.time.MonotonicClock;
import com.questrail.mitm.internal.time.MonotonicScheduler;
import com.questrail.mitm.observability.RoleReporter;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * AttackEngine
 * =============================================================================
 * Per-session attack state. Applies one {@link AttackPolicy} to every frame the
 * relay reads from upstream and realizes the decision.
 *
 * <h2>Holding without blocking</h2>
 * A delayed frame is an independent scheduled task on the
 * {@link MonotonicScheduler}; a reordered frame is a slot in a bounded buffer.
 * {@link #submit(byte[])} never sleeps, so any number of frames may be in
 * flight at once, and delayed frames whose draws differ resolve in draw order
 * rather than submission order.
 *
 * <h2>Reorder release</h2>
 * When the buffer reaches {@code reorder_window} frames it is flushed in
 * reverse arrival order. Release order therefore differs from arrival order
 * whenever two or more frames were held.
 *
 * <h2>Session end</h2>
 * <ul>
 *   <li>{@link #finish(Runnable)}: upstream ended normally. The reorder buffer
 *       is flushed in arrival order; scheduled releases still fire; the
 *       callback runs once nothing is held.</li>
 *   <li>{@link #cancel()}: downstream is gone, a socket failed, or a stop was
 *       requested. Every pending release is cancelled and every held frame is
 *       discarded and counted as {@code discardedAtShutdown}.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * All state is guarded by one lock. The forwarder is called under that lock
 * so writes reach the transport in exactly the order the engine chose; it must
 * therefore not block.
 */
public final class AttackEngine
{
    static final String DIRECTION = "CLIENT -> SERVER";

    private enum Phase { ACTIVE, DRAINING, CLOSED }

    private final AttackPolicy policy;
    private final int reorderWindow;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Consumer<byte[]> forwarder;
    private final RoleReporter reporter;
    private final String label;

    private final Object lock = new Object();
    private final ArrayDeque<byte[]> reorderBuffer = new ArrayDeque<>();
    private final Map<Long, Cancellable> pendingReleases = new HashMap<>();

    private Phase phase = Phase.ACTIVE;
    private Runnable onDrained;

    private long received;
    private long forwarded;
    private long dropped;
    private long delayed;
    private long reordered;
    private long discardedAtShutdown;

    /**
     * @param config    session snapshot
     * @param policy    decision rule built from {@code config}
     * @param scheduler scheduler for delayed releases
     * @param clock     clock matching {@code scheduler}
     * @param forwarder writes one terminated frame downstream; must not block
     * @param reporter  relay role reporter
     * @param label     session label used in output lines
     */
    public AttackEngine(AttackConfig config,
                        AttackPolicy policy,
                        MonotonicScheduler scheduler,
                        MonotonicClock clock,
                        Consumer<byte[]> forwarder,
                        RoleReporter reporter,
                        String label)
    {
        Objects.requireNonNull(config, "config");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.reorderWindow = config.reorderWindow();
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.forwarder = Objects.requireNonNull(forwarder, "forwarder");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.label = Objects.requireNonNull(label, "label");

        if (policy.mode() != config.mode()) {
            throw new IllegalArgumentException("policy mode " + policy.mode() + " does not match config mode " + config.mode());
        }
    }

    public AttackMode mode() {
        return policy.mode();
    }

    /**
     * Accept one frame from upstream and act on the policy's decision.
     * Frames submitted after {@link #finish(Runnable)} or {@link #cancel()}
     * are discarded.
     */
    public void submit(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        synchronized (lock) {
            received++;
            final long index = received;

            if (phase != Phase.ACTIVE) {
                discardedAtShutdown++;
                reporter.debug(prefix() + "session ending, discarded late frame #" + index);
                return;
            }

            AttackDecision decision = policy.decide();

            if (decision instanceof AttackDecision.ForwardNow) {
                forward(frame);
            }
            else if (decision instanceof AttackDecision.ForwardAfter after) {
                scheduleRelease(index, frame, after.delay());
            }
            else if (decision instanceof AttackDecision.Drop) {
                dropped++;
                reporter.warn(prefix() + "MODE=drop -> dropped frame #" + index + " (" + frame.length + " bytes)");
            }
            else if (decision instanceof AttackDecision.Hold) {
                hold(frame);
            }
        }
    }

    /**
     * Upstream ended normally. Flush the reorder buffer in arrival order and
     * run {@code drained} once every scheduled release has fired. Runs
     * {@code drained} immediately if nothing is pending. No effect if the
     * engine is not active.
     */
    public void finish(Runnable drained)
    {
        Objects.requireNonNull(drained, "drained");

        boolean runNow = false;
        synchronized (lock) {
            if (phase != Phase.ACTIVE) {
                return;
            }
            phase = Phase.DRAINING;

            if (!reorderBuffer.isEmpty()) {
                reporter.info(prefix() + "session end, flushing " + reorderBuffer.size() + " buffered frames in arrival order");
                while (!reorderBuffer.isEmpty()) {
                    forward(reorderBuffer.pollFirst());
                }
            }

            if (pendingReleases.isEmpty()) {
                phase = Phase.CLOSED;
                runNow = true;
            } else {
                onDrained = drained;
            }
        }

        // Outside the lock: the callback typically closes a channel.
        if (runNow) {
            drained.run();
        }
    }

    /**
     * Cancel every pending release and discard every held frame.
     *
     * @return number of frames discarded by this call
     */
    public int cancel()
    {
        synchronized (lock) {
            if (phase == Phase.CLOSED) {
                return 0;
            }
            phase = Phase.CLOSED;
            onDrained = null;

            int discarded = reorderBuffer.size() + pendingReleases.size();
            for (Cancellable c : pendingReleases.values()) {
                c.cancel();
            }
            pendingReleases.clear();
            reorderBuffer.clear();

            discardedAtShutdown += discarded;
            return discarded;
        }
    }

    public AttackStats stats()
    {
        synchronized (lock) {
            return new AttackStats(received, forwarded, dropped, delayed, reordered, discardedAtShutdown);
        }
    }

    // -------------------------------------------------------------------------
    // Internals (caller holds lock)
    // -------------------------------------------------------------------------

    private void forward(byte[] frame)
    {
        forwarder.accept(frame);
        forwarded++;
        reporter.info(prefix() + DIRECTION + ": forwarded " + frame.length + " bytes");
    }

    private void scheduleRelease(long index, byte[] frame, Duration delay)
    {
        reporter.warn(prefix() + "MODE=random_delay -> holding frame #" + index
                + " for " + String.format(Locale.ROOT, "%.3f", delay.toNanos() / 1_000_000_000.0) + "s");

        // The task cannot run before put() completes: it needs this lock.
        Cancellable handle = scheduler.scheduleAfter(delay, clock, () -> release(index, frame));
        pendingReleases.put(index, handle);
    }

    private void release(long index, byte[] frame)
    {
        Runnable drained = null;
        synchronized (lock) {
            if (pendingReleases.remove(index) == null) {
                // Cancelled while the task was already starting.
                return;
            }
            try {
                forward(frame);
                delayed++;
            } catch (RuntimeException e) {
                reporter.error(prefix() + "delayed release of frame #" + index + " failed", e);
            }

            if (phase == Phase.DRAINING && pendingReleases.isEmpty()) {
                phase = Phase.CLOSED;
                drained = onDrained;
                onDrained = null;
            }
        }
        if (drained != null) {
            drained.run();
        }
    }

    private void hold(byte[] frame)
    {
        reorderBuffer.addLast(frame);
        if (reorderBuffer.size() < reorderWindow) {
            return;
        }

        List<byte[]> release = new ArrayList<>(reorderBuffer.size());
        while (!reorderBuffer.isEmpty()) {
            release.add(reorderBuffer.pollLast());
        }
        reporter.warn(prefix() + "MODE=reorder -> releasing " + release.size() + " frames in reverse arrival order");
        for (byte[] f : release) {
            forward(f);
            reordered++;
        }
    }

    private String prefix()
    {
        return "[" + label + "] ";
    }
}
