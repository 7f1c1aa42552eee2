package com.questrail.mitm.detection;

import com.questrail.mitm.codec.MalformedMessageException;
import com.questrail.mitm.codec.MessageDecoder;
import com.questrail.mitm.codec.MessageEncoder;
import com.questrail.mitm.codec.impl.MessageFraming;
import com.questrail.mitm.internal.time.WallClock;
import com.questrail.mitm.model.Alert;
import com.questrail.mitm.model.Message;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * DetectionEngine
 * =============================================================================
 * Classifies what the destination actually receives, per source identity.
 *
 * <h2>Classification</h2>
 * For each frame, in order:
 * <ol>
 *   <li><b>malformed</b>: the frame does not decode. State is untouched.</li>
 *   <li><b>duplicate</b>: the sequence is still in the identity's replay
 *       window. The expectation does not move.</li>
 *   <li><b>out_of_order</b>: otherwise, the sequence differs from the expected
 *       one (gaps included). The expectation then becomes
 *       {@code max(expected, sequence + 1)}.</li>
 *   <li><b>excessive_delay</b>: independently of the above, receive time minus
 *       the message timestamp exceeds {@code max_delay}.</li>
 * </ol>
 *
 * <h2>Enable flag</h2>
 * While disabled, classification and state tracking continue but nothing is
 * returned as an alert. Re-enabling resumes from the tracked state.
 *
 * <h2>Thread Safety</h2>
 * Identities are independent. Frames of one identity are classified one at a
 * time under that identity's state monitor.
 */
public final class DetectionEngine
{
    private final DetectionConfig config;
    private final MessageDecoder decoder;
    private final MessageEncoder encoder;
    private final WallClock wallClock;

    private final ConcurrentMap<String, ConnectionState> states = new ConcurrentHashMap<>();

    private volatile boolean enabled;

    public DetectionEngine(DetectionConfig config, MessageDecoder decoder, MessageEncoder encoder, WallClock wallClock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.enabled = config.enabled();
    }

    public DetectionConfig config()
    {
        return config;
    }

    /**
     * Decode and classify one received frame.
     */
    public Observation observe(String sourceId, byte[] frame)
    {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(frame, "frame");

        final String raw = new String(MessageFraming.stripTerminator(frame), StandardCharsets.UTF_8);
        final Message message;
        try {
            message = decoder.decode(frame);
        } catch (MalformedMessageException e) {
            List<Alert> alerts = enabled
                    ? List.of(Alert.malformed(sourceId, raw, wallClock.now()))
                    : List.of();
            return new Observation(sourceId, raw, null, Double.NaN, e.getMessage(), alerts);
        }

        return classify(sourceId, raw, message);
    }

    /**
     * Classify one received frame and return only its alerts.
     */
    public List<Alert> onFrame(String sourceId, byte[] frame)
    {
        return observe(sourceId, frame).alerts();
    }

    /**
     * Classify an already decoded message.
     */
    public List<Alert> onMessage(String sourceId, Message message)
    {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(message, "message");
        String raw = new String(MessageFraming.stripTerminator(encoder.encode(message)), StandardCharsets.UTF_8);
        return classify(sourceId, raw, message).alerts();
    }

    public void setEnabled(boolean value)
    {
        this.enabled = value;
    }

    public boolean isEnabled()
    {
        return enabled;
    }

    /**
     * Next in-order sequence for {@code sourceId}; empty if nothing valid was
     * received from it yet.
     */
    public OptionalLong expectedSequence(String sourceId)
    {
        ConnectionState state = states.get(sourceId);
        if (state == null) {
            return OptionalLong.empty();
        }
        synchronized (state) {
            return OptionalLong.of(state.expectedSequence());
        }
    }

    /**
     * Forget everything about {@code sourceId}. The next frame from it starts
     * from the initial sequence again.
     */
    public void reset(String sourceId)
    {
        states.remove(sourceId);
    }

    /**
     * The identity's session ended; its state is destroyed.
     */
    public void endSession(String sourceId)
    {
        reset(sourceId);
    }

    public int trackedSources()
    {
        return states.size();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private Observation classify(String sourceId, String raw, Message message)
    {
        final ConnectionState state = states.computeIfAbsent(
                sourceId, id -> new ConnectionState(config.initialSequence(), config.replayWindow()));

        final Instant now = wallClock.now();
        final double delay = toEpochSeconds(now) - message.timestamp();
        final long seq = message.sequence();
        final List<Alert> found = new ArrayList<>(2);

        synchronized (state) {
            if (state.isDuplicate(seq)) {
                state.countDuplicate();
                found.add(Alert.duplicate(sourceId, seq, raw, now));
            } else {
                if (seq != state.expectedSequence()) {
                    found.add(Alert.outOfOrder(sourceId, seq, raw, now));
                }
                state.accept(seq);
            }
        }

        if (delay > config.maxDelaySeconds()) {
            found.add(Alert.excessiveDelay(sourceId, seq, delay, raw, now));
        }

        return new Observation(sourceId, raw, message, delay, null, enabled ? found : List.of());
    }

    private static double toEpochSeconds(Instant instant)
    {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
