package com.questrail.mitm.codec.impl;

import com.questrail.mitm.codec.MessageEncoder;
import com.questrail.mitm.model.Message;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultMessageEncoder
 * -----------------------------------------------------------------------------
 * Concrete {@link MessageEncoder}; the mechanical inverse of
 * {@link DefaultMessageDecoder}.
 *
 * <p>The timestamp is written in plain decimal notation using the shortest
 * representation that parses back to the same {@code double}.</p>
 */
public final class DefaultMessageEncoder implements MessageEncoder
{
    @Override
    public byte[] encode(Message message)
    {
        Objects.requireNonNull(message, "message");

        String line = MessageFraming.SEQUENCE_LABEL + message.sequence()
                + MessageFraming.FIELD_SEPARATOR
                + MessageFraming.TIMESTAMP_LABEL + formatTimestamp(message.timestamp())
                + MessageFraming.FIELD_SEPARATOR
                + MessageFraming.PAYLOAD_LABEL + PayloadEscaping.escape(message.payload());

        return MessageFraming.terminate(line.getBytes(StandardCharsets.UTF_8));
    }

    static String formatTimestamp(double timestamp)
    {
        return BigDecimal.valueOf(timestamp).toPlainString();
    }
}
