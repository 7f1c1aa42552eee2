package com.questrail.mitm.codec.impl;

import com.questrail.mitm.codec.MalformedMessageException;
import com.questrail.mitm.codec.MessageDecoder;
import com.questrail.mitm.model.Message;

import java.nio.charset.StandardCharsets;

/**
 * DefaultMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete {@link MessageDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Strip the terminator, if present</li>
 *   <li>Split into exactly three labeled fields, {@code SEQ}, {@code TS},
 *       {@code DATA}, in that order</li>
 *   <li>Parse the sequence as an unsigned decimal and the timestamp as a
 *       finite decimal</li>
 *   <li>Unescape the payload</li>
 * </ol>
 *
 * <p>Every failure is a {@link MalformedMessageException}; nothing else
 * escapes this method for any input.</p>
 */
public final class DefaultMessageDecoder implements MessageDecoder
{
    @Override
    public Message decode(byte[] frame)
    {
        if (frame == null) {
            throw new MalformedMessageException("Frame is null");
        }

        final String line = new String(MessageFraming.stripTerminator(frame), StandardCharsets.UTF_8);
        if (line.isEmpty()) {
            throw new MalformedMessageException("Empty frame");
        }

        // DATA is last; limit the split so '|' inside the payload survives.
        final String[] fields = line.split("\\" + MessageFraming.FIELD_SEPARATOR, 3);
        if (fields.length < 3) {
            throw new MalformedMessageException("Expected 3 fields but found " + fields.length + ": " + line);
        }

        final String seqText = field(fields[0], MessageFraming.SEQUENCE_LABEL);
        final String tsText = field(fields[1], MessageFraming.TIMESTAMP_LABEL);
        final String payloadText = field(fields[2], MessageFraming.PAYLOAD_LABEL);

        return new Message(parseSequence(seqText), parseTimestamp(tsText), PayloadEscaping.unescape(payloadText));
    }

    private static String field(String field, String label)
    {
        if (!field.startsWith(label)) {
            throw new MalformedMessageException("Missing " + label.substring(0, label.length() - 1) + " field");
        }
        return field.substring(label.length());
    }

    private static long parseSequence(String text)
    {
        if (text.isEmpty()) {
            throw new MalformedMessageException("Empty sequence");
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedMessageException("Non-numeric sequence: " + text);
            }
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("Sequence out of range: " + text, e);
        }
    }

    private static double parseTimestamp(String text)
    {
        final double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("Non-numeric timestamp: " + text, e);
        }
        if (!Double.isFinite(value)) {
            throw new MalformedMessageException("Non-finite timestamp: " + text);
        }
        return value;
    }
}
