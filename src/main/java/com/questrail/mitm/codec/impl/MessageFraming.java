package com.questrail.mitm.codec.impl;

import java.util.Arrays;

/**
 * MessageFraming
 * -----------------------------------------------------------------------------
 * Frame-level constants and terminator handling for the line-oriented layout.
 *
 * <p>A frame is the encoded field list followed by a single {@code LF}. A
 * preceding {@code CR} is tolerated on input. This class neither parses fields
 * nor escapes payloads.</p>
 */
public final class MessageFraming
{
    /** Frame terminator. */
    public static final byte TERMINATOR = '\n';

    static final byte CARRIAGE_RETURN = '\r';

    static final char FIELD_SEPARATOR = '|';

    static final String SEQUENCE_LABEL = "SEQ=";
    static final String TIMESTAMP_LABEL = "TS=";
    static final String PAYLOAD_LABEL = "DATA=";

    private MessageFraming() {}

    /**
     * Returns the frame body without its terminator ({@code LF} or
     * {@code CR LF}). Frames already stripped by the transport pass through.
     */
    public static byte[] stripTerminator(byte[] frame)
    {
        int end = frame.length;
        if (end > 0 && frame[end - 1] == TERMINATOR) {
            end--;
        }
        if (end > 0 && frame[end - 1] == CARRIAGE_RETURN) {
            end--;
        }
        return end == frame.length ? frame : Arrays.copyOf(frame, end);
    }

    /**
     * Appends the terminator to a frame body, unless it already ends with one.
     *
     * <p>Used by the relay to restore the boundary the transport stripped on
     * read, without otherwise touching the bytes.</p>
     */
    public static byte[] terminate(byte[] body)
    {
        if (body.length > 0 && body[body.length - 1] == TERMINATOR) {
            return body;
        }
        byte[] framed = Arrays.copyOf(body, body.length + 1);
        framed[framed.length - 1] = TERMINATOR;
        return framed;
    }
}
