package com.questrail.mitm.codec.impl;

import com.questrail.mitm.codec.MalformedMessageException;

/**
 * Payload escaping. Keeps {@link MessageFraming#TERMINATOR} unique on the wire.
 *
 * <pre>
 *   \   → \\
 *   LF  → \n
 *   CR  → \r
 * </pre>
 */
final class PayloadEscaping
{
    private static final char ESCAPE = '\\';

    private PayloadEscaping() {}

    static String escape(String payload)
    {
        // Fast path: nothing to escape.
        if (payload.indexOf(ESCAPE) < 0 && payload.indexOf('\n') < 0 && payload.indexOf('\r') < 0) {
            return payload;
        }

        StringBuilder out = new StringBuilder(payload.length() + 8);
        for (int i = 0; i < payload.length(); i++) {
            char c = payload.charAt(i);
            switch (c) {
                case ESCAPE -> out.append(ESCAPE).append(ESCAPE);
                case '\n' -> out.append(ESCAPE).append('n');
                case '\r' -> out.append(ESCAPE).append('r');
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    static String unescape(String escaped)
    {
        if (escaped.indexOf(ESCAPE) < 0) {
            return escaped;
        }

        StringBuilder out = new StringBuilder(escaped.length());
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (c != ESCAPE) {
                out.append(c);
                continue;
            }
            if (i + 1 >= escaped.length()) {
                throw new MalformedMessageException("Dangling escape at end of payload");
            }
            char next = escaped.charAt(++i);
            switch (next) {
                case ESCAPE -> out.append(ESCAPE);
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                default -> throw new MalformedMessageException("Invalid escape sequence \\" + next + " in payload");
            }
        }
        return out.toString();
    }
}
