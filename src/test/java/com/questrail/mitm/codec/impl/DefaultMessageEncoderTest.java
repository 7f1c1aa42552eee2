package com.questrail.mitm.codec.impl;

import com.questrail.mitm.model.Message;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultMessageEncoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultMessageEncoder}: field order, labels,
 * timestamp notation and terminator.
 */
final class DefaultMessageEncoderTest
{
    private final DefaultMessageEncoder encoder = new DefaultMessageEncoder();

    @Test
    void encodesFieldsInFixedOrderWithTerminator()
    {
        byte[] frame = encoder.encode(new Message(7, 1700000000.25, "hello"));

        assertEquals("SEQ=7|TS=1700000000.25|DATA=hello\n", new String(frame, StandardCharsets.UTF_8));
    }

    @Test
    void timestampNeverUsesScientificNotation()
    {
        for (double ts : new double[] { 1.7e9, 1e-4, 1.0E12, 1700000000.123456 }) {
            String text = DefaultMessageEncoder.formatTimestamp(ts);
            assertFalse(text.contains("E"), text);
            assertEquals(ts, Double.parseDouble(text));
        }
        assertEquals("1700000000", DefaultMessageEncoder.formatTimestamp(1.7e9));
    }

    @Test
    void newlinesInPayloadAreEscaped()
    {
        String line = new String(encoder.encode(new Message(1, 1.0, "a\nb\r\\c")), StandardCharsets.UTF_8);

        assertEquals("SEQ=1|TS=1.0|DATA=a\\nb\\r\\\\c\n", line);
        // Exactly one terminator, at the end.
        assertEquals(line.length() - 1, line.indexOf('\n'));
    }

    @Test
    void separatorInPayloadIsKeptVerbatim()
    {
        String line = new String(encoder.encode(new Message(2, 3.5, "x|y=z")), StandardCharsets.UTF_8);
        assertEquals("SEQ=2|TS=3.5|DATA=x|y=z\n", line);
    }

    @Test
    void rejectsNullMessage()
    {
        assertThrows(NullPointerException.class, () -> encoder.encode(null));
    }
}
