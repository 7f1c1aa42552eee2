package com.questrail.mitm.codec.impl;

import com.questrail.mitm.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decoding an encoded message yields the same message, for payloads that
 * exercise every escaping rule and for timestamps near the edges of plain
 * decimal notation.
 */
final class MessageRoundtripTest
{
    private final DefaultMessageEncoder encoder = new DefaultMessageEncoder();
    private final DefaultMessageDecoder decoder = new DefaultMessageDecoder();

    @Test
    void representativeMessagesSurviveRoundtrip()
    {
        List<Message> messages = List.of(
                new Message(1, 1700000000.123456, "Username=ROOT=, Password=SSHTERMINAL"),
                new Message(0, 0.0, ""),
                new Message(Long.MAX_VALUE, 1e-7, "tiny"),
                new Message(42, 1.0E12, "multi\nline\r\npayload"),
                new Message(43, 5.5, "back\\slash|pipe\\n literal"),
                new Message(44, 6.25, "unicode é中"));

        for (Message m : messages) {
            assertEquals(m, decoder.decode(encoder.encode(m)), m.toString());
        }
    }

    @Test
    void negativeZeroTimestampSurvivesRoundtrip()
    {
        Message m = new Message(3, -0.0, "z");

        assertEquals(m, decoder.decode(encoder.encode(m)));
        assertEquals(new Message(3, 0.0, "z"), m);
    }

    @Test
    void terminatorAppearsOnlyAtTheEnd()
    {
        byte[] frame = encoder.encode(new Message(9, 2.0, "\n\n\n"));
        for (int i = 0; i < frame.length - 1; i++) {
            assertNotEquals(MessageFraming.TERMINATOR, frame[i]);
        }
        assertEquals(MessageFraming.TERMINATOR, frame[frame.length - 1]);
    }
}
