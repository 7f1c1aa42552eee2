package com.questrail.mitm.codec;

import com.questrail.mitm.model.Message;

/**
 * MessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound half of the wire codec: one frame to a {@link Message}.
 *
 * <p>The decoder is handed exactly one frame, with or without its terminator.
 * It never accumulates across calls; re-framing a byte stream is the
 * transport's job.</p>
 *
 * <p>Decode failure is an expected outcome on an attacked path. It is reported
 * with {@link MalformedMessageException} and must never escalate beyond the
 * caller that classifies it.</p>
 */
public interface MessageDecoder
{
    /**
     * @param frame raw frame bytes
     * @return the decoded message
     * @throws MalformedMessageException if a field is missing, out of order,
     *         or carries a non-numeric sequence or timestamp
     */
    Message decode(byte[] frame);
}
