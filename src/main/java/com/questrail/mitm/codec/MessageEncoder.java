package com.questrail.mitm.codec;

import com.questrail.mitm.model.Message;

/**
 * MessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound half of the wire codec: {@link Message} to terminated frame bytes.
 *
 * <p>Encoding is deterministic. The returned bytes include the frame
 * terminator, so consecutive encodings can be written back to back on a
 * stream transport and re-framed by the receiver.</p>
 */
public interface MessageEncoder
{
    byte[] encode(Message message);
}
