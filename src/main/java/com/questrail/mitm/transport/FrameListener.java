package com.questrail.mitm.transport;

/**
 * FrameListener
 * -----------------------------------------------------------------------------
 * Callback sink for one {@link FrameChannel}.
 *
 * <p>Callbacks for one channel are serialized by the implementation (Netty
 * delivers them on the channel's event loop).</p>
 */
public interface FrameListener
{
    /**
     * Called once per inbound frame, with the terminator already stripped.
     * The payload is delivered as received; no decoding has happened.
     */
    void onFrame(byte[] frame);

    /**
     * Called exactly once when the channel becomes unusable.
     *
     * @param cause failure cause; {@code null} for an orderly close by either
     *              peer or a local {@link FrameChannel#close()}
     */
    void onClosed(Throwable cause);
}
