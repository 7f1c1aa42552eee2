package com.questrail.mitm.transport;

import java.net.SocketAddress;

/**
 * FrameChannel
 * -----------------------------------------------------------------------------
 * One established stream connection, seen as a sequence of frames.
 *
 * <p>Implementations may be backed by Netty, plain sockets, or a test double.
 * Above this port nothing sees transport framework types.</p>
 */
public interface FrameChannel
{
    /**
     * Remote peer; used as the source identity at the destination.
     */
    SocketAddress remoteAddress();

    /**
     * Write bytes exactly as given. The caller supplies the frame terminator.
     *
     * <p>Must not block. Writing to a closed channel is a silent no-op: a
     * half-closed session drains by discarding, not by failing.</p>
     */
    void send(byte[] frame);

    /**
     * Stop or resume reading inbound frames. Used to hold upstream input while
     * the downstream side is still connecting.
     */
    void setReadable(boolean readable);

    /**
     * Close the connection. Idempotent. The channel's {@link FrameListener}
     * receives {@link FrameListener#onClosed(Throwable)} with {@code null}.
     */
    void close();

    boolean isOpen();
}
