package com.questrail.mitm.transport;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * Connecting side of a stream transport.
 */
public interface StreamConnector
{
    /**
     * Open a connection. {@code listener} starts receiving frames as soon as
     * the connection is up.
     *
     * @return completes with the channel, or exceptionally if the connect fails
     */
    CompletableFuture<FrameChannel> connect(InetSocketAddress remote, FrameListener listener);

    /**
     * Release transport resources. Open channels are closed.
     */
    void shutdown();
}
