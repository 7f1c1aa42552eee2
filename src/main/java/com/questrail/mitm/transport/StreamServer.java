package com.questrail.mitm.transport;

import java.net.InetSocketAddress;

/**
 * Listening side of a stream transport.
 */
public interface StreamServer
{
    /**
     * Bind and start accepting. Binding failures are thrown here, before any
     * connection is accepted.
     *
     * @return the bound address (the real port when an ephemeral one was requested)
     * @throws TransportBindException if the address cannot be bound
     */
    InetSocketAddress start();

    /**
     * Close the listening socket and every accepted connection.
     */
    void stop();
}
