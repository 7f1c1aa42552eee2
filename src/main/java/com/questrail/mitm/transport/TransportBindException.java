package com.questrail.mitm.transport;

import java.net.SocketAddress;

/**
 * A {@link StreamServer} could not bind its listen address (port in use,
 * address not local, permission denied).
 */
public final class TransportBindException extends RuntimeException
{
    private final SocketAddress address;

    public TransportBindException(SocketAddress address, Throwable cause)
    {
        super("Cannot bind " + address + ": " + cause, cause);
        this.address = address;
    }

    public SocketAddress address()
    {
        return address;
    }
}
