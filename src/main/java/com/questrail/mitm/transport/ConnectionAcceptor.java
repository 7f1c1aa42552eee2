package com.questrail.mitm.transport;

/**
 * Invoked by a listening endpoint for each accepted connection. Returns the
 * listener that will receive that connection's frames.
 */
@FunctionalInterface
public interface ConnectionAcceptor
{
    FrameListener onAccepted(FrameChannel channel);
}
