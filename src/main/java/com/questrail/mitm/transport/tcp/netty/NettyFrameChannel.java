package com.questrail.mitm.transport.tcp.netty;

import com.questrail.mitm.transport.FrameChannel;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link FrameChannel} over a Netty {@link Channel}. Package-private: the
 * Netty channel never leaves this package.
 */
final class NettyFrameChannel implements FrameChannel
{
    private final Channel channel;

    NettyFrameChannel(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public void send(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(Unpooled.wrappedBuffer(frame));
    }

    @Override
    public void setReadable(boolean readable)
    {
        channel.config().setAutoRead(readable);
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public String toString()
    {
        return "NettyFrameChannel[" + channel.remoteAddress() + "]";
    }
}
