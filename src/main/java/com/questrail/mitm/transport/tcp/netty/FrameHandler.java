package com.questrail.mitm.transport.tcp.netty;

import com.questrail.mitm.transport.FrameListener;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * FrameHandler
 * -----------------------------------------------------------------------------
 * Last handler of the pipeline. Receives frames already split by
 * {@link io.netty.handler.codec.LineBasedFrameDecoder}, copies them into
 * {@code byte[]} and forwards them to a {@link FrameListener}.
 *
 * <p>Guarantees a single {@link FrameListener#onClosed(Throwable)} per channel,
 * whichever of {@code exceptionCaught} and {@code channelInactive} fires
 * first.</p>
 */
final class FrameHandler extends SimpleChannelInboundHandler<ByteBuf>
{
    private final AtomicBoolean closedReported = new AtomicBoolean(false);
    private volatile FrameListener listener;

    FrameHandler(FrameListener listener)
    {
        this.listener = listener;
    }

    void setListener(FrameListener listener)
    {
        this.listener = listener;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
    {
        FrameListener l = listener;
        if (l == null) {
            return;
        }

        // Copy out; the ByteBuf is released by SimpleChannelInboundHandler.
        byte[] bytes = new byte[frame.readableBytes()];
        frame.getBytes(frame.readerIndex(), bytes);
        l.onFrame(bytes);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        reportClosed(null);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        reportClosed(cause);
        ctx.close();
    }

    private void reportClosed(Throwable cause)
    {
        FrameListener l = listener;
        if (l != null && closedReported.compareAndSet(false, true)) {
            l.onClosed(cause);
        }
    }
}
