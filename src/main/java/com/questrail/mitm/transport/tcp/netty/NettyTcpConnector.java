package com.questrail.mitm.transport.tcp.netty;

import com.questrail.mitm.transport.FrameChannel;
import com.questrail.mitm.transport.FrameListener;
import com.questrail.mitm.transport.StreamConnector;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyTcpConnector
 * =============================================================================
 * Netty-backed implementation of the {@link StreamConnector} port.
 *
 * <p>Uses a dedicated single-threaded {@link NioEventLoopGroup}, so all
 * connections it opens share one event loop and their callbacks are
 * serialized.</p>
 */
public final class NettyTcpConnector implements StreamConnector
{
    private final EventLoopGroup group;
    private final int maxFrameLength;
    private final int connectTimeoutMillis;

    public NettyTcpConnector(int maxFrameLength, int connectTimeoutMillis)
    {
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
        this.maxFrameLength = maxFrameLength;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public CompletableFuture<FrameChannel> connect(InetSocketAddress remote, FrameListener listener)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(listener, "listener");

        CompletableFuture<FrameChannel> result = new CompletableFuture<>();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new LineBasedFrameDecoder(maxFrameLength));
                        ch.pipeline().addLast(new FrameHandler(listener));
                    }
                });

        ChannelFuture f = bootstrap.connect(remote);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(new NettyFrameChannel(future.channel()));
            } else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    @Override
    public void shutdown()
    {
        group.shutdownGracefully();
    }
}
