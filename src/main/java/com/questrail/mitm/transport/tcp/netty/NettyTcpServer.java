package com.questrail.mitm.transport.tcp.netty;

import com.questrail.mitm.transport.ConnectionAcceptor;
import com.questrail.mitm.transport.FrameListener;
import com.questrail.mitm.transport.StreamServer;
import com.questrail.mitm.transport.TransportBindException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * NettyTcpServer
 * =============================================================================
 * Netty-backed implementation of the {@link StreamServer} port.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>: accepts TCP connections, splits
 * the byte stream into newline-terminated frames and hands each frame to the
 * listener the {@link ConnectionAcceptor} returned for that connection.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds synchronously so that a bind failure surfaces to the
 * caller, as a {@link TransportBindException}, before anything is accepted. {@link #stop()} closes the listening
 * socket, every accepted connection, and both event loop groups.
 */
public final class NettyTcpServer implements StreamServer
{
    private final InetSocketAddress bindAddress;
    private final ConnectionAcceptor acceptor;
    private final int maxFrameLength;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup accepted = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile Channel serverChannel;

    public NettyTcpServer(InetSocketAddress bindAddress, ConnectionAcceptor acceptor, int maxFrameLength)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
        this.maxFrameLength = maxFrameLength;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
    }

    @Override
    public InetSocketAddress start()
    {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        accepted.add(ch);
                        FrameHandler frames = new FrameHandler(null);
                        ch.pipeline().addLast(new LineBasedFrameDecoder(maxFrameLength));
                        ch.pipeline().addLast(new AcceptHandler(frames));
                        ch.pipeline().addLast(frames);
                    }
                });

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            throw new TransportBindException(bindAddress, f.cause());
        }
        serverChannel = f.channel();
        return (InetSocketAddress) serverChannel.localAddress();
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        accepted.close().awaitUninterruptibly();
        shutdownGroups();
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    /**
     * Asks the acceptor for a listener once the connection is active, then
     * removes itself.
     */
    private final class AcceptHandler extends ChannelInboundHandlerAdapter
    {
        private final FrameHandler frames;

        private AcceptHandler(FrameHandler frames)
        {
            this.frames = frames;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            FrameListener listener = acceptor.onAccepted(new NettyFrameChannel(ctx.channel()));
            frames.setListener(listener);
            ctx.pipeline().remove(this);
            super.channelActive(ctx);
        }
    }
}
