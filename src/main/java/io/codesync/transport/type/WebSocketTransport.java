package io.codesync.transport.type;

import io.codesync.config.impl.SyncConfig;
import io.codesync.sync.ConnectionMultiplexer;
import io.codesync.transport.impl.SyncMessageCodec;
import io.codesync.transport.impl.SyncServerHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket endpoint at {@code ws://host:port/<path>/<sessionId:filePath>}.
 */
@Slf4j
public class WebSocketTransport {
    private static final int MAX_HANDSHAKE_BYTES = 64 * 1024;

    @Getter private int port;
    private final String host;
    private final SyncConfig config;
    private final ConnectionMultiplexer multiplexer;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup syncGroup;
    private ChannelGroup channels;
    private Channel serverChannel;

    public WebSocketTransport(final SyncConfig config, final ConnectionMultiplexer multiplexer) {
        this.config = config;
        this.multiplexer = multiplexer;
        this.host = config.getHost();
        this.port = config.getPort();
    }

    public void start() throws InterruptedException {
        /*
         * 1 boss thread accepts connections, default-sized worker group does I/O.
         * Sync handlers run on their own group since attaching can hit storage.
         */
        final IoHandlerFactory factory = NioIoHandler.newFactory();
        bossGroup = new MultiThreadIoEventLoopGroup(1, factory);
        workerGroup = new MultiThreadIoEventLoopGroup(0, factory);
        syncGroup = new DefaultEventExecutorGroup(config.getSyncThreads());
        channels = new DefaultChannelGroup("codesync-connections", GlobalEventExecutor.INSTANCE);

        final String path = config.getPath();
        final long pingMillis = config.getPingIntervalMillis();
        final WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath(path)
                .checkStartsWith(true)
                .maxFramePayloadLength(config.getMaxFrameBytes())
                .allowExtensions(true)
                .build();

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        channels.add(ch);

                        final ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_BYTES));
                        p.addLast(new WebSocketServerCompressionHandler());
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        /* Ping on write silence; give up after two missed intervals of read silence. */
                        p.addLast(new IdleStateHandler(2 * pingMillis, pingMillis, 0, TimeUnit.MILLISECONDS));

                        p.addLast(new WebSocketFrameAggregator(config.getMaxFrameBytes()));
                        p.addLast(new SyncMessageCodec());
                        p.addLast(syncGroup, new SyncServerHandler(multiplexer, path));
                    }
                })
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        try {
            final ChannelFuture f = b.bind(host, port).sync();
            serverChannel = f.channel();
        } catch (final Exception e) {
            stop();
            throw e;
        }

        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("WebSocket transport listening on {}:{}{}", host, port, path);
    }

    /**
     * Stops accepting, closes every open connection, and releases the thread pools.
     * Safe to call more than once.
     */
    public void stop() {
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        if (channels != null) channels.close().awaitUninterruptibly();
        if (bossGroup != null) bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        if (syncGroup != null) syncGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
