package io.codesync.transport.impl;

import io.codesync.sync.ConnectionMultiplexer;
import io.codesync.sync.PeerConnection;
import io.codesync.sync.SyncMessage;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.AttributeKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-channel glue between Netty and the {@link ConnectionMultiplexer}.
 * <p>
 * Runs on a dedicated executor group rather than the I/O loop because attaching may
 * load a document from storage. Netty delivers all events of one channel to the same
 * executor thread, so callbacks for one connection never overlap.
 */
@Slf4j
@RequiredArgsConstructor
public class SyncServerHandler extends SimpleChannelInboundHandler<SyncMessage> {

    static final AttributeKey<PeerConnection> CONNECTION = AttributeKey.valueOf("codesync.connection");

    private final ConnectionMultiplexer multiplexer;
    private final String pathPrefix;

    @Override
    public void channelRead(final ChannelHandlerContext ctx, final Object msg) throws Exception {
        /* Plain HTTP requests outside the WebSocket path end up here. */
        if (msg instanceof final FullHttpRequest req) {
            try {
                final FullHttpResponse res = new DefaultFullHttpResponse(req.protocolVersion(), HttpResponseStatus.NOT_FOUND);
                res.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
                ctx.writeAndFlush(res).addListener(ChannelFutureListener.CLOSE);
            } finally {
                req.release();
            }
            return;
        }
        super.channelRead(ctx, msg);
    }

    @Override
    public void userEventTriggered(final ChannelHandlerContext ctx, final Object evt) throws Exception {
        if (evt instanceof final WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            final PeerConnection connection = new ChannelPeerConnection(ctx.channel());
            ctx.channel().attr(CONNECTION).set(connection);
            multiplexer.onConnect(connection, rawKey(handshake.requestUri(), pathPrefix));
            return;
        }

        if (evt instanceof final IdleStateEvent idle) {
            if (idle.state() == IdleState.WRITER_IDLE) {
                if (ctx.channel().attr(CONNECTION).get() == null) return;

                ctx.writeAndFlush(new PingWebSocketFrame());
            } else if (idle.state() == IdleState.READER_IDLE) {
                log.info("Closing unresponsive connection {}", ctx.channel().id().asShortText());
                ctx.close();
            }
            return;
        }

        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final SyncMessage msg) {
        final PeerConnection connection = ctx.channel().attr(CONNECTION).get();
        if (connection == null) {
            log.debug("Dropping {} received before handshake on {}", msg, ctx.channel().id().asShortText());
            return;
        }
        multiplexer.onMessage(connection, msg);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        final PeerConnection connection = ctx.channel().attr(CONNECTION).get();
        if (connection != null) {
            multiplexer.onDisconnect(connection);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        final PeerConnection connection = ctx.channel().attr(CONNECTION).get();

        if (cause instanceof DecoderException) {
            log.warn("Closing connection {}: undecodable frame: {}", ctx.channel().id().asShortText(), cause.getMessage());
        } else {
            log.error("Handler error on connection {}", ctx.channel().id().asShortText(), cause);
        }

        if (connection != null) {
            multiplexer.onDisconnect(connection);
            connection.close(WebSocketCloseStatus.PROTOCOL_ERROR);
        } else {
            ctx.close();
        }
    }

    /**
     * Extracts the URL-decoded document key from a request URI such as
     * {@code /collab/s1:src%2Fmain.js?token=x}.
     *
     * @return the key, or {@code null} if the URI is not under {@code prefix} or cannot be decoded
     */
    static String rawKey(final String requestUri, final String prefix) {
        final String path;
        try {
            path = new QueryStringDecoder(requestUri).path();
        } catch (final IllegalArgumentException e) {
            return null;
        }

        if (!path.startsWith(prefix)) return null;

        final String rest = path.substring(prefix.length());
        return rest.startsWith("/") ? rest.substring(1) : rest;
    }
}
