package io.codesync.transport.impl;

import io.codesync.sync.PeerConnection;
import io.codesync.sync.SyncMessage;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PeerConnection} over a Netty WebSocket channel.
 */
final class ChannelPeerConnection implements PeerConnection {
    private final Channel channel;
    private final AtomicBoolean closing = new AtomicBoolean();

    ChannelPeerConnection(final Channel channel) {
        this.channel = channel;
    }

    @Override
    public String id() {
        return channel.id().asShortText();
    }

    @Override
    public InetAddress remoteAddress() {
        final SocketAddress addr = channel.remoteAddress();
        return addr instanceof InetSocketAddress inet ? inet.getAddress() : null;
    }

    @Override
    public void send(final SyncMessage message) {
        if (channel.isActive() && !closing.get()) {
            channel.writeAndFlush(message);
        }
    }

    @Override
    public void close(final WebSocketCloseStatus status) {
        if (!closing.compareAndSet(false, true)) return;

        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame(status)).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "ChannelPeerConnection{" + id() + '}';
    }
}
