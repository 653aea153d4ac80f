package io.codesync.sync;

import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;

import java.net.InetAddress;

/**
 * One client connection bound to one document. Equality is identity.
 */
public interface PeerConnection {

    /**
     * Short id used in logs.
     */
    String id();

    /**
     * Address used for admission decisions, or {@code null} if unknown.
     */
    InetAddress remoteAddress();

    /**
     * Queues a message for the client. Never blocks; a no-op once the connection is closed.
     */
    void send(SyncMessage message);

    /**
     * Closes the connection with the given status. Idempotent.
     */
    void close(WebSocketCloseStatus status);
}
