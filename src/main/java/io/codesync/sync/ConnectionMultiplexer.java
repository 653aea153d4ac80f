package io.codesync.sync;

import io.codesync.admission.AdmissionControl;
import io.codesync.crdt.MalformedUpdateException;
import io.codesync.document.DocumentKey;
import io.codesync.document.InvalidDocumentKeyException;
import io.codesync.metrics.SyncMetrics;
import io.codesync.registry.ReplicaEntry;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Binds transport connections to documents.
 * <p>
 * Callbacks for one connection must not run concurrently with each other; callbacks for
 * different connections may.
 */
@Slf4j
public final class ConnectionMultiplexer {
    private final UpdatePipeline pipeline;
    private final AdmissionControl admission;
    private final SyncMetrics metrics;

    private final ConcurrentMap<PeerConnection, ReplicaEntry> attachments = new ConcurrentHashMap<>();

    public ConnectionMultiplexer(final UpdatePipeline pipeline,
                                 final AdmissionControl admission,
                                 final SyncMetrics metrics) {
        this.pipeline = pipeline;
        this.admission = admission;
        this.metrics = metrics;
    }

    /**
     * Validates the key, asks admission control, then attaches the connection and sends its
     * baseline. A rejected connection is closed with a policy-violation status and never
     * reaches the registry.
     *
     * @param rawKey URL-decoded {@code sessionId:filePath}, or {@code null} if the transport could not decode it
     * @return {@code true} if the connection was attached
     */
    public boolean onConnect(final PeerConnection connection, final String rawKey) {
        final DocumentKey key;
        try {
            key = DocumentKey.parse(rawKey);
        } catch (final InvalidDocumentKeyException e) {
            reject(connection, e.getMessage());
            return false;
        }

        boolean admitted;
        try {
            admitted = admission.tryAdmit(connection.remoteAddress());
        } catch (final RuntimeException e) {
            log.warn("Admission check failed for connection {}: {}", connection.id(), e.toString());
            admitted = false;
        }
        if (!admitted) {
            reject(connection, "connection rate limit exceeded");
            return false;
        }

        final ReplicaEntry entry = pipeline.join(key, connection);
        attachments.put(connection, entry);
        metrics.connectionAccepted();
        log.info("Connection {} attached to {} ({} attached)", connection.id(), key, entry.attachedCount());
        return true;
    }

    /**
     * Routes one message from an attached connection. A malformed payload closes that
     * connection only; the document and its other connections are unaffected.
     */
    public void onMessage(final PeerConnection connection, final SyncMessage message) {
        final ReplicaEntry entry = attachments.get(connection);
        if (entry == null) {
            log.debug("Dropping {} from unattached connection {}", message, connection.id());
            return;
        }

        try {
            switch (message.kind()) {
                case SYNC_STEP1 -> pipeline.onSyncStep1(entry, connection, message.payload());
                case SYNC_STEP2, UPDATE -> pipeline.onClientUpdate(entry, connection, message.payload());
                case AWARENESS -> pipeline.onAwareness(entry, connection, message.payload());
            }
        } catch (final MalformedUpdateException e) {
            metrics.updateMalformed();
            log.warn("Closing connection {} on {}: malformed {}: {}",
                    connection.id(), entry.getKey(), message.kind(), e.getMessage());
            onDisconnect(connection);
            connection.close(WebSocketCloseStatus.INVALID_PAYLOAD_DATA);
        }
    }

    /**
     * Detaches the connection from its document. Idempotent.
     *
     * @return {@code true} if the connection was attached
     */
    public boolean onDisconnect(final PeerConnection connection) {
        final ReplicaEntry entry = attachments.remove(connection);
        if (entry == null) return false;

        pipeline.leave(entry, connection);
        log.info("Connection {} detached from {} ({} attached)", connection.id(), entry.getKey(), entry.attachedCount());
        return true;
    }

    private void reject(final PeerConnection connection, final String reason) {
        metrics.connectionRejected();
        log.warn("Rejected connection {} from {}: {}", connection.id(), connection.remoteAddress(), reason);
        connection.close(WebSocketCloseStatus.POLICY_VIOLATION);
    }
}
