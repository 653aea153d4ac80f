package io.codesync.sync;

import io.codesync.crdt.MalformedUpdateException;
import io.codesync.document.DocumentKey;
import io.codesync.metrics.SyncMetrics;
import io.codesync.persistence.PersistenceScheduler;
import io.codesync.registry.ReplicaEntry;
import io.codesync.registry.ReplicaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies client messages to a document's replica and fans them out to the other
 * connections on that document.
 * <p>
 * Every step for one document runs under that document's lock, so updates are applied
 * and broadcast in one order, and a joining connection receives its baseline before any
 * update that follows it. Different documents never contend.
 */
@Slf4j
@RequiredArgsConstructor
public final class UpdatePipeline {

    private final ReplicaRegistry registry;
    private final PersistenceScheduler persistence;
    private final SyncMetrics metrics;

    /**
     * Attaches {@code connection} to the document and sends it the full current state,
     * this replica's state vector, and the presence of the connections already there.
     */
    public ReplicaEntry join(final DocumentKey key, final PeerConnection connection) {
        return registry.attach(key, connection, entry -> {
            connection.send(SyncMessage.step2(entry.getState().encodeStateAsUpdate()));
            connection.send(SyncMessage.step1(entry.getState().encodeStateVector()));
            for (final byte[] presence : entry.awarenessExcept(connection)) {
                connection.send(SyncMessage.awareness(presence));
            }
        });
    }

    public void leave(final ReplicaEntry entry, final PeerConnection connection) {
        registry.detach(entry, connection);
    }

    /**
     * Merges {@code update} into the replica, then forwards the same bytes to every other
     * attached connection and schedules a durable write.
     *
     * @return {@code false} if {@code from} is no longer attached and the update was ignored
     * @throws MalformedUpdateException if the update cannot be decoded; nothing was changed or sent
     */
    public boolean onClientUpdate(final ReplicaEntry entry, final PeerConnection from, final byte[] update) {
        synchronized (entry) {
            if (!entry.isAttached(from)) {
                log.debug("Ignoring update from detached connection {} on {}", from.id(), entry.getKey());
                return false;
            }

            entry.getState().applyUpdate(update);
            entry.markDirty();
            entry.touch();
            metrics.updateApplied();

            final SyncMessage out = SyncMessage.update(update);
            for (final PeerConnection peer : entry.others(from)) {
                peer.send(out);
            }
        }

        persistence.schedulePersist(entry.getKey());
        return true;
    }

    /**
     * Answers a client's state vector with everything the client is missing.
     *
     * @throws MalformedUpdateException if the state vector cannot be decoded
     */
    public boolean onSyncStep1(final ReplicaEntry entry, final PeerConnection from, final byte[] stateVector) {
        synchronized (entry) {
            if (!entry.isAttached(from)) return false;

            from.send(SyncMessage.step2(entry.getState().encodeStateAsUpdate(stateVector)));
            entry.touch();
        }
        return true;
    }

    /**
     * Relays presence data to the other connections. Never touches the replica or the dirty flag.
     */
    public boolean onAwareness(final ReplicaEntry entry, final PeerConnection from, final byte[] payload) {
        synchronized (entry) {
            if (!entry.isAttached(from)) return false;

            entry.rememberAwareness(from, payload);
            entry.touch();

            final SyncMessage out = SyncMessage.awareness(payload);
            for (final PeerConnection peer : entry.others(from)) {
                peer.send(out);
            }
        }
        return true;
    }
}
