package io.codesync.registry;

import io.codesync.crdt.TextDocument;
import io.codesync.document.DocumentKey;
import io.codesync.sync.PeerConnection;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live replica of one document plus its bookkeeping.
 * <p>
 * The entry's monitor is the per-document lock: state mutation, fan-out membership and
 * the dirty flag are only touched while holding it, so everything done under one
 * {@code synchronized (entry)} block is ordered against every other block on the same
 * document. Durable writes take {@link #getPersistLock()} instead, so a slow store never
 * holds up editing.
 */
public final class ReplicaEntry {

    @Getter private final DocumentKey key;
    @Getter private final TextDocument state;
    @Getter private final ReentrantLock persistLock = new ReentrantLock();

    private volatile long lastAccess;

    /* guarded by this */
    private final Set<PeerConnection> connections = new LinkedHashSet<>();
    private final Map<PeerConnection, byte[]> awareness = new LinkedHashMap<>();
    private boolean dirty;
    private long version;
    private boolean evicted;

    ReplicaEntry(final DocumentKey key, final TextDocument state, final boolean dirty) {
        this.key = key;
        this.state = state;
        this.dirty = dirty;
        this.lastAccess = System.currentTimeMillis();
    }

    public long getLastAccess() {
        return lastAccess;
    }

    public void touch() {
        lastAccess = System.currentTimeMillis();
    }

    public synchronized int attachedCount() {
        return connections.size();
    }

    public synchronized boolean isAttached(final PeerConnection connection) {
        return connections.contains(connection);
    }

    /**
     * Attached connections other than {@code exclude}, in attach order.
     */
    public synchronized List<PeerConnection> others(final PeerConnection exclude) {
        final List<PeerConnection> out = new ArrayList<>(connections.size());
        for (final PeerConnection c : connections) {
            if (c != exclude) out.add(c);
        }
        return out;
    }

    public synchronized void rememberAwareness(final PeerConnection connection, final byte[] payload) {
        if (connections.contains(connection)) {
            awareness.put(connection, payload);
        }
    }

    /**
     * Last presence payload of every attached connection except {@code exclude}.
     */
    public synchronized List<byte[]> awarenessExcept(final PeerConnection exclude) {
        final List<byte[]> out = new ArrayList<>(awareness.size());
        awareness.forEach((c, payload) -> {
            if (c != exclude) out.add(payload);
        });
        return out;
    }

    /**
     * Records a mutation of {@link #getState()}.
     */
    public synchronized void markDirty() {
        dirty = true;
        version++;
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    /**
     * Mutation counter; a snapshot taken at version {@code v} is current while this still equals {@code v}.
     */
    public synchronized long version() {
        return version;
    }

    /**
     * Clears the dirty flag if nothing changed since the snapshot at {@code persistedVersion}.
     *
     * @return {@code true} if the entry is now clean
     */
    public synchronized boolean markClean(final long persistedVersion) {
        if (version == persistedVersion) {
            dirty = false;
        }
        return !dirty;
    }

    synchronized boolean isEvicted() {
        return evicted;
    }

    synchronized void addConnection(final PeerConnection connection) {
        connections.add(connection);
        touch();
    }

    /* Fan-out membership and the attachment count are the same set, so they cannot disagree. */
    synchronized boolean removeConnection(final PeerConnection connection) {
        if (!connections.remove(connection)) {
            return false;
        }
        awareness.remove(connection);
        touch();
        return true;
    }

    synchronized void markEvicted() {
        evicted = true;
    }

    @Override
    public String toString() {
        return "ReplicaEntry{" + key + '}';
    }
}
