package io.codesync.registry;

import io.codesync.crdt.TextDocument;
import io.codesync.document.DocumentKey;
import io.codesync.metrics.SyncMetrics;
import io.codesync.store.DocumentStore;
import io.codesync.store.PersistedDocument;
import io.codesync.sync.PeerConnection;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Owns every live {@link ReplicaEntry}. Entries are created on first attach (loading the
 * stored snapshot exactly once) and removed only by the eviction sweeper through
 * {@link #remove(DocumentKey)}.
 */
@Slf4j
public final class ReplicaRegistry {
    private final DocumentStore store;
    private final SyncMetrics metrics;
    private final ConcurrentMap<DocumentKey, ReplicaEntry> entries = new ConcurrentHashMap<>();

    /* Loads in flight; the store is never called while a map lock is held. */
    private final ConcurrentMap<DocumentKey, CompletableFuture<ReplicaEntry>> loading = new ConcurrentHashMap<>();

    private volatile Consumer<DocumentKey> lastDetachListener = key -> { };

    public ReplicaRegistry(final DocumentStore store, final SyncMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
        metrics.registerGauge(SyncMetrics.RESIDENT_REPLICAS, entries::size);
        metrics.registerGauge(SyncMetrics.ATTACHED_CONNECTIONS, this::attachedConnections);
    }

    /**
     * Called with the document key whenever a detach leaves a document with no connections.
     * Must not block.
     */
    public void onLastDetach(final Consumer<DocumentKey> listener) {
        this.lastDetachListener = listener;
    }

    /**
     * Returns the live entry for {@code key}, loading it from the store if absent.
     * Concurrent callers for the same key share one load; other keys are never held up by it.
     */
    public ReplicaEntry getOrCreate(final DocumentKey key) {
        final ReplicaEntry existing = entries.get(key);
        if (existing != null) return existing;

        final CompletableFuture<ReplicaEntry> mine = new CompletableFuture<>();
        final CompletableFuture<ReplicaEntry> inFlight = loading.putIfAbsent(key, mine);
        if (inFlight != null) {
            return inFlight.join();
        }

        try {
            /* Another loader may have published between the first lookup and claiming the slot. */
            ReplicaEntry entry = entries.get(key);
            if (entry == null) {
                entry = load(key);
                entries.put(key, entry);
            }
            mine.complete(entry);
            return entry;
        } catch (final RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            loading.remove(key, mine);
        }
    }

    public Optional<ReplicaEntry> find(final DocumentKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void touch(final DocumentKey key) {
        final ReplicaEntry entry = entries.get(key);
        if (entry != null) entry.touch();
    }

    /**
     * Binds {@code connection} to the document, creating the entry if needed, then runs
     * {@code whileLocked} under the document lock so nothing can be broadcast to the new
     * connection before it.
     */
    public ReplicaEntry attach(final DocumentKey key,
                               final PeerConnection connection,
                               final Consumer<ReplicaEntry> whileLocked) {
        while (true) {
            final ReplicaEntry entry = getOrCreate(key);
            synchronized (entry) {
                /* Lost a race with the sweeper; the next getOrCreate reloads the flushed state. */
                if (entry.isEvicted()) continue;

                entry.addConnection(connection);
                whileLocked.accept(entry);
                return entry;
            }
        }
    }

    public ReplicaEntry attach(final DocumentKey key, final PeerConnection connection) {
        return attach(key, connection, e -> { });
    }

    /**
     * Unbinds {@code connection}. Safe to call more than once.
     *
     * @return {@code true} if the connection was attached
     */
    public boolean detach(final ReplicaEntry entry, final PeerConnection connection) {
        final int remaining;
        synchronized (entry) {
            if (!entry.removeConnection(connection)) {
                return false;
            }
            remaining = entry.attachedCount();
        }

        if (remaining == 0) {
            try {
                lastDetachListener.accept(entry.getKey());
            } catch (final RuntimeException e) {
                log.error("Last-detach listener failed for {}", entry.getKey(), e);
            }
        }
        return true;
    }

    /**
     * Drops the entry if it still has no connections and no unsaved changes.
     *
     * @return {@code true} if the entry was removed
     */
    public boolean remove(final DocumentKey key) {
        final ReplicaEntry entry = entries.get(key);
        if (entry == null) return false;

        synchronized (entry) {
            if (entry.attachedCount() > 0 || entry.isDirty()) {
                return false;
            }
            entry.markEvicted();
            entries.remove(key, entry);
        }

        metrics.evicted();
        log.info("Evicted idle document {}", key);
        return true;
    }

    public Collection<ReplicaEntry> entries() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public int attachedConnections() {
        int total = 0;
        for (final ReplicaEntry entry : entries.values()) {
            total += entry.attachedCount();
        }
        return total;
    }

    private ReplicaEntry load(final DocumentKey key) {
        try {
            final Optional<PersistedDocument> persisted = store.load(key);
            if (persisted.isEmpty()) {
                log.debug("New document {}", key);
                return new ReplicaEntry(key, new TextDocument(), false);
            }

            final TextDocument state = TextDocument.fromState(persisted.get().binaryState());
            log.debug("Loaded document {} ({} chars)", key, state.length());
            return new ReplicaEntry(key, state, false);
        } catch (final IOException | RuntimeException e) {
            metrics.loadFailed();
            log.warn("Failed to load document {}, starting from an empty replica: {}", key, e.toString());
            return new ReplicaEntry(key, new TextDocument(), true);
        }
    }
}
