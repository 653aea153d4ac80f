package io.codesync.persistence;

import io.codesync.document.DocumentKey;
import io.codesync.metrics.SyncMetrics;
import io.codesync.registry.ReplicaEntry;
import io.codesync.registry.ReplicaRegistry;
import io.codesync.store.DocumentStore;
import io.codesync.store.PersistedDocument;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Debounced durable writes of live replicas.
 * <p>
 * The first mutation after a quiet period arms one timer per document; later mutations
 * inside the window ride on it, so a burst of edits costs one write. {@link #flushNow}
 * preempts the timer and writes immediately. A failed write leaves the entry dirty; the
 * next trigger (update, last detach, sweep) tries again.
 */
@Slf4j
public final class PersistenceScheduler implements AutoCloseable {
    private final ReplicaRegistry registry;
    private final DocumentStore store;
    private final SyncMetrics metrics;
    private final long debounceMillis;

    private final ConcurrentMap<DocumentKey, Timer> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService executor;

    public PersistenceScheduler(final ReplicaRegistry registry,
                                final DocumentStore store,
                                final SyncMetrics metrics,
                                final Duration debounce,
                                final int threads) {
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce must be >= 0");
        }
        this.registry = registry;
        this.store = store;
        this.metrics = metrics;
        this.debounceMillis = debounce.toMillis();

        final AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(threads, r -> {
            final Thread t = new Thread(r, "persist-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        registry.onLastDetach(this::requestFlush);
    }

    /**
     * Arms the debounce timer for {@code key} unless one is already pending.
     */
    public void schedulePersist(final DocumentKey key) {
        /* The timer's own remove() blocks on this bin until the future is stored. */
        pending.computeIfAbsent(key, k -> {
            final Timer timer = new Timer();
            timer.future = executor.schedule(() -> fire(k, timer), debounceMillis, TimeUnit.MILLISECONDS);
            return timer;
        });
    }

    /**
     * Cancels any pending timer for {@code key} and writes now, on the calling thread.
     *
     * @return {@code true} if the document is clean afterwards (written, or nothing to write)
     */
    public boolean flushNow(final DocumentKey key) {
        final Timer timer = pending.remove(key);
        if (timer != null) {
            timer.future.cancel(false);
        }
        return persist(key);
    }

    /**
     * {@link #flushNow} on a background thread.
     */
    public CompletableFuture<Boolean> requestFlush(final DocumentKey key) {
        return CompletableFuture.supplyAsync(() -> flushNow(key), executor);
    }

    /**
     * Flushes every resident document in parallel, waiting at most {@code grace}.
     *
     * @return number of documents confirmed clean within the grace period
     */
    public int flushAll(final Duration grace) throws InterruptedException {
        final List<CompletableFuture<Boolean>> flushes = new ArrayList<>();
        for (final ReplicaEntry entry : registry.entries()) {
            flushes.add(requestFlush(entry.getKey()));
        }

        try {
            CompletableFuture.allOf(flushes.toArray(new CompletableFuture[0]))
                    .get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            log.warn("Shutdown flush did not finish within {}; abandoning outstanding writes", grace);
        } catch (final ExecutionException e) {
            log.error("Shutdown flush failed", e.getCause());
        }

        int clean = 0;
        for (final CompletableFuture<Boolean> f : flushes) {
            if (f.isDone() && !f.isCompletedExceptionally() && f.join()) clean++;
        }
        if (clean < flushes.size()) {
            log.warn("{} of {} documents were not persisted at shutdown", flushes.size() - clean, flushes.size());
        }
        return clean;
    }

    public boolean hasPendingTimer(final DocumentKey key) {
        return pending.containsKey(key);
    }

    Timer pendingTimer(final DocumentKey key) {
        return pending.get(key);
    }

    /* A preempted timer that was already running must not unmap its successor. */
    void fire(final DocumentKey key, final Timer timer) {
        pending.remove(key, timer);
        persist(key);
    }

    private boolean persist(final DocumentKey key) {
        final Optional<ReplicaEntry> found = registry.find(key);
        if (found.isEmpty()) return true;

        final ReplicaEntry entry = found.get();
        entry.getPersistLock().lock();
        try {
            final long version;
            final byte[] state;
            final String text;
            synchronized (entry) {
                if (!entry.isDirty()) return true;
                version = entry.version();
                state = entry.getState().encodeStateAsUpdate();
                text = entry.getState().getText();
            }

            store.save(key, new PersistedDocument(state, text, Instant.now()));
            metrics.writeSucceeded();

            final boolean clean = entry.markClean(version);
            log.debug("Persisted {} ({} bytes, clean={})", key, state.length, clean);
            return clean;
        } catch (final IOException | RuntimeException e) {
            metrics.writeFailed();
            log.warn("Failed to persist {}; will retry on next trigger: {}", key, e.toString());
            return false;
        } finally {
            entry.getPersistLock().unlock();
        }
    }

    static final class Timer {
        volatile ScheduledFuture<?> future;
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }
}
