package io.codesync.eviction;

import io.codesync.document.DocumentKey;
import io.codesync.metrics.SyncMetrics;
import io.codesync.persistence.PersistenceScheduler;
import io.codesync.registry.ReplicaEntry;
import io.codesync.registry.ReplicaRegistry;
import io.codesync.test.Await;
import io.codesync.test.RecordingPeer;
import io.codesync.test.TestDocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class EvictionSweeperTest {

    private static final Duration INACTIVITY = Duration.ofMinutes(5);

    private final DocumentKey key = DocumentKey.parse("s1:index.html");
    private final TestDocumentStore store = new TestDocumentStore();
    private final SyncMetrics metrics = new SyncMetrics();
    private final ReplicaRegistry registry = new ReplicaRegistry(store, metrics);
    private final PersistenceScheduler persistence = new PersistenceScheduler(registry, store, metrics, Duration.ofSeconds(30), 1);
    private final EvictionSweeper sweeper = new EvictionSweeper(registry, persistence, metrics, INACTIVITY, Duration.ofMinutes(1));

    @AfterEach
    void tearDown() throws Exception {
        store.releaseSaves();
        sweeper.close();
        persistence.close();
    }

    @Test
    void flushesThenEvictsIdleDocuments() {
        final ReplicaEntry entry = dirtyEntry("<html/>");

        assertEquals(1, sweeper.sweep(later()));

        assertTrue(registry.find(key).isEmpty());
        assertFalse(entry.isDirty());
        assertEquals("<html/>", store.stored(key).orElseThrow().textMirror());
        assertEquals(1L, metrics.evictions());
    }

    @Test
    void keepsRecentlyUsedDocuments() {
        dirtyEntry("x");

        assertEquals(0, sweeper.sweep(System.currentTimeMillis()));
        assertTrue(registry.find(key).isPresent());
        assertEquals(0, store.saves());
    }

    @Test
    void keepsAttachedDocuments() {
        registry.attach(key, new RecordingPeer());

        assertEquals(0, sweeper.sweep(later()));
        assertTrue(registry.find(key).isPresent());
    }

    @Test
    void keepsDocumentWhenFlushFails() {
        dirtyEntry("unsaved");
        store.failSaves(true);

        assertEquals(0, sweeper.sweep(later()));
        assertTrue(registry.find(key).orElseThrow().isDirty());
        assertEquals(0L, metrics.evictions());

        store.failSaves(false);
        assertEquals(1, sweeper.sweep(later()));
    }

    @Test
    void attachDuringFlushKeepsReplica() throws Exception {
        final ReplicaEntry entry = dirtyEntry("draft");
        store.holdSaves();

        final CompletableFuture<Integer> sweep = CompletableFuture.supplyAsync(() -> sweeper.sweep(later()));
        assertTrue(store.awaitSaveEntered(Duration.ofSeconds(5)));

        final RecordingPeer peer = new RecordingPeer();
        assertSame(entry, registry.attach(key, peer));
        store.releaseSaves();

        assertEquals(0, sweep.get(5, TimeUnit.SECONDS));
        assertSame(entry, registry.find(key).orElseThrow());
        assertTrue(entry.isAttached(peer));
    }

    @Test
    void editDuringFlushKeepsReplica() throws Exception {
        final ReplicaEntry entry = dirtyEntry("one");
        store.holdSaves();

        final CompletableFuture<Integer> sweep = CompletableFuture.supplyAsync(() -> sweeper.sweep(later()));
        assertTrue(store.awaitSaveEntered(Duration.ofSeconds(5)));

        synchronized (entry) {
            entry.getState().insert(3, " two");
            entry.markDirty();
        }
        store.releaseSaves();

        assertEquals(0, sweep.get(5, TimeUnit.SECONDS));
        assertTrue(registry.find(key).isPresent());
        assertTrue(entry.isDirty());
    }

    @Test
    void backgroundSweepRunsPeriodically() throws Exception {
        final EvictionSweeper fast = new EvictionSweeper(registry, persistence, metrics, Duration.ofMillis(1), Duration.ofMillis(20));
        try {
            registry.getOrCreate(key);
            fast.start();
            Await.until(() -> registry.size() == 0, "background eviction");
        } finally {
            fast.close();
        }
    }

    @Test
    void sweepAgainstWallClockUsesInactivityTimeout() {
        registry.getOrCreate(key);
        assertEquals(0, sweeper.sweep());
    }

    private ReplicaEntry dirtyEntry(final String text) {
        final ReplicaEntry entry = registry.getOrCreate(key);
        synchronized (entry) {
            entry.getState().insert(0, text);
            entry.markDirty();
        }
        return entry;
    }

    private static long later() {
        return System.currentTimeMillis() + INACTIVITY.toMillis() + 1_000L;
    }
}
