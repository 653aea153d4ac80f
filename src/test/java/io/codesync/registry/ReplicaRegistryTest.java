package io.codesync.registry;

import io.codesync.crdt.TextDocument;
import io.codesync.document.DocumentKey;
import io.codesync.metrics.SyncMetrics;
import io.codesync.store.PersistedDocument;
import io.codesync.test.RecordingPeer;
import io.codesync.test.TestDocumentStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ReplicaRegistryTest {

    private final DocumentKey key = DocumentKey.parse("s1:main.py");
    private final TestDocumentStore store = new TestDocumentStore();
    private final SyncMetrics metrics = new SyncMetrics();
    private final ReplicaRegistry registry = new ReplicaRegistry(store, metrics);

    @Test
    void newDocumentStartsEmptyAndClean() {
        final ReplicaEntry entry = registry.getOrCreate(key);

        assertEquals("", entry.getState().getText());
        assertFalse(entry.isDirty());
        assertSame(entry, registry.getOrCreate(key));
        assertEquals(1, store.loads());
        assertEquals(1L, metrics.gauge(SyncMetrics.RESIDENT_REPLICAS));
    }

    @Test
    void restoresStoredSnapshot() {
        final TextDocument original = new TextDocument(5L);
        original.insert(0, "print('hi')");
        store.put(key, new PersistedDocument(original.encodeStateAsUpdate(), original.getText(), Instant.now()));

        final ReplicaEntry entry = registry.getOrCreate(key);
        assertEquals("print('hi')", entry.getState().getText());
        assertFalse(entry.isDirty());
    }

    @Test
    void concurrentFirstAccessLoadsOnce() throws Exception {
        store.loadDelay(Duration.ofMillis(100));
        final int threads = 8;
        final ExecutorService pool = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);
        final Set<ReplicaEntry> seen = ConcurrentHashMap.newKeySet();

        try {
            final List<CompletableFuture<Void>> calls = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                calls.add(CompletableFuture.runAsync(() -> {
                    try {
                        start.await();
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    seen.add(registry.attach(key, new RecordingPeer()));
                }, pool));
            }
            start.countDown();
            CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, store.loads());
        assertEquals(1, seen.size());
        assertEquals(threads, seen.iterator().next().attachedCount());
        assertEquals(threads, metrics.gauge(SyncMetrics.ATTACHED_CONNECTIONS));
    }

    @Test
    void slowLoadDoesNotHoldUpOtherDocuments() throws Exception {
        final DocumentKey other = sameBinAs(key);
        store.holdLoad(key);
        final ExecutorService pool = Executors.newFixedThreadPool(3);

        try {
            final CompletableFuture<ReplicaEntry> slow = CompletableFuture.supplyAsync(() -> registry.getOrCreate(key), pool);
            assertTrue(store.awaitLoadEntered(Duration.ofSeconds(5)));
            final CompletableFuture<ReplicaEntry> joiner = CompletableFuture.supplyAsync(() -> registry.getOrCreate(key), pool);

            final ReplicaEntry fast = CompletableFuture.supplyAsync(() -> registry.getOrCreate(other), pool)
                    .get(2, TimeUnit.SECONDS);
            assertEquals(other, fast.getKey());
            assertFalse(slow.isDone());

            store.releaseLoad();
            final ReplicaEntry loaded = slow.get(5, TimeUnit.SECONDS);
            assertSame(loaded, joiner.get(5, TimeUnit.SECONDS));
            assertSame(loaded, registry.getOrCreate(key));
            assertEquals(2, store.loads());
        } finally {
            store.releaseLoad();
            pool.shutdownNow();
        }
    }

    @Test
    void loadFailureStartsEmptyDirtyReplica() {
        store.failLoads(true);

        final ReplicaEntry entry = registry.getOrCreate(key);

        assertEquals("", entry.getState().getText());
        assertTrue(entry.isDirty());
        assertEquals(1L, metrics.loadFailures());
    }

    @Test
    void attachRunsCallbackWhileHoldingDocumentLock() {
        final RecordingPeer peer = new RecordingPeer();

        registry.attach(key, peer, entry -> {
            assertTrue(Thread.holdsLock(entry));
            assertTrue(entry.isAttached(peer));
        });
    }

    @Test
    void lastDetachNotifiesListenerOnceAndDetachIsIdempotent() {
        final List<DocumentKey> notified = new ArrayList<>();
        registry.onLastDetach(notified::add);

        final RecordingPeer a = new RecordingPeer();
        final RecordingPeer b = new RecordingPeer();
        final ReplicaEntry entry = registry.attach(key, a);
        registry.attach(key, b);

        assertTrue(registry.detach(entry, a));
        assertTrue(notified.isEmpty());
        assertTrue(registry.detach(entry, b));
        assertFalse(registry.detach(entry, b));

        assertEquals(List.of(key), notified);
        assertEquals(0, entry.attachedCount());
    }

    @Test
    void failingListenerDoesNotBreakDetach() {
        registry.onLastDetach(k -> {
            throw new IllegalStateException("boom");
        });
        final RecordingPeer peer = new RecordingPeer();
        final ReplicaEntry entry = registry.attach(key, peer);

        assertTrue(registry.detach(entry, peer));
        assertFalse(entry.isAttached(peer));
    }

    @Test
    void removeRefusesAttachedOrDirtyEntries() {
        final RecordingPeer peer = new RecordingPeer();
        final ReplicaEntry entry = registry.attach(key, peer);

        assertFalse(registry.remove(key));

        registry.detach(entry, peer);
        entry.markDirty();
        assertFalse(registry.remove(key));

        assertTrue(entry.markClean(entry.version()));
        assertTrue(registry.remove(key));
        assertTrue(registry.find(key).isEmpty());
        assertEquals(1L, metrics.evictions());
        assertFalse(registry.remove(key));
    }

    @Test
    void attachAfterRemovalReloadsFreshEntry() {
        final ReplicaEntry first = registry.getOrCreate(key);
        assertTrue(registry.remove(key));

        final ReplicaEntry second = registry.attach(key, new RecordingPeer());
        assertNotSame(first, second);
        assertEquals(2, store.loads());
        assertEquals(1, registry.size());
    }

    @Test
    void touchRefreshesLastAccess() throws Exception {
        final ReplicaEntry entry = registry.getOrCreate(key);
        final long before = entry.getLastAccess();

        Thread.sleep(5L);
        registry.touch(key);
        assertTrue(entry.getLastAccess() > before);

        registry.touch(DocumentKey.parse("s1:unknown.txt"));
        assertEquals(1, registry.size());
    }

    @Test
    void markCleanKeepsNewerEdits() {
        final ReplicaEntry entry = registry.getOrCreate(key);
        entry.markDirty();
        final long snapshot = entry.version();
        entry.markDirty();

        assertFalse(entry.markClean(snapshot));
        assertTrue(entry.isDirty());
        assertTrue(entry.markClean(entry.version()));
    }

    @Test
    void awarenessIsForgottenOnDetach() {
        final RecordingPeer a = new RecordingPeer();
        final RecordingPeer b = new RecordingPeer();
        final ReplicaEntry entry = registry.attach(key, a);
        registry.attach(key, b);

        entry.rememberAwareness(a, new byte[]{1});
        entry.rememberAwareness(b, new byte[]{2});
        assertEquals(1, entry.awarenessExcept(b).size());
        assertArrayEquals(new byte[]{1}, entry.awarenessExcept(b).get(0));

        registry.detach(entry, a);
        assertTrue(entry.awarenessExcept(b).isEmpty());
        assertEquals(List.of(b), entry.others(a));
    }

    /* A key that lands in the same bin of a default-sized ConcurrentHashMap. */
    private static DocumentKey sameBinAs(final DocumentKey key) {
        for (int i = 0; ; i++) {
            final DocumentKey candidate = DocumentKey.parse("s2:f" + i + ".js");
            if (bin(candidate) == bin(key)) return candidate;
        }
    }

    private static int bin(final DocumentKey key) {
        final int h = key.hashCode();
        return (h ^ (h >>> 16)) & 15;
    }
}
