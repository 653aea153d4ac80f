package io.codesync.store;

import io.codesync.document.DocumentKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryDocumentStoreTest {

    @Test
    void keepsLatestSnapshotPerKey() {
        final InMemoryDocumentStore store = new InMemoryDocumentStore();
        final DocumentKey a = DocumentKey.parse("s1:a.txt");
        final DocumentKey b = DocumentKey.parse("s2:a.txt");

        store.save(a, new PersistedDocument(new byte[]{1}, "one", Instant.now()));
        store.save(a, new PersistedDocument(new byte[]{2}, "two", Instant.now()));

        assertEquals("two", store.load(a).orElseThrow().textMirror());
        assertTrue(store.load(b).isEmpty());
        assertEquals(1, store.size());
    }
}
