package io.codesync.store;

import io.codesync.document.DocumentKey;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Non-durable store for development runs and tests.
 */
public final class InMemoryDocumentStore implements DocumentStore {
    private final ConcurrentMap<DocumentKey, PersistedDocument> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<PersistedDocument> load(final DocumentKey key) {
        return Optional.ofNullable(documents.get(key));
    }

    @Override
    public void save(final DocumentKey key, final PersistedDocument document) {
        documents.put(key, document);
    }

    public int size() {
        return documents.size();
    }
}
