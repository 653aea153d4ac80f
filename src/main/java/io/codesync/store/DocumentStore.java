package io.codesync.store;

import io.codesync.document.DocumentKey;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable home of document snapshots. Implementations must be safe for concurrent use
 * across different keys; callers never issue two writes for the same key at once.
 */
public interface DocumentStore {

    /**
     * Returns the last snapshot saved for {@code key}, or empty if none was ever saved.
     */
    Optional<PersistedDocument> load(DocumentKey key) throws IOException;

    /**
     * Replaces the snapshot for {@code key}.
     */
    void save(DocumentKey key, PersistedDocument document) throws IOException;
}
