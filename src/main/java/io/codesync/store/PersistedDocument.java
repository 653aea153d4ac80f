package io.codesync.store;

import java.time.Instant;

/**
 * Durable snapshot of one document.
 *
 * @param binaryState full-state encoding of the replica; authoritative
 * @param textMirror  plain-text projection for readers that cannot decode {@code binaryState}
 * @param updatedAt   time the snapshot was taken
 */
public record PersistedDocument(byte[] binaryState, String textMirror, Instant updatedAt) {
}
