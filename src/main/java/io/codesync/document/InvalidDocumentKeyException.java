package io.codesync.document;

/**
 * Raised for a raw document key that does not name a valid {@code sessionId:filePath} pair.
 */
public final class InvalidDocumentKeyException extends IllegalArgumentException {

    public InvalidDocumentKeyException(final String message) {
        super(message);
    }
}
