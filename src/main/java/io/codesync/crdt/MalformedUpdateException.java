package io.codesync.crdt;

/**
 * Raised when an update or state-vector payload cannot be decoded.
 * The replica the payload was meant for is left untouched.
 */
public final class MalformedUpdateException extends IllegalArgumentException {

    public MalformedUpdateException(final String message) {
        super(message);
    }

    public MalformedUpdateException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
