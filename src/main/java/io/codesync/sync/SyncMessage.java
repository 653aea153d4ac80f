package io.codesync.sync;

/**
 * One protocol message. The payload is opaque at this layer: a state vector for
 * {@link Kind#SYNC_STEP1}, an update for {@link Kind#SYNC_STEP2} and {@link Kind#UPDATE},
 * presence data for {@link Kind#AWARENESS}.
 */
public record SyncMessage(Kind kind, byte[] payload) {

    public enum Kind {
        SYNC_STEP1,
        SYNC_STEP2,
        UPDATE,
        AWARENESS
    }

    public static SyncMessage step1(final byte[] stateVector) {
        return new SyncMessage(Kind.SYNC_STEP1, stateVector);
    }

    public static SyncMessage step2(final byte[] update) {
        return new SyncMessage(Kind.SYNC_STEP2, update);
    }

    public static SyncMessage update(final byte[] update) {
        return new SyncMessage(Kind.UPDATE, update);
    }

    public static SyncMessage awareness(final byte[] state) {
        return new SyncMessage(Kind.AWARENESS, state);
    }

    @Override
    public String toString() {
        return "SyncMessage{" + kind + ", " + payload.length + " bytes}";
    }
}
