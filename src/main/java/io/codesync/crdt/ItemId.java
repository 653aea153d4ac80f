package io.codesync.crdt;

/**
 * Identity of one inserted character: the replica that created it and that
 * replica's contiguous sequence number.
 */
public record ItemId(long client, long seq) {

    @Override
    public String toString() {
        return client + "#" + seq;
    }
}
