package io.codesync.crdt;

/**
 * A single-character insertion as carried inside an update.
 *
 * @param id      identity of the new item
 * @param lamport Lamport timestamp, orders concurrent inserts after the same origin
 * @param origin  item the new one was inserted after, or {@code null} for the document start
 * @param value   the inserted UTF-16 unit
 */
public record InsertOp(ItemId id, long lamport, ItemId origin, char value) {
}
