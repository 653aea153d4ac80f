package io.codesync.crdt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Replicated text (RGA). Every character is an item with a stable {@link ItemId};
 * concurrent inserts after the same origin are ordered by Lamport timestamp, then
 * by client id, so every replica that has seen the same items renders the same text.
 * Deleted items stay in place as tombstones.
 * <p>
 * Updates may arrive in any order and more than once. Items whose dependencies are
 * still unknown are parked until those dependencies arrive.
 * <p>
 * Not thread-safe: the owner must serialize all access to one instance.
 */
public final class TextDocument {

    private static final Comparator<Item> CAUSAL_ORDER =
            Comparator.comparingLong((Item i) -> i.lamport).thenComparingLong(i -> i.id.client());

    private final long clientId;

    /* Document order, tombstones included. */
    private final List<Item> items = new ArrayList<>();
    private final Map<ItemId, Item> byId = new HashMap<>();

    /* client -> next expected seq */
    private final Map<Long, Long> stateVector = new HashMap<>();

    /* Parked until their origin and every earlier seq of their client are integrated. */
    private final Map<ItemId, InsertOp> pendingInserts = new LinkedHashMap<>();
    private final Set<ItemId> pendingDeletes = new LinkedHashSet<>();

    private long lamport;

    public TextDocument() {
        this(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE));
    }

    public TextDocument(final long clientId) {
        this.clientId = clientId;
    }

    /**
     * Rebuilds a replica from a full-state encoding produced by {@link #encodeStateAsUpdate()}.
     *
     * @throws MalformedUpdateException if {@code state} cannot be decoded
     */
    public static TextDocument fromState(final byte[] state) {
        final TextDocument doc = new TextDocument();
        doc.applyUpdate(state);
        return doc;
    }

    public long clientId() {
        return clientId;
    }

    /**
     * Inserts {@code text} before the visible character at {@code index}.
     *
     * @return the update describing this change, for other replicas
     */
    public byte[] insert(final int index, final String text) {
        if (index < 0 || index > length()) {
            throw new IndexOutOfBoundsException("index " + index + ", length " + length());
        }

        ItemId origin = index == 0 ? null : visibleAt(index - 1).id;
        final List<InsertOp> ops = new ArrayList<>(text.length());

        for (int i = 0; i < text.length(); i++) {
            final InsertOp op = new InsertOp(
                    new ItemId(clientId, nextSeq(clientId)),
                    lamport + 1,
                    origin,
                    text.charAt(i));
            integrate(op);
            ops.add(op);
            origin = op.id();
        }
        return UpdateCodec.encodeUpdate(ops, List.of());
    }

    /**
     * Deletes {@code count} visible characters starting at {@code index}.
     *
     * @return the update describing this change, for other replicas
     */
    public byte[] delete(final int index, final int count) {
        if (index < 0 || count < 0 || index + count > length()) {
            throw new IndexOutOfBoundsException("range [" + index + ", " + (index + count) + "), length " + length());
        }

        final List<ItemId> deleted = new ArrayList<>(count);
        int visible = 0;
        for (final Item item : items) {
            if (item.deleted) continue;
            if (visible >= index + count) break;
            if (visible >= index) {
                item.deleted = true;
                deleted.add(item.id);
            }
            visible++;
        }
        return UpdateCodec.encodeUpdate(List.of(), deleted);
    }

    /**
     * Merges a remote update. Applying the same update twice, or updates in a different
     * order, converges to the same content.
     *
     * @return {@code true} if anything new was integrated
     * @throws MalformedUpdateException if the payload cannot be decoded; the replica is unchanged
     */
    public boolean applyUpdate(final byte[] update) {
        final UpdateCodec.Update decoded = UpdateCodec.decodeUpdate(update);

        boolean changed = false;
        for (final InsertOp op : decoded.inserts()) {
            changed |= offerInsert(op);
        }
        for (final ItemId id : decoded.deletes()) {
            changed |= offerDelete(id);
        }
        if (changed) {
            changed |= drainPending();
        }
        return changed;
    }

    /**
     * Full state, decodable by {@link #fromState(byte[])} or {@link #applyUpdate(byte[])}.
     */
    public byte[] encodeStateAsUpdate() {
        return encodeStateAsUpdate(Map.of());
    }

    /**
     * Everything this replica holds that a peer with the given state vector lacks.
     *
     * @throws MalformedUpdateException if {@code remoteStateVector} cannot be decoded
     */
    public byte[] encodeStateAsUpdate(final byte[] remoteStateVector) {
        return encodeStateAsUpdate(UpdateCodec.decodeStateVector(remoteStateVector));
    }

    public byte[] encodeStateVector() {
        return UpdateCodec.encodeStateVector(stateVector);
    }

    public String getText() {
        final StringBuilder sb = new StringBuilder(items.size());
        for (final Item item : items) {
            if (!item.deleted) sb.append(item.value);
        }
        return sb.toString();
    }

    public int length() {
        int n = 0;
        for (final Item item : items) {
            if (!item.deleted) n++;
        }
        return n;
    }

    /**
     * Number of parked inserts and deletes waiting for their dependencies.
     */
    public int pendingCount() {
        return pendingInserts.size() + pendingDeletes.size();
    }

    private byte[] encodeStateAsUpdate(final Map<Long, Long> remote) {
        final List<Item> missing = new ArrayList<>();
        final List<ItemId> tombstones = new ArrayList<>();

        for (final Item item : items) {
            if (item.id.seq() >= remote.getOrDefault(item.id.client(), 0L)) {
                missing.add(item);
            }
            if (item.deleted) {
                tombstones.add(item.id);
            }
        }

        /* Lamport order puts every origin and every earlier seq of a client first. */
        missing.sort(CAUSAL_ORDER);

        final List<InsertOp> ops = new ArrayList<>(missing.size() + pendingInserts.size());
        for (final Item item : missing) {
            ops.add(new InsertOp(item.id, item.lamport, item.origin, item.value));
        }

        /* Parked items were accepted too; the receiver parks them again. */
        for (final InsertOp op : pendingInserts.values()) {
            if (op.id().seq() >= remote.getOrDefault(op.id().client(), 0L)) {
                ops.add(op);
            }
        }
        tombstones.addAll(pendingDeletes);
        return UpdateCodec.encodeUpdate(ops, tombstones);
    }

    private boolean offerInsert(final InsertOp op) {
        final long expected = nextSeq(op.id().client());
        if (op.id().seq() < expected) {
            return false;
        }
        if (op.id().seq() > expected || (op.origin() != null && !byId.containsKey(op.origin()))) {
            pendingInserts.putIfAbsent(op.id(), op);
            return false;
        }
        integrate(op);
        return true;
    }

    private boolean offerDelete(final ItemId id) {
        final Item item = byId.get(id);
        if (item == null) {
            pendingDeletes.add(id);
            return false;
        }
        if (item.deleted) {
            return false;
        }
        item.deleted = true;
        return true;
    }

    private boolean drainPending() {
        boolean changed = false;
        boolean progress = true;

        while (progress) {
            progress = false;

            final Iterator<InsertOp> inserts = pendingInserts.values().iterator();
            while (inserts.hasNext()) {
                final InsertOp op = inserts.next();
                final long expected = nextSeq(op.id().client());
                if (op.id().seq() < expected) {
                    inserts.remove();
                } else if (op.id().seq() == expected && (op.origin() == null || byId.containsKey(op.origin()))) {
                    inserts.remove();
                    integrate(op);
                    progress = true;
                }
            }

            final Iterator<ItemId> deletes = pendingDeletes.iterator();
            while (deletes.hasNext()) {
                final Item item = byId.get(deletes.next());
                if (item != null) {
                    deletes.remove();
                    item.deleted = true;
                    progress = true;
                }
            }
            changed |= progress;
        }
        return changed;
    }

    private void integrate(final InsertOp op) {
        int pos = 0;
        if (op.origin() != null) {
            pos = items.indexOf(byId.get(op.origin())) + 1;
        }

        /* Skip siblings (and their subtrees) that win against the new item. */
        while (pos < items.size() && precedes(items.get(pos), op)) {
            pos++;
        }

        final Item item = new Item(op.id(), op.lamport(), op.origin(), op.value());
        items.add(pos, item);
        byId.put(op.id(), item);
        stateVector.put(op.id().client(), op.id().seq() + 1);
        lamport = Math.max(lamport, op.lamport());
    }

    private static boolean precedes(final Item existing, final InsertOp op) {
        if (existing.lamport != op.lamport()) {
            return existing.lamport > op.lamport();
        }
        return existing.id.client() > op.id().client();
    }

    private long nextSeq(final long client) {
        return stateVector.getOrDefault(client, 0L);
    }

    private Item visibleAt(final int index) {
        int visible = 0;
        for (final Item item : items) {
            if (item.deleted) continue;
            if (visible == index) return item;
            visible++;
        }
        throw new IndexOutOfBoundsException("index " + index);
    }

    private static final class Item {
        final ItemId id;
        final long lamport;
        final ItemId origin;
        final char value;
        boolean deleted;

        Item(final ItemId id, final long lamport, final ItemId origin, final char value) {
            this.id = id;
            this.lamport = lamport;
            this.origin = origin;
            this.value = value;
        }
    }
}
