package io.codesync.crdt;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary layout of updates and state vectors exchanged between replicas.
 * <pre>
 * update       := MAGIC:short VERSION:byte inserts deletes
 * inserts      := count:int (client:long seq:long lamport:long hasOrigin:bool [client:long seq:long] value:char)*
 * deletes      := count:int (client:long seq:long)*
 * state vector := MAGIC:short VERSION:byte count:int (client:long nextSeq:long)*
 * </pre>
 * All values are big-endian.
 */
public final class UpdateCodec {

    /**
     * 0x4353 == 'C' 'S'
     */
    public static final short MAGIC = 0x4353;
    public static final byte VERSION = 1;

    private static final int HEADER_BYTES = 2 + 1;
    private static final int MIN_INSERT_BYTES = 8 + 8 + 8 + 1 + 2;
    private static final int DELETE_BYTES = 8 + 8;
    private static final int VECTOR_ENTRY_BYTES = 8 + 8;

    private UpdateCodec() {
        // Prevent instantiation
    }

    /**
     * Decoded form of an update payload.
     */
    public record Update(List<InsertOp> inserts, List<ItemId> deletes) {
        public boolean isEmpty() {
            return inserts.isEmpty() && deletes.isEmpty();
        }
    }

    public static byte[] encodeUpdate(final Collection<InsertOp> inserts, final Collection<ItemId> deletes) {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream(
                HEADER_BYTES + 8 + inserts.size() * (MIN_INSERT_BYTES + 16) + deletes.size() * DELETE_BYTES);

        try (final DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeShort(MAGIC);
            out.writeByte(VERSION);

            out.writeInt(inserts.size());
            for (final InsertOp op : inserts) {
                out.writeLong(op.id().client());
                out.writeLong(op.id().seq());
                out.writeLong(op.lamport());
                out.writeBoolean(op.origin() != null);
                if (op.origin() != null) {
                    out.writeLong(op.origin().client());
                    out.writeLong(op.origin().seq());
                }
                out.writeChar(op.value());
            }

            out.writeInt(deletes.size());
            for (final ItemId id : deletes) {
                out.writeLong(id.client());
                out.writeLong(id.seq());
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("In-memory encoding failed", e);
        }
        return bytes.toByteArray();
    }

    /**
     * Decodes a complete update. Nothing is returned unless the whole payload is well formed.
     *
     * @throws MalformedUpdateException if the payload is truncated, has trailing bytes,
     *                                  a wrong header or out-of-range fields
     */
    public static Update decodeUpdate(final byte[] payload) {
        final ByteBuffer in = header(payload);

        try {
            final int insertCount = in.getInt();
            if (insertCount < 0 || (long) insertCount * MIN_INSERT_BYTES > in.remaining()) {
                throw new MalformedUpdateException("Insert count out of range: " + insertCount);
            }

            final List<InsertOp> inserts = new ArrayList<>(insertCount);
            for (int i = 0; i < insertCount; i++) {
                final ItemId id = itemId(in);
                final long lamport = in.getLong();
                if (lamport < 0) {
                    throw new MalformedUpdateException("Negative lamport timestamp for " + id);
                }
                final ItemId origin = in.get() != 0 ? itemId(in) : null;
                inserts.add(new InsertOp(id, lamport, origin, in.getChar()));
            }

            final int deleteCount = in.getInt();
            if (deleteCount < 0 || (long) deleteCount * DELETE_BYTES > in.remaining()) {
                throw new MalformedUpdateException("Delete count out of range: " + deleteCount);
            }

            final List<ItemId> deletes = new ArrayList<>(deleteCount);
            for (int i = 0; i < deleteCount; i++) {
                deletes.add(itemId(in));
            }

            if (in.hasRemaining()) {
                throw new MalformedUpdateException(in.remaining() + " trailing bytes after update");
            }
            return new Update(inserts, deletes);
        } catch (final BufferUnderflowException e) {
            throw new MalformedUpdateException("Truncated update", e);
        }
    }

    public static byte[] encodeStateVector(final Map<Long, Long> vector) {
        final ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + 4 + vector.size() * VECTOR_ENTRY_BYTES);
        out.putShort(MAGIC);
        out.put(VERSION);
        out.putInt(vector.size());
        vector.forEach((client, next) -> out.putLong(client).putLong(next));
        return out.array();
    }

    /**
     * @throws MalformedUpdateException if the payload is not a well-formed state vector
     */
    public static Map<Long, Long> decodeStateVector(final byte[] payload) {
        final ByteBuffer in = header(payload);

        try {
            final int count = in.getInt();
            if (count < 0 || (long) count * VECTOR_ENTRY_BYTES != in.remaining()) {
                throw new MalformedUpdateException("State vector size mismatch: " + count);
            }

            final Map<Long, Long> vector = new HashMap<>(count * 2);
            for (int i = 0; i < count; i++) {
                final long client = in.getLong();
                final long next = in.getLong();
                if (next < 0) {
                    throw new MalformedUpdateException("Negative clock for client " + client);
                }
                vector.put(client, next);
            }
            return vector;
        } catch (final BufferUnderflowException e) {
            throw new MalformedUpdateException("Truncated state vector", e);
        }
    }

    private static ByteBuffer header(final byte[] payload) {
        if (payload == null || payload.length < HEADER_BYTES + 4) {
            throw new MalformedUpdateException("Payload too short");
        }

        final ByteBuffer in = ByteBuffer.wrap(payload);
        final short magic = in.getShort();
        if (magic != MAGIC) {
            throw new MalformedUpdateException("Bad magic 0x" + Integer.toHexString(magic & 0xFFFF));
        }
        final byte version = in.get();
        if (version != VERSION) {
            throw new MalformedUpdateException("Unsupported version " + version);
        }
        return in;
    }

    private static ItemId itemId(final ByteBuffer in) {
        final long client = in.getLong();
        final long seq = in.getLong();
        if (seq < 0) {
            throw new MalformedUpdateException("Negative sequence for client " + client);
        }
        return new ItemId(client, seq);
    }
}
