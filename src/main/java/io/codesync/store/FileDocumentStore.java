package io.codesync.store;

import io.codesync.document.DocumentKey;
import lombok.extern.slf4j.Slf4j;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * One file per document under a base directory. Files are written to a temporary
 * sibling and atomically moved into place, so a reader sees either the previous or
 * the new snapshot, never a partial one.
 */
@Slf4j
public final class FileDocumentStore implements DocumentStore {
    /**
     * 0x43534443 == 'C' 'S' 'D' 'C'
     */
    static final int MAGIC = 0x4353_4443;
    static final short VERSION = 1;

    private static final String FILE_SUFFIX = ".doc";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path dir;

    public FileDocumentStore(final Path dir) throws IOException {
        this.dir = dir;
        Files.createDirectories(dir);
        log.info("Document store at {}", dir.toAbsolutePath());
    }

    @Override
    public Optional<PersistedDocument> load(final DocumentKey key) throws IOException {
        final Path f = fileFor(key);
        if (!Files.exists(f)) return Optional.empty();

        try (final DataInputStream in = new DataInputStream(Files.newInputStream(f))) {
            final int magic = in.readInt();
            if (magic != MAGIC) {
                throw new IOException("Bad magic in " + f + ": 0x" + Integer.toHexString(magic));
            }
            final short version = in.readShort();
            if (version != VERSION) {
                throw new IOException("Unsupported version " + version + " in " + f);
            }

            final long updatedAt = in.readLong();
            final byte[] state = readBlock(in, f);
            final String text = new String(readBlock(in, f), StandardCharsets.UTF_8);

            return Optional.of(new PersistedDocument(state, text, Instant.ofEpochMilli(updatedAt)));
        } catch (final EOFException eof) {
            throw new IOException("Truncated document file " + f, eof);
        }
    }

    @Override
    public void save(final DocumentKey key, final PersistedDocument document) throws IOException {
        final Path target = fileFor(key);
        final Path tmp = target.resolveSibling(target.getFileName().toString() + TMP_SUFFIX);

        try (final DataOutputStream out = new DataOutputStream(Files.newOutputStream(tmp))) {
            out.writeInt(MAGIC);
            out.writeShort(VERSION);
            out.writeLong(document.updatedAt().toEpochMilli());
            out.writeInt(document.binaryState().length);
            out.write(document.binaryState());
            final byte[] text = document.textMirror().getBytes(StandardCharsets.UTF_8);
            out.writeInt(text.length);
            out.write(text);
            out.flush();
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /* Keys may exceed file-name limits, so files are named by digest. */
    Path fileFor(final DocumentKey key) {
        try {
            final MessageDigest sha = MessageDigest.getInstance("SHA-256");
            final byte[] digest = sha.digest(key.toString().getBytes(StandardCharsets.UTF_8));
            return dir.resolve(HexFormat.of().formatHex(digest) + FILE_SUFFIX);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] readBlock(final DataInputStream in, final Path f) throws IOException {
        final int len = in.readInt();
        if (len < 0 || len > Files.size(f)) {
            throw new IOException("Corrupt block length " + len + " in " + f);
        }
        final byte[] block = new byte[len];
        in.readFully(block);
        return block;
    }
}
