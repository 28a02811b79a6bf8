package com.example.archivediff;

import com.example.archivediff.fingerprint.Digest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Streams bytes through SHA-256 in fixed-size chunks, reporting each chunk to a {@link ProgressTracker}.
 */
public final class ContentHasher {
    public static final int DEFAULT_CHUNK_SIZE = 8192;
    private static final String ALGORITHM = "SHA-256";

    private final int chunkSize;
    private final ProgressTracker progress;
    private final CancellationSignal cancellation;

    public ContentHasher() {
        this(DEFAULT_CHUNK_SIZE, new ProgressTracker(), CancellationSignal.NEVER);
    }

    public ContentHasher(int chunkSize, ProgressTracker progress, CancellationSignal cancellation) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.progress = progress;
        this.cancellation = cancellation;
    }

    /**
     * Hashes the stream until exhaustion. The stream is not closed.
     *
     * @throws IOException if a read fails; no retry is attempted
     * @throws java.util.concurrent.CancellationException if cancelled at a chunk boundary
     */
    public Digest hash(InputStream inputStream) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[chunkSize];
        int read;
        cancellation.throwIfCancelled();
        while ((read = inputStream.readNBytes(buffer, 0, chunkSize)) > 0) {
            digest.update(buffer, 0, read);
            progress.addBytes(read);
            cancellation.throwIfCancelled();
        }
        return Digest.of(digest.digest());
    }

    public Digest hash(Path file) throws IOException {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return hash(inputStream);
        }
    }

    public int chunkSize() {
        return chunkSize;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
