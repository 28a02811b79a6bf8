package com.example.archivediff;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared progress state for one scanning pass. Hashing workers add bytes; reporters take snapshots.
 */
public final class ProgressTracker {
    private final AtomicLong processedBytes = new AtomicLong();
    private final Clock clock;
    private volatile long totalBytes;
    private volatile String currentIdentifier = "";
    private volatile Instant startTime;

    public ProgressTracker() {
        this(Clock.systemUTC());
    }

    public ProgressTracker(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    /**
     * Starts a new pass: clears the counter, fixes the expected total and restarts the clock.
     */
    public void reset(long expectedTotalBytes) {
        processedBytes.set(0L);
        totalBytes = expectedTotalBytes;
        currentIdentifier = "";
        startTime = clock.instant();
    }

    public void begin(String identifier) {
        currentIdentifier = identifier;
    }

    public void addBytes(long count) {
        processedBytes.addAndGet(count);
    }

    public long processedBytes() {
        return processedBytes.get();
    }

    public ProgressSnapshot snapshot() {
        return new ProgressSnapshot(processedBytes.get(), totalBytes, currentIdentifier, startTime);
    }

    Clock clock() {
        return clock;
    }
}
