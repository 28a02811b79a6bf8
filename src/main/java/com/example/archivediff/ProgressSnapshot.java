package com.example.archivediff;

import java.time.Duration;
import java.time.Instant;

public record ProgressSnapshot(
        long processedBytes,
        long totalBytes,
        String currentIdentifier,
        Instant startTime
) {
    /**
     * Percentage of the expected bytes processed so far. May exceed 100 if files grew after sizing.
     */
    public double percent() {
        if (totalBytes <= 0) {
            return processedBytes > 0 ? 100.0 : 0.0;
        }
        return processedBytes * 100.0 / totalBytes;
    }

    /**
     * Average throughput in bytes per second between the start time and {@code now}.
     */
    public double bytesPerSecond(Instant now) {
        double seconds = Duration.between(startTime, now).toMillis() / 1000.0;
        if (seconds <= 0) {
            return 0.0;
        }
        return processedBytes / seconds;
    }

    /**
     * Estimated time remaining at the current throughput, zero when no rate is known yet.
     */
    public Duration eta(Instant now) {
        double speed = bytesPerSecond(now);
        long remaining = Math.max(0L, totalBytes - processedBytes);
        if (speed <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) (remaining / speed * 1000));
    }
}
