package com.example.archivediff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Logs a {@link ProgressSnapshot} on a fixed interval from its own daemon thread.
 */
public final class ProgressReporter implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressReporter.class);
    private static final int MAX_IDENTIFIER_LENGTH = 50;

    private final ProgressTracker tracker;
    private final String phase;
    private final ScheduledExecutorService scheduler;

    private ProgressReporter(ProgressTracker tracker, String phase, long intervalMillis) {
        this.tracker = tracker;
        this.phase = phase;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "progress-" + phase);
            thread.setDaemon(true);
            return thread;
        });
        if (intervalMillis > 0) {
            scheduler.scheduleAtFixedRate(this::report, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Starts reporting for one pass. A non-positive interval disables periodic output.
     */
    public static ProgressReporter start(ProgressTracker tracker, String phase, long intervalMillis) {
        return new ProgressReporter(tracker, phase, intervalMillis);
    }

    void report() {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(format(tracker.snapshot(), tracker.clock().instant()));
        }
    }

    String format(ProgressSnapshot snapshot, Instant now) {
        String current = snapshot.currentIdentifier();
        if (current.length() > MAX_IDENTIFIER_LENGTH) {
            current = current.substring(0, MAX_IDENTIFIER_LENGTH) + "...";
        }
        return String.format(Locale.ROOT, "%s %s | Progress: %.2f%% | Speed: %s/s | Processed: %s / %s | ETA: %s",
                phase,
                current,
                snapshot.percent(),
                HumanReadable.size(snapshot.bytesPerSecond(now)),
                HumanReadable.size(snapshot.processedBytes()),
                HumanReadable.size(snapshot.totalBytes()),
                HumanReadable.duration(snapshot.eta(now)));
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
