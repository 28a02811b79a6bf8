package com.example.archivediff;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Immutable runtime settings for one comparison run.
 */
public record ComparerConfig(
        Path folder,
        Path archive,
        Path outputDirectory,
        int threadCount,
        int queueCapacity,
        int chunkSize,
        boolean followLinks,
        ExtractionFailurePolicy extractionFailurePolicy,
        long progressIntervalMillis,
        Optional<Path> reportFile
) {
    /**
     * Settings with defaults for everything but the three locations.
     */
    public static ComparerConfig defaults(Path folder, Path archive, Path outputDirectory) {
        int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
        return new ComparerConfig(
                folder,
                archive,
                outputDirectory,
                threads,
                threads * ConfigLoader.DEFAULT_QUEUE_FACTOR,
                ContentHasher.DEFAULT_CHUNK_SIZE,
                true,
                ExtractionFailurePolicy.CONTINUE,
                ConfigLoader.DEFAULT_PROGRESS_INTERVAL_MILLIS,
                Optional.empty()
        );
    }
}
