package com.example.archivediff;

import com.example.archivediff.fingerprint.ExtractionPlan;
import com.example.archivediff.fingerprint.FingerprintIndex;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a full comparison: size both inputs, fingerprint the folder, fingerprint the archive,
 * classify the archive entries and extract the unique ones.
 */
public final class ArchiveComparer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveComparer.class);

    private final ComparerConfig config;
    private final CancellationSignal cancellation;
    private final ProgressTracker progress;
    private final TreeFingerprinter treeFingerprinter;
    private final ArchiveFingerprinter archiveFingerprinter;
    private final DiffEngine diffEngine;
    private final Extractor extractor;

    public ArchiveComparer(ComparerConfig config) {
        this(config, CancellationSignal.NEVER);
    }

    public ArchiveComparer(ComparerConfig config, CancellationSignal cancellation) {
        this(config, cancellation, new ProgressTracker());
    }

    ArchiveComparer(ComparerConfig config, CancellationSignal cancellation, ProgressTracker progress) {
        this.config = config;
        this.cancellation = cancellation;
        this.progress = progress;
        ContentHasher hasher = new ContentHasher(config.chunkSize(), progress, cancellation);
        this.treeFingerprinter = new TreeFingerprinter(
                hasher,
                progress,
                cancellation,
                config.threadCount(),
                config.queueCapacity(),
                config.followLinks());
        this.archiveFingerprinter = new ArchiveFingerprinter(hasher, progress, new ArchiveTypeDetector(new Tika()));
        this.diffEngine = new DiffEngine();
        this.extractor = new Extractor(archiveFingerprinter, cancellation, config.extractionFailurePolicy(), config.chunkSize());
    }

    /**
     * Executes the comparison.
     *
     * @throws ArchiveScanException if the archive is missing, not a ZIP, or structurally broken
     * @throws java.util.concurrent.CancellationException if the run was cancelled; no result is produced
     */
    public ComparisonResult compare() throws IOException, InterruptedException {
        Path folder = config.folder();
        Path archive = config.archive();
        if (!Files.isDirectory(folder)) {
            throw new NotDirectoryException(folder.toString());
        }
        Instant startedAt = Instant.now();

        LOGGER.info("Calculating total sizes...");
        List<ScanFailure> scanFailures = new ArrayList<>();
        long folderBytes = treeFingerprinter.measure(folder, scanFailures);
        long archiveBytes = archiveFingerprinter.measure(archive);
        LOGGER.info("Folder {}: {}, archive {}: {} uncompressed.",
                folder, HumanReadable.size(folderBytes), archive, HumanReadable.size(archiveBytes));
        cancellation.throwIfCancelled();

        LOGGER.info("Scanning folder {}", folder);
        FolderScan folderScan;
        progress.reset(folderBytes);
        try (ProgressReporter ignored = ProgressReporter.start(progress, "folder", config.progressIntervalMillis())) {
            folderScan = treeFingerprinter.scan(folder);
        }

        LOGGER.info("Scanning archive {}", archive);
        FingerprintIndex archiveIndex;
        progress.reset(archiveBytes);
        try (ProgressReporter ignored = ProgressReporter.start(progress, "archive", config.progressIntervalMillis())) {
            archiveIndex = archiveFingerprinter.scan(archive);
        }

        LOGGER.info("Comparing files and extracting non-duplicates...");
        ExtractionPlan plan = diffEngine.diff(folderScan.index(), archiveIndex);
        ExtractionResult extraction = extractor.materialize(archive, plan, config.outputDirectory());
        scanFailures.addAll(folderScan.failures());

        return new ComparisonResult(
                folder.toString(),
                archive.toString(),
                config.outputDirectory().toString(),
                folderBytes,
                archiveBytes,
                folderScan.index(),
                archiveIndex,
                plan,
                extraction,
                scanFailures,
                startedAt,
                Instant.now()
        );
    }
}
