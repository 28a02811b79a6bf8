package com.example.archivediff;

import com.example.archivediff.fingerprint.ClassificationRecord;
import com.example.archivediff.fingerprint.ExtractionPlan;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the unique entries of an extraction plan below an output directory.
 */
public final class Extractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(Extractor.class);
    private static final String TEMP_PREFIX = ".extract-";
    private static final String TEMP_SUFFIX = ".part";

    private final ArchiveFingerprinter archives;
    private final CancellationSignal cancellation;
    private final ExtractionFailurePolicy failurePolicy;
    private final int chunkSize;

    public Extractor(ArchiveFingerprinter archives,
                     CancellationSignal cancellation,
                     ExtractionFailurePolicy failurePolicy,
                     int chunkSize) {
        this.archives = archives;
        this.cancellation = cancellation;
        this.failurePolicy = failurePolicy;
        this.chunkSize = chunkSize;
    }

    /**
     * Materializes every {@code UNIQUE} record in plan order; duplicates are skipped. Each file appears
     * under its final name only once fully written.
     *
     * @throws ArchiveScanException if the archive itself cannot be opened
     * @throws java.util.concurrent.CancellationException if cancelled between or during entries
     */
    public ExtractionResult materialize(Path archive, ExtractionPlan plan, Path outputDirectory) throws IOException {
        Path root = outputDirectory.toAbsolutePath().normalize();
        Files.createDirectories(root);
        List<String> written = new ArrayList<>();
        List<ExtractionFailure> failures = new ArrayList<>();
        boolean aborted = false;

        try (ZipFile zipFile = archives.open(archive)) {
            for (ClassificationRecord record : plan.records()) {
                if (!record.isUnique()) {
                    continue;
                }
                cancellation.throwIfCancelled();
                String identifier = record.archiveIdentifier();
                try {
                    extractEntry(zipFile, identifier, root);
                    written.add(identifier);
                    LOGGER.debug("Extracted {}", identifier);
                } catch (IOException ex) {
                    LOGGER.warn("Failed to extract {}", identifier, ex);
                    failures.add(ExtractionFailure.of(identifier, ex));
                    if (failurePolicy == ExtractionFailurePolicy.ABORT) {
                        LOGGER.error("Aborting extraction after failure on {}", identifier);
                        aborted = true;
                        break;
                    }
                }
            }
        }
        LOGGER.info("Extracted {} files to {} ({} failed).", written.size(), root, failures.size());
        return new ExtractionResult(written, failures, aborted);
    }

    private void extractEntry(ZipFile zipFile, String identifier, Path root) throws IOException {
        Path target = resolveTarget(root, identifier);
        ZipArchiveEntry entry = zipFile.getEntry(identifier);
        if (entry == null) {
            throw new IOException("Entry not found in archive: " + identifier);
        }
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), TEMP_PREFIX, TEMP_SUFFIX);
        try {
            try (InputStream inputStream = ArchiveFingerprinter.openEntry(zipFile, entry);
                 OutputStream outputStream = Files.newOutputStream(temp)) {
                copy(inputStream, outputStream);
            }
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void copy(InputStream inputStream, OutputStream outputStream) throws IOException {
        byte[] buffer = new byte[chunkSize];
        int read;
        while ((read = inputStream.read(buffer)) != -1) {
            outputStream.write(buffer, 0, read);
            cancellation.throwIfCancelled();
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Resolves an entry name below {@code root}, rejecting names that escape it.
     */
    static Path resolveTarget(Path root, String identifier) throws IOException {
        Path target;
        try {
            target = root.resolve(identifier).normalize();
        } catch (InvalidPathException ex) {
            throw new IOException("Entry name is not a valid path: " + identifier, ex);
        }
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IOException("Entry path escapes output directory: " + identifier);
        }
        return target;
    }
}
