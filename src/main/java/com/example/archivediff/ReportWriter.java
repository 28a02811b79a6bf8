package com.example.archivediff;

import com.example.archivediff.fingerprint.ClassificationRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a {@link ComparisonResult} as a log summary and, optionally, a JSON file.
 */
public final class ReportWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void log(ComparisonResult result) {
        LOGGER.info("Archive examined: {}", result.archive());
        LOGGER.info("Compared against folder: {}", result.folder());
        LOGGER.info("Files extracted to: {}", result.outputDirectory());

        var duplicates = result.plan().duplicates();
        LOGGER.info("Duplicate files found ({}):", duplicates.size());
        for (ClassificationRecord record : duplicates) {
            LOGGER.info("  {} matches {}", record.archiveIdentifier(), record.matchedFolderIdentifier());
        }
        LOGGER.info("Files extracted ({}):", result.extraction().count());
        for (String identifier : result.extraction().written()) {
            LOGGER.info("  - {}", identifier);
        }
        for (ExtractionFailure failure : result.extraction().failures()) {
            LOGGER.warn("  ! {} not extracted: {}", failure.identifier(), failure.error());
        }
        for (ScanFailure failure : result.scanFailures()) {
            LOGGER.warn("  ? {} skipped during {}: {}", failure.path(), failure.stage(), failure.error());
        }

        LOGGER.info("Total archive size: {}", HumanReadable.size(result.archiveBytes()));
        LOGGER.info("Total folder size scanned: {}", HumanReadable.size(result.folderBytes()));
        LOGGER.info("Total files processed: {}, duplicates: {}, extracted: {}, failed: {}",
                result.archiveIndex().size(),
                duplicates.size(),
                result.extraction().count(),
                result.extraction().failures().size());
        if (result.extraction().aborted()) {
            LOGGER.error("Extraction was aborted after the first failure.");
        }
    }

    /**
     * Writes the full result as pretty-printed JSON, creating parent directories if needed.
     */
    public void write(ComparisonResult result, Path reportFile) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportFile.toFile(), result);
        LOGGER.info("Report written to {}", reportFile);
    }
}
