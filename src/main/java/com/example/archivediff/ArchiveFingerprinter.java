package com.example.archivediff;

import com.example.archivediff.fingerprint.Digest;
import com.example.archivediff.fingerprint.FingerprintEntry;
import com.example.archivediff.fingerprint.FingerprintIndex;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.input.ChecksumInputStream;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Fingerprints the file entries of a ZIP archive one at a time.
 */
public final class ArchiveFingerprinter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveFingerprinter.class);

    private final ContentHasher hasher;
    private final ProgressTracker progress;
    private final ArchiveTypeDetector typeDetector;

    public ArchiveFingerprinter(ContentHasher hasher, ProgressTracker progress, ArchiveTypeDetector typeDetector) {
        this.hasher = hasher;
        this.progress = progress;
        this.typeDetector = typeDetector;
    }

    /**
     * Opens the archive for random access. Any failure here is reported as an {@link ArchiveScanException}.
     */
    public ZipFile open(Path archive) throws IOException {
        if (!Files.isRegularFile(archive)) {
            throw new ArchiveScanException("Archive does not exist or is not a file: " + archive);
        }
        MediaType mediaType = typeDetector.detect(archive);
        if (typeDetector.isZip(mediaType)) {
            try {
                return ZipFile.builder().setPath(archive).get();
            } catch (IOException ex) {
                throw new ArchiveScanException("Cannot read archive structure of " + archive, ex);
            }
        }
        if (typeDetector.isText(mediaType)) {
            throw new ArchiveScanException("Not a ZIP archive (" + mediaType + "): " + archive);
        }
        // Self-extracting archives and other ZIPs with a preamble are detected as something else.
        try {
            ZipFile zipFile = ZipFile.builder().setPath(archive).get();
            LOGGER.info("Opened {} as ZIP despite detected type {}", archive, mediaType);
            return zipFile;
        } catch (IOException ex) {
            throw new ArchiveScanException("Not a ZIP archive (" + mediaType + "): " + archive, ex);
        }
    }

    /**
     * Opens an entry's decompressed data, failing with an {@link IOException} at end of data if the
     * bytes do not match the CRC-32 recorded in the archive.
     */
    static InputStream openEntry(ZipFile zipFile, ZipArchiveEntry entry) throws IOException {
        InputStream inputStream = zipFile.getInputStream(entry);
        if (inputStream == null) {
            throw new IOException("Entry data not readable: " + entry.getName());
        }
        if (entry.getCrc() < 0) {
            return inputStream;
        }
        return ChecksumInputStream.builder()
                .setChecksum(new CRC32())
                .setExpectedChecksumValue(entry.getCrc())
                .setCountThreshold(entry.getSize())
                .setInputStream(inputStream)
                .get();
    }

    /**
     * Total uncompressed size of all file entries, used as the progress denominator.
     */
    public long measure(Path archive) throws IOException {
        try (ZipFile zipFile = open(archive)) {
            long total = 0L;
            for (ZipArchiveEntry entry : fileEntries(zipFile)) {
                if (entry.getSize() > 0) {
                    total += entry.getSize();
                }
            }
            return total;
        }
    }

    /**
     * Hashes every non-directory entry in central directory order. Directory entries never appear in the result.
     *
     * @throws ArchiveScanException if the archive or any entry cannot be read
     */
    public FingerprintIndex scan(Path archive) throws IOException {
        Map<String, FingerprintEntry> entries = new LinkedHashMap<>();
        try (ZipFile zipFile = open(archive)) {
            for (ZipArchiveEntry entry : fileEntries(zipFile)) {
                String identifier = entry.getName();
                // Lookups by name resolve to the first entry, so later copies are unreachable.
                if (entries.containsKey(identifier)) {
                    LOGGER.warn("Ignoring repeated entry {} in {}", identifier, archive);
                    continue;
                }
                progress.begin(identifier);
                entries.put(identifier, new FingerprintEntry(identifier, hashEntry(zipFile, entry, archive), entry.getSize()));
            }
        }
        LOGGER.info("Fingerprinted {} entries in {}.", entries.size(), archive);
        return FingerprintIndex.of(entries.values());
    }

    private Digest hashEntry(ZipFile zipFile, ZipArchiveEntry entry, Path archive) throws ArchiveScanException {
        if (!zipFile.canReadEntryData(entry)) {
            throw new ArchiveScanException("Unsupported compression or encryption for entry " + entry.getName() + " in " + archive);
        }
        try (InputStream inputStream = openEntry(zipFile, entry)) {
            return hasher.hash(inputStream);
        } catch (IOException ex) {
            throw new ArchiveScanException("Corrupt entry " + entry.getName() + " in " + archive, ex);
        }
    }

    static List<ZipArchiveEntry> fileEntries(ZipFile zipFile) {
        List<ZipArchiveEntry> files = new ArrayList<>();
        Enumeration<ZipArchiveEntry> entries = zipFile.getEntries();
        while (entries.hasMoreElements()) {
            ZipArchiveEntry entry = entries.nextElement();
            if (!entry.isDirectory()) {
                files.add(entry);
            }
        }
        return files;
    }
}
