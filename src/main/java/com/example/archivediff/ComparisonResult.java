package com.example.archivediff;

import com.example.archivediff.fingerprint.ExtractionPlan;
import com.example.archivediff.fingerprint.FingerprintIndex;

import java.time.Instant;
import java.util.List;

/**
 * Everything a completed comparison hands to the reporting layer.
 */
public record ComparisonResult(
        String folder,
        String archive,
        String outputDirectory,
        long folderBytes,
        long archiveBytes,
        FingerprintIndex folderIndex,
        FingerprintIndex archiveIndex,
        ExtractionPlan plan,
        ExtractionResult extraction,
        List<ScanFailure> scanFailures,
        Instant startedAt,
        Instant finishedAt
) {
    public ComparisonResult {
        scanFailures = List.copyOf(scanFailures);
    }

    public long totalBytes() {
        return folderBytes + archiveBytes;
    }
}
