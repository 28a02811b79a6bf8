package com.example.archivediff;

import com.example.archivediff.fingerprint.FingerprintIndex;

import java.util.List;

/**
 * Result of fingerprinting a folder: the files that were hashed and the ones that were skipped.
 */
public record FolderScan(
        FingerprintIndex index,
        List<ScanFailure> failures
) {
    public FolderScan {
        failures = List.copyOf(failures);
    }
}
