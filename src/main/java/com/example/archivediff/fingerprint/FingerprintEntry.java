package com.example.archivediff.fingerprint;

/**
 * Digest of one folder file or archive entry, keyed by its identifier.
 */
public record FingerprintEntry(
        String identifier,
        Digest digest,
        long size
) {
}
