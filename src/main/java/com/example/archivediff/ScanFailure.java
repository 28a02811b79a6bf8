package com.example.archivediff;

import java.time.Instant;

/**
 * A folder file that was left out of the index because it could not be sized, walked or read.
 */
public record ScanFailure(
        String path,
        Stage stage,
        Instant time,
        String error
) {
    public enum Stage {
        WALK,
        SIZE,
        HASH
    }

    static ScanFailure of(Object path, Stage stage, Exception cause) {
        return new ScanFailure(String.valueOf(path), stage, Instant.now(), String.valueOf(cause));
    }
}
