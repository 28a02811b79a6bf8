package com.example.archivediff;

/**
 * An archive entry that could not be written to the output directory.
 */
public record ExtractionFailure(
        String identifier,
        String error
) {
    static ExtractionFailure of(String identifier, Exception cause) {
        return new ExtractionFailure(identifier, String.valueOf(cause));
    }
}
