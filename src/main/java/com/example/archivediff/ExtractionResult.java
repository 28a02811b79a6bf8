package com.example.archivediff;

import java.util.List;

public record ExtractionResult(
        List<String> written,
        List<ExtractionFailure> failures,
        boolean aborted
) {
    public ExtractionResult {
        written = List.copyOf(written);
        failures = List.copyOf(failures);
    }

    public int count() {
        return written.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
