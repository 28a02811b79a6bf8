package com.example.archivediff;

public enum ExtractionFailurePolicy {
    /** Keep extracting the remaining entries and report every failure at the end. */
    CONTINUE,
    /** Stop at the first failed entry. Files already written stay in place. */
    ABORT
}
