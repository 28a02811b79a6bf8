package com.example.archivediff.fingerprint;

public enum Classification {
    /** Content already present somewhere in the folder. */
    DUPLICATE,
    /** Content not found in the folder; the entry must be extracted. */
    UNIQUE
}
