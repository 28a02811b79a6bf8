package com.example.archivediff;

import java.io.IOException;

/**
 * Structural problem with the archive. Fatal to the whole comparison.
 */
public class ArchiveScanException extends IOException {
    public ArchiveScanException(String message) {
        super(message);
    }

    public ArchiveScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
