package com.example.archivediff.fingerprint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Decision for a single archive entry. {@code matchedFolderIdentifier} is set only for duplicates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassificationRecord(
        String archiveIdentifier,
        Digest digest,
        Classification classification,
        String matchedFolderIdentifier
) {
    public ClassificationRecord {
        Objects.requireNonNull(archiveIdentifier, "archiveIdentifier");
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(classification, "classification");
        if (classification == Classification.DUPLICATE && matchedFolderIdentifier == null) {
            throw new IllegalArgumentException("Duplicate record needs a matched folder identifier: " + archiveIdentifier);
        }
        if (classification == Classification.UNIQUE && matchedFolderIdentifier != null) {
            throw new IllegalArgumentException("Unique record cannot carry a folder match: " + archiveIdentifier);
        }
    }

    public static ClassificationRecord duplicate(String archiveIdentifier, Digest digest, String folderIdentifier) {
        return new ClassificationRecord(archiveIdentifier, digest, Classification.DUPLICATE, folderIdentifier);
    }

    public static ClassificationRecord unique(String archiveIdentifier, Digest digest) {
        return new ClassificationRecord(archiveIdentifier, digest, Classification.UNIQUE, null);
    }

    @JsonIgnore
    public boolean isDuplicate() {
        return classification == Classification.DUPLICATE;
    }

    @JsonIgnore
    public boolean isUnique() {
        return classification == Classification.UNIQUE;
    }
}
