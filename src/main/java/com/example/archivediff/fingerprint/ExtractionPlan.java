package com.example.archivediff.fingerprint;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Ordered classification records, one per non-directory archive entry.
 */
public record ExtractionPlan(List<ClassificationRecord> records) {
    public ExtractionPlan {
        records = List.copyOf(records);
    }

    @Override
    @JsonValue
    public List<ClassificationRecord> records() {
        return records;
    }

    public List<ClassificationRecord> duplicates() {
        return records.stream().filter(ClassificationRecord::isDuplicate).toList();
    }

    public List<ClassificationRecord> uniques() {
        return records.stream().filter(ClassificationRecord::isUnique).toList();
    }

    public int size() {
        return records.size();
    }
}
