package com.example.archivediff;

import com.example.archivediff.fingerprint.ClassificationRecord;
import com.example.archivediff.fingerprint.Digest;
import com.example.archivediff.fingerprint.ExtractionPlan;
import com.example.archivediff.fingerprint.FingerprintEntry;
import com.example.archivediff.fingerprint.FingerprintIndex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies archive entries against folder content by digest.
 */
public final class DiffEngine {

    /**
     * Produces one record per archive entry, in archive index order. When several folder files
     * share a digest, the lexicographically smallest folder identifier is reported as the match.
     */
    public ExtractionPlan diff(FingerprintIndex folderIndex, FingerprintIndex archiveIndex) {
        Map<Digest, String> reverseIndex = reverseIndex(folderIndex);
        List<ClassificationRecord> records = new ArrayList<>(archiveIndex.size());
        for (FingerprintEntry entry : archiveIndex.entries()) {
            String match = reverseIndex.get(entry.digest());
            records.add(match == null
                    ? ClassificationRecord.unique(entry.identifier(), entry.digest())
                    : ClassificationRecord.duplicate(entry.identifier(), entry.digest(), match));
        }
        return new ExtractionPlan(records);
    }

    static Map<Digest, String> reverseIndex(FingerprintIndex folderIndex) {
        Map<Digest, String> reverse = new HashMap<>();
        for (FingerprintEntry entry : folderIndex.entries()) {
            reverse.merge(entry.digest(), entry.identifier(), (current, candidate) ->
                    candidate.compareTo(current) < 0 ? candidate : current);
        }
        return reverse;
    }
}
