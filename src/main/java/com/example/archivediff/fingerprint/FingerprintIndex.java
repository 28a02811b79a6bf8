package com.example.archivediff.fingerprint;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable identifier to fingerprint mapping for one source. Iteration follows insertion order.
 */
public final class FingerprintIndex {
    private static final FingerprintIndex EMPTY = new FingerprintIndex(Map.of());

    private final Map<String, FingerprintEntry> entries;

    private FingerprintIndex(Map<String, FingerprintEntry> entries) {
        this.entries = entries;
    }

    public static FingerprintIndex empty() {
        return EMPTY;
    }

    /**
     * Builds an index from entries in the order given. Identifiers must be unique.
     */
    public static FingerprintIndex of(Collection<FingerprintEntry> entries) {
        Map<String, FingerprintEntry> ordered = new LinkedHashMap<>();
        for (FingerprintEntry entry : entries) {
            if (ordered.putIfAbsent(entry.identifier(), entry) != null) {
                throw new IllegalArgumentException("Duplicate identifier in index: " + entry.identifier());
            }
        }
        return new FingerprintIndex(Collections.unmodifiableMap(ordered));
    }

    public Optional<FingerprintEntry> get(String identifier) {
        return Optional.ofNullable(entries.get(identifier));
    }

    public boolean contains(String identifier) {
        return entries.containsKey(identifier);
    }

    public Set<String> identifiers() {
        return entries.keySet();
    }

    @JsonValue
    public Collection<FingerprintEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long totalBytes() {
        long total = 0L;
        for (FingerprintEntry entry : entries.values()) {
            total += entry.size();
        }
        return total;
    }
}
