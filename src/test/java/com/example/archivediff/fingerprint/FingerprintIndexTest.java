package com.example.archivediff.fingerprint;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FingerprintIndexTest {
    @Test
    void keepsInsertionOrderAndTotals() {
        FingerprintIndex index = FingerprintIndex.of(List.of(
                new FingerprintEntry("z", digest(1), 3L),
                new FingerprintEntry("a", digest(2), 4L)));

        assertEquals(List.of("z", "a"), List.copyOf(index.identifiers()));
        assertEquals(7L, index.totalBytes());
        assertEquals(4L, index.get("a").orElseThrow().size());
    }

    @Test
    void rejectsRepeatedIdentifiers() {
        List<FingerprintEntry> entries = List.of(
                new FingerprintEntry("a", digest(1), 1L),
                new FingerprintEntry("a", digest(2), 1L));

        assertThrows(IllegalArgumentException.class, () -> FingerprintIndex.of(entries));
    }

    @Test
    void digestsCompareByContent() {
        assertEquals(digest(5), digest(5));
        assertEquals(digest(5).hashCode(), digest(5).hashCode());
        assertNotEquals(digest(5), digest(6));
        assertEquals("05" + "00".repeat(31), digest(5).hex());
        assertThrows(IllegalArgumentException.class, () -> Digest.of(new byte[16]));
    }

    @Test
    void classificationRecordsValidateTheirMatch() {
        assertThrows(IllegalArgumentException.class,
                () -> new ClassificationRecord("a", digest(1), Classification.DUPLICATE, null));
        assertThrows(IllegalArgumentException.class,
                () -> new ClassificationRecord("a", digest(1), Classification.UNIQUE, "/f/a"));
    }

    private static Digest digest(int first) {
        byte[] bytes = new byte[Digest.LENGTH];
        bytes[0] = (byte) first;
        return Digest.of(bytes);
    }
}
