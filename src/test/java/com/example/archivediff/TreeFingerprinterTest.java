package com.example.archivediff;

import com.example.archivediff.fingerprint.FingerprintEntry;
import com.example.archivediff.fingerprint.FingerprintIndex;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeFingerprinterTest {
    @Test
    void fingerprintsNestedRegularFiles() throws Exception {
        Path root = Files.createTempDirectory("tree-root");
        Path subDir = Files.createDirectories(root.resolve("sub/deeper"));
        Files.writeString(root.resolve("a.txt"), "hello");
        Files.writeString(subDir.resolve("b.txt"), "world!");
        Files.createDirectory(root.resolve("empty"));

        ProgressTracker progress = new ProgressTracker();
        TreeFingerprinter fingerprinter = fingerprinter(progress, 2, 2);
        FolderScan scan = fingerprinter.scan(root);
        FingerprintIndex index = scan.index();

        assertEquals(2, index.size());
        assertTrue(scan.failures().isEmpty());
        FingerprintEntry a = index.get(root.resolve("a.txt").toString()).orElseThrow();
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", a.digest().hex());
        assertEquals(5L, a.size());
        assertEquals(6L, index.get(subDir.resolve("b.txt").toString()).orElseThrow().size());
        assertEquals(11L, progress.processedBytes());
    }

    @Test
    void measuresTotalSizeBeforeHashing() throws Exception {
        Path root = Files.createTempDirectory("tree-size");
        Files.writeString(root.resolve("one.bin"), "12345");
        Files.writeString(Files.createDirectory(root.resolve("nested")).resolve("two.bin"), "678");

        assertEquals(8L, fingerprinter(new ProgressTracker(), 1, 1).measure(root));
    }

    @Test
    void orderIsLexicographicRegardlessOfWorkerTiming() throws Exception {
        Path root = Files.createTempDirectory("tree-order");
        for (int i = 0; i < 40; i++) {
            Files.writeString(root.resolve(String.format("file-%02d.txt", 39 - i)), "content " + i);
        }

        FingerprintIndex index = fingerprinter(new ProgressTracker(), 4, 1).scan(root).index();

        List<String> identifiers = new ArrayList<>(index.identifiers());
        List<String> sorted = new ArrayList<>(identifiers);
        sorted.sort(String::compareTo);
        assertEquals(40, identifiers.size());
        assertEquals(sorted, identifiers);
    }

    @Test
    void boundedPoolHashesMoreFilesThanQueueSlots() throws Exception {
        Path root = Files.createTempDirectory("tree-bounded");
        for (int i = 0; i < 100; i++) {
            Files.writeString(root.resolve("f" + i), "value-" + i);
        }

        FolderScan scan = fingerprinter(new ProgressTracker(), 1, 1).scan(root);

        assertEquals(100, scan.index().size());
    }

    @Test
    void emptyFolderYieldsEmptyIndex() throws Exception {
        Path root = Files.createTempDirectory("tree-empty");

        FolderScan scan = fingerprinter(new ProgressTracker(), 2, 2).scan(root);

        assertTrue(scan.index().isEmpty());
        assertEquals(0L, fingerprinter(new ProgressTracker(), 2, 2).measure(root));
    }

    @Test
    void symbolicLinkCycleIsSkipped() throws Exception {
        Path root = Files.createTempDirectory("tree-loop");
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.writeString(sub.resolve("x.txt"), "x");
        try {
            Files.createSymbolicLink(sub.resolve("back"), root);
        } catch (UnsupportedOperationException | java.io.IOException ex) {
            return;
        }

        FolderScan scan = fingerprinter(new ProgressTracker(), 2, 2).scan(root);

        assertEquals(1, scan.index().size());
        assertFalse(scan.failures().isEmpty());
    }

    @Test
    void measureRecordsSizeFailuresForLinkCycles() throws Exception {
        Path root = Files.createTempDirectory("tree-measure-loop");
        Path sub = Files.createDirectory(root.resolve("sub"));
        Files.writeString(sub.resolve("x.txt"), "xyz");
        try {
            Files.createSymbolicLink(sub.resolve("back"), root);
        } catch (UnsupportedOperationException | java.io.IOException ex) {
            return;
        }
        List<ScanFailure> failures = new ArrayList<>();

        long total = fingerprinter(new ProgressTracker(), 2, 2).measure(root, failures);

        assertEquals(3L, total);
        assertFalse(failures.isEmpty());
        assertTrue(failures.stream().allMatch(failure -> failure.stage() == ScanFailure.Stage.SIZE));
    }

    @Test
    void cancelledScanProducesNoIndex() throws Exception {
        Path root = Files.createTempDirectory("tree-cancel");
        Files.writeString(root.resolve("a.txt"), "a");
        CancellationFlag flag = new CancellationFlag();
        flag.cancel();
        ProgressTracker progress = new ProgressTracker();
        TreeFingerprinter fingerprinter = new TreeFingerprinter(
                new ContentHasher(ContentHasher.DEFAULT_CHUNK_SIZE, progress, flag), progress, flag, 2, 2, true);

        assertThrows(CancellationException.class, () -> fingerprinter.scan(root));
    }

    private static TreeFingerprinter fingerprinter(ProgressTracker progress, int threads, int queue) {
        ContentHasher hasher = new ContentHasher(ContentHasher.DEFAULT_CHUNK_SIZE, progress, CancellationSignal.NEVER);
        return new TreeFingerprinter(hasher, progress, CancellationSignal.NEVER, threads, queue, true);
    }
}
