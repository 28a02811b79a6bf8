package com.example.archivediff;

import com.example.archivediff.fingerprint.Digest;
import com.example.archivediff.fingerprint.FingerprintEntry;
import com.example.archivediff.fingerprint.FingerprintIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * Fingerprints every regular file below a root directory on a bounded worker pool.
 */
public final class TreeFingerprinter {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeFingerprinter.class);

    private final ContentHasher hasher;
    private final ProgressTracker progress;
    private final CancellationSignal cancellation;
    private final int threadCount;
    private final int queueCapacity;
    private final boolean followLinks;

    public TreeFingerprinter(ContentHasher hasher,
                             ProgressTracker progress,
                             CancellationSignal cancellation,
                             int threadCount,
                             int queueCapacity,
                             boolean followLinks) {
        if (threadCount <= 0 || queueCapacity <= 0) {
            throw new IllegalArgumentException("threadCount and queueCapacity must be positive.");
        }
        this.hasher = hasher;
        this.progress = progress;
        this.cancellation = cancellation;
        this.threadCount = threadCount;
        this.queueCapacity = queueCapacity;
        this.followLinks = followLinks;
    }

    /**
     * Sums the sizes of all regular files below {@code root}. Unreadable entries are logged and skipped.
     */
    public long measure(Path root) throws IOException {
        return measure(root, new ArrayList<>());
    }

    /**
     * Sums the sizes of all regular files below {@code root}, adding a {@link ScanFailure.Stage#SIZE}
     * failure to {@code failures} for every entry that could not be read.
     */
    public long measure(Path root, List<ScanFailure> failures) throws IOException {
        AtomicLong total = new AtomicLong();
        walk(root, (file, attrs) -> total.addAndGet(attrs.size()), ScanFailure.Stage.SIZE, failures);
        return total.get();
    }

    /**
     * Hashes every regular file below {@code root}. Files that fail are logged and left out of the index.
     *
     * @throws CancellationException if the cancellation signal is raised during the scan
     */
    public FolderScan scan(Path root) throws IOException, InterruptedException {
        Map<String, FingerprintEntry> results = new ConcurrentHashMap<>();
        Queue<ScanFailure> failures = new ConcurrentLinkedQueue<>();
        List<ScanFailure> walkFailures = new ArrayList<>();

        // Full queue makes the walking thread hash the file itself, which throttles the walk.
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threadCount,
                threadCount,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                workerThreads(),
                new ThreadPoolExecutor.CallerRunsPolicy());
        try {
            walk(root, (file, attrs) -> {
                cancellation.throwIfCancelled();
                executor.execute(() -> hashFile(file, results, failures));
            }, ScanFailure.Stage.WALK, walkFailures);
        } catch (CancellationException ex) {
            executor.shutdownNow();
            throw ex;
        } finally {
            executor.shutdown();
        }
        if (!executor.awaitTermination(1, TimeUnit.HOURS)) {
            executor.shutdownNow();
            throw new IOException("Timed out waiting for hashing workers under " + root);
        }
        cancellation.throwIfCancelled();

        List<FingerprintEntry> ordered = new ArrayList<>(results.values());
        ordered.sort(Comparator.comparing(FingerprintEntry::identifier));
        List<ScanFailure> allFailures = new ArrayList<>(walkFailures);
        allFailures.addAll(failures);
        LOGGER.info("Fingerprinted {} files under {} ({} skipped).", ordered.size(), root, allFailures.size());
        return new FolderScan(FingerprintIndex.of(ordered), allFailures);
    }

    private void hashFile(Path file, Map<String, FingerprintEntry> results, Queue<ScanFailure> failures) {
        if (cancellation.isCancelled()) {
            return;
        }
        String identifier = file.toString();
        progress.begin(identifier);
        try {
            long size = Files.size(file);
            Digest digest = hasher.hash(file);
            results.put(identifier, new FingerprintEntry(identifier, digest, size));
        } catch (IOException ex) {
            LOGGER.warn("Failed to fingerprint {}", file, ex);
            failures.add(ScanFailure.of(file, ScanFailure.Stage.HASH, ex));
        } catch (CancellationException ex) {
            LOGGER.debug("Hashing of {} cancelled", file);
        }
    }

    private void walk(Path root,
                      BiConsumer<Path, BasicFileAttributes> onFile,
                      ScanFailure.Stage stage,
                      List<ScanFailure> failures) throws IOException {
        Set<FileVisitOption> options = followLinks ? EnumSet.of(FileVisitOption.FOLLOW_LINKS) : EnumSet.noneOf(FileVisitOption.class);
        Files.walkFileTree(root, options, Integer.MAX_VALUE, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    onFile.accept(file, attrs);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException ex) {
                if (ex instanceof FileSystemLoopException) {
                    LOGGER.warn("Skipping symbolic link cycle at {}", file);
                } else {
                    LOGGER.warn("Failed to read {}", file, ex);
                }
                failures.add(ScanFailure.of(file, stage, ex));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException ex) {
                if (ex != null) {
                    LOGGER.warn("Failed to list directory {}", dir, ex);
                    failures.add(ScanFailure.of(dir, stage, ex));
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "fingerprint-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
