package com.example.archivediff;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class ConfigLoader {
    static final int DEFAULT_QUEUE_FACTOR = 4;
    static final long DEFAULT_PROGRESS_INTERVAL_MILLIS = 1000L;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ComparerConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        Path folder = Path.of(requireString(raw.folder, "folder"));
        Path archive = Path.of(requireString(raw.archive, "archive"));
        Path outputDirectory = Path.of(requireString(raw.outputDirectory, "outputDirectory"));
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        int queueCapacity = raw.queueCapacity != null && raw.queueCapacity > 0
                ? raw.queueCapacity
                : threadCount * DEFAULT_QUEUE_FACTOR;
        int chunkSize = raw.chunkSize != null && raw.chunkSize > 0
                ? raw.chunkSize
                : ContentHasher.DEFAULT_CHUNK_SIZE;
        boolean followLinks = raw.followLinks == null || raw.followLinks;
        ExtractionFailurePolicy policy = parsePolicy(raw.extractionFailurePolicy);
        long progressInterval = raw.progressIntervalMillis != null
                ? raw.progressIntervalMillis
                : DEFAULT_PROGRESS_INTERVAL_MILLIS;
        Optional<Path> reportFile = Optional.ofNullable(raw.reportFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);

        return new ComparerConfig(
                folder,
                archive,
                outputDirectory,
                threadCount,
                queueCapacity,
                chunkSize,
                followLinks,
                policy,
                progressInterval,
                reportFile
        );
    }

    private ExtractionFailurePolicy parsePolicy(String value) {
        if (value == null || value.isBlank()) {
            return ExtractionFailurePolicy.CONTINUE;
        }
        try {
            return ExtractionFailurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown extractionFailurePolicy: " + value, ex);
        }
    }

    private String requireString(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Config must include " + name + ".");
        }
        return value;
    }

    private static class RawConfig {
        public String folder;
        public String archive;
        public String outputDirectory;
        public Integer threadCount;
        public Integer queueCapacity;
        public Integer chunkSize;
        public Boolean followLinks;
        public String extractionFailurePolicy;
        public Long progressIntervalMillis;
        public String reportFile;
    }
}
