package com.example.archivediff;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void appliesDefaultsForMissingSettings() throws Exception {
        Path dir = Files.createTempDirectory("config-defaults");
        Path file = Files.writeString(dir.resolve("config.json"),
                "{\"folder\": \"/data/photos\", \"archive\": \"/data/backup.zip\", "
                        + "\"outputDirectory\": \"/data/restore\", \"threadCount\": 3, \"somethingElse\": true}");

        ComparerConfig config = new ConfigLoader().load(file);

        assertEquals(Path.of("/data/photos"), config.folder());
        assertEquals(Path.of("/data/backup.zip"), config.archive());
        assertEquals(Path.of("/data/restore"), config.outputDirectory());
        assertEquals(3, config.threadCount());
        assertEquals(12, config.queueCapacity());
        assertEquals(ContentHasher.DEFAULT_CHUNK_SIZE, config.chunkSize());
        assertTrue(config.followLinks());
        assertEquals(ExtractionFailurePolicy.CONTINUE, config.extractionFailurePolicy());
        assertEquals(1000L, config.progressIntervalMillis());
        assertFalse(config.reportFile().isPresent());
    }

    @Test
    void readsExplicitSettings() throws Exception {
        Path dir = Files.createTempDirectory("config-explicit");
        Path file = Files.writeString(dir.resolve("config.json"),
                "{\"folder\": \"f\", \"archive\": \"a.zip\", \"outputDirectory\": \"o\", "
                        + "\"queueCapacity\": 7, \"chunkSize\": 4096, \"followLinks\": false, "
                        + "\"extractionFailurePolicy\": \"abort\", \"progressIntervalMillis\": 0, "
                        + "\"reportFile\": \"report.json\"}");

        ComparerConfig config = new ConfigLoader().load(file);

        assertEquals(7, config.queueCapacity());
        assertEquals(4096, config.chunkSize());
        assertFalse(config.followLinks());
        assertEquals(ExtractionFailurePolicy.ABORT, config.extractionFailurePolicy());
        assertEquals(0L, config.progressIntervalMillis());
        assertEquals(Path.of("report.json"), config.reportFile().orElseThrow());
    }

    @Test
    void requiresAllThreeLocations() throws Exception {
        Path dir = Files.createTempDirectory("config-missing");
        Path file = Files.writeString(dir.resolve("config.json"), "{\"folder\": \"f\", \"archive\": \"a.zip\"}");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> new ConfigLoader().load(file));
        assertTrue(ex.getMessage().contains("outputDirectory"));
    }

    @Test
    void rejectsUnknownFailurePolicy() throws Exception {
        Path dir = Files.createTempDirectory("config-policy");
        Path file = Files.writeString(dir.resolve("config.json"),
                "{\"folder\": \"f\", \"archive\": \"a.zip\", \"outputDirectory\": \"o\", \"extractionFailurePolicy\": \"retry\"}");

        assertThrows(IllegalArgumentException.class, () -> new ConfigLoader().load(file));
    }
}
