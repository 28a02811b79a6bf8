package com.example.archivediff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CancellationException;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Either a JSON config file, or the three locations directly.
        ComparerConfig config;
        if (args.length == 1) {
            config = new ConfigLoader().load(Path.of(args[0]));
        } else if (args.length == 3) {
            config = ComparerConfig.defaults(Path.of(args[0]), Path.of(args[1]), Path.of(args[2]));
        } else {
            LOGGER.error("Usage: java -jar archive-diff.jar <config.json> | <folder> <archive.zip> <output-dir>");
            System.exit(1);
            return;
        }

        CancellationFlag cancellation = new CancellationFlag();
        Thread mainThread = Thread.currentThread();
        Thread hook = new Thread(() -> {
            cancellation.cancel();
            try {
                // Give in-flight writes a chance to remove their temporary files.
                mainThread.join(5000L);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "cancel-on-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        ComparisonResult result;
        try {
            result = new ArchiveComparer(config, cancellation).compare();
        } catch (CancellationException ex) {
            LOGGER.warn("Operation cancelled by user.");
            return;
        } catch (ArchiveScanException ex) {
            LOGGER.error("Cannot compare against archive: {}", ex.getMessage(), ex);
            Runtime.getRuntime().removeShutdownHook(hook);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().removeShutdownHook(hook);

        ReportWriter reportWriter = new ReportWriter();
        reportWriter.log(result);
        if (config.reportFile().isPresent()) {
            reportWriter.write(result, config.reportFile().get());
        }
    }
}
