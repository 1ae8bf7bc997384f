package com.example.disksight;

import com.example.disksight.model.ScanResult;
import com.example.disksight.progress.LoggingProgressSink;
import com.example.disksight.progress.ProgressSink;
import com.example.disksight.progress.QueuedProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CompletionException;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a JSON config file path, optionally followed by a root that overrides the config.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar disk-sight.jar <config.json> [root]");
            System.exit(1);
        }
        ScanConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration {}: {}", args[0], ex.getMessage());
            System.exit(1);
            return;
        }
        if (args.length > 1) {
            config = config.toBuilder().root(Path.of(args[1])).build();
        }

        if (!config.recurseDetailed()) {
            DirectoryLister lister = new DirectoryLister(null, EntryFactory.forConfig(config),
                    ProgressSink.NOOP, CancellationToken.NONE);
            try {
                lister.listNames(config.root(), config).forEach(System.out::println);
            } catch (RootUnreadableException ex) {
                System.exit(1);
            }
            return;
        }

        ReportWriter reportWriter = new ReportWriter();
        try (DiskUsageScanner scanner = new DiskUsageScanner();
             QueuedProgressSink progress = new QueuedProgressSink(new LoggingProgressSink())) {
            ScanResult result = scanner.scanAsync(config, progress).join();
            System.out.println(reportWriter.renderTable(result, config));
            if (config.outputFile().isPresent()) {
                reportWriter.writeJson(result, config.outputFile().get());
                LOGGER.info("Wrote report to {}", config.outputFile().get());
            }
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RootUnreadableException) {
                System.exit(1);
            }
            throw ex;
        }
    }
}
