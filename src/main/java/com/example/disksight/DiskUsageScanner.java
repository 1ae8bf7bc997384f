package com.example.disksight;

import com.example.disksight.model.Entry;
import com.example.disksight.model.ScanResult;
import com.example.disksight.progress.GuardedProgressSink;
import com.example.disksight.progress.ProgressSink;
import com.example.disksight.progress.ProgressStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for callers: runs one listing with its own fan-out pool and times it.
 * {@link #scanAsync} keeps the caller's thread free and reports through the returned future.
 */
public final class DiskUsageScanner implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(DiskUsageScanner.class);
    private static final AtomicInteger SCAN_THREADS = new AtomicInteger(1);

    private final ExecutorService scanExecutor;

    public DiskUsageScanner() {
        this.scanExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "disk-scan-" + SCAN_THREADS.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    public ScanResult scan(ScanConfig config, ProgressSink sink) throws IOException {
        return scan(config, sink, CancellationToken.NONE);
    }

    /**
     * Scans {@code config.root()} on the calling thread.
     *
     * @throws RootUnreadableException if the root cannot be opened
     * @throws ScanCancelledException  if {@code cancellation} fires before the scan finishes
     */
    public ScanResult scan(ScanConfig config, ProgressSink sink, CancellationToken cancellation) throws IOException {
        ProgressSink progress = GuardedProgressSink.wrap(sink);
        Path root = config.root();
        long started = System.nanoTime();
        progress.notify(root, root, ProgressStatus.SCAN_STARTED);
        LOGGER.info("Scanning {} (parallel={}, threads={})", root, config.parallel(), config.threadCount());

        ForkJoinPool pool = config.parallel() ? new ForkJoinPool(config.threadCount()) : null;
        try {
            SizeAggregator aggregator = new SizeAggregator(pool, progress, config.followLinks(), cancellation);
            DirectoryLister lister = new DirectoryLister(aggregator, EntryFactory.forConfig(config), progress, cancellation);
            List<Entry> entries = lister.list(root, config);
            double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;
            progress.notify(root, root, ProgressStatus.SCAN_COMPLETED);
            LOGGER.info("Scanned {} in {} s: {} entries", root, String.format(Locale.ROOT, "%.3f", elapsed), entries.size());
            return new ScanResult(entries, elapsed);
        } catch (ScanCancelledException ex) {
            progress.notify(root, root, ProgressStatus.SCAN_CANCELLED);
            LOGGER.info("Scan of {} cancelled", root);
            throw ex;
        } catch (IOException ex) {
            progress.notify(root, root, ProgressStatus.SCAN_FAILED);
            throw ex;
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
    }

    public CompletableFuture<ScanResult> scanAsync(ScanConfig config, ProgressSink sink) {
        return scanAsync(config, sink, CancellationToken.NONE);
    }

    /**
     * Runs {@link #scan(ScanConfig, ProgressSink, CancellationToken)} on the scanner's worker thread.
     * The future fails with the {@link RootUnreadableException} or, after cancellation, a
     * {@link CancellationException}.
     */
    public CompletableFuture<ScanResult> scanAsync(ScanConfig config, ProgressSink sink, CancellationToken cancellation) {
        CompletableFuture<ScanResult> future = new CompletableFuture<>();
        scanExecutor.execute(() -> {
            try {
                future.complete(scan(config, sink, cancellation));
            } catch (ScanCancelledException ex) {
                CancellationException cancelled = new CancellationException(ex.getMessage());
                cancelled.initCause(ex);
                future.completeExceptionally(cancelled);
            } catch (IOException | RuntimeException ex) {
                future.completeExceptionally(ex);
            }
        });
        return future;
    }

    @Override
    public void close() {
        scanExecutor.shutdown();
        try {
            if (!scanExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                scanExecutor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            scanExecutor.shutdownNow();
        }
    }
}
