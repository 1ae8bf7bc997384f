package com.example.disksight.progress;

import java.nio.file.Path;

/**
 * Receives best-effort notifications about which path a scan is working on.
 * Implementations may be called concurrently from parallel branches.
 */
@FunctionalInterface
public interface ProgressSink {
    /**
     * @param currentDirectory directory being worked in
     * @param currentEntry     entry within that directory (may equal the directory)
     * @param status           short status tag, see {@link ProgressStatus}
     */
    void notify(Path currentDirectory, Path currentEntry, String status);

    /**
     * Sink used when the caller does not observe progress.
     */
    ProgressSink NOOP = (currentDirectory, currentEntry, status) -> {
    };
}
