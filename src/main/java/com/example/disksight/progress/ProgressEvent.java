package com.example.disksight.progress;

import java.nio.file.Path;

/**
 * One progress notification, as queued or recorded by sinks.
 */
public record ProgressEvent(
        Path currentDirectory,
        Path currentEntry,
        String status
) {
}
