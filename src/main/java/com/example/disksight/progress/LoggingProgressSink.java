package com.example.disksight.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Writes progress events to the log at DEBUG level.
 */
public final class LoggingProgressSink implements ProgressSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressSink.class);

    @Override
    public void notify(Path currentDirectory, Path currentEntry, String status) {
        LOGGER.debug("[{}] {} :: {}", status, currentDirectory, currentEntry);
    }
}
