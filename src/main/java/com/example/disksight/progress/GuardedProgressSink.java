package com.example.disksight.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Keeps delivery failures of a host sink away from the traversal.
 */
public final class GuardedProgressSink implements ProgressSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(GuardedProgressSink.class);

    private final ProgressSink delegate;

    private GuardedProgressSink(ProgressSink delegate) {
        this.delegate = delegate;
    }

    /**
     * Wraps the given sink; {@code null} and already guarded sinks are handled.
     */
    public static ProgressSink wrap(ProgressSink sink) {
        if (sink == null) {
            return ProgressSink.NOOP;
        }
        if (sink == ProgressSink.NOOP || sink instanceof GuardedProgressSink) {
            return sink;
        }
        return new GuardedProgressSink(sink);
    }

    @Override
    public void notify(Path currentDirectory, Path currentEntry, String status) {
        try {
            delegate.notify(currentDirectory, currentEntry, status);
        } catch (RuntimeException ex) {
            LOGGER.warn("Dropping progress event {} for {}", status, currentEntry, ex);
        }
    }
}
