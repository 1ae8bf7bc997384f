package com.example.disksight.progress;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertSame;

class GuardedProgressSinkTest {
    @Test
    void swallowsHostFailures() {
        ProgressSink guarded = GuardedProgressSink.wrap((directory, entry, status) -> {
            throw new IllegalStateException("channel closed");
        });

        assertDoesNotThrow(() -> guarded.notify(Path.of("a"), Path.of("a/b"), ProgressStatus.PROCESSING));
    }

    @Test
    void nullAndNoopNeedNoWrapping() {
        assertSame(ProgressSink.NOOP, GuardedProgressSink.wrap(null));
        assertSame(ProgressSink.NOOP, GuardedProgressSink.wrap(ProgressSink.NOOP));
        ProgressSink guarded = GuardedProgressSink.wrap(new LoggingProgressSink());
        assertSame(guarded, GuardedProgressSink.wrap(guarded));
    }
}
