package com.example.disksight;

import java.nio.file.Path;

/**
 * Cooperative cancellation flag shared between a caller and a running scan.
 */
public final class CancellationToken {
    /**
     * Token for scans that run to completion.
     */
    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared NONE token cannot be cancelled.");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void throwIfCancelled(Path at) {
        if (cancelled) {
            throw new ScanCancelledException(at);
        }
    }
}
