package com.example.disksight;

import java.nio.file.Path;

/**
 * Thrown at a directory boundary once the scan's {@link CancellationToken} has been cancelled.
 */
public class ScanCancelledException extends RuntimeException {
    public ScanCancelledException(Path at) {
        super("Scan cancelled at " + at);
    }
}
