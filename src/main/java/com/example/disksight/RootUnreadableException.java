package com.example.disksight;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The scan root could not be opened for reading. This is the only failure a scan reports to its caller.
 */
public class RootUnreadableException extends IOException {
    private final Path root;

    public RootUnreadableException(Path root, IOException cause) {
        super("cannot access '" + root + "': " + describe(cause), cause);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }

    private static String describe(IOException cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null ? "" : " (" + message + ")");
    }
}
