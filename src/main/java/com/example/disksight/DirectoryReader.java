package com.example.disksight;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Directory enumeration shared by the traversal classes. An enumeration step that fails
 * ends the enumeration but keeps the children read before it.
 */
final class DirectoryReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryReader.class);
    private static final LinkOption[] FOLLOW = new LinkOption[0];
    private static final LinkOption[] NO_FOLLOW = new LinkOption[]{LinkOption.NOFOLLOW_LINKS};

    static final Comparator<Path> BY_NAME = Comparator.comparing(DirectoryReader::nameOf);

    private DirectoryReader() {
    }

    /**
     * Lists the children of {@code dir}; fails only when the directory itself cannot be opened.
     */
    static List<Path> children(Path dir) throws IOException {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                children.add(entry);
            }
        } catch (DirectoryIteratorException ex) {
            LOGGER.warn("Failed to read an entry of {}; keeping {} entries read so far", dir, children.size(), ex.getCause());
        }
        return children;
    }

    /**
     * Like {@link #children(Path)} but an unreadable directory yields no children.
     */
    static List<Path> childrenOrEmpty(Path dir) {
        try {
            return children(dir);
        } catch (IOException ex) {
            LOGGER.warn("Failed to list directory {}", dir, ex);
            return List.of();
        }
    }

    static List<Path> sortedChildren(Path dir) throws IOException {
        List<Path> children = children(dir);
        children.sort(BY_NAME);
        return children;
    }

    static LinkOption[] linkOptions(boolean followLinks) {
        return followLinks ? FOLLOW : NO_FOLLOW;
    }

    static String nameOf(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    static boolean isHidden(Path path) {
        try {
            return Files.isHidden(path);
        } catch (IOException ex) {
            LOGGER.debug("Failed to read hidden attribute for {}", path, ex);
            return nameOf(path).startsWith(".");
        }
    }
}
