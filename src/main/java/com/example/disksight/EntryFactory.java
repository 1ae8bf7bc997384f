package com.example.disksight;

import com.example.disksight.model.Entry;
import com.example.disksight.model.EntryKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.DosFileAttributeView;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Builds listing entries from a path, its attributes and an already computed size.
 */
public class EntryFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(EntryFactory.class);
    private static final String VERBATIM_PREFIX = "\\\\?\\";

    private final boolean humanReadable;
    private final boolean includeCreatedTime;
    private final LinkOption[] linkOptions;

    public EntryFactory(boolean humanReadable, boolean includeCreatedTime, boolean followLinks) {
        this.humanReadable = humanReadable;
        this.includeCreatedTime = includeCreatedTime;
        this.linkOptions = DirectoryReader.linkOptions(followLinks);
    }

    public static EntryFactory forConfig(ScanConfig config) {
        return new EntryFactory(config.humanReadable(), config.showTime(), config.followLinks());
    }

    public Entry create(Path path, BasicFileAttributes attrs, long sizeRaw) {
        return new Entry(
                attrs.isDirectory() ? EntryKind.DIRECTORY : EntryKind.FILE,
                permissionFlags(isReadOnly(path)),
                sizeRaw,
                SizeFormatter.format(sizeRaw, humanReadable),
                canonicalPath(path),
                DirectoryReader.nameOf(path),
                includeCreatedTime ? createdTime(attrs) : Optional.empty()
        );
    }

    static String permissionFlags(boolean readOnly) {
        return (readOnly ? "r" : " ") + "wx";
    }

    /**
     * Canonical absolute path without a Windows verbatim prefix; the absolute path if the
     * path cannot be resolved.
     */
    static String canonicalPath(Path path) {
        try {
            return stripVerbatimPrefix(path.toRealPath().toString());
        } catch (IOException ex) {
            LOGGER.debug("Failed to canonicalize {}", path, ex);
            return path.toAbsolutePath().toString();
        }
    }

    static String stripVerbatimPrefix(String path) {
        return path.startsWith(VERBATIM_PREFIX) ? path.substring(VERBATIM_PREFIX.length()) : path;
    }

    // Read-only means no write bit at all on POSIX, the DOS read-only attribute elsewhere.
    boolean isReadOnly(Path path) {
        try {
            PosixFileAttributeView posix = Files.getFileAttributeView(path, PosixFileAttributeView.class, linkOptions);
            if (posix != null) {
                Set<PosixFilePermission> permissions = posix.readAttributes().permissions();
                return !permissions.contains(PosixFilePermission.OWNER_WRITE)
                        && !permissions.contains(PosixFilePermission.GROUP_WRITE)
                        && !permissions.contains(PosixFilePermission.OTHERS_WRITE);
            }
            DosFileAttributeView dos = Files.getFileAttributeView(path, DosFileAttributeView.class, linkOptions);
            if (dos != null) {
                return dos.readAttributes().isReadOnly();
            }
        } catch (IOException ex) {
            LOGGER.debug("Failed to read permissions for {}", path, ex);
        }
        return !Files.isWritable(path);
    }

    private Optional<Instant> createdTime(BasicFileAttributes attrs) {
        FileTime created = attrs.creationTime();
        return created == null ? Optional.empty() : Optional.of(created.toInstant());
    }
}
