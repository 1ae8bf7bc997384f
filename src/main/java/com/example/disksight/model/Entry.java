package com.example.disksight.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Optional;

/**
 * One listed child of the scanned root, or one name-filter match below it.
 *
 * @param permissionFlags three characters: {@code r} or a space for the read-only bit, then {@code w} and {@code x}
 * @param sizeRaw         file length, or the recursive sum of readable descendants for a directory
 * @param sizeDisplay     {@code sizeRaw} rendered by {@link com.example.disksight.SizeFormatter}
 * @param path            canonical absolute path, or the absolute path when canonicalization failed
 * @param createdTime     creation time when requested and available
 */
public record Entry(
        EntryKind kind,
        String permissionFlags,
        long sizeRaw,
        String sizeDisplay,
        String path,
        String name,
        Optional<Instant> createdTime
) {
    @JsonIgnore
    public boolean isDirectory() {
        return kind == EntryKind.DIRECTORY;
    }
}
