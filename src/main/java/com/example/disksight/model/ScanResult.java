package com.example.disksight.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Ordered entries of one scan plus the wall-clock time it took.
 */
public record ScanResult(
        List<Entry> entries,
        double elapsedSeconds
) {
    public ScanResult {
        entries = List.copyOf(entries);
    }

    @JsonIgnore
    public int entryCount() {
        return entries.size();
    }

    @JsonIgnore
    public long totalBytes() {
        return entries.stream().mapToLong(Entry::sizeRaw).sum();
    }
}
