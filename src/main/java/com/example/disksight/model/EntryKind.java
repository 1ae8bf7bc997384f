package com.example.disksight.model;

public enum EntryKind {
    FILE,
    DIRECTORY;

    /**
     * Single-character type marker used by listings ({@code d} or {@code -}).
     */
    public char marker() {
        return this == DIRECTORY ? 'd' : '-';
    }
}
