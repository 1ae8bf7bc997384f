package com.example.disksight;

import java.util.Locale;

public enum SortDirection {
    ASCENDING,
    DESCENDING;

    /**
     * Parses {@code ascending}/{@code asc} or {@code descending}/{@code desc}, case-insensitive.
     */
    public static SortDirection parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "asc":
            case "ascending":
                return ASCENDING;
            case "desc":
            case "descending":
                return DESCENDING;
            default:
                throw new IllegalArgumentException("Unknown sortDirection: " + value);
        }
    }
}
