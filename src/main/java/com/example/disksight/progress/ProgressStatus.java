package com.example.disksight.progress;

/**
 * Status tags emitted during a scan. The vocabulary is open; hosts should ignore tags they do not know.
 */
public final class ProgressStatus {
    public static final String SCAN_STARTED = "scan_started";
    public static final String PROCESSING = "processing";
    public static final String CALCULATING_DIRECTORY_SIZE = "calculating_directory_size";
    public static final String DIRECTORY_CALCULATION_COMPLETED = "directory_calculation_completed";
    public static final String SEARCHING_IN_DIRECTORY = "searching_in_directory";
    public static final String CHECKING_FILE = "checking_file";
    public static final String CALCULATING_MATCHING_DIRECTORY = "calculating_matching_directory";
    public static final String MATCHING_DIRECTORY_COMPLETED = "matching_directory_completed";
    public static final String PROCESSING_FILE = "processing_file";
    public static final String COMPLETED = "completed";
    public static final String SCAN_COMPLETED = "scan_completed";
    public static final String SCAN_FAILED = "scan_failed";
    public static final String SCAN_CANCELLED = "scan_cancelled";

    private ProgressStatus() {
    }

    /**
     * Coarse milestone tag, e.g. {@code progress_40%}.
     */
    public static String progress(int percent) {
        return "progress_" + percent + "%";
    }
}
