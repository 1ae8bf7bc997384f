package com.example.disksight;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for one scan.
 */
public record ScanConfig(
        Path root,
        boolean recurseDetailed,
        boolean humanReadable,
        boolean showHidden,
        Optional<String> nameFilter,
        boolean parallel,
        boolean sortBySize,
        SortDirection sortDirection,
        boolean fullPath,
        boolean showTime,
        boolean followLinks,
        int threadCount,
        Optional<Path> outputFile
) {
    /** Upper bound on {@code ForkJoinPool} parallelism. */
    static final int MAX_THREADS = 0x7fff;

    public ScanConfig {
        Objects.requireNonNull(root, "root");
        nameFilter = nameFilter == null ? Optional.empty() : nameFilter.filter(value -> !value.isBlank());
        sortDirection = sortDirection == null ? SortDirection.DESCENDING : sortDirection;
        threadCount = threadCount > 0 ? Math.min(threadCount, MAX_THREADS) : defaultThreadCount();
        outputFile = outputFile == null ? Optional.empty() : outputFile;
    }

    /**
     * Defaults used by the desktop viewer: detailed, human readable, parallel, largest first.
     */
    public static ScanConfig defaults(Path root) {
        return builder(root).build();
    }

    public static Builder builder(Path root) {
        return new Builder(root);
    }

    public Builder toBuilder() {
        return new Builder(root)
                .recurseDetailed(recurseDetailed)
                .humanReadable(humanReadable)
                .showHidden(showHidden)
                .nameFilter(nameFilter.orElse(null))
                .parallel(parallel)
                .sortBySize(sortBySize)
                .sortDirection(sortDirection)
                .fullPath(fullPath)
                .showTime(showTime)
                .followLinks(followLinks)
                .threadCount(threadCount)
                .outputFile(outputFile.orElse(null));
    }

    static int defaultThreadCount() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public static final class Builder {
        private Path root;
        private boolean recurseDetailed = true;
        private boolean humanReadable = true;
        private boolean showHidden = true;
        private String nameFilter;
        private boolean parallel = true;
        private boolean sortBySize = true;
        private SortDirection sortDirection = SortDirection.DESCENDING;
        private boolean fullPath;
        private boolean showTime;
        private boolean followLinks;
        private int threadCount;
        private Path outputFile;

        private Builder(Path root) {
            this.root = root;
        }

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        public Builder recurseDetailed(boolean recurseDetailed) {
            this.recurseDetailed = recurseDetailed;
            return this;
        }

        public Builder humanReadable(boolean humanReadable) {
            this.humanReadable = humanReadable;
            return this;
        }

        public Builder showHidden(boolean showHidden) {
            this.showHidden = showHidden;
            return this;
        }

        public Builder nameFilter(String nameFilter) {
            this.nameFilter = nameFilter;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder sortBySize(boolean sortBySize) {
            this.sortBySize = sortBySize;
            return this;
        }

        public Builder sortDirection(SortDirection sortDirection) {
            this.sortDirection = sortDirection;
            return this;
        }

        public Builder fullPath(boolean fullPath) {
            this.fullPath = fullPath;
            return this;
        }

        public Builder showTime(boolean showTime) {
            this.showTime = showTime;
            return this;
        }

        public Builder followLinks(boolean followLinks) {
            this.followLinks = followLinks;
            return this;
        }

        public Builder threadCount(int threadCount) {
            this.threadCount = threadCount;
            return this;
        }

        public Builder outputFile(Path outputFile) {
            this.outputFile = outputFile;
            return this;
        }

        public ScanConfig build() {
            return new ScanConfig(
                    root,
                    recurseDetailed,
                    humanReadable,
                    showHidden,
                    Optional.ofNullable(nameFilter),
                    parallel,
                    sortBySize,
                    sortDirection,
                    fullPath,
                    showTime,
                    followLinks,
                    threadCount,
                    Optional.ofNullable(outputFile)
            );
        }
    }
}
