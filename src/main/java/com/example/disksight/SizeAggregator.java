package com.example.disksight;

import com.example.disksight.progress.ProgressSink;
import com.example.disksight.progress.ProgressStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;

/**
 * Sums the bytes of every readable file below a directory.
 *
 * <p>Entries that cannot be listed or stat'ed add nothing to the total and are logged;
 * a failure never reaches sibling or ancestor sums. In parallel mode each directory's
 * children are summed as one fork/join task per child directory, so parallelism follows
 * the breadth of the tree up to the pool size.
 *
 * <p>With {@code followLinks} set there is no cycle detection: a link pointing at one of
 * its own ancestors recurses without bound.
 */
public final class SizeAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SizeAggregator.class);

    private final ForkJoinPool pool;
    private final ProgressSink progress;
    private final LinkOption[] linkOptions;
    private final CancellationToken cancellation;

    public SizeAggregator(ForkJoinPool pool, ProgressSink progress, boolean followLinks) {
        this(pool, progress, followLinks, CancellationToken.NONE);
    }

    public SizeAggregator(ForkJoinPool pool,
                          ProgressSink progress,
                          boolean followLinks,
                          CancellationToken cancellation) {
        this.pool = pool;
        this.progress = progress;
        this.linkOptions = DirectoryReader.linkOptions(followLinks);
        this.cancellation = cancellation;
    }

    /**
     * Returns the total size in bytes of the files below {@code dir}. Never fails on I/O errors.
     *
     * @param parallel fan out over child directories on the pool; the choice holds for every level
     */
    public long aggregate(Path dir, boolean parallel) {
        progress.notify(dir, dir, ProgressStatus.CALCULATING_DIRECTORY_SIZE);
        long total = parallel && pool != null
                ? pool.invoke(new DirectorySumTask(dir))
                : sumSequential(dir);
        LOGGER.debug("Total size of {}: {}", dir, total);
        return total;
    }

    private long sumSequential(Path dir) {
        cancellation.throwIfCancelled(dir);
        long total = 0L;
        for (Path child : enumerate(dir)) {
            BasicFileAttributes attrs = stat(child);
            if (attrs == null) {
                continue;
            }
            total += attrs.isDirectory() ? sumSequential(child) : attrs.size();
        }
        return total;
    }

    private List<Path> enumerate(Path dir) {
        List<Path> children = DirectoryReader.childrenOrEmpty(dir);
        for (Path child : children) {
            progress.notify(dir, child, ProgressStatus.PROCESSING_FILE);
        }
        return children;
    }

    private BasicFileAttributes stat(Path path) {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class, linkOptions);
        } catch (IOException ex) {
            LOGGER.warn("Failed to read metadata for {}", path, ex);
            return null;
        }
    }

    private final class DirectorySumTask extends RecursiveTask<Long> {
        private final Path dir;

        private DirectorySumTask(Path dir) {
            this.dir = dir;
        }

        @Override
        protected Long compute() {
            cancellation.throwIfCancelled(dir);
            long files = 0L;
            List<DirectorySumTask> subdirectories = new ArrayList<>();
            for (Path child : enumerate(dir)) {
                BasicFileAttributes attrs = stat(child);
                if (attrs == null) {
                    continue;
                }
                if (attrs.isDirectory()) {
                    subdirectories.add(new DirectorySumTask(child));
                } else {
                    files += attrs.size();
                }
            }
            long total = files;
            for (DirectorySumTask task : invokeAll(subdirectories)) {
                total += task.join();
            }
            return total;
        }
    }
}
