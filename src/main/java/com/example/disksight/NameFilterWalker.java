package com.example.disksight;

import com.example.disksight.model.Entry;
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

/**
 * Searches a subtree for directories whose name contains a filter string.
 *
 * <p>Each match is sized as a whole and reported once; the walker does not look inside a
 * match. Directories that do not match are searched but never reported. Files are ignored.
 * Matching is case-sensitive substring containment.
 */
public final class NameFilterWalker {
    private static final Logger LOGGER = LoggerFactory.getLogger(NameFilterWalker.class);

    private final SizeAggregator aggregator;
    private final EntryFactory entryFactory;
    private final ProgressSink progress;
    private final boolean parallel;
    private final boolean showHidden;
    private final LinkOption[] linkOptions;
    private final CancellationToken cancellation;

    public NameFilterWalker(SizeAggregator aggregator,
                            EntryFactory entryFactory,
                            ProgressSink progress,
                            ScanConfig config,
                            CancellationToken cancellation) {
        this.aggregator = aggregator;
        this.entryFactory = entryFactory;
        this.progress = progress;
        this.parallel = config.parallel();
        this.showHidden = config.showHidden();
        this.linkOptions = DirectoryReader.linkOptions(config.followLinks());
        this.cancellation = cancellation;
    }

    /**
     * Returns one entry per nearest matching directory below {@code dir}, in depth-first name order.
     * {@code dir} itself is not tested against the filter.
     */
    public List<Entry> findMatches(Path dir, String filter) {
        List<Entry> matches = new ArrayList<>();
        search(dir, filter, matches);
        return matches;
    }

    private void search(Path dir, String filter, List<Entry> matches) {
        cancellation.throwIfCancelled(dir);
        progress.notify(dir, dir, ProgressStatus.SEARCHING_IN_DIRECTORY);

        List<Path> children;
        try {
            children = DirectoryReader.sortedChildren(dir);
        } catch (IOException ex) {
            LOGGER.warn("Failed to search directory {}", dir, ex);
            return;
        }

        for (Path child : children) {
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(child, BasicFileAttributes.class, linkOptions);
            } catch (IOException ex) {
                LOGGER.warn("Failed to read metadata for {}", child, ex);
                continue;
            }
            progress.notify(dir, child, ProgressStatus.CHECKING_FILE);

            if (!attrs.isDirectory()) {
                continue;
            }
            if (!showHidden && DirectoryReader.isHidden(child)) {
                continue;
            }
            if (DirectoryReader.nameOf(child).contains(filter)) {
                progress.notify(dir, child, ProgressStatus.CALCULATING_MATCHING_DIRECTORY);
                long size = aggregator.aggregate(child, parallel);
                matches.add(entryFactory.create(child, attrs, size));
                progress.notify(dir, child, ProgressStatus.MATCHING_DIRECTORY_COMPLETED);
            } else {
                search(child, filter, matches);
            }
        }
    }
}
