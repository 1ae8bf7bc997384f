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
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Lists the immediate children of a directory with their recursive sizes.
 *
 * <p>Only a root that cannot be opened fails the listing. A child whose metadata cannot be
 * read is left out and logged. With a name filter, only directories whose name contains the
 * filter are reported, found at any depth below the root.
 */
public final class DirectoryLister {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryLister.class);

    private final SizeAggregator aggregator;
    private final EntryFactory entryFactory;
    private final ProgressSink progress;
    private final CancellationToken cancellation;

    public DirectoryLister(SizeAggregator aggregator,
                           EntryFactory entryFactory,
                           ProgressSink progress,
                           CancellationToken cancellation) {
        this.aggregator = aggregator;
        this.entryFactory = entryFactory;
        this.progress = progress;
        this.cancellation = cancellation;
    }

    /**
     * Returns the base names of the root's children in lexicographic order.
     *
     * @throws RootUnreadableException if the root cannot be opened
     */
    public List<String> listNames(Path root, ScanConfig config) throws IOException {
        List<String> names = new ArrayList<>();
        for (Path child : readRoot(root)) {
            if (!config.showHidden() && DirectoryReader.isHidden(child)) {
                continue;
            }
            names.add(DirectoryReader.nameOf(child));
        }
        return names;
    }

    /**
     * Lists {@code root}. Without {@code recurseDetailed} no metadata is gathered and the result is empty.
     *
     * @throws RootUnreadableException if the root cannot be opened
     */
    public List<Entry> list(Path root, ScanConfig config) throws IOException {
        List<Path> children = readRoot(root);
        List<Entry> entries = new ArrayList<>();
        if (!config.recurseDetailed()) {
            LOGGER.debug("Listed {} names under {} without details", children.size(), root);
            return entries;
        }

        LinkOption[] linkOptions = DirectoryReader.linkOptions(config.followLinks());
        Optional<String> nameFilter = config.nameFilter();
        NameFilterWalker walker = nameFilter.isPresent()
                ? new NameFilterWalker(aggregator, entryFactory, progress, config, cancellation)
                : null;

        int total = children.size();
        int milestone = Math.max(1, total / 10);
        for (int index = 0; index < total; index++) {
            Path child = children.get(index);
            String name = DirectoryReader.nameOf(child);
            cancellation.throwIfCancelled(child);
            progress.notify(root, child, ProgressStatus.PROCESSING);
            if (index % milestone == 0) {
                progress.notify(root, child, ProgressStatus.progress(index * 100 / total));
            }

            if (!config.showHidden() && DirectoryReader.isHidden(child)) {
                continue;
            }

            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(child, BasicFileAttributes.class, linkOptions);
            } catch (IOException ex) {
                LOGGER.warn("cannot access '{}'", child, ex);
                continue;
            }

            if (nameFilter.isPresent()) {
                if (!attrs.isDirectory()) {
                    continue;
                }
                if (!name.contains(nameFilter.get())) {
                    entries.addAll(walker.findMatches(child, nameFilter.get()));
                    continue;
                }
            }

            long size;
            if (attrs.isDirectory()) {
                progress.notify(root, child, ProgressStatus.CALCULATING_DIRECTORY_SIZE);
                size = aggregator.aggregate(child, config.parallel());
                progress.notify(root, child, ProgressStatus.DIRECTORY_CALCULATION_COMPLETED);
            } else {
                size = attrs.size();
            }
            entries.add(entryFactory.create(child, attrs, size));
            progress.notify(root, child, ProgressStatus.COMPLETED);
        }

        if (config.sortBySize()) {
            entries.sort(sizeOrder(config.sortDirection()));
        }
        return entries;
    }

    static Comparator<Entry> sizeOrder(SortDirection direction) {
        Comparator<Entry> ascending = Comparator.comparingLong(Entry::sizeRaw);
        return direction == SortDirection.ASCENDING ? ascending : ascending.reversed();
    }

    private List<Path> readRoot(Path root) throws IOException {
        try {
            return DirectoryReader.sortedChildren(root);
        } catch (IOException ex) {
            LOGGER.error("cannot access '{}': {}", root, ex.toString());
            throw new RootUnreadableException(root, ex);
        }
    }
}
