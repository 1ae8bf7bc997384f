package com.example.disksight;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a JSON scan configuration. Missing keys fall back to the viewer defaults.
 */
public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ScanConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.root == null || raw.root.isBlank()) {
            throw new IllegalArgumentException("Config must include a root path.");
        }
        if (raw.threadCount != null && raw.threadCount < 0) {
            throw new IllegalArgumentException("threadCount must not be negative.");
        }

        ScanConfig.Builder builder = ScanConfig.builder(Path.of(raw.root))
                .recurseDetailed(flag(raw.recurseDetailed, true))
                .humanReadable(flag(raw.humanReadable, true))
                .showHidden(flag(raw.showHidden, true))
                .nameFilter(optionalString(raw.nameFilter))
                .parallel(flag(raw.parallel, true))
                .sortBySize(flag(raw.sortBySize, true))
                .fullPath(flag(raw.fullPath, false))
                .showTime(flag(raw.showTime, false))
                .followLinks(flag(raw.followLinks, false))
                .threadCount(raw.threadCount != null && raw.threadCount > 0
                        ? raw.threadCount
                        : ScanConfig.defaultThreadCount());

        String direction = optionalString(raw.sortDirection);
        if (direction != null) {
            builder.sortDirection(SortDirection.parse(direction));
        }
        String outputFile = optionalString(raw.outputFile);
        if (outputFile != null) {
            builder.outputFile(Path.of(outputFile));
        }
        return builder.build();
    }

    private boolean flag(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private String optionalString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value;
    }

    private static class RawConfig {
        public String root;
        public Boolean recurseDetailed;
        public Boolean humanReadable;
        public Boolean showHidden;
        public String nameFilter;
        public Boolean parallel;
        public Boolean sortBySize;
        public String sortDirection;
        public Boolean fullPath;
        public Boolean showTime;
        public Boolean followLinks;
        public Integer threadCount;
        public String outputFile;
    }
}
