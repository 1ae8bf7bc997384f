package com.example.disksight;

import com.example.disksight.model.Entry;
import com.example.disksight.model.ScanResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Renders scan results as a text listing or a JSON report file.
 */
public final class ReportWriter {
    private final ObjectMapper mapper;

    public ReportWriter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public ReportWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Writes the result as pretty-printed JSON, creating parent directories if needed.
     */
    public void writeJson(ScanResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), result);
    }

    ScanResult readJson(Path file) throws IOException {
        return mapper.readValue(file.toFile(), ScanResult.class);
    }

    /**
     * One line per entry: type, permission flags, size, optional creation time and name
     * (or canonical path with {@code fullPath}), followed by a totals line.
     */
    public String renderTable(ScanResult result, ScanConfig config) {
        int sizeWidth = 1;
        for (Entry entry : result.entries()) {
            sizeWidth = Math.max(sizeWidth, entry.sizeDisplay().length());
        }
        StringBuilder builder = new StringBuilder();
        for (Entry entry : result.entries()) {
            builder.append(entry.kind().marker())
                    .append(entry.permissionFlags())
                    .append(' ')
                    .append(pad(entry.sizeDisplay(), sizeWidth));
            if (config.showTime()) {
                builder.append(' ').append(entry.createdTime().map(Object::toString).orElse("-"));
            }
            builder.append(' ')
                    .append(config.fullPath() ? entry.path() : entry.name())
                    .append(System.lineSeparator());
        }
        builder.append(String.format(Locale.ROOT, "total: %d entries, %s in %.2fs",
                result.entryCount(),
                SizeFormatter.format(result.totalBytes(), config.humanReadable()),
                result.elapsedSeconds()));
        return builder.toString();
    }

    private String pad(String value, int width) {
        StringBuilder padded = new StringBuilder(width);
        for (int i = value.length(); i < width; i++) {
            padded.append(' ');
        }
        return padded.append(value).toString();
    }
}
