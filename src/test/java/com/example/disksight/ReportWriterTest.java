package com.example.disksight;

import com.example.disksight.model.Entry;
import com.example.disksight.model.EntryKind;
import com.example.disksight.model.ScanResult;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportWriterTest {
    private static final Instant CREATED = Instant.parse("2024-05-01T10:15:30Z");

    private final ScanResult result = new ScanResult(List.of(
            new Entry(EntryKind.DIRECTORY, " wx", 2048L, "2.00 KB", "/data/photos", "photos", Optional.of(CREATED)),
            new Entry(EntryKind.FILE, "rwx", 12L, "12 B", "/data/notes.txt", "notes.txt", Optional.empty())
    ), 0.25);

    @Test
    void writesJsonReportIntoNewDirectory() throws Exception {
        Path output = Files.createTempDirectory("report-test").resolve("nested").resolve("report.json");
        ReportWriter writer = new ReportWriter();

        writer.writeJson(result, output);

        assertTrue(Files.exists(output));
        String json = Files.readString(output);
        assertTrue(json.contains("\"sizeRaw\" : 2048"));
        assertTrue(json.contains("\"createdTime\" : \"2024-05-01T10:15:30Z\""));
        assertFalse(json.contains("totalBytes"));

        ScanResult read = writer.readJson(output);
        assertEquals(result, read);
    }

    @Test
    void rendersNamesOrFullPaths() {
        ReportWriter writer = new ReportWriter();
        ScanConfig names = ScanConfig.builder(Path.of("/data")).build();
        ScanConfig paths = names.toBuilder().fullPath(true).showTime(true).build();

        String[] nameLines = writer.renderTable(result, names).split(System.lineSeparator());
        String[] pathLines = writer.renderTable(result, paths).split(System.lineSeparator());

        assertEquals("d wx 2.00 KB photos", nameLines[0]);
        assertEquals("-rwx    12 B notes.txt", nameLines[1]);
        assertEquals("total: 2 entries, 2.01 KB in 0.25s", nameLines[2]);
        assertEquals("d wx 2.00 KB 2024-05-01T10:15:30Z /data/photos", pathLines[0]);
        assertEquals("-rwx    12 B - /data/notes.txt", pathLines[1]);
    }
}
