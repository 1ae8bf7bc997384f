package com.example.disksight;

import com.example.disksight.model.Entry;
import com.example.disksight.model.EntryKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntryFactoryTest {
    @Test
    void buildsEntryFromAttributes() throws Exception {
        Path dir = Files.createTempDirectory("factory-test");
        Path file = Files.write(dir.resolve("report.pdf"), new byte[10]);
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);

        Entry entry = new EntryFactory(true, true, false).create(file, attrs, 4096L);

        assertEquals(EntryKind.FILE, entry.kind());
        assertEquals(4096L, entry.sizeRaw());
        assertEquals("4.00 KB", entry.sizeDisplay());
        assertEquals("report.pdf", entry.name());
        assertEquals(file.toRealPath().toString(), entry.path());
        assertEquals(3, entry.permissionFlags().length());
        assertTrue(entry.createdTime().isPresent());
    }

    @Test
    void canonicalPathFallsBackToAbsolutePath() throws Exception {
        Path missing = Files.createTempDirectory("factory-missing").resolve("gone").resolve("..").resolve("x");

        assertEquals(missing.toAbsolutePath().toString(), EntryFactory.canonicalPath(missing));
    }

    @Test
    void stripsWindowsVerbatimPrefix() {
        assertEquals("C:\\Users\\me", EntryFactory.stripVerbatimPrefix("\\\\?\\C:\\Users\\me"));
        assertEquals("/home/me", EntryFactory.stripVerbatimPrefix("/home/me"));
    }

    @Test
    void permissionFlagsCarryOnlyReadOnlyBit() {
        assertEquals("rwx", EntryFactory.permissionFlags(true));
        assertEquals(" wx", EntryFactory.permissionFlags(false));
    }
}
