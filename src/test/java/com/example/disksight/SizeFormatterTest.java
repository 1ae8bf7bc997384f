package com.example.disksight;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SizeFormatterTest {
    @Test
    void zeroBytesUsesByteUnit() {
        assertEquals("0 B", SizeFormatter.format(0L, true));
    }

    @Test
    void scalesThroughBinaryUnits() {
        assertEquals("1023 B", SizeFormatter.format(1023L, true));
        assertEquals("1.00 KB", SizeFormatter.format(1024L, true));
        assertEquals("1.50 KB", SizeFormatter.format(1536L, true));
        assertEquals("5.00 MB", SizeFormatter.format(5L * 1024 * 1024, true));
        assertEquals("2.25 GB", SizeFormatter.format(2L * 1024 * 1024 * 1024 + 256L * 1024 * 1024, true));
        assertEquals("8.00 EB", SizeFormatter.format(Long.MAX_VALUE, true));
    }

    @Test
    void roundingUpToNextUnitMovesToThatUnit() {
        assertEquals("1.00 MB", SizeFormatter.format(1024L * 1024 - 1, true));
        assertEquals("1.00 GB", SizeFormatter.format(1024L * 1024 * 1024 - 1, true));
        assertEquals("1023.99 KB", SizeFormatter.format(1023L * 1024 + 1013, true));
    }

    @Test
    void rawFormatIsDecimalString() {
        for (long value : new long[]{0L, 1L, 1536L, 987_654_321L, Long.MAX_VALUE}) {
            assertEquals(Long.toString(value), SizeFormatter.format(value, false));
        }
    }
}
