package de.bsommerfeld.toolvault.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteFormatterTest {

    @Test
    void format_shouldHandleBytes() {
        assertEquals("0 B", ByteFormatter.format(0));
        assertEquals("1023 B", ByteFormatter.format(1023));
    }

    @Test
    void format_shouldScaleUnits() {
        assertEquals("1.0 KB", ByteFormatter.format(1024));
        assertEquals("1.5 MB", ByteFormatter.format(1024 * 1024 + 512 * 1024));
        assertEquals("2.0 GB", ByteFormatter.format(2L * 1024 * 1024 * 1024));
    }

    @Test
    void format_shouldMarkUnknownSizes() {
        assertEquals("? B", ByteFormatter.format(-1));
    }

    @Test
    void formatProgress_shouldOmitUnknownTotal() {
        assertEquals("512 B / 1.0 KB", ByteFormatter.formatProgress(512, 1024));
        assertEquals("512 B", ByteFormatter.formatProgress(512, -1));
    }

    @Test
    void toMegabytes_shouldRoundToTwoDecimals() {
        assertEquals(1.0, ByteFormatter.toMegabytes(1024 * 1024));
        assertEquals(0.0, ByteFormatter.toMegabytes(0));
        assertEquals(2.5, ByteFormatter.toMegabytes(2 * 1024 * 1024 + 512 * 1024));
    }
}
