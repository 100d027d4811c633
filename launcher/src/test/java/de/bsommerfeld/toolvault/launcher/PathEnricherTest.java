package de.bsommerfeld.toolvault.launcher;

import de.bsommerfeld.toolvault.core.util.StorageUtils;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

/**
 * Tests for PathEnricher's process environment enrichment.
 */
class PathEnricherTest {

    private static final Path TOOL_DIR = Path.of("library", "blender", "4.1").toAbsolutePath();

    @Test
    void enrich_shouldPrependToolDirectory() {
        ProcessBuilder pb = new ProcessBuilder();
        pb.environment().put("PATH", "/custom/path");

        PathEnricher.enrich(pb, TOOL_DIR);

        assertEquals(TOOL_DIR + File.pathSeparator + "/custom/path", pb.environment().get("PATH"));
    }

    @Test
    void enrich_shouldUseDefaultPathWhenMissing() {
        assumeFalse(StorageUtils.isWindows());
        ProcessBuilder pb = new ProcessBuilder();
        pb.environment().remove("PATH");

        PathEnricher.enrich(pb, TOOL_DIR);

        String path = pb.environment().get("PATH");
        assertTrue(path.startsWith(TOOL_DIR.toString()));
        assertTrue(path.endsWith("/usr/bin:/bin"));
    }

    @Test
    void enrich_shouldReuseExistingKeySpelling() {
        ProcessBuilder pb = new ProcessBuilder();
        pb.environment().remove("PATH");
        pb.environment().put("Path", "C:\\Windows");

        PathEnricher.enrich(pb, TOOL_DIR);

        assertTrue(pb.environment().get("Path").startsWith(TOOL_DIR.toString()));
    }
}
