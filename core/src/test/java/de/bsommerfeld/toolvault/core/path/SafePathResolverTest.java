package de.bsommerfeld.toolvault.core.path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SafePathResolverTest {

    @TempDir
    Path root;

    @Test
    void resolveWithin_shouldResolveNestedRelativePath() {
        PathResolution result = SafePathResolver.resolveWithin(root, "engines/godot-4.3.zip");

        assertTrue(result.success());
        assertEquals(root.toAbsolutePath().normalize().resolve("engines").resolve("godot-4.3.zip"),
                result.fullPath());
        assertNull(result.errorCode());
    }

    @Test
    void resolveWithin_shouldTreatBackslashesAsSeparators() {
        PathResolution result = SafePathResolver.resolveWithin(root, "engines\\godot.zip");

        assertTrue(result.success());
        assertEquals(root.toAbsolutePath().normalize().resolve("engines").resolve("godot.zip"),
                result.fullPath());
    }

    @Test
    void resolveWithin_shouldIgnoreCurrentDirectorySegments() {
        PathResolution result = SafePathResolver.resolveWithin(root, "./a/./b.zip");

        assertTrue(result.success());
        assertEquals(root.toAbsolutePath().normalize().resolve("a").resolve("b.zip"), result.fullPath());
    }

    @Test
    void resolveWithin_shouldRejectParentSegments() {
        for (String input : new String[]{"../outside.exe", "a/../../b", "a/..", "..\\x", "a\\..\\..\\b"}) {
            PathResolution result = SafePathResolver.resolveWithin(root, input);
            assertFalse(result.success(), input);
            assertEquals(PathResolution.PATH_TRAVERSAL, result.errorCode(), input);
            assertTrue(result.isTraversal(), input);
        }
    }

    @Test
    void resolveWithin_shouldRejectParentSegmentEvenIfItStaysInside() {
        PathResolution result = SafePathResolver.resolveWithin(root, "a/../b.zip");
        assertEquals(PathResolution.PATH_TRAVERSAL, result.errorCode());
    }

    @Test
    void resolveWithin_shouldRejectAbsolutePaths() {
        String[] inputs = {"/etc/passwd", "\\Windows\\system32", "C:\\Windows", "c:/x", "\\\\server\\share"};
        for (String input : inputs) {
            PathResolution result = SafePathResolver.resolveWithin(root, input);
            assertFalse(result.success(), input);
            assertEquals(PathResolution.PATH_ABSOLUTE, result.errorCode(), input);
            assertFalse(result.isTraversal(), input);
        }
    }

    @Test
    void resolveWithin_shouldRejectEmptyInput() {
        assertEquals(PathResolution.PATH_EMPTY, SafePathResolver.resolveWithin(root, "").errorCode());
        assertEquals(PathResolution.PATH_EMPTY, SafePathResolver.resolveWithin(root, "   ").errorCode());
        assertEquals(PathResolution.PATH_EMPTY, SafePathResolver.resolveWithin(root, null).errorCode());
    }

    @Test
    void resolveWithin_shouldEmbedInputInMessage() {
        PathResolution result = SafePathResolver.resolveWithin(root, "../outside.exe");
        assertTrue(result.message().contains("../outside.exe"));
    }

    @Test
    void simplify_shouldFoldSegmentsLexically() {
        assertEquals("a/c", SafePathResolver.simplify("a/b/../c"));
        assertEquals("/x/y", SafePathResolver.simplify("/x//./y/"));
        assertEquals("", SafePathResolver.simplify("./."));
    }
}
