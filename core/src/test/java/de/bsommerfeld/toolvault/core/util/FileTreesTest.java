package de.bsommerfeld.toolvault.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileTreesTest {

    @TempDir
    Path tempDir;

    private Path sampleTree() throws IOException {
        Path root = tempDir.resolve("tree");
        Files.createDirectories(root.resolve("b/deep/deeper"));
        Files.createDirectories(root.resolve("a"));
        Files.createDirectories(root.resolve("empty"));
        Files.writeString(root.resolve("top.txt"), "top");
        Files.writeString(root.resolve("a/one.txt"), "1");
        Files.writeString(root.resolve("b/deep/deeper/leaf.bin"), "leaf!");
        return root;
    }

    @Test
    void copyTree_shouldReproduceStructureAndContent() throws IOException {
        Path source = sampleTree();
        Path target = tempDir.resolve("copy");

        FileTrees.copyTree(source, target);

        assertEquals("top", Files.readString(target.resolve("top.txt")));
        assertEquals("leaf!", Files.readString(target.resolve("b/deep/deeper/leaf.bin")));
        assertTrue(Files.isDirectory(target.resolve("empty")));
    }

    @Test
    void copyTree_shouldRejectNonDirectorySource() throws IOException {
        Path file = tempDir.resolve("file.txt");
        Files.writeString(file, "x");
        assertThrows(IOException.class, () -> FileTrees.copyTree(file, tempDir.resolve("out")));
    }

    @Test
    void deleteTree_shouldRemoveEverything() throws IOException {
        Path root = sampleTree();
        FileTrees.deleteTree(root);
        assertFalse(Files.exists(root));
    }

    @Test
    void deleteTree_shouldIgnoreMissingRoot() {
        assertDoesNotThrow(() -> FileTrees.deleteTree(tempDir.resolve("ghost")));
    }

    @Test
    void deleteTree_shouldHandleDeepNesting() throws IOException {
        Path root = tempDir.resolve("deep");
        Path current = root;
        for (int i = 0; i < 200; i++) {
            current = current.resolve("d");
        }
        Files.createDirectories(current);
        Files.writeString(current.resolve("bottom.txt"), "x");

        FileTrees.deleteTree(root);
        assertFalse(Files.exists(root));
    }

    @Test
    void listRecursive_shouldSortByRelativePath() throws IOException {
        Path root = sampleTree();

        List<String> names = FileTrees.listRecursive(root).stream()
                .map(p -> FileTrees.relativeString(root, p))
                .toList();

        assertEquals(List.of("a", "a/one.txt", "b", "b/deep", "b/deep/deeper", "b/deep/deeper/leaf.bin",
                "empty", "top.txt"), names);
    }

    @Test
    void sizeOf_shouldSumRegularFiles() throws IOException {
        assertEquals(3 + 1 + 5, FileTrees.sizeOf(sampleTree()));
    }

    @Test
    void findFirst_shouldPreferShallowMatches() throws IOException {
        Path root = sampleTree();
        Files.writeString(root.resolve("b/match.bin"), "x");

        Optional<Path> found = FileTrees.findFirst(root, p -> p.toString().endsWith(".bin"));
        assertEquals(root.resolve("b/match.bin"), found.orElseThrow());
    }

    @Test
    void findFirst_shouldBeEmptyWithoutMatch() throws IOException {
        assertTrue(FileTrees.findFirst(sampleTree(), p -> p.toString().endsWith(".exe")).isEmpty());
    }

    @Test
    void isEmptyDirectory_shouldDistinguishEmptyAndMissing() throws IOException {
        Path root = sampleTree();
        assertTrue(FileTrees.isEmptyDirectory(root.resolve("empty")));
        assertFalse(FileTrees.isEmptyDirectory(root.resolve("a")));
        assertFalse(FileTrees.isEmptyDirectory(root.resolve("ghost")));
    }
}
