package de.bsommerfeld.toolvault.core.library;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LibraryPathsTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverride() {
        LibraryPaths.clearTestOverride();
    }

    @Test
    void defaultRoot_shouldEndWithAppAndLibraryFolder() {
        LibraryPaths.defaultRoot().ifPresent(root -> {
            assertEquals(LibraryPaths.LIBRARY_DIR_NAME, root.getFileName().toString());
            assertEquals(LibraryPaths.APP_DIR_NAME, root.getParent().getFileName().toString());
        });
    }

    @Test
    void overrideRootForTesting_shouldReplaceDefaultUntilCleared() {
        Path before = LibraryPaths.defaultRoot().orElse(null);

        LibraryPaths.overrideRootForTesting(tempDir);
        assertEquals(tempDir.toAbsolutePath().normalize(), LibraryPaths.defaultRoot().orElseThrow());

        LibraryPaths.clearTestOverride();
        assertEquals(before, LibraryPaths.defaultRoot().orElse(null));
    }
}
