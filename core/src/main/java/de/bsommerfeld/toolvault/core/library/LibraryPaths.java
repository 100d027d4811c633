package de.bsommerfeld.toolvault.core.library;

import com.google.common.annotations.VisibleForTesting;
import de.bsommerfeld.toolvault.core.util.StorageUtils;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves where the shared tool library lives.
 *
 * <p>
 * Production callers get the platform default
 * ({@code <appData>/toolvault/library}). Tests may redirect every
 * default-constructed {@link LibraryManager} to a temporary folder through
 * {@link #overrideRootForTesting(Path)}; nothing outside test code calls it.
 */
public final class LibraryPaths {

    public static final String APP_DIR_NAME = "toolvault";
    public static final String LIBRARY_DIR_NAME = "library";

    private static final AtomicReference<Path> TEST_OVERRIDE = new AtomicReference<>();

    private LibraryPaths() {
    }

    /**
     * The platform default library root, or the test override if one is set.
     * Empty when no base path can be resolved on this machine.
     */
    public static Optional<Path> defaultRoot() {
        Path override = TEST_OVERRIDE.get();
        if (override != null) {
            return Optional.of(override);
        }
        return StorageUtils.getAppDataDir(APP_DIR_NAME).map(dir -> dir.resolve(LIBRARY_DIR_NAME));
    }

    @VisibleForTesting
    public static void overrideRootForTesting(Path root) {
        TEST_OVERRIDE.set(root == null ? null : root.toAbsolutePath().normalize());
    }

    @VisibleForTesting
    public static void clearTestOverride() {
        TEST_OVERRIDE.set(null);
    }
}
