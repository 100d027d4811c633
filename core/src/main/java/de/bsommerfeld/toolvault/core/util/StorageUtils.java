package de.bsommerfeld.toolvault.core.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves OS-specific application data directories following each platform's
 * native conventions. Paths are <strong>not</strong> created; the caller is
 * responsible for ensuring the directory exists.
 *
 * <p>
 * Resolution order per platform:
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 *
 * <p>
 * When neither the platform variable nor {@code user.home} is usable the
 * result is empty. Callers treat that as a normal, persistent "unresolved"
 * outcome.
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific application data directory for the given app
     * name, or empty if no base path can be determined.
     */
    public static Optional<Path> getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        try {
            if (os.contains("mac") || os.contains("darwin")) {
                return isUsable(home)
                        ? Optional.of(Path.of(home, "Library", "Application Support", appName))
                        : Optional.empty();
            }
            if (os.contains("win")) {
                String appData = System.getenv("APPDATA");
                if (isUsable(appData)) {
                    return Optional.of(Path.of(appData, appName));
                }
                return isUsable(home)
                        ? Optional.of(Path.of(home, "AppData", "Roaming", appName))
                        : Optional.empty();
            }
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (isUsable(xdgData)) {
                return Optional.of(Path.of(xdgData, appName));
            }
            return isUsable(home)
                    ? Optional.of(Path.of(home, ".local", "share", appName))
                    : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    /** Returns {@code {appDataDir}/logs}, if the data directory resolves. */
    public static Optional<Path> getLogsDir(String appName) {
        return getAppDataDir(appName).map(dir -> dir.resolve("logs"));
    }

    public static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ENGLISH).contains("win");
    }

    public static boolean isMacOS() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ENGLISH).contains("mac");
    }

    private static boolean isUsable(String value) {
        return value != null && !value.isBlank();
    }
}
