package de.bsommerfeld.toolvault.launcher;

import de.bsommerfeld.toolvault.core.util.StorageUtils;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;

/**
 * Puts a tool's own directory at the front of the {@code PATH} of a
 * {@link ProcessBuilder}.
 *
 * <p>
 * Portable tool builds ship helper binaries and shared libraries next to
 * the main executable and expect to find them on {@code PATH} (Blender's
 * bundled Python, Krita's plugins). Prepending guarantees the bundled copy
 * wins over anything installed system-wide.
 */
final class PathEnricher {

    private static final String UNIX_DEFAULT_PATH = "/usr/bin:/bin";

    private PathEnricher() {
    }

    static void enrich(ProcessBuilder pb, Path toolDirectory) {
        Map<String, String> env = pb.environment();
        String key = pathKey(env);
        String current = env.get(key);
        if (current == null || current.isEmpty()) {
            current = StorageUtils.isWindows() ? "" : UNIX_DEFAULT_PATH;
        }

        String dir = toolDirectory.toAbsolutePath().toString();
        env.put(key, current.isEmpty() ? dir : dir + File.pathSeparator + current);
    }

    /** Windows environments may spell it "Path". */
    private static String pathKey(Map<String, String> env) {
        for (String key : env.keySet()) {
            if (key.equalsIgnoreCase("PATH")) {
                return key;
            }
        }
        return "PATH";
    }
}
