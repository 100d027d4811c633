package de.bsommerfeld.toolvault.launcher;

import de.bsommerfeld.toolvault.core.model.KnownTool;
import de.bsommerfeld.toolvault.core.util.FileTrees;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the binary to start inside a library entry.
 *
 * <p>
 * Known tools are matched against their conventional executable names
 * (relative path, case-insensitive, preference order). Anything else, or a
 * known tool whose layout differs, falls back to the first executable file
 * in breadth-first, name-sorted order.
 */
final class ExecutableResolver {

    private static final List<String> WINDOWS_EXECUTABLE_SUFFIXES = List.of(".exe", ".bat", ".cmd");

    private final boolean windows;

    ExecutableResolver(boolean windows) {
        this.windows = windows;
    }

    Optional<Path> resolve(Path toolDir, String toolId) throws IOException {
        Optional<KnownTool> known = KnownTool.byId(toolId);
        if (known.isPresent()) {
            Map<String, Path> byRelativeName = new HashMap<>();
            for (Path file : FileTrees.listRecursive(toolDir)) {
                if (Files.isRegularFile(file)) {
                    byRelativeName.putIfAbsent(
                            FileTrees.relativeString(toolDir, file).toLowerCase(Locale.ROOT), file);
                }
            }
            for (String candidate : known.get().executableCandidates(windows)) {
                Path match = byRelativeName.get(candidate.toLowerCase(Locale.ROOT));
                if (match != null) {
                    return Optional.of(match);
                }
            }
        }
        return FileTrees.findFirst(toolDir, this::isExecutable);
    }

    boolean isExecutable(Path file) {
        if (windows) {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            return WINDOWS_EXECUTABLE_SUFFIXES.stream().anyMatch(name::endsWith);
        }
        return Files.isExecutable(file);
    }
}
