package de.bsommerfeld.toolvault.core.path;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical containment check for untrusted relative paths (mirror archive
 * paths, project tool paths, archive entry names).
 *
 * <p>
 * The check never touches the filesystem and behaves identically on every
 * platform: backslashes are treated as separators, comparison is
 * case-insensitive, and {@code .} segments are simplified away before the
 * prefix comparison. Any {@code ..} segment is rejected outright, even one
 * that would normalize back inside the root.
 */
public final class SafePathResolver {

    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");

    private SafePathResolver() {
    }

    /**
     * Resolves {@code relativePath} below {@code root}.
     *
     * @param root         trusted root directory
     * @param relativePath untrusted, supposedly relative path
     * @return the contained absolute path, or a failure carrying a stable error code
     */
    public static PathResolution resolveWithin(Path root, String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return PathResolution.failed(PathResolution.PATH_EMPTY, "Path is empty");
        }

        String slashed = relativePath.replace('\\', '/');
        if (slashed.startsWith("/") || DRIVE_PREFIX.matcher(slashed).matches()) {
            return PathResolution.failed(PathResolution.PATH_ABSOLUTE,
                    "Absolute paths are not allowed: " + relativePath);
        }

        for (String segment : slashed.split("/")) {
            if (segment.equals("..")) {
                return PathResolution.failed(PathResolution.PATH_TRAVERSAL,
                        "Parent directory segments are not allowed: " + relativePath);
            }
        }

        Path absoluteRoot = root.toAbsolutePath().normalize();
        String rootKey = simplify(absoluteRoot.toString().replace('\\', '/')).toLowerCase(Locale.ROOT);
        String relative = simplify(slashed);
        String candidateKey = simplify(rootKey + "/" + relative.toLowerCase(Locale.ROOT));

        String prefix = rootKey.endsWith("/") ? rootKey : rootKey + "/";
        if (!candidateKey.equals(rootKey) && !candidateKey.startsWith(prefix)) {
            return PathResolution.failed(PathResolution.PATH_OUTSIDE_ROOT,
                    "Path resolves outside of " + absoluteRoot + ": " + relativePath);
        }

        try {
            Path full = relative.isEmpty() ? absoluteRoot : absoluteRoot.resolve(relative).normalize();
            return PathResolution.resolved(full);
        } catch (InvalidPathException e) {
            return PathResolution.failed(PathResolution.PATH_EMPTY,
                    "Path is not valid on this platform: " + relativePath);
        }
    }

    /**
     * Simplifies a forward-slash path lexically: drops empty and {@code .}
     * segments and folds {@code ..} into its parent. A leading slash is kept.
     */
    static String simplify(String slashedPath) {
        boolean leadingSlash = slashedPath.startsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : slashedPath.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty()) {
                    segments.removeLast();
                }
                continue;
            }
            segments.addLast(segment);
        }
        String joined = String.join("/", segments);
        return leadingSlash ? "/" + joined : joined;
    }
}
