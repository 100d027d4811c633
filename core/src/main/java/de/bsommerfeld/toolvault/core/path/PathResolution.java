package de.bsommerfeld.toolvault.core.path;

import java.nio.file.Path;

/**
 * Outcome of resolving an untrusted relative path against a trusted root.
 *
 * @param success   {@code true} if {@code fullPath} is contained in the root
 * @param fullPath  resolved absolute path; {@code null} on failure
 * @param errorCode stable code for branching ({@code path_empty}, {@code path_absolute},
 *                  {@code path_traversal}, {@code path_outside_root}); {@code null} on success
 * @param message   human-readable detail including the offending input
 */
public record PathResolution(boolean success, Path fullPath, String errorCode, String message) {

    public static final String PATH_EMPTY = "path_empty";
    public static final String PATH_ABSOLUTE = "path_absolute";
    public static final String PATH_TRAVERSAL = "path_traversal";
    public static final String PATH_OUTSIDE_ROOT = "path_outside_root";

    public static PathResolution resolved(Path fullPath) {
        return new PathResolution(true, fullPath, null, null);
    }

    public static PathResolution failed(String errorCode, String message) {
        return new PathResolution(false, null, errorCode, message);
    }

    /** Traversal-class failures: the input tried to leave its root. */
    public boolean isTraversal() {
        return PATH_TRAVERSAL.equals(errorCode) || PATH_OUTSIDE_ROOT.equals(errorCode);
    }
}
