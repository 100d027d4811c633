package de.bsommerfeld.toolvault.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Snapshot of a library entry as seen on disk.
 *
 * @param exists       whether the entry directory exists and is populated
 * @param path         resolved entry directory, {@code null} if the library root is unresolved
 * @param sizeBytes    total size of all regular files below the entry
 * @param lastModified modification time of the entry directory, {@code null} if absent
 */
public record ToolMetadata(boolean exists, Path path, long sizeBytes, Instant lastModified) {

    public static ToolMetadata absent(Path path) {
        return new ToolMetadata(false, path, 0, null);
    }
}
