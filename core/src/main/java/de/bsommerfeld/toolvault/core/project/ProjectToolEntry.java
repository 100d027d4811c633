package de.bsommerfeld.toolvault.core.project;

import de.bsommerfeld.toolvault.core.model.ToolReference;

/**
 * One tool referenced by a project.
 *
 * @param id      tool id
 * @param version exact version
 * @param path    optional project-relative executable path; {@code null} means "resolve via the library"
 * @param sha256  optional expected hash of the executable; {@code null} means "not pinned"
 */
public record ProjectToolEntry(String id, String version, String path, String sha256) {

    public static ProjectToolEntry of(String id, String version) {
        return new ProjectToolEntry(id, version, null, null);
    }

    public boolean hasExplicitPath() {
        return path != null && !path.isBlank();
    }

    public boolean hasDeclaredHash() {
        return sha256 != null;
    }

    /**
     * @throws IllegalArgumentException if id or version is not a valid reference
     */
    public ToolReference reference() {
        return new ToolReference(id, version);
    }
}
