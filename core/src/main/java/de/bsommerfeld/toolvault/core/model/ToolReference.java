package de.bsommerfeld.toolvault.core.model;

import java.util.Objects;

/**
 * Immutable identity of a tool in the library: an id plus an exact version.
 *
 * <p>
 * Both components become directory names below the library root, so they
 * are restricted to a single path segment. Anything that could escape the
 * {@code <root>/<id>/<version>} layout is rejected at construction.
 *
 * @param id      tool identifier (e.g. "godot")
 * @param version exact version string (e.g. "4.3")
 */
public record ToolReference(String id, String version) implements Comparable<ToolReference> {

    public ToolReference {
        requireSegment(id, "id");
        requireSegment(version, "version");
    }

    public static ToolReference of(String id, String version) {
        return new ToolReference(id, version);
    }

    /**
     * Parses the textual form {@code id@version}.
     *
     * @throws IllegalArgumentException if the separator is missing or either side is invalid
     */
    public static ToolReference parse(String text) {
        Objects.requireNonNull(text, "text");
        int at = text.lastIndexOf('@');
        if (at <= 0 || at == text.length() - 1) {
            throw new IllegalArgumentException("Expected <id>@<version> but got: " + text);
        }
        return new ToolReference(text.substring(0, at), text.substring(at + 1));
    }

    /** Folder name used when the tool is embedded into a project ({@code <id>_<version>}). */
    public String folderName() {
        return id + "_" + version;
    }

    @Override
    public int compareTo(ToolReference other) {
        int byId = id.compareTo(other.id);
        return byId != 0 ? byId : version.compareTo(other.version);
    }

    @Override
    public String toString() {
        return id + "@" + version;
    }

    /**
     * Whether {@code value} is acceptable as an id or version: non-blank and
     * a single path segment.
     */
    public static boolean isValidSegment(String value) {
        return value != null && !value.isBlank() && isSingleSegment(value);
    }

    private static boolean isSingleSegment(String value) {
        return value.indexOf('/') < 0 && value.indexOf('\\') < 0
                && !value.equals(".") && !value.equals("..");
    }

    private static void requireSegment(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (!isSingleSegment(value)) {
            throw new IllegalArgumentException(name + " must be a single path segment: " + value);
        }
    }
}
