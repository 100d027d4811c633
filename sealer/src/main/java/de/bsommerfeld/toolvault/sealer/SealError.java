package de.bsommerfeld.toolvault.sealer;

/**
 * One problem found while sealing.
 *
 * @param phase   phase that reported it
 * @param code    stable code for branching, e.g. {@code tool_missing}
 * @param message detail naming the affected path or tool
 */
public record SealError(SealPhase phase, String code, String message) {

    public static final String PROJECT_NOT_FOUND = "project_not_found";
    public static final String MANIFEST_INVALID = "manifest_invalid";
    public static final String LIBRARY_UNRESOLVED = "library_unresolved";
    public static final String TOOL_INVALID = "tool_invalid";
    public static final String TOOL_MISSING = "tool_missing";
    public static final String TOOLS_DIR_FAILED = "tools_dir_failed";
    public static final String TOOL_COPY_FAILED = "tool_copy_failed";
    public static final String CONFIG_WRITE_FAILED = "config_write_failed";
    public static final String ARCHIVE_FAILED = "archive_failed";

    @Override
    public String toString() {
        return phase + "/" + code + ": " + message;
    }
}
