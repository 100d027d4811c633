package de.bsommerfeld.toolvault.launcher;

/**
 * Why a launch did not happen.
 */
public enum LaunchErrorKind {

    /** Missing id/version, or the project directory does not exist. */
    INVALID_ENTRY,
    /** Explicit path is absolute. */
    PATH_ABSOLUTE,
    /** Explicit path climbs out of the project directory. */
    PATH_TRAVERSAL,
    TOOL_NOT_INSTALLED,
    EXECUTABLE_NOT_FOUND,
    /** Declared SHA-256 is not 64 lowercase hex characters. */
    HASH_MALFORMED,
    HASH_MISMATCH,
    /** The executable could not be read for hashing. */
    HASH_UNREADABLE,
    OFFLINE_OVERRIDE_FAILED,
    SPAWN_FAILED
}
