package de.bsommerfeld.toolvault.launcher;

import java.util.OptionalLong;

/**
 * Outcome of {@link ToolLauncher#launch}.
 *
 * @param success   {@code true} if a process was started
 * @param errorKind failure classification; {@code null} on success
 * @param pid       id of the spawned process, empty on failure
 * @param message   detail for logs and users
 */
public record LaunchResult(boolean success, LaunchErrorKind errorKind, OptionalLong pid, String message) {

    static LaunchResult started(long pid, String message) {
        return new LaunchResult(true, null, OptionalLong.of(pid), message);
    }

    static LaunchResult failed(LaunchErrorKind kind, String message) {
        return new LaunchResult(false, kind, OptionalLong.empty(), message);
    }
}
