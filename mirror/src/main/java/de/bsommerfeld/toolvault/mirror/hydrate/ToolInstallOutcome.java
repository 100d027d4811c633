package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.model.ToolReference;

/**
 * Result of hydrating a single tool.
 *
 * @param tool    the requested reference
 * @param success {@code true} if the library entry exists afterwards
 * @param message human-readable detail (reason for failure, or what happened)
 */
public record ToolInstallOutcome(ToolReference tool, boolean success, String message) {

    static ToolInstallOutcome installed(ToolReference tool, String message) {
        return new ToolInstallOutcome(tool, true, message);
    }

    static ToolInstallOutcome failed(ToolReference tool, String message) {
        return new ToolInstallOutcome(tool, false, message);
    }
}
