package de.bsommerfeld.toolvault.launcher;

import de.bsommerfeld.toolvault.core.model.KnownTool;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line arguments per tool. A pure function of tool id and project
 * directory.
 */
final class LaunchArguments {

    private LaunchArguments() {
    }

    static List<String> forTool(String toolId, Path projectDir) {
        KnownTool tool = KnownTool.byId(toolId).orElse(null);
        if (tool == null) {
            return List.of();
        }
        switch (tool) {
            case GODOT:
                // Opens the editor on the project instead of the project manager
                return List.of("--path", projectDir.toAbsolutePath().toString(), "--editor");
            default:
                return List.of();
        }
    }
}
