package de.bsommerfeld.toolvault.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed table of the tools the launcher has first-class knowledge of.
 *
 * <p>
 * Every per-tool decision (category fallback, executable discovery, launch
 * arguments, offline overrides) dispatches on this enum. Tools outside the
 * table still work; they simply get the generic behavior ("Unknown"
 * category, first executable found, no extra arguments).
 */
public enum KnownTool {

    GODOT("godot", ToolCategory.ENGINE,
            List.of("godot.exe", "godot"),
            List.of("Godot", "godot.x86_64", "godot.arm64", "Godot.app/Contents/MacOS/Godot")),
    BLENDER("blender", ToolCategory.THREE_D,
            List.of("blender.exe"),
            List.of("blender", "Blender.app/Contents/MacOS/Blender")),
    KRITA("krita", ToolCategory.TWO_D,
            List.of("krita.exe", "bin/krita.exe"),
            List.of("krita", "bin/krita", "krita.appimage", "krita.app/Contents/MacOS/krita")),
    ASEPRITE("aseprite", ToolCategory.TWO_D,
            List.of("Aseprite.exe", "aseprite.exe"),
            List.of("aseprite", "Aseprite.app/Contents/MacOS/aseprite")),
    AUDACITY("audacity", ToolCategory.AUDIO,
            List.of("Audacity.exe", "audacity.exe"),
            List.of("audacity", "Audacity.app/Contents/MacOS/Wrapper")),
    LMMS("lmms", ToolCategory.AUDIO,
            List.of("lmms.exe"),
            List.of("lmms", "lmms.appimage"));

    private final String id;
    private final ToolCategory category;
    private final List<String> windowsExecutables;
    private final List<String> unixExecutables;

    KnownTool(String id, ToolCategory category, List<String> windowsExecutables, List<String> unixExecutables) {
        this.id = id;
        this.category = category;
        this.windowsExecutables = windowsExecutables;
        this.unixExecutables = unixExecutables;
    }

    public String id() {
        return id;
    }

    public ToolCategory category() {
        return category;
    }

    /**
     * Relative executable candidates inside the tool's library directory, in
     * preference order. Matching is done on the relative path, ignoring case.
     */
    public List<String> executableCandidates(boolean windows) {
        return windows ? windowsExecutables : unixExecutables;
    }

    /** Case-insensitive lookup by tool id. */
    public static Optional<KnownTool> byId(String toolId) {
        if (toolId == null) {
            return Optional.empty();
        }
        String normalized = toolId.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.id.equals(normalized)).findFirst();
    }

    /** Category display name for the id, falling back to "Unknown". */
    public static String categoryFor(String toolId) {
        return byId(toolId).map(t -> t.category.displayName()).orElse(ToolCategory.UNKNOWN.displayName());
    }
}
