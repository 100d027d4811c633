package de.bsommerfeld.toolvault.mirror.manifest;

import de.bsommerfeld.toolvault.core.model.ToolReference;

import java.util.List;
import java.util.Optional;

/**
 * A validated mirror manifest. Never cached: hydrators load a fresh copy on
 * every pass so edits to the mirror take effect immediately.
 *
 * @param schemaVersion always {@link MirrorRepository#SUPPORTED_SCHEMA_VERSION}
 * @param mirrorName    non-empty display name
 * @param tools         offered archives in manifest order
 */
public record MirrorManifest(int schemaVersion, String mirrorName, List<MirrorToolEntry> tools) {

    public MirrorManifest {
        tools = List.copyOf(tools);
    }

    /** First entry matching id and version exactly. */
    public Optional<MirrorToolEntry> find(ToolReference ref) {
        return tools.stream().filter(t -> t.matches(ref)).findFirst();
    }
}
