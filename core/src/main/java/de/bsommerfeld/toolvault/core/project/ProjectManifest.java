package de.bsommerfeld.toolvault.core.project;

import de.bsommerfeld.toolvault.core.offline.OfflineConfig;

import java.util.List;
import java.util.Optional;

/**
 * The parts of a project's {@code toolvault.json} this library consumes.
 *
 * @param name    display name, defaults to the project folder name
 * @param tools   referenced tools in declaration order
 * @param offline offline flags of the project, including those of {@code toolvault.config.json}
 */
public record ProjectManifest(String name, List<ProjectToolEntry> tools, OfflineConfig offline) {

    public static final String FILE_NAME = "toolvault.json";

    /** Written by sealing; its offline flags overlay the manifest's. */
    public static final String CONFIG_FILE_NAME = "toolvault.config.json";

    public ProjectManifest {
        tools = List.copyOf(tools);
    }

    public Optional<ProjectToolEntry> findTool(String toolId) {
        return tools.stream().filter(t -> t.id().equalsIgnoreCase(toolId)).findFirst();
    }
}
