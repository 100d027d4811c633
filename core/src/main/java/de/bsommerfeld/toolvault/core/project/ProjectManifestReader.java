package de.bsommerfeld.toolvault.core.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.toolvault.core.offline.OfflineConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code toolvault.json} from a project directory.
 *
 * <p>
 * If the project also carries a {@code toolvault.config.json} (written when
 * the project is sealed), its {@code offline_mode} and {@code force_offline}
 * flags are OR-ed into the manifest's. A sealed project therefore always
 * reads back as forced offline.
 *
 * <p>
 * Only {@code name}, {@code tools[]} and the two offline flags are read; all
 * other keys belong to the project and are ignored. Expected shape:
 *
 * <pre>{@code
 * {
 *   "name": "my-game",
 *   "offline_mode": false,
 *   "force_offline": false,
 *   "tools": [
 *     { "id": "godot", "version": "4.3" },
 *     { "id": "blender", "version": "4.1", "path": "tools/blender/blender", "sha256": "..." }
 *   ]
 * }
 * }</pre>
 */
public final class ProjectManifestReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProjectManifestReader() {
    }

    public static Path manifestPath(Path projectDir) {
        return projectDir.resolve(ProjectManifest.FILE_NAME);
    }

    public static Path configPath(Path projectDir) {
        return projectDir.resolve(ProjectManifest.CONFIG_FILE_NAME);
    }

    /**
     * @throws ProjectManifestException if the manifest is missing, unreadable, not JSON,
     *                                  a tool entry lacks id/version, or an existing
     *                                  config file is not a JSON object
     */
    public static ProjectManifest read(Path projectDir) throws ProjectManifestException {
        Path file = manifestPath(projectDir);
        if (!Files.isRegularFile(file)) {
            throw new ProjectManifestException("Project manifest not found: " + file);
        }
        JsonNode root = readObject(file, "Project manifest");

        Path fileName = projectDir.toAbsolutePath().normalize().getFileName();
        String name = root.path("name").asText(fileName == null ? "project" : fileName.toString());
        OfflineConfig offline = offlineFlags(root);

        Path config = configPath(projectDir);
        if (Files.isRegularFile(config)) {
            offline = offline.merge(offlineFlags(readObject(config, "Project config")));
        }

        return new ProjectManifest(name, parseTools(root.path("tools"), file), offline);
    }

    private static JsonNode readObject(Path file, String what) throws ProjectManifestException {
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new ProjectManifestException(what + " is not valid JSON: " + file, e);
        } catch (IOException e) {
            throw new ProjectManifestException(what + " cannot be read: " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new ProjectManifestException(what + " must be a JSON object: " + file);
        }
        return root;
    }

    private static OfflineConfig offlineFlags(JsonNode root) {
        return new OfflineConfig(
                root.path("offline_mode").asBoolean(false),
                root.path("force_offline").asBoolean(false));
    }

    private static List<ProjectToolEntry> parseTools(JsonNode toolsNode, Path file)
            throws ProjectManifestException {
        List<ProjectToolEntry> tools = new ArrayList<>();
        if (toolsNode.isMissingNode() || toolsNode.isNull()) {
            return tools;
        }
        if (!toolsNode.isArray()) {
            throw new ProjectManifestException("'tools' must be an array in " + file);
        }

        for (int i = 0; i < toolsNode.size(); i++) {
            JsonNode node = toolsNode.get(i);
            String id = textOrNull(node, "id");
            String version = textOrNull(node, "version");
            if (id == null || version == null) {
                throw new ProjectManifestException("Tool entry " + i + " needs 'id' and 'version' in " + file);
            }
            // A declared but blank hash stays visible so the launcher can reject it as malformed
            JsonNode sha = node.get("sha256");
            String sha256 = sha == null || sha.isNull() ? null : sha.asText();
            tools.add(new ProjectToolEntry(id, version, textOrNull(node, "path"), sha256));
        }
        return tools;
    }

    private static String textOrNull(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
