package de.bsommerfeld.toolvault.sealer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.toolvault.core.project.ProjectManifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Configure phase: writes {@code toolvault.config.json} with the offline
 * flags forced on.
 *
 * <p>
 * Keys already present in the file are kept; {@code offline_mode},
 * {@code force_offline} and {@code sealed} are always overwritten with
 * {@code true}. Output is pretty-printed with a trailing newline, so writing
 * twice produces byte-identical files.
 */
public class OfflineConfigWriter {

    public static final String CONFIG_FILE_NAME = ProjectManifest.CONFIG_FILE_NAME;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public record Result(Path configFile, List<SealError> errors) {

        public Result {
            errors = List.copyOf(errors);
        }

        public boolean isSuccess() {
            return errors.isEmpty();
        }
    }

    public static Path configPath(Path projectDir) {
        return projectDir.resolve(CONFIG_FILE_NAME);
    }

    public Result write(Path projectDir) {
        Path file = configPath(projectDir);
        try {
            ObjectNode config = readExisting(file);
            config.put("offline_mode", true);
            config.put("force_offline", true);
            config.put("sealed", true);

            String json = MAPPER.writeValueAsString(config) + "\n";
            Files.writeString(file, json, StandardCharsets.UTF_8);
            return new Result(file, List.of());
        } catch (IOException e) {
            return new Result(file, List.of(new SealError(SealPhase.CONFIGURE, SealError.CONFIG_WRITE_FAILED,
                    "Cannot write " + file + ": " + e.getMessage())));
        }
    }

    /** Existing object content, or a fresh object if absent or not an object. */
    private static ObjectNode readExisting(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return MAPPER.createObjectNode();
        }
        JsonNode existing = MAPPER.readTree(Files.readString(file, StandardCharsets.UTF_8));
        return existing instanceof ObjectNode object ? object : MAPPER.createObjectNode();
    }
}
