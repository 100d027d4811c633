package de.bsommerfeld.toolvault.mirror.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.toolvault.core.hash.HashUtil;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads and validates mirror manifests.
 *
 * <h3>Schema (version 1)</h3>
 *
 * <pre>{@code
 * {
 *   "schema_version": 1,
 *   "mirror_name": "studio-mirror",
 *   "tools": [
 *     {
 *       "id": "godot", "version": "4.3", "category": "Engine",
 *       "archive_path": "engines/godot-4.3.zip",
 *       "sha256": "<64 lowercase hex>", "size_bytes": 123456
 *     },
 *     { "id": "blender", "version": "4.1", "archive_url": "https://...", "sha256": "..." }
 *   ]
 * }
 * }</pre>
 *
 * <h3>Error codes</h3>
 * Validation never stops at the first problem. Every violation is collected
 * as {@code <field>_<problem>} or, for tool entries, {@code <field>_<problem>:<index>}.
 * The codes are stable and meant for branching; display text is built from them.
 */
public final class MirrorRepository {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int SUPPORTED_SCHEMA_VERSION = 1;
    public static final String MANIFEST_FILE_NAME = "mirror.json";

    public static final String MANIFEST_UNREADABLE = "manifest_unreadable";
    public static final String MANIFEST_MALFORMED = "manifest_malformed";
    public static final String MANIFEST_NOT_OBJECT = "manifest_not_object";
    public static final String SCHEMA_VERSION_MISSING = "schema_version_missing";
    public static final String SCHEMA_VERSION_UNSUPPORTED = "schema_version_unsupported";
    public static final String MIRROR_NAME_MISSING = "mirror_name_missing";
    public static final String TOOLS_MISSING = "tools_missing";
    public static final String TOOLS_EMPTY = "tools_empty";
    public static final String TOOL_NOT_OBJECT = "tool_not_object";
    public static final String ID_MISSING = "id_missing";
    public static final String VERSION_MISSING = "version_missing";
    public static final String ID_INVALID = "id_invalid";
    public static final String VERSION_INVALID = "version_invalid";
    public static final String ARCHIVE_SOURCE_MISSING = "archive_source_missing";
    public static final String ARCHIVE_SOURCE_CONFLICT = "archive_source_conflict";
    public static final String SHA256_MISSING = "sha256_missing";
    public static final String SHA256_INVALID = "sha256_invalid";
    public static final String SIZE_INVALID = "size_invalid";
    public static final String SIZE_BYTES_INVALID = "size_bytes_invalid";
    public static final String CATEGORY_EMPTY = "category_empty";

    private MirrorRepository() {
    }

    /** Builds an indexed code such as {@code sha256_invalid:2}. */
    public static String indexed(String code, int index) {
        return code + ":" + index;
    }

    /**
     * Reads {@code mirror.json} from a mirror root. Always reads from disk.
     */
    public static ManifestLoadResult loadFromMirror(Path mirrorRoot) {
        return load(mirrorRoot.resolve(MANIFEST_FILE_NAME));
    }

    public static ManifestLoadResult load(Path manifestFile) {
        String json;
        try {
            json = Files.readString(manifestFile);
        } catch (IOException e) {
            LOG.warn("Cannot read mirror manifest {}: {}", manifestFile, e.getMessage());
            return ManifestLoadResult.invalid(Set.of(MANIFEST_UNREADABLE));
        }
        return parse(json);
    }

    /**
     * Parses and validates a manifest document.
     */
    public static ManifestLoadResult parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            LOG.warn("Mirror manifest is not valid JSON: {}", e.getOriginalMessage());
            return ManifestLoadResult.invalid(Set.of(MANIFEST_MALFORMED));
        }

        Set<String> errors = validate(root);
        if (!errors.isEmpty()) {
            LOG.warn("Mirror manifest rejected: {}", errors);
            return ManifestLoadResult.invalid(errors);
        }
        return ManifestLoadResult.valid(toManifest(root));
    }

    /**
     * Collects every schema violation in {@code data}. An empty set means the
     * document is a valid version 1 manifest.
     */
    public static Set<String> validate(JsonNode data) {
        Set<String> errors = new LinkedHashSet<>();
        if (data == null || !data.isObject()) {
            errors.add(MANIFEST_NOT_OBJECT);
            return errors;
        }

        validateSchemaVersion(data.get("schema_version"), errors);

        if (!isNonEmptyText(data.get("mirror_name"))) {
            errors.add(MIRROR_NAME_MISSING);
        }

        JsonNode tools = data.get("tools");
        if (tools == null || !tools.isArray()) {
            errors.add(TOOLS_MISSING);
        } else if (tools.isEmpty()) {
            errors.add(TOOLS_EMPTY);
        } else {
            for (int i = 0; i < tools.size(); i++) {
                validateTool(tools.get(i), i, errors);
            }
        }
        return errors;
    }

    private static void validateSchemaVersion(JsonNode version, Set<String> errors) {
        if (version == null || version.isNull()) {
            errors.add(SCHEMA_VERSION_MISSING);
            return;
        }
        boolean supported = version.isIntegralNumber()
                ? version.canConvertToLong() && version.longValue() == SUPPORTED_SCHEMA_VERSION
                : version.isFloatingPointNumber() && version.doubleValue() == SUPPORTED_SCHEMA_VERSION;
        if (!supported) {
            errors.add(SCHEMA_VERSION_UNSUPPORTED);
        }
    }

    private static void validateTool(JsonNode tool, int index, Set<String> errors) {
        if (tool == null || !tool.isObject()) {
            errors.add(indexed(TOOL_NOT_OBJECT, index));
            return;
        }

        validateSegment(tool.get("id"), indexed(ID_MISSING, index), indexed(ID_INVALID, index), errors);
        validateSegment(tool.get("version"), indexed(VERSION_MISSING, index),
                indexed(VERSION_INVALID, index), errors);

        boolean hasPath = isNonEmptyText(tool.get("archive_path"));
        boolean hasUrl = isNonEmptyText(tool.get("archive_url"));
        if (hasPath && hasUrl) {
            errors.add(indexed(ARCHIVE_SOURCE_CONFLICT, index));
        } else if (!hasPath && !hasUrl) {
            errors.add(indexed(ARCHIVE_SOURCE_MISSING, index));
        }

        JsonNode sha = tool.get("sha256");
        if (sha == null || sha.isNull()) {
            errors.add(indexed(SHA256_MISSING, index));
        } else if (!sha.isTextual() || !HashUtil.isWellFormed(sha.asText())) {
            errors.add(indexed(SHA256_INVALID, index));
        }

        validateSize(tool.get("size"), indexed(SIZE_INVALID, index), errors);
        validateSize(tool.get("size_bytes"), indexed(SIZE_BYTES_INVALID, index), errors);

        JsonNode category = tool.get("category");
        if (category != null && !category.isNull() && !isNonEmptyText(category)) {
            errors.add(indexed(CATEGORY_EMPTY, index));
        }
    }

    /** Ids and versions become library folder names, see {@link ToolReference}. */
    private static void validateSegment(JsonNode value, String missingCode, String invalidCode,
            Set<String> errors) {
        if (!isNonEmptyText(value)) {
            errors.add(missingCode);
        } else if (!ToolReference.isValidSegment(value.asText())) {
            errors.add(invalidCode);
        }
    }

    private static void validateSize(JsonNode size, String code, Set<String> errors) {
        if (size == null || size.isNull()) {
            return;
        }
        if (!size.isIntegralNumber() || !size.canConvertToLong() || size.longValue() <= 0) {
            errors.add(code);
        }
    }

    private static MirrorManifest toManifest(JsonNode root) {
        List<MirrorToolEntry> entries = new ArrayList<>();
        for (JsonNode tool : root.get("tools")) {
            long size = tool.hasNonNull("size_bytes") ? tool.get("size_bytes").longValue()
                    : tool.hasNonNull("size") ? tool.get("size").longValue() : -1;
            entries.add(new MirrorToolEntry(
                    tool.get("id").asText(),
                    tool.get("version").asText(),
                    textOrNull(tool, "category"),
                    textOrNull(tool, "archive_path"),
                    textOrNull(tool, "archive_url"),
                    tool.get("sha256").asText(),
                    size));
        }
        return new MirrorManifest(SUPPORTED_SCHEMA_VERSION, root.get("mirror_name").asText(), entries);
    }

    private static boolean isNonEmptyText(JsonNode node) {
        return node != null && node.isTextual() && !node.asText().isBlank();
    }

    private static String textOrNull(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return isNonEmptyText(value) ? value.asText() : null;
    }
}
