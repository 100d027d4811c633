package de.bsommerfeld.toolvault.mirror.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MirrorRepositoryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SHA = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    @TempDir
    Path tempDir;

    private static JsonNode json(String text) throws IOException {
        return MAPPER.readTree(text);
    }

    private static String manifest(String schemaVersion, String tools) {
        return "{ \"schema_version\": " + schemaVersion + ", \"mirror_name\": \"studio\", \"tools\": " + tools + " }";
    }

    private static String tool(String extra) {
        return "{ \"id\": \"godot\", \"version\": \"4.3\", \"sha256\": \"" + SHA + "\"" + extra + " }";
    }

    @Test
    void parse_shouldAcceptValidManifest() {
        ManifestLoadResult result = MirrorRepository.parse(manifest("1",
                "[" + tool(", \"archive_path\": \"engines/godot.zip\","
                        + " \"category\": \"Engine\", \"size_bytes\": 42") + ","
                        + "{ \"id\": \"blender\", \"version\": \"4.1\", \"sha256\": \"" + SHA + "\","
                        + " \"archive_url\": \"https://example.org/blender.zip\" } ]"));

        assertTrue(result.isValid(), result.describeErrors());
        MirrorManifest manifest = result.manifest();
        assertEquals("studio", manifest.mirrorName());
        assertEquals(2, manifest.tools().size());

        MirrorToolEntry godot = manifest.find(ToolReference.of("godot", "4.3")).orElseThrow();
        assertEquals("engines/godot.zip", godot.archivePath());
        assertEquals(42, godot.sizeBytes());
        assertFalse(godot.isRemote());

        MirrorToolEntry blender = manifest.find(ToolReference.of("blender", "4.1")).orElseThrow();
        assertTrue(blender.isRemote());
        assertEquals(-1, blender.sizeBytes());
        assertEquals("3D", blender.effectiveCategory());
    }

    @Test
    void parse_shouldAcceptFloatingSchemaVersionOne() {
        ManifestLoadResult result = MirrorRepository.parse(manifest("1.0",
                "[" + tool(", \"archive_path\": \"g.zip\"") + "]"));
        assertTrue(result.isValid(), result.describeErrors());
    }

    @Test
    void validate_shouldFlagUnsupportedSchemaVersion() throws IOException {
        for (String version : new String[]{"2", "0", "1.5", "\"1\"", "true"}) {
            Set<String> errors = MirrorRepository.validate(json(manifest(version,
                    "[" + tool(", \"archive_path\": \"g.zip\"") + "]")));
            assertEquals(Set.of(MirrorRepository.SCHEMA_VERSION_UNSUPPORTED), errors, version);
        }
    }

    @Test
    void validate_shouldReportUnsupportedVersionAlongsideOtherErrors() throws IOException {
        Set<String> errors = MirrorRepository.validate(json("{ \"schema_version\": 7, \"tools\": [] }"));

        assertTrue(errors.contains(MirrorRepository.SCHEMA_VERSION_UNSUPPORTED));
        assertTrue(errors.contains(MirrorRepository.MIRROR_NAME_MISSING));
        assertTrue(errors.contains(MirrorRepository.TOOLS_EMPTY));
    }

    @Test
    void validate_shouldFlagMissingTopLevelFields() throws IOException {
        Set<String> errors = MirrorRepository.validate(json("{}"));
        assertEquals(Set.of(MirrorRepository.SCHEMA_VERSION_MISSING, MirrorRepository.MIRROR_NAME_MISSING,
                MirrorRepository.TOOLS_MISSING), errors);
    }

    @Test
    void validate_shouldRejectNonObjectRoot() throws IOException {
        assertEquals(Set.of(MirrorRepository.MANIFEST_NOT_OBJECT), MirrorRepository.validate(json("[]")));
        assertEquals(Set.of(MirrorRepository.MANIFEST_NOT_OBJECT), MirrorRepository.validate(null));
    }

    @Test
    void validate_shouldCollectIndexedToolErrors() throws IOException {
        String tools = "["
                + tool(", \"archive_path\": \"ok.zip\"") + ","
                + "\"not-an-object\","
                + "{ \"sha256\": \"ABC\", \"archive_path\": \"a\", \"archive_url\": \"http://x\" },"
                + "{ \"id\": \"lmms\", \"version\": \"1.2\", \"size\": -5, \"size_bytes\": 1.5, \"category\": \"\" }"
                + "]";

        Set<String> errors = MirrorRepository.validate(json(manifest("1", tools)));

        assertEquals(Set.of(
                "tool_not_object:1",
                "id_missing:2", "version_missing:2", "archive_source_conflict:2", "sha256_invalid:2",
                "archive_source_missing:3", "sha256_missing:3", "size_invalid:3", "size_bytes_invalid:3",
                "category_empty:3"), errors);
    }

    @Test
    void validate_shouldRejectIdsAndVersionsThatAreNotSingleSegments() throws IOException {
        String tools = "["
                + "{ \"id\": \"a/b\", \"version\": \"..\", \"sha256\": \"" + SHA + "\", \"archive_path\": \"x.zip\" },"
                + "{ \"id\": \"..\", \"version\": \"4.3\\\\beta\", \"sha256\": \"" + SHA + "\","
                + " \"archive_path\": \"y.zip\" },"
                + tool(", \"archive_path\": \"ok.zip\"")
                + "]";

        Set<String> errors = MirrorRepository.validate(json(manifest("1", tools)));

        assertEquals(Set.of("id_invalid:0", "version_invalid:0", "id_invalid:1", "version_invalid:1"), errors);
    }

    @Test
    void parse_shouldMapSyntaxErrorsToMalformed() {
        ManifestLoadResult result = MirrorRepository.parse("{ broken");
        assertFalse(result.isValid());
        assertEquals(Set.of(MirrorRepository.MANIFEST_MALFORMED), result.errors());
    }

    @Test
    void loadFromMirror_shouldReportUnreadableManifest() {
        ManifestLoadResult result = MirrorRepository.loadFromMirror(tempDir);
        assertEquals(Set.of(MirrorRepository.MANIFEST_UNREADABLE), result.errors());
    }

    @Test
    void loadFromMirror_shouldReadFreshEveryTime() throws IOException {
        Path file = tempDir.resolve(MirrorRepository.MANIFEST_FILE_NAME);
        Files.writeString(file, manifest("1", "[" + tool(", \"archive_path\": \"g.zip\"") + "]"));
        assertTrue(MirrorRepository.loadFromMirror(tempDir).isValid());

        Files.writeString(file, manifest("2", "[" + tool(", \"archive_path\": \"g.zip\"") + "]"));
        assertFalse(MirrorRepository.loadFromMirror(tempDir).isValid());
    }

    @Test
    void describeErrors_shouldBeSorted() {
        ManifestLoadResult result = MirrorRepository.parse("{}");
        assertEquals("mirror_name_missing, schema_version_missing, tools_missing", result.describeErrors());
    }
}
