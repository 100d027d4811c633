package de.bsommerfeld.toolvault.core.project;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProjectManifestReaderTest {

    @TempDir
    Path projectDir;

    private void writeManifest(String json) throws IOException {
        Files.writeString(projectDir.resolve(ProjectManifest.FILE_NAME), json);
    }

    @Test
    void read_shouldParseToolsAndOfflineFlags() throws Exception {
        writeManifest("""
                {
                  "name": "my-game",
                  "offline_mode": true,
                  "tools": [
                    { "id": "godot", "version": "4.3" },
                    { "id": "blender", "version": "4.1", "path": "bin/blender", "sha256": "abc" }
                  ],
                  "unrelated": { "kept": "by the project" }
                }
                """);

        ProjectManifest manifest = ProjectManifestReader.read(projectDir);

        assertEquals("my-game", manifest.name());
        assertTrue(manifest.offline().offlineMode());
        assertFalse(manifest.offline().forceOffline());
        assertEquals(2, manifest.tools().size());

        ProjectToolEntry blender = manifest.findTool("Blender").orElseThrow();
        assertEquals("bin/blender", blender.path());
        assertEquals("abc", blender.sha256());
        assertTrue(blender.hasExplicitPath());
        assertFalse(manifest.findTool("godot").orElseThrow().hasDeclaredHash());
    }

    @Test
    void read_shouldOverlayFlagsFromSealedConfig() throws Exception {
        writeManifest("{ \"name\": \"my-game\", \"offline_mode\": false, \"tools\": [] }");
        Files.writeString(projectDir.resolve(ProjectManifest.CONFIG_FILE_NAME),
                "{ \"offline_mode\" : true, \"force_offline\" : true, \"sealed\" : true }\n");

        ProjectManifest manifest = ProjectManifestReader.read(projectDir);

        assertTrue(manifest.offline().offlineMode());
        assertTrue(manifest.offline().forceOffline());
    }

    @Test
    void read_shouldKeepManifestFlagsWhenConfigLeavesThemUnset() throws Exception {
        writeManifest("{ \"offline_mode\": true, \"tools\": [] }");
        Files.writeString(projectDir.resolve(ProjectManifest.CONFIG_FILE_NAME), "{ \"theme\": \"dark\" }");

        ProjectManifest manifest = ProjectManifestReader.read(projectDir);

        assertTrue(manifest.offline().offlineMode());
        assertFalse(manifest.offline().forceOffline());
    }

    @Test
    void read_shouldRejectConfigThatIsNotAnObject() throws Exception {
        writeManifest("{ \"tools\": [] }");
        Files.writeString(projectDir.resolve(ProjectManifest.CONFIG_FILE_NAME), "[ true ]");

        ProjectManifestException e = assertThrows(ProjectManifestException.class,
                () -> ProjectManifestReader.read(projectDir));
        assertTrue(e.getMessage().startsWith("Project config"));
    }

    @Test
    void read_shouldDefaultNameToFolder() throws Exception {
        writeManifest("{ \"tools\": [] }");
        assertEquals(projectDir.getFileName().toString(), ProjectManifestReader.read(projectDir).name());
    }

    @Test
    void read_shouldKeepBlankHashAsDeclared() throws Exception {
        writeManifest("{ \"tools\": [ { \"id\": \"godot\", \"version\": \"4.3\", \"sha256\": \"\" } ] }");

        ProjectToolEntry entry = ProjectManifestReader.read(projectDir).tools().get(0);
        assertTrue(entry.hasDeclaredHash());
        assertEquals("", entry.sha256());
    }

    @Test
    void read_shouldFailWhenMissing() {
        assertThrows(ProjectManifestException.class, () -> ProjectManifestReader.read(projectDir));
    }

    @Test
    void read_shouldFailOnInvalidJson() throws IOException {
        writeManifest("{ not json");
        assertThrows(ProjectManifestException.class, () -> ProjectManifestReader.read(projectDir));
    }

    @Test
    void read_shouldFailOnNonObjectRoot() throws IOException {
        writeManifest("[1, 2]");
        assertThrows(ProjectManifestException.class, () -> ProjectManifestReader.read(projectDir));
    }

    @Test
    void read_shouldFailOnToolWithoutVersion() throws IOException {
        writeManifest("{ \"tools\": [ { \"id\": \"godot\" } ] }");

        ProjectManifestException e = assertThrows(ProjectManifestException.class,
                () -> ProjectManifestReader.read(projectDir));
        assertTrue(e.getMessage().contains("Tool entry 0"));
    }
}
