package de.bsommerfeld.toolvault.sealer;

import de.bsommerfeld.toolvault.core.event.ApplicationEventBus;
import de.bsommerfeld.toolvault.core.event.ToolVaultEvents;
import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.offline.OfflineConfig;
import de.bsommerfeld.toolvault.core.project.ProjectManifestReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProjectSealerTest {

    private static final Instant NOW = Instant.parse("2026-03-14T09:26:53.589Z");

    @TempDir
    Path tempDir;

    private LibraryManager library;
    private ApplicationEventBus eventBus;
    private Path workspace;
    private Path project;

    @BeforeEach
    void setUp() throws IOException {
        library = new LibraryManager(tempDir.resolve("library"));
        eventBus = mock(ApplicationEventBus.class);
        workspace = Files.createDirectories(tempDir.resolve("workspace"));
        project = workspace.resolve("demo");
    }

    private ProjectSealer sealer(Clock clock) {
        return new ProjectSealer(library, eventBus, clock);
    }

    private ProjectSealer sealer() {
        return sealer(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // -- validation --

    @Test
    void seal_shouldFailWithoutSideEffectsWhenToolIsMissing() throws IOException {
        SealFixture.installTool(library, "godot", "4.3", "godot");
        SealFixture.writeProject(project, "godot@4.3", "blender@4.1");

        SealResult result = sealer().seal(project);

        assertFalse(result.success());
        assertNull(result.sealedArchivePath());
        assertEquals(1, result.errors().size());
        SealError error = result.errors().get(0);
        assertEquals(SealPhase.VALIDATE, error.phase());
        assertEquals(SealError.TOOL_MISSING, error.code());
        assertTrue(error.message().contains("blender"));
        assertTrue(error.message().contains("4.1"));

        assertFalse(Files.exists(project.resolve("tools")));
        assertFalse(Files.exists(project.resolve("toolvault.config.json")));
        assertTrue(SealFixture.sealedArchives(workspace).isEmpty());
        verify(eventBus).post(new ToolVaultEvents.ProjectSealedEvent(project, null, false));
    }

    @Test
    void seal_shouldReportMissingProject() {
        SealResult result = sealer().seal(workspace.resolve("missing"));

        assertFalse(result.success());
        assertEquals(SealError.PROJECT_NOT_FOUND, result.errors().get(0).code());
    }

    @Test
    void seal_shouldReportUnreadableManifest() throws IOException {
        Files.createDirectories(project);
        Files.writeString(project.resolve("toolvault.json"), "{ not json");

        SealResult result = sealer().seal(project);

        assertEquals(SealError.MANIFEST_INVALID, result.errors().get(0).code());
        assertTrue(SealFixture.sealedArchives(workspace).isEmpty());
    }

    // -- full run --

    @Test
    void seal_shouldEmbedToolsConfigureAndArchive() throws IOException {
        SealFixture.installTool(library, "godot", "4.3", "godot");
        SealFixture.writeProject(project, "godot@4.3");

        SealResult result = sealer().seal(project);

        assertTrue(result.success(), () -> result.errors().toString());
        assertTrue(result.errors().isEmpty());
        assertEquals(List.of(ToolReference.of("godot", "4.3")), result.toolsCopied());
        assertEquals(workspace.resolve("demo_Sealed_20260314_092653_589.zip"), result.sealedArchivePath());
        assertTrue(Files.isRegularFile(result.sealedArchivePath()));
        assertTrue(result.sizeMb() >= 0);

        assertTrue(Files.isRegularFile(project.resolve("tools/godot_4.3/godot")));
        assertTrue(Files.readString(project.resolve("toolvault.config.json")).contains("\"force_offline\" : true"));

        List<String> entries = SealFixture.zipEntries(result.sealedArchivePath());
        assertTrue(entries.contains("toolvault.json"));
        assertTrue(entries.contains("toolvault.config.json"));
        assertTrue(entries.contains("tools/godot_4.3/godot"));
        assertTrue(entries.contains("scenes/main.tscn"));

        verify(eventBus).post(new ToolVaultEvents.ProjectSealedEvent(project, result.sealedArchivePath(), true));
    }

    @Test
    void seal_shouldLeaveProjectForcedOfflineWhenReadBack() throws Exception {
        SealFixture.installTool(library, "godot", "4.3", "godot");
        SealFixture.writeProject(project, "godot@4.3");
        assertFalse(ProjectManifestReader.read(project).offline().forceOffline());

        assertTrue(sealer().seal(project).success());

        OfflineConfig offline = ProjectManifestReader.read(project).offline();
        assertTrue(offline.forceOffline());
        assertTrue(offline.offlineMode());
    }

    @Test
    void seal_shouldSucceedForProjectWithoutTools() throws IOException {
        SealFixture.writeProject(project);

        SealResult result = sealer().seal(project);

        assertTrue(result.success(), () -> result.errors().toString());
        assertTrue(result.toolsCopied().isEmpty());
        assertTrue(Files.isDirectory(project.resolve("tools")));
    }

    @Test
    void seal_shouldProduceDistinctArchivesAndStableConfig() throws IOException {
        SealFixture.installTool(library, "godot", "4.3", "godot");
        SealFixture.writeProject(project, "godot@4.3");
        ProjectSealer sealer = sealer(new SealFixture.TickingClock(NOW));

        SealResult first = sealer.seal(project);
        byte[] configAfterFirst = Files.readAllBytes(project.resolve("toolvault.config.json"));
        SealResult second = sealer.seal(project);

        assertTrue(first.success());
        assertTrue(second.success());
        assertNotEquals(first.sealedArchivePath(), second.sealedArchivePath());
        assertEquals(2, SealFixture.sealedArchives(workspace).size());
        assertArrayEquals(configAfterFirst, Files.readAllBytes(project.resolve("toolvault.config.json")));
    }

    @Test
    void seal_shouldStopAtFirstFailingPhase() {
        SealValidator validator = mock(SealValidator.class);
        ToolCopier copier = mock(ToolCopier.class);
        OfflineConfigWriter writer = mock(OfflineConfigWriter.class);
        ProjectArchiver archiver = mock(ProjectArchiver.class);
        List<ToolReference> tools = List.of(ToolReference.of("godot", "4.3"));
        when(validator.validate(project)).thenReturn(new SealValidator.Result(null, tools, List.of()));
        when(copier.copy(tools, project)).thenReturn(new ToolCopier.Result(project.resolve("tools"), List.of(),
                List.of(new SealError(SealPhase.COPY, SealError.TOOL_COPY_FAILED, "disk full"))));

        SealResult result = new ProjectSealer(validator, copier, writer, archiver, eventBus).seal(project);

        assertFalse(result.success());
        assertEquals(SealPhase.COPY, result.errors().get(0).phase());
        verifyNoInteractions(writer, archiver);
        verify(eventBus).post(any(ToolVaultEvents.ProjectSealedEvent.class));
    }
}
