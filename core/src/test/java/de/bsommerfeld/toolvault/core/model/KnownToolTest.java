package de.bsommerfeld.toolvault.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KnownToolTest {

    @Test
    void categoryFor_shouldMapKnownIds() {
        assertEquals("Engine", KnownTool.categoryFor("godot"));
        assertEquals("3D", KnownTool.categoryFor("blender"));
        assertEquals("2D", KnownTool.categoryFor("krita"));
        assertEquals("2D", KnownTool.categoryFor("aseprite"));
        assertEquals("Audio", KnownTool.categoryFor("audacity"));
        assertEquals("Audio", KnownTool.categoryFor("lmms"));
    }

    @Test
    void categoryFor_shouldFallBackToUnknown() {
        assertEquals("Unknown", KnownTool.categoryFor("gimp"));
        assertEquals("Unknown", KnownTool.categoryFor(null));
    }

    @Test
    void byId_shouldIgnoreCase() {
        assertEquals(KnownTool.GODOT, KnownTool.byId("Godot").orElseThrow());
        assertTrue(KnownTool.byId("unknown-tool").isEmpty());
    }

    @Test
    void executableCandidates_shouldDifferPerPlatform() {
        assertTrue(KnownTool.BLENDER.executableCandidates(true).contains("blender.exe"));
        assertTrue(KnownTool.BLENDER.executableCandidates(false).contains("blender"));
        assertFalse(KnownTool.BLENDER.executableCandidates(false).contains("blender.exe"));
    }
}
