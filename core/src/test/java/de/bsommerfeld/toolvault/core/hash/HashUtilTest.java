package de.bsommerfeld.toolvault.core.hash;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HashUtilTest {

    private static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    private static final String HELLO_WORLD_SHA256 = "b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9";

    @TempDir
    Path tempDir;

    @Test
    void sha256File_shouldMatchKnownValue() throws IOException {
        Path file = tempDir.resolve("empty.txt");
        Files.writeString(file, "");

        assertEquals(EMPTY_SHA256, HashUtil.sha256(file));
    }

    @Test
    void sha256_shouldAgreeAcrossInputKinds() throws IOException {
        byte[] data = "hello world".getBytes(StandardCharsets.UTF_8);
        Path file = tempDir.resolve("hello.txt");
        Files.write(file, data);

        assertEquals(HELLO_WORLD_SHA256, HashUtil.sha256(data));
        assertEquals(HELLO_WORLD_SHA256, HashUtil.sha256(file));
        assertEquals(HELLO_WORLD_SHA256, HashUtil.sha256(new ByteArrayInputStream(data)));
    }

    @Test
    void sha256File_shouldThrowForNonexistentFile() {
        assertThrows(IOException.class, () -> HashUtil.sha256(tempDir.resolve("ghost.txt")));
    }

    @Test
    void isWellFormed_shouldAcceptOnlyLowercaseHex64() {
        assertTrue(HashUtil.isWellFormed(EMPTY_SHA256));
        assertFalse(HashUtil.isWellFormed(EMPTY_SHA256.toUpperCase()));
        assertFalse(HashUtil.isWellFormed(EMPTY_SHA256.substring(1)));
        assertFalse(HashUtil.isWellFormed(EMPTY_SHA256 + "0"));
        assertFalse(HashUtil.isWellFormed("z" + EMPTY_SHA256.substring(1)));
        assertFalse(HashUtil.isWellFormed(""));
        assertFalse(HashUtil.isWellFormed(null));
    }

    @Test
    void matches_shouldDetectSingleCharacterDifference() throws IOException {
        Path file = tempDir.resolve("hello.txt");
        Files.writeString(file, "hello world");

        assertTrue(HashUtil.matches(file, HELLO_WORLD_SHA256));
        String altered = HELLO_WORLD_SHA256.substring(0, 63) + (HELLO_WORLD_SHA256.endsWith("0") ? "1" : "0");
        assertFalse(HashUtil.matches(file, altered));
    }

    @Test
    void matches_shouldRejectMalformedExpectation() throws IOException {
        Path file = tempDir.resolve("hello.txt");
        Files.writeString(file, "hello world");

        assertThrows(IllegalArgumentException.class, () -> HashUtil.matches(file, "abc"));
    }
}
