package de.bsommerfeld.toolvault.core.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * SHA-256 hashing utility. Uses streaming I/O so multi-gigabyte tool archives
 * are never loaded into memory.
 *
 * <p>
 * Declared hashes are accepted only in their canonical form: exactly 64
 * lowercase hex characters. Comparison is exact; there is no case folding and
 * no prefix matching.
 */
public final class HashUtil {

    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;
    private static final Pattern SHA256_PATTERN = Pattern.compile("^[0-9a-f]{64}$");

    private HashUtil() {
    }

    /**
     * Computes the lowercase hex SHA-256 of the given file.
     *
     * @throws IOException if the file cannot be read
     */
    public static String sha256(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return sha256(in);
        }
    }

    /**
     * Consumes the stream to its end and returns its lowercase hex SHA-256.
     * The stream is not closed.
     */
    public static String sha256(InputStream in) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String sha256(byte[] data) {
        MessageDigest digest = newDigest();
        digest.update(data);
        return HexFormat.of().formatHex(digest.digest());
    }

    /** {@code true} if the value is exactly 64 lowercase hex characters. */
    public static boolean isWellFormed(String sha256) {
        return sha256 != null && SHA256_PATTERN.matcher(sha256).matches();
    }

    /**
     * Hashes the file and compares it to the expected value.
     *
     * @throws IllegalArgumentException if {@code expected} is not well-formed
     * @throws IOException              if the file cannot be read
     */
    public static boolean matches(Path file, String expected) throws IOException {
        if (!isWellFormed(expected)) {
            throw new IllegalArgumentException("Malformed SHA-256: " + expected);
        }
        return sha256(file).equals(expected);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JVM is required to ship SHA-256
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
