package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.path.PathResolution;
import de.bsommerfeld.toolvault.core.path.SafePathResolver;
import de.bsommerfeld.toolvault.core.util.StorageUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Unpacks a verified tool archive into a staging directory.
 *
 * <p>
 * {@code .zip} archives are extracted; any other file (a single-binary tool
 * such as an AppImage or a portable {@code .exe}) is copied as-is. Entry
 * names go through {@link SafePathResolver}, so a crafted archive cannot
 * write outside the destination.
 *
 * <h3>Wrapper folders</h3>
 * Most vendors zip their release inside one top-level folder
 * ({@code Godot_v4.3-stable/...}). If the extracted tree consists of exactly
 * one directory, that directory becomes the content root so the library
 * entry holds the files directly.
 */
final class ArchiveExtractor {

    private static final List<String> EXECUTABLE_SUFFIXES = List.of(
            ".sh", ".x86_64", ".x86_32", ".arm64", ".arm32", ".appimage", ".run", ".bin");

    private ArchiveExtractor() {
    }

    /**
     * @param archive     verified archive file
     * @param destination empty or missing staging directory
     * @return the content root: {@code destination} or its single wrapping folder
     * @throws IOException if the archive is unreadable, empty, or contains unsafe entries
     */
    static Path extract(Path archive, Path destination) throws IOException {
        Files.createDirectories(destination);

        if (isZip(archive)) {
            unzip(archive, destination);
        } else {
            Path target = destination.resolve(archive.getFileName().toString());
            Files.copy(archive, target, StandardCopyOption.REPLACE_EXISTING);
            markExecutableIfLikely(target);
        }

        return contentRoot(destination);
    }

    static boolean isZip(Path archive) {
        return archive.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static void unzip(Path archive, Path destination) throws IOException {
        try (InputStream raw = Files.newInputStream(archive);
             ZipInputStream zis = new ZipInputStream(raw)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                PathResolution resolution = SafePathResolver.resolveWithin(destination, entry.getName());
                if (!resolution.success()) {
                    throw new IOException("Unsafe archive entry '" + entry.getName() + "' in "
                            + archive.getFileName() + ": " + resolution.errorCode());
                }

                Path target = resolution.fullPath();
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }

                Files.createDirectories(target.getParent());
                Files.copy(zis, target, StandardCopyOption.REPLACE_EXISTING);
                markExecutableIfLikely(target);
            }
        }
    }

    private static Path contentRoot(Path destination) throws IOException {
        List<Path> children;
        try (Stream<Path> stream = Files.list(destination)) {
            children = stream.toList();
        }
        if (children.isEmpty()) {
            throw new IOException("Archive contained no files");
        }
        if (children.size() == 1 && Files.isDirectory(children.get(0))) {
            return children.get(0);
        }
        return destination;
    }

    /**
     * Java's zip API drops Unix permission bits. Restore the executable flag
     * on files that are typically launched directly.
     */
    private static void markExecutableIfLikely(Path file) {
        if (StorageUtils.isWindows()) {
            return;
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean likely = !name.contains(".") || EXECUTABLE_SUFFIXES.stream().anyMatch(name::endsWith);
        if (likely) {
            file.toFile().setExecutable(true, false);
        }
    }
}
