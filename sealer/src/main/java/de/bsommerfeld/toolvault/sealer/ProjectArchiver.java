package de.bsommerfeld.toolvault.sealer;

import de.bsommerfeld.toolvault.core.util.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Archive phase: zips the whole project tree next to the project folder.
 *
 * <p>
 * The archive is named {@code <projectName>_Sealed_<yyyyMMdd_HHmmss_SSS>.zip}
 * and lands in the project's parent directory. Entries are project-relative
 * with forward slashes and written in sorted order. An existing archive is
 * never overwritten: if the timestamped name is taken (two seals in the same
 * millisecond, a fixed clock) a {@code _1}, {@code _2}, ... suffix is added.
 * The zip is assembled under a temporary name and moved into place.
 */
public class ProjectArchiver {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectArchiver.class);

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Clock clock;

    public ProjectArchiver(Clock clock) {
        this.clock = clock;
    }

    public record Result(Path archive, long sizeBytes, List<SealError> errors) {

        public Result {
            errors = List.copyOf(errors);
        }

        public boolean isSuccess() {
            return errors.isEmpty();
        }
    }

    /** First free archive name for the current time. */
    public Path archivePath(Path projectDir) {
        Path project = projectDir.toAbsolutePath().normalize();
        String base = project.getFileName() + "_Sealed_" + LocalDateTime.now(clock).format(TIMESTAMP);
        Path candidate = project.resolveSibling(base + ".zip");
        for (int n = 1; Files.exists(candidate, LinkOption.NOFOLLOW_LINKS); n++) {
            candidate = project.resolveSibling(base + "_" + n + ".zip");
        }
        return candidate;
    }

    public Result archive(Path projectDir) {
        Path project = projectDir.toAbsolutePath().normalize();
        if (project.getParent() == null) {
            return failed(null, "Project directory has no parent to place the archive in: " + project);
        }

        Path archive = archivePath(project);
        Path temp = archive.resolveSibling(archive.getFileName() + ".tmp");
        try {
            List<Path> entries = FileTrees.listRecursive(project);
            try (OutputStream out = Files.newOutputStream(temp);
                 ZipOutputStream zip = new ZipOutputStream(out)) {
                for (Path path : entries) {
                    writeEntry(zip, project, path);
                }
            }
            // Fails rather than replaces if another seal claimed the name meanwhile
            Files.move(temp, archive);

            long size = Files.size(archive);
            LOG.info("Wrote {} ({} entries, {} bytes)", archive, entries.size(), size);
            return new Result(archive, size, List.of());
        } catch (IOException e) {
            return failed(archive, "Cannot write " + archive + ": " + e.getMessage());
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOG.warn("Could not remove temporary archive {}: {}", temp, e.getMessage());
            }
        }
    }

    private static void writeEntry(ZipOutputStream zip, Path project, Path path) throws IOException {
        String name = FileTrees.relativeString(project, path);
        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            zip.putNextEntry(new ZipEntry(name + "/"));
            zip.closeEntry();
        } else if (Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
            ZipEntry entry = new ZipEntry(name);
            entry.setTime(Files.getLastModifiedTime(path).toMillis());
            zip.putNextEntry(entry);
            Files.copy(path, zip);
            zip.closeEntry();
        } else {
            LOG.debug("Skipping non-regular file {}", path);
        }
    }

    private static Result failed(Path archive, String message) {
        return new Result(archive, 0, List.of(new SealError(SealPhase.ARCHIVE, SealError.ARCHIVE_FAILED, message)));
    }
}
