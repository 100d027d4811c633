package de.bsommerfeld.toolvault.core.library;

import de.bsommerfeld.toolvault.core.model.ToolMetadata;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.util.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Read-side view of the shared tool library.
 *
 * <h3>Layout</h3>
 *
 * <pre>
 * &lt;root&gt;/
 *   godot/
 *     4.3/        ← one LibraryEntry, created wholesale by hydration
 *     4.2.2/
 *   blender/
 *     4.1/
 *   .staging/     ← hidden, used by installers, never listed
 * </pre>
 *
 * <h3>Failure model</h3>
 * Nothing here throws for expected conditions. An unresolvable root, a
 * missing directory, an invalid id, or an unreadable folder all surface as
 * empty results or {@code false}. Callers treat "unresolved" as a normal
 * outcome.
 */
public class LibraryManager {

    private static final Logger LOG = LoggerFactory.getLogger(LibraryManager.class);

    static final String STAGING_DIR_NAME = ".staging";

    private final Supplier<Optional<Path>> rootSupplier;

    /** Uses the platform default root (or the test override, if set). */
    public LibraryManager() {
        this(LibraryPaths::defaultRoot);
    }

    public LibraryManager(Path root) {
        this(() -> Optional.of(root.toAbsolutePath().normalize()));
    }

    private LibraryManager(Supplier<Optional<Path>> rootSupplier) {
        this.rootSupplier = rootSupplier;
    }

    public Optional<Path> libraryRoot() {
        return rootSupplier.get();
    }

    /**
     * Private scratch area for installers. Lives inside the library root so
     * the final move into place stays on one filesystem.
     */
    public Optional<Path> stagingRoot() {
        return libraryRoot().map(root -> root.resolve(STAGING_DIR_NAME));
    }

    public Optional<Path> toolPath(String id, String version) {
        return reference(id, version).flatMap(this::toolPath);
    }

    public Optional<Path> toolPath(ToolReference ref) {
        return libraryRoot().map(root -> root.resolve(ref.id()).resolve(ref.version()));
    }

    public boolean toolExists(String id, String version) {
        return reference(id, version).map(this::toolExists).orElse(false);
    }

    /** An entry exists when its directory is present and not empty. */
    public boolean toolExists(ToolReference ref) {
        Optional<Path> path = toolPath(ref);
        if (path.isEmpty() || !Files.isDirectory(path.get())) {
            return false;
        }
        try {
            return !FileTrees.isEmptyDirectory(path.get());
        } catch (IOException e) {
            LOG.warn("Cannot inspect library entry {}: {}", ref, e.getMessage());
            return false;
        }
    }

    /** All tool ids with a folder in the library, sorted. */
    public SortedSet<String> listTools() {
        return libraryRoot().map(LibraryManager::visibleDirectoryNames)
                .orElse(Collections.emptySortedSet());
    }

    /** All installed versions of a tool, sorted. Unknown ids yield an empty set. */
    public SortedSet<String> listVersions(String id) {
        if (reference(id, "any").isEmpty()) {
            return Collections.emptySortedSet();
        }
        return libraryRoot().map(root -> visibleDirectoryNames(root.resolve(id)))
                .orElse(Collections.emptySortedSet());
    }

    public ToolMetadata toolMetadata(String id, String version) {
        Optional<ToolReference> ref = reference(id, version);
        if (ref.isEmpty()) {
            return ToolMetadata.absent(null);
        }
        Optional<Path> path = toolPath(ref.get());
        if (path.isEmpty() || !toolExists(ref.get())) {
            return ToolMetadata.absent(path.orElse(null));
        }
        try {
            return new ToolMetadata(true, path.get(),
                    FileTrees.sizeOf(path.get()),
                    Files.getLastModifiedTime(path.get()).toInstant());
        } catch (IOException e) {
            LOG.warn("Cannot read metadata for {}: {}", ref.get(), e.getMessage());
            return new ToolMetadata(true, path.get(), 0, null);
        }
    }

    /**
     * Deletes a library entry and, if it was the last version, the tool folder.
     *
     * @return {@code true} if an entry existed and was deleted
     */
    public boolean removeTool(ToolReference ref) {
        Optional<Path> path = toolPath(ref);
        if (path.isEmpty() || !Files.exists(path.get(), LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try {
            FileTrees.deleteTree(path.get());
            Path toolDir = path.get().getParent();
            if (FileTrees.isEmptyDirectory(toolDir)) {
                Files.deleteIfExists(toolDir);
            }
            LOG.info("Removed library entry {}", ref);
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to remove library entry {}: {}", ref, e.getMessage());
            return false;
        }
    }

    private static SortedSet<String> visibleDirectoryNames(Path dir) {
        SortedSet<String> names = new TreeSet<>();
        if (!Files.isDirectory(dir)) {
            return names;
        }
        try (Stream<Path> children = Files.list(dir)) {
            children.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .forEach(names::add);
        } catch (IOException e) {
            LOG.warn("Cannot list {}: {}", dir, e.getMessage());
        }
        return names;
    }

    private static Optional<ToolReference> reference(String id, String version) {
        try {
            return Optional.of(new ToolReference(id, version));
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejected tool reference {}@{}: {}", id, version, e.getMessage());
            return Optional.empty();
        }
    }
}
