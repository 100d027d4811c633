package de.bsommerfeld.toolvault.mirror.hydrate;

import com.google.common.util.concurrent.Striped;
import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.util.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * Moves a verified archive's content into the library.
 *
 * <h3>Staging</h3>
 * Extraction happens in {@code <libraryRoot>/.staging/<id>-<version>-<uuid>}.
 * Only a fully extracted tree is moved to {@code <root>/<id>/<version>}; a
 * failed extraction leaves the library untouched. The staging folder is
 * always removed afterwards.
 *
 * <h3>Concurrency</h3>
 * Installs of the same (id, version) are serialized by a striped lock for
 * the whole process. After taking the lock the entry is checked again, so a
 * second hydrator that lost the race sees the first one's result instead
 * of replacing it. There is no cross-process locking.
 */
class LibraryInstaller {

    private static final Logger LOG = LoggerFactory.getLogger(LibraryInstaller.class);

    private static final Striped<Lock> INSTALL_LOCKS = Striped.lock(64);

    enum Result {
        INSTALLED,
        ALREADY_PRESENT
    }

    private final LibraryManager library;

    LibraryInstaller(LibraryManager library) {
        this.library = library;
    }

    /**
     * @throws IOException if the library root is unresolved or extraction/move fails
     */
    Result install(ToolReference ref, Path archive) throws IOException {
        Lock lock = INSTALL_LOCKS.get(ref);
        lock.lock();
        try {
            if (library.toolExists(ref)) {
                LOG.info("{} was installed concurrently, skipping", ref);
                return Result.ALREADY_PRESENT;
            }

            Path stagingRoot = library.stagingRoot()
                    .orElseThrow(() -> new IOException("Library root cannot be resolved"));
            Path target = library.toolPath(ref)
                    .orElseThrow(() -> new IOException("Library root cannot be resolved"));
            Path staging = stagingRoot.resolve(ref.id() + "-" + ref.version() + "-" + UUID.randomUUID());

            try {
                Path content = ArchiveExtractor.extract(archive, staging.resolve("content"));

                // Entries are replaced wholesale, never merged with leftovers
                FileTrees.deleteTree(target);
                Files.createDirectories(target.getParent());
                move(content, target);
                LOG.info("Installed {} into {}", ref, target);
                return Result.INSTALLED;
            } finally {
                FileTrees.deleteTree(staging);
            }
        } finally {
            lock.unlock();
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }
}
