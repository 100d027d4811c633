package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.path.PathResolution;
import de.bsommerfeld.toolvault.mirror.manifest.ManifestLoadResult;
import de.bsommerfeld.toolvault.mirror.manifest.MirrorPathResolver;
import de.bsommerfeld.toolvault.mirror.manifest.MirrorRepository;
import de.bsommerfeld.toolvault.mirror.manifest.MirrorToolEntry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Hydrates the library from a mirror on a local or mounted filesystem
 * (USB stick, network share, unpacked delivery).
 *
 * <p>
 * The mirror root holds {@code mirror.json} plus the archives it references
 * through {@code archive_path}. Archives are read in place and never
 * modified; extraction always happens in the library's staging area.
 */
public class MirrorHydrator extends AbstractMirrorHydrator {

    private final Path mirrorRoot;

    public MirrorHydrator(LibraryManager library, Path mirrorRoot, Executor callbackExecutor) {
        super(library, callbackExecutor);
        this.mirrorRoot = mirrorRoot.toAbsolutePath().normalize();
    }

    public Path mirrorRoot() {
        return mirrorRoot;
    }

    @Override
    protected String describeMirror() {
        return "local mirror " + mirrorRoot;
    }

    @Override
    protected ManifestLoadResult loadManifest() {
        return MirrorRepository.loadFromMirror(mirrorRoot);
    }

    @Override
    protected FetchedArchive fetchArchive(MirrorToolEntry entry, ToolReference ref, HydrationListener listener)
            throws MirrorException {
        if (entry.archivePath() == null) {
            throw new MirrorException("Entry only declares archive_url; a local mirror needs archive_path");
        }

        PathResolution resolution = MirrorPathResolver.resolveArchivePath(mirrorRoot, entry.archivePath());
        if (!resolution.success()) {
            throw new MirrorException("Archive path rejected (" + resolution.errorCode() + "): "
                    + resolution.message());
        }

        Path archive = resolution.fullPath();
        if (!Files.isRegularFile(archive) || !Files.isReadable(archive)) {
            throw new MirrorException("Archive not found in mirror: " + archive);
        }
        return new FetchedArchive(archive, false);
    }
}
