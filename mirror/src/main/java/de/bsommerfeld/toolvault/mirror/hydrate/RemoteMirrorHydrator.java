package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.offline.NetworkGuardResult;
import de.bsommerfeld.toolvault.core.offline.OfflineEnforcer;
import de.bsommerfeld.toolvault.mirror.download.Downloader;
import de.bsommerfeld.toolvault.mirror.manifest.ManifestLoadResult;
import de.bsommerfeld.toolvault.mirror.manifest.MirrorRepository;
import de.bsommerfeld.toolvault.mirror.manifest.MirrorToolEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Hydrates the library from an HTTP mirror.
 *
 * <p>
 * The manifest is downloaded fresh on every pass from {@code manifestUrl};
 * each tool must declare an absolute {@code archive_url}. Archives stream to
 * a temporary file with byte-level progress, are verified, extracted, and
 * then deleted.
 *
 * <h3>Offline policy</h3>
 * If the offline gate is active when a pass starts, every requested tool
 * fails without any network attempt. Each individual fetch is additionally
 * guarded, so a gate that closes mid-pass, or one that was never
 * initialized, also blocks.
 */
public class RemoteMirrorHydrator extends AbstractMirrorHydrator {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteMirrorHydrator.class);

    private final String manifestUrl;
    private final OfflineEnforcer offlineEnforcer;

    public RemoteMirrorHydrator(LibraryManager library, String manifestUrl,
            OfflineEnforcer offlineEnforcer, Executor callbackExecutor) {
        super(library, callbackExecutor);
        this.manifestUrl = manifestUrl;
        this.offlineEnforcer = offlineEnforcer;
    }

    @Override
    protected String describeMirror() {
        return "remote mirror " + manifestUrl;
    }

    @Override
    protected Optional<String> batchRejection() {
        if (offlineEnforcer.isOffline()) {
            return Optional.of("Remote hydration unavailable while offline ("
                    + offlineEnforcer.state().reason().key() + ")");
        }
        return Optional.empty();
    }

    @Override
    protected ManifestLoadResult loadManifest() {
        NetworkGuardResult guard = offlineEnforcer.guardNetworkCall("fetch mirror manifest " + manifestUrl);
        if (!guard.allowed()) {
            return new ManifestLoadResult(null, Set.of(guard.errorCode()));
        }

        try {
            return MirrorRepository.parse(Downloader.toString(manifestUrl));
        } catch (IOException e) {
            LOG.warn("Cannot download mirror manifest {}: {}", manifestUrl, e.getMessage());
            return new ManifestLoadResult(null, Set.of(MirrorRepository.MANIFEST_UNREADABLE));
        }
    }

    @Override
    protected FetchedArchive fetchArchive(MirrorToolEntry entry, ToolReference ref, HydrationListener listener)
            throws MirrorException {
        if (entry.archiveUrl() == null) {
            throw new MirrorException("Entry only declares archive_path; a remote mirror needs archive_url");
        }

        NetworkGuardResult guard = offlineEnforcer.guardNetworkCall("download " + ref + " from " + entry.archiveUrl());
        if (!guard.allowed()) {
            throw new MirrorException(guard.message());
        }

        Path temp;
        try {
            temp = Files.createTempFile("toolvault-", "-" + archiveFileName(entry.archiveUrl()));
        } catch (IOException e) {
            throw new MirrorException("Cannot create temporary file: " + e.getMessage(), e);
        }

        try {
            Downloader.toFile(entry.archiveUrl(), temp, (done, total) ->
                    listener.onInstallProgress(ref, done, total > 0 ? total : entry.sizeBytes()));
            return new FetchedArchive(temp, true);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new MirrorException("Download failed: " + e.getMessage(), e);
        }
    }

    /**
     * Last path segment of the URL, so the temp file keeps the archive's
     * extension ({@code .zip} decides between extracting and copying).
     */
    static String archiveFileName(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = null;
        }
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            return "archive.bin";
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
