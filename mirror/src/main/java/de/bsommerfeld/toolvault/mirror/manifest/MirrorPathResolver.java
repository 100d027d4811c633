package de.bsommerfeld.toolvault.mirror.manifest;

import de.bsommerfeld.toolvault.core.path.PathResolution;
import de.bsommerfeld.toolvault.core.path.SafePathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Resolves a manifest-declared {@code archive_path} against the mirror root.
 *
 * <p>
 * Manifests are trusted for content (hashes) but not for layout: an entry
 * pointing at {@code ../../etc/passwd} or {@code C:\Windows} must never be
 * read, let alone extracted. See {@link SafePathResolver} for the exact rules.
 */
public final class MirrorPathResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorPathResolver.class);

    private MirrorPathResolver() {
    }

    public static PathResolution resolveArchivePath(Path mirrorRoot, String relativePath) {
        PathResolution resolution = SafePathResolver.resolveWithin(mirrorRoot, relativePath);
        if (!resolution.success()) {
            LOG.warn("Rejected mirror archive path [{}]: {}", resolution.errorCode(), resolution.message());
        }
        return resolution;
    }
}
