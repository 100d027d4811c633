package de.bsommerfeld.toolvault.mirror.manifest;

import de.bsommerfeld.toolvault.core.model.KnownTool;
import de.bsommerfeld.toolvault.core.model.ToolReference;

/**
 * One tool archive offered by a mirror. Instances only exist for entries
 * that passed {@link MirrorRepository#validate}, so exactly one of
 * {@code archivePath}/{@code archiveUrl} is set and {@code sha256} is canonical.
 *
 * @param id          tool id
 * @param version     exact version
 * @param category    declared category, {@code null} if the manifest omits it
 * @param archivePath mirror-relative archive path (local mirrors)
 * @param archiveUrl  absolute archive URL (remote mirrors)
 * @param sha256      64 lowercase hex characters
 * @param sizeBytes   declared archive size, or -1 if not declared
 */
public record MirrorToolEntry(String id, String version, String category,
        String archivePath, String archiveUrl, String sha256, long sizeBytes) {

    public ToolReference reference() {
        return new ToolReference(id, version);
    }

    public boolean matches(ToolReference ref) {
        return id.equals(ref.id()) && version.equals(ref.version());
    }

    public boolean isRemote() {
        return archiveUrl != null;
    }

    /** Declared category, or the static fallback for known tool ids. */
    public String effectiveCategory() {
        return category != null ? category : KnownTool.categoryFor(id);
    }
}
