package de.bsommerfeld.toolvault.mirror.manifest;

import java.util.Set;
import java.util.TreeSet;

/**
 * Either a valid manifest or the complete set of error codes explaining why
 * there is none.
 */
public record ManifestLoadResult(MirrorManifest manifest, Set<String> errors) {

    public ManifestLoadResult {
        errors = Set.copyOf(errors);
    }

    static ManifestLoadResult valid(MirrorManifest manifest) {
        return new ManifestLoadResult(manifest, Set.of());
    }

    static ManifestLoadResult invalid(Set<String> errors) {
        return new ManifestLoadResult(null, errors);
    }

    public boolean isValid() {
        return manifest != null;
    }

    /** Sorted, comma-separated codes for log lines and failure messages. */
    public String describeErrors() {
        return String.join(", ", new TreeSet<>(errors));
    }
}
