package de.bsommerfeld.toolvault.launcher;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * {@link ProcessBuilder}-based spawner. The child is detached from the
 * launcher: it inherits stdio and is never waited for.
 */
public class DefaultProcessSpawner implements ProcessSpawner {

    @Override
    public long spawn(List<String> command, Path workingDirectory, Map<String, String> environment)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());
        pb.inheritIO();
        pb.environment().putAll(environment);

        Path executableDir = Path.of(command.get(0)).toAbsolutePath().getParent();
        if (executableDir != null) {
            PathEnricher.enrich(pb, executableDir);
        }

        return pb.start().pid();
    }
}
