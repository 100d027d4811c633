package de.bsommerfeld.toolvault.launcher;

import de.bsommerfeld.toolvault.core.model.ToolReference;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Prepares a tool to run without network access. Only invoked while the
 * offline gate is active; a thrown exception aborts the launch.
 */
public interface OfflineOverride {

    /**
     * @param tool       the tool about to start
     * @param executable resolved executable
     * @param projectDir project the tool is launched for
     * @return environment variables and extra arguments for the spawn
     * @throws IOException if a required config edit fails
     */
    Injection prepare(ToolReference tool, Path executable, Path projectDir) throws IOException;

    /**
     * What an override contributes to the spawn.
     */
    record Injection(Map<String, String> environment, List<String> extraArguments) {

        public static final Injection NONE = new Injection(Map.of(), List.of());

        public Injection {
            environment = Map.copyOf(environment);
            extraArguments = List.copyOf(extraArguments);
        }
    }
}
