package de.bsommerfeld.toolvault.launcher;

import de.bsommerfeld.toolvault.core.model.KnownTool;
import de.bsommerfeld.toolvault.core.model.ToolReference;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Environment and flag based offline preparation.
 *
 * <p>
 * Every tool gets {@code TOOLVAULT_OFFLINE=1}. Tools with a documented
 * offline switch get it on top; nothing on disk is edited.
 */
public class DefaultOfflineOverride implements OfflineOverride {

    static final String OFFLINE_ENV = "TOOLVAULT_OFFLINE";

    @Override
    public Injection prepare(ToolReference tool, Path executable, Path projectDir) {
        Map<String, String> env = new HashMap<>();
        env.put(OFFLINE_ENV, "1");

        List<String> extraArgs = List.of();
        KnownTool known = KnownTool.byId(tool.id()).orElse(null);
        if (known == KnownTool.BLENDER) {
            extraArgs = List.of("--offline-mode");
        }
        return new Injection(env, extraArgs);
    }
}
