package de.bsommerfeld.toolvault.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ToolVaultSettings} from JSON. A missing file yields defaults;
 * a file that exists but cannot be parsed is an error.
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String SETTINGS_FILE_NAME = "settings.json";

    private SettingsLoader() {
    }

    public static ToolVaultSettings load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            LOG.info("No settings at {}, using defaults", file);
            return new ToolVaultSettings();
        }
        LOG.info("Loading settings from {}", file.toAbsolutePath());
        ToolVaultSettings settings = MAPPER.readValue(file.toFile(), ToolVaultSettings.class);
        return settings != null ? settings : new ToolVaultSettings();
    }
}
