package de.bsommerfeld.toolvault.app;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.toolvault.app.config.ApplicationMode;
import de.bsommerfeld.toolvault.app.config.SettingsLoader;
import de.bsommerfeld.toolvault.app.config.ToolVaultSettings;
import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.library.LibraryPaths;
import de.bsommerfeld.toolvault.core.offline.OfflineEnforcer;
import de.bsommerfeld.toolvault.core.util.StorageUtils;
import de.bsommerfeld.toolvault.launcher.DefaultOfflineOverride;
import de.bsommerfeld.toolvault.launcher.DefaultProcessSpawner;
import de.bsommerfeld.toolvault.launcher.OfflineOverride;
import de.bsommerfeld.toolvault.launcher.ProcessSpawner;
import de.bsommerfeld.toolvault.mirror.hydrate.MirrorHydrator;
import de.bsommerfeld.toolvault.mirror.hydrate.RemoteMirrorHydrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Guice wiring for the command line application.
 *
 * <p>
 * Settings are read once at module configuration time and the offline flags
 * are applied to the process-wide {@link OfflineEnforcer} before anything
 * else can ask it. In {@link ApplicationMode#TEST} the library, mirror and
 * settings all live in a fresh temp directory.
 */
public class ToolVaultModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ToolVaultModule.class);

    private final ApplicationMode mode;
    private final Path appDataDir;

    public ToolVaultModule() {
        this(ApplicationMode.get(), null);
    }

    /**
     * @param appDataDir data directory to use instead of the platform default; may be {@code null}
     */
    public ToolVaultModule(ApplicationMode mode, Path appDataDir) {
        this.mode = mode;
        this.appDataDir = appDataDir;
    }

    @Override
    protected void configure() {
        LOG.info("Application mode initialized: {}", mode);
        try {
            Path dataDir = resolveDataDir();
            ToolVaultSettings settings = SettingsLoader.load(dataDir.resolve(SettingsLoader.SETTINGS_FILE_NAME));

            OfflineEnforcer enforcer = OfflineEnforcer.shared();
            enforcer.apply(settings.offlineConfig());

            LibraryManager library = new LibraryManager(dataDir.resolve(LibraryPaths.LIBRARY_DIR_NAME));
            Path mirrorRoot = settings.getMirrorRoot() != null
                    ? Path.of(settings.getMirrorRoot())
                    : dataDir.resolve("mirror");

            bind(ToolVaultSettings.class).toInstance(settings);
            bind(OfflineEnforcer.class).toInstance(enforcer);
            bind(LibraryManager.class).toInstance(library);
            bind(Path.class).annotatedWith(MirrorRoot.class).toInstance(mirrorRoot);
            bind(Clock.class).toInstance(Clock.systemDefaultZone());
            bind(OfflineOverride.class).to(DefaultOfflineOverride.class);
            bind(ProcessSpawner.class).to(DefaultProcessSpawner.class);
            bind(HydrationEventLogger.class).asEagerSingleton();
        } catch (IOException e) {
            // Settings are vital, there is nothing sensible to fall back to
            throw new IllegalStateException("Failed to load application settings", e);
        }
    }

    /**
     * Hydration callbacks run inline; the CLI has no UI thread to marshal to.
     */
    @Provides
    @Singleton
    Executor callbackExecutor() {
        return MoreExecutors.directExecutor();
    }

    @Provides
    @Singleton
    MirrorHydrator mirrorHydrator(LibraryManager library, @MirrorRoot Path mirrorRoot, Executor executor) {
        return new MirrorHydrator(library, mirrorRoot, executor);
    }

    @Provides
    @Singleton
    RemoteMirrorHydrator remoteMirrorHydrator(LibraryManager library, ToolVaultSettings settings,
            OfflineEnforcer enforcer, Executor executor) {
        return new RemoteMirrorHydrator(library, settings.getRemoteManifestUrl(), enforcer, executor);
    }

    private Path resolveDataDir() throws IOException {
        Path dir;
        if (appDataDir != null) {
            dir = appDataDir;
        } else if (mode.isTest()) {
            dir = Files.createTempDirectory(LibraryPaths.APP_DIR_NAME + "-test");
        } else {
            dir = StorageUtils.getAppDataDir(LibraryPaths.APP_DIR_NAME)
                    .orElseThrow(() -> new IOException("No usable application data directory"));
        }
        Files.createDirectories(dir);
        return dir;
    }
}
