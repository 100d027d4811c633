package de.bsommerfeld.toolvault.mirror.hydrate;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.toolvault.core.hash.HashUtil;
import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.mirror.manifest.ManifestLoadResult;
import de.bsommerfeld.toolvault.mirror.manifest.MirrorToolEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Shared hydration pipeline for local and remote mirrors.
 *
 * <h3>Per-tool pipeline</h3>
 *
 * <pre>
 * 1. Already in library        → success, no re-verification
 * 2. Load + validate manifest  → invalid: every requested tool fails identically
 * 3. Find (id, version)        → absent: only this tool fails
 * 4. Obtain archive            → subclass (mirror path / HTTP download)
 * 5. SHA-256 of the archive    → mismatch: fail, nothing is extracted
 * 6. Stage + extract + move    → {@link LibraryInstaller}
 * 7. Entry exists afterwards?  → otherwise fail
 * </pre>
 *
 * The manifest is loaded at most once per pass and never kept between
 * passes. A failing tool never aborts the batch, and nothing is retried.
 *
 * <h3>Threading</h3>
 * {@link #hydrate} runs on the caller's thread and notifies the listener
 * directly. {@link #hydrateAsync} runs the same pipeline on a dedicated
 * worker and routes every notification through the callback executor. Only
 * one async pass may be active per instance.
 */
public abstract class AbstractMirrorHydrator {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractMirrorHydrator.class);

    protected final LibraryManager library;
    private final LibraryInstaller installer;
    private final Executor callbackExecutor;
    private final AtomicBoolean running = new AtomicBoolean();

    protected AbstractMirrorHydrator(LibraryManager library, Executor callbackExecutor) {
        this.library = library;
        this.installer = new LibraryInstaller(library);
        this.callbackExecutor = callbackExecutor;
    }

    public HydrationReport hydrate(List<ToolReference> tools) {
        return hydrate(tools, HydrationListener.NONE);
    }

    public HydrationReport hydrate(List<ToolReference> tools, HydrationListener listener) {
        return runPass(List.copyOf(tools), listener, () -> false);
    }

    /**
     * Starts a background pass. A request made while another pass of this
     * hydrator is still running is ignored and reported as
     * {@link HydrationStatus#ALREADY_RUNNING}.
     */
    public HydrationHandle hydrateAsync(List<ToolReference> tools, HydrationListener listener) {
        if (!running.compareAndSet(false, true)) {
            LOG.info("Hydration already in progress on {}, ignoring start request", describeMirror());
            return HydrationHandle.alreadyRunning();
        }

        List<ToolReference> batch = List.copyOf(tools);
        HydrationEventChannel channel = new HydrationEventChannel(listener, callbackExecutor);
        ExecutorService worker = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("hydration-%d")
                .setDaemon(true)
                .build());

        CompletableFuture<HydrationReport> report;
        try {
            report = CompletableFuture.supplyAsync(() -> runPass(batch, channel, channel::isCancelled), worker);
        } catch (RuntimeException e) {
            running.set(false);
            worker.shutdown();
            throw e;
        }
        report.whenComplete((result, error) -> {
            running.set(false);
            worker.shutdown();
            if (error != null) {
                LOG.error("Background hydration from {} failed", describeMirror(), error);
            }
        });
        return new HydrationHandle(HydrationStatus.STARTED, channel, report);
    }

    public boolean isRunning() {
        return running.get();
    }

    // =====================================================================
    // Subclass hooks
    // =====================================================================

    /** Short description for logs ("local mirror /srv/mirror"). */
    protected abstract String describeMirror();

    /**
     * Returns a reason to fail the whole batch before anything else happens,
     * or empty to proceed.
     */
    protected Optional<String> batchRejection() {
        return Optional.empty();
    }

    /** Loads the manifest fresh from its source. */
    protected abstract ManifestLoadResult loadManifest();

    /**
     * Makes the archive for {@code entry} available as a local file.
     *
     * @throws MirrorException if the archive cannot be reached
     */
    protected abstract FetchedArchive fetchArchive(MirrorToolEntry entry, ToolReference ref,
            HydrationListener listener) throws MirrorException;

    /**
     * A local archive file. Temporary files are deleted once the tool has
     * been processed; mirror files never are.
     */
    protected record FetchedArchive(Path file, boolean temporary) {
    }

    // =====================================================================
    // Pipeline
    // =====================================================================

    private HydrationReport runPass(List<ToolReference> tools, HydrationListener listener,
            BooleanSupplier cancelled) {
        LOG.info("Hydrating {} tool(s) from {}", tools.size(), describeMirror());
        List<ToolInstallOutcome> outcomes = new ArrayList<>();

        Optional<String> rejection = batchRejection();
        ManifestPass manifest = new ManifestPass();

        for (ToolReference ref : tools) {
            if (cancelled.getAsBoolean()) {
                LOG.info("Hydration cancelled, {} tool(s) not attempted", tools.size() - outcomes.size());
                break;
            }

            listener.onInstallStarted(ref);
            ToolInstallOutcome outcome = rejection.isPresent()
                    ? ToolInstallOutcome.failed(ref, rejection.get())
                    : installOne(ref, manifest, listener);
            outcomes.add(outcome);

            if (outcome.success()) {
                LOG.info("{}: {}", ref, outcome.message());
            } else {
                LOG.warn("{} failed: {}", ref, outcome.message());
            }
            listener.onInstallCompleted(ref, outcome.success(), outcome.message());
        }

        HydrationReport report = HydrationReport.of(outcomes);
        LOG.info("Hydration finished: {} installed, {} failed", report.installedCount(), report.failedCount());
        listener.onHydrationCompleted(report.success(), report.failedTools());
        return report;
    }

    private ToolInstallOutcome installOne(ToolReference ref, ManifestPass manifest, HydrationListener listener) {
        if (library.toolExists(ref)) {
            return ToolInstallOutcome.installed(ref, "Already installed");
        }

        ManifestLoadResult loaded = manifest.get();
        if (!loaded.isValid()) {
            return ToolInstallOutcome.failed(ref, "Mirror manifest invalid: " + loaded.describeErrors());
        }

        Optional<MirrorToolEntry> entry = loaded.manifest().find(ref);
        if (entry.isEmpty()) {
            return ToolInstallOutcome.failed(ref,
                    "Not offered by mirror '" + loaded.manifest().mirrorName() + "'");
        }

        FetchedArchive archive;
        try {
            archive = fetchArchive(entry.get(), ref, listener);
        } catch (MirrorException e) {
            return ToolInstallOutcome.failed(ref, e.getMessage());
        }

        try {
            return verifyAndInstall(ref, entry.get(), archive.file());
        } catch (IOException | RuntimeException e) {
            LOG.error("Installing {} failed", ref, e);
            return ToolInstallOutcome.failed(ref, "Install failed: " + e.getMessage());
        } finally {
            if (archive.temporary()) {
                deleteQuietly(archive.file());
            }
        }
    }

    private ToolInstallOutcome verifyAndInstall(ToolReference ref, MirrorToolEntry entry, Path archive)
            throws IOException {
        String actual = HashUtil.sha256(archive);
        if (!actual.equals(entry.sha256())) {
            return ToolInstallOutcome.failed(ref,
                    "SHA-256 mismatch: expected " + entry.sha256() + " but archive hashes to " + actual);
        }

        if (entry.sizeBytes() > 0) {
            long size = Files.size(archive);
            if (size != entry.sizeBytes()) {
                LOG.warn("{}: declared size {} differs from archive size {}", ref, entry.sizeBytes(), size);
            }
        }

        LibraryInstaller.Result result = installer.install(ref, archive);

        if (!library.toolExists(ref)) {
            return ToolInstallOutcome.failed(ref, "Library entry missing after extraction");
        }
        return ToolInstallOutcome.installed(ref,
                result == LibraryInstaller.Result.INSTALLED ? "Installed" : "Already installed");
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary archive {}: {}", file, e.getMessage());
        }
    }

    /** Lazily loads the manifest once per pass. */
    private final class ManifestPass {

        private ManifestLoadResult loaded;

        ManifestLoadResult get() {
            if (loaded == null) {
                loaded = loadManifest();
            }
            return loaded;
        }
    }
}
