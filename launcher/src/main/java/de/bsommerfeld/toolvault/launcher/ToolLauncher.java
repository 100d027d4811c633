package de.bsommerfeld.toolvault.launcher;

import de.bsommerfeld.toolvault.core.event.ApplicationEventBus;
import de.bsommerfeld.toolvault.core.event.ToolVaultEvents;
import de.bsommerfeld.toolvault.core.hash.HashUtil;
import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.offline.OfflineEnforcer;
import de.bsommerfeld.toolvault.core.path.PathResolution;
import de.bsommerfeld.toolvault.core.path.SafePathResolver;
import de.bsommerfeld.toolvault.core.project.ProjectToolEntry;
import de.bsommerfeld.toolvault.core.util.StorageUtils;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Launches a project's tool after verifying where it lives and what it is.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 * 1. Validate entry          → INVALID_ENTRY
 * 2. Locate executable       → explicit path (contained in project) or library lookup
 * 3. Verify declared SHA-256 → HASH_MALFORMED / HASH_UNREADABLE / HASH_MISMATCH
 * 4. Build arguments         → closed per-tool table
 * 5. Offline override        → only while the gate is active; OFFLINE_OVERRIDE_FAILED
 * 6. Spawn                   → SPAWN_FAILED
 * </pre>
 *
 * Every failing step returns before the next one runs, so a rejected
 * launch never reaches the spawner.
 */
public class ToolLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(ToolLauncher.class);

    private final LibraryManager library;
    private final OfflineEnforcer offlineEnforcer;
    private final OfflineOverride offlineOverride;
    private final ProcessSpawner spawner;
    private final ApplicationEventBus eventBus;
    private final ExecutableResolver executableResolver;

    @Inject
    public ToolLauncher(LibraryManager library, OfflineEnforcer offlineEnforcer,
            OfflineOverride offlineOverride, ProcessSpawner spawner, ApplicationEventBus eventBus) {
        this(library, offlineEnforcer, offlineOverride, spawner, eventBus, StorageUtils.isWindows());
    }

    ToolLauncher(LibraryManager library, OfflineEnforcer offlineEnforcer, OfflineOverride offlineOverride,
            ProcessSpawner spawner, ApplicationEventBus eventBus, boolean windows) {
        this.library = library;
        this.offlineEnforcer = offlineEnforcer;
        this.offlineOverride = offlineOverride;
        this.spawner = spawner;
        this.eventBus = eventBus;
        this.executableResolver = new ExecutableResolver(windows);
    }

    public LaunchResult launch(ProjectToolEntry entry, Path projectDir) {
        LaunchResult result = doLaunch(entry, projectDir);
        if (result.success()) {
            LOG.info("Launched {}: {}", describe(entry), result.message());
        } else {
            LOG.warn("Launch of {} rejected [{}]: {}", describe(entry), result.errorKind(), result.message());
        }
        return result;
    }

    private LaunchResult doLaunch(ProjectToolEntry entry, Path projectDir) {
        if (entry == null) {
            return LaunchResult.failed(LaunchErrorKind.INVALID_ENTRY, "No tool entry given");
        }
        ToolReference ref;
        try {
            ref = entry.reference();
        } catch (IllegalArgumentException e) {
            return LaunchResult.failed(LaunchErrorKind.INVALID_ENTRY, "Invalid tool entry: " + e.getMessage());
        }
        if (projectDir == null || !Files.isDirectory(projectDir)) {
            return LaunchResult.failed(LaunchErrorKind.INVALID_ENTRY, "Project directory not found: " + projectDir);
        }
        Path project = projectDir.toAbsolutePath().normalize();

        Located located = entry.hasExplicitPath()
                ? locateExplicit(entry.path(), project)
                : locateInLibrary(ref);
        if (located.failure() != null) {
            return located.failure();
        }
        Path executable = located.executable();

        if (entry.hasDeclaredHash()) {
            Optional<LaunchResult> hashFailure = verifyHash(executable, entry.sha256());
            if (hashFailure.isPresent()) {
                return hashFailure.get();
            }
        }

        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(LaunchArguments.forTool(ref.id(), project));
        Map<String, String> environment = new HashMap<>();

        if (offlineEnforcer.isOffline()) {
            OfflineOverride.Injection injection;
            try {
                injection = offlineOverride.prepare(ref, executable, project);
            } catch (IOException | RuntimeException e) {
                return LaunchResult.failed(LaunchErrorKind.OFFLINE_OVERRIDE_FAILED,
                        "Offline preparation failed: " + e.getMessage());
            }
            environment.putAll(injection.environment());
            command.addAll(injection.extraArguments());
        }

        long pid;
        try {
            pid = spawner.spawn(command, project, environment);
        } catch (IOException | RuntimeException e) {
            return LaunchResult.failed(LaunchErrorKind.SPAWN_FAILED,
                    "Could not start " + executable + ": " + e.getMessage());
        }

        eventBus.post(new ToolVaultEvents.ToolLaunchedEvent(ref, pid));
        return LaunchResult.started(pid, executable + " (pid " + pid + ")");
    }

    private Located locateExplicit(String relativePath, Path project) {
        PathResolution resolution = SafePathResolver.resolveWithin(project, relativePath);
        if (!resolution.success()) {
            LaunchErrorKind kind;
            if (PathResolution.PATH_ABSOLUTE.equals(resolution.errorCode())) {
                kind = LaunchErrorKind.PATH_ABSOLUTE;
            } else if (resolution.isTraversal()) {
                kind = LaunchErrorKind.PATH_TRAVERSAL;
            } else {
                kind = LaunchErrorKind.INVALID_ENTRY;
            }
            return Located.failed(LaunchResult.failed(kind, resolution.message()));
        }

        Path executable = resolution.fullPath();
        if (!Files.isRegularFile(executable)) {
            return Located.failed(LaunchResult.failed(LaunchErrorKind.EXECUTABLE_NOT_FOUND,
                    "No file at " + executable));
        }
        return Located.found(executable);
    }

    private Located locateInLibrary(ToolReference ref) {
        Optional<Path> toolDir = library.toolPath(ref);
        if (toolDir.isEmpty() || !library.toolExists(ref)) {
            return Located.failed(LaunchResult.failed(LaunchErrorKind.TOOL_NOT_INSTALLED,
                    ref + " is not installed in the library"));
        }

        try {
            return executableResolver.resolve(toolDir.get(), ref.id())
                    .map(Located::found)
                    .orElseGet(() -> Located.failed(LaunchResult.failed(LaunchErrorKind.EXECUTABLE_NOT_FOUND,
                            "No executable found in " + toolDir.get())));
        } catch (IOException e) {
            return Located.failed(LaunchResult.failed(LaunchErrorKind.EXECUTABLE_NOT_FOUND,
                    "Cannot scan " + toolDir.get() + ": " + e.getMessage()));
        }
    }

    private static Optional<LaunchResult> verifyHash(Path executable, String expected) {
        if (!HashUtil.isWellFormed(expected)) {
            return Optional.of(LaunchResult.failed(LaunchErrorKind.HASH_MALFORMED,
                    "Declared sha256 is not 64 lowercase hex characters: '" + expected + "'"));
        }

        String actual;
        try {
            actual = HashUtil.sha256(executable);
        } catch (IOException e) {
            return Optional.of(LaunchResult.failed(LaunchErrorKind.HASH_UNREADABLE,
                    "Cannot hash " + executable + ": " + e.getMessage()));
        }
        if (!actual.equals(expected)) {
            return Optional.of(LaunchResult.failed(LaunchErrorKind.HASH_MISMATCH,
                    "SHA-256 mismatch for " + executable + ": expected " + expected + " but was " + actual));
        }
        return Optional.empty();
    }

    private static String describe(ProjectToolEntry entry) {
        return entry == null ? "<none>" : entry.id() + "@" + entry.version();
    }

    /** Either an executable or the failure explaining why there is none. */
    private record Located(Path executable, LaunchResult failure) {

        static Located found(Path executable) {
            return new Located(executable, null);
        }

        static Located failed(LaunchResult failure) {
            return new Located(null, failure);
        }
    }
}
