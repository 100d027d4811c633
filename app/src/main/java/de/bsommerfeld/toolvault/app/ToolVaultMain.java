package de.bsommerfeld.toolvault.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.toolvault.app.config.ToolVaultSettings;
import de.bsommerfeld.toolvault.core.event.ApplicationEventBus;
import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.KnownTool;
import de.bsommerfeld.toolvault.core.model.ToolMetadata;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.offline.OfflineConfig;
import de.bsommerfeld.toolvault.core.offline.OfflineEnforcer;
import de.bsommerfeld.toolvault.core.project.ProjectManifest;
import de.bsommerfeld.toolvault.core.project.ProjectManifestException;
import de.bsommerfeld.toolvault.core.project.ProjectManifestReader;
import de.bsommerfeld.toolvault.core.project.ProjectToolEntry;
import de.bsommerfeld.toolvault.core.util.ByteFormatter;
import de.bsommerfeld.toolvault.launcher.LaunchResult;
import de.bsommerfeld.toolvault.launcher.ToolLauncher;
import de.bsommerfeld.toolvault.mirror.hydrate.AbstractMirrorHydrator;
import de.bsommerfeld.toolvault.mirror.hydrate.EventBusHydrationListener;
import de.bsommerfeld.toolvault.mirror.hydrate.HydrationReport;
import de.bsommerfeld.toolvault.mirror.hydrate.MirrorHydrator;
import de.bsommerfeld.toolvault.mirror.hydrate.RemoteMirrorHydrator;
import de.bsommerfeld.toolvault.mirror.hydrate.ToolInstallOutcome;
import de.bsommerfeld.toolvault.sealer.ProjectSealer;
import de.bsommerfeld.toolvault.sealer.SealError;
import de.bsommerfeld.toolvault.sealer.SealResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command line entry point.
 *
 * <pre>
 * list                                 installed tools and versions
 * hydrate &lt;id@version&gt;...            install from the local mirror
 * hydrate-remote &lt;id@version&gt;...     install from the remote mirror
 * remove &lt;id@version&gt;                delete a library entry
 * launch &lt;projectDir&gt; &lt;toolId&gt;       start a project's tool
 * seal &lt;projectDir&gt;                   build the sealed deliverable
 * </pre>
 *
 * Exit codes: 0 success, 1 the operation failed, 2 usage error.
 */
public final class ToolVaultMain {

    private static final Logger LOG = LoggerFactory.getLogger(ToolVaultMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final Injector injector;
    private final PrintStream out;

    ToolVaultMain(Injector injector, PrintStream out) {
        this.injector = injector;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            Injector injector = Guice.createInjector(new ToolVaultModule());
            exitCode = new ToolVaultMain(injector, System.out).run(args);
        } catch (RuntimeException e) {
            LOG.error("Fatal error", e);
            System.err.println("Error: " + e.getMessage());
            exitCode = EXIT_FAILED;
        }
        System.exit(exitCode);
    }

    int run(String[] args) {
        if (args.length == 0) {
            return usage("No command given");
        }
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);

        switch (command) {
            case "list":
                return list();
            case "hydrate":
                return hydrate(injector.getInstance(MirrorHydrator.class), rest);
            case "hydrate-remote":
                if (!injector.getInstance(ToolVaultSettings.class).hasRemoteMirror()) {
                    out.println("No remote_manifest_url configured in settings.json");
                    return EXIT_FAILED;
                }
                return hydrate(injector.getInstance(RemoteMirrorHydrator.class), rest);
            case "remove":
                return remove(rest);
            case "launch":
                return launch(rest);
            case "seal":
                return seal(rest);
            default:
                return usage("Unknown command: " + command);
        }
    }

    private int list() {
        LibraryManager library = injector.getInstance(LibraryManager.class);
        Optional<Path> root = library.libraryRoot();
        if (root.isEmpty()) {
            out.println("Library location cannot be resolved on this machine");
            return EXIT_FAILED;
        }

        out.println("Library: " + root.get());
        for (String id : library.listTools()) {
            for (String version : library.listVersions(id)) {
                ToolMetadata meta = library.toolMetadata(id, version);
                out.printf("  %-12s %-12s %-8s %s%n", id, version, KnownTool.categoryFor(id),
                        ByteFormatter.format(meta.sizeBytes()));
            }
        }
        return EXIT_OK;
    }

    private int hydrate(AbstractMirrorHydrator hydrator, List<String> refs) {
        if (refs.isEmpty()) {
            return usage("hydrate needs at least one <id@version>");
        }
        List<ToolReference> tools = new ArrayList<>();
        for (String text : refs) {
            try {
                tools.add(ToolReference.parse(text));
            } catch (IllegalArgumentException e) {
                return usage(e.getMessage());
            }
        }

        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        HydrationReport report = hydrator.hydrate(tools, new EventBusHydrationListener(eventBus));
        for (ToolInstallOutcome outcome : report.outcomes()) {
            out.printf("  %-20s %s  %s%n", outcome.tool(), outcome.success() ? "OK  " : "FAIL", outcome.message());
        }
        out.printf("%d installed, %d failed%n", report.installedCount(), report.failedCount());
        return report.success() ? EXIT_OK : EXIT_FAILED;
    }

    private int remove(List<String> args) {
        if (args.size() != 1) {
            return usage("remove needs exactly one <id@version>");
        }
        ToolReference ref;
        try {
            ref = ToolReference.parse(args.get(0));
        } catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        }
        if (!injector.getInstance(LibraryManager.class).removeTool(ref)) {
            out.println(ref + " is not installed or could not be removed");
            return EXIT_FAILED;
        }
        out.println("Removed " + ref);
        return EXIT_OK;
    }

    private int launch(List<String> args) {
        if (args.size() != 2) {
            return usage("launch needs <projectDir> <toolId>");
        }
        Path projectDir = Path.of(args.get(0));
        ProjectManifest manifest;
        try {
            manifest = ProjectManifestReader.read(projectDir);
        } catch (ProjectManifestException e) {
            out.println(e.getMessage());
            return EXIT_FAILED;
        }

        Optional<ProjectToolEntry> entry = manifest.findTool(args.get(1));
        if (entry.isEmpty()) {
            out.println("Project '" + manifest.name() + "' does not declare tool " + args.get(1));
            return EXIT_FAILED;
        }

        // Settings and project flags combine, so a sealed project stays offline on any machine
        OfflineConfig effective = injector.getInstance(ToolVaultSettings.class).offlineConfig()
                .merge(manifest.offline());
        injector.getInstance(OfflineEnforcer.class).apply(effective);

        LaunchResult result = injector.getInstance(ToolLauncher.class).launch(entry.get(), projectDir);
        if (!result.success()) {
            out.println("Launch failed [" + result.errorKind() + "]: " + result.message());
            return EXIT_FAILED;
        }
        out.println("Started " + result.message());
        return EXIT_OK;
    }

    private int seal(List<String> args) {
        if (args.size() != 1) {
            return usage("seal needs <projectDir>");
        }
        SealResult result = injector.getInstance(ProjectSealer.class).seal(Path.of(args.get(0)));
        if (!result.success()) {
            for (SealError error : result.errors()) {
                out.println("  " + error);
            }
            out.println("Sealing failed");
            return EXIT_FAILED;
        }
        out.printf("Sealed %d tool(s) into %s (%.2f MB)%n",
                result.toolsCopied().size(), result.sealedArchivePath(), result.sizeMb());
        return EXIT_OK;
    }

    private int usage(String problem) {
        out.println(problem);
        out.println("Usage: toolvault <list | hydrate id@version... | hydrate-remote id@version... "
                + "| remove id@version | launch projectDir toolId | seal projectDir>");
        return EXIT_USAGE;
    }
}
