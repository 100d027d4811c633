package de.bsommerfeld.toolvault.sealer;

import de.bsommerfeld.toolvault.core.event.ApplicationEventBus;
import de.bsommerfeld.toolvault.core.event.ToolVaultEvents;
import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.util.ByteFormatter;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Turns a project into a self-contained, offline-only deliverable.
 *
 * <h3>Phases</h3>
 *
 * <pre>
 * VALIDATE   project + manifest readable, every tool installed  ({@link SealValidator})
 * COPY       library entries → &lt;project&gt;/tools/&lt;id&gt;_&lt;version&gt;/  ({@link ToolCopier})
 * CONFIGURE  toolvault.config.json with offline flags forced on  ({@link OfflineConfigWriter})
 * ARCHIVE    &lt;parent&gt;/&lt;name&gt;_Sealed_&lt;timestamp&gt;.zip           ({@link ProjectArchiver})
 * </pre>
 *
 * The first phase that reports errors stops the run; its errors become the
 * result's error list. A failed validation therefore leaves the project
 * folder untouched.
 */
public class ProjectSealer {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectSealer.class);

    private final SealValidator validator;
    private final ToolCopier copier;
    private final OfflineConfigWriter configWriter;
    private final ProjectArchiver archiver;
    private final ApplicationEventBus eventBus;

    @Inject
    public ProjectSealer(LibraryManager library, ApplicationEventBus eventBus, Clock clock) {
        this(new SealValidator(library), new ToolCopier(library), new OfflineConfigWriter(),
                new ProjectArchiver(clock), eventBus);
    }

    ProjectSealer(SealValidator validator, ToolCopier copier, OfflineConfigWriter configWriter,
            ProjectArchiver archiver, ApplicationEventBus eventBus) {
        this.validator = validator;
        this.copier = copier;
        this.configWriter = configWriter;
        this.archiver = archiver;
        this.eventBus = eventBus;
    }

    public SealResult seal(Path projectDir) {
        LOG.info("Sealing project {}", projectDir);
        SealResult result = runPhases(projectDir);

        if (result.success()) {
            LOG.info("Sealed {} into {} ({} MB, {} tool(s))",
                    projectDir, result.sealedArchivePath(), result.sizeMb(), result.toolsCopied().size());
        } else {
            LOG.warn("Sealing {} failed: {}", projectDir, result.errors());
        }
        eventBus.post(new ToolVaultEvents.ProjectSealedEvent(
                projectDir, result.sealedArchivePath(), result.success()));
        return result;
    }

    private SealResult runPhases(Path projectDir) {
        SealValidator.Result validation = validator.validate(projectDir);
        if (!validation.isValid()) {
            return SealResult.failed(List.of(), validation.errors());
        }

        ToolCopier.Result copy = copier.copy(validation.tools(), projectDir);
        List<ToolReference> copied = copy.copied();
        if (!copy.isSuccess()) {
            return SealResult.failed(copied, copy.errors());
        }

        OfflineConfigWriter.Result config = configWriter.write(projectDir);
        if (!config.isSuccess()) {
            return SealResult.failed(copied, config.errors());
        }

        ProjectArchiver.Result archive = archiver.archive(projectDir);
        if (!archive.isSuccess()) {
            return SealResult.failed(copied, archive.errors());
        }

        return SealResult.sealed(archive.archive(), ByteFormatter.toMegabytes(archive.sizeBytes()), copied);
    }
}
