package de.bsommerfeld.toolvault.sealer;

import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.util.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Copy phase: embeds library entries into {@code <project>/tools/<id>_<version>/}.
 *
 * <p>
 * Each tool is copied into a {@code .partial} sibling first and renamed
 * once complete, so a tool folder either holds the full entry or does not
 * exist. A failing tool is reported and the remaining tools are still
 * attempted.
 */
public class ToolCopier {

    private static final Logger LOG = LoggerFactory.getLogger(ToolCopier.class);

    public static final String TOOLS_DIR_NAME = "tools";
    static final String PARTIAL_SUFFIX = ".partial";

    private final LibraryManager library;

    public ToolCopier(LibraryManager library) {
        this.library = library;
    }

    /**
     * @param copied tools now present in the project, in request order
     * @param errors one entry per tool that could not be copied
     */
    public record Result(Path toolsDir, List<ToolReference> copied, List<SealError> errors) {

        public Result {
            copied = List.copyOf(copied);
            errors = List.copyOf(errors);
        }

        public boolean isSuccess() {
            return errors.isEmpty();
        }
    }

    public static Path toolsDir(Path projectDir) {
        return projectDir.resolve(TOOLS_DIR_NAME);
    }

    public Result copy(List<ToolReference> tools, Path projectDir) {
        Path toolsDir = toolsDir(projectDir);
        try {
            Files.createDirectories(toolsDir);
        } catch (IOException e) {
            return new Result(toolsDir, List.of(), List.of(new SealError(SealPhase.COPY,
                    SealError.TOOLS_DIR_FAILED, "Cannot create " + toolsDir + ": " + e.getMessage())));
        }

        List<ToolReference> copied = new ArrayList<>();
        List<SealError> errors = new ArrayList<>();
        for (ToolReference ref : tools) {
            try {
                copyOne(ref, toolsDir);
                copied.add(ref);
            } catch (IOException e) {
                LOG.warn("Copying {} into {} failed: {}", ref, toolsDir, e.getMessage());
                errors.add(new SealError(SealPhase.COPY, SealError.TOOL_COPY_FAILED,
                        "Cannot copy " + ref + ": " + e.getMessage()));
            }
        }
        return new Result(toolsDir, copied, errors);
    }

    private void copyOne(ToolReference ref, Path toolsDir) throws IOException {
        Optional<Path> source = library.toolPath(ref);
        if (source.isEmpty() || !library.toolExists(ref)) {
            throw new IOException("library entry is missing");
        }

        Path target = toolsDir.resolve(ref.folderName());
        Path partial = toolsDir.resolve(ref.folderName() + PARTIAL_SUFFIX);
        FileTrees.deleteTree(partial);
        try {
            FileTrees.copyTree(source.get(), partial);
            FileTrees.deleteTree(target);
            try {
                Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partial, target);
            }
        } finally {
            FileTrees.deleteTree(partial);
        }
        LOG.debug("Copied {} to {}", ref, target);
    }
}
