package de.bsommerfeld.toolvault.sealer;

import de.bsommerfeld.toolvault.core.library.LibraryManager;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import de.bsommerfeld.toolvault.core.project.ProjectManifest;
import de.bsommerfeld.toolvault.core.project.ProjectManifestException;
import de.bsommerfeld.toolvault.core.project.ProjectManifestReader;
import de.bsommerfeld.toolvault.core.project.ProjectToolEntry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validate phase: the project and its manifest exist and every referenced
 * tool is installed. All missing tools are reported, not only the first.
 */
public class SealValidator {

    private final LibraryManager library;

    public SealValidator(LibraryManager library) {
        this.library = library;
    }

    /**
     * @param manifest parsed manifest, {@code null} if it could not be read
     * @param tools    distinct tool references in manifest order
     * @param errors   empty if sealing may proceed
     */
    public record Result(ProjectManifest manifest, List<ToolReference> tools, List<SealError> errors) {

        public Result {
            tools = List.copyOf(tools);
            errors = List.copyOf(errors);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    public Result validate(Path projectDir) {
        if (projectDir == null || !Files.isDirectory(projectDir)) {
            return new Result(null, List.of(), List.of(error(SealError.PROJECT_NOT_FOUND,
                    "Project directory not found: " + projectDir)));
        }

        ProjectManifest manifest;
        try {
            manifest = ProjectManifestReader.read(projectDir);
        } catch (ProjectManifestException e) {
            return new Result(null, List.of(), List.of(error(SealError.MANIFEST_INVALID, e.getMessage())));
        }

        if (library.libraryRoot().isEmpty()) {
            return new Result(manifest, List.of(), List.of(error(SealError.LIBRARY_UNRESOLVED,
                    "Tool library location cannot be resolved")));
        }

        Set<ToolReference> tools = new LinkedHashSet<>();
        List<SealError> errors = new ArrayList<>();
        for (ProjectToolEntry entry : manifest.tools()) {
            ToolReference ref;
            try {
                ref = entry.reference();
            } catch (IllegalArgumentException e) {
                errors.add(error(SealError.TOOL_INVALID,
                        "Invalid tool entry " + entry.id() + "@" + entry.version() + ": " + e.getMessage()));
                continue;
            }
            if (!library.toolExists(ref)) {
                errors.add(error(SealError.TOOL_MISSING,
                        "Tool " + ref.id() + " version " + ref.version() + " is not installed in the library"));
                continue;
            }
            tools.add(ref);
        }
        return new Result(manifest, new ArrayList<>(tools), errors);
    }

    private static SealError error(String code, String message) {
        return new SealError(SealPhase.VALIDATE, code, message);
    }
}
