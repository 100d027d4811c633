package de.bsommerfeld.toolvault.sealer;

import de.bsommerfeld.toolvault.core.model.ToolReference;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link ProjectSealer#seal}. {@code errors} is empty exactly
 * when {@code success} is {@code true}.
 *
 * @param success             all four phases completed
 * @param sealedArchivePath   the written archive, {@code null} unless successful
 * @param sizeMb              archive size in megabytes, rounded to two decimals
 * @param toolsCopied         tools embedded into the project, in manifest order
 * @param errors              every problem of the phase that stopped the run
 */
public record SealResult(boolean success, Path sealedArchivePath, double sizeMb,
        List<ToolReference> toolsCopied, List<SealError> errors) {

    public SealResult {
        toolsCopied = List.copyOf(toolsCopied);
        errors = List.copyOf(errors);
    }

    static SealResult sealed(Path archive, double sizeMb, List<ToolReference> toolsCopied) {
        return new SealResult(true, archive, sizeMb, toolsCopied, List.of());
    }

    static SealResult failed(List<ToolReference> toolsCopied, List<SealError> errors) {
        return new SealResult(false, null, 0, toolsCopied, errors);
    }
}
