package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.model.ToolReference;

import java.util.List;

/**
 * Aggregated outcome of one hydration pass.
 *
 * @param installedCount tools present in the library after the pass (including already installed ones)
 * @param failedCount    tools that could not be installed
 * @param failedTools    references of the failed tools, in request order
 * @param outcomes       per-tool outcomes, in request order
 */
public record HydrationReport(int installedCount, int failedCount,
        List<ToolReference> failedTools, List<ToolInstallOutcome> outcomes) {

    public HydrationReport {
        failedTools = List.copyOf(failedTools);
        outcomes = List.copyOf(outcomes);
    }

    public static HydrationReport of(List<ToolInstallOutcome> outcomes) {
        List<ToolReference> failed = outcomes.stream()
                .filter(o -> !o.success())
                .map(ToolInstallOutcome::tool)
                .toList();
        return new HydrationReport(outcomes.size() - failed.size(), failed.size(), failed, outcomes);
    }

    public static HydrationReport empty() {
        return new HydrationReport(0, 0, List.of(), List.of());
    }

    public boolean success() {
        return failedCount == 0;
    }
}
