package de.bsommerfeld.toolvault.core.event;

import de.bsommerfeld.toolvault.core.model.ToolReference;

import java.nio.file.Path;
import java.util.List;

/**
 * Events posted on the {@link ApplicationEventBus}. Only events that more
 * than one module produces or consumes belong here.
 */
public final class ToolVaultEvents {

    private ToolVaultEvents() {
    }

    public record InstallStartedEvent(ToolReference tool) {
    }

    public record InstallProgressEvent(ToolReference tool, long bytesDone, long bytesTotal) {
    }

    public record InstallCompletedEvent(ToolReference tool, boolean success, String message) {
    }

    public record HydrationCompletedEvent(boolean success, List<ToolReference> failedTools) {
        public HydrationCompletedEvent {
            failedTools = List.copyOf(failedTools);
        }
    }

    public record ToolLaunchedEvent(ToolReference tool, long pid) {
    }

    public record ProjectSealedEvent(Path projectDir, Path archive, boolean success) {
    }
}
