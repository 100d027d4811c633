package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.model.ToolReference;

import java.util.List;

/**
 * Receives hydration notifications. For {@code hydrateAsync} every callback
 * runs on the hydrator's callback executor (the caller's owning context),
 * never on the worker thread.
 */
public interface HydrationListener {

    HydrationListener NONE = new HydrationListener() {
    };

    default void onInstallStarted(ToolReference tool) {
    }

    /**
     * Byte-level progress. Only remote hydration reports it.
     *
     * @param bytesTotal expected total, or -1 if neither the server nor the manifest declares it
     */
    default void onInstallProgress(ToolReference tool, long bytesDone, long bytesTotal) {
    }

    default void onInstallCompleted(ToolReference tool, boolean success, String message) {
    }

    default void onHydrationCompleted(boolean success, List<ToolReference> failedTools) {
    }
}
