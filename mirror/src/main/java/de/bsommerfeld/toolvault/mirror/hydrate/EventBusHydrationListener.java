package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.event.ApplicationEventBus;
import de.bsommerfeld.toolvault.core.event.ToolVaultEvents;
import de.bsommerfeld.toolvault.core.model.ToolReference;

import java.util.List;

/**
 * Republishes hydration callbacks as {@link ToolVaultEvents} on the
 * application bus.
 */
public class EventBusHydrationListener implements HydrationListener {

    private final ApplicationEventBus eventBus;

    public EventBusHydrationListener(ApplicationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void onInstallStarted(ToolReference tool) {
        eventBus.post(new ToolVaultEvents.InstallStartedEvent(tool));
    }

    @Override
    public void onInstallProgress(ToolReference tool, long bytesDone, long bytesTotal) {
        eventBus.post(new ToolVaultEvents.InstallProgressEvent(tool, bytesDone, bytesTotal));
    }

    @Override
    public void onInstallCompleted(ToolReference tool, boolean success, String message) {
        eventBus.post(new ToolVaultEvents.InstallCompletedEvent(tool, success, message));
    }

    @Override
    public void onHydrationCompleted(boolean success, List<ToolReference> failedTools) {
        eventBus.post(new ToolVaultEvents.HydrationCompletedEvent(success, failedTools));
    }
}
