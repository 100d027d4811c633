package de.bsommerfeld.toolvault.app;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.toolvault.core.event.ApplicationEventBus;
import de.bsommerfeld.toolvault.core.event.ToolVaultEvents;
import de.bsommerfeld.toolvault.core.util.ByteFormatter;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes library activity from the event bus to the log.
 */
public class HydrationEventLogger {

    private static final Logger LOG = LoggerFactory.getLogger(HydrationEventLogger.class);

    @Inject
    public HydrationEventLogger(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onInstallStarted(ToolVaultEvents.InstallStartedEvent event) {
        LOG.info("Installing {}", event.tool());
    }

    @Subscribe
    public void onInstallProgress(ToolVaultEvents.InstallProgressEvent event) {
        LOG.debug("{}: {}", event.tool(), ByteFormatter.formatProgress(event.bytesDone(), event.bytesTotal()));
    }

    @Subscribe
    public void onInstallCompleted(ToolVaultEvents.InstallCompletedEvent event) {
        if (event.success()) {
            LOG.info("{} ready: {}", event.tool(), event.message());
        } else {
            LOG.warn("{} failed: {}", event.tool(), event.message());
        }
    }

    @Subscribe
    public void onHydrationCompleted(ToolVaultEvents.HydrationCompletedEvent event) {
        if (event.success()) {
            LOG.info("Hydration complete");
        } else {
            LOG.warn("Hydration finished with failures: {}", event.failedTools());
        }
    }

    @Subscribe
    public void onToolLaunched(ToolVaultEvents.ToolLaunchedEvent event) {
        LOG.info("{} running as pid {}", event.tool(), event.pid());
    }

    @Subscribe
    public void onProjectSealed(ToolVaultEvents.ProjectSealedEvent event) {
        if (event.success()) {
            LOG.info("Project {} sealed into {}", event.projectDir(), event.archive());
        } else {
            LOG.warn("Project {} could not be sealed", event.projectDir());
        }
    }
}
