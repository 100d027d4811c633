package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.event.ApplicationEventBus;
import de.bsommerfeld.toolvault.core.event.ToolVaultEvents;
import de.bsommerfeld.toolvault.core.model.ToolReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventBusHydrationListenerTest {

    private static final ToolReference GODOT = ToolReference.of("godot", "4.3");

    @Mock
    private ApplicationEventBus bus;

    @Test
    void callbacks_shouldBePostedAsEvents() {
        EventBusHydrationListener listener = new EventBusHydrationListener(bus);

        listener.onInstallStarted(GODOT);
        listener.onInstallProgress(GODOT, 10, 100);
        listener.onInstallCompleted(GODOT, false, "SHA-256 mismatch");
        listener.onHydrationCompleted(false, List.of(GODOT));

        verify(bus).post(new ToolVaultEvents.InstallStartedEvent(GODOT));
        verify(bus).post(new ToolVaultEvents.InstallProgressEvent(GODOT, 10, 100));
        verify(bus).post(new ToolVaultEvents.InstallCompletedEvent(GODOT, false, "SHA-256 mismatch"));
        verify(bus).post(new ToolVaultEvents.HydrationCompletedEvent(false, List.of(GODOT)));
        verifyNoMoreInteractions(bus);
    }
}
