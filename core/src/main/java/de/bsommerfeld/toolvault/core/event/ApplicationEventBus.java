package de.bsommerfeld.toolvault.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} that decouples the library
 * operations (hydration, sealing, launching) from whoever displays them.
 *
 * <p>
 * Delivery is synchronous on the posting thread. Hydration events are
 * already marshalled to the owning context before they reach the bus, so
 * subscribers never run on a worker thread.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        // Byte-level progress is far too chatty for debug output
        if (!(event instanceof ToolVaultEvents.InstallProgressEvent)) {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable error, SubscriberExceptionContext context) {
        LOG.error("Subscriber {} failed on {}", context.getSubscriberMethod(), context.getEvent(), error);
    }
}
