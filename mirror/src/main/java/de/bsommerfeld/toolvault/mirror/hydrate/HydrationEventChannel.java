package de.bsommerfeld.toolvault.mirror.hydrate;

import de.bsommerfeld.toolvault.core.model.ToolReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Carries hydration events from the worker thread to the owning context.
 *
 * <p>
 * The worker only enqueues. Each enqueue schedules a drain on the owner
 * executor, which delivers pending events in order to the real listener.
 * Once cancelled, nothing further is enqueued or delivered.
 */
final class HydrationEventChannel implements HydrationListener {

    private static final Logger LOG = LoggerFactory.getLogger(HydrationEventChannel.class);

    private final HydrationListener target;
    private final Executor owner;
    private final Queue<Consumer<HydrationListener>> pending = new ConcurrentLinkedQueue<>();
    private volatile boolean cancelled;

    HydrationEventChannel(HydrationListener target, Executor owner) {
        this.target = target;
        this.owner = owner;
    }

    void cancel() {
        cancelled = true;
        pending.clear();
    }

    boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void onInstallStarted(ToolReference tool) {
        enqueue(l -> l.onInstallStarted(tool));
    }

    @Override
    public void onInstallProgress(ToolReference tool, long bytesDone, long bytesTotal) {
        enqueue(l -> l.onInstallProgress(tool, bytesDone, bytesTotal));
    }

    @Override
    public void onInstallCompleted(ToolReference tool, boolean success, String message) {
        enqueue(l -> l.onInstallCompleted(tool, success, message));
    }

    @Override
    public void onHydrationCompleted(boolean success, List<ToolReference> failedTools) {
        enqueue(l -> l.onHydrationCompleted(success, failedTools));
    }

    private void enqueue(Consumer<HydrationListener> event) {
        if (cancelled) {
            return;
        }
        pending.add(event);
        owner.execute(this::drain);
    }

    private synchronized void drain() {
        Consumer<HydrationListener> event;
        while ((event = pending.poll()) != null) {
            if (cancelled) {
                pending.clear();
                return;
            }
            try {
                event.accept(target);
            } catch (RuntimeException e) {
                LOG.warn("Hydration listener threw: {}", e.getMessage(), e);
            }
        }
    }
}
