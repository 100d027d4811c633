package de.bsommerfeld.toolvault.mirror.hydrate;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a background hydration started with
 * {@link AbstractMirrorHydrator#hydrateAsync}.
 *
 * <p>
 * Cancellation is cooperative. It silences all further notifications at
 * once, but the worker only stops between tools; an install that is already
 * extracting runs to completion and still appears in the final report.
 */
public final class HydrationHandle {

    private final HydrationStatus status;
    private final HydrationEventChannel channel;
    private final CompletableFuture<HydrationReport> report;

    HydrationHandle(HydrationStatus status, HydrationEventChannel channel,
            CompletableFuture<HydrationReport> report) {
        this.status = status;
        this.channel = channel;
        this.report = report;
    }

    static HydrationHandle alreadyRunning() {
        return new HydrationHandle(HydrationStatus.ALREADY_RUNNING, null,
                CompletableFuture.completedFuture(HydrationReport.empty()));
    }

    public HydrationStatus status() {
        return status;
    }

    public void cancel() {
        if (channel != null) {
            channel.cancel();
        }
    }

    public boolean isCancelled() {
        return channel != null && channel.isCancelled();
    }

    /**
     * Completes on the worker thread when the pass ends. For
     * {@link HydrationStatus#ALREADY_RUNNING} it is already complete with an
     * empty report.
     */
    public CompletableFuture<HydrationReport> report() {
        return report;
    }
}
