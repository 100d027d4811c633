package de.bsommerfeld.toolvault.core.offline;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide network gate.
 *
 * <h3>State machine</h3>
 *
 * <pre>
 * UNKNOWN ──apply(cfg)──► FORCE_OFFLINE   (cfg.forceOffline)
 *                     ├─► OFFLINE_MODE    (cfg.offlineMode)
 *                     └─► DISABLED        (neither)
 * any     ──apply(null)─► UNKNOWN
 * any     ──reset()─────► RESET (inactive, initialized)
 * </pre>
 *
 * <h3>Thread model</h3>
 * The whole state is one immutable {@link OfflineState} behind an
 * {@link AtomicReference}. Writers replace it in a single store, so every
 * concurrent hydrator sees either the old or the new state, never a mix.
 *
 * <h3>Fail closed</h3>
 * {@link #guardNetworkCall(String)} blocks while the gate is still
 * {@code UNKNOWN}: a caller that runs before any configuration was applied
 * cannot tell whether it is allowed online, so it is not.
 */
@Singleton
public class OfflineEnforcer {

    private static final Logger LOG = LoggerFactory.getLogger(OfflineEnforcer.class);

    private static final OfflineEnforcer SHARED = new OfflineEnforcer();

    private final AtomicReference<OfflineState> state = new AtomicReference<>(OfflineState.UNKNOWN);

    /** The process-wide instance. Guice binds the same object. */
    public static OfflineEnforcer shared() {
        return SHARED;
    }

    /**
     * Re-derives the state from a configuration. {@code null} means "no
     * configuration" and returns the gate to {@code UNKNOWN}.
     */
    public OfflineState apply(OfflineConfig config) {
        OfflineState next;
        if (config == null) {
            next = OfflineState.UNKNOWN;
        } else if (config.forceOffline()) {
            next = OfflineState.FORCE_OFFLINE;
        } else if (config.offlineMode()) {
            next = OfflineState.OFFLINE_MODE;
        } else {
            next = OfflineState.DISABLED;
        }

        OfflineState previous = state.getAndSet(next);
        if (previous != next) {
            LOG.info("Offline state changed: {} -> {}", previous.reason().key(), next.reason().key());
        }
        return next;
    }

    public boolean isOffline() {
        return state.get().active();
    }

    public OfflineState state() {
        return state.get();
    }

    /**
     * Asks whether a network-capable step may run.
     *
     * @param context short description of the caller's intent, embedded in the
     *                blocked message (e.g. "download godot@4.3")
     */
    public NetworkGuardResult guardNetworkCall(String context) {
        OfflineState current = state.get();
        if (current.active()) {
            String message = "Network access blocked (" + current.reason().key() + "): " + context;
            LOG.warn(message);
            return NetworkGuardResult.block(NetworkGuardResult.NETWORK_OFFLINE, message);
        }
        if (!current.initialized()) {
            String message = "Network access blocked, offline state was never initialized: " + context;
            LOG.warn(message);
            return NetworkGuardResult.block(NetworkGuardResult.GATE_UNINITIALIZED, message);
        }
        return NetworkGuardResult.allow();
    }

    /** Forces the gate open and initialized. Intended for test isolation. */
    public void reset() {
        state.set(OfflineState.RESET);
        LOG.debug("Offline state reset");
    }
}
