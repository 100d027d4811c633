package de.bsommerfeld.toolvault.core.offline;

import java.util.Locale;

/**
 * Immutable snapshot of the network gate. Published as a whole; readers never
 * observe a half-applied transition.
 *
 * @param active {@code true} if network-capable behavior must be blocked
 * @param reason why the gate is in its current position
 */
public record OfflineState(boolean active, Reason reason) {

    public static final OfflineState UNKNOWN = new OfflineState(false, Reason.UNKNOWN);
    public static final OfflineState DISABLED = new OfflineState(false, Reason.DISABLED);
    public static final OfflineState OFFLINE_MODE = new OfflineState(true, Reason.OFFLINE_MODE);
    public static final OfflineState FORCE_OFFLINE = new OfflineState(true, Reason.FORCE_OFFLINE);
    public static final OfflineState RESET = new OfflineState(false, Reason.RESET);

    public enum Reason {
        UNKNOWN,
        OFFLINE_MODE,
        FORCE_OFFLINE,
        DISABLED,
        RESET;

        /** Lowercase key as used in logs and status output (e.g. "force_offline"). */
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** {@code false} until a configuration has been applied or the gate was reset. */
    public boolean initialized() {
        return reason != Reason.UNKNOWN;
    }
}
