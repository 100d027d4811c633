package de.bsommerfeld.toolvault.core.offline;

/**
 * Verdict of {@link OfflineEnforcer#guardNetworkCall(String)}.
 *
 * @param allowed   whether the caller may proceed with network I/O
 * @param errorCode {@code network_offline} or {@code network_gate_uninitialized}; {@code null} if allowed
 * @param message   blocking context including the caller's description; {@code null} if allowed
 */
public record NetworkGuardResult(boolean allowed, String errorCode, String message) {

    public static final String NETWORK_OFFLINE = "network_offline";
    public static final String GATE_UNINITIALIZED = "network_gate_uninitialized";

    static NetworkGuardResult allow() {
        return new NetworkGuardResult(true, null, null);
    }

    static NetworkGuardResult block(String errorCode, String message) {
        return new NetworkGuardResult(false, errorCode, message);
    }
}
