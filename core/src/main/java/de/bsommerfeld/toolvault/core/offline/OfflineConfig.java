package de.bsommerfeld.toolvault.core.offline;

/**
 * The two offline flags a launcher or project configuration may carry.
 * Absent flags count as {@code false}.
 *
 * @param offlineMode  user-selected offline mode
 * @param forceOffline hard offline switch set by sealing; wins over {@code offlineMode}
 */
public record OfflineConfig(boolean offlineMode, boolean forceOffline) {

    public static final OfflineConfig ONLINE = new OfflineConfig(false, false);
    public static final OfflineConfig FORCED = new OfflineConfig(true, true);

    /** Flag-wise OR: a flag set on either side stays set. */
    public OfflineConfig merge(OfflineConfig other) {
        if (other == null) {
            return this;
        }
        return new OfflineConfig(offlineMode || other.offlineMode, forceOffline || other.forceOffline);
    }
}
