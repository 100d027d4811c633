package de.bsommerfeld.toolvault.mirror.hydrate;

public enum HydrationStatus {

    /** A worker was started for this request. */
    STARTED,

    /** Another hydration was in flight; the request was ignored. */
    ALREADY_RUNNING
}
