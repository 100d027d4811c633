package de.bsommerfeld.toolvault.sealer;

/**
 * Sealing phases in execution order.
 */
public enum SealPhase {
    VALIDATE,
    COPY,
    CONFIGURE,
    ARCHIVE
}
