package de.bsommerfeld.toolvault.mirror.hydrate;

/**
 * Thrown when a tool archive cannot be obtained from its mirror.
 */
public class MirrorException extends Exception {

    public MirrorException(String message) {
        super(message);
    }

    public MirrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
