package de.bsommerfeld.toolvault.core.project;

/**
 * Thrown when a project manifest is missing or does not have the expected shape.
 */
public class ProjectManifestException extends Exception {

    public ProjectManifestException(String message) {
        super(message);
    }

    public ProjectManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
