package de.bsommerfeld.toolvault.launcher;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Starts an operating system process. Output handling is up to the
 * implementation; callers only get the pid.
 */
public interface ProcessSpawner {

    /**
     * @param command          executable followed by its arguments
     * @param workingDirectory directory the process starts in
     * @param environment      variables added to the inherited environment
     * @return id of the started process
     * @throws IOException if the process cannot be started
     */
    long spawn(List<String> command, Path workingDirectory, Map<String, String> environment) throws IOException;
}
