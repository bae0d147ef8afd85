package org.Aayush.scenario.sumo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts an external process without waiting for it.
 */
public interface ProcessLauncher {

    /**
     * @param name short label, used for the log file name.
     * @param command program and arguments.
     * @param workingDirectory directory the process runs in.
     * @return the started process.
     */
    Process launch(String name, List<String> command, Path workingDirectory) throws IOException;
}
