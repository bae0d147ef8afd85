package org.Aayush.scenario.sumo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link ProcessLauncher} over {@link ProcessBuilder}: stdout and stderr go to
 * {@code <name>.log} inside the working directory.
 */
public final class DetachedProcessLauncher implements ProcessLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(DetachedProcessLauncher.class);

    @Override
    public Process launch(String name, List<String> command, Path workingDirectory) throws IOException {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Path logFile = workingDirectory.resolve(name + ".log");
        Process process = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile())
                .start();
        LOG.info("Started {} (pid {}) in {}: {}", name, process.pid(), workingDirectory, String.join(" ", command));
        return process;
    }
}
