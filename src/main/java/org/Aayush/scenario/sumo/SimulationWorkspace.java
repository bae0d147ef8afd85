package org.Aayush.scenario.sumo;

import lombok.Getter;
import org.Aayush.scenario.core.io.FileTrees;
import org.Aayush.scenario.scenario.ScenarioBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Exclusive temporary directory for one request.
 * <p>
 * A fresh directory is created per instance, so concurrent requests never share one.
 * {@link #close()} deletes it with everything inside.
 */
public final class SimulationWorkspace implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SimulationWorkspace.class);

    @Getter
    private final Path directory;
    private final SumoCommandLine commandLine;
    private boolean closed;

    private SimulationWorkspace(Path directory, SumoCommandLine commandLine) {
        this.directory = directory;
        this.commandLine = commandLine;
    }

    /**
     * Creates a new workspace under the system temporary directory.
     */
    public static SimulationWorkspace create(String prefix, SumoCommandLine commandLine) throws IOException {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(commandLine, "commandLine");
        Path directory = Files.createTempDirectory(prefix);
        LOG.info("Created temporary directory: {}", directory);
        return new SimulationWorkspace(directory, commandLine);
    }

    public SimulationWorkspace write(ScenarioBundle bundle) {
        ensureOpen();
        bundle.writeTo(directory);
        return this;
    }

    /**
     * Starts the network compiler; it writes the compiled network into this workspace.
     */
    public Process compileNetwork(ProcessLauncher launcher) throws IOException {
        ensureOpen();
        return launcher.launch("netconvert", commandLine.netconvert(), directory);
    }

    public Process startSimulation(ProcessLauncher launcher, boolean gui) throws IOException {
        ensureOpen();
        return launcher.launch(gui ? "sumo-gui" : "sumo", commandLine.simulation(gui), directory);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Workspace " + directory + " is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            FileTrees.deleteRecursively(directory);
            LOG.debug("Deleted workspace {}", directory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Error deleting workspace " + directory, ex);
        }
    }
}
