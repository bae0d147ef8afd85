package org.Aayush.scenario.sumo;

import org.Aayush.scenario.config.EngineConfig;
import org.Aayush.scenario.scenario.ScenarioFiles;

import java.util.List;
import java.util.Objects;

/**
 * Command lines of the external network compiler and simulator.
 * <p>
 * Paths are relative; commands are meant to run inside a workspace holding a written bundle.
 */
public final class SumoCommandLine {
    private final EngineConfig config;

    public SumoCommandLine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Compiles nodes and edges into {@value ScenarioFiles#COMPILED_NETWORK}.
     */
    public List<String> netconvert() {
        return List.of(
                config.getNetconvertBinary(),
                "--node-files", ScenarioFiles.NODES,
                "--edge-files", ScenarioFiles.EDGES,
                "--output-file", ScenarioFiles.COMPILED_NETWORK,
                "--no-turnarounds"
        );
    }

    public List<String> simulation(boolean gui) {
        return List.of(
                gui ? config.getSumoGuiBinary() : config.getSumoBinary(),
                "-c", ScenarioFiles.RUN_CONFIG,
                "--no-step-log", "true"
        );
    }
}
