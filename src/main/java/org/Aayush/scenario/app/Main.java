package org.Aayush.scenario.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.scenario.config.EngineConfig;
import org.Aayush.scenario.config.EngineConfigLoader;
import org.Aayush.scenario.core.ScenarioEngineException;
import org.Aayush.scenario.engine.ExportRequest;
import org.Aayush.scenario.engine.NetworkView;
import org.Aayush.scenario.engine.ScenarioEngine;
import org.Aayush.scenario.engine.ScenarioExport;
import org.Aayush.scenario.network.OsmGraphImporter;
import org.Aayush.scenario.routing.VehicleDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line export:
 * {@code Main <net-file> <network-id> <total-vehicles> <horizon> <output.zip> [seed]}.
 * <p>
 * {@code *.osm.json} files are imported as geographic graphs, {@code *.json} as network
 * data, anything else as SUMO XML. Every entry and exit edge is used, with an all-car
 * population.
 */
public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE =
            "Usage: Main <net-file> <network-id> <total-vehicles> <horizon> <output.zip> [seed]";

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, EngineConfigLoader.load(), System.out, System.err));
    }

    static int run(String[] args, EngineConfig config, PrintStream out, PrintStream err) {
        if (args.length < 5 || args.length > 6) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path source = Paths.get(args[0]);
        String networkId = args[1];
        int totalVehicles;
        double horizon;
        Long seed = null;
        try {
            totalVehicles = Integer.parseInt(args[2]);
            horizon = Double.parseDouble(args[3]);
            if (args.length == 6) {
                seed = Long.parseLong(args[5]);
            }
        } catch (NumberFormatException ex) {
            err.println("Invalid number: " + ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path output = Paths.get(args[4]);

        ScenarioEngine engine = new ScenarioEngine(config);
        try {
            NetworkView view = load(engine, networkId, source, config);
            ScenarioExport export = engine.exportArchive(ExportRequest.builder()
                    .networkId(networkId)
                    .totalVehicles(totalVehicles)
                    .horizon(horizon)
                    .distribution(VehicleDistribution.builder().vehicleType("car").percentage(100.0d).build())
                    .seed(seed)
                    .build(), output);
            out.println("Exported " + export.getScenario().getRoutes().size() + " vehicles over "
                    + view.getGraph().edgeCount() + " edges to " + output);
            return EXIT_OK;
        } catch (ScenarioEngineException ex) {
            LOG.error("Export failed for {}", networkId, ex);
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            LOG.error("Cannot read {}", source, ex);
            err.println("Cannot read " + source + ": " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static NetworkView load(ScenarioEngine engine, String networkId, Path source, EngineConfig config)
            throws IOException {
        if (source.toString().endsWith(".osm.json")) {
            try (InputStream input = Files.newInputStream(source)) {
                OsmGraphImporter importer = new OsmGraphImporter(
                        new ObjectMapper(),
                        config.edgeDefaults()
                );
                return engine.publishNetwork(networkId, importer.importGraph(input).getGraph());
            }
        }
        return engine.loadNetwork(networkId, source);
    }
}
