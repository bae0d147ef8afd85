package org.Aayush.scenario.scenario.metadata;

import org.Aayush.scenario.geometry.GeometryNormalizer;
import org.Aayush.scenario.geometry.PlanarBounds;
import org.Aayush.scenario.network.Coordinate;
import org.Aayush.scenario.network.Edge;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.NetworkStatistics;
import org.Aayush.scenario.network.Node;
import org.Aayush.scenario.routing.RouteAssignment;
import org.Aayush.scenario.routing.VehicleDistribution;
import org.Aayush.scenario.scenario.Scenario;
import org.Aayush.scenario.scenario.ScenarioConfig;
import org.Aayush.scenario.scenario.ScenarioFiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the reconstruction document for a {@link Scenario}.
 * <p>
 * Edge flags mirror the selected entry/exit sets. A node is flagged as an entry point
 * when it is the {@code from} node of a selected entry edge, and as an exit point when
 * it is the {@code to} node of a selected exit edge.
 */
public final class ScenarioMetadataMapper {
    public static final String FORMAT_VERSION = "1.0";
    public static final String GENERATOR = "sumo-scenario-engine";

    static final List<String> RECONSTRUCTION_STEPS = List.of(
            "Rebuild the graph from 'nodes' and 'edges'.",
            "Write " + ScenarioFiles.NODES + " and " + ScenarioFiles.EDGES + " from the graph.",
            "Write " + ScenarioFiles.ROUTES + " from 'routes' sorted by depart_time, after the standard vType definitions.",
            "Write " + ScenarioFiles.RUN_CONFIG + " with end = simulation_config.simulation_time.",
            "Compile the network: netconvert --node-files " + ScenarioFiles.NODES
                    + " --edge-files " + ScenarioFiles.EDGES
                    + " --output-file " + ScenarioFiles.COMPILED_NETWORK + " --no-turnarounds",
            "Run: sumo-gui -c " + ScenarioFiles.RUN_CONFIG + " --no-step-log true"
    );

    public ScenarioMetadata toMetadata(Scenario scenario, Instant createdAt) {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(createdAt, "createdAt");
        Graph graph = scenario.getGraph();
        ScenarioConfig config = scenario.getConfig();

        Set<String> entryEdges = new HashSet<>(scenario.getEntryEdges());
        Set<String> exitEdges = new HashSet<>(scenario.getExitEdges());
        Set<String> entryNodes = new HashSet<>();
        Set<String> exitNodes = new HashSet<>();
        for (Edge edge : graph.edges()) {
            if (entryEdges.contains(edge.getId())) {
                entryNodes.add(edge.getFrom());
            }
            if (exitEdges.contains(edge.getId())) {
                exitNodes.add(edge.getTo());
            }
        }

        List<ScenarioMetadata.NodeRecord> nodes = new ArrayList<>(graph.nodeCount());
        for (Node node : graph.nodes()) {
            nodes.add(new ScenarioMetadata.NodeRecord(
                    node.getId(),
                    node.getX(),
                    node.getY(),
                    node.getLat(),
                    node.getLon(),
                    node.getKind().wireValue(),
                    entryNodes.contains(node.getId()),
                    exitNodes.contains(node.getId())
            ));
        }

        List<ScenarioMetadata.EdgeRecord> edges = new ArrayList<>(graph.edgeCount());
        for (Edge edge : graph.edges()) {
            List<List<Double>> shape = new ArrayList<>(edge.getShape().size());
            for (Coordinate point : edge.getShape()) {
                shape.add(List.of(point.x(), point.y()));
            }
            edges.add(new ScenarioMetadata.EdgeRecord(
                    edge.getId(),
                    edge.getFrom(),
                    edge.getTo(),
                    edge.getLaneCount(),
                    edge.getSpeed(),
                    edge.getLength(),
                    shape,
                    entryEdges.contains(edge.getId()),
                    exitEdges.contains(edge.getId())
            ));
        }

        List<ScenarioMetadata.DistributionRecord> distribution = new ArrayList<>();
        for (VehicleDistribution entry : config.getDistributions()) {
            distribution.add(new ScenarioMetadata.DistributionRecord(
                    entry.getVehicleType(),
                    entry.getPercentage(),
                    entry.getColor(),
                    entry.getPeriod(),
                    entry.getAttributes()
            ));
        }

        List<ScenarioMetadata.RouteRecord> routes = new ArrayList<>(scenario.getRoutes().size());
        for (RouteAssignment route : scenario.getRoutes()) {
            routes.add(new ScenarioMetadata.RouteRecord(
                    route.getId(),
                    route.getVehicleType(),
                    route.getDepartTime(),
                    route.getColor(),
                    route.getEdges()
            ));
        }

        NetworkStatistics statistics = NetworkStatistics.of(graph);
        PlanarBounds bounds = GeometryNormalizer.boundsOf(graph.nodes());
        return new ScenarioMetadata(
                new ScenarioMetadata.SimulationInfo(
                        config.getName(),
                        createdAt.toString(),
                        FORMAT_VERSION,
                        GENERATOR,
                        config.getTotalVehicles(),
                        routes.size(),
                        config.getHorizon()
                ),
                new ScenarioMetadata.NetworkData(
                        statistics.getNodeCount(),
                        statistics.getEdgeCount(),
                        statistics.getTotalLength(),
                        statistics.getAverageSpeed(),
                        statistics.getDensity(),
                        new ScenarioMetadata.Bounds(bounds.getXmin(), bounds.getYmin(), bounds.getXmax(), bounds.getYmax())
                ),
                nodes,
                edges,
                new ScenarioMetadata.SimulationConfig(
                        config.getName(),
                        config.getHorizon(),
                        config.getTotalVehicles(),
                        config.getSeed(),
                        distribution
                ),
                new ScenarioMetadata.SelectedPoints(scenario.getEntryEdges(), scenario.getExitEdges()),
                routes,
                new ScenarioMetadata.ReconstructionInstructions(
                        "Self-contained snapshot of a SUMO scenario. Every bundle file can be regenerated"
                                + " from this document without re-running route generation.",
                        ScenarioFiles.ALL,
                        RECONSTRUCTION_STEPS
                )
        );
    }
}
