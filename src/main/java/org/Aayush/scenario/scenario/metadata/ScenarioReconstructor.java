package org.Aayush.scenario.scenario.metadata;

import org.Aayush.scenario.core.MalformedInputException;
import org.Aayush.scenario.network.Coordinate;
import org.Aayush.scenario.network.Edge;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.Node;
import org.Aayush.scenario.network.NodeKind;
import org.Aayush.scenario.routing.RouteAssignment;
import org.Aayush.scenario.routing.VehicleDistribution;
import org.Aayush.scenario.scenario.Scenario;
import org.Aayush.scenario.scenario.ScenarioConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds a {@link Scenario} from its reconstruction document, without route generation.
 */
public final class ScenarioReconstructor {
    private static final Logger LOG = LoggerFactory.getLogger(ScenarioReconstructor.class);

    public static final String REASON_INCONSISTENT = "METADATA_INCONSISTENT";

    private final ScenarioMetadataCodec codec;

    public ScenarioReconstructor() {
        this(new ScenarioMetadataCodec());
    }

    public ScenarioReconstructor(ScenarioMetadataCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Scenario reconstruct(String metadataJson) {
        return reconstruct(codec.read(metadataJson));
    }

    public Scenario reconstruct(ScenarioMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        try {
            Graph graph = Graph.of(nodesOf(metadata), edgesOf(metadata));
            ScenarioMetadata.SimulationConfig simulation = metadata.simulationConfig();
            ScenarioConfig.ScenarioConfigBuilder config = ScenarioConfig.builder()
                    .horizon(simulation.simulationTime())
                    .totalVehicles(simulation.totalVehicles())
                    .seed(simulation.seed());
            if (simulation.name() != null) {
                config.name(simulation.name());
            }
            if (simulation.vehicleDistribution() != null) {
                for (ScenarioMetadata.DistributionRecord record : simulation.vehicleDistribution()) {
                    VehicleDistribution.VehicleDistributionBuilder entry = VehicleDistribution.builder()
                            .vehicleType(record.vehicleType())
                            .percentage(record.percentage())
                            .period(record.period())
                            .attributes(record.attributes());
                    if (record.color() != null) {
                        entry.color(record.color());
                    }
                    config.distribution(entry.build());
                }
            }

            Scenario.ScenarioBuilder scenario = Scenario.builder()
                    .graph(graph)
                    .config(config.build())
                    .entryEdges(listOrEmpty(metadata.selectedPoints().entryPoints()))
                    .exitEdges(listOrEmpty(metadata.selectedPoints().exitPoints()));
            for (ScenarioMetadata.RouteRecord route : metadata.routes()) {
                scenario.route(RouteAssignment.builder()
                        .id(route.id())
                        .edges(listOrEmpty(route.edges()))
                        .vehicleType(route.vehicleType())
                        .departTime(route.departTime())
                        .color(route.color())
                        .build());
            }
            Scenario rebuilt = scenario.build();
            LOG.info("Reconstructed scenario '{}' with {} nodes, {} edges, {} routes",
                    rebuilt.getConfig().getName(), graph.nodeCount(), graph.edgeCount(), rebuilt.getRoutes().size());
            return rebuilt;
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new MalformedInputException(
                    REASON_INCONSISTENT,
                    "Simulation metadata cannot be turned back into a scenario: " + ex.getMessage(),
                    ex
            );
        }
    }

    private static List<Node> nodesOf(ScenarioMetadata metadata) {
        List<Node> nodes = new ArrayList<>(metadata.nodes().size());
        for (ScenarioMetadata.NodeRecord record : metadata.nodes()) {
            nodes.add(Node.builder()
                    .id(record.id())
                    .x(record.x())
                    .y(record.y())
                    .lat(record.lat())
                    .lon(record.lon())
                    .kind(NodeKind.fromWire(record.type()))
                    .build());
        }
        return nodes;
    }

    private static List<Edge> edgesOf(ScenarioMetadata metadata) {
        List<Edge> edges = new ArrayList<>(metadata.edges().size());
        for (ScenarioMetadata.EdgeRecord record : metadata.edges()) {
            Edge.EdgeBuilder edge = Edge.builder()
                    .id(record.id())
                    .from(record.from())
                    .to(record.to())
                    .laneCount(record.numLanes())
                    .speed(record.speed())
                    .length(record.length());
            for (List<Double> point : listOrEmpty(record.shape())) {
                if (point == null || point.size() != 2 || point.get(0) == null || point.get(1) == null) {
                    throw new IllegalArgumentException("Edge " + record.id() + " has a malformed shape point " + point);
                }
                edge.shapePoint(new Coordinate(point.get(0), point.get(1)));
            }
            edges.add(edge.build());
        }
        return edges;
    }

    private static <T> List<T> listOrEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
