package org.Aayush.scenario.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.scenario.boundary.BoundaryClassification;
import org.Aayush.scenario.boundary.BoundaryClassifier;
import org.Aayush.scenario.boundary.BoundaryPoint;
import org.Aayush.scenario.config.EngineConfig;
import org.Aayush.scenario.core.ScenarioEngineException;
import org.Aayush.scenario.core.UnresolvedReferenceException;
import org.Aayush.scenario.geometry.BoundingBoxFilter;
import org.Aayush.scenario.geometry.GeometryNormalizer;
import org.Aayush.scenario.geometry.NetworkIds;
import org.Aayush.scenario.geometry.NormalizedGraph;
import org.Aayush.scenario.geometry.SelectionArea;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.JsonNetworkParser;
import org.Aayush.scenario.network.NetworkParser;
import org.Aayush.scenario.network.NetworkStatistics;
import org.Aayush.scenario.network.ParseResult;
import org.Aayush.scenario.network.XmlNetworkParser;
import org.Aayush.scenario.routing.DistributionAllocator;
import org.Aayush.scenario.routing.RouteGenerationRequest;
import org.Aayush.scenario.routing.RouteGenerationResult;
import org.Aayush.scenario.routing.RouteGenerator;
import org.Aayush.scenario.scenario.BundleArchiver;
import org.Aayush.scenario.scenario.Scenario;
import org.Aayush.scenario.scenario.ScenarioBundle;
import org.Aayush.scenario.scenario.ScenarioConfig;
import org.Aayush.scenario.scenario.ScenarioSerializer;
import org.Aayush.scenario.scenario.metadata.ScenarioReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Facade over parsing, geometry, boundary classification, route generation and serialization.
 * <p>
 * Parsed graphs are cached in a {@link GraphArena}; every other step works on values
 * derived per call, so one engine instance serves concurrent requests.
 */
public final class ScenarioEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ScenarioEngine.class);

    public static final String REASON_UNKNOWN_NETWORK = "UNKNOWN_NETWORK";
    public static final String REASON_NETWORK_NOT_READABLE = "NETWORK_NOT_READABLE";
    public static final String REASON_UNKNOWN_EDGE = "UNKNOWN_EDGE";

    private final EngineConfig config;
    private final GraphArena arena;
    private final GeometryNormalizer normalizer;
    private final BoundaryClassifier classifier;
    private final RouteGenerator routeGenerator;
    private final ScenarioSerializer serializer;
    private final ScenarioReconstructor reconstructor;
    private final BundleArchiver archiver;

    public ScenarioEngine(EngineConfig config) {
        this(config, new GraphArena(), Clock.systemUTC());
    }

    public ScenarioEngine(EngineConfig config, GraphArena arena, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.arena = Objects.requireNonNull(arena, "arena");
        this.normalizer = new GeometryNormalizer(config.getViewportHalfWidth());
        this.classifier = new BoundaryClassifier();
        this.routeGenerator = new RouteGenerator(new DistributionAllocator(config.getDistributionTolerance()));
        this.serializer = new ScenarioSerializer(Objects.requireNonNull(clock, "clock"));
        this.reconstructor = new ScenarioReconstructor();
        this.archiver = new BundleArchiver();
    }

    /**
     * Validates a selection and returns the network id that encodes it.
     */
    public String networkIdFor(SelectionArea area) {
        Objects.requireNonNull(area, "area");
        area.validate(config.getMaxSelectionAreaSquareDegrees());
        return NetworkIds.forArea(area);
    }

    /**
     * Parses {@code source} on first use of {@code networkId} and returns the request view.
     * <p>
     * Files ending in {@code .json} are read as JSON network data, anything else as SUMO XML.
     */
    public NetworkView loadNetwork(String networkId, Path source) {
        Objects.requireNonNull(networkId, "networkId");
        Objects.requireNonNull(source, "source");
        arena.computeIfAbsent(networkId, id -> parse(id, source));
        return view(networkId);
    }

    /**
     * Publishes an already built graph (for example a geographic import) under {@code networkId}.
     * <p>
     * Published graphs are never replaced: when the id is already cached, {@code graph} is
     * ignored and the view is built from the cached graph. Evict the id first to refresh it.
     */
    public NetworkView publishNetwork(String networkId, Graph graph) {
        Graph cached = arena.publish(networkId, graph);
        if (cached != graph) {
            LOG.warn("Network {} is already loaded; supplied graph ({} nodes, {} edges) ignored",
                    networkId, graph.nodeCount(), graph.edgeCount());
        }
        return view(networkId);
    }

    /**
     * Drops the cached graph for {@code networkId} so the next load or publish replaces it.
     *
     * @return whether a graph was cached.
     */
    public boolean evictNetwork(String networkId) {
        return arena.evict(networkId);
    }

    /**
     * Builds the request view of a published network: bounding-box filter derived from a
     * {@code map_} id, then normalization of a copy for display.
     *
     * @throws UnresolvedReferenceException when the network was never loaded.
     */
    public NetworkView view(String networkId) {
        Graph cached = arena.get(networkId).orElseThrow(() -> new UnresolvedReferenceException(
                REASON_UNKNOWN_NETWORK,
                "Network " + networkId + " is not loaded"
        ));
        Graph graph = NetworkIds.boundsOf(networkId)
                .map(bounds -> BoundingBoxFilter.filter(cached, bounds))
                .orElse(cached);
        NormalizedGraph display = normalizer.normalize(graph);
        LOG.info("Network data extracted for {}: {} nodes, {} edges", networkId, graph.nodeCount(), graph.edgeCount());
        return new NetworkView(networkId, graph, display.getGraph(), display.getBounds(), NetworkStatistics.of(graph));
    }

    /**
     * Entry points with display coordinates.
     */
    public List<BoundaryPoint> entryPoints(NetworkView view) {
        List<BoundaryPoint> points = classifier.classify(view.getDisplayGraph()).getEntryPoints();
        LOG.info("Found {} entry points in {}", points.size(), view.getNetworkId());
        return points;
    }

    /**
     * Exit points with display coordinates.
     */
    public List<BoundaryPoint> exitPoints(NetworkView view) {
        List<BoundaryPoint> points = classifier.classify(view.getDisplayGraph()).getExitPoints();
        LOG.info("Found {} exit points in {}", points.size(), view.getNetworkId());
        return points;
    }

    /**
     * Generates routes on the projected graph and serializes the scenario.
     *
     * @throws UnresolvedReferenceException when a selected edge is not in the network.
     * @throws org.Aayush.scenario.core.InvalidDistributionException when the distribution is invalid.
     * @throws org.Aayush.scenario.core.NoRoutableVehiclesException when no vehicle could be routed.
     */
    public ScenarioExport export(ExportRequest request) {
        Objects.requireNonNull(request, "request");
        NetworkView view = view(request.getNetworkId());
        Graph graph = view.getGraph();
        requireEdges(graph, request.getEntryEdges(), "entry");
        requireEdges(graph, request.getExitEdges(), "exit");

        BoundaryClassification classification = classifier.classify(graph);
        List<String> entries = request.getEntryEdges().isEmpty()
                ? classification.entryEdgeIds()
                : request.getEntryEdges();
        List<String> exits = request.getExitEdges().isEmpty()
                ? classification.exitEdgeIds()
                : request.getExitEdges();

        RouteGenerationResult generated = routeGenerator.generate(RouteGenerationRequest.builder()
                .graph(graph)
                .totalVehicles(request.getTotalVehicles())
                .distributions(request.getDistributions())
                .entryEdges(entries)
                .exitEdges(exits)
                .horizon(request.getHorizon())
                .seed(request.getSeed())
                .build());

        Scenario scenario = Scenario.builder()
                .graph(graph)
                .routes(generated.requireRoutable())
                .config(ScenarioConfig.builder()
                        .name(request.getName())
                        .horizon(request.getHorizon())
                        .totalVehicles(request.getTotalVehicles())
                        .distributions(request.getDistributions())
                        .seed(request.getSeed())
                        .build())
                .entryEdges(entries)
                .exitEdges(exits)
                .build();
        ScenarioBundle bundle = serializer.serialize(scenario);
        LOG.info("Exported {}: {}/{} vehicles routed, {} entry and {} exit edges",
                request.getNetworkId(), generated.getAssignments().size(), generated.getAttempted(),
                entries.size(), exits.size());
        return new ScenarioExport(scenario, bundle, generated.getAttempted(), generated.getSkipped());
    }

    /**
     * Exports and writes the bundle as a ZIP archive.
     */
    public ScenarioExport exportArchive(ExportRequest request, Path zipFile) {
        ScenarioExport export = export(request);
        archiver.archive(export.getBundle(), zipFile);
        return export;
    }

    /**
     * Rebuilds every bundle document from a metadata document alone.
     */
    public ScenarioBundle reconstruct(String metadataJson) {
        return serializer.serialize(reconstructor.reconstruct(metadataJson));
    }

    private Graph parse(String networkId, Path source) {
        NetworkParser parser = parserFor(source);
        try (InputStream input = Files.newInputStream(source)) {
            ParseResult result = parser.parse(input);
            if (result.hasWarnings()) {
                LOG.warn("Network {} parsed with {} skipped elements", networkId, result.getWarnings().size());
            }
            return result.getGraph();
        } catch (IOException ex) {
            throw new ScenarioEngineException(
                    REASON_NETWORK_NOT_READABLE,
                    "Network file " + source + " cannot be read: " + ex.getMessage(),
                    ex
            );
        }
    }

    private NetworkParser parserFor(Path source) {
        Path fileName = source.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return new JsonNetworkParser(new ObjectMapper(), config.edgeDefaults());
        }
        return new XmlNetworkParser(config.edgeDefaults());
    }

    private static void requireEdges(Graph graph, List<String> edgeIds, String role) {
        for (String edgeId : edgeIds) {
            if (!graph.containsEdge(edgeId)) {
                throw new UnresolvedReferenceException(
                        REASON_UNKNOWN_EDGE,
                        "Selected " + role + " edge " + edgeId + " is not part of network"
                );
            }
        }
    }
}
