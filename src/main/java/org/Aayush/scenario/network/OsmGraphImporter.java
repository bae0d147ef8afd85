package org.Aayush.scenario.network;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.scenario.core.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Imports a geographic node-link graph (as exported by OSM tooling) and projects it
 * onto a local planar frame in meters.
 * <p>
 * Input shape:
 * <pre>
 * {"nodes": [{"id", "x": lon, "y": lat, "traffic_signals"?}],
 *  "edges" | "links": [{"u"|"source", "v"|"target", "lanes"?, "speed"?, "length"?}]}
 * </pre>
 * The origin is the mean lon/lat of all nodes with coordinates. Planar values are
 * rounded to two decimals. OSM attributes frequently arrive as lists ({@code "lanes": ["2", "3"]});
 * the first element is used.
 */
public final class OsmGraphImporter {
    private static final Logger LOG = LoggerFactory.getLogger(OsmGraphImporter.class);

    public static final String REASON_UNREADABLE_DOCUMENT = "OSM_UNREADABLE_DOCUMENT";
    public static final String REASON_NO_NODES = "OSM_NO_NODES";
    public static final String REASON_NO_EDGES = "OSM_NO_EDGES";

    static final double MIN_SPEED = 5.56d;
    static final double MIN_LENGTH = 10.0d;

    private final ObjectMapper mapper;
    private final EdgeDefaults defaults;

    public OsmGraphImporter() {
        this(new ObjectMapper(), EdgeDefaults.standard());
    }

    public OsmGraphImporter(ObjectMapper mapper, EdgeDefaults defaults) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public ParseResult importGraph(InputStream input) {
        Objects.requireNonNull(input, "input");
        try {
            return importGraph(mapper.readTree(input));
        } catch (IOException ex) {
            throw new MalformedInputException(
                    REASON_UNREADABLE_DOCUMENT,
                    "Error reading OSM graph: " + ex.getMessage(),
                    ex
            );
        }
    }

    public ParseResult importGraph(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedInputException(REASON_UNREADABLE_DOCUMENT, "OSM graph root must be an object");
        }
        ParseResult.ParseResultBuilder result = ParseResult.builder();

        List<GeoNode> geoNodes = new ArrayList<>();
        for (JsonNode node : root.path("nodes")) {
            String id = JsonNetworkParser.text(node.get("id"));
            NumericField lon = NumericField.decode(node.get("x"));
            NumericField lat = NumericField.decode(node.get("y"));
            if (id == null || !lon.isPresent() || !lat.isPresent()) {
                warn(result, "OSM node " + id + " has no coordinates, skipping");
                continue;
            }
            boolean signals = node.path("traffic_signals").asBoolean(false);
            geoNodes.add(new GeoNode(id, lat.value(), lon.value(), signals));
        }
        if (geoNodes.isEmpty()) {
            throw new MalformedInputException(REASON_NO_NODES, "No nodes with coordinates found in the graph");
        }

        LocalProjection projection = LocalProjection.centeredOn(
                geoNodes.stream().mapToDouble(GeoNode::lat).average().orElse(0.0d),
                geoNodes.stream().mapToDouble(GeoNode::lon).average().orElse(0.0d)
        );

        LinkedHashMap<String, Node> nodes = new LinkedHashMap<>();
        for (GeoNode geo : geoNodes) {
            if (nodes.containsKey(geo.id())) {
                warn(result, "Duplicate OSM node " + geo.id() + " skipped");
                continue;
            }
            Coordinate planar = projection.project(geo.lat(), geo.lon());
            nodes.put(geo.id(), Node.builder()
                    .id(geo.id())
                    .x(planar.x())
                    .y(planar.y())
                    .lat(geo.lat())
                    .lon(geo.lon())
                    .kind(geo.signals() ? NodeKind.TRAFFIC_LIGHT : NodeKind.PRIORITY)
                    .build());
        }

        JsonNode edgeArray = root.has("edges") ? root.get("edges") : root.path("links");
        List<Edge> edges = new ArrayList<>();
        int counter = 0;
        for (JsonNode edge : edgeArray) {
            String u = JsonNetworkParser.text(edge.has("u") ? edge.get("u") : edge.get("source"));
            String v = JsonNetworkParser.text(edge.has("v") ? edge.get("v") : edge.get("target"));
            String edgeId = "edge_" + counter + "_" + u + "_" + v;
            counter++;
            Node fromNode = u == null ? null : nodes.get(u);
            Node toNode = v == null ? null : nodes.get(v);
            if (fromNode == null || toNode == null) {
                warn(result, "OSM edge " + edgeId + " references a node without coordinates, skipping");
                continue;
            }
            edges.add(Edge.builder()
                    .id(edgeId)
                    .from(u)
                    .to(v)
                    .laneCount(Math.max(1, NumericField.decode(edge.get("lanes")).orDefaultInt(defaults.getLaneCount())))
                    .speed(Math.max(MIN_SPEED, NumericField.decode(edge.get("speed")).orDefault(defaults.getSpeed())))
                    .length(Math.max(MIN_LENGTH, NumericField.decode(edge.get("length")).orDefault(defaults.getLength())))
                    .shape(GraphAssembler.shapeOf(fromNode, toNode))
                    .build());
        }
        if (edges.isEmpty()) {
            throw new MalformedInputException(REASON_NO_EDGES, "No edges found in the graph");
        }

        Graph graph = Graph.of(new ArrayList<>(nodes.values()), edges);
        LOG.info("Imported OSM graph with {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return result.graph(graph).build();
    }

    private static void warn(ParseResult.ParseResultBuilder result, String message) {
        LOG.warn(message);
        result.warning(message);
    }

    private record GeoNode(String id, double lat, double lon, boolean signals) {
    }

    /**
     * Equirectangular approximation around a fixed origin.
     */
    static final class LocalProjection {
        static final double METERS_PER_DEGREE = 111_000.0d;

        private final double originLat;
        private final double originLon;
        private final double lonScale;

        private LocalProjection(double originLat, double originLon) {
            this.originLat = originLat;
            this.originLon = originLon;
            this.lonScale = METERS_PER_DEGREE * Math.abs(Math.cos(Math.toRadians(originLat)));
        }

        static LocalProjection centeredOn(double lat, double lon) {
            return new LocalProjection(lat, lon);
        }

        Coordinate project(double lat, double lon) {
            return new Coordinate(
                    round2((lon - originLon) * lonScale),
                    round2((lat - originLat) * METERS_PER_DEGREE)
            );
        }

        private static double round2(double value) {
            return Math.round(value * 100.0d) / 100.0d;
        }

        @Override
        public String toString() {
            return String.format("LocalProjection(lat=%.6f, lon=%.6f)", originLat, originLon);
        }
    }
}
