package org.Aayush.scenario.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Format-independent half of network parsing.
 * <p>
 * Parsers feed raw node and edge records in document order. The assembler applies
 * the record-level contract (required attributes, defaults, duplicate ids, endpoint
 * resolution, shape derivation) and turns every rejected record into a warning
 * instead of an exception.
 * <p>
 * Edges are resolved in {@link #build()}, after all nodes are known, so documents
 * that list edges before nodes still parse.
 */
final class GraphAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(GraphAssembler.class);

    private final EdgeDefaults defaults;
    private final String sourceName;
    private final LinkedHashMap<String, Node> nodes = new LinkedHashMap<>();
    private final List<RawEdge> rawEdges = new ArrayList<>();
    private final ParseResult.ParseResultBuilder result = ParseResult.builder();

    GraphAssembler(EdgeDefaults defaults, String sourceName) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    }

    void addNode(
            String id,
            NumericField x,
            NumericField y,
            NumericField lat,
            NumericField lon,
            String type
    ) {
        if (isBlank(id)) {
            warn("Node without id skipped");
            return;
        }
        if (!x.isPresent() || !y.isPresent()) {
            warn("Node " + id + " has missing or invalid coordinates (x=" + x + ", y=" + y + "), skipping");
            return;
        }
        if (nodes.containsKey(id)) {
            warn("Duplicate node " + id + " skipped");
            return;
        }
        nodes.put(id, Node.builder()
                .id(id)
                .x(x.value())
                .y(y.value())
                .lat(lat.isPresent() ? lat.value() : null)
                .lon(lon.isPresent() ? lon.value() : null)
                .kind(NodeKind.fromWire(type))
                .build());
    }

    void addEdge(
            String id,
            String from,
            String to,
            NumericField lanes,
            NumericField speed,
            NumericField length
    ) {
        if (isBlank(id) || isBlank(from) || isBlank(to)) {
            warn("Edge " + id + " has missing attributes (from=" + from + ", to=" + to + "), skipping");
            return;
        }
        rawEdges.add(new RawEdge(id, from, to, lanes, speed, length));
    }

    ParseResult build() {
        List<Edge> edges = new ArrayList<>(rawEdges.size());
        Map<String, Boolean> seenEdges = new LinkedHashMap<>();
        for (RawEdge raw : rawEdges) {
            if (seenEdges.putIfAbsent(raw.id(), Boolean.TRUE) != null) {
                warn("Duplicate edge " + raw.id() + " skipped");
                continue;
            }
            Node fromNode = nodes.get(raw.from());
            Node toNode = nodes.get(raw.to());
            if (fromNode == null || toNode == null) {
                warn("Edge " + raw.id() + " has missing node coordinates, skipping");
                continue;
            }
            edges.add(Edge.builder()
                    .id(raw.id())
                    .from(raw.from())
                    .to(raw.to())
                    .laneCount(Math.max(1, raw.lanes().orDefaultInt(defaults.getLaneCount())))
                    .speed(positiveOrDefault(raw.speed(), defaults.getSpeed()))
                    .length(positiveOrDefault(raw.length(), defaults.getLength()))
                    .shape(shapeOf(fromNode, toNode))
                    .build());
        }
        Graph graph = Graph.of(new ArrayList<>(nodes.values()), edges);
        LOG.debug("{}: assembled {} nodes and {} edges", sourceName, graph.nodeCount(), graph.edgeCount());
        return result.graph(graph).build();
    }

    /**
     * Geographic pair when both endpoints carry lat/lon, planar pair otherwise.
     */
    static List<Coordinate> shapeOf(Node fromNode, Node toNode) {
        if (fromNode.hasGeographic() && toNode.hasGeographic()) {
            return List.of(fromNode.geographic(), toNode.geographic());
        }
        return List.of(fromNode.planar(), toNode.planar());
    }

    private static double positiveOrDefault(NumericField field, double defaultValue) {
        double value = field.orDefault(defaultValue);
        return value > 0.0d ? value : defaultValue;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void warn(String message) {
        LOG.warn("{}: {}", sourceName, message);
        result.warning(message);
    }

    private record RawEdge(
            String id,
            String from,
            String to,
            NumericField lanes,
            NumericField speed,
            NumericField length
    ) {
    }
}
