package org.Aayush.scenario.boundary;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Aayush.scenario.network.Edge;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies edges as traffic sources and sinks by topology alone.
 *
 * <p>An edge is an entry point when no edge ends at its {@code from} node, and an
 * exit point when no edge starts at its {@code to} node. Degrees are counted over
 * the full edge set, so an edge can be both or neither.</p>
 *
 * <p>A point whose dangling node is not in the graph is still emitted, at (0, 0).</p>
 */
public final class BoundaryClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(BoundaryClassifier.class);

    public BoundaryClassification classify(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        Object2IntOpenHashMap<String> inDegree = new Object2IntOpenHashMap<>();
        Object2IntOpenHashMap<String> outDegree = new Object2IntOpenHashMap<>();
        inDegree.defaultReturnValue(0);
        outDegree.defaultReturnValue(0);
        for (Edge edge : graph.edges()) {
            inDegree.addTo(edge.getTo(), 1);
            outDegree.addTo(edge.getFrom(), 1);
        }

        List<BoundaryPoint> entries = new ArrayList<>();
        List<BoundaryPoint> exits = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            if (inDegree.getInt(edge.getFrom()) == 0) {
                entries.add(pointAt(graph, edge, edge.getFrom()));
            }
            if (outDegree.getInt(edge.getTo()) == 0) {
                exits.add(pointAt(graph, edge, edge.getTo()));
            }
        }
        LOG.debug("Classified {} entry points and {} exit points over {} edges",
                entries.size(), exits.size(), graph.edgeCount());
        return new BoundaryClassification(List.copyOf(entries), List.copyOf(exits));
    }

    private static BoundaryPoint pointAt(Graph graph, Edge edge, String nodeId) {
        Optional<Node> node = graph.node(nodeId);
        if (node.isEmpty()) {
            LOG.warn("Edge {} references unknown node {}; boundary point placed at origin", edge.getId(), nodeId);
            return new BoundaryPoint(edge.getId(), 0.0d, 0.0d);
        }
        return new BoundaryPoint(edge.getId(), node.get().getX(), node.get().getY());
    }
}
