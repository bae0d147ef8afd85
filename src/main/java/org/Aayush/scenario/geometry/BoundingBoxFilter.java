package org.Aayush.scenario.geometry;

import org.Aayush.scenario.network.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Restricts a graph to nodes inside a geographic box.
 *
 * <p>Nodes without lat/lon are dropped. Edges survive only when both endpoints do.</p>
 */
public final class BoundingBoxFilter {
    private static final Logger LOG = LoggerFactory.getLogger(BoundingBoxFilter.class);

    private BoundingBoxFilter() {
    }

    public static Graph filter(Graph graph, GeoBounds bounds) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(bounds, "bounds");
        Graph filtered = graph.retain(node -> node.hasGeographic() && bounds.contains(node.getLat(), node.getLon()));
        LOG.debug("Bounding box {} kept {}/{} nodes and {}/{} edges",
                bounds,
                filtered.nodeCount(), graph.nodeCount(),
                filtered.edgeCount(), graph.edgeCount());
        return filtered;
    }
}
