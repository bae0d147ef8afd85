package org.Aayush.scenario.geometry;

import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fits planar node coordinates into a square display viewport.
 * <p>
 * With a non-degenerate bounding box every node is shifted so the box midpoint lands on
 * the origin, then scaled by {@code min(2h / width, 2h / height)} where {@code h} is the
 * viewport half-width. Aspect ratio is preserved and the declared bounds become
 * {@code [-h, h] x [-h, h]}.
 * <p>
 * Degenerate boxes (zero width or height) are left unscaled and the raw min/max are
 * declared. An empty graph declares {@link PlanarBounds#ZERO}.
 * <p>
 * The input graph is never modified; a normalized copy is returned, so cached graphs
 * can be normalized per request.
 */
public final class GeometryNormalizer {
    public static final double DEFAULT_HALF_WIDTH = 100.0d;

    private final double halfWidth;

    public GeometryNormalizer() {
        this(DEFAULT_HALF_WIDTH);
    }

    public GeometryNormalizer(double halfWidth) {
        if (!(halfWidth > 0.0d) || !Double.isFinite(halfWidth)) {
            throw new IllegalArgumentException("halfWidth must be positive and finite: " + halfWidth);
        }
        this.halfWidth = halfWidth;
    }

    /**
     * Computes the raw planar bounding box of all nodes.
     */
    public static PlanarBounds boundsOf(List<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        if (nodes.isEmpty()) {
            return PlanarBounds.ZERO;
        }
        double xmin = Double.POSITIVE_INFINITY;
        double ymin = Double.POSITIVE_INFINITY;
        double xmax = Double.NEGATIVE_INFINITY;
        double ymax = Double.NEGATIVE_INFINITY;
        for (Node node : nodes) {
            xmin = Math.min(xmin, node.getX());
            ymin = Math.min(ymin, node.getY());
            xmax = Math.max(xmax, node.getX());
            ymax = Math.max(ymax, node.getY());
        }
        return new PlanarBounds(xmin, ymin, xmax, ymax);
    }

    public NormalizedGraph normalize(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        PlanarBounds raw = boundsOf(graph.nodes());
        if (graph.isEmpty() || raw.isDegenerate()) {
            return new NormalizedGraph(graph, raw, false);
        }

        double width = raw.width();
        double height = raw.height();
        double span = 2.0d * halfWidth;
        double scale = Math.min(span / width, span / height);

        List<Node> normalized = new ArrayList<>(graph.nodeCount());
        for (Node node : graph.nodes()) {
            normalized.add(node.withPlanar(
                    (node.getX() - raw.getXmin() - width / 2.0d) * scale,
                    (node.getY() - raw.getYmin() - height / 2.0d) * scale
            ));
        }
        return new NormalizedGraph(graph.withNodes(normalized), PlanarBounds.viewport(halfWidth), true);
    }
}
