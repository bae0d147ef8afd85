package org.Aayush.scenario.network;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable road graph: ordered node and edge collections plus id lookups.
 * <p>
 * Edges reference nodes by id. Lookups resolve through {@link #node(String)} instead
 * of object pointers, which keeps the graph a plain value that can be cached and
 * shared across requests without copying.
 * <p>
 * Document order is preserved everywhere. Consumers that iterate nodes or edges
 * (adjacency building, serialization) inherit that order, which keeps their output
 * deterministic for a given input.
 * <p>
 * Transformations ({@link #withNodes(List)}, {@link #retain(Predicate)}) never touch
 * this instance; they return a new graph.
 */
public final class Graph {

    private static final Graph EMPTY = new Graph(List.of(), List.of());

    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<String, Node> nodesById;
    private final Map<String, Edge> edgesById;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private Graph(List<Node> nodes, List<Edge> edges) {
        LinkedHashMap<String, Node> nodeIndex = new LinkedHashMap<>();
        for (Node node : nodes) {
            Objects.requireNonNull(node, "node");
            if (nodeIndex.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            }
        }
        LinkedHashMap<String, Edge> edgeIndex = new LinkedHashMap<>();
        for (Edge edge : edges) {
            Objects.requireNonNull(edge, "edge");
            if (edgeIndex.putIfAbsent(edge.getId(), edge) != null) {
                throw new IllegalArgumentException("Duplicate edge id: " + edge.getId());
            }
        }
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.nodesById = Collections.unmodifiableMap(nodeIndex);
        this.edgesById = Collections.unmodifiableMap(edgeIndex);
        this.nodeCount = this.nodes.size();
        this.edgeCount = this.edges.size();
    }

    /**
     * Creates a graph from ordered node and edge lists.
     *
     * <p>Edges are not required to reference existing nodes; components that need
     * endpoints resolve them through {@link #node(String)} and decide per edge.</p>
     *
     * @throws IllegalArgumentException on duplicate node or edge ids.
     */
    public static Graph of(List<Node> nodes, List<Edge> edges) {
        return new Graph(
                Objects.requireNonNull(nodes, "nodes"),
                Objects.requireNonNull(edges, "edges")
        );
    }

    public static Graph empty() {
        return EMPTY;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    public Optional<Node> node(String nodeId) {
        return Optional.ofNullable(nodesById.get(nodeId));
    }

    public Optional<Edge> edge(String edgeId) {
        return Optional.ofNullable(edgesById.get(edgeId));
    }

    public boolean containsNode(String nodeId) {
        return nodesById.containsKey(nodeId);
    }

    public boolean containsEdge(String edgeId) {
        return edgesById.containsKey(edgeId);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Returns a graph with the same edges and a replacement node list.
     */
    public Graph withNodes(List<Node> replacementNodes) {
        return new Graph(replacementNodes, edges);
    }

    /**
     * Keeps nodes matching {@code nodeFilter}, then keeps edges whose both endpoints survived.
     */
    public Graph retain(Predicate<Node> nodeFilter) {
        Objects.requireNonNull(nodeFilter, "nodeFilter");
        List<Node> keptNodes = new ArrayList<>();
        for (Node node : nodes) {
            if (nodeFilter.test(node)) {
                keptNodes.add(node);
            }
        }
        LinkedHashMap<String, Node> keptIndex = new LinkedHashMap<>();
        for (Node node : keptNodes) {
            keptIndex.put(node.getId(), node);
        }
        List<Edge> keptEdges = new ArrayList<>();
        for (Edge edge : edges) {
            if (keptIndex.containsKey(edge.getFrom()) && keptIndex.containsKey(edge.getTo())) {
                keptEdges.add(edge);
            }
        }
        return new Graph(keptNodes, keptEdges);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Graph)) {
            return false;
        }
        Graph that = (Graph) other;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "Graph{nodes=" + nodeCount + ", edges=" + edgeCount + "}";
    }
}
