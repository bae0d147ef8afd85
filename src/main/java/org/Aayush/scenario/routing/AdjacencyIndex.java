package org.Aayush.scenario.routing;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.scenario.core.id.IDMapper;
import org.Aayush.scenario.network.Edge;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.Node;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Dense forward adjacency over a {@link Graph}.
 *
 * <p>Node indices follow graph node order, followed by edge endpoints not present as
 * nodes. Outgoing edge lists keep graph edge order.</p>
 */
final class AdjacencyIndex {
    private final IDMapper nodeIds;
    private final List<Edge> edges;
    private final IntArrayList[] outgoing;
    private final int[] edgeSources;
    private final int[] edgeTargets;

    private AdjacencyIndex(
            IDMapper nodeIds,
            List<Edge> edges,
            IntArrayList[] outgoing,
            int[] edgeSources,
            int[] edgeTargets
    ) {
        this.nodeIds = nodeIds;
        this.edges = edges;
        this.outgoing = outgoing;
        this.edgeSources = edgeSources;
        this.edgeTargets = edgeTargets;
    }

    static AdjacencyIndex of(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        for (Node node : graph.nodes()) {
            ids.add(node.getId());
        }
        for (Edge edge : graph.edges()) {
            ids.add(edge.getFrom());
            ids.add(edge.getTo());
        }
        IDMapper mapper = IDMapper.ofOrdered(new ArrayList<>(ids));

        IntArrayList[] outgoing = new IntArrayList[mapper.size()];
        for (int i = 0; i < outgoing.length; i++) {
            outgoing[i] = new IntArrayList();
        }
        List<Edge> edges = graph.edges();
        int[] sources = new int[edges.size()];
        int[] targets = new int[edges.size()];
        for (int e = 0; e < edges.size(); e++) {
            Edge edge = edges.get(e);
            sources[e] = mapper.toInternal(edge.getFrom());
            targets[e] = mapper.toInternal(edge.getTo());
            outgoing[sources[e]].add(e);
        }
        return new AdjacencyIndex(mapper, edges, outgoing, sources, targets);
    }

    int nodeCount() {
        return outgoing.length;
    }

    boolean containsNode(String nodeId) {
        return nodeIds.containsExternal(nodeId);
    }

    int nodeIndex(String nodeId) {
        return nodeIds.toInternal(nodeId);
    }

    IntList outgoing(int nodeIndex) {
        return outgoing[nodeIndex];
    }

    int source(int edgeIndex) {
        return edgeSources[edgeIndex];
    }

    int target(int edgeIndex) {
        return edgeTargets[edgeIndex];
    }

    String edgeId(int edgeIndex) {
        return edges.get(edgeIndex).getId();
    }
}
