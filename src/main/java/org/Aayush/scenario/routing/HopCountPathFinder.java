package org.Aayush.scenario.routing;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.scenario.network.Graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Minimum-hop node-to-node search (Dijkstra with unit edge cost).
 *
 * <p>Equal-cost ties resolve to the label queued first; labels are queued in
 * graph edge order, so the chosen path is reproducible for a given graph.
 * A node is only relabelled on strict improvement.</p>
 *
 * <p>Instances are immutable after construction and may be shared across threads.</p>
 */
public final class HopCountPathFinder {
    private static final int NO_EDGE = -1;

    private final AdjacencyIndex index;

    public HopCountPathFinder(Graph graph) {
        this.index = AdjacencyIndex.of(graph);
    }

    /**
     * Finds a shortest edge path from {@code sourceNodeId} to {@code targetNodeId}.
     *
     * @return edge ids in travel order; empty when unreachable, when either node is unknown,
     * or when source and target coincide (a route needs at least one edge).
     */
    public Optional<List<String>> findPath(String sourceNodeId, String targetNodeId) {
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        if (!index.containsNode(sourceNodeId) || !index.containsNode(targetNodeId)) {
            return Optional.empty();
        }
        int source = index.nodeIndex(sourceNodeId);
        int target = index.nodeIndex(targetNodeId);
        if (source == target) {
            return Optional.empty();
        }

        int[] distance = new int[index.nodeCount()];
        int[] arrivalEdge = new int[index.nodeCount()];
        boolean[] settled = new boolean[index.nodeCount()];
        Arrays.fill(distance, Integer.MAX_VALUE);
        Arrays.fill(arrivalEdge, NO_EDGE);

        PriorityQueue<Label> frontier = new PriorityQueue<>(Label.ORDER);
        long sequence = 0L;
        distance[source] = 0;
        frontier.add(new Label(source, 0, sequence++));

        while (!frontier.isEmpty()) {
            Label label = frontier.poll();
            int node = label.node();
            if (settled[node] || label.distance() > distance[node]) {
                continue;
            }
            settled[node] = true;
            if (node == target) {
                return Optional.of(unwind(arrivalEdge, source, target));
            }
            IntList outgoing = index.outgoing(node);
            for (int i = 0; i < outgoing.size(); i++) {
                int edge = outgoing.getInt(i);
                int next = index.target(edge);
                int candidate = label.distance() + 1;
                if (candidate < distance[next]) {
                    distance[next] = candidate;
                    arrivalEdge[next] = edge;
                    frontier.add(new Label(next, candidate, sequence++));
                }
            }
        }
        return Optional.empty();
    }

    private List<String> unwind(int[] arrivalEdge, int source, int target) {
        List<String> path = new ArrayList<>();
        int node = target;
        while (node != source) {
            int edge = arrivalEdge[node];
            path.add(index.edgeId(edge));
            node = index.source(edge);
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    private record Label(int node, int distance, long sequence) {
        static final Comparator<Label> ORDER = Comparator
                .comparingInt(Label::distance)
                .thenComparingLong(Label::sequence);
    }
}
