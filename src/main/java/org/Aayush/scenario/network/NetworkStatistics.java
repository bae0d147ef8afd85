package org.Aayush.scenario.network;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Summary figures for one graph.
 */
@Value
@Builder
public class NetworkStatistics {
    int nodeCount;
    int edgeCount;
    /** Sum of edge lengths in meters. */
    double totalLength;
    /** Mean edge speed in m/s; the default urban speed when the graph has no edges. */
    double averageSpeed;
    /** Edges per node. */
    double density;

    public static NetworkStatistics of(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        double totalLength = 0.0d;
        double speedSum = 0.0d;
        for (Edge edge : graph.edges()) {
            totalLength += edge.getLength();
            speedSum += edge.getSpeed();
        }
        int edgeCount = graph.edgeCount();
        return NetworkStatistics.builder()
                .nodeCount(graph.nodeCount())
                .edgeCount(edgeCount)
                .totalLength(totalLength)
                .averageSpeed(edgeCount == 0 ? EdgeDefaults.standard().getSpeed() : speedSum / edgeCount)
                .density((double) edgeCount / Math.max(1, graph.nodeCount()))
                .build();
    }
}
