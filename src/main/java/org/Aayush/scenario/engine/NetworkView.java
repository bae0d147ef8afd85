package org.Aayush.scenario.engine;

import lombok.Value;
import org.Aayush.scenario.geometry.PlanarBounds;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.network.NetworkStatistics;

/**
 * One network as seen by a request.
 */
@Value
public class NetworkView {
    String networkId;
    /** Bounding-box filtered graph in projected coordinates; used for routing and export. */
    Graph graph;
    /** Normalized copy of {@link #graph} for display. */
    Graph displayGraph;
    /** Declared display bounds. */
    PlanarBounds bounds;
    NetworkStatistics statistics;
}
