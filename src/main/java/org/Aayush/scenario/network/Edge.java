package org.Aayush.scenario.network;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Directed road segment between two nodes.
 *
 * <p>Nodes are referenced by id and resolved through the owning {@link Graph}.
 * There is no implicit reverse edge. Self-loops are allowed.</p>
 */
@Value
@Builder(toBuilder = true)
public class Edge {
    @NonNull
    String id;
    @NonNull
    String from;
    @NonNull
    String to;
    int laneCount;
    /** Speed limit in m/s. */
    double speed;
    /** Length in meters. */
    double length;
    /** Two-point polyline, geographic when both endpoints had lat/lon, planar otherwise. */
    @Singular("shapePoint")
    List<Coordinate> shape;

    public boolean isSelfLoop() {
        return from.equals(to);
    }
}
