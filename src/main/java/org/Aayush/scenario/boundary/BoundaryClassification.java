package org.Aayush.scenario.boundary;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry and exit points of one graph, each in edge order.
 */
@Value
public class BoundaryClassification {
    List<BoundaryPoint> entryPoints;
    List<BoundaryPoint> exitPoints;

    public List<String> entryEdgeIds() {
        return entryPoints.stream().map(BoundaryPoint::id).collect(Collectors.toList());
    }

    public List<String> exitEdgeIds() {
        return exitPoints.stream().map(BoundaryPoint::id).collect(Collectors.toList());
    }
}
