package org.Aayush.scenario.scenario;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.scenario.network.Graph;
import org.Aayush.scenario.routing.RouteAssignment;

import java.util.List;

/**
 * Everything one export produces: graph, routed vehicles, settings and selected boundary edges.
 */
@Value
@Builder(toBuilder = true)
public class Scenario {
    @NonNull
    Graph graph;
    @Singular
    List<RouteAssignment> routes;
    @NonNull
    ScenarioConfig config;
    @Singular
    List<String> entryEdges;
    @Singular
    List<String> exitEdges;
}
