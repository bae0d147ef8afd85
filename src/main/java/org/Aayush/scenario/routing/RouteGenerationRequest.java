package org.Aayush.scenario.routing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.scenario.network.Graph;

import java.util.List;

/**
 * Inputs of one route generation call.
 */
@Value
@Builder(toBuilder = true)
public class RouteGenerationRequest {
    @NonNull
    Graph graph;
    int totalVehicles;
    @Singular
    List<VehicleDistribution> distributions;
    @Singular
    List<String> entryEdges;
    @Singular
    List<String> exitEdges;
    /** Simulation window in seconds. */
    double horizon;
    /** Optional seed; {@code null} draws from an unseeded source. */
    Long seed;
}
