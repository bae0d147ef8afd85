package org.Aayush.scenario.engine;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.scenario.routing.VehicleDistribution;
import org.Aayush.scenario.scenario.ScenarioConfig;

import java.util.List;

/**
 * Export parameters for one loaded network.
 * <p>
 * Empty entry or exit selections fall back to every classified entry or exit edge.
 */
@Value
@Builder(toBuilder = true)
public class ExportRequest {
    @NonNull
    String networkId;
    @NonNull
    @Builder.Default
    String name = ScenarioConfig.DEFAULT_NAME;
    int totalVehicles;
    /** Seconds. */
    double horizon;
    @Singular
    List<VehicleDistribution> distributions;
    @Singular
    List<String> entryEdges;
    @Singular
    List<String> exitEdges;
    Long seed;
}
