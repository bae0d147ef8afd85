package org.Aayush.scenario.scenario;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.scenario.routing.VehicleDistribution;

import java.util.List;

/**
 * Request-level simulation settings carried into the bundle.
 */
@Value
@Builder(toBuilder = true)
public class ScenarioConfig {
    public static final String DEFAULT_NAME = "simulation";

    @NonNull
    @Builder.Default
    String name = DEFAULT_NAME;
    /** Simulation end time in seconds. */
    double horizon;
    int totalVehicles;
    @Singular
    List<VehicleDistribution> distributions;
    Long seed;
}
