package org.Aayush.scenario.config;

import lombok.Builder;
import lombok.Value;
import org.Aayush.scenario.network.EdgeDefaults;

/**
 * Engine-wide settings bound once at startup.
 */
@Value
@Builder(toBuilder = true)
public class EngineConfig {

    /**
     * Lane count for edges that carry none.
     */
    @Builder.Default
    int defaultLaneCount = 2;

    /**
     * Speed in m/s for edges that carry none (50 km/h).
     */
    @Builder.Default
    double defaultSpeed = 13.89d;

    /**
     * Length in meters for edges that carry none.
     */
    @Builder.Default
    double defaultLength = 100.0d;

    /**
     * Half-width of the square display viewport used by normalization.
     */
    @Builder.Default
    double viewportHalfWidth = 100.0d;

    /**
     * Accepted deviation of the distribution sum from 100.
     */
    @Builder.Default
    double distributionTolerance = 0.01d;

    /**
     * Largest downloadable selection, in square degrees.
     */
    @Builder.Default
    double maxSelectionAreaSquareDegrees = 0.01d;

    @Builder.Default
    String netconvertBinary = "netconvert";

    @Builder.Default
    String sumoBinary = "sumo";

    @Builder.Default
    String sumoGuiBinary = "sumo-gui";

    /**
     * Name prefix of per-request temporary workspaces.
     */
    @Builder.Default
    String workspacePrefix = "sumo_export_";

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }

    public EdgeDefaults edgeDefaults() {
        return EdgeDefaults.builder()
                .laneCount(defaultLaneCount)
                .speed(defaultSpeed)
                .length(defaultLength)
                .build();
    }
}
