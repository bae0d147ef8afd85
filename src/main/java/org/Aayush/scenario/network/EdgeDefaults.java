package org.Aayush.scenario.network;

import lombok.Builder;
import lombok.Value;

/**
 * Fallback values applied when an edge omits (or garbles) an optional attribute.
 */
@Value
@Builder
public class EdgeDefaults {
    @Builder.Default
    int laneCount = 2;
    /** 13.89 m/s, i.e. 50 km/h. */
    @Builder.Default
    double speed = 13.89d;
    @Builder.Default
    double length = 100.0d;

    public static EdgeDefaults standard() {
        return EdgeDefaults.builder().build();
    }
}
