package org.Aayush.scenario.routing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Share of the vehicle population assigned to one vehicle type.
 */
@Value
@Builder(toBuilder = true)
public class VehicleDistribution {
    public static final String DEFAULT_COLOR = "1,1,0";
    public static final double DEFAULT_PERIOD = 1.0d;

    @NonNull
    String vehicleType;
    /** Percentage in {@code [0, 100]}. */
    double percentage;
    @NonNull
    @Builder.Default
    String color = DEFAULT_COLOR;
    @Builder.Default
    double period = DEFAULT_PERIOD;
    /** Free-form extra vehicle attributes. Recorded in metadata, never emitted on vehicles. */
    String attributes;
}
