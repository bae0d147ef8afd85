package org.Aayush.scenario.scenario;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Car-following parameters of one {@code <vType>}.
 */
@Value
@Builder
public class VehicleType {
    @NonNull
    String id;
    double accel;
    double decel;
    double sigma;
    double length;
    double minGap;
    double maxSpeed;
    @NonNull
    String guiShape;
}
