package org.Aayush.scenario.routing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One routed vehicle: contiguous edge path plus departure.
 */
@Value
@Builder(toBuilder = true)
public class RouteAssignment {
    @NonNull
    String id;
    @Singular
    List<String> edges;
    @NonNull
    String vehicleType;
    double departTime;
    @NonNull
    String color;
}
