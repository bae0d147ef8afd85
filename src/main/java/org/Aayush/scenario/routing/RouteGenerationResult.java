package org.Aayush.scenario.routing;

import lombok.Value;
import org.Aayush.scenario.core.NoRoutableVehiclesException;

import java.util.List;

/**
 * Routed vehicles plus attempt bookkeeping.
 */
@Value
public class RouteGenerationResult {
    public static final String REASON_NO_ROUTABLE_VEHICLES = "NO_ROUTABLE_VEHICLES";

    /** Assignments in generation order (type by type, then vehicle index). */
    List<RouteAssignment> assignments;
    int attempted;
    int skipped;

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    /**
     * Returns the assignments, or fails when not a single vehicle could be routed.
     */
    public List<RouteAssignment> requireRoutable() {
        if (assignments.isEmpty()) {
            throw new NoRoutableVehiclesException(
                    REASON_NO_ROUTABLE_VEHICLES,
                    "No valid routes could be generated: all " + attempted
                            + " attempted vehicles had no path between the selected entry and exit points"
            );
        }
        return assignments;
    }
}
