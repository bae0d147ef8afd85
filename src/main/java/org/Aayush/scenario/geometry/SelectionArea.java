package org.Aayush.scenario.geometry;

import lombok.Builder;
import lombok.Value;
import org.Aayush.scenario.core.ScenarioEngineException;

/**
 * Area requested for a network download, in degrees.
 */
@Value
@Builder
public class SelectionArea {
    public static final String REASON_AREA_TOO_LARGE = "AREA_TOO_LARGE";
    public static final String REASON_AREA_NOT_FINITE = "AREA_NOT_FINITE";

    double north;
    double south;
    double east;
    double west;
    /** Optional display name. */
    String placeName;

    /**
     * Rejects non-finite limits and areas larger than {@code maxSquareDegrees}.
     *
     * @return this area, for chaining.
     */
    public SelectionArea validate(double maxSquareDegrees) {
        if (!Double.isFinite(north) || !Double.isFinite(south)
                || !Double.isFinite(east) || !Double.isFinite(west)) {
            throw new ScenarioEngineException(REASON_AREA_NOT_FINITE, "Selected area limits must be finite numbers");
        }
        double area = Math.abs((north - south) * (east - west));
        if (area > maxSquareDegrees) {
            throw new ScenarioEngineException(
                    REASON_AREA_TOO_LARGE,
                    "Selected area is too large (" + area + " sq deg > " + maxSquareDegrees
                            + "). Please select a smaller area."
            );
        }
        return this;
    }

    public GeoBounds toGeoBounds() {
        return GeoBounds.of(north, south, east, west);
    }

    public String displayName(String networkId) {
        return placeName == null || placeName.isBlank() ? "Map " + networkId : placeName;
    }
}
