package org.Aayush.scenario.geometry;

import lombok.Value;

/**
 * Geographic bounding box in degrees, always with {@code north >= south} and {@code east >= west}.
 */
@Value
public class GeoBounds {
    double north;
    double south;
    double east;
    double west;

    /**
     * Builds a box from two latitude and two longitude limits given in any order.
     */
    public static GeoBounds of(double latA, double latB, double lonA, double lonB) {
        return new GeoBounds(
                Math.max(latA, latB),
                Math.min(latA, latB),
                Math.max(lonA, lonB),
                Math.min(lonA, lonB)
        );
    }

    /**
     * Inclusive containment test.
     */
    public boolean contains(double lat, double lon) {
        return west <= lon && lon <= east && south <= lat && lat <= north;
    }

    public double areaSquareDegrees() {
        return (north - south) * (east - west);
    }
}
