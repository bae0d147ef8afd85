package org.Aayush.scenario.network;

/**
 * Plain coordinate pair.
 *
 * <p>Component meaning depends on the source: {@code (lat, lon)} for geographic
 * shapes, {@code (x, y)} for projected planar shapes. No distance logic lives here.</p>
 *
 * @param x first component (lat for geographic, x for planar).
 * @param y second component (lon for geographic, y for planar).
 */
public record Coordinate(double x, double y) {

    public static final Coordinate ORIGIN = new Coordinate(0.0d, 0.0d);

    @Override
    public String toString() {
        return String.format("(%.6f, %.6f)", x, y);
    }
}
