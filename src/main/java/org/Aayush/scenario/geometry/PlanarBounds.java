package org.Aayush.scenario.geometry;

import lombok.Value;

/**
 * Axis-aligned planar bounding box.
 */
@Value
public class PlanarBounds {
    public static final PlanarBounds ZERO = new PlanarBounds(0.0d, 0.0d, 0.0d, 0.0d);

    double xmin;
    double ymin;
    double xmax;
    double ymax;

    public double width() {
        return xmax - xmin;
    }

    public double height() {
        return ymax - ymin;
    }

    /**
     * True when either extent is zero (single point or axis-parallel line).
     */
    public boolean isDegenerate() {
        return !(width() > 0.0d && height() > 0.0d);
    }

    /**
     * Square viewport centered on the origin.
     */
    public static PlanarBounds viewport(double halfWidth) {
        return new PlanarBounds(-halfWidth, -halfWidth, halfWidth, halfWidth);
    }
}
