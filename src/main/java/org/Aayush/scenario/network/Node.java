package org.Aayush.scenario.network;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Graph junction.
 *
 * <p>{@code x}/{@code y} are projected planar coordinates; {@code lat}/{@code lon}
 * are kept when the source carried them so the node can be re-projected or
 * bounding-box filtered later.</p>
 */
@Value
@Builder(toBuilder = true)
public class Node {
    @NonNull
    String id;
    double x;
    double y;
    /** Geographic latitude, or {@code null} when unknown. */
    Double lat;
    /** Geographic longitude, or {@code null} when unknown. */
    Double lon;
    @NonNull
    @Builder.Default
    NodeKind kind = NodeKind.PRIORITY;

    public boolean hasGeographic() {
        return lat != null && lon != null;
    }

    public Coordinate planar() {
        return new Coordinate(x, y);
    }

    /**
     * Returns {@code (lat, lon)}, or {@code null} when either component is missing.
     */
    public Coordinate geographic() {
        return hasGeographic() ? new Coordinate(lat, lon) : null;
    }

    /**
     * Returns a copy carrying new planar coordinates.
     */
    public Node withPlanar(double newX, double newY) {
        return toBuilder().x(newX).y(newY).build();
    }
}
