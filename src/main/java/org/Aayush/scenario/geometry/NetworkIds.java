package org.Aayush.scenario.geometry;

import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes a selection area into a network id and back.
 *
 * <p>Format: {@code map_<north>_<south>_<east>_<west>}, each limit in thousandths of a
 * degree truncated toward zero. Decoding swaps limits where needed so the result
 * always satisfies {@code north >= south} and {@code east >= west}.</p>
 */
@UtilityClass
public class NetworkIds {
    private static final Pattern MAP_ID = Pattern.compile("map_(-?\\d+)_(-?\\d+)_(-?\\d+)_(-?\\d+)");
    private static final double SCALE = 1000.0d;

    public static String forArea(SelectionArea area) {
        Objects.requireNonNull(area, "area");
        return "map_" + encode(area.getNorth())
                + "_" + encode(area.getSouth())
                + "_" + encode(area.getEast())
                + "_" + encode(area.getWest());
    }

    /**
     * Decodes the bounding box embedded in a {@code map_} id.
     *
     * @return the box, or empty when the id does not start with the expected pattern.
     */
    public static Optional<GeoBounds> boundsOf(String networkId) {
        if (networkId == null) {
            return Optional.empty();
        }
        Matcher matcher = MAP_ID.matcher(networkId);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        try {
            double north = Long.parseLong(matcher.group(1)) / SCALE;
            double south = Long.parseLong(matcher.group(2)) / SCALE;
            double east = Long.parseLong(matcher.group(3)) / SCALE;
            double west = Long.parseLong(matcher.group(4)) / SCALE;
            return Optional.of(GeoBounds.of(north, south, east, west));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static long encode(double degrees) {
        return (long) (degrees * SCALE);
    }
}
