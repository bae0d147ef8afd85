package org.Aayush.scenario.network;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Locale;

/**
 * Junction control type, carried through to the nodes document.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum NodeKind {
    PRIORITY("priority"),
    TRAFFIC_LIGHT("traffic_light");

    /** Value written to and read from SUMO documents. */
    private final String wireValue;

    /**
     * Maps a raw {@code type} attribute to a kind.
     *
     * <p>Any {@code traffic_light*} variant is signal controlled; everything else,
     * including a missing value, is treated as a priority junction.</p>
     */
    public static NodeKind fromWire(String raw) {
        if (raw == null) {
            return PRIORITY;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith(TRAFFIC_LIGHT.wireValue) ? TRAFFIC_LIGHT : PRIORITY;
    }
}
