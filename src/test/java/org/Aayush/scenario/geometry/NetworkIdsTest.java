package org.Aayush.scenario.geometry;

import org.Aayush.scenario.core.ScenarioEngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Network Id and Selection Area Tests")
class NetworkIdsTest {

    @Test
    @DisplayName("Encodes limits in thousandths of a degree, truncated")
    void testForArea() {
        SelectionArea area = SelectionArea.builder()
                .north(40.4275d)
                .south(40.4101d)
                .east(-3.6899d)
                .west(-3.7123d)
                .build();

        assertEquals("map_40427_40410_-3689_-3712", NetworkIds.forArea(area));
    }

    @Test
    @DisplayName("Decodes bounds and swaps inverted limits")
    void testBoundsOf() {
        GeoBounds bounds = NetworkIds.boundsOf("map_40410_40427_-3712_-3689").orElseThrow();

        assertEquals(40.427d, bounds.getNorth(), 1e-12);
        assertEquals(40.410d, bounds.getSouth(), 1e-12);
        assertEquals(-3.689d, bounds.getEast(), 1e-12);
        assertEquals(-3.712d, bounds.getWest(), 1e-12);
    }

    @Test
    @DisplayName("Ids with a suffix still decode; other ids do not")
    void testPatternMatching() {
        assertTrue(NetworkIds.boundsOf("map_1_2_3_4_v2").isPresent());
        assertEquals(Optional.empty(), NetworkIds.boundsOf("downtown"));
        assertEquals(Optional.empty(), NetworkIds.boundsOf("x_map_1_2_3_4"));
        assertEquals(Optional.empty(), NetworkIds.boundsOf(null));
    }

    @Test
    @DisplayName("Selections above the area limit are rejected")
    void testAreaLimit() {
        SelectionArea small = SelectionArea.builder().north(40.05d).south(40.0d).east(-3.0d).west(-3.05d).build();
        SelectionArea large = SelectionArea.builder().north(41.0d).south(40.0d).east(-3.0d).west(-3.5d).build();

        assertSame(small, small.validate(0.01d));
        ScenarioEngineException ex = assertThrows(ScenarioEngineException.class, () -> large.validate(0.01d));
        assertEquals(SelectionArea.REASON_AREA_TOO_LARGE, ex.getReasonCode());
        assertEquals("Map map_1", small.displayName("map_1"));
    }
}
