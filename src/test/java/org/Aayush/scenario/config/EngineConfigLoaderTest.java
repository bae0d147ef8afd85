package org.Aayush.scenario.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Engine Config Loader Tests")
class EngineConfigLoaderTest {

    private static Properties properties(String... pairs) {
        Properties properties = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            properties.setProperty(pairs[i], pairs[i + 1]);
        }
        return properties;
    }

    @Test
    @DisplayName("Empty sources give the built-in defaults")
    void testDefaults() {
        EngineConfig config = EngineConfigLoader.load(new Properties(), new Properties());

        assertEquals(EngineConfig.defaults(), config);
        assertEquals(2, config.edgeDefaults().getLaneCount());
        assertEquals(13.89d, config.edgeDefaults().getSpeed());
    }

    @Test
    @DisplayName("Prefixed system properties override file values")
    void testPrecedence() {
        Properties file = properties(
                "sumoBinary", "/usr/local/bin/sumo",
                "viewportHalfWidth", "250",
                "defaultLaneCount", " 3 ");
        Properties system = properties(
                "scenario.sumoBinary", "/opt/sumo/bin/sumo",
                "sumoGuiBinary", "ignored-without-prefix");

        EngineConfig config = EngineConfigLoader.load(file, system);

        assertEquals("/opt/sumo/bin/sumo", config.getSumoBinary());
        assertEquals("sumo-gui", config.getSumoGuiBinary());
        assertEquals(250.0d, config.getViewportHalfWidth());
        assertEquals(3, config.getDefaultLaneCount());
    }

    @Test
    @DisplayName("Unparseable numbers name the offending key")
    void testInvalidNumber() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> EngineConfigLoader.load(properties("distributionTolerance", "tight"), new Properties()));

        assertTrue(ex.getMessage().contains("distributionTolerance"));
    }

    @Test
    @DisplayName("Bundled resource is found on the classpath and matches the defaults")
    void testBundledResource() {
        Properties resource = EngineConfigLoader.readResource(EngineConfigLoader.RESOURCE);

        assertFalse(resource.isEmpty());
        assertEquals(EngineConfig.defaults(), EngineConfigLoader.load(resource, new Properties()));
        assertTrue(EngineConfigLoader.readResource("missing.properties").isEmpty());
    }
}
