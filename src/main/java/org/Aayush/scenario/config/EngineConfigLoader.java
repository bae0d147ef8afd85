package org.Aayush.scenario.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Builds {@link EngineConfig} from {@value #RESOURCE} on the classpath, then from
 * {@code scenario.*} system properties, later sources winning.
 * <p>
 * Keys are the {@link EngineConfig} field names, e.g. {@code sumoBinary=/opt/sumo/bin/sumo}
 * in the file or {@code -Dscenario.sumoBinary=/opt/sumo/bin/sumo} on the command line.
 */
public final class EngineConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String RESOURCE = "scenario-engine.properties";
    public static final String SYSTEM_PREFIX = "scenario.";

    private EngineConfigLoader() {
    }

    public static EngineConfig load() {
        return load(readResource(RESOURCE), System.getProperties());
    }

    /**
     * @param file properties as read from the configuration file.
     * @param system system properties; only {@code scenario.}-prefixed keys are used.
     * @throws IllegalArgumentException when a numeric value cannot be parsed.
     */
    public static EngineConfig load(Properties file, Properties system) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(system, "system");
        Properties merged = new Properties();
        merged.putAll(file);
        for (String name : system.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                merged.setProperty(name.substring(SYSTEM_PREFIX.length()), system.getProperty(name));
            }
        }

        EngineConfig defaults = EngineConfig.defaults();
        EngineConfig config = EngineConfig.builder()
                .defaultLaneCount(intValue(merged, "defaultLaneCount", defaults.getDefaultLaneCount()))
                .defaultSpeed(doubleValue(merged, "defaultSpeed", defaults.getDefaultSpeed()))
                .defaultLength(doubleValue(merged, "defaultLength", defaults.getDefaultLength()))
                .viewportHalfWidth(doubleValue(merged, "viewportHalfWidth", defaults.getViewportHalfWidth()))
                .distributionTolerance(doubleValue(merged, "distributionTolerance", defaults.getDistributionTolerance()))
                .maxSelectionAreaSquareDegrees(doubleValue(
                        merged, "maxSelectionAreaSquareDegrees", defaults.getMaxSelectionAreaSquareDegrees()))
                .netconvertBinary(merged.getProperty("netconvertBinary", defaults.getNetconvertBinary()).trim())
                .sumoBinary(merged.getProperty("sumoBinary", defaults.getSumoBinary()).trim())
                .sumoGuiBinary(merged.getProperty("sumoGuiBinary", defaults.getSumoGuiBinary()).trim())
                .workspacePrefix(merged.getProperty("workspacePrefix", defaults.getWorkspacePrefix()).trim())
                .build();
        LOG.debug("Loaded engine config {}", config);
        return config;
    }

    static Properties readResource(String resource) {
        Properties properties = new Properties();
        try (InputStream input = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                LOG.debug("No {} on classpath, using defaults", resource);
                return properties;
            }
            properties.load(input);
        } catch (IOException ex) {
            throw new UncheckedIOException("Error reading " + resource, ex);
        }
        return properties;
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, ex);
        }
    }

    private static double doubleValue(Properties properties, String key, double defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, ex);
        }
    }
}
