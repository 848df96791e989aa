/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowdsl.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration for the flow DSL engine.
 *
 * <p>Values are resolved in this order, later sources overriding earlier ones:</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>the first readable {@code flowdsl.properties} found in the working directory,
 *       {@code config/}, {@code ~/.flowdsl/}, or else on the classpath</li>
 *   <li>system properties starting with {@code flowdsl.}</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public class FlowDslConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FlowDslConfiguration.class);

    public static final String LAYOUT_SPACING_X = "flowdsl.layout.spacing.x";
    public static final String LAYOUT_SPACING_Y = "flowdsl.layout.spacing.y";
    public static final String LAYOUT_ORIGIN_X = "flowdsl.layout.origin.x";
    public static final String LAYOUT_ORIGIN_Y = "flowdsl.layout.origin.y";
    public static final String LAYOUT_AUTO = "flowdsl.layout.auto";
    public static final String MAX_NODES = "flowdsl.limits.max.nodes";
    public static final String MAX_EDGES = "flowdsl.limits.max.edges";
    public static final String REPAIR_ENABLED = "flowdsl.repair.enabled";
    public static final String METRICS_ENABLED = "flowdsl.monitoring.metrics.enabled";

    // Default configuration values
    private static final double DEFAULT_SPACING_X = 250;
    private static final double DEFAULT_SPACING_Y = 120;
    private static final double DEFAULT_ORIGIN_X = 100;
    private static final double DEFAULT_ORIGIN_Y = 200;
    private static final int DEFAULT_MAX_NODES = 1000;
    private static final int DEFAULT_MAX_EDGES = 5000;

    private static final String CONFIG_FILE = "flowdsl.properties";

    private final Properties properties;

    public FlowDslConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Creates a configuration from defaults plus the given overrides only. Files and system
     * properties are not consulted, which keeps tests independent of the environment.
     */
    public FlowDslConfiguration(Properties overrides) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    /**
     * Returns a configuration holding the built-in defaults only.
     */
    public static FlowDslConfiguration defaults() {
        return new FlowDslConfiguration(new Properties());
    }

    // Layout Configuration
    public double getLayoutSpacingX() {
        return getDoubleProperty(LAYOUT_SPACING_X, DEFAULT_SPACING_X);
    }

    public double getLayoutSpacingY() {
        return getDoubleProperty(LAYOUT_SPACING_Y, DEFAULT_SPACING_Y);
    }

    public double getLayoutOriginX() {
        return getDoubleProperty(LAYOUT_ORIGIN_X, DEFAULT_ORIGIN_X);
    }

    public double getLayoutOriginY() {
        return getDoubleProperty(LAYOUT_ORIGIN_Y, DEFAULT_ORIGIN_Y);
    }

    public boolean isAutoLayoutEnabled() {
        return getBooleanProperty(LAYOUT_AUTO, true);
    }

    // Limits
    public int getMaxNodes() {
        return getIntProperty(MAX_NODES, DEFAULT_MAX_NODES);
    }

    public int getMaxEdges() {
        return getIntProperty(MAX_EDGES, DEFAULT_MAX_EDGES);
    }

    // Pipeline
    public boolean isRepairEnabled() {
        return getBooleanProperty(REPAIR_ENABLED, true);
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                double parsed = Double.parseDouble(value.trim());
                if (Double.isFinite(parsed)) {
                    return parsed;
                }
                logger.warn("Non-finite value for property {}: {}. Using default: {}", key, value, defaultValue);
            } catch (NumberFormatException e) {
                logger.warn("Invalid numeric value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(LAYOUT_SPACING_X, String.valueOf(DEFAULT_SPACING_X));
        properties.setProperty(LAYOUT_SPACING_Y, String.valueOf(DEFAULT_SPACING_Y));
        properties.setProperty(LAYOUT_ORIGIN_X, String.valueOf(DEFAULT_ORIGIN_X));
        properties.setProperty(LAYOUT_ORIGIN_Y, String.valueOf(DEFAULT_ORIGIN_Y));
        properties.setProperty(LAYOUT_AUTO, "true");
        properties.setProperty(MAX_NODES, String.valueOf(DEFAULT_MAX_NODES));
        properties.setProperty(MAX_EDGES, String.valueOf(DEFAULT_MAX_EDGES));
        properties.setProperty(REPAIR_ENABLED, "true");
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE,
                "config/" + CONFIG_FILE,
                System.getProperty("user.home") + "/.flowdsl/" + CONFIG_FILE
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("flowdsl."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowDslConfiguration{" +
                "spacing=(" + getLayoutSpacingX() + ", " + getLayoutSpacingY() + ')' +
                ", origin=(" + getLayoutOriginX() + ", " + getLayoutOriginY() + ')' +
                ", maxNodes=" + getMaxNodes() +
                ", maxEdges=" + getMaxEdges() +
                ", repairEnabled=" + isRepairEnabled() +
                '}';
    }
}
