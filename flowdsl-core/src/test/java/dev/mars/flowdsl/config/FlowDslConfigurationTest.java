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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FlowDslConfiguration}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-09
 */
class FlowDslConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(FlowDslConfiguration.MAX_EDGES);
    }

    @Test
    void testDefaults() {
        FlowDslConfiguration config = FlowDslConfiguration.defaults();

        assertEquals(250, config.getLayoutSpacingX());
        assertEquals(120, config.getLayoutSpacingY());
        assertEquals(100, config.getLayoutOriginX());
        assertEquals(200, config.getLayoutOriginY());
        assertTrue(config.isAutoLayoutEnabled());
        assertEquals(1000, config.getMaxNodes());
        assertEquals(5000, config.getMaxEdges());
        assertTrue(config.isRepairEnabled());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testOverrides() {
        Properties overrides = new Properties();
        overrides.setProperty(FlowDslConfiguration.LAYOUT_SPACING_Y, "80.5");
        overrides.setProperty(FlowDslConfiguration.MAX_NODES, " 10 ");
        overrides.setProperty(FlowDslConfiguration.REPAIR_ENABLED, "false");

        FlowDslConfiguration config = new FlowDslConfiguration(overrides);

        assertEquals(80.5, config.getLayoutSpacingY());
        assertEquals(10, config.getMaxNodes());
        assertFalse(config.isRepairEnabled());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        Properties overrides = new Properties();
        overrides.setProperty(FlowDslConfiguration.MAX_NODES, "many");
        overrides.setProperty(FlowDslConfiguration.LAYOUT_SPACING_X, "NaN");
        overrides.setProperty(FlowDslConfiguration.LAYOUT_ORIGIN_X, "left");

        FlowDslConfiguration config = new FlowDslConfiguration(overrides);

        assertEquals(1000, config.getMaxNodes());
        assertEquals(250, config.getLayoutSpacingX());
        assertEquals(100, config.getLayoutOriginX());
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty(FlowDslConfiguration.MAX_EDGES, "42");

        assertEquals(42, new FlowDslConfiguration().getMaxEdges());
        assertEquals(5000, FlowDslConfiguration.defaults().getMaxEdges());
    }

    @Test
    void testSetProperty() {
        FlowDslConfiguration config = FlowDslConfiguration.defaults();
        config.setProperty(FlowDslConfiguration.LAYOUT_AUTO, "false");

        assertFalse(config.isAutoLayoutEnabled());
        assertEquals("false", config.getProperty(FlowDslConfiguration.LAYOUT_AUTO));
        assertEquals("fallback", config.getProperty("flowdsl.unknown", "fallback"));
    }
}
