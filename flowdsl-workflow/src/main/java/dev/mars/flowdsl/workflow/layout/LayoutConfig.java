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

package dev.mars.flowdsl.workflow.layout;

import dev.mars.flowdsl.config.FlowDslConfiguration;

import java.util.Objects;

/**
 * Column and row spacing plus the origin used by the {@link LayoutEngine}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-13
 * @version 1.0
 */
public final class LayoutConfig {

    private final double spacingX;
    private final double spacingY;
    private final double originX;
    private final double originY;

    public LayoutConfig(double spacingX, double spacingY, double originX, double originY) {
        if (!Double.isFinite(spacingX) || !Double.isFinite(spacingY)
                || !Double.isFinite(originX) || !Double.isFinite(originY)) {
            throw new IllegalArgumentException("Layout values must be finite numbers");
        }
        this.spacingX = spacingX;
        this.spacingY = spacingY;
        this.originX = originX;
        this.originY = originY;
    }

    /**
     * Spacing 250 x 120, origin (100, 200).
     */
    public static LayoutConfig defaults() {
        return from(FlowDslConfiguration.defaults());
    }

    public static LayoutConfig from(FlowDslConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return new LayoutConfig(
                configuration.getLayoutSpacingX(),
                configuration.getLayoutSpacingY(),
                configuration.getLayoutOriginX(),
                configuration.getLayoutOriginY());
    }

    public double getSpacingX() {
        return spacingX;
    }

    public double getSpacingY() {
        return spacingY;
    }

    public double getOriginX() {
        return originX;
    }

    public double getOriginY() {
        return originY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LayoutConfig that = (LayoutConfig) o;
        return Double.compare(spacingX, that.spacingX) == 0 &&
               Double.compare(spacingY, that.spacingY) == 0 &&
               Double.compare(originX, that.originX) == 0 &&
               Double.compare(originY, that.originY) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(spacingX, spacingY, originX, originY);
    }

    @Override
    public String toString() {
        return "LayoutConfig{spacing=(" + spacingX + ", " + spacingY + "), origin=(" + originX + ", " + originY + ")}";
    }
}
