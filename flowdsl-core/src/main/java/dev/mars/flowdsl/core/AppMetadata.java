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

package dev.mars.flowdsl.core;

import java.util.Map;
import java.util.Objects;

/**
 * The {@code app} section of a workflow document.
 *
 * <p>Keys the engine does not model (for example {@code use_icon_as_answer_icon}) are kept
 * in {@link #getExtras()} and written back unchanged on export.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public class AppMetadata {

    private final String name;
    private final String mode;
    private final String icon;
    private final String iconBackground;
    private final String description;
    private final Map<String, Object> extras;

    public AppMetadata(String name, String mode, String icon, String iconBackground,
                       String description, Map<String, Object> extras) {
        this.name = Objects.requireNonNull(name, "App name cannot be null");
        this.mode = Objects.requireNonNull(mode, "App mode cannot be null");
        this.icon = Objects.requireNonNull(icon, "App icon cannot be null");
        this.iconBackground = Objects.requireNonNull(iconBackground, "App icon background cannot be null");
        this.description = description;
        this.extras = RawFields.copyOf(extras);
    }

    public AppMetadata(String name, String mode, String icon, String iconBackground, String description) {
        this(name, mode, icon, iconBackground, description, Map.of());
    }

    public String getName() {
        return name;
    }

    public String getMode() {
        return mode;
    }

    public String getIcon() {
        return icon;
    }

    public String getIconBackground() {
        return iconBackground;
    }

    /**
     * @return the description, or null when the document has none
     */
    public String getDescription() {
        return description;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AppMetadata that = (AppMetadata) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(mode, that.mode) &&
               Objects.equals(icon, that.icon) &&
               Objects.equals(iconBackground, that.iconBackground) &&
               Objects.equals(description, that.description) &&
               Objects.equals(extras, that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, mode, icon, iconBackground, description, extras);
    }

    @Override
    public String toString() {
        return "AppMetadata{" +
               "name='" + name + '\'' +
               ", mode='" + mode + '\'' +
               '}';
    }
}
