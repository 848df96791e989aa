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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Safe accessors over the loosely typed maps produced by the YAML decoder.
 *
 * <p>Decoded maps may contain {@code null} values ({@code desc:} with nothing after it),
 * so copies are kept in insertion-ordered {@link LinkedHashMap}s rather than
 * {@code Map.copyOf}, which rejects nulls.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public final class RawFields {

    private RawFields() {
    }

    /**
     * Returns an unmodifiable, order-preserving deep copy of the given map. Nested maps,
     * lists and sets are copied and frozen as well.
     */
    public static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, nested) -> copy.put(key, freeze(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>(((List<?>) value).size());
            for (Object item : (List<?>) value) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object item : (Set<?>) value) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableSet(copy);
        }
        return value;
    }

    public static String getString(Map<String, ?> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof String ? (String) value : null;
    }

    /**
     * True when {@code key} holds a string with at least one non-whitespace character.
     */
    public static boolean hasText(Map<String, ?> data, String key) {
        String value = getString(data, key);
        return value != null && !value.isBlank();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, ?> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> getList(Map<String, ?> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof List ? (List<Object>) value : null;
    }

    public static boolean getBoolean(Map<String, ?> data, String key, boolean defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }
}
