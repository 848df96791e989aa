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
 * A directed arc of the workflow graph.
 *
 * <p>Handles, edge type and the {@code data} block are optional in DSL text; the parser
 * fills in {@link #DEFAULT_SOURCE_HANDLE}, {@link #DEFAULT_TARGET_HANDLE} and
 * {@link #DEFAULT_TYPE} when they are absent.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public class Edge {

    public static final String DEFAULT_SOURCE_HANDLE = "source";
    public static final String DEFAULT_TARGET_HANDLE = "target";
    public static final String DEFAULT_TYPE = "custom";

    private final String id;
    private final String source;
    private final String target;
    private final String sourceHandle;
    private final String targetHandle;
    private final String type;
    private final Integer zIndex;
    private final EdgeData data;
    private final Map<String, Object> extras;

    public Edge(String id, String source, String target, String sourceHandle, String targetHandle,
                String type, Integer zIndex, EdgeData data, Map<String, Object> extras) {
        this.id = Objects.requireNonNull(id, "Edge id cannot be null");
        this.source = Objects.requireNonNull(source, "Edge source cannot be null");
        this.target = Objects.requireNonNull(target, "Edge target cannot be null");
        this.sourceHandle = sourceHandle != null ? sourceHandle : DEFAULT_SOURCE_HANDLE;
        this.targetHandle = targetHandle != null ? targetHandle : DEFAULT_TARGET_HANDLE;
        this.type = type != null ? type : DEFAULT_TYPE;
        this.zIndex = zIndex;
        this.data = data != null ? data : EdgeData.EMPTY;
        this.extras = RawFields.copyOf(extras);
    }

    /**
     * Creates an edge with default handles, type and data.
     */
    public static Edge of(String id, String source, String target) {
        return new Edge(id, source, target, null, null, null, null, null, Map.of());
    }

    public String getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getSourceHandle() {
        return sourceHandle;
    }

    public String getTargetHandle() {
        return targetHandle;
    }

    public String getType() {
        return type;
    }

    /**
     * @return the stacking order, or null when the document does not set one
     */
    public Integer getZIndex() {
        return zIndex;
    }

    public EdgeData getData() {
        return data;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge that = (Edge) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(source, that.source) &&
               Objects.equals(target, that.target) &&
               Objects.equals(sourceHandle, that.sourceHandle) &&
               Objects.equals(targetHandle, that.targetHandle) &&
               Objects.equals(type, that.type) &&
               Objects.equals(zIndex, that.zIndex) &&
               Objects.equals(data, that.data) &&
               Objects.equals(extras, that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, target, sourceHandle, targetHandle, type, zIndex, data, extras);
    }

    @Override
    public String toString() {
        return "Edge{" +
               "id='" + id + '\'' +
               ", " + source + " -> " + target +
               '}';
    }

    /**
     * The {@code data} block of an edge record. {@code sourceType} and {@code targetType}
     * repeat the node types at either end; unknown keys are kept in {@link #getExtras()}.
     */
    public static class EdgeData {

        public static final EdgeData EMPTY = new EdgeData(null, null, false, Map.of());

        private final String sourceType;
        private final String targetType;
        private final boolean inIteration;
        private final Map<String, Object> extras;

        public EdgeData(String sourceType, String targetType, boolean inIteration, Map<String, Object> extras) {
            this.sourceType = sourceType;
            this.targetType = targetType;
            this.inIteration = inIteration;
            this.extras = RawFields.copyOf(extras);
        }

        public String getSourceType() {
            return sourceType;
        }

        public String getTargetType() {
            return targetType;
        }

        public boolean isInIteration() {
            return inIteration;
        }

        public Map<String, Object> getExtras() {
            return extras;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            EdgeData that = (EdgeData) o;
            return inIteration == that.inIteration &&
                   Objects.equals(sourceType, that.sourceType) &&
                   Objects.equals(targetType, that.targetType) &&
                   Objects.equals(extras, that.extras);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sourceType, targetType, inIteration, extras);
        }

        @Override
        public String toString() {
            return "EdgeData{" +
                   "sourceType='" + sourceType + '\'' +
                   ", targetType='" + targetType + '\'' +
                   ", isInIteration=" + inIteration +
                   '}';
        }
    }
}
