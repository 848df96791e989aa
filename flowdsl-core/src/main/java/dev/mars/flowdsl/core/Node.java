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
 * A vertex of the workflow graph.
 *
 * <p>The node {@code type} is kept exactly as written so that unknown types survive a
 * round trip; {@link #getKind()} classifies it. Record keys other than {@code id},
 * {@code type}, {@code position} and {@code data} (for example {@code width},
 * {@code height} or {@code selected}) are kept in {@link #getExtras()}.</p>
 *
 * <p>The payload always matches the kind: a payload of the wrong variant is rebuilt from
 * its fields.</p>
 *
 * <p>Instances are immutable. {@link #withPosition(Position)} returns a moved copy.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public class Node {

    private final String id;
    private final String type;
    private final Position position;
    private final NodeData data;
    private final Map<String, Object> extras;

    public Node(String id, String type, Position position, NodeData data, Map<String, Object> extras) {
        this.id = Objects.requireNonNull(id, "Node id cannot be null");
        this.type = Objects.requireNonNull(type, "Node type cannot be null");
        this.position = Objects.requireNonNull(position, "Node position cannot be null");
        this.data = conform(NodeKind.fromWireName(type), Objects.requireNonNull(data, "Node data cannot be null"));
        this.extras = RawFields.copyOf(extras);
    }

    public Node(String id, String type, Position position, NodeData data) {
        this(id, type, position, data, Map.of());
    }

    /**
     * Convenience factory that builds the typed payload from a raw data map.
     */
    public static Node of(String id, String type, Position position, Map<String, Object> data) {
        return new Node(id, type, position, NodeData.of(NodeKind.fromWireName(type), data));
    }

    /**
     * Rebuilds a payload whose variant does not match the node kind, so that an
     * {@code llm} node always carries {@link LlmNodeData} however it was constructed.
     */
    private static NodeData conform(NodeKind kind, NodeData data) {
        NodeData typed = NodeData.of(kind, data.getFields());
        return typed.getClass() == data.getClass() ? data : typed;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public NodeKind getKind() {
        return NodeKind.fromWireName(type);
    }

    public Position getPosition() {
        return position;
    }

    public NodeData getData() {
        return data;
    }

    public String getTitle() {
        return data.getTitle();
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    public Node withPosition(Position newPosition) {
        return new Node(id, type, newPosition, data, extras);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node that = (Node) o;
        return Objects.equals(id, that.id) &&
               Objects.equals(type, that.type) &&
               Objects.equals(position, that.position) &&
               Objects.equals(data, that.data) &&
               Objects.equals(extras, that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, position, data, extras);
    }

    @Override
    public String toString() {
        return "Node{" +
               "id='" + id + '\'' +
               ", type='" + type + '\'' +
               ", position=" + position +
               '}';
    }
}
