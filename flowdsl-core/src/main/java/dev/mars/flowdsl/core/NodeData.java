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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The {@code data} payload of a node, modelled as a closed set of typed payloads keyed by
 * {@link NodeKind} plus the {@link GenericNodeData} fallback for every other kind.
 *
 * <p>Every payload keeps the complete field map it was decoded from. The typed accessors
 * of the subclasses are views over that map, which keeps export lossless: fields the
 * engine does not interpret are written back exactly as they were read.</p>
 *
 * <h3>Creating Payloads:</h3>
 * <pre>{@code
 * NodeData data = NodeData.of(NodeKind.LLM, Map.of(
 *     "title", "Summarise",
 *     "model", Map.of("provider", "openai", "name", "gpt-4o"),
 *     "prompt_template", "Summarise {{#start.text#}}"));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 * @see NodeKind
 */
public abstract class NodeData {

    private final Map<String, Object> fields;

    protected NodeData(Map<String, Object> fields) {
        this.fields = RawFields.copyOf(fields);
    }

    /**
     * Creates the payload type that matches {@code kind}.
     *
     * @param kind the node kind, {@link NodeKind#UNKNOWN} for unrecognised types
     * @param fields the raw {@code data} map, may be null
     * @return a typed payload, never null
     */
    public static NodeData of(NodeKind kind, Map<String, Object> fields) {
        Objects.requireNonNull(kind, "Node kind cannot be null");
        switch (kind) {
            case START:
                return new StartNodeData(fields);
            case END:
                return new EndNodeData(fields);
            case LLM:
                return new LlmNodeData(fields);
            case CODE:
                return new CodeNodeData(fields);
            case IF_ELSE:
                return new IfElseNodeData(fields);
            case HTTP_REQUEST:
                return new HttpRequestNodeData(fields);
            case TEMPLATE_TRANSFORM:
                return new TemplateTransformNodeData(fields);
            default:
                return new GenericNodeData(fields);
        }
    }

    /**
     * Returns the complete, unmodifiable field map including {@code title}.
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    public String getTitle() {
        return RawFields.getString(fields, "title");
    }

    public String getDescription() {
        return RawFields.getString(fields, "desc");
    }

    public boolean has(String key) {
        return fields.get(key) != null;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public boolean hasText(String key) {
        return RawFields.hasText(fields, key);
    }

    public boolean hasList(String key) {
        return RawFields.getList(fields, key) != null;
    }

    protected String stringField(String key) {
        return RawFields.getString(fields, key);
    }

    protected Map<String, Object> mapField(String key) {
        return RawFields.getMap(fields, key);
    }

    protected List<Object> listField(String key) {
        return RawFields.getList(fields, key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((NodeData) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + fields;
    }
}
