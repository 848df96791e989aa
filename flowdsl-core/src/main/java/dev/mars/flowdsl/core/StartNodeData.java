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
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload of a {@code start} node: the input variables a workflow run is started with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public final class StartNodeData extends NodeData {

    /**
     * Input variable types accepted by the runtime form builder.
     */
    public static final Set<String> VARIABLE_TYPES = Set.of(
        "text-input", "paragraph", "number", "select", "file", "file-list", "object",
        "string", "boolean", "array[string]", "array[number]", "array[object]"
    );

    public StartNodeData(Map<String, Object> fields) {
        super(fields);
    }

    /**
     * Returns the declared variables. Entries that are not mappings are returned as
     * variables with no fields so that callers can still report them by index.
     */
    @SuppressWarnings("unchecked")
    public List<Variable> getVariables() {
        List<Object> raw = listField("variables");
        if (raw == null) {
            return List.of();
        }
        List<Variable> variables = new ArrayList<>(raw.size());
        for (Object item : raw) {
            variables.add(new Variable(item instanceof Map ? (Map<String, Object>) item : Map.of()));
        }
        return variables;
    }

    /**
     * A single start input. The runtime names it with {@code variable}; older documents use
     * {@code name}.
     */
    public static final class Variable {

        private final Map<String, Object> fields;

        Variable(Map<String, Object> fields) {
            this.fields = RawFields.copyOf(fields);
        }

        public String getName() {
            String variable = RawFields.getString(fields, "variable");
            return variable != null && !variable.isBlank() ? variable : RawFields.getString(fields, "name");
        }

        public String getType() {
            return RawFields.getString(fields, "type");
        }

        public String getLabel() {
            return RawFields.getString(fields, "label");
        }

        public boolean hasOptions() {
            return fields.get("options") != null;
        }

        public boolean isRequired() {
            return RawFields.getBoolean(fields, "required", false);
        }
    }
}
