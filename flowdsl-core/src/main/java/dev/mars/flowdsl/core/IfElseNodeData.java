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

/**
 * Payload of an {@code if-else} node.
 *
 * <p>Two layouts are in circulation: a flat {@code conditions} list, and the newer
 * {@code cases} list where every case carries its own {@code conditions}. Both are exposed
 * through {@link #getConditions()}; the flat list wins when both are present.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public final class IfElseNodeData extends NodeData {

    public IfElseNodeData(Map<String, Object> fields) {
        super(fields);
    }

    /**
     * @return true when a {@code conditions} list, or a {@code cases} list, is present
     */
    public boolean hasConditionList() {
        return listField("conditions") != null || listField("cases") != null;
    }

    public String getLogicalOperator() {
        return stringField("logical_operator");
    }

    public List<Condition> getConditions() {
        List<Object> flat = listField("conditions");
        if (flat != null) {
            return toConditions(flat);
        }
        List<Object> cases = listField("cases");
        if (cases == null) {
            return List.of();
        }
        List<Condition> conditions = new ArrayList<>();
        for (Object item : cases) {
            if (item instanceof Map) {
                @SuppressWarnings("unchecked")
                List<Object> caseConditions = RawFields.getList((Map<String, Object>) item, "conditions");
                if (caseConditions != null) {
                    conditions.addAll(toConditions(caseConditions));
                }
            }
        }
        return conditions;
    }

    @SuppressWarnings("unchecked")
    private static List<Condition> toConditions(List<Object> raw) {
        List<Condition> conditions = new ArrayList<>(raw.size());
        for (Object item : raw) {
            conditions.add(new Condition(item instanceof Map ? (Map<String, Object>) item : Map.of()));
        }
        return conditions;
    }

    /**
     * One comparison of an if-else node.
     */
    public static final class Condition {

        private final Map<String, Object> fields;

        Condition(Map<String, Object> fields) {
            this.fields = RawFields.copyOf(fields);
        }

        public String getId() {
            return RawFields.getString(fields, "id");
        }

        /**
         * @return the selector path ({@code [nodeId, variable]}), or null when absent or
         *         not a list
         */
        public List<Object> getVariableSelector() {
            return RawFields.getList(fields, "variable_selector");
        }

        public String getComparisonOperator() {
            return RawFields.getString(fields, "comparison_operator");
        }

        public Object getValue() {
            return fields.get("value");
        }
    }
}
