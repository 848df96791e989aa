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

package dev.mars.flowdsl.workflow.validation;

import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeKind;
import dev.mars.flowdsl.core.StartNodeData;

import java.util.List;
import java.util.Map;

/**
 * Checks the input variables of a start node: each needs a name and a known type, and a
 * {@code select} variable needs options.
 */
public class StartFieldRule implements NodeFieldRule {

    @Override
    public NodeKind getKind() {
        return NodeKind.START;
    }

    @Override
    public void validate(Node node, ValidationResult result) {
        StartNodeData data = node.getData() instanceof StartNodeData
                ? (StartNodeData) node.getData()
                : new StartNodeData(node.getData().getFields());
        List<StartNodeData.Variable> variables = data.getVariables();
        for (int index = 0; index < variables.size(); index++) {
            StartNodeData.Variable variable = variables.get(index);
            String name = variable.getName();
            Map<String, Object> details = Map.of("index", index);

            if (name == null || name.isBlank()) {
                result.addNodeError(IssueCodes.INVALID_VARIABLE_NAME, node.getId(),
                        "Variable at index " + index + " must have a valid name", details);
            }
            String label = name != null && !name.isBlank() ? "\"" + name + "\"" : "at index " + index;
            String type = variable.getType();
            if (type == null || !StartNodeData.VARIABLE_TYPES.contains(type)) {
                result.addNodeError(IssueCodes.INVALID_VARIABLE_TYPE, node.getId(),
                        "Variable " + label + " has invalid type " + (type == null ? "(none)" : "'" + type + "'"), details);
            }
            if ("select".equals(type) && !variable.hasOptions()) {
                result.addNodeError(IssueCodes.MISSING_SELECT_OPTIONS, node.getId(),
                        "Select variable " + label + " must have options", details);
            }
        }
    }
}
