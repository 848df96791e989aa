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

import dev.mars.flowdsl.core.IfElseNodeData;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeKind;

import java.util.List;
import java.util.Map;

/**
 * An if-else node needs at least one condition, either in {@code conditions} or inside
 * {@code cases}. Each condition needs a variable selector and a comparison operator.
 */
public class IfElseFieldRule implements NodeFieldRule {

    @Override
    public NodeKind getKind() {
        return NodeKind.IF_ELSE;
    }

    @Override
    public void validate(Node node, ValidationResult result) {
        IfElseNodeData data = node.getData() instanceof IfElseNodeData
                ? (IfElseNodeData) node.getData()
                : new IfElseNodeData(node.getData().getFields());
        List<IfElseNodeData.Condition> conditions = data.getConditions();

        if (!data.hasConditionList() || conditions.isEmpty()) {
            result.addNodeError(IssueCodes.MISSING_CONDITIONS, node.getId(), "If-else node must have conditions array");
            return;
        }

        for (int index = 0; index < conditions.size(); index++) {
            IfElseNodeData.Condition condition = conditions.get(index);
            Map<String, Object> details = Map.of("index", index);
            List<Object> selector = condition.getVariableSelector();
            if (selector == null || selector.isEmpty()) {
                result.addNodeError(IssueCodes.INVALID_CONDITION_VARIABLE, node.getId(),
                        "Condition at index " + index + " must have valid variable selector", details);
            }
            String operator = condition.getComparisonOperator();
            if (operator == null || operator.isBlank()) {
                result.addNodeError(IssueCodes.MISSING_COMPARISON_OPERATOR, node.getId(),
                        "Condition at index " + index + " must have comparison operator", details);
            }
        }
    }
}
