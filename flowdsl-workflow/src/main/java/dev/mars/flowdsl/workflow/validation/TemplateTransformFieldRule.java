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
import dev.mars.flowdsl.core.TemplateTransformNodeData;

public class TemplateTransformFieldRule implements NodeFieldRule {

    @Override
    public NodeKind getKind() {
        return NodeKind.TEMPLATE_TRANSFORM;
    }

    @Override
    public void validate(Node node, ValidationResult result) {
        TemplateTransformNodeData data = node.getData() instanceof TemplateTransformNodeData
                ? (TemplateTransformNodeData) node.getData()
                : new TemplateTransformNodeData(node.getData().getFields());
        String template = data.getTemplate();
        if (template == null || template.isBlank()) {
            result.addNodeError(IssueCodes.MISSING_TEMPLATE, node.getId(), "Template Transform node must have template");
        }
    }
}
