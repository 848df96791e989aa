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

import dev.mars.flowdsl.core.LlmNodeData;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeKind;

/**
 * An LLM node needs a model with provider and name, and a prompt template.
 */
public class LlmFieldRule implements NodeFieldRule {

    @Override
    public NodeKind getKind() {
        return NodeKind.LLM;
    }

    @Override
    public void validate(Node node, ValidationResult result) {
        LlmNodeData data = node.getData() instanceof LlmNodeData
                ? (LlmNodeData) node.getData()
                : new LlmNodeData(node.getData().getFields());

        if (!data.hasModel()) {
            result.addNodeError(IssueCodes.MISSING_MODEL_CONFIG, node.getId(), "LLM node must have model configuration");
        } else {
            if (isBlank(data.getModelProvider())) {
                result.addNodeError(IssueCodes.MISSING_MODEL_PROVIDER, node.getId(), "LLM node must specify model provider");
            }
            if (isBlank(data.getModelName())) {
                result.addNodeError(IssueCodes.MISSING_MODEL_NAME, node.getId(), "LLM node must specify model name");
            }
        }

        if (!data.hasPromptTemplate()) {
            result.addNodeError(IssueCodes.MISSING_PROMPT_TEMPLATE, node.getId(), "LLM node must have prompt template");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
