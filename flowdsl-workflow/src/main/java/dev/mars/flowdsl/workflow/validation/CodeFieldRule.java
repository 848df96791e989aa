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

import dev.mars.flowdsl.core.CodeNodeData;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeKind;

/**
 * A code node needs source code, a supported language and declared outputs.
 */
public class CodeFieldRule implements NodeFieldRule {

    @Override
    public NodeKind getKind() {
        return NodeKind.CODE;
    }

    @Override
    public void validate(Node node, ValidationResult result) {
        CodeNodeData data = node.getData() instanceof CodeNodeData
                ? (CodeNodeData) node.getData()
                : new CodeNodeData(node.getData().getFields());

        if (data.getCode() == null || data.getCode().isBlank()) {
            result.addNodeError(IssueCodes.MISSING_CODE, node.getId(), "Code node must have code content");
        }
        if (!data.isSupportedLanguage()) {
            result.addNodeError(IssueCodes.INVALID_CODE_LANGUAGE, node.getId(),
                    "Code node must specify valid language (python3 or javascript)");
        }
        if (!data.hasOutputs()) {
            result.addNodeError(IssueCodes.MISSING_CODE_OUTPUTS, node.getId(), "Code node must define outputs");
        }
    }
}
