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

import dev.mars.flowdsl.core.HttpRequestNodeData;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeKind;

public class HttpRequestFieldRule implements NodeFieldRule {

    @Override
    public NodeKind getKind() {
        return NodeKind.HTTP_REQUEST;
    }

    @Override
    public void validate(Node node, ValidationResult result) {
        HttpRequestNodeData data = node.getData() instanceof HttpRequestNodeData
                ? (HttpRequestNodeData) node.getData()
                : new HttpRequestNodeData(node.getData().getFields());
        if (data.getMethod() == null || data.getMethod().isBlank()) {
            result.addNodeError(IssueCodes.MISSING_HTTP_METHOD, node.getId(), "HTTP Request node must have method");
        }
        if (data.getUrl() == null || data.getUrl().isBlank()) {
            result.addNodeError(IssueCodes.MISSING_HTTP_URL, node.getId(), "HTTP Request node must have URL");
        }
    }
}
