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

/**
 * Required-field check for the {@code data} payload of one node kind.
 *
 * <p>Implementations add one issue per violation and must not throw. They are registered
 * with the {@link SemanticValidator} by {@link #getKind() kind}; a kind without a rule
 * skips field validation.</p>
 */
public interface NodeFieldRule {

    NodeKind getKind();

    void validate(Node node, ValidationResult result);
}
