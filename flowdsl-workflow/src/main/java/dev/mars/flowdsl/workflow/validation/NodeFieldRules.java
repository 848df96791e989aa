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

import dev.mars.flowdsl.core.NodeKind;
import dev.mars.flowdsl.workflow.validation.RequiredFieldRule.Requirement;

import java.util.List;

/**
 * The built-in field rules, one per node kind that has required fields.
 */
public final class NodeFieldRules {

    private NodeFieldRules() {
    }

    public static List<NodeFieldRule> defaults() {
        return List.of(
                new StartFieldRule(),
                new LlmFieldRule(),
                new CodeFieldRule(),
                new IfElseFieldRule(),
                new HttpRequestFieldRule(),
                new TemplateTransformFieldRule(),
                new RequiredFieldRule(NodeKind.PARAMETER_EXTRACTOR, List.of(
                        Requirement.present("model", IssueCodes.MISSING_EXTRACTOR_MODEL,
                                "Parameter Extractor node must have model configuration"),
                        Requirement.list("parameters", IssueCodes.MISSING_EXTRACTOR_PARAMETERS,
                                "Parameter Extractor node must have parameters array"))),
                new RequiredFieldRule(NodeKind.AGENT, List.of(
                        Requirement.present("model", IssueCodes.MISSING_AGENT_MODEL,
                                "Agent node must have model configuration"),
                        Requirement.list("tools", IssueCodes.MISSING_AGENT_TOOLS,
                                "Agent node must have tools array"))),
                new RequiredFieldRule(NodeKind.QUESTION_CLASSIFIER, List.of(
                        Requirement.list("classes", IssueCodes.MISSING_CLASSIFIER_CLASSES,
                                "Question Classifier node must have classes array"))),
                new RequiredFieldRule(NodeKind.LOOP, List.of(
                        Requirement.present("loop_termination_condition", IssueCodes.MISSING_LOOP_CONDITION,
                                "Loop node must have termination condition"),
                        Requirement.number("max_iterations", IssueCodes.MISSING_LOOP_MAX_ITERATIONS,
                                "Loop node must have max_iterations number"))),
                new RequiredFieldRule(NodeKind.DOCUMENT_EXTRACTOR, List.of(
                        Requirement.list("variable_selector", IssueCodes.MISSING_DOCUMENT_SELECTOR,
                                "Document Extractor node must have variable_selector"))),
                new RequiredFieldRule(NodeKind.VARIABLE_ASSIGNER, List.of(
                        Requirement.list("assignments", IssueCodes.MISSING_VARIABLE_ASSIGNMENTS,
                                "Variable Assigner node must have assignments array"))),
                new RequiredFieldRule(NodeKind.LIST_OPERATOR, List.of(
                        Requirement.list("input_variables", IssueCodes.MISSING_LIST_INPUT_VARIABLES,
                                "List Operator node must have input_variables array"))),
                new RequiredFieldRule(NodeKind.CONVERSATION_VARIABLES, List.of(
                        Requirement.list("conversation_variables", IssueCodes.MISSING_CONVERSATION_VARIABLES,
                                "Conversation Variables node must have conversation_variables array"))));
    }
}
