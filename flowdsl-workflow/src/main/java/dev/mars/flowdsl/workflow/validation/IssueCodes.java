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

/**
 * Stable codes carried by {@link ValidationResult.ValidationIssue}. Callers and tests
 * match on these rather than on messages.
 */
public final class IssueCodes {

    // Identity and references
    public static final String DUPLICATE_NODE_ID = "DUPLICATE_NODE_ID";
    public static final String DUPLICATE_EDGE_ID = "DUPLICATE_EDGE_ID";
    public static final String EDGE_INVALID_SOURCE = "EDGE_INVALID_SOURCE";
    public static final String EDGE_INVALID_TARGET = "EDGE_INVALID_TARGET";

    // Entry and exit
    public static final String MISSING_START = "MISSING_START";
    public static final String MISSING_END = "MISSING_END";
    public static final String MULTIPLE_START_NODES = "MULTIPLE_START_NODES";

    // Topology
    public static final String CYCLE_DETECTED = "CYCLE_DETECTED";
    public static final String UNREACHABLE_NODE = "UNREACHABLE_NODE";
    public static final String ISOLATED_NODE = "ISOLATED_NODE";
    public static final String START_HAS_INCOMING = "START_HAS_INCOMING";
    public static final String START_NO_OUTGOING = "START_NO_OUTGOING";
    public static final String END_HAS_OUTGOING = "END_HAS_OUTGOING";
    public static final String END_NO_INCOMING = "END_NO_INCOMING";
    public static final String BRANCH_INSUFFICIENT_EDGES = "BRANCH_INSUFFICIENT_EDGES";
    public static final String AGGREGATOR_INSUFFICIENT_EDGES = "AGGREGATOR_INSUFFICIENT_EDGES";
    public static final String DEAD_END_NODE = "DEAD_END_NODE";

    // Start
    public static final String INVALID_VARIABLE_NAME = "INVALID_VARIABLE_NAME";
    public static final String INVALID_VARIABLE_TYPE = "INVALID_VARIABLE_TYPE";
    public static final String MISSING_SELECT_OPTIONS = "MISSING_SELECT_OPTIONS";

    // LLM
    public static final String MISSING_MODEL_CONFIG = "MISSING_MODEL_CONFIG";
    public static final String MISSING_MODEL_PROVIDER = "MISSING_MODEL_PROVIDER";
    public static final String MISSING_MODEL_NAME = "MISSING_MODEL_NAME";
    public static final String MISSING_PROMPT_TEMPLATE = "MISSING_PROMPT_TEMPLATE";

    // Code
    public static final String MISSING_CODE = "MISSING_CODE";
    public static final String INVALID_CODE_LANGUAGE = "INVALID_CODE_LANGUAGE";
    public static final String MISSING_CODE_OUTPUTS = "MISSING_CODE_OUTPUTS";

    // If-else
    public static final String MISSING_CONDITIONS = "MISSING_CONDITIONS";
    public static final String INVALID_CONDITION_VARIABLE = "INVALID_CONDITION_VARIABLE";
    public static final String MISSING_COMPARISON_OPERATOR = "MISSING_COMPARISON_OPERATOR";

    // HTTP request and template transform
    public static final String MISSING_HTTP_METHOD = "MISSING_HTTP_METHOD";
    public static final String MISSING_HTTP_URL = "MISSING_HTTP_URL";
    public static final String MISSING_TEMPLATE = "MISSING_TEMPLATE";

    // Other node kinds
    public static final String MISSING_EXTRACTOR_MODEL = "MISSING_EXTRACTOR_MODEL";
    public static final String MISSING_EXTRACTOR_PARAMETERS = "MISSING_EXTRACTOR_PARAMETERS";
    public static final String MISSING_AGENT_MODEL = "MISSING_AGENT_MODEL";
    public static final String MISSING_AGENT_TOOLS = "MISSING_AGENT_TOOLS";
    public static final String MISSING_CLASSIFIER_CLASSES = "MISSING_CLASSIFIER_CLASSES";
    public static final String MISSING_LOOP_CONDITION = "MISSING_LOOP_CONDITION";
    public static final String MISSING_LOOP_MAX_ITERATIONS = "MISSING_LOOP_MAX_ITERATIONS";
    public static final String MISSING_DOCUMENT_SELECTOR = "MISSING_DOCUMENT_SELECTOR";
    public static final String MISSING_VARIABLE_ASSIGNMENTS = "MISSING_VARIABLE_ASSIGNMENTS";
    public static final String MISSING_LIST_INPUT_VARIABLES = "MISSING_LIST_INPUT_VARIABLES";
    public static final String MISSING_CONVERSATION_VARIABLES = "MISSING_CONVERSATION_VARIABLES";

    // Advisories
    public static final String UNSUPPORTED_APP_MODE = "UNSUPPORTED_APP_MODE";
    public static final String EDGE_TYPE_MISMATCH = "EDGE_TYPE_MISMATCH";

    private IssueCodes() {
    }
}
