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

import java.util.HashMap;
import java.util.Map;

/**
 * Enumeration of the node kinds recognised by the workflow DSL.
 *
 * <p>Each constant carries the wire name used in the {@code type} field of a node record.
 * Node types that are not listed here resolve to {@link #UNKNOWN}; such nodes still take
 * part in every graph-level check but have no per-kind field schema.</p>
 *
 * <h3>Graph Roles:</h3>
 * <ul>
 *   <li><strong>Branch kinds</strong> ({@code if-else}) need at least two outgoing edges</li>
 *   <li><strong>Aggregator kinds</strong> ({@code variable-aggregator}, {@code variable-assigner})
 *       need at least two incoming edges</li>
 *   <li><strong>Loop-capable kinds</strong> ({@code loop}, {@code iteration}) may sit on a
 *       directed cycle</li>
 *   <li><strong>Terminal kinds</strong> ({@code end}, {@code answer}) may have no outgoing edge</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public enum NodeKind {

    START("start"),
    END("end"),
    ANSWER("answer"),
    LLM("llm"),
    AGENT("agent"),
    CODE("code"),
    TEMPLATE_TRANSFORM("template-transform"),
    PARAMETER_EXTRACTOR("parameter-extractor"),
    VARIABLE_AGGREGATOR("variable-aggregator"),
    VARIABLE_ASSIGNER("variable-assigner"),
    KNOWLEDGE_RETRIEVAL("knowledge-retrieval"),
    DOCUMENT_EXTRACTOR("document-extractor"),
    IF_ELSE("if-else"),
    LOOP("loop"),
    ITERATION("iteration"),
    QUESTION_CLASSIFIER("question-classifier"),
    HTTP_REQUEST("http-request"),
    TOOL("tool"),
    LIST_OPERATOR("list-operator"),
    CONVERSATION_VARIABLES("conversation-variables"),

    /**
     * Any node type without a dedicated constant.
     */
    UNKNOWN("");

    private static final Map<String, NodeKind> BY_WIRE_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (kind != UNKNOWN) {
                BY_WIRE_NAME.put(kind.wireName, kind);
                BY_WIRE_NAME.put(kind.wireName.replace('-', '_'), kind);
            }
        }
    }

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the name used for this kind in DSL text.
     *
     * @return the wire name, empty for {@link #UNKNOWN}
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a node {@code type} string. Both the hyphenated and the underscore spelling
     * ({@code if-else} / {@code if_else}) are accepted.
     *
     * @param type the raw node type, may be null
     * @return the matching kind, or {@link #UNKNOWN}
     */
    public static NodeKind fromWireName(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        return BY_WIRE_NAME.getOrDefault(type.trim(), UNKNOWN);
    }

    public boolean isBranch() {
        return this == IF_ELSE;
    }

    public boolean isAggregator() {
        return this == VARIABLE_AGGREGATOR || this == VARIABLE_ASSIGNER;
    }

    public boolean isLoopCapable() {
        return this == LOOP || this == ITERATION;
    }

    public boolean isTerminal() {
        return this == END || this == ANSWER;
    }
}
