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

import dev.mars.flowdsl.core.Edge;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeKind;
import dev.mars.flowdsl.core.WorkflowDocument;
import dev.mars.flowdsl.workflow.WorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks graph invariants and per-kind field requirements of a {@link WorkflowDocument}.
 *
 * <h3>Check Order:</h3>
 * <ol>
 *   <li>duplicate node and edge ids</li>
 *   <li>edge references to missing nodes; such edges take no part in later checks</li>
 *   <li>presence of start and end nodes</li>
 *   <li>cycles, unless every node on the cycle is loop-capable</li>
 *   <li>reachability from the start nodes, and isolated nodes</li>
 *   <li>edge counts per node kind</li>
 *   <li>required {@code data} fields through the registered {@link NodeFieldRule}s</li>
 *   <li>advisory warnings on app mode and edge type hints</li>
 * </ol>
 *
 * <p>The validator never throws for a document, however degenerate, and always returns a
 * complete result. It keeps no state between calls and may be shared across threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-12
 * @version 1.0
 */
public class SemanticValidator {
    private static final Logger logger = LoggerFactory.getLogger(SemanticValidator.class);

    /**
     * App modes the runtime can execute.
     */
    public static final Set<String> SUPPORTED_APP_MODES = Set.of("workflow", "advanced-chat", "agent-chat", "chat");

    private final Map<NodeKind, NodeFieldRule> fieldRules;

    public SemanticValidator() {
        this(NodeFieldRules.defaults());
    }

    /**
     * @param rules field rules; a later rule for the same kind replaces an earlier one
     */
    public SemanticValidator(Collection<NodeFieldRule> rules) {
        Objects.requireNonNull(rules, "Field rules cannot be null");
        this.fieldRules = new EnumMap<>(NodeKind.class);
        for (NodeFieldRule rule : rules) {
            fieldRules.put(rule.getKind(), rule);
        }
    }

    public ValidationResult validate(WorkflowDocument document) {
        Objects.requireNonNull(document, "Document cannot be null");
        ValidationResult result = new ValidationResult();

        checkDuplicateIds(document, result);
        checkEdgeReferences(document, result);

        WorkflowGraph graph = WorkflowGraph.of(document);
        List<String> startNodes = graph.getNodesOfKind(NodeKind.START);

        checkEntryAndExit(graph, startNodes, result);
        checkCycles(graph, result);
        Set<String> reachable = checkReachability(graph, startNodes, result);
        checkEdgeCounts(graph, startNodes, reachable, result);
        checkFields(document, result);
        checkAdvisories(document, graph, result);

        logger.debug("Validated workflow '{}': {} error(s), {} warning(s)",
                document.getApp().getName(), result.getErrorCount(), result.getWarningCount());
        return result;
    }

    private void checkDuplicateIds(WorkflowDocument document, ValidationResult result) {
        Set<String> nodeIds = new HashSet<>();
        List<Node> nodes = document.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            String id = nodes.get(i).getId();
            if (!nodeIds.add(id)) {
                result.addNodeError(IssueCodes.DUPLICATE_NODE_ID, id,
                        "Duplicate node id '" + id + "'", Map.of("index", i));
            }
        }

        Set<String> edgeIds = new HashSet<>();
        List<Edge> edges = document.getEdges();
        for (int i = 0; i < edges.size(); i++) {
            String id = edges.get(i).getId();
            if (!edgeIds.add(id)) {
                result.addEdgeError(IssueCodes.DUPLICATE_EDGE_ID, id,
                        "Duplicate edge id '" + id + "'", Map.of("index", i));
            }
        }
    }

    private void checkEdgeReferences(WorkflowDocument document, ValidationResult result) {
        Set<String> nodeIds = new HashSet<>();
        for (Node node : document.getNodes()) {
            nodeIds.add(node.getId());
        }
        for (Edge edge : document.getEdges()) {
            if (!nodeIds.contains(edge.getSource())) {
                result.addEdgeError(IssueCodes.EDGE_INVALID_SOURCE, edge.getId(),
                        "Edge '" + edge.getId() + "' references missing source node '" + edge.getSource() + "'",
                        Map.of("missingNodeId", edge.getSource()));
            }
            if (!nodeIds.contains(edge.getTarget())) {
                result.addEdgeError(IssueCodes.EDGE_INVALID_TARGET, edge.getId(),
                        "Edge '" + edge.getId() + "' references missing target node '" + edge.getTarget() + "'",
                        Map.of("missingNodeId", edge.getTarget()));
            }
        }
    }

    private void checkEntryAndExit(WorkflowGraph graph, List<String> startNodes, ValidationResult result) {
        if (startNodes.isEmpty()) {
            result.addError(IssueCodes.MISSING_START, "Workflow must have a start node");
        } else if (startNodes.size() > 1) {
            result.addWarning(IssueCodes.MULTIPLE_START_NODES,
                    "Workflow has " + startNodes.size() + " start nodes: " + startNodes);
        }
        if (graph.getNodesOfKind(NodeKind.END).isEmpty()) {
            result.addError(IssueCodes.MISSING_END, "Workflow must have an end node");
        }
    }

    private void checkCycles(WorkflowGraph graph, ValidationResult result) {
        for (List<String> cycle : graph.findCycles()) {
            boolean allowed = cycle.stream().allMatch(id -> graph.getKind(id).isLoopCapable());
            if (allowed) {
                logger.debug("Cycle {} is made of loop-capable nodes only", cycle);
                continue;
            }
            result.addNodeError(IssueCodes.CYCLE_DETECTED, cycle.get(0),
                    "Cycle detected: " + String.join(" -> ", cycle), Map.of("path", cycle));
        }
    }

    private Set<String> checkReachability(WorkflowGraph graph, List<String> startNodes, ValidationResult result) {
        for (String id : graph.getNodeIds()) {
            if (isIsolated(graph, id)) {
                result.addNodeError(IssueCodes.ISOLATED_NODE, id, "Node '" + id + "' has no connections");
            }
        }
        if (startNodes.isEmpty()) {
            return Set.of();
        }

        Set<String> reachable = graph.reachableFrom(startNodes);
        for (String id : graph.getNodeIds()) {
            NodeKind kind = graph.getKind(id);
            if (kind == NodeKind.START || reachable.contains(id) || isIsolated(graph, id)) {
                continue;
            }
            result.addNodeError(IssueCodes.UNREACHABLE_NODE, id, "Node '" + id + "' is not reachable from a start node");
        }
        return reachable;
    }

    private static boolean isIsolated(WorkflowGraph graph, String id) {
        NodeKind kind = graph.getKind(id);
        return kind != NodeKind.START && kind != NodeKind.END
                && graph.getInDegree(id) == 0 && graph.getOutDegree(id) == 0;
    }

    private void checkEdgeCounts(WorkflowGraph graph, List<String> startNodes, Set<String> reachable,
                                 ValidationResult result) {
        for (String id : graph.getNodeIds()) {
            NodeKind kind = graph.getKind(id);
            int in = graph.getInDegree(id);
            int out = graph.getOutDegree(id);

            if (kind == NodeKind.START) {
                if (in > 0) {
                    result.addNodeError(IssueCodes.START_HAS_INCOMING, id, "Start node must not have incoming edges");
                }
                if (out == 0) {
                    result.addNodeError(IssueCodes.START_NO_OUTGOING, id, "Start node must have at least one outgoing edge");
                }
            } else if (kind == NodeKind.END) {
                if (out > 0) {
                    result.addNodeError(IssueCodes.END_HAS_OUTGOING, id, "End node must not have outgoing edges");
                }
                if (in == 0) {
                    result.addNodeError(IssueCodes.END_NO_INCOMING, id, "End node must have at least one incoming edge");
                }
            }

            if (kind.isBranch() && out < 2) {
                result.addNodeError(IssueCodes.BRANCH_INSUFFICIENT_EDGES, id,
                        "Branch node must have at least 2 outgoing edges, found " + out);
            }
            if (kind.isAggregator() && in < 2) {
                result.addNodeError(IssueCodes.AGGREGATOR_INSUFFICIENT_EDGES, id,
                        "Aggregator node must have at least 2 incoming edges, found " + in);
            }

            if (!startNodes.isEmpty() && reachable.contains(id) && !kind.isTerminal()
                    && kind != NodeKind.START && in > 0 && out == 0) {
                result.addNodeWarning(IssueCodes.DEAD_END_NODE, id,
                        "Node '" + id + "' has no outgoing edge and is not an end node");
            }
        }
    }

    private void checkFields(WorkflowDocument document, ValidationResult result) {
        for (Node node : document.getNodes()) {
            NodeFieldRule rule = fieldRules.get(node.getKind());
            if (rule != null) {
                rule.validate(node, result);
            }
        }
    }

    private void checkAdvisories(WorkflowDocument document, WorkflowGraph graph, ValidationResult result) {
        String mode = document.getApp().getMode();
        if (!SUPPORTED_APP_MODES.contains(mode)) {
            result.addWarning(IssueCodes.UNSUPPORTED_APP_MODE, "App mode '" + mode + "' is not supported");
        }

        Map<String, String> types = new HashMap<>();
        for (Node node : document.getNodes()) {
            types.putIfAbsent(node.getId(), node.getType());
        }
        for (Edge edge : document.getEdges()) {
            if (!graph.containsNode(edge.getSource()) || !graph.containsNode(edge.getTarget())) {
                continue;
            }
            checkTypeHint(edge, "sourceType", edge.getData().getSourceType(), types.get(edge.getSource()), result);
            checkTypeHint(edge, "targetType", edge.getData().getTargetType(), types.get(edge.getTarget()), result);
        }
    }

    private static void checkTypeHint(Edge edge, String field, String declared, String actual, ValidationResult result) {
        if (declared == null || declared.isEmpty() || declared.equals(actual)) {
            return;
        }
        result.addEdgeWarning(IssueCodes.EDGE_TYPE_MISMATCH, edge.getId(),
                "Edge '" + edge.getId() + "' declares " + field + " '" + declared + "' but the node type is '" + actual + "'",
                Map.of("field", field, "declared", declared, "actual", actual));
    }
}
