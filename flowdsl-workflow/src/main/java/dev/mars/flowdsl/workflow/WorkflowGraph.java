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

package dev.mars.flowdsl.workflow;

import dev.mars.flowdsl.core.Edge;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeKind;
import dev.mars.flowdsl.core.WorkflowDocument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed view of a document's nodes and edges.
 *
 * <p>Node ids keep document order; when an id repeats, the first node wins. Edges whose
 * source or target is not a known node id are left out, so they count towards no degree
 * and are never traversed. Adjacency lists keep edge declaration order, which makes every
 * traversal below deterministic.</p>
 *
 * <p>All traversals use explicit stacks or queues, so graph size is bounded by heap
 * rather than by thread stack depth.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-12
 * @version 1.0
 */
public class WorkflowGraph {

    private final Map<String, NodeKind> kinds;
    private final Map<String, List<String>> outgoing;
    private final Map<String, List<String>> incoming;

    private WorkflowGraph(Map<String, NodeKind> kinds) {
        this.kinds = kinds;
        this.outgoing = new HashMap<>();
        this.incoming = new HashMap<>();
        for (String id : kinds.keySet()) {
            outgoing.put(id, new ArrayList<>());
            incoming.put(id, new ArrayList<>());
        }
    }

    /**
     * Builds the graph for the given document.
     */
    public static WorkflowGraph of(WorkflowDocument document) {
        Objects.requireNonNull(document, "Document cannot be null");

        Map<String, NodeKind> kinds = new LinkedHashMap<>();
        for (Node node : document.getNodes()) {
            kinds.putIfAbsent(node.getId(), node.getKind());
        }

        WorkflowGraph graph = new WorkflowGraph(kinds);
        for (Edge edge : document.getEdges()) {
            if (graph.containsNode(edge.getSource()) && graph.containsNode(edge.getTarget())) {
                graph.outgoing.get(edge.getSource()).add(edge.getTarget());
                graph.incoming.get(edge.getTarget()).add(edge.getSource());
            }
        }
        return graph;
    }

    public boolean containsNode(String nodeId) {
        return kinds.containsKey(nodeId);
    }

    /**
     * @return the distinct node ids in document order
     */
    public Set<String> getNodeIds() {
        return Collections.unmodifiableSet(kinds.keySet());
    }

    public NodeKind getKind(String nodeId) {
        return kinds.getOrDefault(nodeId, NodeKind.UNKNOWN);
    }

    public List<String> getNodesOfKind(NodeKind kind) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, NodeKind> entry : kinds.entrySet()) {
            if (entry.getValue() == kind) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public List<String> getSuccessors(String nodeId) {
        return List.copyOf(outgoing.getOrDefault(nodeId, List.of()));
    }

    public List<String> getPredecessors(String nodeId) {
        return List.copyOf(incoming.getOrDefault(nodeId, List.of()));
    }

    public int getOutDegree(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of()).size();
    }

    public int getInDegree(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of()).size();
    }

    /**
     * Collects every node reachable from any of the roots, roots included.
     */
    public Set<String> reachableFrom(Collection<String> roots) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String root : roots) {
            if (containsNode(root) && visited.add(root)) {
                queue.add(root);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : outgoing.get(current)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    /**
     * Finds the cycles closed by back-edges of a depth-first search.
     *
     * <p>Roots are tried in node order and successors in edge declaration order. Each time
     * an edge points at a node that is still on the search path, the path segment from that
     * node to the current node is reported, closed with the node itself. For
     * {@code S -> A -> S} the result is {@code [[S, A, S]]}.</p>
     *
     * @return one closed path per back-edge, in discovery order
     */
    public List<List<String>> findCycles() {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> finished = new HashSet<>();
        Map<String, Integer> onPath = new HashMap<>();
        List<String> path = new ArrayList<>();

        for (String root : kinds.keySet()) {
            if (finished.contains(root)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root, outgoing.get(root).iterator()));
            onPath.put(root, path.size());
            path.add(root);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    Integer pathIndex = onPath.get(next);
                    if (pathIndex != null) {
                        List<String> cycle = new ArrayList<>(path.subList(pathIndex, path.size()));
                        cycle.add(next);
                        cycles.add(List.copyOf(cycle));
                    } else if (!finished.contains(next)) {
                        stack.push(new Frame(next, outgoing.get(next).iterator()));
                        onPath.put(next, path.size());
                        path.add(next);
                    }
                } else {
                    stack.pop();
                    onPath.remove(frame.nodeId);
                    path.remove(path.size() - 1);
                    finished.add(frame.nodeId);
                }
            }
        }
        return cycles;
    }

    @Override
    public String toString() {
        return "WorkflowGraph{" +
               "nodes=" + kinds.size() +
               ", edges=" + outgoing.values().stream().mapToInt(List::size).sum() +
               '}';
    }

    private static final class Frame {
        private final String nodeId;
        private final Iterator<String> successors;

        private Frame(String nodeId, Iterator<String> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }
    }
}
