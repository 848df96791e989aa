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

package dev.mars.flowdsl.workflow.layout;

import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeKind;
import dev.mars.flowdsl.core.Position;
import dev.mars.flowdsl.core.WorkflowDocument;
import dev.mars.flowdsl.workflow.WorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes column/row positions from the edge topology.
 *
 * <h3>Algorithm:</h3>
 * <ol>
 *   <li>Every start node gets level 0. A breadth-first walk assigns each child
 *       {@code max(current level, parent level + 1)}; a node is queued on its first visit
 *       only, so cycles terminate.</li>
 *   <li>Nodes are grouped by level, keeping document order inside a level. A level is a
 *       column at {@code x = originX + level * dx}; its nodes are centred vertically on
 *       {@code originY}, {@code dy} apart.</li>
 *   <li>Nodes that received no level (not reachable from a start, or no start at all)
 *       are stacked downwards from {@code originY} in an overflow column right of the
 *       last level, or in column 0 when no node has a level.</li>
 * </ol>
 *
 * <p>Only positions change; the result is a new document. The same document and config
 * always produce the same positions, and laying out an already laid out document changes
 * nothing.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-13
 * @version 1.0
 */
public class LayoutEngine {
    private static final Logger logger = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutConfig defaultConfig;

    public LayoutEngine() {
        this(LayoutConfig.defaults());
    }

    public LayoutEngine(LayoutConfig defaultConfig) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "Layout config cannot be null");
    }

    public WorkflowDocument layout(WorkflowDocument document) {
        return layout(document, defaultConfig);
    }

    public WorkflowDocument layout(WorkflowDocument document, LayoutConfig config) {
        Objects.requireNonNull(document, "Document cannot be null");
        Objects.requireNonNull(config, "Layout config cannot be null");

        Map<String, Integer> levels = assignLevels(WorkflowGraph.of(document));

        TreeMap<Integer, List<Integer>> columns = new TreeMap<>();
        List<Integer> overflow = new ArrayList<>();
        List<Node> nodes = document.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            Integer level = levels.get(nodes.get(i).getId());
            if (level != null) {
                columns.computeIfAbsent(level, key -> new ArrayList<>()).add(i);
            } else {
                overflow.add(i);
            }
        }

        Position[] positions = new Position[nodes.size()];
        for (Map.Entry<Integer, List<Integer>> column : columns.entrySet()) {
            List<Integer> members = column.getValue();
            double x = config.getOriginX() + column.getKey() * config.getSpacingX();
            double centre = (members.size() - 1) / 2.0;
            for (int row = 0; row < members.size(); row++) {
                double y = config.getOriginY() + (row - centre) * config.getSpacingY();
                positions[members.get(row)] = new Position(x, y);
            }
        }

        int overflowLevel = columns.isEmpty() ? 0 : columns.lastKey() + 1;
        double overflowX = config.getOriginX() + overflowLevel * config.getSpacingX();
        for (int row = 0; row < overflow.size(); row++) {
            positions[overflow.get(row)] = new Position(overflowX, config.getOriginY() + row * config.getSpacingY());
        }

        List<Node> placed = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            placed.add(nodes.get(i).withPosition(positions[i]));
        }

        logger.debug("Laid out {} node(s) in {} column(s), {} in overflow",
                nodes.size(), columns.size(), overflow.size());
        return document.withNodes(placed);
    }

    /**
     * Breadth-first levels from the start nodes, keyed by node id.
     */
    Map<String, Integer> assignLevels(WorkflowGraph graph) {
        Map<String, Integer> levels = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();

        for (String start : graph.getNodesOfKind(NodeKind.START)) {
            levels.put(start, 0);
            visited.add(start);
            queue.add(start);
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int childLevel = levels.get(current) + 1;
            for (String child : graph.getSuccessors(current)) {
                levels.merge(child, childLevel, Math::max);
                if (visited.add(child)) {
                    queue.add(child);
                }
            }
        }
        return levels;
    }
}
