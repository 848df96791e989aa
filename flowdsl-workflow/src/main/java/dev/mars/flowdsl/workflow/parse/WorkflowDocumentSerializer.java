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

package dev.mars.flowdsl.workflow.parse;

import dev.mars.flowdsl.core.AppMetadata;
import dev.mars.flowdsl.core.Edge;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.Viewport;
import dev.mars.flowdsl.core.WorkflowDocument;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a {@link WorkflowDocument} back to block-style YAML.
 *
 * <p>The output uses the same schema {@link YamlWorkflowDocumentParser} reads, including
 * every key the engine did not interpret, so parsing the output yields an equal
 * document.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-11
 * @version 1.0
 */
public class WorkflowDocumentSerializer {

    public String serialize(WorkflowDocument document) {
        Objects.requireNonNull(document, "Document cannot be null");
        return newYaml().dump(toTree(document));
    }

    private Map<String, Object> toTree(WorkflowDocument document) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("app", appTree(document.getApp()));
        root.put("kind", document.getKind());
        root.put("version", document.getVersion());

        Map<String, Object> workflow = new LinkedHashMap<>(document.getWorkflowAttributes());
        Map<String, Object> graph = new LinkedHashMap<>(document.getGraphAttributes());
        List<Object> edges = new ArrayList<>();
        for (Edge edge : document.getEdges()) {
            edges.add(edgeTree(edge));
        }
        List<Object> nodes = new ArrayList<>();
        for (Node node : document.getNodes()) {
            nodes.add(nodeTree(node));
        }
        graph.put("edges", edges);
        graph.put("nodes", nodes);
        document.getViewport().ifPresent(viewport -> graph.put("viewport", viewportTree(viewport)));
        workflow.put("graph", graph);
        root.put("workflow", workflow);

        root.putAll(document.getExtensions());
        return root;
    }

    private static Map<String, Object> appTree(AppMetadata app) {
        Map<String, Object> tree = new LinkedHashMap<>();
        if (app.getDescription() != null) {
            tree.put("description", app.getDescription());
        }
        tree.put("icon", app.getIcon());
        tree.put("icon_background", app.getIconBackground());
        tree.put("mode", app.getMode());
        tree.put("name", app.getName());
        tree.putAll(app.getExtras());
        return tree;
    }

    private static Map<String, Object> nodeTree(Node node) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("id", node.getId());
        tree.put("type", node.getType());
        tree.put("data", new LinkedHashMap<>(node.getData().getFields()));
        Map<String, Object> position = new LinkedHashMap<>();
        position.put("x", node.getPosition().getX());
        position.put("y", node.getPosition().getY());
        tree.put("position", position);
        tree.putAll(node.getExtras());
        return tree;
    }

    private static Map<String, Object> edgeTree(Edge edge) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("id", edge.getId());
        tree.put("source", edge.getSource());
        tree.put("sourceHandle", edge.getSourceHandle());
        tree.put("target", edge.getTarget());
        tree.put("targetHandle", edge.getTargetHandle());
        tree.put("type", edge.getType());
        if (edge.getZIndex() != null) {
            tree.put("zIndex", edge.getZIndex());
        }

        Edge.EdgeData data = edge.getData();
        Map<String, Object> dataTree = new LinkedHashMap<>();
        dataTree.put("isInIteration", data.isInIteration());
        if (data.getSourceType() != null) {
            dataTree.put("sourceType", data.getSourceType());
        }
        if (data.getTargetType() != null) {
            dataTree.put("targetType", data.getTargetType());
        }
        dataTree.putAll(data.getExtras());
        tree.put("data", dataTree);

        tree.putAll(edge.getExtras());
        return tree;
    }

    private static Map<String, Object> viewportTree(Viewport viewport) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("x", viewport.getX());
        tree.put("y", viewport.getY());
        tree.put("zoom", viewport.getZoom());
        return tree;
    }

    private static Yaml newYaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setAllowUnicode(true);
        options.setSplitLines(false);
        return new Yaml(options);
    }
}
