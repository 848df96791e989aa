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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root value of the workflow DSL: app metadata plus the node/edge graph.
 *
 * <p>A document is created either by the structural parser from text or by the layout
 * engine as a repositioned copy of an existing document. It is immutable once built;
 * editing means producing a new document through one of the {@code with*} methods or a
 * {@link #toBuilder() builder} and running it through validation again.</p>
 *
 * <h3>Lossless Export:</h3>
 * <p>Besides the modelled graph, a document carries three raw attribute maps so that an
 * export writes back everything the engine did not interpret:</p>
 * <ul>
 *   <li>{@link #getWorkflowAttributes()}: keys of the {@code workflow} section other than
 *       {@code graph} ({@code environment_variables}, {@code conversation_variables},
 *       {@code features}, ...)</li>
 *   <li>{@link #getGraphAttributes()}: keys of {@code workflow.graph} other than
 *       {@code nodes}, {@code edges} and {@code viewport}</li>
 *   <li>{@link #getExtensions()}: unknown top-level keys</li>
 * </ul>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * WorkflowDocument document = WorkflowDocument.builder()
 *     .app(new AppMetadata("Translator", "workflow", "🤖", "#EFF1F5", null))
 *     .version("0.1.5")
 *     .node(Node.of("start", "start", Position.ORIGIN, Map.of("title", "Start")))
 *     .node(Node.of("end", "end", Position.ORIGIN, Map.of("title", "End")))
 *     .edge(Edge.of("start-end", "start", "end"))
 *     .build();
 * }</pre>
 *
 * <h3>Thread Safety:</h3>
 * <p>Instances are immutable and may be shared freely between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public class WorkflowDocument {

    /**
     * The only {@code kind} value the runtime accepts.
     */
    public static final String KIND_APP = "app";

    private final AppMetadata app;
    private final String kind;
    private final String version;
    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Viewport viewport;
    private final Map<String, Object> workflowAttributes;
    private final Map<String, Object> graphAttributes;
    private final Map<String, Object> extensions;

    private WorkflowDocument(Builder builder) {
        this.app = Objects.requireNonNull(builder.app, "App metadata cannot be null");
        this.kind = builder.kind != null ? builder.kind : KIND_APP;
        this.version = Objects.requireNonNull(builder.version, "Version cannot be null");
        this.nodes = List.copyOf(builder.nodes);
        this.edges = List.copyOf(builder.edges);
        this.viewport = builder.viewport;
        this.workflowAttributes = RawFields.copyOf(builder.workflowAttributes);
        this.graphAttributes = RawFields.copyOf(builder.graphAttributes);
        this.extensions = RawFields.copyOf(builder.extensions);
    }

    public AppMetadata getApp() {
        return app;
    }

    public String getKind() {
        return kind;
    }

    public String getVersion() {
        return version;
    }

    /**
     * @return the nodes in declaration order, never null
     */
    public List<Node> getNodes() {
        return nodes;
    }

    /**
     * @return the edges in declaration order, never null
     */
    public List<Edge> getEdges() {
        return edges;
    }

    /**
     * @return the stored viewport, or empty when the document has none
     */
    public Optional<Viewport> getViewport() {
        return Optional.ofNullable(viewport);
    }

    public Map<String, Object> getWorkflowAttributes() {
        return workflowAttributes;
    }

    public Map<String, Object> getGraphAttributes() {
        return graphAttributes;
    }

    public Map<String, Object> getExtensions() {
        return extensions;
    }

    /**
     * Returns {@code workflow.environment_variables}, or an empty list when absent.
     */
    public List<Object> getEnvironmentVariables() {
        List<Object> variables = RawFields.getList(workflowAttributes, "environment_variables");
        return variables != null ? variables : List.of();
    }

    /**
     * Returns {@code workflow.features}, or an empty map when absent.
     */
    public Map<String, Object> getFeatures() {
        Map<String, Object> features = RawFields.getMap(workflowAttributes, "features");
        return features != null ? features : Map.of();
    }

    /**
     * Finds the first node with the given id.
     */
    public Optional<Node> findNode(String nodeId) {
        for (Node node : nodes) {
            if (node.getId().equals(nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public WorkflowDocument withNodes(List<Node> newNodes) {
        return toBuilder().nodes(newNodes).build();
    }

    public WorkflowDocument withEdges(List<Edge> newEdges) {
        return toBuilder().edges(newEdges).build();
    }

    public WorkflowDocument withViewport(Viewport newViewport) {
        return toBuilder().viewport(newViewport).build();
    }

    /**
     * Returns a builder pre-populated with this document's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .app(app)
                .kind(kind)
                .version(version)
                .nodes(nodes)
                .edges(edges)
                .viewport(viewport)
                .workflowAttributes(workflowAttributes)
                .graphAttributes(graphAttributes)
                .extensions(extensions);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDocument that = (WorkflowDocument) o;
        return Objects.equals(app, that.app) &&
               Objects.equals(kind, that.kind) &&
               Objects.equals(version, that.version) &&
               Objects.equals(nodes, that.nodes) &&
               Objects.equals(edges, that.edges) &&
               Objects.equals(viewport, that.viewport) &&
               Objects.equals(workflowAttributes, that.workflowAttributes) &&
               Objects.equals(graphAttributes, that.graphAttributes) &&
               Objects.equals(extensions, that.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(app, kind, version, nodes, edges, viewport,
                workflowAttributes, graphAttributes, extensions);
    }

    @Override
    public String toString() {
        return "WorkflowDocument{" +
               "app=" + app.getName() +
               ", version='" + version + '\'' +
               ", nodes=" + nodes.size() +
               ", edges=" + edges.size() +
               '}';
    }

    /**
     * Builder for {@link WorkflowDocument}. {@code app} and {@code version} are required;
     * {@code kind} defaults to {@value #KIND_APP}.
     */
    public static class Builder {
        private AppMetadata app;
        private String kind;
        private String version;
        private final List<Node> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private Viewport viewport;
        private Map<String, Object> workflowAttributes;
        private Map<String, Object> graphAttributes;
        private Map<String, Object> extensions;

        public Builder app(AppMetadata app) {
            this.app = app;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder node(Node node) {
            this.nodes.add(Objects.requireNonNull(node, "Node cannot be null"));
            return this;
        }

        /**
         * Replaces all nodes.
         */
        public Builder nodes(List<Node> nodes) {
            this.nodes.clear();
            if (nodes != null) {
                nodes.forEach(this::node);
            }
            return this;
        }

        public Builder edge(Edge edge) {
            this.edges.add(Objects.requireNonNull(edge, "Edge cannot be null"));
            return this;
        }

        /**
         * Replaces all edges.
         */
        public Builder edges(List<Edge> edges) {
            this.edges.clear();
            if (edges != null) {
                edges.forEach(this::edge);
            }
            return this;
        }

        public Builder viewport(Viewport viewport) {
            this.viewport = viewport;
            return this;
        }

        public Builder workflowAttributes(Map<String, Object> workflowAttributes) {
            this.workflowAttributes = workflowAttributes;
            return this;
        }

        public Builder graphAttributes(Map<String, Object> graphAttributes) {
            this.graphAttributes = graphAttributes;
            return this;
        }

        public Builder extensions(Map<String, Object> extensions) {
            this.extensions = extensions;
            return this;
        }

        public WorkflowDocument build() {
            return new WorkflowDocument(this);
        }
    }
}
