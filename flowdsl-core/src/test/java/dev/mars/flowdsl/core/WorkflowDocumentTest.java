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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WorkflowDocument} and its builder.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-09
 */
class WorkflowDocumentTest {

    private AppMetadata app;
    private Node start;
    private Node end;

    @BeforeEach
    void setUp() {
        app = new AppMetadata("Demo", "workflow", "🤖", "#FFEAD5", "A demo");
        start = Node.of("start", "start", Position.ORIGIN, Map.of("title", "Start"));
        end = Node.of("end", "end", new Position(250, 0), Map.of("title", "End"));
    }

    private WorkflowDocument demo() {
        return WorkflowDocument.builder()
                .app(app)
                .version("0.1.5")
                .node(start)
                .node(end)
                .edge(Edge.of("start-end", "start", "end"))
                .workflowAttributes(Map.of(
                        "environment_variables", List.of(Map.of("name", "API_KEY")),
                        "features", Map.of("retriever_resource", Map.of("enabled", true))))
                .build();
    }

    @Test
    void testBuilderDefaults() {
        WorkflowDocument document = demo();

        assertEquals(WorkflowDocument.KIND_APP, document.getKind());
        assertTrue(document.getViewport().isEmpty());
        assertTrue(document.getGraphAttributes().isEmpty());
        assertTrue(document.getExtensions().isEmpty());
        assertEquals(1, document.getEnvironmentVariables().size());
        assertTrue(document.getFeatures().containsKey("retriever_resource"));
    }

    @Test
    void testRequiredFields() {
        assertThrows(NullPointerException.class, () -> WorkflowDocument.builder().version("1").build());
        assertThrows(NullPointerException.class, () -> WorkflowDocument.builder().app(app).build());
        assertThrows(NullPointerException.class, () -> WorkflowDocument.builder().node(null));
    }

    @Test
    void testMissingOptionalSectionsReadAsEmpty() {
        WorkflowDocument document = WorkflowDocument.builder().app(app).version("1").build();

        assertTrue(document.getEnvironmentVariables().isEmpty());
        assertTrue(document.getFeatures().isEmpty());
        assertTrue(document.getNodes().isEmpty());
    }

    @Test
    void testCollectionsAreImmutableCopies() {
        List<Node> nodes = new ArrayList<>(List.of(start));
        WorkflowDocument document = WorkflowDocument.builder().app(app).version("1").nodes(nodes).build();
        nodes.add(end);

        assertEquals(1, document.getNodes().size());
        assertThrows(UnsupportedOperationException.class, () -> document.getNodes().add(end));
    }

    @Test
    void testWithMethodsReturnNewDocuments() {
        WorkflowDocument original = demo();
        Node moved = start.withPosition(new Position(10, 20));

        WorkflowDocument changed = original.withNodes(List.of(moved, end)).withViewport(new Viewport(1, 2, 0.5));

        assertNotSame(original, changed);
        assertEquals(Position.ORIGIN, original.findNode("start").orElseThrow().getPosition());
        assertEquals(new Position(10, 20), changed.findNode("start").orElseThrow().getPosition());
        assertEquals(0.5, changed.getViewport().orElseThrow().getZoom());
        assertEquals(original.getEdges(), changed.getEdges());
        assertEquals(original.getWorkflowAttributes(), changed.getWorkflowAttributes());
        assertEquals(original, original.toBuilder().build());
        assertTrue(changed.withEdges(List.of()).getEdges().isEmpty());
    }

    @Test
    void testFindNode() {
        WorkflowDocument document = demo();

        assertEquals("End", document.findNode("end").orElseThrow().getTitle());
        assertTrue(document.findNode("missing").isEmpty());
    }

    @Test
    void testEdgeDefaults() {
        Edge edge = Edge.of("e", "a", "b");

        assertEquals("source", edge.getSourceHandle());
        assertEquals("target", edge.getTargetHandle());
        assertEquals("custom", edge.getType());
        assertNull(edge.getZIndex());
        assertSame(Edge.EdgeData.EMPTY, edge.getData());
        assertThat(edge.getExtras()).isEmpty();
    }

    @Test
    void testNodeKindFollowsType() {
        assertEquals(NodeKind.START, start.getKind());
        assertEquals(NodeKind.UNKNOWN, Node.of("x", "mystery", Position.ORIGIN, Map.of()).getKind());
        assertEquals(start, start.withPosition(Position.ORIGIN));
        assertNotEquals(start, start.withPosition(new Position(1, 1)));
    }
}
