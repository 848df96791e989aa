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

import dev.mars.flowdsl.config.FlowDslConfiguration;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.Position;
import dev.mars.flowdsl.core.WorkflowDocument;
import dev.mars.flowdsl.workflow.WorkflowGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static dev.mars.flowdsl.workflow.TestDocuments.code;
import static dev.mars.flowdsl.workflow.TestDocuments.document;
import static dev.mars.flowdsl.workflow.TestDocuments.edge;
import static dev.mars.flowdsl.workflow.TestDocuments.end;
import static dev.mars.flowdsl.workflow.TestDocuments.ifElse;
import static dev.mars.flowdsl.workflow.TestDocuments.llm;
import static dev.mars.flowdsl.workflow.TestDocuments.start;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LayoutEngine}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-13
 */
class LayoutEngineTest {

    private LayoutEngine engine;

    @BeforeEach
    void setUp() {
        engine = new LayoutEngine();
    }

    private static Position positionOf(WorkflowDocument document, String id) {
        return document.findNode(id).map(Node::getPosition).orElseThrow();
    }

    @Test
    void testTwoNodeChain() {
        WorkflowDocument laidOut = engine.layout(document(List.of(start("S"), end("E")), List.of(edge("S", "E"))));

        assertEquals(new Position(100, 200), positionOf(laidOut, "S"));
        assertEquals(new Position(350, 200), positionOf(laidOut, "E"));
    }

    @Test
    void testColumnIsCentredOnOrigin() {
        WorkflowDocument laidOut = engine.layout(document(
                List.of(start("S"), ifElse("B"), llm("A"), code("C"), end("E")),
                List.of(edge("S", "B"), edge("B", "A"), edge("B", "C"), edge("A", "E"), edge("C", "E"))));

        assertEquals(new Position(350, 200), positionOf(laidOut, "B"));
        assertEquals(new Position(600, 140), positionOf(laidOut, "A"));
        assertEquals(new Position(600, 260), positionOf(laidOut, "C"));
        assertEquals(new Position(850, 200), positionOf(laidOut, "E"));
    }

    @Test
    void testUnreachableNodesGoToOverflowColumn() {
        WorkflowDocument laidOut = engine.layout(document(
                List.of(start("S"), llm("X"), end("E"), code("Y")),
                List.of(edge("S", "E"))));

        assertEquals(new Position(600, 200), positionOf(laidOut, "X"));
        assertEquals(new Position(600, 320), positionOf(laidOut, "Y"));
    }

    @Test
    void testWithoutStartEverythingOverflows() {
        WorkflowDocument laidOut = engine.layout(document(List.of(llm("A"), end("E")), List.of(edge("A", "E"))));

        assertEquals(new Position(100, 200), positionOf(laidOut, "A"));
        assertEquals(new Position(100, 320), positionOf(laidOut, "E"));
    }

    @Test
    void testOnlyPositionsChange() {
        WorkflowDocument original = document(List.of(start("S"), end("E")), List.of(edge("S", "E")));

        WorkflowDocument laidOut = engine.layout(original);

        assertEquals(original.getEdges(), laidOut.getEdges());
        assertEquals(original.getApp(), laidOut.getApp());
        for (int i = 0; i < original.getNodes().size(); i++) {
            Node before = original.getNodes().get(i);
            Node after = laidOut.getNodes().get(i);
            assertEquals(before.getId(), after.getId());
            assertEquals(before.getData(), after.getData());
        }
        assertEquals(Position.ORIGIN, positionOf(original, "S"));
    }

    @Test
    void testLayoutIsDeterministic() {
        WorkflowDocument original = document(
                List.of(start("S"), llm("A"), llm("B"), end("E")),
                List.of(edge("S", "A"), edge("S", "B"), edge("A", "E"), edge("B", "E")));

        assertEquals(engine.layout(original), engine.layout(engine.layout(original)));
    }

    @Test
    void testLongestPathWinsForSecondParent() {
        WorkflowGraph graph = WorkflowGraph.of(document(
                List.of(start("S"), llm("A"), end("E")),
                List.of(edge("S", "E"), edge("S", "A"), edge("A", "E"))));

        Map<String, Integer> levels = engine.assignLevels(graph);

        assertEquals(Map.of("S", 0, "A", 1, "E", 2), levels);
    }

    @Test
    void testCustomConfig() {
        LayoutConfig config = new LayoutConfig(100, 50, 0, 0);
        WorkflowDocument laidOut = engine.layout(document(List.of(start("S"), end("E")), List.of(edge("S", "E"))), config);

        assertEquals(new Position(100, 0), positionOf(laidOut, "E"));
    }

    @Test
    void testConfigFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(FlowDslConfiguration.LAYOUT_SPACING_X, "300");
        properties.setProperty(FlowDslConfiguration.LAYOUT_ORIGIN_Y, "not-a-number");

        LayoutConfig config = LayoutConfig.from(new FlowDslConfiguration(properties));

        assertEquals(300, config.getSpacingX());
        assertEquals(120, config.getSpacingY());
        assertEquals(200, config.getOriginY());
        assertEquals(LayoutConfig.defaults(), new LayoutConfig(250, 120, 100, 200));
    }

    @Test
    void testNonFiniteConfigIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LayoutConfig(Double.NaN, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new LayoutConfig(1, 1, Double.POSITIVE_INFINITY, 0));
    }
}
