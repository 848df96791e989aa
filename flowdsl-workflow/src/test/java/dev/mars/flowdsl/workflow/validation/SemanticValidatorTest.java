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

import dev.mars.flowdsl.core.AppMetadata;
import dev.mars.flowdsl.core.Edge;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.WorkflowDocument;
import dev.mars.flowdsl.workflow.validation.ValidationResult.ValidationIssue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static dev.mars.flowdsl.workflow.TestDocuments.aggregator;
import static dev.mars.flowdsl.workflow.TestDocuments.code;
import static dev.mars.flowdsl.workflow.TestDocuments.document;
import static dev.mars.flowdsl.workflow.TestDocuments.edge;
import static dev.mars.flowdsl.workflow.TestDocuments.end;
import static dev.mars.flowdsl.workflow.TestDocuments.ifElse;
import static dev.mars.flowdsl.workflow.TestDocuments.llm;
import static dev.mars.flowdsl.workflow.TestDocuments.loop;
import static dev.mars.flowdsl.workflow.TestDocuments.node;
import static dev.mars.flowdsl.workflow.TestDocuments.start;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SemanticValidator}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-12
 */
class SemanticValidatorTest {

    private SemanticValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SemanticValidator();
    }

    private ValidationResult validate(List<Node> nodes, List<Edge> edges) {
        return validator.validate(document(nodes, edges));
    }

    private static List<String> codes(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::getCode).collect(Collectors.toList());
    }

    @Test
    void testMinimalWorkflowIsValid() {
        ValidationResult result = validate(List.of(start("S"), end("E")), List.of(edge("S", "E")));

        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
        assertTrue(result.getIssues().isEmpty());
    }

    @Test
    void testLinearWorkflowWithAllKindsIsValid() {
        ValidationResult result = validate(
                List.of(start("S"), llm("A"), ifElse("B"), code("C1"), code("C2"), aggregator("G"), end("E")),
                List.of(edge("S", "A"), edge("A", "B"), edge("B", "C1"), edge("B", "C2"),
                        edge("C1", "G"), edge("C2", "G"), edge("G", "E")));

        assertTrue(result.isValid(), () -> "Issues: " + result.getIssues());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testNullDocumentIsRejected() {
        assertThrows(NullPointerException.class, () -> validator.validate(null));
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        void testDuplicateNodeId() {
            ValidationResult result = validate(List.of(start("S"), end("E"), end("E")), List.of(edge("S", "E")));

            assertEquals(List.of(IssueCodes.DUPLICATE_NODE_ID), codes(result.getErrors()));
            ValidationIssue issue = result.getErrors().get(0);
            assertEquals("E", issue.getNodeId());
            assertEquals(2, issue.getDetails().get("index"));
        }

        @Test
        void testDuplicateEdgeId() {
            ValidationResult result = validate(List.of(start("S"), end("E")),
                    List.of(edge("S", "E"), Edge.of("S-E", "S", "E")));

            assertEquals(List.of(IssueCodes.DUPLICATE_EDGE_ID), codes(result.getErrors()));
            assertEquals("S-E", result.getErrors().get(0).getEdgeId());
        }

        @Test
        void testEdgeToMissingTarget() {
            ValidationResult result = validate(List.of(start("S"), end("E")),
                    List.of(edge("S", "E"), Edge.of("e-ghost", "S", "ghost-node")));

            assertEquals(1, result.getErrorCount());
            ValidationIssue issue = result.getErrors().get(0);
            assertEquals(IssueCodes.EDGE_INVALID_TARGET, issue.getCode());
            assertEquals("e-ghost", issue.getEdgeId());
            assertEquals("ghost-node", issue.getDetails().get("missingNodeId"));
            assertEquals("Edge 'e-ghost' references missing target node 'ghost-node'", issue.getMessage());
        }

        @Test
        void testEdgeFromMissingSource() {
            ValidationResult result = validate(List.of(start("S"), end("E")),
                    List.of(edge("S", "E"), Edge.of("e-ghost", "ghost-node", "E")));

            assertEquals(List.of(IssueCodes.EDGE_INVALID_SOURCE), codes(result.getErrors()));
        }

        @Test
        void testMissingStart() {
            ValidationResult result = validate(List.of(llm("A"), end("E")), List.of(edge("A", "E")));

            assertEquals(List.of(IssueCodes.MISSING_START), codes(result.getErrors()));
            assertNull(result.getErrors().get(0).getNodeId());
        }

        @Test
        void testMissingEnd() {
            ValidationResult result = validate(List.of(start("S"), llm("A")), List.of(edge("S", "A")));

            assertThat(codes(result.getErrors())).containsExactly(IssueCodes.MISSING_END);
            assertThat(codes(result.getWarnings())).containsExactly(IssueCodes.DEAD_END_NODE);
        }

        @Test
        void testMultipleStartNodesIsWarning() {
            ValidationResult result = validate(List.of(start("S1"), start("S2"), end("E")),
                    List.of(edge("S1", "E"), edge("S2", "E")));

            assertTrue(result.isValid());
            assertEquals(List.of(IssueCodes.MULTIPLE_START_NODES), codes(result.getWarnings()));
        }
    }

    @Nested
    @DisplayName("Cycles")
    class Cycles {

        @Test
        void testCycleThroughStart() {
            ValidationResult result = validate(List.of(start("S"), llm("A")), List.of(edge("S", "A"), edge("A", "S")));

            List<ValidationIssue> cycles = result.getIssues(IssueCodes.CYCLE_DETECTED);
            assertEquals(1, cycles.size());
            assertEquals(List.of("S", "A", "S"), cycles.get(0).getDetails().get("path"));
            assertEquals("S", cycles.get(0).getNodeId());
            assertEquals("Cycle detected: S -> A -> S", cycles.get(0).getMessage());
            assertThat(codes(result.getErrors())).contains(IssueCodes.START_HAS_INCOMING, IssueCodes.MISSING_END);
        }

        @Test
        void testEachBackEdgeIsReportedInDeclarationOrder() {
            List<Node> nodes = List.of(start("S"), llm("A"), llm("B"));
            List<Edge> edges = List.of(edge("S", "A"), edge("A", "S"), edge("A", "B"), edge("B", "A"));

            List<ValidationIssue> cycles = validate(nodes, edges).getIssues(IssueCodes.CYCLE_DETECTED);

            assertEquals(List.of(List.of("S", "A", "S"), List.of("A", "B", "A")), cycles.stream()
                    .map(issue -> issue.getDetails().get("path"))
                    .collect(Collectors.toList()));
            assertEquals(cycles, validate(nodes, edges).getIssues(IssueCodes.CYCLE_DETECTED));
        }

        @Test
        void testLoopOnlyCycleIsAllowed() {
            ValidationResult result = validate(
                    List.of(start("S"), loop("L"), node("I", "iteration", Map.of()), end("E")),
                    List.of(edge("S", "L"), edge("L", "I"), edge("I", "L"), edge("L", "E")));

            assertTrue(result.getIssues(IssueCodes.CYCLE_DETECTED).isEmpty());
            assertTrue(result.isValid(), () -> "Issues: " + result.getIssues());
        }

        @Test
        void testCycleThroughOrdinaryNodeIsRejected() {
            ValidationResult result = validate(
                    List.of(start("S"), loop("L"), llm("A"), end("E")),
                    List.of(edge("S", "L"), edge("L", "A"), edge("A", "L"), edge("L", "E")));

            List<ValidationIssue> cycles = result.getIssues(IssueCodes.CYCLE_DETECTED);
            assertEquals(1, cycles.size());
            assertEquals(List.of("L", "A", "L"), cycles.get(0).getDetails().get("path"));
        }
    }

    @Nested
    @DisplayName("Reachability")
    class Reachability {

        @Test
        void testIsolatedNode() {
            ValidationResult result = validate(List.of(start("S"), end("E"), code("C")), List.of(edge("S", "E")));

            assertEquals(List.of(IssueCodes.ISOLATED_NODE), codes(result.getErrors()));
            assertEquals("C", result.getErrors().get(0).getNodeId());
        }

        @Test
        void testIsolatedNodeWithoutStart() {
            ValidationResult result = validate(List.of(llm("A"), end("E"), code("C")), List.of(edge("A", "E")));

            assertThat(codes(result.getErrors()))
                    .containsExactlyInAnyOrder(IssueCodes.MISSING_START, IssueCodes.ISOLATED_NODE);
        }

        @Test
        void testUnreachableNodes() {
            ValidationResult result = validate(List.of(start("S"), end("E"), llm("A"), llm("B")),
                    List.of(edge("S", "E"), edge("A", "B")));

            List<ValidationIssue> unreachable = result.getIssues(IssueCodes.UNREACHABLE_NODE);
            assertEquals(List.of("A", "B"),
                    unreachable.stream().map(ValidationIssue::getNodeId).collect(Collectors.toList()));
            assertTrue(result.getIssues(IssueCodes.DEAD_END_NODE).isEmpty());
        }

        @Test
        void testEveryStartIsARoot() {
            ValidationResult result = validate(List.of(start("S1"), start("S2"), llm("A"), end("E")),
                    List.of(edge("S1", "E"), edge("S2", "A"), edge("A", "E")));

            assertTrue(result.isValid(), () -> "Issues: " + result.getIssues());
        }
    }

    @Nested
    @DisplayName("Edge counts")
    class EdgeCounts {

        @Test
        void testBranchWithOneOutgoingEdge() {
            ValidationResult result = validate(List.of(start("S"), ifElse("B"), end("E")),
                    List.of(edge("S", "B"), edge("B", "E")));

            assertEquals(List.of(IssueCodes.BRANCH_INSUFFICIENT_EDGES), codes(result.getErrors()));
            assertEquals("B", result.getErrors().get(0).getNodeId());
        }

        @Test
        void testAggregatorWithOneIncomingEdge() {
            ValidationResult result = validate(List.of(start("S"), aggregator("G"), end("E")),
                    List.of(edge("S", "G"), edge("G", "E")));

            assertEquals(List.of(IssueCodes.AGGREGATOR_INSUFFICIENT_EDGES), codes(result.getErrors()));
        }

        @Test
        void testStartAndEndWithoutEdges() {
            ValidationResult result = validate(List.of(start("S"), end("E")), List.of());

            assertThat(codes(result.getErrors())).containsExactlyInAnyOrder(
                    IssueCodes.START_NO_OUTGOING, IssueCodes.END_NO_INCOMING, IssueCodes.UNREACHABLE_NODE);
        }

        @Test
        void testEndWithOutgoingEdge() {
            ValidationResult result = validate(List.of(start("S"), end("E"), end("E2")),
                    List.of(edge("S", "E"), edge("E", "E2")));

            assertEquals(List.of(IssueCodes.END_HAS_OUTGOING), codes(result.getErrors()));
        }

        @Test
        void testDeadEndIsWarning() {
            ValidationResult result = validate(List.of(start("S"), llm("A"), end("E")),
                    List.of(edge("S", "A"), edge("S", "E")));

            assertTrue(result.isValid());
            assertEquals(List.of(IssueCodes.DEAD_END_NODE), codes(result.getWarnings()));
            assertEquals("A", result.getWarnings().get(0).getNodeId());
        }

        @Test
        void testAnswerNodeIsTerminal() {
            ValidationResult result = validate(List.of(start("S"), node("R", "answer", Map.of()), end("E")),
                    List.of(edge("S", "R"), edge("S", "E")));

            assertTrue(result.getIssues(IssueCodes.DEAD_END_NODE).isEmpty());
        }
    }

    @Nested
    @DisplayName("Advisories")
    class Advisories {

        @Test
        void testUnsupportedAppMode() {
            WorkflowDocument document = document(List.of(start("S"), end("E")), List.of(edge("S", "E")))
                    .toBuilder()
                    .app(new AppMetadata("Test Workflow", "completion", "🤖", "#FFEAD5", null))
                    .build();

            ValidationResult result = validator.validate(document);

            assertTrue(result.isValid());
            assertEquals(List.of(IssueCodes.UNSUPPORTED_APP_MODE), codes(result.getWarnings()));
        }

        @Test
        void testEdgeTypeMismatch() {
            Edge hinted = new Edge("S-E", "S", "E", null, null, null, null,
                    new Edge.EdgeData("llm", "end", false, Map.of()), Map.of());

            ValidationResult result = validate(List.of(start("S"), end("E")), List.of(hinted));

            assertTrue(result.isValid());
            List<ValidationIssue> warnings = result.getIssues(IssueCodes.EDGE_TYPE_MISMATCH);
            assertEquals(1, warnings.size());
            assertEquals("S-E", warnings.get(0).getEdgeId());
            assertEquals(Map.of("field", "sourceType", "declared", "llm", "actual", "start"),
                    warnings.get(0).getDetails());
        }
    }

    @Test
    void testFieldRulesCanBeReplaced() {
        Node bareLlm = node("A", "llm", Map.of());
        List<Node> nodes = List.of(start("S"), bareLlm, end("E"));
        List<Edge> edges = List.of(edge("S", "A"), edge("A", "E"));

        assertFalse(validator.validate(document(nodes, edges)).isValid());
        assertTrue(new SemanticValidator(List.of()).validate(document(nodes, edges)).isValid());
    }
}
