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

package dev.mars.flowdsl.workflow.repair;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the individual repair rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-10
 */
class RepairRulesTest {

    private static List<String> apply(RepairRule rule, String... lines) {
        return rule.apply(List.of(lines), new ArrayList<>());
    }

    @Nested
    @DisplayName("Quote balancing")
    class QuoteBalancing {

        @Test
        void testClosesQuoteAtLineEnd() {
            assertEquals("  description: 'Says hello'", QuoteBalancingRule.balance("  description: 'Says hello"));
        }

        @Test
        void testClosesQuoteBeforeMergedKey() {
            assertEquals("name: 'My App' description: x", QuoteBalancingRule.balance("name: 'My App description: x"));
        }

        @Test
        void testTrimsTrailingWhitespaceBeforeClosing() {
            assertEquals("title: 'Hello'", QuoteBalancingRule.balance("title: 'Hello   "));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "desc: Bob's node",
                "title: 'balanced'",
                "# it's a comment",
                "text: \"it's inside double quotes\"",
                "text: \"unterminated 'quote",
                "plain line without quotes"
        })
        void testLeavesLineUnchanged(String line) {
            assertEquals(line, QuoteBalancingRule.balance(line));
        }

        @Test
        void testKeyInsideDoubleQuotesIsNotASplitPoint() {
            String line = "description: 'Say \"hello world: now\"";

            String balanced = QuoteBalancingRule.balance(line);

            assertEquals("description: 'Say \"hello world: now\"'", balanced);
            assertEquals(balanced, QuoteBalancingRule.balance(balanced));
        }

        @Test
        void testFirstKeyOutsideDoubleQuotesIsUsed() {
            assertEquals("note: 'a \"b: c\"' d: e", QuoteBalancingRule.balance("note: 'a \"b: c\" d: e"));
        }

        @Test
        void testListItemQuoteIsClosed() {
            assertEquals("  - 'first item'", QuoteBalancingRule.balance("  - 'first item"));
        }
    }

    @Nested
    @DisplayName("Missing colon")
    class MissingColon {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "workflow|workflow:",
                "app|app:",
                "  workflow  |  workflow:",
                "kind app|kind: app",
                "version 0.1.5|version: 0.1.5",
                "version 1.0|version: 1.0",
                "  mode workflow|  mode: workflow",
                "  mode advanced-chat|  mode: advanced-chat"
        })
        void testInsertsColon(String input, String expected) {
            assertEquals(expected, MissingColonRule.repair(input));
        }

        @Test
        void testInsertsColonBeforeQuotedValue() {
            assertEquals("  name: 'Translator'", MissingColonRule.repair("  name 'Translator'"));
            assertEquals("    title: \"Start\"", MissingColonRule.repair("    title \"Start\""));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "workflow:",
                "kind: app",
                "version: 0.1.5",
                "mode: workflow",
                "  name: Translator",
                "version latest",
                "workflows"
        })
        void testLeavesLineUnchanged(String line) {
            assertEquals(line, MissingColonRule.repair(line));
        }
    }

    @Nested
    @DisplayName("Merged lines")
    class MergedLines {

        private final MergedLineRule rule = new MergedLineRule();

        @Test
        void testSplitsVersionAndWorkflow() {
            assertEquals(List.of("version: 0.1.5", "workflow:"), apply(rule, "version: 0.1.5 workflow:"));
        }

        @Test
        void testSplitsThreeSiblings() {
            assertEquals(List.of("kind: app", "version: 0.1.5", "workflow:"),
                    apply(rule, "kind: app version: 0.1.5 workflow:"));
        }

        @Test
        void testSiblingKeepsIndentation() {
            assertEquals(List.of("  mode: workflow", "  version: 1.0"), apply(rule, "  mode: workflow version: 1.0"));
        }

        @Test
        void testSplitsNestedChild() {
            assertEquals(List.of("app:", "  description: x"), apply(rule, "app: description: x"));
        }

        @Test
        void testSplitsNestedChildThenSiblingChain() {
            assertEquals(List.of("workflow:", "  graph:"), apply(rule, "workflow: graph:"));
        }

        @Test
        void testLeavesOrdinaryLinesAlone() {
            List<String> lines = List.of("kind: app", "  name: My workflow app", "  text: 'version: 2 workflow:'");
            assertEquals(lines, rule.apply(lines, new ArrayList<>()));
        }
    }

    @Nested
    @DisplayName("Orphan colon lines")
    class OrphanColon {

        private final OrphanColonRule rule = new OrphanColonRule();

        @Test
        void testMergesValueIntoOpenKey() {
            List<RepairNote> notes = new ArrayList<>();
            List<String> result = rule.apply(List.of("    title:", "    : End"), notes);

            assertEquals(List.of("    title: End"), result);
            assertEquals(1, notes.size());
        }

        @Test
        void testDropsOrphanWithoutOpenKey() {
            List<RepairNote> notes = new ArrayList<>();
            List<String> result = rule.apply(List.of("name: x", ": stray", "kind: app"), notes);

            assertEquals(List.of("name: x", "kind: app"), result);
            assertEquals(1, notes.size());
            assertEquals(2, notes.get(0).getLineNumber());
            assertEquals("orphan-colon", notes.get(0).getRule());
        }

        @Test
        void testAlwaysDropsLoneColon() {
            List<RepairNote> notes = new ArrayList<>();
            assertEquals(List.of("title:"), rule.apply(List.of("title:", "  :"), notes));
            assertEquals(1, notes.size());
        }

        @Test
        void testDropsOrphanOnFirstLine() {
            assertEquals(List.of("kind: app"), apply(rule, ": value", "kind: app"));
        }
    }

    @Nested
    @DisplayName("Colon spacing")
    class ColonSpacing {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "source:start|source: start",
                "  - id:node-1|  - id: node-1",
                "time:12:30|time: 12:30",
                "values:[1, 2]|values: [1, 2]"
        })
        void testInsertsSpace(String input, String expected) {
            assertEquals(expected, ColonSpacingRule.space(input));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "url: https://example.com",
                "url:https://example.com",
                "key: value",
                "title:",
                "# note:this stays",
                "text: 'a:b'",
                "'quoted:key'",
                "inline: {a: 1}",
                "[a:b, c]",
                "scope::name"
        })
        void testLeavesLineUnchanged(String line) {
            assertEquals(line, ColonSpacingRule.space(line));
        }
    }

    @Nested
    @DisplayName("Blank line collapse")
    class BlankLineCollapse {

        private final BlankLineCollapseRule rule = new BlankLineCollapseRule();

        @Test
        void testCollapsesThreeOrMoreBlankLines() {
            assertEquals(List.of("a:", "", "b:"), apply(rule, "a:", "", "  ", "", "", "b:"));
        }

        @Test
        void testKeepsShortRuns() {
            List<String> lines = List.of("a:", "", "", "b:");
            assertEquals(lines, rule.apply(lines, new ArrayList<>()));
        }
    }
}
