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

import dev.mars.flowdsl.workflow.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RepairNormalizer} running the full default rule chain.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-10
 */
class RepairNormalizerTest {

    private RepairNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new RepairNormalizer();
    }

    @Test
    void testNullInputYieldsEmptyText() {
        RepairOutcome outcome = normalizer.normalizeWithNotes(null);

        assertEquals("", outcome.getText());
        assertFalse(outcome.hasNotes());
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    void testMissingSectionColonIsRestored() {
        String repaired = normalizer.normalize("workflow\n  graph:");

        assertTrue(repaired.contains("workflow:\n  graph:"));
    }

    @Test
    void testWindowsLineEndingsAreNormalized() {
        String repaired = normalizer.normalize("kind: app\r\nversion: 0.1.5\r\n");

        assertEquals("kind: app\nversion: 0.1.5\n", repaired);
    }

    @Test
    void testWellFormedFixtureIsUnchanged() {
        String yaml = TestDocuments.fixture("translator-workflow.yml").replace("\r\n", "\n");

        RepairOutcome outcome = normalizer.normalizeWithNotes(yaml);

        assertEquals(yaml, outcome.getText());
        assertFalse(outcome.hasNotes());
    }

    @Test
    void testCorruptedFixtureIsRepaired() {
        RepairOutcome outcome = normalizer.normalizeWithNotes(TestDocuments.fixture("corrupted-workflow.txt"));
        String repaired = outcome.getText();

        assertThat(repaired)
                .startsWith("app:\n")
                .contains("  description: 'Says hello'\n")
                .contains("  mode: workflow\n")
                .contains("kind: app\nversion: 0.1.5\nworkflow:\n")
                .contains("      source: start\n")
                .contains("        title: End")
                .doesNotContain("\n\n\n");
        assertThat(outcome.getNotes())
                .extracting(RepairNote::getRule)
                .containsOnly("orphan-colon");
        assertThat(outcome.getNotes())
                .extracting(RepairNote::getMessage)
                .contains("Joined orphan value onto previous key");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "workflow\n  graph:",
            "app\n  description: 'Says hello\n  mode workflow",
            "kind: app version: 0.1.5 workflow: graph:",
            "title:\n: value\n: dropped",
            "a:b\n\n\n\n\nc:d",
            "plain text that is not yaml at all",
            "description: 'Say \"hello world: now\"",
            "note: 'a \"b: c\" d: e\n  - 'item \"x: y\"",
            "title \"it's: open\nname 'mixed \"quote: here\"",
            ""
    })
    void testNormalizeIsIdempotent(String input) {
        String once = normalizer.normalize(input);

        assertEquals(once, normalizer.normalize(once));
    }

    @Test
    void testMixedQuotesSettleInOnePass() {
        String once = normalizer.normalize("description: 'Say \"hello world: now\"");

        assertEquals("description: 'Say \"hello world: now\"'", once);
    }

    @Test
    void testNormalizeIsIdempotentOnGeneratedText() {
        String[] fragments = {
                "app", "workflow", "kind app", "version 0.1.5", "mode workflow",
                "kind: app version: 0.1.5", "app: name: x", "graph: nodes: []",
                "name 'My App", "description 'Say \"hello world: now\"", "  title \"quoted",
                "note: 'a \"b: c\" d: e", "  - 'item", "x: 'it\"s", "  y: 'open key: z",
                "desc: Bob's node", "# comment 'x", "a:'b", "key:value", "url: http://x/y",
                "[a:b]", "  title:", "  : End", ":", ": orphan", "", "", "    "
        };
        Random random = new Random(20260210L);

        for (int i = 0; i < 2000; i++) {
            StringBuilder text = new StringBuilder();
            int lines = 1 + random.nextInt(8);
            for (int line = 0; line < lines; line++) {
                if (line > 0) {
                    text.append('\n');
                }
                text.append(fragments[random.nextInt(fragments.length)]);
            }
            String input = text.toString();
            String once = normalizer.normalize(input);

            assertEquals(once, normalizer.normalize(once), () -> "Not idempotent for input:\n" + input);
        }
    }

    @Test
    void testCustomRuleListIsUsed() {
        RepairNormalizer colonOnly = new RepairNormalizer(List.of(new MissingColonRule()));

        assertEquals(1, colonOnly.getRules().size());
        assertEquals("workflow:\nsource:start", colonOnly.normalize("workflow\nsource:start"));
    }

    @Test
    void testFailingRuleFallsBackToLineEndingNormalization() {
        RepairRule broken = new RepairRule() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public List<String> apply(List<String> lines, List<RepairNote> notes) {
                throw new IllegalStateException("boom");
            }
        };
        RepairNormalizer failing = new RepairNormalizer(List.of(broken));

        assertEquals("workflow\ngraph", failing.normalize("workflow\r\ngraph"));
    }

    @Test
    void testDefaultRuleOrder() {
        List<String> names = new ArrayList<>();
        for (RepairRule rule : RepairNormalizer.defaultRules()) {
            names.add(rule.getName());
        }

        assertEquals(List.of("quote-balancing", "missing-colon", "merged-line",
                "orphan-colon", "colon-spacing", "blank-line-collapse"), names);
    }
}
