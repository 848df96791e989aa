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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Best-effort text repair applied to candidate workflow text before strict parsing.
 *
 * <p>The normalizer works line by line and runs an ordered list of {@link RepairRule}s.
 * The default order is:</p>
 * <ol>
 *   <li>{@link QuoteBalancingRule}</li>
 *   <li>{@link MissingColonRule}</li>
 *   <li>{@link MergedLineRule}</li>
 *   <li>{@link OrphanColonRule}</li>
 *   <li>{@link ColonSpacingRule}</li>
 *   <li>{@link BlankLineCollapseRule}</li>
 * </ol>
 *
 * <p>The rule list is applied repeatedly until the text stops changing, so
 * {@code normalize(normalize(x))} always equals {@code normalize(x)}. Line endings are
 * normalized to {@code \n} first.</p>
 *
 * <p>The normalizer never throws. A {@code null} input yields the empty string, and
 * lines that cannot be repaired safely are dropped with a {@link RepairNote} rather than
 * reported as errors.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class RepairNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(RepairNormalizer.class);

    private static final int MAX_PASSES = 8;

    private final List<RepairRule> rules;

    public RepairNormalizer() {
        this(defaultRules());
    }

    public RepairNormalizer(List<RepairRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules cannot be null"));
    }

    public static List<RepairRule> defaultRules() {
        return List.of(
                new QuoteBalancingRule(),
                new MissingColonRule(),
                new MergedLineRule(),
                new OrphanColonRule(),
                new ColonSpacingRule(),
                new BlankLineCollapseRule());
    }

    public List<RepairRule> getRules() {
        return rules;
    }

    /**
     * Repairs the text and returns the result only.
     */
    public String normalize(String text) {
        return normalizeWithNotes(text).getText();
    }

    /**
     * Repairs the text and also returns a note for every line that was merged or dropped.
     */
    public RepairOutcome normalizeWithNotes(String text) {
        if (text == null) {
            return new RepairOutcome("", List.of());
        }

        String current = text.replace("\r\n", "\n").replace('\r', '\n');
        List<RepairNote> notes = new ArrayList<>();
        try {
            boolean settled = false;
            for (int pass = 1; pass <= MAX_PASSES && !settled; pass++) {
                String next = applyRules(current, notes);
                if (next.equals(current)) {
                    logger.debug("Repair reached a fixpoint after {} pass(es)", pass);
                    settled = true;
                }
                current = next;
            }
            if (!settled) {
                logger.warn("Repair did not settle after {} passes; returning the last pass", MAX_PASSES);
            }
        } catch (RuntimeException e) {
            logger.warn("Repair aborted, returning text with line endings normalized only: {}", e.getMessage(), e);
            return new RepairOutcome(text.replace("\r\n", "\n").replace('\r', '\n'), notes);
        }

        if (!notes.isEmpty()) {
            logger.debug("Repair produced {} note(s)", notes.size());
        }
        return new RepairOutcome(current, notes);
    }

    private String applyRules(String text, List<RepairNote> notes) {
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        for (RepairRule rule : rules) {
            lines = rule.apply(lines, notes);
        }
        return String.join("\n", lines);
    }
}
