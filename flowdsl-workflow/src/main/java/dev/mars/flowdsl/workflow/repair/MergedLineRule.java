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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits two keys that ended up on one line.
 *
 * <p><strong>Preconditions:</strong></p>
 * <ul>
 *   <li>sibling merge: a {@code kind}, {@code version} or {@code mode} entry with a
 *       single-token value is followed on the same line by an {@code app}, {@code kind},
 *       {@code version} or {@code workflow} key ({@code version: 0.1.5 workflow:})</li>
 *   <li>nested merge: an {@code app}, {@code workflow} or {@code graph} section key is
 *       followed on the same line by its first child key ({@code app: description: x})</li>
 * </ul>
 *
 * <p><strong>Repair:</strong> the line is split. A sibling keeps the indentation of the
 * first key; a child is indented two more spaces. Splitting repeats until neither
 * pattern matches, so {@code kind: app version: 0.1.5 workflow:} becomes three lines.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public final class MergedLineRule implements RepairRule {

    private static final Pattern SIBLING = Pattern.compile(
            "^(\\s*)((?:kind|version|mode):[ \\t]*[^\\s'\":]+)[ \\t]+((?:app|kind|version|workflow):.*)$");
    private static final Pattern NESTED = Pattern.compile(
            "^(\\s*)(app|workflow|graph):[ \\t]*(\\w+:(?:\\s.*)?)$");

    @Override
    public String getName() {
        return "merged-line";
    }

    @Override
    public List<String> apply(List<String> lines, List<RepairNote> notes) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            split(line, result);
        }
        return result;
    }

    private static void split(String line, List<String> out) {
        String remainder = line;
        while (true) {
            Matcher sibling = SIBLING.matcher(remainder);
            if (sibling.matches()) {
                out.add(sibling.group(1) + sibling.group(2).stripTrailing());
                remainder = sibling.group(1) + sibling.group(3);
                continue;
            }
            Matcher nested = NESTED.matcher(remainder);
            if (nested.matches()) {
                out.add(nested.group(1) + nested.group(2) + ":");
                remainder = nested.group(1) + "  " + nested.group(3);
                continue;
            }
            out.add(remainder);
            return;
        }
    }
}
