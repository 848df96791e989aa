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
 * Closes single-quoted scalars that were left open.
 *
 * <p><strong>Precondition:</strong> the line has an odd number of {@code '} characters
 * outside double-quoted text, and one of them opens a scalar (it follows the start of the
 * line, {@code :}, {@code -}, {@code [}, {@code {} or {@code ,}). Apostrophes inside plain
 * text such as {@code desc: Bob's node} do not open a scalar and are left alone.</p>
 *
 * <p><strong>Repair:</strong> a closing quote goes in front of a key-looking suffix after
 * the last quote ({@code name: 'My App description: x} becomes
 * {@code name: 'My App' description: x}), otherwise at the end of the line. A suffix inside
 * double-quoted text is not a key, so the quote never lands between double quotes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public final class QuoteBalancingRule implements RepairRule {

    private static final Pattern KEY_SUFFIX = Pattern.compile("\\s+\\w+:(?=\\s|$)");

    @Override
    public String getName() {
        return "quote-balancing";
    }

    @Override
    public List<String> apply(List<String> lines, List<RepairNote> notes) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(balance(line));
        }
        return result;
    }

    static String balance(String line) {
        if (line.trim().startsWith("#")) {
            return line;
        }

        boolean inDouble = false;
        int count = 0;
        int opening = -1;
        int last = -1;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inDouble = !inDouble;
            } else if (c == '\'' && !inDouble) {
                count++;
                if (opening < 0 && opensScalar(line, i)) {
                    opening = i;
                }
                last = i;
            }
        }

        // An unterminated double-quoted string makes quote positions ambiguous
        if (inDouble || count % 2 == 0 || opening < 0) {
            return line;
        }

        String before = line.substring(0, last + 1);
        String after = line.substring(last + 1);
        Matcher suffix = KEY_SUFFIX.matcher(after);
        while (suffix.find()) {
            if (!insideDoubleQuotes(after, suffix.start())) {
                return before + after.substring(0, suffix.start()) + "'" + after.substring(suffix.start());
            }
        }
        return before + after.stripTrailing() + "'";
    }

    private static boolean insideDoubleQuotes(String text, int end) {
        boolean inside = false;
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '"') {
                inside = !inside;
            }
        }
        return inside;
    }

    private static boolean opensScalar(String line, int quoteIndex) {
        String prefix = line.substring(0, quoteIndex).stripTrailing();
        if (prefix.isEmpty()) {
            return true;
        }
        char previous = prefix.charAt(prefix.length() - 1);
        return previous == ':' || previous == '-' || previous == '[' || previous == '{' || previous == ',';
    }
}
