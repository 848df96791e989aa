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

/**
 * Inserts the missing space in {@code key:value}.
 *
 * <p><strong>Precondition:</strong> the line is not a comment, contains no {@code ": "}
 * and no {@code "://"}, and has a colon outside quotes and outside {@code [...]} or
 * {@code {...}} that is directly followed by a value character.</p>
 *
 * <p><strong>Repair:</strong> a single space is inserted after the first such colon, so
 * {@code time:12:30} becomes {@code time: 12:30}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public final class ColonSpacingRule implements RepairRule {

    @Override
    public String getName() {
        return "colon-spacing";
    }

    @Override
    public List<String> apply(List<String> lines, List<RepairNote> notes) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(space(line));
        }
        return result;
    }

    static String space(String line) {
        if (line.trim().startsWith("#") || line.indexOf(':') < 0
                || line.contains(": ") || line.contains(":\t") || line.contains("://")) {
            return line;
        }

        boolean inSingle = false;
        boolean inDouble = false;
        int depth = 0;
        for (int i = 0; i < line.length() - 1; i++) {
            char c = line.charAt(i);
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (!inSingle && !inDouble) {
                if (c == '[' || c == '{') {
                    depth++;
                } else if ((c == ']' || c == '}') && depth > 0) {
                    depth--;
                } else if (c == ':' && depth == 0 && isSplittable(line, i)) {
                    return line.substring(0, i + 1) + " " + line.substring(i + 1);
                }
            }
        }
        return line;
    }

    private static boolean isSplittable(String line, int colon) {
        if (colon == 0 || line.charAt(colon - 1) == ':' || Character.isWhitespace(line.charAt(colon - 1))) {
            return false;
        }
        char next = line.charAt(colon + 1);
        return next != ':' && !Character.isWhitespace(next);
    }
}
