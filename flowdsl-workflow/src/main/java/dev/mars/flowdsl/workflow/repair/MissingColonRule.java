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
 * Restores the colon after well-known keys.
 *
 * <p><strong>Precondition:</strong> the whole line is one of {@code workflow}, {@code app},
 * {@code kind app}, {@code version <semver>} or {@code mode <app mode>}, at any
 * indentation, or it starts with {@code name}, {@code description} or {@code title}
 * followed directly by a quoted value.</p>
 *
 * <p><strong>Repair:</strong> the colon is inserted right after the key. The indentation
 * is kept.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public final class MissingColonRule implements RepairRule {

    private static final Pattern BARE_SECTION = Pattern.compile("^(\\s*)(workflow|app)\\s*$");
    private static final Pattern KIND = Pattern.compile("^(\\s*)kind\\s+(app)\\s*$");
    private static final Pattern VERSION = Pattern.compile("^(\\s*)version\\s+(\\d+\\.\\d+(?:\\.\\d+)?(?:[-+][\\w.]+)?)\\s*$");
    private static final Pattern MODE = Pattern.compile("^(\\s*)mode\\s+(workflow|advanced-chat|agent-chat|chat)\\s*$");
    private static final Pattern QUOTED_VALUE = Pattern.compile("^(\\s*)(name|description|title)\\s+(['\"].*)$");

    @Override
    public String getName() {
        return "missing-colon";
    }

    @Override
    public List<String> apply(List<String> lines, List<RepairNote> notes) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(repair(line));
        }
        return result;
    }

    static String repair(String line) {
        Matcher matcher = BARE_SECTION.matcher(line);
        if (matcher.matches()) {
            return matcher.group(1) + matcher.group(2) + ":";
        }
        matcher = KIND.matcher(line);
        if (matcher.matches()) {
            return matcher.group(1) + "kind: " + matcher.group(2);
        }
        matcher = VERSION.matcher(line);
        if (matcher.matches()) {
            return matcher.group(1) + "version: " + matcher.group(2);
        }
        matcher = MODE.matcher(line);
        if (matcher.matches()) {
            return matcher.group(1) + "mode: " + matcher.group(2);
        }
        matcher = QUOTED_VALUE.matcher(line);
        if (matcher.matches()) {
            return matcher.group(1) + matcher.group(2) + ": " + matcher.group(3);
        }
        return line;
    }
}
