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
 * Collapses runs of three or more blank lines into one empty line.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public final class BlankLineCollapseRule implements RepairRule {

    private static final int MIN_RUN = 3;

    @Override
    public String getName() {
        return "blank-line-collapse";
    }

    @Override
    public List<String> apply(List<String> lines, List<RepairNote> notes) {
        List<String> result = new ArrayList<>(lines.size());
        int i = 0;
        while (i < lines.size()) {
            if (!lines.get(i).isBlank()) {
                result.add(lines.get(i));
                i++;
                continue;
            }
            int end = i;
            while (end < lines.size() && lines.get(end).isBlank()) {
                end++;
            }
            if (end - i >= MIN_RUN) {
                result.add("");
            } else {
                result.addAll(lines.subList(i, end));
            }
            i = end;
        }
        return result;
    }
}
