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
 * Handles lines that begin with a colon.
 *
 * <p><strong>Precondition:</strong> the trimmed line starts with {@code :}.</p>
 *
 * <p><strong>Repair:</strong> when the line carries a value and the previous line ends
 * with an open key ({@code key:}), the value is joined onto that key. Otherwise the line
 * is dropped and a {@link RepairNote} records the removal.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public final class OrphanColonRule implements RepairRule {

    @Override
    public String getName() {
        return "orphan-colon";
    }

    @Override
    public List<String> apply(List<String> lines, List<RepairNote> notes) {
        List<String> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.trim();
            if (!trimmed.startsWith(":")) {
                result.add(line);
                continue;
            }

            String value = trimmed.substring(1).trim();
            if (!value.isEmpty() && !result.isEmpty()) {
                int previousIndex = result.size() - 1;
                String previous = result.get(previousIndex).stripTrailing();
                if (previous.endsWith(":") && !previous.trim().startsWith("#")) {
                    result.set(previousIndex, previous + " " + value);
                    notes.add(new RepairNote(i + 1, getName(), "Joined orphan value onto previous key"));
                    continue;
                }
            }
            notes.add(new RepairNote(i + 1, getName(), "Dropped orphan line: " + trimmed));
        }
        return result;
    }
}
