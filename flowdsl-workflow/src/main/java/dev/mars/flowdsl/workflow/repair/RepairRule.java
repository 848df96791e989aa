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

import java.util.List;

/**
 * A single text repair applied by the {@link RepairNormalizer}.
 *
 * <p>Rules are pure functions over the lines of a document. Each rule documents the
 * precondition that makes it fire; a rule's own output never satisfies that precondition
 * again, so applying a rule twice gives the same result as applying it once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public interface RepairRule {

    /**
     * Short identifier used in repair notes and log output.
     */
    String getName();

    /**
     * Applies the rule.
     *
     * @param lines the current lines, never modified
     * @param notes sink for lines the rule had to drop
     * @return the repaired lines
     */
    List<String> apply(List<String> lines, List<RepairNote> notes);
}
