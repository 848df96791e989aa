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

import java.util.Objects;

/**
 * Records a line a repair rule could not fix safely and therefore dropped. Notes are
 * advisory only; they never block parsing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public final class RepairNote {

    private final int lineNumber;
    private final String rule;
    private final String message;

    public RepairNote(int lineNumber, String rule, String message) {
        this.lineNumber = lineNumber;
        this.rule = Objects.requireNonNull(rule, "Rule cannot be null");
        this.message = Objects.requireNonNull(message, "Message cannot be null");
    }

    /**
     * @return the 1-based line number in the text the rule was applied to
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getRule() {
        return rule;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RepairNote that = (RepairNote) o;
        return lineNumber == that.lineNumber &&
               rule.equals(that.rule) &&
               message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, rule, message);
    }

    @Override
    public String toString() {
        return "line " + lineNumber + " [" + rule + "]: " + message;
    }
}
