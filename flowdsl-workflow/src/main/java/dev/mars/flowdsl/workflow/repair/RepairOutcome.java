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
import java.util.Objects;

/**
 * Normalized text together with the notes collected while producing it.
 */
public final class RepairOutcome {

    private final String text;
    private final List<RepairNote> notes;

    public RepairOutcome(String text, List<RepairNote> notes) {
        this.text = Objects.requireNonNull(text, "Text cannot be null");
        this.notes = List.copyOf(notes != null ? notes : List.of());
    }

    public String getText() {
        return text;
    }

    public List<RepairNote> getNotes() {
        return notes;
    }

    public boolean hasNotes() {
        return !notes.isEmpty();
    }
}
