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

package dev.mars.flowdsl.workflow.parse;

import dev.mars.flowdsl.core.exceptions.FlowDslException;

import java.util.List;

/**
 * Exception thrown when workflow text cannot be imported.
 * Carries every {@link ParseError} found, not only the first.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-11
 * @version 1.0
 */
public class WorkflowParseException extends FlowDslException {

    private final List<ParseError> errors;

    public WorkflowParseException(List<ParseError> errors) {
        super("This text cannot be imported, request a corrected version");
        this.errors = List.copyOf(errors != null ? errors : List.of());
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (!errors.isEmpty()) {
            sb.append(" (").append(errors.size()).append(errors.size() == 1 ? " error)" : " errors)");
            for (ParseError error : errors) {
                sb.append("\n  - ").append(error);
            }
        }
        return sb.toString();
    }
}
