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

import dev.mars.flowdsl.core.WorkflowDocument;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a strict parse: either a {@link WorkflowDocument} or a non-empty list of
 * {@link ParseError}s, never both.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-11
 * @version 1.0
 */
public final class ParseResult {

    private final WorkflowDocument document;
    private final List<ParseError> errors;

    private ParseResult(WorkflowDocument document, List<ParseError> errors) {
        this.document = document;
        this.errors = errors;
    }

    public static ParseResult success(WorkflowDocument document) {
        return new ParseResult(Objects.requireNonNull(document, "Document cannot be null"), List.of());
    }

    public static ParseResult failure(List<ParseError> errors) {
        Objects.requireNonNull(errors, "Errors cannot be null");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed parse needs at least one error");
        }
        return new ParseResult(null, List.copyOf(errors));
    }

    public static ParseResult failure(ParseError error) {
        return failure(List.of(error));
    }

    public boolean isSuccess() {
        return document != null;
    }

    public Optional<WorkflowDocument> getDocument() {
        return Optional.ofNullable(document);
    }

    /**
     * @return the parse errors, empty on success
     */
    public List<ParseError> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ParseResult{success, " + document + '}'
                : "ParseResult{failed, errors=" + errors.size() + '}';
    }
}
