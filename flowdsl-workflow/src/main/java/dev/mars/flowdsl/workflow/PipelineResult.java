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

package dev.mars.flowdsl.workflow;

import dev.mars.flowdsl.core.WorkflowDocument;
import dev.mars.flowdsl.workflow.parse.ParseError;
import dev.mars.flowdsl.workflow.repair.RepairNote;
import dev.mars.flowdsl.workflow.validation.ValidationResult;
import dev.mars.flowdsl.workflow.validation.ValidationResult.ValidationIssue;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one {@link WorkflowDslEngine#process(String)} call produced.
 *
 * <p>After a parse failure only the normalized text, the repair notes and the parse
 * errors are set. Otherwise the document, its validation result and the sorted issue list
 * are set as well; the document carries computed positions when the stage is
 * {@link PipelineStage#LAID_OUT}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-14
 * @version 1.0
 */
public final class PipelineResult {

    private final PipelineStage stage;
    private final String normalizedText;
    private final List<RepairNote> repairNotes;
    private final List<ParseError> parseErrors;
    private final WorkflowDocument document;
    private final ValidationResult validationResult;
    private final List<ValidationIssue> issues;

    private PipelineResult(PipelineStage stage, String normalizedText, List<RepairNote> repairNotes,
                           List<ParseError> parseErrors, WorkflowDocument document,
                           ValidationResult validationResult, List<ValidationIssue> issues) {
        this.stage = Objects.requireNonNull(stage, "Stage cannot be null");
        this.normalizedText = Objects.requireNonNull(normalizedText, "Normalized text cannot be null");
        this.repairNotes = List.copyOf(repairNotes);
        this.parseErrors = List.copyOf(parseErrors);
        this.document = document;
        this.validationResult = validationResult;
        this.issues = List.copyOf(issues);
    }

    static PipelineResult parseFailed(String normalizedText, List<RepairNote> repairNotes,
                                      List<ParseError> parseErrors) {
        return new PipelineResult(PipelineStage.PARSE_FAILED, normalizedText, repairNotes, parseErrors,
                null, null, List.of());
    }

    static PipelineResult completed(PipelineStage stage, String normalizedText, List<RepairNote> repairNotes,
                                    WorkflowDocument document, ValidationResult validationResult,
                                    List<ValidationIssue> issues) {
        return new PipelineResult(stage, normalizedText, repairNotes, List.of(),
                Objects.requireNonNull(document, "Document cannot be null"),
                Objects.requireNonNull(validationResult, "Validation result cannot be null"),
                issues);
    }

    public PipelineStage getStage() {
        return stage;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    public List<RepairNote> getRepairNotes() {
        return repairNotes;
    }

    public List<ParseError> getParseErrors() {
        return parseErrors;
    }

    public Optional<WorkflowDocument> getDocument() {
        return Optional.ofNullable(document);
    }

    public Optional<ValidationResult> getValidationResult() {
        return Optional.ofNullable(validationResult);
    }

    /**
     * @return validation issues in report order, empty after a parse failure
     */
    public List<ValidationIssue> getIssues() {
        return issues;
    }

    /**
     * @return true when a document was parsed and has no validation errors
     */
    public boolean isValid() {
        return validationResult != null && validationResult.isValid();
    }

    @Override
    public String toString() {
        return "PipelineResult{" +
               "stage=" + stage +
               ", parseErrors=" + parseErrors.size() +
               ", issues=" + issues.size() +
               ", valid=" + isValid() +
               '}';
    }
}
