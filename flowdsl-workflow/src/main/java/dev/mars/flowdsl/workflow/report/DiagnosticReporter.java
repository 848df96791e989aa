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

package dev.mars.flowdsl.workflow.report;

import dev.mars.flowdsl.workflow.validation.ValidationResult;
import dev.mars.flowdsl.workflow.validation.ValidationResult.ValidationIssue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link ValidationResult} into a stable, user-facing issue list.
 *
 * <p>Issues are ordered by severity (errors first), then code, then location. The
 * location is the node id, or the edge id for issues without a node; issues that concern
 * the whole document come first within their code. The result passed in is not
 * modified.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-13
 * @version 1.0
 */
public class DiagnosticReporter {

    static final Comparator<ValidationIssue> ORDER = Comparator
            .comparing(ValidationIssue::getSeverity)
            .thenComparing(ValidationIssue::getCode)
            .thenComparing(DiagnosticReporter::location, Comparator.nullsFirst(Comparator.naturalOrder()));

    public List<ValidationIssue> report(ValidationResult result) {
        Objects.requireNonNull(result, "Validation result cannot be null");
        List<ValidationIssue> issues = new ArrayList<>(result.getIssues());
        issues.sort(ORDER);
        return List.copyOf(issues);
    }

    /**
     * Renders the sorted issues as text, one per line, under a summary line:
     * <pre>
     * Workflow is invalid: 1 error(s), 0 warning(s)
     * ERROR CYCLE_DETECTED [node a]: Cycle detected: a -&gt; b -&gt; a
     * </pre>
     */
    public String render(ValidationResult result) {
        List<ValidationIssue> issues = report(result);
        StringBuilder sb = new StringBuilder();
        sb.append(result.isValid() ? "Workflow is valid" : "Workflow is invalid")
          .append(": ").append(result.getErrorCount()).append(" error(s), ")
          .append(result.getWarningCount()).append(" warning(s)");
        for (ValidationIssue issue : issues) {
            sb.append('\n').append(issue);
        }
        return sb.toString();
    }

    private static String location(ValidationIssue issue) {
        return issue.getNodeId() != null ? issue.getNodeId() : issue.getEdgeId();
    }
}
