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

package dev.mars.flowdsl.workflow.validation;

import dev.mars.flowdsl.core.RawFields;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Errors and warnings found by the {@link SemanticValidator}.
 *
 * <p>A result is valid when it holds no errors; warnings never affect validity.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-12
 * @version 1.0
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
        this.warnings = new ArrayList<>(warnings != null ? warnings : List.of());
    }

    public void add(ValidationIssue issue) {
        Objects.requireNonNull(issue, "Issue cannot be null");
        if (issue.getSeverity() == ValidationIssue.Severity.ERROR) {
            errors.add(issue);
        } else {
            warnings.add(issue);
        }
    }

    public void addError(String code, String message) {
        add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, message, null, null, Map.of()));
    }

    public void addNodeError(String code, String nodeId, String message) {
        addNodeError(code, nodeId, message, Map.of());
    }

    public void addNodeError(String code, String nodeId, String message, Map<String, Object> details) {
        add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, message, nodeId, null, details));
    }

    public void addEdgeError(String code, String edgeId, String message, Map<String, Object> details) {
        add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, message, null, edgeId, details));
    }

    public void addWarning(String code, String message) {
        add(new ValidationIssue(ValidationIssue.Severity.WARNING, code, message, null, null, Map.of()));
    }

    public void addNodeWarning(String code, String nodeId, String message) {
        add(new ValidationIssue(ValidationIssue.Severity.WARNING, code, message, nodeId, null, Map.of()));
    }

    public void addEdgeWarning(String code, String edgeId, String message, Map<String, Object> details) {
        add(new ValidationIssue(ValidationIssue.Severity.WARNING, code, message, null, edgeId, details));
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    /**
     * @return errors followed by warnings, each in the order they were found
     */
    public List<ValidationIssue> getIssues() {
        return Stream.concat(errors.stream(), warnings.stream()).collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return every issue, error or warning, carrying the given code
     */
    public List<ValidationIssue> getIssues(String code) {
        return getIssues().stream()
                .filter(issue -> issue.getCode().equals(code))
                .collect(Collectors.toUnmodifiableList());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * A single validation issue (error or warning), located on a node, an edge, or the
     * document as a whole.
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String code;
        private final String message;
        private final String nodeId;
        private final String edgeId;
        private final Map<String, Object> details;

        public ValidationIssue(Severity severity, String code, String message,
                               String nodeId, String edgeId, Map<String, Object> details) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.code = Objects.requireNonNull(code, "Code cannot be null");
            this.message = Objects.requireNonNull(message, "Message cannot be null");
            this.nodeId = nodeId;
            this.edgeId = edgeId;
            this.details = RawFields.copyOf(details);
        }

        public Severity getSeverity() {
            return severity;
        }

        public boolean isError() {
            return severity == Severity.ERROR;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        /**
         * @return the node the issue is about, or null
         */
        public String getNodeId() {
            return nodeId;
        }

        /**
         * @return the edge the issue is about, or null
         */
        public String getEdgeId() {
            return edgeId;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   Objects.equals(code, that.code) &&
                   Objects.equals(message, that.message) &&
                   Objects.equals(nodeId, that.nodeId) &&
                   Objects.equals(edgeId, that.edgeId) &&
                   Objects.equals(details, that.details);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, code, message, nodeId, edgeId, details);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(severity.name()).append(' ').append(code);

            if (nodeId != null) {
                sb.append(" [node ").append(nodeId).append("]");
            } else if (edgeId != null) {
                sb.append(" [edge ").append(edgeId).append("]");
            }

            sb.append(": ").append(message);

            return sb.toString();
        }
    }
}
