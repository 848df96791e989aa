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

import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeData;
import dev.mars.flowdsl.core.NodeKind;

import java.util.List;
import java.util.Objects;

/**
 * Table-driven field rule for node kinds whose payload has no dedicated type.
 * Each {@link Requirement} names a field, what it must hold, and the issue code to report
 * when it does not.
 *
 * <pre>{@code
 * new RequiredFieldRule(NodeKind.AGENT, List.of(
 *     Requirement.present("model", IssueCodes.MISSING_AGENT_MODEL, "Agent node must have model configuration"),
 *     Requirement.list("tools", IssueCodes.MISSING_AGENT_TOOLS, "Agent node must have tools array")));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-12
 * @version 1.0
 */
public class RequiredFieldRule implements NodeFieldRule {

    private final NodeKind kind;
    private final List<Requirement> requirements;

    public RequiredFieldRule(NodeKind kind, List<Requirement> requirements) {
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null");
        this.requirements = List.copyOf(Objects.requireNonNull(requirements, "Requirements cannot be null"));
    }

    @Override
    public NodeKind getKind() {
        return kind;
    }

    public List<Requirement> getRequirements() {
        return requirements;
    }

    @Override
    public void validate(Node node, ValidationResult result) {
        for (Requirement requirement : requirements) {
            if (!requirement.isSatisfiedBy(node.getData())) {
                result.addNodeError(requirement.getCode(), node.getId(), requirement.getMessage());
            }
        }
    }

    /**
     * What a required field must hold.
     */
    public enum Expectation {
        /** Any value other than null, blank text, {@code false} or zero. */
        PRESENT,
        /** A list, possibly empty. */
        LIST,
        /** A non-zero number. */
        NUMBER
    }

    public static final class Requirement {

        private final String field;
        private final Expectation expectation;
        private final String code;
        private final String message;

        public Requirement(String field, Expectation expectation, String code, String message) {
            this.field = Objects.requireNonNull(field, "Field cannot be null");
            this.expectation = Objects.requireNonNull(expectation, "Expectation cannot be null");
            this.code = Objects.requireNonNull(code, "Code cannot be null");
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public static Requirement present(String field, String code, String message) {
            return new Requirement(field, Expectation.PRESENT, code, message);
        }

        public static Requirement list(String field, String code, String message) {
            return new Requirement(field, Expectation.LIST, code, message);
        }

        public static Requirement number(String field, String code, String message) {
            return new Requirement(field, Expectation.NUMBER, code, message);
        }

        public String getField() {
            return field;
        }

        public Expectation getExpectation() {
            return expectation;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        boolean isSatisfiedBy(NodeData data) {
            Object value = data.get(field);
            switch (expectation) {
                case LIST:
                    return value instanceof List;
                case NUMBER:
                    return value instanceof Number && ((Number) value).doubleValue() != 0;
                case PRESENT:
                default:
                    if (value == null || Boolean.FALSE.equals(value)) {
                        return false;
                    }
                    if (value instanceof String) {
                        return !((String) value).isBlank();
                    }
                    if (value instanceof Number) {
                        return ((Number) value).doubleValue() != 0;
                    }
                    return true;
            }
        }
    }
}
