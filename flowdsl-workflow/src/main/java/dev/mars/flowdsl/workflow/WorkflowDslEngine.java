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

import dev.mars.flowdsl.config.FlowDslConfiguration;
import dev.mars.flowdsl.core.WorkflowDocument;
import dev.mars.flowdsl.workflow.layout.LayoutConfig;
import dev.mars.flowdsl.workflow.layout.LayoutEngine;
import dev.mars.flowdsl.workflow.observability.PipelineMetrics;
import dev.mars.flowdsl.workflow.parse.ParseResult;
import dev.mars.flowdsl.workflow.parse.WorkflowDocumentSerializer;
import dev.mars.flowdsl.workflow.parse.WorkflowParseException;
import dev.mars.flowdsl.workflow.parse.YamlWorkflowDocumentParser;
import dev.mars.flowdsl.workflow.repair.RepairNormalizer;
import dev.mars.flowdsl.workflow.repair.RepairNote;
import dev.mars.flowdsl.workflow.repair.RepairOutcome;
import dev.mars.flowdsl.workflow.report.DiagnosticReporter;
import dev.mars.flowdsl.workflow.validation.SemanticValidator;
import dev.mars.flowdsl.workflow.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point that wires repair, parsing, validation, reporting and layout together.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * WorkflowDslEngine engine = new WorkflowDslEngine();
 * PipelineResult result = engine.process(candidateText);
 * if (result.getStage() == PipelineStage.PARSE_FAILED) {
 *     // ask for a corrected version, the parse errors say why
 * } else if (!result.isValid()) {
 *     result.getIssues().forEach(issue -> System.out.println(issue));
 * }
 * }</pre>
 *
 * <p>The engine holds no per-document state and may be shared between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-14
 * @version 1.0
 */
public class WorkflowDslEngine {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowDslEngine.class);

    private final FlowDslConfiguration configuration;
    private final RepairNormalizer normalizer;
    private final YamlWorkflowDocumentParser parser;
    private final SemanticValidator validator;
    private final DiagnosticReporter reporter;
    private final LayoutEngine layoutEngine;
    private final WorkflowDocumentSerializer serializer;
    private final PipelineMetrics metrics;

    public WorkflowDslEngine() {
        this(new FlowDslConfiguration());
    }

    public WorkflowDslEngine(FlowDslConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.normalizer = new RepairNormalizer();
        this.parser = new YamlWorkflowDocumentParser(configuration);
        this.validator = new SemanticValidator();
        this.reporter = new DiagnosticReporter();
        this.layoutEngine = new LayoutEngine(LayoutConfig.from(configuration));
        this.serializer = new WorkflowDocumentSerializer();
        this.metrics = configuration.isMetricsEnabled() ? PipelineMetrics.getInstance() : null;
        logger.info("WorkflowDslEngine initialized with {}", configuration);
    }

    /**
     * Runs the full pipeline on candidate text. Never throws for any text.
     */
    public PipelineResult process(String text) {
        RepairOutcome repaired = repair(text);
        String normalized = repaired.getText();
        List<RepairNote> notes = repaired.getNotes();
        if (metrics != null) {
            metrics.recordRepairNotes(notes.size());
        }

        ParseResult parsed = parser.parse(normalized);
        if (!parsed.isSuccess()) {
            logger.debug("Pipeline stopped at {}: {} parse error(s)", PipelineStage.PARSE_FAILED, parsed.getErrors().size());
            if (metrics != null) {
                metrics.recordParseFailure(parsed.getErrors().size());
                metrics.recordRun(PipelineStage.PARSE_FAILED.name());
            }
            return PipelineResult.parseFailed(normalized, notes, parsed.getErrors());
        }

        WorkflowDocument document = parsed.getDocument().orElseThrow();
        ValidationResult validation = revalidate(document);

        PipelineStage stage = PipelineStage.VALIDATED;
        if (configuration.isAutoLayoutEnabled()) {
            document = layoutEngine.layout(document);
            stage = PipelineStage.LAID_OUT;
        }

        logger.debug("Pipeline finished at {}: {}", stage, validation);
        if (metrics != null) {
            metrics.recordRun(stage.name());
        }
        return PipelineResult.completed(stage, normalized, notes, document, validation, reporter.report(validation));
    }

    /**
     * Validates an in-memory document, for example after an edit.
     */
    public ValidationResult revalidate(WorkflowDocument document) {
        long startNanos = System.nanoTime();
        ValidationResult result = validator.validate(document);
        if (metrics != null) {
            double durationMs = (System.nanoTime() - startNanos) / 1_000_000.0;
            metrics.recordValidation(document.getApp().getMode(), result.getErrorCount(),
                    result.getWarningCount(), durationMs);
        }
        return result;
    }

    /**
     * Lays out the document with the configured spacing and origin.
     */
    public WorkflowDocument layout(WorkflowDocument document) {
        return layoutEngine.layout(document);
    }

    public String export(WorkflowDocument document) {
        return serializer.serialize(document);
    }

    /**
     * Repairs and parses the text, without validating it.
     *
     * @throws WorkflowParseException carrying every parse error when the text cannot be
     *         imported
     */
    public WorkflowDocument importDocument(String text) throws WorkflowParseException {
        ParseResult parsed = parser.parse(repair(text).getText());
        if (!parsed.isSuccess()) {
            throw new WorkflowParseException(parsed.getErrors());
        }
        return parsed.getDocument().orElseThrow();
    }

    public FlowDslConfiguration getConfiguration() {
        return configuration;
    }

    private RepairOutcome repair(String text) {
        if (configuration.isRepairEnabled()) {
            return normalizer.normalizeWithNotes(text);
        }
        return new RepairOutcome(text != null ? text : "", List.of());
    }
}
