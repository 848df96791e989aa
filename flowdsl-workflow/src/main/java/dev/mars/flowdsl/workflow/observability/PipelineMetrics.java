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

package dev.mars.flowdsl.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for the flow DSL pipeline.
 *
 * Provides 6 pipeline metrics:
 * - flowdsl.pipeline.runs (counter) - Pipeline runs, by final stage
 * - flowdsl.pipeline.parse.failures (counter) - Runs that stopped at the parser
 * - flowdsl.repair.notes (counter) - Lines merged or dropped by repair
 * - flowdsl.validation.errors (counter) - Validation errors found
 * - flowdsl.validation.warnings (counter) - Validation warnings found
 * - flowdsl.validation.duration.ms (histogram) - Time spent in validation
 *
 * Instruments are no-ops until an OpenTelemetry SDK is registered globally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-13
 * @version 1.0
 */
public class PipelineMetrics {

    private static final Logger logger = LoggerFactory.getLogger(PipelineMetrics.class);
    private static final String METER_NAME = "flowdsl-workflow";

    // Singleton instance
    private static PipelineMetrics instance;

    // Counters
    private final LongCounter pipelineRuns;
    private final LongCounter parseFailures;
    private final LongCounter repairNotes;
    private final LongCounter validationErrors;
    private final LongCounter validationWarnings;

    // Histograms
    private final DoubleHistogram validationDuration;

    // Attribute keys
    private static final AttributeKey<String> STAGE_KEY = AttributeKey.stringKey("pipeline.stage");
    private static final AttributeKey<String> APP_MODE_KEY = AttributeKey.stringKey("app.mode");

    private PipelineMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        pipelineRuns = meter.counterBuilder("flowdsl.pipeline.runs")
                .setDescription("Number of pipeline runs")
                .setUnit("1")
                .build();

        parseFailures = meter.counterBuilder("flowdsl.pipeline.parse.failures")
                .setDescription("Number of pipeline runs rejected by the parser")
                .setUnit("1")
                .build();

        repairNotes = meter.counterBuilder("flowdsl.repair.notes")
                .setDescription("Number of lines merged or dropped by text repair")
                .setUnit("1")
                .build();

        validationErrors = meter.counterBuilder("flowdsl.validation.errors")
                .setDescription("Number of validation errors found")
                .setUnit("1")
                .build();

        validationWarnings = meter.counterBuilder("flowdsl.validation.warnings")
                .setDescription("Number of validation warnings found")
                .setUnit("1")
                .build();

        validationDuration = meter.histogramBuilder("flowdsl.validation.duration.ms")
                .setDescription("Validation duration in milliseconds")
                .setUnit("ms")
                .build();

        logger.info("PipelineMetrics initialized");
    }

    /**
     * Get the singleton instance of PipelineMetrics.
     */
    public static synchronized PipelineMetrics getInstance() {
        if (instance == null) {
            instance = new PipelineMetrics();
        }
        return instance;
    }

    /**
     * Record a finished pipeline run.
     */
    public void recordRun(String finalStage) {
        pipelineRuns.add(1, Attributes.of(STAGE_KEY, finalStage));
    }

    /**
     * Record a run that stopped because the text could not be parsed.
     */
    public void recordParseFailure(int errorCount) {
        parseFailures.add(1);
        logger.debug("Parse failure with {} error(s) recorded", errorCount);
    }

    public void recordRepairNotes(int noteCount) {
        if (noteCount > 0) {
            repairNotes.add(noteCount);
        }
    }

    /**
     * Record the outcome of one validation.
     */
    public void recordValidation(String appMode, int errorCount, int warningCount, double durationMs) {
        Attributes attrs = Attributes.of(APP_MODE_KEY, appMode != null ? appMode : "unknown");
        validationErrors.add(errorCount, attrs);
        validationWarnings.add(warningCount, attrs);
        validationDuration.record(durationMs, attrs);
    }
}
