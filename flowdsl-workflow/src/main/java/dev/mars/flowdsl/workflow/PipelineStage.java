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

/**
 * Lifecycle of one input text through the pipeline.
 *
 * <pre>
 * RAW_TEXT -&gt; NORMALIZED_TEXT -&gt; PARSED -&gt; VALIDATED -&gt; LAID_OUT
 *                             \-&gt; PARSE_FAILED
 * </pre>
 */
public enum PipelineStage {

    /**
     * Text as supplied by the caller.
     */
    RAW_TEXT,

    /**
     * Text after repair.
     */
    NORMALIZED_TEXT,

    /**
     * A document was decoded from the text.
     */
    PARSED,

    /**
     * The text could not be decoded. The caller has to supply new text.
     */
    PARSE_FAILED,

    /**
     * The document was checked; the validation result may still hold errors.
     */
    VALIDATED,

    /**
     * Node positions were computed.
     */
    LAID_OUT;

    /**
     * Checks if no further stage can follow.
     */
    public boolean isTerminal() {
        return this == PARSE_FAILED || this == LAID_OUT;
    }

    /**
     * Checks if a document is available at this stage.
     */
    public boolean hasDocument() {
        return this == PARSED || this == VALIDATED || this == LAID_OUT;
    }
}
