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

import java.nio.file.Path;

/**
 * Strict decoder from workflow text to a {@link dev.mars.flowdsl.core.WorkflowDocument}.
 * Implementations never throw; every problem is reported through the {@link ParseResult}.
 */
public interface WorkflowDocumentParser {

    ParseResult parse(String text);

    /**
     * Reads the file as UTF-8 and parses it. An unreadable file yields a single error.
     */
    ParseResult parse(Path file);
}
