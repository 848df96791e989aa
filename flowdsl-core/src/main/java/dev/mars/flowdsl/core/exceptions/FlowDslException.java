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

package dev.mars.flowdsl.core.exceptions;

/**
 * Base exception class for all flow DSL exceptions.
 * Provides a common hierarchy for callers that want to handle every engine failure in
 * one place.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public class FlowDslException extends Exception {

    public FlowDslException(String message) {
        super(message);
    }

    public FlowDslException(String message, Throwable cause) {
        super(message, cause);
    }

    public FlowDslException(Throwable cause) {
        super(cause);
    }
}
