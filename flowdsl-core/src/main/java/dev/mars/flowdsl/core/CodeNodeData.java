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

package dev.mars.flowdsl.core;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload of a {@code code} node.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public final class CodeNodeData extends NodeData {

    /**
     * Languages the workflow runtime can execute.
     */
    public static final Set<String> SUPPORTED_LANGUAGES = Set.of("python3", "javascript");

    public CodeNodeData(Map<String, Object> fields) {
        super(fields);
    }

    public String getCode() {
        return stringField("code");
    }

    public String getCodeLanguage() {
        return stringField("code_language");
    }

    public boolean isSupportedLanguage() {
        String language = getCodeLanguage();
        return language != null && SUPPORTED_LANGUAGES.contains(language);
    }

    /**
     * Outputs are normally a map of output name to type declaration; a list of names is
     * also accepted.
     */
    public boolean hasOutputs() {
        Object outputs = get("outputs");
        return outputs instanceof Map || outputs instanceof List;
    }
}
