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

/**
 * Payload of an {@code llm} node.
 *
 * <p>{@code prompt_template} is either a plain string or a list of role/text messages.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-09
 * @version 1.0
 */
public final class LlmNodeData extends NodeData {

    public LlmNodeData(Map<String, Object> fields) {
        super(fields);
    }

    public boolean hasModel() {
        return mapField("model") != null;
    }

    public String getModelProvider() {
        return RawFields.getString(mapField("model"), "provider");
    }

    public String getModelName() {
        return RawFields.getString(mapField("model"), "name");
    }

    public String getModelMode() {
        return RawFields.getString(mapField("model"), "mode");
    }

    public Object getPromptTemplate() {
        return get("prompt_template");
    }

    /**
     * True when the prompt is a non-blank string or a non-empty message list.
     */
    public boolean hasPromptTemplate() {
        Object template = getPromptTemplate();
        if (template instanceof String) {
            return !((String) template).isBlank();
        }
        return template instanceof List && !((List<?>) template).isEmpty();
    }
}
