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

import java.util.Map;

/**
 * Payload of an {@code http-request} node.
 */
public final class HttpRequestNodeData extends NodeData {

    public HttpRequestNodeData(Map<String, Object> fields) {
        super(fields);
    }

    public String getMethod() {
        return stringField("method");
    }

    public String getUrl() {
        return stringField("url");
    }
}
