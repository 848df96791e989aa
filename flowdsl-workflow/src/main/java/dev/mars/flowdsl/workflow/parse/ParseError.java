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

import java.util.Objects;

/**
 * A single problem found while decoding workflow text.
 *
 * <p>{@code path} is a dotted field path such as {@code workflow.graph.nodes[2].data.title},
 * or {@code null} when the problem concerns the text as a whole. Line and column are
 * 1-based and {@code -1} when unknown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-11
 * @version 1.0
 */
public final class ParseError {

    private final String path;
    private final String message;
    private final int line;
    private final int column;

    public ParseError(String path, String message) {
        this(path, message, -1, -1);
    }

    public ParseError(String path, String message, int line, int column) {
        this.path = path;
        this.message = Objects.requireNonNull(message, "Message cannot be null");
        this.line = line;
        this.column = column;
    }

    public String getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParseError that = (ParseError) o;
        return line == that.line &&
               column == that.column &&
               Objects.equals(path, that.path) &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, message, line, column);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (line > 0) {
            sb.append("Line ").append(line);
            if (column > 0) {
                sb.append(", column ").append(column);
            }
            sb.append(": ");
        }
        if (path != null) {
            sb.append("Field '").append(path).append("': ");
        }
        sb.append(message);
        return sb.toString();
    }
}
