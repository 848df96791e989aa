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

import dev.mars.flowdsl.config.FlowDslConfiguration;
import dev.mars.flowdsl.core.AppMetadata;
import dev.mars.flowdsl.core.Edge;
import dev.mars.flowdsl.core.Node;
import dev.mars.flowdsl.core.NodeData;
import dev.mars.flowdsl.core.NodeKind;
import dev.mars.flowdsl.core.Position;
import dev.mars.flowdsl.core.RawFields;
import dev.mars.flowdsl.core.Viewport;
import dev.mars.flowdsl.core.WorkflowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * SnakeYAML-based implementation of {@link WorkflowDocumentParser}.
 *
 * <p>The text is decoded with a {@link SafeConstructor}, so JSON input is accepted as
 * well. The decoded tree is then walked once and every shape violation is collected:
 * a document with three bad nodes yields three errors, not one.</p>
 *
 * <h3>Required Shape:</h3>
 * <ul>
 *   <li>{@code app}: mapping with string {@code name}, {@code icon},
 *       {@code icon_background} and {@code mode}</li>
 *   <li>{@code kind}: the string {@code app}</li>
 *   <li>{@code version}: a string, or a number that is kept in its text form</li>
 *   <li>{@code workflow.graph.nodes} and {@code workflow.graph.edges}: lists</li>
 *   <li>each node: {@code id}, {@code type}, numeric {@code position.x}/{@code position.y}
 *       and {@code data.title}</li>
 *   <li>each edge: {@code id}, {@code source} and {@code target}</li>
 * </ul>
 *
 * <p>Keys the engine does not interpret are kept on the resulting model objects so
 * that {@link WorkflowDocumentSerializer} can write them back.</p>
 *
 * <p>A new {@link Yaml} instance is created per call because SnakeYAML instances are not
 * thread-safe; the parser itself can be shared.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-11
 * @version 1.0
 */
public class YamlWorkflowDocumentParser implements WorkflowDocumentParser {
    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowDocumentParser.class);

    private static final Set<String> ROOT_KEYS = Set.of("app", "kind", "version", "workflow");
    private static final Set<String> APP_KEYS = Set.of("name", "mode", "icon", "icon_background", "description");
    private static final Set<String> GRAPH_KEYS = Set.of("nodes", "edges", "viewport");
    private static final Set<String> NODE_KEYS = Set.of("id", "type", "position", "data");
    private static final Set<String> EDGE_KEYS = Set.of(
            "id", "source", "target", "sourceHandle", "targetHandle", "type", "zIndex", "data");
    private static final Set<String> EDGE_DATA_KEYS = Set.of("sourceType", "targetType", "isInIteration");

    private final int maxNodes;
    private final int maxEdges;

    public YamlWorkflowDocumentParser() {
        this(FlowDslConfiguration.defaults());
    }

    public YamlWorkflowDocumentParser(FlowDslConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.maxNodes = configuration.getMaxNodes();
        this.maxEdges = configuration.getMaxEdges();
    }

    @Override
    public ParseResult parse(Path file) {
        Objects.requireNonNull(file, "File cannot be null");
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return parse(content);
        } catch (IOException e) {
            logger.debug("Failed to read workflow file {}", file, e);
            return ParseResult.failure(new ParseError(null, "Failed to read file " + file + ": " + e.getMessage()));
        }
    }

    @Override
    public ParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return ParseResult.failure(new ParseError(null, "Document is empty"));
        }

        Object root;
        try {
            root = newYaml().load(text);
        } catch (MarkedYAMLException e) {
            return ParseResult.failure(decodeError(e));
        } catch (YAMLException e) {
            logger.debug("YAML decode failed: {}", e.getMessage());
            return ParseResult.failure(new ParseError(null, "YAML syntax error: " + e.getMessage()));
        } catch (RuntimeException e) {
            // SafeConstructor lets tag conversion failures (!!int abc, !!binary %%) escape unwrapped
            logger.debug("YAML value construction failed", e);
            String problem = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ParseResult.failure(new ParseError(null, "YAML syntax error: " + problem));
        }

        if (root == null) {
            return ParseResult.failure(new ParseError(null, "Document is empty"));
        }
        if (!(root instanceof Map)) {
            return ParseResult.failure(new ParseError(null,
                    "Document root must be a mapping, found " + describe(root)));
        }

        DocumentReader reader = new DocumentReader();
        WorkflowDocument document = reader.read((Map<?, ?>) root);
        if (!reader.errors.isEmpty()) {
            logger.debug("Workflow document rejected with {} parse error(s)", reader.errors.size());
            return ParseResult.failure(reader.errors);
        }

        logger.debug("Parsed workflow document '{}' with {} nodes and {} edges",
                document.getApp().getName(), document.getNodes().size(), document.getEdges().size());
        return ParseResult.success(document);
    }

    private static Yaml newYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(loaderOptions));
    }

    private static ParseError decodeError(MarkedYAMLException e) {
        Mark mark = e.getProblemMark() != null ? e.getProblemMark() : e.getContextMark();
        String problem = e.getProblem() != null ? e.getProblem() : e.getMessage();
        logger.debug("YAML decode failed: {}", problem);
        if (mark == null) {
            return new ParseError(null, "YAML syntax error: " + problem);
        }
        return new ParseError(null, "YAML syntax error: " + problem, mark.getLine() + 1, mark.getColumn() + 1);
    }

    static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof Map) return "mapping";
        if (value instanceof List) return "list";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number) return "number";
        return value.getClass().getSimpleName();
    }

    /**
     * Walks one decoded tree and collects every violation.
     */
    private final class DocumentReader {

        private final List<ParseError> errors = new ArrayList<>();

        WorkflowDocument read(Map<?, ?> root) {
            AppMetadata app = readApp(root);
            readKind(root);
            String version = readVersion(root);

            Map<?, ?> workflow = requireMap(root, "workflow", "workflow");
            Map<?, ?> graph = workflow != null ? requireMap(workflow, "graph", "workflow.graph") : null;

            List<Node> nodes = new ArrayList<>();
            List<Edge> edges = new ArrayList<>();
            Viewport viewport = null;
            if (graph != null) {
                List<?> rawNodes = requireList(graph, "nodes", "workflow.graph.nodes");
                if (rawNodes != null) {
                    readNodes(rawNodes, nodes);
                }
                List<?> rawEdges = requireList(graph, "edges", "workflow.graph.edges");
                if (rawEdges != null) {
                    readEdges(rawEdges, edges);
                }
                viewport = readViewport(graph);
            }

            if (!errors.isEmpty()) {
                return null;
            }

            return WorkflowDocument.builder()
                    .app(app)
                    .kind(WorkflowDocument.KIND_APP)
                    .version(version)
                    .nodes(nodes)
                    .edges(edges)
                    .viewport(viewport)
                    .workflowAttributes(remaining(workflow, Set.of("graph")))
                    .graphAttributes(remaining(graph, GRAPH_KEYS))
                    .extensions(remaining(root, ROOT_KEYS))
                    .build();
        }

        private AppMetadata readApp(Map<?, ?> root) {
            Map<?, ?> app = requireMap(root, "app", "app");
            if (app == null) {
                return null;
            }
            String name = requireString(app, "name", "app.name");
            String mode = requireString(app, "mode", "app.mode");
            String icon = requireString(app, "icon", "app.icon");
            String iconBackground = requireString(app, "icon_background", "app.icon_background");
            String description = optionalString(app, "description", "app.description");
            if (name == null || mode == null || icon == null || iconBackground == null) {
                return null;
            }
            return new AppMetadata(name, mode, icon, iconBackground, description, remaining(app, APP_KEYS));
        }

        private void readKind(Map<?, ?> root) {
            String kind = requireString(root, "kind", "kind");
            if (kind != null && !WorkflowDocument.KIND_APP.equals(kind)) {
                error("kind", "Unsupported kind '" + kind + "', expected '" + WorkflowDocument.KIND_APP + "'");
            }
        }

        private String readVersion(Map<?, ?> root) {
            if (!root.containsKey("version")) {
                error("version", "Required field is missing");
                return null;
            }
            Object value = root.get("version");
            if (value instanceof String && !((String) value).isBlank()) {
                return (String) value;
            }
            if (value instanceof Number) {
                return value.toString();
            }
            error("version", "Expected a version string, found " + describe(value));
            return null;
        }

        private void readNodes(List<?> rawNodes, List<Node> nodes) {
            if (rawNodes.size() > maxNodes) {
                error("workflow.graph.nodes", "Too many nodes: " + rawNodes.size() + " exceeds the limit of " + maxNodes);
                return;
            }
            for (int i = 0; i < rawNodes.size(); i++) {
                Node node = readNode(rawNodes.get(i), "workflow.graph.nodes[" + i + "]");
                if (node != null) {
                    nodes.add(node);
                }
            }
        }

        private Node readNode(Object value, String path) {
            if (!(value instanceof Map)) {
                error(path, "Expected a mapping, found " + describe(value));
                return null;
            }
            Map<?, ?> raw = (Map<?, ?>) value;
            String id = requireNonBlankString(raw, "id", path + ".id");
            String type = requireString(raw, "type", path + ".type");
            Position position = readPosition(raw, path + ".position");
            Map<?, ?> data = requireMap(raw, "data", path + ".data");
            String title = data != null ? requireString(data, "title", path + ".data.title") : null;
            if (id == null || type == null || position == null || title == null) {
                return null;
            }
            NodeData nodeData = NodeData.of(NodeKind.fromWireName(type), stringKeyed(data));
            return new Node(id, type, position, nodeData, remaining(raw, NODE_KEYS));
        }

        private Position readPosition(Map<?, ?> node, String path) {
            Map<?, ?> position = requireMap(node, "position", path);
            if (position == null) {
                return null;
            }
            Double x = requireNumber(position, "x", path + ".x");
            Double y = requireNumber(position, "y", path + ".y");
            if (x == null || y == null) {
                return null;
            }
            return new Position(x, y);
        }

        private void readEdges(List<?> rawEdges, List<Edge> edges) {
            if (rawEdges.size() > maxEdges) {
                error("workflow.graph.edges", "Too many edges: " + rawEdges.size() + " exceeds the limit of " + maxEdges);
                return;
            }
            for (int i = 0; i < rawEdges.size(); i++) {
                Edge edge = readEdge(rawEdges.get(i), "workflow.graph.edges[" + i + "]");
                if (edge != null) {
                    edges.add(edge);
                }
            }
        }

        private Edge readEdge(Object value, String path) {
            if (!(value instanceof Map)) {
                error(path, "Expected a mapping, found " + describe(value));
                return null;
            }
            Map<?, ?> raw = (Map<?, ?>) value;
            int errorsBefore = errors.size();
            String id = requireNonBlankString(raw, "id", path + ".id");
            String source = requireNonBlankString(raw, "source", path + ".source");
            String target = requireNonBlankString(raw, "target", path + ".target");
            String sourceHandle = optionalString(raw, "sourceHandle", path + ".sourceHandle");
            String targetHandle = optionalString(raw, "targetHandle", path + ".targetHandle");
            String type = optionalString(raw, "type", path + ".type");
            Integer zIndex = optionalInteger(raw, "zIndex", path + ".zIndex");
            Edge.EdgeData data = readEdgeData(raw, path + ".data");
            if (errors.size() > errorsBefore) {
                return null;
            }
            return new Edge(id, source, target, sourceHandle, targetHandle, type, zIndex, data,
                    remaining(raw, EDGE_KEYS));
        }

        private Edge.EdgeData readEdgeData(Map<?, ?> edge, String path) {
            Object value = edge.get("data");
            if (value == null) {
                return null;
            }
            if (!(value instanceof Map)) {
                error(path, "Expected a mapping, found " + describe(value));
                return null;
            }
            Map<String, Object> data = stringKeyed((Map<?, ?>) value);
            String sourceType = optionalString(data, "sourceType", path + ".sourceType");
            String targetType = optionalString(data, "targetType", path + ".targetType");
            boolean inIteration = RawFields.getBoolean(data, "isInIteration", false);
            return new Edge.EdgeData(sourceType, targetType, inIteration, remaining(data, EDGE_DATA_KEYS));
        }

        private Viewport readViewport(Map<?, ?> graph) {
            if (graph.get("viewport") == null) {
                return null;
            }
            Map<?, ?> viewport = requireMap(graph, "viewport", "workflow.graph.viewport");
            if (viewport == null) {
                return null;
            }
            Double x = requireNumber(viewport, "x", "workflow.graph.viewport.x");
            Double y = requireNumber(viewport, "y", "workflow.graph.viewport.y");
            Double zoom = viewport.containsKey("zoom")
                    ? requireNumber(viewport, "zoom", "workflow.graph.viewport.zoom")
                    : Double.valueOf(1.0);
            if (x == null || y == null || zoom == null) {
                return null;
            }
            return new Viewport(x, y, zoom);
        }

        private Map<?, ?> requireMap(Map<?, ?> parent, String key, String path) {
            Object value = parent.get(key);
            if (value instanceof Map) {
                return (Map<?, ?>) value;
            }
            missingOrWrongType(parent, key, path, "a mapping");
            return null;
        }

        private List<?> requireList(Map<?, ?> parent, String key, String path) {
            Object value = parent.get(key);
            if (value instanceof List) {
                return (List<?>) value;
            }
            missingOrWrongType(parent, key, path, "a list");
            return null;
        }

        private String requireString(Map<?, ?> parent, String key, String path) {
            Object value = parent.get(key);
            if (value instanceof String) {
                return (String) value;
            }
            missingOrWrongType(parent, key, path, "a string");
            return null;
        }

        private String requireNonBlankString(Map<?, ?> parent, String key, String path) {
            String value = requireString(parent, key, path);
            if (value != null && value.isBlank()) {
                error(path, "Must not be blank");
                return null;
            }
            return value;
        }

        private String optionalString(Map<?, ?> parent, String key, String path) {
            Object value = parent.get(key);
            if (value == null || value instanceof String) {
                return (String) value;
            }
            error(path, "Expected a string, found " + describe(value));
            return null;
        }

        private Integer optionalInteger(Map<?, ?> parent, String key, String path) {
            Object value = parent.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof Integer) {
                return (Integer) value;
            }
            if (value instanceof Long && (Long) value >= Integer.MIN_VALUE && (Long) value <= Integer.MAX_VALUE) {
                return ((Long) value).intValue();
            }
            error(path, "Expected an integer, found " + describe(value));
            return null;
        }

        private Double requireNumber(Map<?, ?> parent, String key, String path) {
            Object value = parent.get(key);
            if (value instanceof Number) {
                double number = ((Number) value).doubleValue();
                if (Double.isFinite(number)) {
                    return number;
                }
                error(path, "Expected a finite number, found " + value);
                return null;
            }
            missingOrWrongType(parent, key, path, "a number");
            return null;
        }

        private void missingOrWrongType(Map<?, ?> parent, String key, String path, String expected) {
            if (!parent.containsKey(key)) {
                error(path, "Required field is missing");
            } else {
                error(path, "Expected " + expected + ", found " + describe(parent.get(key)));
            }
        }

        private void error(String path, String message) {
            errors.add(new ParseError(path, message));
        }
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private static Map<String, Object> remaining(Map<?, ?> source, Set<String> known) {
        Map<String, Object> extras = new LinkedHashMap<>();
        if (source == null) {
            return extras;
        }
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!known.contains(key)) {
                extras.put(key, entry.getValue());
            }
        }
        return extras;
    }
}
