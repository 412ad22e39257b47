package org.etlstudio.engine.service;

import org.etlstudio.engine.plan.AggregateNode;
import org.etlstudio.engine.plan.AggregateNode.Measure;
import org.etlstudio.engine.plan.AggregateOp;
import org.etlstudio.engine.plan.CastType;
import org.etlstudio.engine.plan.ColumnCast;
import org.etlstudio.engine.plan.ColumnSelection;
import org.etlstudio.engine.plan.DeriveNode;
import org.etlstudio.engine.plan.FilterNode;
import org.etlstudio.engine.plan.GraphCompileException;
import org.etlstudio.engine.plan.JoinNode;
import org.etlstudio.engine.plan.LoadNode;
import org.etlstudio.engine.plan.NodeKind;
import org.etlstudio.engine.plan.PassthroughExpression;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.PipelineNode;
import org.etlstudio.engine.plan.SampleNode;
import org.etlstudio.engine.plan.SelectNode;
import org.etlstudio.engine.plan.SortNode;
import org.etlstudio.engine.plan.UnknownNode;
import org.etlstudio.engine.plan.WriteNode;
import org.etlstudio.engine.serialization.Json;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads pipeline request documents.
 *
 * Document shape:
 *
 * <pre>
 * {
 *   "nodes": [{"id": "a", "data": {"type": "source.load", "label": "People", "path": "people.csv"}}],
 *   "edges": [{"source": "a", "target": "b"}],
 *   "lang": "sql",
 *   "previewId": "b",
 *   "code": "SELECT 1"
 * }
 * </pre>
 *
 * Node fields may sit in {@code data} or directly on the node. Legacy kind
 * tags and field names of the studio front end are accepted: join keys as
 * {@code left_on}/{@code right_on}, a measure alias as {@code as}, uploaded
 * text as {@code _fileText}. A select's {@code schema} list of
 * {@code {"name", "dtype"}} entries becomes its column casts.
 */
public final class GraphJsonReader {

    private GraphJsonReader() {
    }

    /**
     * @throws GraphCompileException if the document is not a valid pipeline
     */
    public static PipelineRequest readRequest(String json) {
        Map<String, Object> document;
        try {
            document = Json.parseObject(json);
        } catch (IllegalArgumentException e) {
            throw new GraphCompileException("Invalid request document: " + e.getMessage(), e);
        }
        return new PipelineRequest(
                readGraph(document),
                Json.getString(document, "lang"),
                blankToNull(Json.getString(document, "previewId")),
                Json.getString(document, "code"));
    }

    public static PipelineGraph readGraph(String json) {
        return readRequest(json).graph();
    }

    @SuppressWarnings("unchecked")
    public static PipelineGraph readGraph(Map<String, Object> document) {
        PipelineGraph.Builder builder = PipelineGraph.builder();
        for (Object entry : listOf(document, "nodes")) {
            builder.node(readNode(asObject(entry, "node")));
        }
        for (Object entry : listOf(document, "edges")) {
            Map<String, Object> edge = asObject(entry, "edge");
            builder.edge(requireString(edge, "source", "edge"), requireString(edge, "target", "edge"));
        }
        return builder.build();
    }

    // ==================== Nodes ====================

    @SuppressWarnings("unchecked")
    static PipelineNode readNode(Map<String, Object> node) {
        String id = requireString(node, "id", "node");
        Map<String, Object> data = node.get("data") instanceof Map<?, ?> nested
                ? (Map<String, Object>) nested
                : node;
        String type = text(data, "type");
        if (type == null) {
            type = text(node, "type");
        }
        String label = text(data, "label");
        NodeKind kind = NodeKind.fromWireName(type);

        return switch (kind) {
            case LOAD -> new LoadNode(id, label, text(data, "path"), firstText(data, "_fileText", "fileText", "content"));
            case SELECT -> new SelectNode(id, label, ColumnSelection.parse(text(data, "columns")), readCasts(data));
            case FILTER -> new FilterNode(id, label, PassthroughExpression.of(text(data, "expr")));
            case AGGREGATE -> new AggregateNode(id, label,
                    ColumnSelection.splitList(text(data, "groupBy")), readMeasures(data));
            case DERIVE -> new DeriveNode(id, label, text(data, "newCol"), PassthroughExpression.of(text(data, "expr")));
            case SORT -> new SortNode(id, label, SortNode.parseKeys(text(data, "sortSpec")));
            case SAMPLE -> new SampleNode(id, label,
                    SampleNode.SampleMode.fromWireName(text(data, "mode")),
                    intValue(data, "n", SampleNode.DEFAULT_ROWS),
                    doubleValue(data, "frac", SampleNode.DEFAULT_FRACTION),
                    longValue(data, "seed"));
            case JOIN -> new JoinNode(id, label,
                    JoinNode.JoinType.fromWireName(text(data, "how")),
                    ColumnSelection.splitList(firstText(data, "leftKeys", "left_on")),
                    ColumnSelection.splitList(firstText(data, "rightKeys", "right_on")));
            case WRITE -> new WriteNode(id, label, text(data, "path"));
            case UNKNOWN -> new UnknownNode(id, label, type == null ? "" : type);
        };
    }

    /**
     * Measures with a blank column or operator are skipped.
     */
    private static List<Measure> readMeasures(Map<String, Object> data) {
        List<Measure> measures = new ArrayList<>();
        for (Object entry : listOf(data, "measures")) {
            Map<String, Object> measure = asObject(entry, "measure");
            String column = text(measure, "col");
            String op = text(measure, "op");
            if (column == null || op == null) {
                continue;
            }
            measures.add(new Measure(column, AggregateOp.fromWireName(op), firstText(measure, "alias", "as")));
        }
        return measures;
    }

    /**
     * Casts from the select node's {@code schema} list; entries without a
     * name are skipped and a missing dtype means string.
     */
    private static List<ColumnCast> readCasts(Map<String, Object> data) {
        List<ColumnCast> casts = new ArrayList<>();
        for (Object entry : listOf(data, "schema")) {
            Map<String, Object> cast = asObject(entry, "schema entry");
            String name = text(cast, "name");
            if (name == null) {
                continue;
            }
            casts.add(ColumnCast.of(name, CastType.fromWireName(text(cast, "dtype"))));
        }
        return casts;
    }

    // ==================== Field access ====================

    private static String text(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static String firstText(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            String value = text(map, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String requireString(Map<String, Object> map, String key, String what) {
        String value = text(map, key);
        if (value == null) {
            throw new GraphCompileException("Missing '" + key + "' in " + what + ": " + Json.toJson(map));
        }
        return value;
    }

    private static int intValue(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = text(map, key);
        if (text == null) {
            return defaultValue;
        }
        try {
            return (int) Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new GraphCompileException("Field '" + key + "' is not a number: " + text, e);
        }
    }

    private static double doubleValue(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = text(map, key);
        if (text == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new GraphCompileException("Field '" + key + "' is not a number: " + text, e);
        }
    }

    private static Long longValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        String text = text(map, key);
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new GraphCompileException("Field '" + key + "' is not an integer: " + text, e);
        }
    }

    private static List<Object> listOf(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?>)) {
            throw new GraphCompileException("Field '" + key + "' must be an array");
        }
        @SuppressWarnings("unchecked")
        List<Object> list = (List<Object>) value;
        return list;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value, String what) {
        if (!(value instanceof Map<?, ?>)) {
            throw new GraphCompileException("Expected a JSON object for " + what + " but got: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
