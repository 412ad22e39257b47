package org.etlstudio.engine.service;

import org.etlstudio.engine.plan.AggregateNode;
import org.etlstudio.engine.plan.AggregateNode.Measure;
import org.etlstudio.engine.plan.ColumnCast;
import org.etlstudio.engine.plan.ColumnSelection;
import org.etlstudio.engine.plan.DeriveNode;
import org.etlstudio.engine.plan.Edge;
import org.etlstudio.engine.plan.FilterNode;
import org.etlstudio.engine.plan.JoinNode;
import org.etlstudio.engine.plan.LoadNode;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.PipelineNode;
import org.etlstudio.engine.plan.PipelineNodeVisitor;
import org.etlstudio.engine.plan.SampleNode;
import org.etlstudio.engine.plan.SelectNode;
import org.etlstudio.engine.plan.SortNode;
import org.etlstudio.engine.plan.UnknownNode;
import org.etlstudio.engine.plan.WriteNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a pipeline graph in the request document shape, so that
 * {@link GraphJsonReader} reads back an equal graph.
 */
public final class GraphJsonWriter implements PipelineNodeVisitor<Map<String, Object>> {

    public static final GraphJsonWriter INSTANCE = new GraphJsonWriter();

    private GraphJsonWriter() {
    }

    /**
     * {@code {"nodes": [{"id", "data": {...}}], "edges": [{"source", "target"}]}}
     */
    public Map<String, Object> toJsonMap(PipelineGraph graph) {
        List<Object> nodes = new ArrayList<>();
        for (PipelineNode node : graph.nodes()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", node.id());
            entry.put("data", node.accept(this));
            nodes.add(entry);
        }
        List<Object> edges = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("source", edge.source());
            entry.put("target", edge.target());
            edges.add(entry);
        }
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("nodes", nodes);
        json.put("edges", edges);
        return json;
    }

    private static Map<String, Object> data(PipelineNode node) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", node.kind().wireName());
        data.put("label", node.label());
        return data;
    }

    // ==================== Nodes ====================

    @Override
    public Map<String, Object> visit(LoadNode load) {
        Map<String, Object> data = data(load);
        data.put("path", load.path());
        load.inlineContent().ifPresent(content -> data.put("content", content));
        return data;
    }

    @Override
    public Map<String, Object> visit(SelectNode select) {
        Map<String, Object> data = data(select);
        data.put("columns", select.columns().isWildcard()
                ? ColumnSelection.WILDCARD
                : String.join(", ", select.columns().columns()));
        if (select.hasCasts()) {
            List<Object> schema = new ArrayList<>();
            for (ColumnCast cast : select.casts()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", cast.column());
                entry.put("dtype", cast.type().wireName());
                schema.add(entry);
            }
            data.put("schema", schema);
        }
        return data;
    }

    @Override
    public Map<String, Object> visit(FilterNode filter) {
        Map<String, Object> data = data(filter);
        data.put("expr", filter.predicate().text());
        return data;
    }

    @Override
    public Map<String, Object> visit(AggregateNode aggregate) {
        Map<String, Object> data = data(aggregate);
        data.put("groupBy", String.join(", ", aggregate.groupBy()));
        List<Object> measures = new ArrayList<>();
        for (Measure measure : aggregate.measures()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("col", measure.column());
            entry.put("op", measure.op().wireName());
            if (measure.alias() != null) {
                entry.put("alias", measure.alias());
            }
            measures.add(entry);
        }
        data.put("measures", measures);
        return data;
    }

    @Override
    public Map<String, Object> visit(DeriveNode derive) {
        Map<String, Object> data = data(derive);
        data.put("newCol", derive.newColumn());
        data.put("expr", derive.expression().text());
        return data;
    }

    @Override
    public Map<String, Object> visit(SortNode sort) {
        Map<String, Object> data = data(sort);
        data.put("sortSpec", sort.keys().stream()
                .map(k -> k.descending() ? k.column() + " desc" : k.column())
                .collect(Collectors.joining(", ")));
        return data;
    }

    @Override
    public Map<String, Object> visit(SampleNode sample) {
        Map<String, Object> data = data(sample);
        data.put("mode", sample.mode() == SampleNode.SampleMode.FRACTION ? "fraction" : "rows");
        data.put("n", sample.n());
        data.put("frac", sample.fraction());
        if (sample.seed() != null) {
            data.put("seed", sample.seed());
        }
        return data;
    }

    @Override
    public Map<String, Object> visit(JoinNode join) {
        Map<String, Object> data = data(join);
        data.put("how", join.joinType().wireName());
        data.put("leftKeys", String.join(", ", join.leftKeys()));
        data.put("rightKeys", String.join(", ", join.rightKeys()));
        return data;
    }

    @Override
    public Map<String, Object> visit(WriteNode write) {
        Map<String, Object> data = data(write);
        data.put("path", write.path());
        return data;
    }

    @Override
    public Map<String, Object> visit(UnknownNode unknown) {
        Map<String, Object> data = data(unknown);
        data.put("type", unknown.rawKind());
        return data;
    }
}
