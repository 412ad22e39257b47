package org.etlstudio.engine.service;

import org.etlstudio.engine.plan.AggregateNode;
import org.etlstudio.engine.plan.AggregateNode.Measure;
import org.etlstudio.engine.plan.AggregateOp;
import org.etlstudio.engine.plan.CastType;
import org.etlstudio.engine.plan.ColumnCast;
import org.etlstudio.engine.plan.ColumnSelection;
import org.etlstudio.engine.plan.DeriveNode;
import org.etlstudio.engine.plan.FilterNode;
import org.etlstudio.engine.plan.JoinNode;
import org.etlstudio.engine.plan.LoadNode;
import org.etlstudio.engine.plan.PassthroughExpression;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.SampleNode;
import org.etlstudio.engine.plan.SelectNode;
import org.etlstudio.engine.plan.SortNode;
import org.etlstudio.engine.plan.SortNode.SortKey;
import org.etlstudio.engine.plan.UnknownNode;
import org.etlstudio.engine.plan.WriteNode;
import org.etlstudio.engine.serialization.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rendering graphs back into request documents.
 */
class GraphJsonWriterTest {

    @Test
    @DisplayName("Every node kind reads back to an equal graph")
    void testReadBack() {
        PipelineGraph graph = PipelineGraph.builder()
                .node(new LoadNode("a", "Orders", "orders.csv", "id,amount\n1,2.5"))
                .node(LoadNode.of("b", "Customers", "customers.csv"))
                .node(new JoinNode("j", "Joined", JoinNode.JoinType.OUTER, List.of("cust_id", "region"), List.of("id")))
                .node(new SelectNode("s", "Typed", ColumnSelection.of("id", "amount"),
                        List.of(ColumnCast.of("amount", CastType.FLOAT), ColumnCast.of("id", CastType.STRING))))
                .node(new FilterNode("f", "Big", PassthroughExpression.of("(amount > 1) AND (id != '7')")))
                .node(new DeriveNode("d", "Taxed", "gross", PassthroughExpression.of("amount * 1.2")))
                .node(new AggregateNode("g", "Totals", List.of("id"), List.of(
                        new Measure("gross", AggregateOp.SUM, "total"),
                        new Measure("gross", AggregateOp.NUNIQUE, null))))
                .node(new SortNode("o", "Sorted", List.of(SortKey.desc("total"), SortKey.asc("id"))))
                .node(new SampleNode("p", "Some", SampleNode.SampleMode.FRACTION, 100, 0.25, 42L))
                .node(new UnknownNode("u", "Mystery", "transform.pivot"))
                .node(new WriteNode("w", "Out", "out.csv"))
                .edge("a", "j")
                .edge("b", "j")
                .chain("j", "s", "f", "d", "g", "o", "p", "u", "w")
                .build();

        String json = Json.toJson(GraphJsonWriter.INSTANCE.toJsonMap(graph));

        assertEquals(graph, GraphJsonReader.readGraph(json));
    }

    @Test
    @DisplayName("Nodes use the request shape with fields under data")
    @SuppressWarnings("unchecked")
    void testShape() {
        PipelineGraph graph = PipelineGraph.builder()
                .node(LoadNode.of("a", "People", "people.csv"))
                .node(new SelectNode("s", "", ColumnSelection.wildcard(), List.of(ColumnCast.of("age", CastType.INTEGER))))
                .chain("a", "s")
                .build();

        Map<String, Object> json = GraphJsonWriter.INSTANCE.toJsonMap(graph);

        Map<String, Object> select = (Map<String, Object>) Json.getList(json, "nodes").get(1);
        assertEquals("s", select.get("id"));
        Map<String, Object> data = Json.getObject(select, "data");
        assertEquals("transform.select", data.get("type"));
        assertEquals("*", data.get("columns"));
        assertEquals(List.of(Map.of("name", "age", "dtype", "integer")), data.get("schema"));
        assertEquals(List.of(Map.of("source", "a", "target", "s")), json.get("edges"));
    }
}
