package org.etlstudio.engine.plan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for graph construction, ordering and reachability.
 */
class PipelineGraphTest {

    private static PipelineNode load(String id) {
        return LoadNode.of(id, id, id + ".csv");
    }

    private static PipelineNode filter(String id, String expr) {
        return new FilterNode(id, id, PassthroughExpression.of(expr));
    }

    private static PipelineNode select(String id, String columns) {
        return new SelectNode(id, id, ColumnSelection.parse(columns));
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Duplicate node ids are rejected")
        void testDuplicateIds() {
            GraphCompileException e = assertThrows(GraphCompileException.class, () -> PipelineGraph.builder()
                    .node(load("a"))
                    .node(load("a"))
                    .build());
            assertTrue(e.getMessage().contains("Duplicate node id: a"));
        }

        @Test
        @DisplayName("Edges to unknown nodes are rejected")
        void testUnknownEdgeEndpoint() {
            assertThrows(GraphCompileException.class, () -> PipelineGraph.builder()
                    .node(load("a"))
                    .edge("a", "missing")
                    .build());
        }

        @Test
        @DisplayName("A filter without a parent violates the arity contract")
        void testMissingParent() {
            GraphCompileException e = assertThrows(GraphCompileException.class, () -> PipelineGraph.builder()
                    .node(filter("f", "x > 1"))
                    .build());
            assertTrue(e.getMessage().contains("expects 1 input(s) but has 0"), e.getMessage());
        }

        @Test
        @DisplayName("A load with a parent violates the arity contract")
        void testLoadWithParent() {
            assertThrows(GraphCompileException.class, () -> PipelineGraph.builder()
                    .node(load("a"))
                    .node(load("b"))
                    .edge("a", "b")
                    .build());
        }

        @Test
        @DisplayName("A join needs two distinct parents; duplicate edges count once")
        void testJoinArity() {
            JoinNode join = new JoinNode("j", "Join", JoinNode.JoinType.INNER, List.of("id"), List.of("id"));
            assertThrows(GraphCompileException.class, () -> PipelineGraph.builder()
                    .node(load("a"))
                    .node(join)
                    .edge("a", "j")
                    .edge("a", "j")
                    .build());

            PipelineGraph ok = PipelineGraph.builder()
                    .node(load("a"))
                    .node(load("b"))
                    .node(join)
                    .edge("a", "j")
                    .edge("b", "j")
                    .build();
            assertEquals(List.of("a", "b"), ok.parentsOf("j"));
        }

        @Test
        @DisplayName("A self-join goes through an intermediate select")
        void testSelfJoinThroughSelect() {
            JoinNode join = new JoinNode("j", "Join", JoinNode.JoinType.INNER, List.of("id"), List.of("id"));

            PipelineGraph graph = PipelineGraph.builder()
                    .node(load("a"))
                    .node(new SelectNode("s", "Copy", ColumnSelection.wildcard()))
                    .node(join)
                    .edge("a", "j")
                    .edge("a", "s")
                    .edge("s", "j")
                    .build();

            assertEquals(List.of("a", "s"), graph.parentsOf("j"));
        }

        @Test
        @DisplayName("Unknown kinds report their raw kind in arity errors")
        void testUnknownKindArity() {
            GraphCompileException e = assertThrows(GraphCompileException.class, () -> PipelineGraph.builder()
                    .node(new UnknownNode("u", "Pivot", "transform.pivot"))
                    .build());
            assertTrue(e.getMessage().contains("transform.pivot"));
        }
    }

    @Nested
    @DisplayName("Topological order")
    class OrderTests {

        @Test
        @DisplayName("Every edge source precedes its target")
        void testEdgesRespected() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(filter("c", "x > 1"))
                    .node(select("b", "*"))
                    .node(load("a"))
                    .chain("a", "b", "c")
                    .build();

            TopologicalOrder order = graph.topologicalOrder();

            assertFalse(order.cyclic());
            assertEquals(List.of("a", "b", "c"), order.ids());
            Map<String, Integer> positions = order.positions();
            for (Edge edge : graph.edges()) {
                assertTrue(positions.get(edge.source()) < positions.get(edge.target()));
            }
        }

        @Test
        @DisplayName("Ties are broken by caller node order")
        void testTieBreaking() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(load("z"))
                    .node(load("y"))
                    .node(filter("fz", ""))
                    .node(filter("fy", ""))
                    .edge("y", "fy")
                    .edge("z", "fz")
                    .build();

            assertEquals(List.of("z", "y", "fz", "fy"), graph.topologicalOrder().ids());
        }

        @Test
        @DisplayName("A cycle falls back to caller order and is flagged")
        void testCycleFallback() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(select("b", "*"))
                    .node(filter("a", "x > 1"))
                    .edge("a", "b")
                    .edge("b", "a")
                    .build();

            TopologicalOrder order = graph.topologicalOrder();

            assertTrue(order.cyclic());
            assertEquals(List.of("b", "a"), order.ids());
        }

        @Test
        @DisplayName("An empty graph has an empty order")
        void testEmptyGraph() {
            TopologicalOrder order = PipelineGraph.empty().topologicalOrder();
            assertTrue(order.isEmpty());
            assertNull(order.last());
        }
    }

    @Nested
    @DisplayName("Reachability")
    class ReachabilityTests {

        private final PipelineGraph graph = PipelineGraph.builder()
                .node(load("a"))
                .node(filter("b", "x > 1"))
                .node(select("c", "x"))
                .node(filter("d", "y < 2"))
                .edge("a", "b")
                .edge("b", "c")
                .edge("a", "d")
                .build();

        @Test
        @DisplayName("Ancestors include the target itself")
        void testAncestors() {
            assertEquals(Set.of("a", "b", "c"), graph.ancestorsOf("c"));
            assertEquals(Set.of("a"), graph.ancestorsOf("a"));
        }

        @Test
        @DisplayName("Subgraph keeps only edges between kept nodes")
        void testSubgraph() {
            PipelineGraph sub = graph.subgraphUpTo("b");

            assertEquals(List.of("a", "b"), sub.nodeIds());
            assertEquals(List.of(new Edge("a", "b")), sub.edges());
        }

        @Test
        @DisplayName("A null preview id keeps the whole graph")
        void testNullPreview() {
            assertSame(graph, graph.subgraphUpTo(null));
        }

        @Test
        @DisplayName("An unknown target id is a malformed graph")
        void testUnknownTarget() {
            assertThrows(GraphCompileException.class, () -> graph.ancestorsOf("nope"));
        }
    }

    @Nested
    @DisplayName("Node payloads")
    class PayloadTests {

        @Test
        @DisplayName("Sort keys parse a trailing desc in any case")
        void testSortSpec() {
            List<SortNode.SortKey> keys = SortNode.parseKeys("region, revenue DESC , name asc");
            assertEquals(List.of(
                    SortNode.SortKey.asc("region"),
                    SortNode.SortKey.desc("revenue"),
                    SortNode.SortKey.asc("name")), keys);
        }

        @Test
        @DisplayName("Right keys wrap to the first entry when the list is shorter")
        void testJoinKeyWrap() {
            JoinNode join = new JoinNode("j", "J", JoinNode.JoinType.LEFT, List.of("a", "b"), List.of("x"));

            assertEquals("x", join.rightKeyAt(0));
            assertEquals("x", join.rightKeyAt(1));
            assertEquals(List.of("x", "x"), join.pairedRightKeys());
            assertFalse(join.sameNamedKeys());
        }

        @Test
        @DisplayName("Blank join keys default to id")
        void testJoinDefaults() {
            JoinNode join = new JoinNode("j", null, null, null, List.of());
            assertEquals(JoinNode.JoinType.INNER, join.joinType());
            assertEquals(List.of("id"), join.leftKeys());
            assertTrue(join.sameNamedKeys());
        }

        @Test
        @DisplayName("Aggregate measure output name defaults to op_column")
        void testMeasureName() {
            assertEquals("sum_amount", new AggregateNode.Measure("amount", AggregateOp.SUM, null).outputName());
            assertEquals("total", new AggregateNode.Measure("amount", AggregateOp.SUM, " total ").outputName());
        }

        @Test
        @DisplayName("Unknown aggregate operators are rejected")
        void testUnknownOperator() {
            assertThrows(GraphCompileException.class, () -> AggregateOp.fromWireName("variance"));
            assertEquals(AggregateOp.MEAN, AggregateOp.fromWireName("Mean"));
        }

        @Test
        @DisplayName("Legacy kind tags resolve to their current kinds")
        void testLegacyKinds() {
            assertEquals(NodeKind.LOAD, NodeKind.fromWireName("source.csv"));
            assertEquals(NodeKind.WRITE, NodeKind.fromWireName("sink.csv"));
            assertEquals(NodeKind.AGGREGATE, NodeKind.fromWireName("transform.summarize"));
            assertEquals(NodeKind.DERIVE, NodeKind.fromWireName("transform.formula"));
            assertEquals(NodeKind.UNKNOWN, NodeKind.fromWireName("transform.pivot"));
        }
    }
}
