package org.etlstudio.engine.execution;

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
import org.etlstudio.engine.plan.JoinNode.JoinType;
import org.etlstudio.engine.plan.LoadNode;
import org.etlstudio.engine.plan.PassthroughExpression;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.SampleNode;
import org.etlstudio.engine.plan.SampleNode.SampleMode;
import org.etlstudio.engine.plan.SelectNode;
import org.etlstudio.engine.plan.SortNode;
import org.etlstudio.engine.plan.SortNode.SortKey;
import org.etlstudio.engine.plan.UnknownNode;
import org.etlstudio.engine.plan.WriteNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-process reference interpreter.
 */
class PipelineInterpreterTest {

    private static final String PEOPLE = """
            name,age,city
            Alice,34,Paris
            Bob,17,Rome
            Carol,25,Paris
            Dan,12,Rome
            Eve,19,Oslo
            """;

    private static final String TIERS = """
            name,tier
            Alice,gold
            Bob,silver
            Carol,bronze
            """;

    private final PipelineInterpreter interpreter = new PipelineInterpreter();

    private static LoadNode people() {
        return new LoadNode("src", "People", "people.csv", PEOPLE);
    }

    private static LoadNode inline(String id, String content) {
        return new LoadNode(id, id, id + ".csv", content);
    }

    private static FilterNode filter(String id, String expr) {
        return new FilterNode(id, "", PassthroughExpression.of(expr));
    }

    private static PipelineGraph chain(org.etlstudio.engine.plan.PipelineNode... nodes) {
        PipelineGraph.Builder builder = PipelineGraph.builder();
        String[] ids = new String[nodes.length];
        for (int i = 0; i < nodes.length; i++) {
            builder.node(nodes[i]);
            ids[i] = nodes[i].id();
        }
        return builder.chain(ids).build();
    }

    private static List<Object> column(Table table, String name) {
        List<Object> values = new ArrayList<>();
        for (int r = 0; r < table.rowCount(); r++) {
            values.add(table.getValue(r, name));
        }
        return values;
    }

    // ==================== Node kinds ====================

    @Nested
    @DisplayName("Node kinds")
    class NodeKindTests {

        @Test
        @DisplayName("Inline load infers dtypes")
        void testLoadInline() {
            InterpretResult result = interpreter.run(chain(people()));

            Table table = result.table();
            assertEquals(List.of("name", "age", "city"), table.columnNames());
            assertEquals(Column.INT64, table.columns().get(1).dtype());
            assertEquals(Column.OBJECT, table.columns().get(0).dtype());
            assertEquals(5, table.rowCount());
            assertFalse(result.hasErrors());
        }

        @Test
        @DisplayName("File load resolves against the base directory")
        void testLoadFile(@TempDir Path dir) throws IOException {
            Files.writeString(dir.resolve("people.csv"), PEOPLE, StandardCharsets.UTF_8);

            InterpretResult result = new PipelineInterpreter(dir).run(chain(LoadNode.of("src", "People", "people.csv")));

            assertEquals(5, result.table().rowCount());
        }

        @Test
        @DisplayName("Filter keeps matching rows")
        void testFilter() {
            Table table = interpreter.run(chain(people(), filter("f", "age >= 18"))).table();

            assertEquals(List.of("Alice", "Carol", "Eve"), column(table, "name"));
        }

        @Test
        @DisplayName("Select projects and reorders columns")
        void testSelect() {
            SelectNode select = new SelectNode("s", "", ColumnSelection.parse("city, name"));

            Table table = interpreter.run(chain(people(), select)).table();

            assertEquals(List.of("city", "name"), table.columnNames());
            assertEquals("Paris", table.getValue(0, 0));
        }

        @Test
        @DisplayName("Aggregate groups are ordered by key")
        void testAggregate() {
            AggregateNode aggregate = new AggregateNode("g", "", List.of("city"), List.of(
                    new Measure("name", AggregateOp.COUNT, "n"),
                    new Measure("age", AggregateOp.MEAN, null)));

            Table table = interpreter.run(chain(people(), aggregate)).table();

            assertEquals(List.of("city", "n", "mean_age"), table.columnNames());
            assertEquals(List.of("Oslo", "Paris", "Rome"), column(table, "city"));
            assertEquals(List.of(1L, 2L, 2L), column(table, "n"));
            assertEquals(29.5, table.getValue(1, "mean_age"));
            assertEquals(Column.INT64, table.columns().get(1).dtype());
            assertEquals(Column.FLOAT64, table.columns().get(2).dtype());
        }

        @Test
        @DisplayName("Aggregate without group keys yields one row")
        void testAggregateWithoutGroups() {
            AggregateNode aggregate = new AggregateNode("g", "", List.of(), List.of(
                    new Measure("age", AggregateOp.SUM, "total"),
                    new Measure("age", AggregateOp.MAX, null)));

            Table table = interpreter.run(chain(people(), aggregate)).table();

            assertEquals(1, table.rowCount());
            assertEquals(107L, table.getValue(0, "total"));
            assertEquals(34L, table.getValue(0, "max_age"));
        }

        @Test
        @DisplayName("Derive appends a computed column")
        void testDerive() {
            DeriveNode derive = new DeriveNode("d", "", "adult", PassthroughExpression.of("age >= 18"));

            Table table = interpreter.run(chain(people(), derive)).table();

            assertEquals(List.of("name", "age", "city", "adult"), table.columnNames());
            assertEquals(List.of(true, false, true, false, true), column(table, "adult"));
            assertEquals(Column.BOOL, table.columns().get(3).dtype());
        }

        @Test
        @DisplayName("Derive replaces an existing column in place")
        void testDeriveReplace() {
            DeriveNode derive = new DeriveNode("d", "", "age", PassthroughExpression.of("age * 2"));

            Table table = interpreter.run(chain(people(), derive)).table();

            assertEquals(List.of("name", "age", "city"), table.columnNames());
            assertEquals(68L, table.getValue(0, "age"));
        }

        @Test
        @DisplayName("Sort is stable across keys")
        void testSort() {
            SortNode sort = new SortNode("o", "", List.of(SortKey.asc("city"), SortKey.desc("age")));

            Table table = interpreter.run(chain(people(), sort)).table();

            assertEquals(List.of("Eve", "Alice", "Carol", "Bob", "Dan"), column(table, "name"));
        }

        @Test
        @DisplayName("Row sampling is seeded and keeps input order")
        void testSampleRows() {
            SampleNode sample = new SampleNode("p", "", SampleMode.ROWS, 3, 0.1, 42L);

            Table first = interpreter.run(chain(people(), sample)).table();
            Table second = interpreter.run(chain(people(), sample)).table();

            assertEquals(3, first.rowCount());
            assertEquals(first.rows(), second.rows());
            List<String> order = List.of("Alice", "Bob", "Carol", "Dan", "Eve");
            List<Object> names = column(first, "name");
            for (int i = 1; i < names.size(); i++) {
                assertTrue(order.indexOf(names.get(i - 1)) < order.indexOf(names.get(i)));
            }
        }

        @Test
        @DisplayName("Row sampling caps at the input size")
        void testSampleMoreThanAvailable() {
            SampleNode sample = new SampleNode("p", "", SampleMode.ROWS, 50, 0.1, 1L);

            assertEquals(5, interpreter.run(chain(people(), sample)).table().rowCount());
        }

        @Test
        @DisplayName("Fraction sampling at the bounds")
        void testSampleFraction() {
            SampleNode none = new SampleNode("p", "", SampleMode.FRACTION, 0, 0.0, 3L);
            SampleNode all = new SampleNode("p", "", SampleMode.FRACTION, 0, 1.0, 3L);

            assertEquals(0, interpreter.run(chain(people(), none)).table().rowCount());
            assertEquals(5, interpreter.run(chain(people(), all)).table().rowCount());
        }

        @Test
        @DisplayName("Write stores the table and passes it on")
        void testWrite(@TempDir Path dir) throws IOException {
            WriteNode write = new WriteNode("w", "", "out/adults.csv");

            InterpretResult result = new PipelineInterpreter(dir).run(chain(people(), filter("f", "age >= 18"), write));

            assertEquals(3, result.table().rowCount());
            String written = Files.readString(dir.resolve("out/adults.csv"), StandardCharsets.UTF_8);
            assertEquals("name,age,city\nAlice,34,Paris\nCarol,25,Paris\nEve,19,Oslo\n", written);
        }

        @Test
        @DisplayName("Unknown kinds pass their input through")
        void testUnknown() {
            InterpretResult result = interpreter.run(chain(people(), new UnknownNode("u", "", "transform.pivot")));

            assertEquals(5, result.table().rowCount());
            assertFalse(result.hasErrors());
        }
    }

    // ==================== Joins ====================

    @Nested
    @DisplayName("Joins")
    class JoinTests {

        private PipelineGraph join(String right, JoinNode join) {
            return PipelineGraph.builder()
                    .node(people())
                    .node(inline("r", right))
                    .node(join)
                    .edge("src", join.id())
                    .edge("r", join.id())
                    .build();
        }

        @Test
        @DisplayName("Inner join coalesces a same-named key")
        void testInnerJoin() {
            JoinNode node = new JoinNode("j", "", JoinType.INNER, List.of("name"), List.of("name"));

            Table table = interpreter.run(join(TIERS, node)).table();

            assertEquals(List.of("name", "age", "city", "tier"), table.columnNames());
            assertEquals(List.of("gold", "silver", "bronze"), column(table, "tier"));
        }

        @Test
        @DisplayName("Left join keeps unmatched left rows with nulls")
        void testLeftJoin() {
            JoinNode node = new JoinNode("j", "", JoinType.LEFT, List.of("name"), List.of("name"));

            Table table = interpreter.run(join(TIERS, node)).table();

            assertEquals(5, table.rowCount());
            assertNull(table.getValue(3, "tier"));
            assertNull(table.getValue(4, "tier"));
        }

        @Test
        @DisplayName("Differently named keys keep both columns")
        void testDifferentKeyNames() {
            String orders = "customer,total\nAlice,10.5\nAlice,3.0\nEve,7.25\n";
            JoinNode node = new JoinNode("j", "", JoinType.INNER, List.of("name"), List.of("customer"));

            Table table = interpreter.run(join(orders, node)).table();

            assertEquals(List.of("name", "age", "city", "customer", "total"), table.columnNames());
            assertEquals(3, table.rowCount());
        }

        @Test
        @DisplayName("Clashing non-key columns get suffixes")
        void testSuffixes() {
            String moves = "name,city\nAlice,Lyon\nBob,Pisa\n";
            JoinNode node = new JoinNode("j", "", JoinType.INNER, List.of("name"), List.of("name"));

            Table table = interpreter.run(join(moves, node)).table();

            assertEquals(List.of("name", "age", "city_x", "city_y"), table.columnNames());
            assertEquals("Lyon", table.getValue(0, "city_y"));
        }

        @Test
        @DisplayName("Null keys never match")
        void testNullKeys() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(inline("l", "k,v\n1,a\n,b\n"))
                    .node(inline("r", "k,w\n1,x\n,y\n"))
                    .node(new JoinNode("j", "", JoinType.INNER, List.of("k"), List.of("k")))
                    .edge("l", "j")
                    .edge("r", "j")
                    .build();

            Table table = interpreter.run(graph).table();

            assertEquals(1, table.rowCount());
            assertEquals("x", table.getValue(0, "w"));
        }

        @Test
        @DisplayName("Outer join appends unmatched right rows")
        void testOuterJoin() {
            String extra = "name,tier\nAlice,gold\nZed,iron\n";
            JoinNode node = new JoinNode("j", "", JoinType.OUTER, List.of("name"), List.of("name"));

            Table table = interpreter.run(join(extra, node)).table();

            assertEquals(6, table.rowCount());
            assertEquals(List.of("Alice", "Bob", "Carol", "Dan", "Eve", "Zed"), column(table, "name"));
            assertEquals("iron", table.getValue(5, "tier"));
        }

        @Test
        @DisplayName("Left keys beyond the right key list pair with the first right key")
        void testWrappedKeys() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(inline("l", "a,b,v\n1,1,p\n1,2,q\n2,2,r\n3,3,s\n"))
                    .node(inline("r", "x,w\n1,X1\n2,X2\n3,X3\n"))
                    .node(new JoinNode("j", "", JoinType.LEFT, List.of("a", "b"), List.of("x")))
                    .edge("l", "j")
                    .edge("r", "j")
                    .build();

            Table table = interpreter.run(graph).table();

            // a = x AND b = x: only rows with a == b match
            assertEquals(List.of("a", "b", "v", "x", "w"), table.columnNames());
            assertEquals(List.of("p", "q", "r", "s"), column(table, "v"));
            assertEquals(Arrays.asList("X1", null, "X2", "X3"), column(table, "w"));
        }
    }

    // ==================== Fault isolation ====================

    @Nested
    @DisplayName("Fault isolation")
    class FaultIsolationTests {

        @Test
        @DisplayName("A failing filter keeps its input")
        void testFailingFilter() {
            InterpretResult result = interpreter.run(chain(people(), filter("f", "height > 1")));

            assertEquals(5, result.table().rowCount());
            assertEquals("transform.filter: name 'height' is not defined", result.nodeErrors().get("f"));
        }

        @Test
        @DisplayName("A failing derive yields a null column")
        void testFailingDerive() {
            DeriveNode derive = new DeriveNode("d", "", "bad", PassthroughExpression.of("name > 3"));

            InterpretResult result = interpreter.run(chain(people(), derive));

            assertEquals(5, result.table().rowCount());
            assertEquals(List.of("name", "age", "city", "bad"), result.table().columnNames());
            assertTrue(column(result.table(), "bad").stream().allMatch(v -> v == null));
            assertTrue(result.nodeErrors().get("d").startsWith("transform.derive: "));
        }

        @Test
        @DisplayName("Other failures substitute an empty table and the run continues")
        void testFailingSelect() {
            SelectNode select = new SelectNode("s", "", ColumnSelection.of("zzz"));

            InterpretResult result = interpreter.run(chain(people(), select, filter("f", "age > 1")));

            assertEquals(0, result.table().rowCount());
            assertEquals("transform.select: Column not found: zzz", result.nodeErrors().get("s"));
            assertEquals(1, result.nodeErrors().size());
        }

        @Test
        @DisplayName("A missing source file is reported against the load node")
        void testMissingFile(@TempDir Path dir) {
            InterpretResult result = new PipelineInterpreter(dir).run(chain(LoadNode.of("src", "", "missing.csv")));

            assertTrue(result.table().columns().isEmpty());
            assertTrue(result.nodeErrors().get("src").startsWith("source.load: Cannot read missing.csv"));
        }

        @Test
        @DisplayName("Aggregating text numerically is reported")
        void testAggregateTypeError() {
            AggregateNode aggregate = new AggregateNode("g", "", List.of(), List.of(
                    new Measure("city", AggregateOp.MEAN, null)));

            InterpretResult result = interpreter.run(chain(people(), aggregate));

            assertTrue(result.nodeErrors().containsKey("g"));
        }
    }

    // ==================== Column casts ====================

    @Nested
    @DisplayName("Column casts")
    class CastTests {

        private static final String MIXED = """
                v,d,flag,n
                1.0,2024-01-05,true,7
                x,2024-02-30,false,8
                """;

        @Test
        @DisplayName("Unparseable numbers and dates become null")
        void testCasts() {
            SelectNode select = new SelectNode("s", "", ColumnSelection.wildcard(), List.of(
                    ColumnCast.of("v", CastType.FLOAT),
                    ColumnCast.of("d", CastType.DATE),
                    ColumnCast.of("flag", CastType.STRING),
                    ColumnCast.of("n", CastType.FLOAT)));

            InterpretResult result = interpreter.run(chain(inline("src", MIXED), select));

            Table table = result.table();
            assertFalse(result.hasErrors());
            assertEquals(Arrays.asList(1.0, null), column(table, "v"));
            assertEquals(Arrays.asList("2024-01-05", null), column(table, "d"));
            assertEquals(List.of("True", "False"), column(table, "flag"));
            assertEquals(List.of(7.0, 8.0), column(table, "n"));
            assertEquals(Column.FLOAT64, table.columns().get(0).dtype());
            assertEquals(Column.OBJECT, table.columns().get(2).dtype());
        }

        @Test
        @DisplayName("Datetime and integer casts on a projection")
        void testProjectionCasts() {
            SelectNode select = new SelectNode("s", "", ColumnSelection.of("at", "n"), List.of(
                    ColumnCast.of("at", CastType.DATETIME),
                    ColumnCast.of("n", CastType.INTEGER)));

            Table table = interpreter.run(chain(inline("src", "at,n\n2024-03-01T10:30,4.0\n2024-03-02,\n"), select)).table();

            assertEquals(List.of("2024-03-01 10:30:00", "2024-03-02 00:00:00"), column(table, "at"));
            assertEquals(Arrays.asList(4L, null), column(table, "n"));
            assertEquals(Column.INT64, table.columns().get(1).dtype());
        }

        @Test
        @DisplayName("A non-integral value cast to integer fails the select")
        void testNonIntegral() {
            SelectNode select = new SelectNode("s", "", ColumnSelection.wildcard(), List.of(
                    ColumnCast.of("v", CastType.INTEGER)));

            InterpretResult result = interpreter.run(chain(inline("src", "v\n1\n2.5\n"), select));

            assertEquals(0, result.table().rowCount());
            assertEquals("transform.select: Cannot cast non-integral value 2.5 in column v to integer",
                    result.nodeErrors().get("s"));
        }

        @Test
        @DisplayName("Casts on columns the input lacks are ignored")
        void testMissingColumn() {
            SelectNode select = new SelectNode("s", "", ColumnSelection.wildcard(), List.of(
                    ColumnCast.of("zzz", CastType.INTEGER)));

            InterpretResult result = interpreter.run(chain(people(), select));

            assertFalse(result.hasErrors());
            assertEquals(List.of("name", "age", "city"), result.table().columnNames());
        }

        @Test
        @DisplayName("The last cast for a column wins")
        void testLastCastWins() {
            SelectNode select = new SelectNode("s", "", ColumnSelection.of("age"), List.of(
                    ColumnCast.of("age", CastType.STRING),
                    ColumnCast.of("age", CastType.FLOAT)));

            Table table = interpreter.run(chain(people(), select)).table();

            assertEquals(Column.FLOAT64, table.columns().get(0).dtype());
            assertEquals(34.0, table.getValue(0, 0));
        }
    }

    // ==================== Preview & ordering ====================

    @Nested
    @DisplayName("Preview and ordering")
    class PreviewTests {

        @Test
        @DisplayName("Preview returns the chosen node's table")
        void testPreview() {
            PipelineGraph graph = chain(people(), filter("f", "age >= 18"),
                    new SelectNode("s", "", ColumnSelection.of("name")));

            InterpretResult result = interpreter.run(graph, "f");

            assertEquals(List.of("name", "age", "city"), result.table().columnNames());
            assertEquals(3, result.table().rowCount());
        }

        @Test
        @DisplayName("Preview skips unrelated failing branches")
        void testPreviewIgnoresOtherBranches() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(people())
                    .node(filter("good", "age > 20"))
                    .node(filter("bad", "nope > 1"))
                    .edge("src", "good")
                    .edge("src", "bad")
                    .build();

            InterpretResult result = interpreter.run(graph, "good");

            assertFalse(result.hasErrors());
            assertEquals(2, result.table().rowCount());
        }

        @Test
        @DisplayName("Unknown preview id is rejected")
        void testUnknownPreview() {
            assertThrows(GraphCompileException.class, () -> interpreter.run(chain(people()), "nope"));
        }

        @Test
        @DisplayName("An empty graph yields an empty table")
        void testEmptyGraph() {
            InterpretResult result = interpreter.run(PipelineGraph.empty());

            assertTrue(result.table().columns().isEmpty());
            assertFalse(result.orderFallback());
        }

        @Test
        @DisplayName("A cyclic graph runs in caller order and is flagged")
        void testCycle() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(new SelectNode("a", "", ColumnSelection.wildcard()))
                    .node(new SelectNode("b", "", ColumnSelection.wildcard()))
                    .edge("a", "b")
                    .edge("b", "a")
                    .build();

            InterpretResult result = interpreter.run(graph);

            assertTrue(result.orderFallback());
            assertEquals(0, result.table().rowCount());
        }
    }
}
