package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.AggregateNode;
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
import org.etlstudio.engine.plan.UnknownNode;
import org.etlstudio.engine.plan.WriteNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Text-shape tests for the three lowerers. Filter and derive expressions are
 * passed through untouched; whether an expression means the same thing in
 * every dialect is the pipeline author's concern, not the lowerer's.
 */
class PipelineLowererTest {

    /** load -> filter(age >= 18) -> select(name, age) */
    private static PipelineGraph adultsGraph() {
        return PipelineGraph.builder()
                .node(LoadNode.of("a", "People", "people.csv"))
                .node(new FilterNode("b", "Adults", PassthroughExpression.of("age >= 18")))
                .node(new SelectNode("c", "Columns", ColumnSelection.parse("name, age")))
                .chain("a", "b", "c")
                .build();
    }

    /** Two sources joined with a shorter right key list. */
    private static PipelineGraph wrapJoinGraph() {
        return PipelineGraph.builder()
                .node(LoadNode.of("l", "Left", "left.csv"))
                .node(LoadNode.of("r", "Right", "right.csv"))
                .node(new JoinNode("j", "Joined", JoinNode.JoinType.LEFT, List.of("a", "b"), List.of("x")))
                .edge("l", "j")
                .edge("r", "j")
                .build();
    }

    private static PipelineGraph chainOf(String loadPath, org.etlstudio.engine.plan.PipelineNode node) {
        return PipelineGraph.builder()
                .node(LoadNode.of("src", "Src", loadPath))
                .node(node)
                .edge("src", node.id())
                .build();
    }

    @Nested
    @DisplayName("pandas")
    class PandasTests {

        private final PipelineLowerer lowerer = PandasLowerer.INSTANCE;

        @Test
        @DisplayName("Each node binds one variable and the last becomes result")
        void testChain() {
            String code = lowerer.lower(adultsGraph());

            assertTrue(code.contains("import pandas as pd"));
            assertTrue(code.contains("people = pd.read_csv(\"people.csv\")"), code);
            assertTrue(code.contains("adults = people.query(\"age >= 18\")"), code);
            assertTrue(code.contains("columns = adults[[\"name\", \"age\"]].copy()"), code);
            assertTrue(code.endsWith("result = columns\n"), code);
        }

        @Test
        @DisplayName("Join keys wrap to the first right key")
        void testJoinWrap() {
            String code = lowerer.lower(wrapJoinGraph());

            assertTrue(code.contains(
                    "joined = left.merge(right, how=\"left\", left_on=[\"a\", \"b\"], right_on=[\"x\", \"x\"])"), code);
        }

        @Test
        @DisplayName("Group-by sorts keys, keeps null keys and names measures")
        void testAggregate() {
            AggregateNode agg = new AggregateNode("g", "By Region", List.of("region"), List.of(
                    new AggregateNode.Measure("amount", AggregateOp.SUM, null),
                    new AggregateNode.Measure("amount", AggregateOp.AVG, "avg_amt")));

            String code = lowerer.lower(chainOf("sales.csv", agg));

            assertTrue(code.contains("by_region = src.groupby([\"region\"], sort=True, dropna=False)"
                    + ".agg(**{\"sum_amount\": (\"amount\", \"sum\"), \"avg_amt\": (\"amount\", \"mean\")}).reset_index()"),
                    code);
        }

        @Test
        @DisplayName("Sort is stable with nulls last")
        void testSort() {
            SortNode sort = new SortNode("s", "Sorted", SortNode.parseKeys("region, amount desc"));

            String code = lowerer.lower(chainOf("sales.csv", sort));

            assertTrue(code.contains("sorted = src.sort_values([\"region\", \"amount\"], ascending=[True, False], "
                    + "kind=\"stable\", na_position=\"last\")"), code);
        }

        @Test
        @DisplayName("Casts over file columns are guarded by a membership check")
        void testCasts() {
            String wildcard = lowerer.lower(chainOf("sales.csv", new SelectNode("s", "Typed", ColumnSelection.wildcard(),
                    List.of(ColumnCast.of("amount", CastType.FLOAT)))));
            String projected = lowerer.lower(chainOf("sales.csv", new SelectNode("s", "Typed", ColumnSelection.parse("id, day"),
                    List.of(ColumnCast.of("id", CastType.INTEGER), ColumnCast.of("day", CastType.DATE)))));

            assertTrue(wildcard.contains("typed = src.copy()\nif \"amount\" in typed.columns: "
                    + "typed[\"amount\"] = pd.to_numeric(typed[\"amount\"], errors=\"coerce\")\n"), wildcard);
            assertTrue(projected.contains("typed = src[[\"id\", \"day\"]].copy()\n"
                    + "typed[\"id\"] = pd.to_numeric(typed[\"id\"], errors=\"coerce\").astype(\"Int64\")\n"
                    + "typed[\"day\"] = pd.to_datetime(typed[\"day\"], errors=\"coerce\").dt.date\n"), projected);
        }

        @Test
        @DisplayName("Derive evaluates the raw expression into the new column")
        void testDerive() {
            DeriveNode derive = new DeriveNode("d", "Total", "total", PassthroughExpression.of("price * qty"));

            String code = lowerer.lower(chainOf("sales.csv", derive));

            assertTrue(code.contains("total = src.copy()\ntotal[\"total\"] = total.eval(\"price * qty\", engine=\"python\")"),
                    code);
        }

        @Test
        @DisplayName("Sampling uses the seed when one is given")
        void testSample() {
            String rows = lowerer.lower(chainOf("s.csv",
                    new SampleNode("x", "Pick", SampleNode.SampleMode.ROWS, 5, 0.1, 7L)));
            String fraction = lowerer.lower(chainOf("s.csv",
                    new SampleNode("x", "Pick", SampleNode.SampleMode.FRACTION, 5, 0.25, null)));

            assertTrue(rows.contains("pick = src.sample(n=min(5, len(src)), random_state=7)"), rows);
            assertTrue(fraction.contains("pick = src[np.random.default_rng(None).random(len(src)) < 0.25]"), fraction);
        }

        @Test
        @DisplayName("Quotes in expressions are escaped for the string literal")
        void testEscaping() {
            FilterNode filter = new FilterNode("f", "Named", PassthroughExpression.of("name == \"Bob\""));

            String code = lowerer.lower(chainOf("p.csv", filter));

            assertTrue(code.contains("named = src.query(\"name == \\\"Bob\\\"\")"), code);
        }

        @Test
        @DisplayName("An empty graph still binds result")
        void testEmptyGraph() {
            assertTrue(lowerer.lower(PipelineGraph.empty()).endsWith("result = pd.DataFrame()\n"));
        }
    }

    @Nested
    @DisplayName("DuckDB SQL")
    class DuckDbTests {

        private final PipelineLowerer lowerer = DuckDbSqlLowerer.INSTANCE;

        @Test
        @DisplayName("Each node materialises a temp table and the script selects the last")
        void testChain() {
            String sql = lowerer.lower(adultsGraph());

            assertTrue(sql.contains("CREATE OR REPLACE TEMP TABLE \"people\" AS SELECT * FROM "
                    + "read_csv_auto('people.csv', header=true);"), sql);
            assertTrue(sql.contains("CREATE OR REPLACE TEMP TABLE \"adults\" AS SELECT * FROM \"people\" WHERE age >= 18;"),
                    sql);
            assertTrue(sql.contains("CREATE OR REPLACE TEMP TABLE \"columns\" AS SELECT \"name\", \"age\" FROM \"adults\";"),
                    sql);
            assertTrue(sql.endsWith("SELECT * FROM \"columns\";\n"), sql);
        }

        @Test
        @DisplayName("Join keys wrap to the first right key")
        void testJoinWrap() {
            String sql = lowerer.lower(wrapJoinGraph());

            assertTrue(sql.contains("LEFT OUTER JOIN (SELECT *, rowid AS \"__right_row\" FROM \"right\") AS \"right\" "
                    + "ON \"left\".\"a\" = \"right\".\"x\" AND \"left\".\"b\" = \"right\".\"x\""), sql);
        }

        @Test
        @DisplayName("Joins keep left input order and project the row numbers away")
        void testJoinOrder() {
            String sql = lowerer.lower(wrapJoinGraph());

            assertTrue(sql.contains("AS SELECT * EXCLUDE (\"__left_row\", \"__right_row\") "
                    + "FROM (SELECT *, rowid AS \"__left_row\" FROM \"left\") AS \"left\" LEFT OUTER JOIN"), sql);
            assertTrue(sql.contains(" ORDER BY \"__left_row\" NULLS LAST, \"__right_row\" NULLS LAST;"), sql);
        }

        @Test
        @DisplayName("Right joins order by the right input first")
        void testRightJoinOrder() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(LoadNode.of("l", "L", "l.csv"))
                    .node(LoadNode.of("r", "R", "r.csv"))
                    .node(new JoinNode("j", "J", JoinNode.JoinType.RIGHT, List.of("id"), List.of("id")))
                    .edge("l", "j")
                    .edge("r", "j")
                    .build();

            String sql = lowerer.lower(graph);

            assertTrue(sql.contains(" ORDER BY \"__right_row\" NULLS LAST, \"__left_row\" NULLS LAST;"), sql);
        }

        @Test
        @DisplayName("Same-named keys use USING so the key column appears once")
        void testJoinUsing() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(LoadNode.of("l", "L", "l.csv"))
                    .node(LoadNode.of("r", "R", "r.csv"))
                    .node(new JoinNode("j", "J", JoinNode.JoinType.OUTER, List.of("id"), List.of("id")))
                    .edge("l", "j")
                    .edge("r", "j")
                    .build();

            String sql = lowerer.lower(graph);

            assertTrue(sql.contains("FULL OUTER JOIN (SELECT *, rowid AS \"__right_row\" FROM \"r\") AS \"r\" USING (\"id\")"),
                    sql);
            assertTrue(sql.contains(" ORDER BY \"id\" ASC NULLS LAST, \"__left_row\" NULLS LAST, \"__right_row\" NULLS LAST;"),
                    sql);
        }

        @Test
        @DisplayName("A derive over known columns replaces the column in place")
        void testDeriveReplacesKnownColumn() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(LoadNode.of("src", "Src", "s.csv"))
                    .node(new SelectNode("k", "Kept", ColumnSelection.parse("k, v")))
                    .node(new DeriveNode("d", "Doubled", "v", PassthroughExpression.of("v * 2")))
                    .chain("src", "k", "d")
                    .build();

            String sql = lowerer.lower(graph);

            assertTrue(sql.contains("\"doubled\" AS SELECT * REPLACE ((v * 2) AS \"v\") FROM \"kept\";"), sql);
        }

        @Test
        @DisplayName("A derive over unknown or new columns appends")
        void testDeriveAppends() {
            String direct = lowerer.lower(chainOf("s.csv",
                    new DeriveNode("d", "Doubled", "v", PassthroughExpression.of("v * 2"))));
            PipelineGraph afterSelect = PipelineGraph.builder()
                    .node(LoadNode.of("src", "Src", "s.csv"))
                    .node(new SelectNode("k", "Kept", ColumnSelection.parse("k, v")))
                    .node(new DeriveNode("d", "Doubled", "w", PassthroughExpression.of("v * 2")))
                    .chain("src", "k", "d")
                    .build();

            assertTrue(direct.contains("\"doubled\" AS SELECT *, (v * 2) AS \"v\" FROM \"src\";"), direct);
            assertTrue(lowerer.lower(afterSelect).contains("SELECT *, (v * 2) AS \"w\" FROM \"kept\";"));
        }

        @Test
        @DisplayName("Casts replace columns in place and tolerate bad values")
        void testCasts() {
            String wildcard = lowerer.lower(chainOf("s.csv", new SelectNode("s", "Typed", ColumnSelection.wildcard(),
                    List.of(ColumnCast.of("amount", CastType.FLOAT), ColumnCast.of("at", CastType.DATETIME)))));
            String projected = lowerer.lower(chainOf("s.csv", new SelectNode("s", "Typed", ColumnSelection.parse("id, amount"),
                    List.of(ColumnCast.of("amount", CastType.STRING), ColumnCast.of("other", CastType.INTEGER)))));

            assertTrue(wildcard.contains("\"typed\" AS SELECT * REPLACE (TRY_CAST(\"amount\" AS DOUBLE) AS \"amount\", "
                    + "TRY_CAST(\"at\" AS TIMESTAMP) AS \"at\") FROM \"src\";"), wildcard);
            assertTrue(projected.contains("\"typed\" AS SELECT \"id\", CAST(\"amount\" AS VARCHAR) AS \"amount\" FROM \"src\";"),
                    projected);
        }

        @Test
        @DisplayName("Casts on columns a known input lacks are dropped")
        void testCastOnAbsentColumn() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(LoadNode.of("src", "Src", "s.csv"))
                    .node(new SelectNode("k", "Kept", ColumnSelection.parse("k, v")))
                    .node(new SelectNode("s", "Typed", ColumnSelection.wildcard(),
                            List.of(ColumnCast.of("zzz", CastType.BOOLEAN))))
                    .chain("src", "k", "s")
                    .build();

            String sql = lowerer.lower(graph);

            assertFalse(sql.contains("zzz"), sql);
        }

        @Test
        @DisplayName("Aggregates order by their group keys")
        void testAggregate() {
            AggregateNode agg = new AggregateNode("g", "Totals", List.of("region"), List.of(
                    new AggregateNode.Measure("amount", AggregateOp.NUNIQUE, null)));

            String sql = lowerer.lower(chainOf("sales.csv", agg));

            assertTrue(sql.contains("SELECT \"region\", count(DISTINCT \"amount\") AS \"nunique_amount\" FROM \"src\" "
                    + "GROUP BY \"region\" ORDER BY \"region\" ASC NULLS LAST"), sql);
        }

        @Test
        @DisplayName("Sampling uses DuckDB sample clauses")
        void testSample() {
            String rows = lowerer.lower(chainOf("s.csv",
                    new SampleNode("x", "Pick", SampleNode.SampleMode.ROWS, 5, 0.1, 42L)));
            String fraction = lowerer.lower(chainOf("s.csv",
                    new SampleNode("x", "Pick", SampleNode.SampleMode.FRACTION, 5, 0.25, null)));

            assertTrue(rows.contains("USING SAMPLE 5 ROWS (reservoir, 42)"), rows);
            assertTrue(fraction.contains("USING SAMPLE 25 PERCENT (bernoulli)"), fraction);
        }

        @Test
        @DisplayName("Sinks copy their input to the target file")
        void testWrite() {
            String sql = lowerer.lower(chainOf("s.csv", new WriteNode("w", "Out", "out/result.csv")));

            assertTrue(sql.contains("COPY (SELECT * FROM \"src\") TO 'out/result.csv' (HEADER, DELIMITER ',');"), sql);
        }

        @Test
        @DisplayName("Single quotes in paths are doubled")
        void testQuoting() {
            String sql = lowerer.lower(PipelineGraph.builder().node(LoadNode.of("a", "A", "o'brien.csv")).build());

            assertTrue(sql.contains("read_csv_auto('o''brien.csv', header=true)"), sql);
        }
    }

    @Nested
    @DisplayName("PySpark")
    class PySparkTests {

        private final PipelineLowerer lowerer = PySparkLowerer.INSTANCE;

        @Test
        @DisplayName("Reads with header and schema inference and binds result")
        void testChain() {
            String code = lowerer.lower(adultsGraph());

            assertTrue(code.contains("spark = SparkSession.builder.appName(\"etl-studio\").getOrCreate()"), code);
            assertTrue(code.contains("people = spark.read.option(\"header\", True).option(\"inferSchema\", True)"
                    + ".csv(\"people.csv\")"), code);
            assertTrue(code.contains("adults = people.filter(\"age >= 18\")"), code);
            assertTrue(code.contains("columns = adults.select(\"name\", \"age\")"), code);
            assertTrue(code.endsWith("result = columns\n"), code);
        }

        @Test
        @DisplayName("Join keys wrap to the first right key")
        void testJoinWrap() {
            String code = lowerer.lower(wrapJoinGraph());

            assertTrue(code.contains("joined = left.withColumn(\"__left_row\", F.monotonically_increasing_id())"
                    + ".join(right.withColumn(\"__right_row\", F.monotonically_increasing_id()), "
                    + "on=(left[\"a\"] == right[\"x\"]) & (left[\"b\"] == right[\"x\"]), how=\"left\")"
                    + ".orderBy(F.col(\"__left_row\").asc_nulls_last(), F.col(\"__right_row\").asc_nulls_last())"
                    + ".drop(\"__left_row\", \"__right_row\")"), code);
        }

        @Test
        @DisplayName("Sort puts nulls last in both directions")
        void testSort() {
            String code = lowerer.lower(chainOf("s.csv", new SortNode("s", "Sorted", SortNode.parseKeys("a desc, b"))));

            assertTrue(code.contains("sorted = src.orderBy(F.col(\"a\").desc_nulls_last(), F.col(\"b\").asc_nulls_last())"),
                    code);
        }

        @Test
        @DisplayName("Casts chain withColumn after the projection")
        void testCasts() {
            String code = lowerer.lower(chainOf("s.csv", new SelectNode("s", "Typed", ColumnSelection.parse("id, ok"),
                    List.of(ColumnCast.of("id", CastType.INTEGER), ColumnCast.of("ok", CastType.BOOLEAN)))));

            assertTrue(code.contains("typed = src.select(\"id\", \"ok\")"
                    + ".withColumn(\"id\", F.col(\"id\").cast(\"bigint\"))"
                    + ".withColumn(\"ok\", F.col(\"ok\").cast(\"boolean\"))"), code);
        }

        @Test
        @DisplayName("Exact-n sampling orders by a seeded random column")
        void testSample() {
            String code = lowerer.lower(chainOf("s.csv",
                    new SampleNode("x", "Pick", SampleNode.SampleMode.ROWS, 3, 0.1, 11L)));

            assertTrue(code.contains("pick = src.orderBy(F.rand(11)).limit(3)"), code);
        }
    }

    @Nested
    @DisplayName("Shared behaviour")
    class SharedTests {

        @Test
        @DisplayName("Unknown kinds leave a visible placeholder in every backend")
        void testUnknownPlaceholder() {
            PipelineGraph graph = chainOf("s.csv", new UnknownNode("u", "Pivot", "transform.pivot"));

            for (Backend backend : Backend.values()) {
                String code = backend.lowerer().lower(graph);
                assertTrue(code.contains("Unhandled node kind 'transform.pivot': input passed through"),
                        backend + ":\n" + code);
            }
        }

        @Test
        @DisplayName("Backends resolve from their language tags")
        void testLanguages() {
            assertEquals(Backend.PANDAS, Backend.fromLanguage("python").orElseThrow());
            assertEquals(Backend.DUCKDB, Backend.fromLanguage("SQL").orElseThrow());
            assertEquals(Backend.PYSPARK, Backend.fromLanguage("spark").orElseThrow());
            assertTrue(Backend.fromLanguage("scala").isEmpty());
            assertTrue(Backend.fromLanguage(null).isEmpty());
        }

        @Test
        @DisplayName("Source reads of a staged path are redirected; other text is untouched")
        void testRewriteSourcePaths() {
            Map<String, String> staged = Map.of("people.csv", "/tmp/etl_uploads_1/0_people.csv");

            String pandas = PandasLowerer.INSTANCE.rewriteSourcePaths(
                    "df = pd.read_csv('people.csv')\nprint(\"people.csv\")\n", staged);
            String sql = DuckDbSqlLowerer.INSTANCE.rewriteSourcePaths(
                    "SELECT * FROM read_csv_auto('people.csv', header=true);", staged);
            String spark = PySparkLowerer.INSTANCE.rewriteSourcePaths(
                    "df = spark.read.option(\"header\", True).csv(\"people.csv\")", staged);

            assertEquals("df = pd.read_csv(\"/tmp/etl_uploads_1/0_people.csv\")\nprint(\"people.csv\")\n", pandas);
            assertEquals("SELECT * FROM read_csv_auto('/tmp/etl_uploads_1/0_people.csv', header=true);", sql);
            assertEquals("df = spark.read.option(\"header\", True).csv(\"/tmp/etl_uploads_1/0_people.csv\")", spark);
        }

        @Test
        @DisplayName("Every lowerer uses the same names")
        void testSharedNames() {
            PipelineGraph graph = PipelineGraph.builder()
                    .node(LoadNode.of("a", "Step", "s.csv"))
                    .node(new FilterNode("b", "Step", PassthroughExpression.of("x > 1")))
                    .edge("a", "b")
                    .build();

            assertTrue(PandasLowerer.INSTANCE.lower(graph).contains("step_2 = step.query("));
            assertTrue(DuckDbSqlLowerer.INSTANCE.lower(graph).contains("\"step_2\" AS SELECT * FROM \"step\""));
            assertTrue(PySparkLowerer.INSTANCE.lower(graph).contains("step_2 = step.filter("));
        }
    }
}
