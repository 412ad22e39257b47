package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.AggregateNode;
import org.etlstudio.engine.plan.AggregateNode.Measure;
import org.etlstudio.engine.plan.CastType;
import org.etlstudio.engine.plan.ColumnCast;
import org.etlstudio.engine.plan.DeriveNode;
import org.etlstudio.engine.plan.FilterNode;
import org.etlstudio.engine.plan.JoinNode;
import org.etlstudio.engine.plan.LoadNode;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.PipelineNodeVisitor;
import org.etlstudio.engine.plan.SampleNode;
import org.etlstudio.engine.plan.SelectNode;
import org.etlstudio.engine.plan.SortNode;
import org.etlstudio.engine.plan.UnknownNode;
import org.etlstudio.engine.plan.WriteNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lowers a pipeline graph to a PySpark program.
 *
 * The program creates (or reuses) a session bound to {@code spark}, reads
 * sources with header detection and schema inference, and binds the final
 * DataFrame to {@code result}.
 */
public final class PySparkLowerer implements PipelineLowerer {

    public static final PySparkLowerer INSTANCE = new PySparkLowerer();

    public static final String APP_NAME = "etl-studio";

    private static final PythonDialect DIALECT = PythonDialect.INSTANCE;

    private static final SourceReadRewriter READS = new SourceReadRewriter(
            "spark\\.read(?:\\s*\\.\\s*option\\([^)]*\\))*\\s*\\.\\s*csv\\(", DIALECT,
            SourceReadRewriter::pythonLiteralBody);

    private PySparkLowerer() {
    }

    @Override
    public Backend backend() {
        return Backend.PYSPARK;
    }

    @Override
    public String lower(PipelineGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        LoweringContext context = new LoweringContext(graph);
        StringBuilder sb = new StringBuilder();
        sb.append("# Generated by ETL Studio (PySpark)\n");
        sb.append("from pyspark.sql import SparkSession, functions as F\n");
        sb.append('\n');
        sb.append("spark = SparkSession.builder.appName(")
                .append(DIALECT.quoteStringLiteral(APP_NAME))
                .append(").getOrCreate()\n");

        Emitter emitter = new Emitter(context);
        for (String id : context.order()) {
            sb.append('\n').append(graph.node(id).accept(emitter));
        }

        String last = context.resultName();
        sb.append('\n').append("result = ").append(last == null ? "spark.range(0).drop(\"id\")" : last).append('\n');
        return sb.toString();
    }

    @Override
    public String rewriteSourcePaths(String programText, Map<String, String> replacements) {
        return READS.rewrite(programText, replacements);
    }

    // ==================== Node emission ====================

    private static final class Emitter implements PipelineNodeVisitor<String> {

        private final LoweringContext context;
        private final KnownColumns known;

        Emitter(LoweringContext context) {
            this.context = context;
            this.known = new KnownColumns(context.graph());
        }

        private String bind(String id, String rhs) {
            return context.nameOf(id) + " = " + rhs + "\n";
        }

        @Override
        public String visit(LoadNode load) {
            return "# Source: " + PandasLowerer.commentText(load.label().isEmpty() ? load.path() : load.label()) + "\n"
                    + bind(load.id(), "spark.read.option(\"header\", True).option(\"inferSchema\", True).csv("
                    + DIALECT.quoteStringLiteral(load.path()) + ")");
        }

        @Override
        public String visit(SelectNode select) {
            String input = context.input(select);
            StringBuilder rhs = new StringBuilder(input);
            if (!select.columns().isWildcard()) {
                rhs.append(".select(").append(argumentList(select.columns().columns())).append(')');
            }
            for (ColumnCast cast : known.applicableCasts(select)) {
                String column = DIALECT.quoteStringLiteral(cast.column());
                rhs.append(".withColumn(").append(column).append(", F.col(").append(column).append(").cast(")
                        .append(DIALECT.quoteStringLiteral(sparkType(cast.type()))).append("))");
            }
            return bind(select.id(), rhs.toString());
        }

        @Override
        public String visit(FilterNode filter) {
            String input = context.input(filter);
            if (filter.predicate().isBlank()) {
                return bind(filter.id(), input);
            }
            return bind(filter.id(), input + ".filter(" + DIALECT.renderExpression(filter.predicate()) + ")");
        }

        @Override
        public String visit(AggregateNode aggregate) {
            String input = context.input(aggregate);
            List<String> groupBy = aggregate.groupBy();
            List<Measure> measures = aggregate.measures();
            if (groupBy.isEmpty() && measures.isEmpty()) {
                return bind(aggregate.id(), input);
            }
            String aggs = measures.stream()
                    .map(m -> aggregateCall(m) + ".alias(" + DIALECT.quoteStringLiteral(m.outputName()) + ")")
                    .collect(Collectors.joining(", "));
            if (groupBy.isEmpty()) {
                return bind(aggregate.id(), input + ".agg(" + aggs + ")");
            }
            String order = groupBy.stream()
                    .map(c -> "F.col(" + DIALECT.quoteStringLiteral(c) + ").asc_nulls_last()")
                    .collect(Collectors.joining(", "));
            if (measures.isEmpty()) {
                return bind(aggregate.id(), input + ".select(" + argumentList(groupBy) + ").distinct().orderBy("
                        + order + ")");
            }
            return bind(aggregate.id(), input + ".groupBy(" + argumentList(groupBy) + ").agg(" + aggs
                    + ").orderBy(" + order + ")");
        }

        @Override
        public String visit(DeriveNode derive) {
            return bind(derive.id(), context.input(derive) + ".withColumn("
                    + DIALECT.quoteStringLiteral(derive.newColumn()) + ", F.expr("
                    + DIALECT.renderExpression(derive.expression()) + "))");
        }

        @Override
        public String visit(SortNode sort) {
            String input = context.input(sort);
            if (sort.keys().isEmpty()) {
                return bind(sort.id(), input);
            }
            String order = sort.keys().stream()
                    .map(k -> "F.col(" + DIALECT.quoteStringLiteral(k.column()) + ")."
                            + (k.descending() ? "desc_nulls_last()" : "asc_nulls_last()"))
                    .collect(Collectors.joining(", "));
            return bind(sort.id(), input + ".orderBy(" + order + ")");
        }

        @Override
        public String visit(SampleNode sample) {
            String input = context.input(sample);
            String seed = sample.seed() == null ? DIALECT.formatNull() : String.valueOf(sample.seed());
            if (sample.mode() == SampleNode.SampleMode.FRACTION) {
                return bind(sample.id(), input + ".sample(withReplacement=False, fraction="
                        + sample.fraction() + ", seed=" + seed + ")");
            }
            String rand = sample.seed() == null ? "F.rand()" : "F.rand(" + sample.seed() + ")";
            return bind(sample.id(), input + ".orderBy(" + rand + ").limit(" + sample.n() + ")");
        }

        @Override
        public String visit(JoinNode join) {
            String left = context.inputAt(join, 0);
            String right = context.inputAt(join, 1);
            String how = DIALECT.quoteStringLiteral(join.joinType().wireName());
            String on;
            if (join.sameNamedKeys()) {
                on = "[" + argumentList(join.leftKeys()) + "]";
            } else {
                List<String> conditions = new ArrayList<>();
                for (int i = 0; i < join.keyCount(); i++) {
                    conditions.add("(" + left + "[" + DIALECT.quoteStringLiteral(join.leftKeys().get(i)) + "] == "
                            + right + "[" + DIALECT.quoteStringLiteral(join.rightKeyAt(i)) + "])");
                }
                on = String.join(" & ", conditions);
            }
            return bind(join.id(), numbered(left, LEFT_ROW) + ".join(" + numbered(right, RIGHT_ROW)
                    + ", on=" + on + ", how=" + how + ")"
                    + ".orderBy(" + String.join(", ", joinOrder(join, left)) + ")"
                    + ".drop(" + argumentList(List.of(LEFT_ROW, RIGHT_ROW)) + ")");
        }

        @Override
        public String visit(WriteNode write) {
            String input = context.input(write);
            return input + ".coalesce(1).write.mode(\"overwrite\").option(\"header\", True).csv("
                    + DIALECT.quoteStringLiteral(write.path()) + ")\n"
                    + bind(write.id(), input);
        }

        @Override
        public String visit(UnknownNode unknown) {
            return "# Unhandled node kind '" + PandasLowerer.commentText(unknown.rawKind()) + "': input passed through\n"
                    + bind(unknown.id(), context.input(unknown));
        }
    }

    // ==================== Join ordering ====================

    private static final String LEFT_ROW = "__left_row";
    private static final String RIGHT_ROW = "__right_row";

    private static String numbered(String input, String ordinal) {
        return input + ".withColumn(" + DIALECT.quoteStringLiteral(ordinal) + ", F.monotonically_increasing_id())";
    }

    /**
     * Same order as the interpreter: input row numbers (right first for a
     * right join), preceded by the key columns for a full outer join.
     */
    private static List<String> joinOrder(JoinNode join, String left) {
        List<String> order = new ArrayList<>();
        if (join.joinType() == JoinNode.JoinType.OUTER) {
            for (String key : join.leftKeys()) {
                String column = join.sameNamedKeys()
                        ? "F.col(" + DIALECT.quoteStringLiteral(key) + ")"
                        : left + "[" + DIALECT.quoteStringLiteral(key) + "]";
                order.add(column + ".asc_nulls_last()");
            }
        }
        List<String> ordinals = join.joinType() == JoinNode.JoinType.RIGHT
                ? List.of(RIGHT_ROW, LEFT_ROW)
                : List.of(LEFT_ROW, RIGHT_ROW);
        for (String ordinal : ordinals) {
            order.add("F.col(" + DIALECT.quoteStringLiteral(ordinal) + ").asc_nulls_last()");
        }
        return order;
    }

    // ==================== Helpers ====================

    private static String sparkType(CastType type) {
        return switch (type) {
            case INTEGER -> "bigint";
            case FLOAT -> "double";
            case BOOLEAN -> "boolean";
            case DATE -> "date";
            case DATETIME -> "timestamp";
            case STRING -> "string";
        };
    }

    private static String aggregateCall(Measure measure) {
        String column = DIALECT.quoteStringLiteral(measure.column());
        return switch (measure.op()) {
            case SUM -> "F.sum(" + column + ")";
            case MEAN -> "F.mean(" + column + ")";
            case AVG -> "F.avg(" + column + ")";
            case MIN -> "F.min(" + column + ")";
            case MAX -> "F.max(" + column + ")";
            case COUNT -> "F.count(" + column + ")";
            case MEDIAN -> "F.median(" + column + ")";
            case NUNIQUE -> "F.countDistinct(" + column + ")";
            case STD -> "F.stddev_samp(" + column + ")";
        };
    }

    private static String argumentList(List<String> columns) {
        return columns.stream()
                .map(DIALECT::quoteStringLiteral)
                .collect(Collectors.joining(", "));
    }
}
