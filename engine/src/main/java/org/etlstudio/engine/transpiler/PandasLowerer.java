package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.AggregateNode;
import org.etlstudio.engine.plan.AggregateNode.Measure;
import org.etlstudio.engine.plan.AggregateOp;
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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lowers a pipeline graph to a pandas program.
 *
 * Each node binds one variable named by {@link NameAssigner}; the program
 * ends with {@code result = <last>}. Generated code sorts with a stable
 * algorithm and nulls last, groups with sorted keys and keeps null groups,
 * so its output lines up with the interpreter and the other backends.
 */
public final class PandasLowerer implements PipelineLowerer {

    public static final PandasLowerer INSTANCE = new PandasLowerer();

    private static final PythonDialect DIALECT = PythonDialect.INSTANCE;

    private static final SourceReadRewriter READS = new SourceReadRewriter(
            "pd\\.read_csv\\(", DIALECT, SourceReadRewriter::pythonLiteralBody);

    private PandasLowerer() {
    }

    @Override
    public Backend backend() {
        return Backend.PANDAS;
    }

    @Override
    public String lower(PipelineGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        LoweringContext context = new LoweringContext(graph);
        StringBuilder sb = new StringBuilder();
        sb.append("# Generated by ETL Studio (pandas)\n");
        sb.append("import numpy as np\n");
        sb.append("import pandas as pd\n");

        Emitter emitter = new Emitter(context);
        for (String id : context.order()) {
            sb.append('\n').append(graph.node(id).accept(emitter));
        }

        String last = context.resultName();
        sb.append('\n').append("result = ").append(last == null ? "pd.DataFrame()" : last).append('\n');
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
            String comment = "# Source: " + commentText(load.label().isEmpty() ? load.path() : load.label()) + "\n";
            return comment + bind(load.id(), "pd.read_csv(" + DIALECT.quoteStringLiteral(load.path()) + ")");
        }

        @Override
        public String visit(SelectNode select) {
            String input = context.input(select);
            String name = context.nameOf(select.id());
            StringBuilder code = new StringBuilder();
            if (select.columns().isWildcard()) {
                code.append(bind(select.id(), input + ".copy()"));
            } else {
                code.append(bind(select.id(), input + "[" + stringList(select.columns().columns()) + "].copy()"));
            }
            // columns of a wildcard over file data are checked at run time
            boolean guarded = select.columns().isWildcard()
                    && !known.isKnown(context.graph().parentsOf(select.id()).get(0));
            for (ColumnCast cast : known.applicableCasts(select)) {
                String column = name + "[" + DIALECT.quoteStringLiteral(cast.column()) + "]";
                if (guarded) {
                    code.append("if ").append(DIALECT.quoteStringLiteral(cast.column())).append(" in ")
                            .append(name).append(".columns: ");
                }
                code.append(column).append(" = ").append(castCall(cast.type(), column)).append('\n');
            }
            return code.toString();
        }

        @Override
        public String visit(FilterNode filter) {
            String input = context.input(filter);
            if (filter.predicate().isBlank()) {
                return bind(filter.id(), input + ".copy()");
            }
            return bind(filter.id(), input + ".query(" + DIALECT.renderExpression(filter.predicate()) + ")");
        }

        @Override
        public String visit(AggregateNode aggregate) {
            String input = context.input(aggregate);
            List<String> groupBy = aggregate.groupBy();
            List<Measure> measures = aggregate.measures();
            if (groupBy.isEmpty() && measures.isEmpty()) {
                return bind(aggregate.id(), input + ".copy()");
            }
            if (groupBy.isEmpty()) {
                String columns = measures.stream()
                        .map(m -> DIALECT.quoteStringLiteral(m.outputName()) + ": ["
                                + input + "[" + DIALECT.quoteStringLiteral(m.column()) + "].agg("
                                + DIALECT.quoteStringLiteral(pandasOp(m.op())) + ")]")
                        .collect(Collectors.joining(", "));
                return bind(aggregate.id(), "pd.DataFrame({" + columns + "})");
            }
            String grouped = input + ".groupby(" + stringList(groupBy) + ", sort=True, dropna=False)";
            if (measures.isEmpty()) {
                return bind(aggregate.id(), grouped + ".size().reset_index()[" + stringList(groupBy) + "]");
            }
            String named = measures.stream()
                    .map(m -> DIALECT.quoteStringLiteral(m.outputName()) + ": ("
                            + DIALECT.quoteStringLiteral(m.column()) + ", "
                            + DIALECT.quoteStringLiteral(pandasOp(m.op())) + ")")
                    .collect(Collectors.joining(", "));
            return bind(aggregate.id(), grouped + ".agg(**{" + named + "}).reset_index()");
        }

        @Override
        public String visit(DeriveNode derive) {
            String name = context.nameOf(derive.id());
            return bind(derive.id(), context.input(derive) + ".copy()")
                    + name + "[" + DIALECT.quoteStringLiteral(derive.newColumn()) + "] = "
                    + name + ".eval(" + DIALECT.renderExpression(derive.expression()) + ", engine=\"python\")\n";
        }

        @Override
        public String visit(SortNode sort) {
            String input = context.input(sort);
            if (sort.keys().isEmpty()) {
                return bind(sort.id(), input + ".copy()");
            }
            String columns = stringList(sort.keys().stream().map(SortNode.SortKey::column).toList());
            String ascending = sort.keys().stream()
                    .map(k -> DIALECT.formatBoolean(!k.descending()))
                    .collect(Collectors.joining(", ", "[", "]"));
            return bind(sort.id(), input + ".sort_values(" + columns + ", ascending=" + ascending
                    + ", kind=\"stable\", na_position=\"last\")");
        }

        @Override
        public String visit(SampleNode sample) {
            String input = context.input(sample);
            String seed = sample.seed() == null ? DIALECT.formatNull() : String.valueOf(sample.seed());
            if (sample.mode() == SampleNode.SampleMode.FRACTION) {
                return bind(sample.id(), input + "[np.random.default_rng(" + seed + ").random(len(" + input
                        + ")) < " + sample.fraction() + "]");
            }
            return bind(sample.id(), input + ".sample(n=min(" + sample.n() + ", len(" + input
                    + ")), random_state=" + seed + ")");
        }

        @Override
        public String visit(JoinNode join) {
            String left = context.inputAt(join, 0);
            String right = context.inputAt(join, 1);
            String how = DIALECT.quoteStringLiteral(join.joinType().wireName());
            if (join.sameNamedKeys()) {
                return bind(join.id(), left + ".merge(" + right + ", how=" + how
                        + ", on=" + stringList(join.leftKeys()) + ")");
            }
            return bind(join.id(), left + ".merge(" + right + ", how=" + how
                    + ", left_on=" + stringList(join.leftKeys())
                    + ", right_on=" + stringList(join.pairedRightKeys()) + ")");
        }

        @Override
        public String visit(WriteNode write) {
            String input = context.input(write);
            return input + ".to_csv(" + DIALECT.quoteStringLiteral(write.path()) + ", index=False)\n"
                    + bind(write.id(), input);
        }

        @Override
        public String visit(UnknownNode unknown) {
            return "# Unhandled node kind '" + commentText(unknown.rawKind()) + "': input passed through\n"
                    + bind(unknown.id(), context.input(unknown) + ".copy()");
        }
    }

    // ==================== Helpers ====================

    private static String castCall(CastType type, String column) {
        return switch (type) {
            case INTEGER -> "pd.to_numeric(" + column + ", errors=\"coerce\").astype(\"Int64\")";
            case FLOAT -> "pd.to_numeric(" + column + ", errors=\"coerce\")";
            case BOOLEAN -> column + ".astype(\"boolean\")";
            case DATE -> "pd.to_datetime(" + column + ", errors=\"coerce\").dt.date";
            case DATETIME -> "pd.to_datetime(" + column + ", errors=\"coerce\")";
            case STRING -> column + ".astype(\"string\")";
        };
    }

    static String pandasOp(AggregateOp op) {
        return switch (op) {
            case AVG, MEAN -> "mean";
            default -> op.wireName();
        };
    }

    private static String stringList(List<String> values) {
        return values.stream()
                .map(DIALECT::quoteStringLiteral)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    static String commentText(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }
}
