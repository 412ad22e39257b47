package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.AggregateNode;
import org.etlstudio.engine.plan.AggregateNode.Measure;
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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lowers a pipeline graph to a DuckDB SQL script.
 *
 * Every node materialises as {@code CREATE OR REPLACE TEMP TABLE <name> AS ...}
 * and the script ends with {@code SELECT * FROM <last>}. Sinks additionally
 * {@code COPY} their input to the target file.
 *
 * Filter and derive expressions are embedded verbatim. A derive replaces its
 * column in place with {@code SELECT * REPLACE} when the input columns are
 * known from the graph (after an explicit select, an aggregate or another
 * derive). Otherwise it appends the column, and a name that already exists in
 * the source file ends up twice. Joins number their inputs by {@code rowid}
 * so the output keeps the interpreter's row order.
 */
public final class DuckDbSqlLowerer implements PipelineLowerer {

    public static final DuckDbSqlLowerer INSTANCE = new DuckDbSqlLowerer();

    private static final DuckDBDialect DIALECT = DuckDBDialect.INSTANCE;

    private static final SourceReadRewriter READS = new SourceReadRewriter(
            "(?i)read_csv(?:_auto)?\\(", DIALECT, SourceReadRewriter::sqlLiteralBody);

    private DuckDbSqlLowerer() {
    }

    @Override
    public Backend backend() {
        return Backend.DUCKDB;
    }

    @Override
    public String lower(PipelineGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        LoweringContext context = new LoweringContext(graph);
        StringBuilder sb = new StringBuilder();
        sb.append("-- Generated by ETL Studio (DuckDB SQL)\n");

        Emitter emitter = new Emitter(context);
        for (String id : context.order()) {
            sb.append(graph.node(id).accept(emitter));
        }

        String last = context.resultName();
        if (last != null) {
            sb.append("SELECT * FROM ").append(DIALECT.quoteIdentifier(last)).append(";\n");
        }
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

        private String create(String id, String select) {
            return "CREATE OR REPLACE TEMP TABLE " + DIALECT.quoteIdentifier(context.nameOf(id))
                    + " AS " + select + ";\n";
        }

        private String from(String inputName) {
            return " FROM " + DIALECT.quoteIdentifier(inputName);
        }

        private String copyOf(String id, String inputName) {
            return create(id, "SELECT *" + from(inputName));
        }

        @Override
        public String visit(LoadNode load) {
            return create(load.id(), "SELECT * FROM read_csv_auto("
                    + DIALECT.quoteStringLiteral(load.path()) + ", header=true)");
        }

        @Override
        public String visit(SelectNode select) {
            String input = context.input(select);
            Map<String, String> casts = new LinkedHashMap<>();
            for (ColumnCast cast : known.applicableCasts(select)) {
                casts.put(cast.column(), castExpression(cast) + " AS " + DIALECT.quoteIdentifier(cast.column()));
            }
            if (select.columns().isWildcard()) {
                if (casts.isEmpty()) {
                    return copyOf(select.id(), input);
                }
                return create(select.id(), "SELECT * REPLACE (" + String.join(", ", casts.values()) + ")" + from(input));
            }
            List<String> projections = new ArrayList<>();
            for (String column : select.columns().columns()) {
                projections.add(casts.getOrDefault(column, DIALECT.quoteIdentifier(column)));
            }
            return create(select.id(), "SELECT " + String.join(", ", projections) + from(input));
        }

        @Override
        public String visit(FilterNode filter) {
            String input = context.input(filter);
            if (filter.predicate().isBlank()) {
                return copyOf(filter.id(), input);
            }
            return create(filter.id(), "SELECT *" + from(input)
                    + " WHERE " + DIALECT.renderExpression(filter.predicate()));
        }

        @Override
        public String visit(AggregateNode aggregate) {
            String input = context.input(aggregate);
            List<String> groupBy = aggregate.groupBy();
            if (groupBy.isEmpty() && aggregate.measures().isEmpty()) {
                return copyOf(aggregate.id(), input);
            }
            List<String> projections = new ArrayList<>();
            for (String column : groupBy) {
                projections.add(DIALECT.quoteIdentifier(column));
            }
            for (Measure measure : aggregate.measures()) {
                projections.add(aggregateCall(measure) + " AS " + DIALECT.quoteIdentifier(measure.outputName()));
            }
            StringBuilder sql = new StringBuilder("SELECT ")
                    .append(String.join(", ", projections))
                    .append(from(input));
            if (!groupBy.isEmpty()) {
                sql.append(" GROUP BY ").append(identifierList(groupBy));
                sql.append(" ORDER BY ").append(groupBy.stream()
                        .map(c -> DIALECT.quoteIdentifier(c) + " ASC NULLS LAST")
                        .collect(Collectors.joining(", ")));
            }
            return create(aggregate.id(), sql.toString());
        }

        @Override
        public String visit(DeriveNode derive) {
            String computed = "(" + DIALECT.renderExpression(derive.expression()) + ") AS "
                    + DIALECT.quoteIdentifier(derive.newColumn());
            String input = context.input(derive);
            boolean replaces = known.of(context.graph().parentsOf(derive.id()).get(0))
                    .map(columns -> columns.contains(derive.newColumn()))
                    .orElse(false);
            if (replaces) {
                return create(derive.id(), "SELECT * REPLACE (" + computed + ")" + from(input));
            }
            return create(derive.id(), "SELECT *, " + computed + from(input));
        }

        @Override
        public String visit(SortNode sort) {
            String input = context.input(sort);
            if (sort.keys().isEmpty()) {
                return copyOf(sort.id(), input);
            }
            String orderBy = sort.keys().stream()
                    .map(k -> DIALECT.quoteIdentifier(k.column()) + (k.descending() ? " DESC" : " ASC") + " NULLS LAST")
                    .collect(Collectors.joining(", "));
            return create(sort.id(), "SELECT *" + from(input) + " ORDER BY " + orderBy);
        }

        @Override
        public String visit(SampleNode sample) {
            String input = context.input(sample);
            String seed = sample.seed() == null ? "" : ", " + sample.seed();
            String clause;
            if (sample.mode() == SampleNode.SampleMode.FRACTION) {
                String percent = BigDecimal.valueOf(sample.fraction())
                        .movePointRight(2)
                        .stripTrailingZeros()
                        .toPlainString();
                clause = percent + " PERCENT (bernoulli" + seed + ")";
            } else {
                clause = sample.n() + " ROWS (reservoir" + seed + ")";
            }
            return create(sample.id(), "SELECT *" + from(input) + " USING SAMPLE " + clause);
        }

        @Override
        public String visit(JoinNode join) {
            String left = context.inputAt(join, 0);
            String right = context.inputAt(join, 1);
            StringBuilder sql = new StringBuilder("SELECT * EXCLUDE (")
                    .append(identifierList(List.of(LEFT_ROW, RIGHT_ROW))).append(')')
                    .append(" FROM ").append(numbered(left, LEFT_ROW))
                    .append(' ').append(join.joinType().toSql()).append(' ')
                    .append(numbered(right, RIGHT_ROW));
            if (join.sameNamedKeys()) {
                sql.append(" USING (").append(identifierList(join.leftKeys())).append(')');
            } else {
                List<String> conditions = new ArrayList<>();
                for (int i = 0; i < join.keyCount(); i++) {
                    conditions.add(qualified(left, join.leftKeys().get(i)) + " = " + qualified(right, join.rightKeyAt(i)));
                }
                sql.append(" ON ").append(String.join(" AND ", conditions));
            }
            sql.append(" ORDER BY ").append(String.join(", ", joinOrder(join, left)));
            return create(join.id(), sql.toString());
        }

        @Override
        public String visit(WriteNode write) {
            String input = context.input(write);
            return "COPY (SELECT *" + from(input) + ") TO " + DIALECT.quoteStringLiteral(write.path())
                    + " (HEADER, DELIMITER ',');\n"
                    + copyOf(write.id(), input);
        }

        @Override
        public String visit(UnknownNode unknown) {
            return "-- Unhandled node kind '" + PandasLowerer.commentText(unknown.rawKind()) + "': input passed through\n"
                    + copyOf(unknown.id(), context.input(unknown));
        }
    }

    // ==================== Join ordering ====================

    /**
     * Input row numbers, projected away after the join. Ordering by them keeps
     * the left input's row order (the right input's for a right join), with
     * each row's matches in the other input's order.
     */
    private static final String LEFT_ROW = "__left_row";
    private static final String RIGHT_ROW = "__right_row";

    private static String numbered(String input, String ordinal) {
        String name = DIALECT.quoteIdentifier(input);
        return "(SELECT *, rowid AS " + DIALECT.quoteIdentifier(ordinal) + " FROM " + name + ") AS " + name;
    }

    private static String qualified(String table, String column) {
        return DIALECT.quoteIdentifier(table) + "." + DIALECT.quoteIdentifier(column);
    }

    /**
     * A full outer join is ordered by its key columns first: the coalesced
     * key for same-named keys, the left key otherwise.
     */
    private static List<String> joinOrder(JoinNode join, String left) {
        List<String> order = new ArrayList<>();
        if (join.joinType() == JoinNode.JoinType.OUTER) {
            for (String key : join.leftKeys()) {
                String column = join.sameNamedKeys() ? DIALECT.quoteIdentifier(key) : qualified(left, key);
                order.add(column + " ASC NULLS LAST");
            }
        }
        List<String> ordinals = join.joinType() == JoinNode.JoinType.RIGHT
                ? List.of(RIGHT_ROW, LEFT_ROW)
                : List.of(LEFT_ROW, RIGHT_ROW);
        for (String ordinal : ordinals) {
            order.add(DIALECT.quoteIdentifier(ordinal) + " NULLS LAST");
        }
        return order;
    }

    // ==================== Helpers ====================

    /**
     * Unparseable numbers and temporal values become null.
     */
    private static String castExpression(ColumnCast cast) {
        String column = DIALECT.quoteIdentifier(cast.column());
        return switch (cast.type()) {
            case INTEGER -> "TRY_CAST(" + column + " AS BIGINT)";
            case FLOAT -> "TRY_CAST(" + column + " AS DOUBLE)";
            case BOOLEAN -> "CAST(" + column + " AS BOOLEAN)";
            case DATE -> "TRY_CAST(" + column + " AS DATE)";
            case DATETIME -> "TRY_CAST(" + column + " AS TIMESTAMP)";
            case STRING -> "CAST(" + column + " AS VARCHAR)";
        };
    }

    private static String aggregateCall(Measure measure) {
        String column = DIALECT.quoteIdentifier(measure.column());
        return switch (measure.op()) {
            case SUM -> "sum(" + column + ")";
            case MEAN, AVG -> "avg(" + column + ")";
            case MIN -> "min(" + column + ")";
            case MAX -> "max(" + column + ")";
            case COUNT -> "count(" + column + ")";
            case MEDIAN -> "median(" + column + ")";
            case NUNIQUE -> "count(DISTINCT " + column + ")";
            case STD -> "stddev_samp(" + column + ")";
        };
    }

    private static String identifierList(List<String> identifiers) {
        return identifiers.stream()
                .map(DIALECT::quoteIdentifier)
                .collect(Collectors.joining(", "));
    }
}
