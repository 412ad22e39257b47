package org.etlstudio.engine.execution;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.etlstudio.engine.expression.ExpressionParser;
import org.etlstudio.engine.expression.RowEvaluator;
import org.etlstudio.engine.expression.ScalarExpression;
import org.etlstudio.engine.plan.AggregateNode;
import org.etlstudio.engine.plan.AggregateNode.Measure;
import org.etlstudio.engine.plan.DeriveNode;
import org.etlstudio.engine.plan.FilterNode;
import org.etlstudio.engine.plan.JoinNode;
import org.etlstudio.engine.plan.LoadNode;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.PipelineNode;
import org.etlstudio.engine.plan.PipelineNodeVisitor;
import org.etlstudio.engine.plan.SampleNode;
import org.etlstudio.engine.plan.SelectNode;
import org.etlstudio.engine.plan.SortNode;
import org.etlstudio.engine.plan.TopologicalOrder;
import org.etlstudio.engine.plan.UnknownNode;
import org.etlstudio.engine.plan.WriteNode;
import org.etlstudio.engine.serialization.CsvReader;
import org.etlstudio.engine.serialization.CsvWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Executes a pipeline graph directly against in-process {@link Table}s.
 *
 * This is the reference the generated programs are validated against.
 * Nodes run in topological order, each holding one materialized table.
 * A failing node never aborts the run:
 * - filter: the unchanged input table is kept
 * - derive: the input rows are kept and the new column is all nulls
 * - any other kind: an empty table is substituted
 * In every case the failure is recorded as {@code "<node kind>: <message>"}.
 */
public final class PipelineInterpreter {

    private static final Logger LOG = LogManager.getLogger(PipelineInterpreter.class);

    private final Path baseDirectory;

    /**
     * @param baseDirectory Directory relative source and sink paths resolve against
     */
    public PipelineInterpreter(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "Base directory cannot be null");
    }

    public PipelineInterpreter() {
        this(Path.of(""));
    }

    /**
     * Runs the whole graph.
     */
    public InterpretResult run(PipelineGraph graph) {
        return run(graph, null);
    }

    /**
     * Runs the graph, restricted to the ancestors of {@code previewId} when
     * one is given.
     *
     * @throws org.etlstudio.engine.plan.GraphCompileException if the preview id is unknown
     */
    public InterpretResult run(PipelineGraph graph, String previewId) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        PipelineGraph scoped = graph.subgraphUpTo(previewId);
        TopologicalOrder order = scoped.topologicalOrder();
        if (order.cyclic()) {
            LOG.warn("Pipeline graph has a cycle; running {} nodes in caller order", order.size());
        }

        Map<String, Table> tables = new HashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        NodeEvaluator evaluator = new NodeEvaluator(scoped, tables);

        for (String id : order.ids()) {
            PipelineNode node = scoped.node(id);
            Table output;
            try {
                output = node.accept(evaluator);
                LOG.debug("Node '{}' ({}) produced {} rows", id, node.kind().wireName(), output.rowCount());
            } catch (RuntimeException e) {
                String message = describeKind(node) + ": " + messageOf(e);
                errors.put(id, message);
                output = recover(node, evaluator);
                LOG.warn("Node '{}' failed, continuing with fallback output: {}", id, message);
            }
            tables.put(id, output);
        }

        String last = order.last();
        Table result = last == null ? Table.empty() : tables.getOrDefault(last, Table.empty());
        return new InterpretResult(result, errors, order.cyclic());
    }

    private static Table recover(PipelineNode node, NodeEvaluator evaluator) {
        if (node instanceof FilterNode filter) {
            return evaluator.input(filter);
        }
        if (node instanceof DeriveNode derive) {
            return withColumn(evaluator.input(derive), derive.newColumn(), null);
        }
        return Table.empty();
    }

    private static String describeKind(PipelineNode node) {
        if (node instanceof UnknownNode unknown && !unknown.rawKind().isEmpty()) {
            return unknown.rawKind();
        }
        return node.kind().wireName();
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    /**
     * Sets or appends a column. A null {@code values} list fills it with nulls.
     */
    static Table withColumn(Table input, String name, List<Object> values) {
        int existing = input.indexOf(name);
        List<Row> rows = new ArrayList<>(input.rowCount());
        List<Object> newValues = new ArrayList<>(input.rowCount());
        for (int r = 0; r < input.rowCount(); r++) {
            Object value = values == null ? null : values.get(r);
            newValues.add(value);
            List<Object> row = new ArrayList<>(input.rows().get(r).values());
            if (existing >= 0) {
                row.set(existing, value);
            } else {
                row.add(value);
            }
            rows.add(new Row(row));
        }
        List<Column> columns = new ArrayList<>(input.columns());
        Column column = new Column(name, Column.inferDtype(newValues));
        if (existing >= 0) {
            columns.set(existing, column);
        } else {
            columns.add(column);
        }
        return new Table(columns, rows);
    }

    // ==================== Node evaluation ====================

    private final class NodeEvaluator implements PipelineNodeVisitor<Table> {

        private final PipelineGraph graph;
        private final Map<String, Table> tables;

        NodeEvaluator(PipelineGraph graph, Map<String, Table> tables) {
            this.graph = graph;
            this.tables = tables;
        }

        /**
         * Table of the node's first input. A parent that has not run (only
         * possible under the cycle fallback) reads as empty.
         */
        Table input(PipelineNode node) {
            return inputAt(node, 0);
        }

        Table inputAt(PipelineNode node, int index) {
            List<String> parents = graph.parentsOf(node.id());
            if (index >= parents.size()) {
                return Table.empty();
            }
            return tables.getOrDefault(parents.get(index), Table.empty());
        }

        @Override
        public Table visit(LoadNode load) {
            if (load.inlineContent().isPresent()) {
                return CsvReader.INSTANCE.parse(load.inlineContent().get());
            }
            try {
                return CsvReader.INSTANCE.read(baseDirectory.resolve(load.path()));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + load.path() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public Table visit(SelectNode select) {
            Table input = input(select);
            if (select.columns().isWildcard()) {
                return ColumnCaster.apply(input, select.casts());
            }
            List<String> names = select.columns().columns();
            int[] indices = new int[names.size()];
            List<Column> columns = new ArrayList<>(names.size());
            for (int i = 0; i < names.size(); i++) {
                indices[i] = input.requireColumn(names.get(i));
                columns.add(input.columns().get(indices[i]));
            }
            List<Row> rows = new ArrayList<>(input.rowCount());
            for (Row row : input.rows()) {
                List<Object> values = new ArrayList<>(indices.length);
                for (int index : indices) {
                    values.add(row.get(index));
                }
                rows.add(new Row(values));
            }
            return ColumnCaster.apply(new Table(columns, rows), select.casts());
        }

        @Override
        public Table visit(FilterNode filter) {
            Table input = input(filter);
            if (filter.predicate().isBlank()) {
                return input;
            }
            ScalarExpression predicate = ExpressionParser.parse(filter.predicate().text());
            RowEvaluator evaluator = new RowEvaluator(input.columnNames());
            List<Row> kept = new ArrayList<>();
            for (Row row : input.rows()) {
                if (evaluator.test(predicate, row)) {
                    kept.add(row);
                }
            }
            return input.withRows(kept);
        }

        @Override
        public Table visit(AggregateNode aggregate) {
            Table input = input(aggregate);
            List<String> groupBy = aggregate.groupBy();
            List<Measure> measures = aggregate.measures();
            if (groupBy.isEmpty() && measures.isEmpty()) {
                return input;
            }
            int[] groupIdx = new int[groupBy.size()];
            for (int i = 0; i < groupIdx.length; i++) {
                groupIdx[i] = input.requireColumn(groupBy.get(i));
            }
            int[] measureIdx = new int[measures.size()];
            for (int i = 0; i < measureIdx.length; i++) {
                measureIdx[i] = input.requireColumn(measures.get(i).column());
            }

            // Group key (normalized) -> original key values and member rows
            Map<List<Object>, List<Object>> keyValues = new LinkedHashMap<>();
            Map<List<Object>, List<Row>> groups = new LinkedHashMap<>();
            if (groupIdx.length == 0) {
                groups.put(List.of(), input.rows());
                keyValues.put(List.of(), List.of());
            } else {
                for (Row row : input.rows()) {
                    List<Object> key = Values.keyTuple(row, groupIdx);
                    groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
                    keyValues.computeIfAbsent(key, k -> {
                        List<Object> original = new ArrayList<>(groupIdx.length);
                        for (int index : groupIdx) {
                            original.add(row.get(index));
                        }
                        return original;
                    });
                }
            }

            List<List<Object>> keys = new ArrayList<>(groups.keySet());
            keys.sort(Values::compareTuples);

            List<String> names = new ArrayList<>(groupBy);
            for (Measure measure : measures) {
                names.add(measure.outputName());
            }
            List<Row> rows = new ArrayList<>(keys.size());
            for (List<Object> key : keys) {
                List<Object> values = new ArrayList<>(keyValues.get(key));
                List<Row> members = groups.get(key);
                for (int m = 0; m < measures.size(); m++) {
                    List<Object> column = new ArrayList<>(members.size());
                    for (Row member : members) {
                        column.add(member.get(measureIdx[m]));
                    }
                    values.add(Aggregations.apply(measures.get(m).op(), measures.get(m).column(), column));
                }
                rows.add(new Row(values));
            }
            return Table.withInferredTypes(names, rows);
        }

        @Override
        public Table visit(DeriveNode derive) {
            Table input = input(derive);
            ScalarExpression expression = ExpressionParser.parse(derive.expression().text());
            RowEvaluator evaluator = new RowEvaluator(input.columnNames());
            List<Object> values = new ArrayList<>(input.rowCount());
            for (Row row : input.rows()) {
                values.add(evaluator.evaluate(expression, row));
            }
            return withColumn(input, derive.newColumn(), values);
        }

        @Override
        public Table visit(SortNode sort) {
            Table input = input(sort);
            if (sort.keys().isEmpty()) {
                return input;
            }
            Comparator<Row> comparator = null;
            for (SortNode.SortKey key : sort.keys()) {
                Comparator<Row> next = Values.byColumn(input.requireColumn(key.column()), key.descending());
                comparator = comparator == null ? next : comparator.thenComparing(next);
            }
            List<Row> rows = new ArrayList<>(input.rows());
            // List.sort is stable
            rows.sort(comparator);
            return input.withRows(rows);
        }

        @Override
        public Table visit(SampleNode sample) {
            Table input = input(sample);
            Random random = sample.seed() == null ? new Random() : new Random(sample.seed());
            List<Row> kept = new ArrayList<>();
            if (sample.mode() == SampleNode.SampleMode.FRACTION) {
                for (Row row : input.rows()) {
                    if (random.nextDouble() < sample.fraction()) {
                        kept.add(row);
                    }
                }
                return input.withRows(kept);
            }
            int total = input.rowCount();
            int wanted = Math.min(sample.n(), total);
            // Selection sampling keeps the chosen rows in input order
            int needed = wanted;
            for (int i = 0; i < total && needed > 0; i++) {
                if (random.nextInt(total - i) < needed) {
                    kept.add(input.rows().get(i));
                    needed--;
                }
            }
            return input.withRows(kept);
        }

        @Override
        public Table visit(JoinNode join) {
            return new TableJoiner(join, inputAt(join, 0), inputAt(join, 1)).execute();
        }

        @Override
        public Table visit(WriteNode write) {
            Table input = input(write);
            try {
                CsvWriter.INSTANCE.write(input, baseDirectory.resolve(write.path()));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write " + write.path() + ": " + e.getMessage(), e);
            }
            return input;
        }

        @Override
        public Table visit(UnknownNode unknown) {
            return input(unknown);
        }
    }
}
