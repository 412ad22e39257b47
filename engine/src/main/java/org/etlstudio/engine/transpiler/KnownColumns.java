package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.AggregateNode;
import org.etlstudio.engine.plan.AggregateNode.Measure;
import org.etlstudio.engine.plan.ColumnCast;
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
import org.etlstudio.engine.plan.UnknownNode;
import org.etlstudio.engine.plan.WriteNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output columns of a node as far as they follow from the graph alone.
 *
 * Loads and joins depend on file contents, so their columns (and those of
 * everything downstream until an explicit select or aggregate) are unknown.
 */
final class KnownColumns implements PipelineNodeVisitor<Optional<List<String>>> {

    private final PipelineGraph graph;
    private final Map<String, Optional<List<String>>> cache = new HashMap<>();

    KnownColumns(PipelineGraph graph) {
        this.graph = graph;
    }

    /**
     * @return The node's output columns, or empty when they depend on data
     */
    Optional<List<String>> of(String id) {
        Optional<List<String>> cached = cache.get(id);
        if (cached == null) {
            cached = graph.node(id).accept(this);
            cache.put(id, cached);
        }
        return cached;
    }

    /**
     * Casts of a select that can apply: those on projected columns, or for a
     * wildcard those on columns the input has or may have.
     */
    List<ColumnCast> applicableCasts(SelectNode select) {
        if (!select.columns().isWildcard()) {
            return select.effectiveCasts();
        }
        Optional<List<String>> columns = input(select);
        List<ColumnCast> casts = new ArrayList<>();
        for (ColumnCast cast : select.casts()) {
            if (columns.map(c -> c.contains(cast.column())).orElse(true)) {
                casts.add(cast);
            }
        }
        return casts;
    }

    /**
     * @return True when the node's output columns follow from the graph
     */
    boolean isKnown(String id) {
        return of(id).isPresent();
    }

    private Optional<List<String>> input(PipelineNode node) {
        List<String> parents = graph.parentsOf(node.id());
        return parents.isEmpty() ? Optional.empty() : of(parents.get(0));
    }

    @Override
    public Optional<List<String>> visit(LoadNode load) {
        return Optional.empty();
    }

    @Override
    public Optional<List<String>> visit(SelectNode select) {
        if (select.columns().isWildcard()) {
            return input(select);
        }
        return Optional.of(select.columns().columns());
    }

    @Override
    public Optional<List<String>> visit(FilterNode filter) {
        return input(filter);
    }

    @Override
    public Optional<List<String>> visit(AggregateNode aggregate) {
        if (aggregate.groupBy().isEmpty() && aggregate.measures().isEmpty()) {
            return input(aggregate);
        }
        List<String> columns = new ArrayList<>(aggregate.groupBy());
        for (Measure measure : aggregate.measures()) {
            columns.add(measure.outputName());
        }
        return Optional.of(columns);
    }

    @Override
    public Optional<List<String>> visit(DeriveNode derive) {
        return input(derive).map(columns -> {
            if (columns.contains(derive.newColumn())) {
                return columns;
            }
            List<String> extended = new ArrayList<>(columns);
            extended.add(derive.newColumn());
            return extended;
        });
    }

    @Override
    public Optional<List<String>> visit(SortNode sort) {
        return input(sort);
    }

    @Override
    public Optional<List<String>> visit(SampleNode sample) {
        return input(sample);
    }

    @Override
    public Optional<List<String>> visit(JoinNode join) {
        return Optional.empty();
    }

    @Override
    public Optional<List<String>> visit(WriteNode write) {
        return input(write);
    }

    @Override
    public Optional<List<String>> visit(UnknownNode unknown) {
        return input(unknown);
    }
}
