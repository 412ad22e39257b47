package org.etlstudio.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Groups the input by a column list (possibly empty) and computes measures.
 *
 * @param id       The node id
 * @param label    The display label
 * @param groupBy  The grouping columns, in output order
 * @param measures The aggregate measures, in output order
 */
public record AggregateNode(
        String id,
        String label,
        List<String> groupBy,
        List<Measure> measures) implements PipelineNode {

    public AggregateNode {
        Objects.requireNonNull(id, "Id cannot be null");
        label = label == null ? "" : label;
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        measures = measures == null ? List.of() : List.copyOf(measures);
    }

    /**
     * One aggregate output column.
     *
     * @param column The input column
     * @param op     The aggregate operator
     * @param alias  The output name, or null for the default {@code op_column}
     */
    public record Measure(String column, AggregateOp op, String alias) {
        public Measure {
            Objects.requireNonNull(column, "Column cannot be null");
            Objects.requireNonNull(op, "Operator cannot be null");
            alias = alias == null || alias.isBlank() ? null : alias.trim();
        }

        public String outputName() {
            return alias != null ? alias : op.wireName() + "_" + column;
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AGGREGATE;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
