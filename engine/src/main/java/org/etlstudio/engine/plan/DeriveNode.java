package org.etlstudio.engine.plan;

import java.util.Objects;

/**
 * Copies the input and adds (or replaces) one computed column.
 *
 * @param id         The node id
 * @param label      The display label
 * @param newColumn  The name of the computed column
 * @param expression The opaque scalar expression text
 */
public record DeriveNode(
        String id,
        String label,
        String newColumn,
        PassthroughExpression expression) implements PipelineNode {

    public static final String DEFAULT_COLUMN = "new_column";

    public DeriveNode {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
        label = label == null ? "" : label;
        newColumn = newColumn == null || newColumn.isBlank() ? DEFAULT_COLUMN : newColumn.trim();
        if (expression.isBlank()) {
            expression = PassthroughExpression.of("0");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DERIVE;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
