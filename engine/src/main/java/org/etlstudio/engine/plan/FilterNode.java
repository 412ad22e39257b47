package org.etlstudio.engine.plan;

import java.util.Objects;

/**
 * Keeps the rows for which a boolean expression holds. A blank expression
 * keeps every row.
 *
 * @param id        The node id
 * @param label     The display label
 * @param predicate The opaque predicate text
 */
public record FilterNode(String id, String label, PassthroughExpression predicate) implements PipelineNode {

    public FilterNode {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        label = label == null ? "" : label;
    }

    public FilterNode withPredicate(PassthroughExpression newPredicate) {
        return new FilterNode(id, label, newPredicate);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILTER;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "FilterNode(" + id + ": " + predicate.text() + ")";
    }
}
