package org.etlstudio.engine.expression;

import java.util.List;
import java.util.Objects;

/**
 * Membership test: {@code operand IN (v1, v2, ...)}.
 *
 * @param operand The tested expression
 * @param values  The candidate values
 * @param negated True for {@code NOT IN}
 */
public record InExpression(
        ScalarExpression operand,
        List<ScalarExpression> values,
        boolean negated) implements ScalarExpression {

    public InExpression {
        Objects.requireNonNull(operand, "Operand cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        values = List.copyOf(values);
    }

    @Override
    public <T> T accept(ScalarExpressionVisitor<T> visitor) {
        return visitor.visitIn(this);
    }
}
