package org.etlstudio.engine.expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Represents a logical expression combining multiple conditions.
 *
 * @param operator The logical operator (AND, OR, NOT)
 * @param operands The operand expressions
 */
public record LogicalExpression(
        LogicalOperator operator,
        List<ScalarExpression> operands) implements ScalarExpression {

    public enum LogicalOperator {
        AND,
        OR,
        NOT
    }

    public LogicalExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operands, "Operands cannot be null");
        operands = List.copyOf(operands);

        if (operator == LogicalOperator.NOT && operands.size() != 1) {
            throw new IllegalArgumentException("NOT operator requires exactly 1 operand");
        }
        if (operator != LogicalOperator.NOT && operands.size() < 2) {
            throw new IllegalArgumentException(operator + " operator requires at least 2 operands");
        }
    }

    public static LogicalExpression and(List<ScalarExpression> expressions) {
        return new LogicalExpression(LogicalOperator.AND, expressions);
    }

    public static LogicalExpression or(List<ScalarExpression> expressions) {
        return new LogicalExpression(LogicalOperator.OR, expressions);
    }

    public static LogicalExpression not(ScalarExpression expression) {
        return new LogicalExpression(LogicalOperator.NOT, List.of(expression));
    }

    @Override
    public <T> T accept(ScalarExpressionVisitor<T> visitor) {
        return visitor.visitLogical(this);
    }

    @Override
    public String toString() {
        if (operator == LogicalOperator.NOT) {
            return "NOT (" + operands.get(0) + ")";
        }
        return operands.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" " + operator + " ", "(", ")"));
    }
}
