package org.etlstudio.engine.expression;

import java.util.Objects;

/**
 * Represents a comparison expression (e.g., {@code age >= 18}) or a null
 * test ({@code email IS NULL}).
 *
 * @param left     The left operand
 * @param operator The comparison operator
 * @param right    The right operand, null for null tests
 */
public record ComparisonExpression(
        ScalarExpression left,
        ComparisonOperator operator,
        ScalarExpression right) implements ScalarExpression {

    public enum ComparisonOperator {
        EQUALS("=="),
        NOT_EQUALS("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUALS("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUALS(">="),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isNullTest() {
            return this == IS_NULL || this == IS_NOT_NULL;
        }
    }

    public ComparisonExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        if (!operator.isNullTest()) {
            Objects.requireNonNull(right, "Right operand cannot be null");
        }
    }

    public static ComparisonExpression isNull(ScalarExpression operand, boolean negated) {
        return new ComparisonExpression(operand,
                negated ? ComparisonOperator.IS_NOT_NULL : ComparisonOperator.IS_NULL, null);
    }

    @Override
    public <T> T accept(ScalarExpressionVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        if (operator.isNullTest()) {
            return "(" + left + " " + operator.symbol() + ")";
        }
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
