package org.etlstudio.engine.expression;

import java.util.Objects;

/**
 * Represents a binary arithmetic expression. Unary minus is parsed as
 * {@code 0 - operand}.
 *
 * @param left     The left operand
 * @param operator The arithmetic operator
 * @param right    The right operand
 */
public record ArithmeticExpression(
        ScalarExpression left,
        ArithmeticOperator operator,
        ScalarExpression right) implements ScalarExpression {

    public enum ArithmeticOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        FLOOR_DIVIDE("//"),
        MODULO("%"),
        POWER("**");

        private final String symbol;

        ArithmeticOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public ArithmeticExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static ArithmeticExpression negate(ScalarExpression operand) {
        return new ArithmeticExpression(Literal.of(0L), ArithmeticOperator.SUBTRACT, operand);
    }

    @Override
    public <T> T accept(ScalarExpressionVisitor<T> visitor) {
        return visitor.visitArithmetic(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
