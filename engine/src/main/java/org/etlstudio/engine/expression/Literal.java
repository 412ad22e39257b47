package org.etlstudio.engine.expression;

/**
 * A constant: {@link Long}, {@link Double}, {@link String}, {@link Boolean}
 * or null.
 *
 * @param value The literal value (can be null)
 */
public record Literal(Object value) implements ScalarExpression {

    private static final Literal NULL = new Literal(null);

    public Literal {
        if (value != null && !(value instanceof Long || value instanceof Double
                || value instanceof String || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getSimpleName());
        }
    }

    public static Literal of(Object value) {
        return value == null ? NULL : new Literal(value);
    }

    public static Literal nullLiteral() {
        return NULL;
    }

    @Override
    public <T> T accept(ScalarExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        if (value == null) {
            return "null";
        }
        return value instanceof String s ? "'" + s + "'" : value.toString();
    }
}
