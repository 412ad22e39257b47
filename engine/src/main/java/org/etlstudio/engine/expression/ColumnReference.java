package org.etlstudio.engine.expression;

import java.util.Objects;

/**
 * Reference to a column of the row being evaluated.
 *
 * @param columnName The column name
 */
public record ColumnReference(String columnName) implements ScalarExpression {

    public ColumnReference {
        Objects.requireNonNull(columnName, "Column name cannot be null");
    }

    public static ColumnReference of(String columnName) {
        return new ColumnReference(columnName);
    }

    @Override
    public <T> T accept(ScalarExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return columnName;
    }
}
