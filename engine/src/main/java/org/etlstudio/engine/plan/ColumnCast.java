package org.etlstudio.engine.plan;

import java.util.Objects;

/**
 * Coerces one column of a select node's output to a type. A cast naming a
 * column the output does not have is ignored.
 *
 * @param column The column name
 * @param type   The target type
 */
public record ColumnCast(String column, CastType type) {

    public ColumnCast {
        Objects.requireNonNull(column, "Column cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
    }

    public static ColumnCast of(String column, CastType type) {
        return new ColumnCast(column, type);
    }
}
