package org.etlstudio.engine.execution;

import java.util.Collection;
import java.util.Objects;

/**
 * Column metadata for a table: the name and a dataframe-style dtype label
 * ({@code int64}, {@code float64}, {@code bool}, {@code object}).
 *
 * Dtypes are informational; backends disagree on them and table
 * comparison ignores them.
 */
public record Column(String name, String dtype) {

    public static final String INT64 = "int64";
    public static final String FLOAT64 = "float64";
    public static final String BOOL = "bool";
    public static final String OBJECT = "object";

    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        dtype = dtype == null || dtype.isBlank() ? OBJECT : dtype;
    }

    public static Column of(String name, String dtype) {
        return new Column(name, dtype);
    }

    /**
     * Maps a JDBC type code to a dtype label.
     */
    public static String dtypeForJdbcType(int jdbcType) {
        return switch (jdbcType) {
            case java.sql.Types.INTEGER, java.sql.Types.SMALLINT, java.sql.Types.TINYINT,
                    java.sql.Types.BIGINT -> INT64;
            case java.sql.Types.DOUBLE, java.sql.Types.FLOAT, java.sql.Types.REAL,
                    java.sql.Types.DECIMAL, java.sql.Types.NUMERIC -> FLOAT64;
            case java.sql.Types.BOOLEAN, java.sql.Types.BIT -> BOOL;
            default -> OBJECT;
        };
    }

    /**
     * Infers a dtype from column values the way a dataframe library does:
     * integers with missing values widen to {@code float64}, and booleans
     * with missing values become {@code object}.
     */
    public static String inferDtype(Collection<?> values) {
        boolean hasNull = false;
        boolean allLong = true;
        boolean allNumber = true;
        boolean allBoolean = true;
        boolean any = false;
        for (Object value : values) {
            if (value == null) {
                hasNull = true;
                continue;
            }
            any = true;
            allLong &= value instanceof Long || value instanceof Integer;
            allNumber &= value instanceof Number;
            allBoolean &= value instanceof Boolean;
        }
        if (!any) {
            return hasNull ? FLOAT64 : OBJECT;
        }
        if (allLong) {
            return hasNull ? FLOAT64 : INT64;
        }
        if (allNumber) {
            return FLOAT64;
        }
        if (allBoolean) {
            return hasNull ? OBJECT : BOOL;
        }
        return OBJECT;
    }
}
