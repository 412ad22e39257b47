package org.etlstudio.engine.execution;

import org.etlstudio.engine.plan.CastType;
import org.etlstudio.engine.plan.ColumnCast;
import org.etlstudio.engine.serialization.CsvWriter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies a select node's column casts with dataframe coercion rules:
 * numbers and temporal values that do not parse become null, a
 * non-integral number cast to integer is an error, and booleans accept
 * only boolean-like values.
 *
 * Dates render as {@code yyyy-MM-dd} and datetimes as
 * {@code yyyy-MM-dd HH:mm:ss}, the forms database temporal values take in a
 * {@link Row}.
 */
final class ColumnCaster {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ColumnCaster() {
    }

    static Table apply(Table table, List<ColumnCast> casts) {
        Table current = table;
        for (ColumnCast cast : casts) {
            int index = current.indexOf(cast.column());
            if (index < 0) {
                continue;
            }
            current = castColumn(current, index, cast.type());
        }
        return current;
    }

    private static Table castColumn(Table table, int index, CastType type) {
        List<Row> rows = new ArrayList<>(table.rowCount());
        for (Row row : table.rows()) {
            List<Object> values = new ArrayList<>(row.values());
            values.set(index, cast(values.get(index), type, table.columns().get(index).name()));
            rows.add(new Row(values));
        }
        List<Column> columns = new ArrayList<>(table.columns());
        columns.set(index, Column.of(table.columns().get(index).name(), dtypeOf(type)));
        return new Table(columns, rows);
    }

    private static String dtypeOf(CastType type) {
        return switch (type) {
            case INTEGER -> Column.INT64;
            case FLOAT -> Column.FLOAT64;
            case BOOLEAN -> Column.BOOL;
            case DATE, DATETIME, STRING -> Column.OBJECT;
        };
    }

    static Object cast(Object value, CastType type, String column) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case INTEGER -> toInteger(value, column);
            case FLOAT -> toDouble(value);
            case BOOLEAN -> toBoolean(value, column);
            case DATE -> toDate(value);
            case DATETIME -> toTimestamp(value);
            case STRING -> toText(value);
        };
    }

    // ==================== Numbers ====================

    private static Double toDouble(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long toInteger(Object value, String column) {
        if (value instanceof Long l) {
            return l;
        }
        Double d = toDouble(value);
        if (d == null) {
            return null;
        }
        if (d != Math.rint(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException(
                    "Cannot cast non-integral value " + value + " in column " + column + " to integer");
        }
        return d.longValue();
    }

    private static Boolean toBoolean(Object value, String column) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.equals("true")) {
            return true;
        }
        if (text.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException("Cannot cast " + value + " in column " + column + " to boolean");
    }

    // ==================== Text and time ====================

    private static String toText(Object value) {
        if (value instanceof Double d) {
            return CsvWriter.formatDouble(d);
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return value.toString();
    }

    private static String toDate(Object value) {
        LocalDateTime parsed = toDateTime(value);
        return parsed == null ? null : parsed.toLocalDate().toString();
    }

    private static String toTimestamp(Object value) {
        LocalDateTime parsed = toDateTime(value);
        return parsed == null ? null : TIMESTAMP.format(parsed);
    }

    /**
     * Parses {@code yyyy-MM-dd} with an optional time of day separated by a
     * space or {@code T}.
     */
    private static LocalDateTime toDateTime(Object value) {
        String text = value.toString().trim();
        try {
            if (text.length() <= 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            return LocalDateTime.parse(text.replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
