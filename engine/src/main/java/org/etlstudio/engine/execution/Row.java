package org.etlstudio.engine.execution;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row of values in a table. Values are {@link Long}, {@link Double},
 * {@link Boolean}, {@link String} or null.
 */
public record Row(List<Object> values) {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public Row {
        // Rows may hold nulls, so List.copyOf is not an option
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Row of(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new Row(list);
    }

    /**
     * Gets the value at the specified index.
     */
    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    /**
     * Creates a Row from the current position of a ResultSet.
     */
    public static Row fromResultSet(ResultSet rs, int columnCount) throws SQLException {
        List<Object> values = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            values.add(normalize(rs.getObject(i)));
        }
        return new Row(values);
    }

    /**
     * Narrows driver-specific values to the table value types. Temporal
     * values become ISO text, the form CSV readers leave them in.
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof Long || value instanceof Double
                || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof java.sql.Timestamp ts) {
            return TIMESTAMP.format(ts.toLocalDateTime());
        }
        if (value instanceof LocalDateTime ldt) {
            return TIMESTAMP.format(ldt);
        }
        if (value instanceof OffsetDateTime odt) {
            return TIMESTAMP.format(odt.toLocalDateTime());
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof LocalDate || value instanceof LocalTime) {
            return value.toString();
        }
        return value.toString();
    }
}
