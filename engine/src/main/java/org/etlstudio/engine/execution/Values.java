package org.etlstudio.engine.execution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering and equality helpers for table values.
 */
public final class Values {

    /**
     * Total order over non-null values: numbers numerically (booleans as
     * 0/1), strings lexicographically. Values of unrelated types order by
     * type name so sorting never fails on mixed columns.
     */
    public static final Comparator<Object> NATURAL = Values::compareNonNull;

    /**
     * {@link #NATURAL} with nulls after every value, in either direction.
     */
    public static final Comparator<Object> NULLS_LAST = Comparator.nullsLast(NATURAL);

    private Values() {
    }

    /**
     * Comparator over rows for one column; nulls sort last in both directions.
     */
    public static Comparator<Row> byColumn(int index, boolean descending) {
        return (a, b) -> {
            Object x = a.get(index);
            Object y = b.get(index);
            if (x == null || y == null) {
                return x == null ? (y == null ? 0 : 1) : -1;
            }
            int cmp = compareNonNull(x, y);
            return descending ? -cmp : cmp;
        };
    }

    /**
     * Lexicographic order over key tuples with nulls last per element.
     */
    public static int compareTuples(List<Object> a, List<Object> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = NULLS_LAST.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    /**
     * Normalizes a value for use in a hash key so {@code 1} and {@code 1.0}
     * fall into the same bucket.
     */
    public static Object keyOf(Object value) {
        if (value instanceof Long || value instanceof Integer) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    public static List<Object> keyTuple(Row row, int[] indices) {
        List<Object> key = new ArrayList<>(indices.length);
        for (int index : indices) {
            key.add(keyOf(row.get(index)));
        }
        return key;
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }

    private static int compareNonNull(Object a, Object b) {
        if (a instanceof Long x && b instanceof Long y) {
            return Long.compare(x, y);
        }
        if (isNumeric(a) && isNumeric(b)) {
            return Double.compare(toDouble(a), toDouble(b));
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        if (a.getClass() == b.getClass() && a instanceof Comparable) {
            @SuppressWarnings("unchecked")
            Comparable<Object> comparable = (Comparable<Object>) a;
            return comparable.compareTo(b);
        }
        return a.getClass().getSimpleName().compareTo(b.getClass().getSimpleName());
    }

    public static double toDouble(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return ((Number) value).doubleValue();
    }
}
