package org.etlstudio.engine.execution;

import org.etlstudio.engine.plan.AggregateOp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate operators over one column of one group. Missing values are
 * skipped by every operator.
 */
public final class Aggregations {

    private Aggregations() {
    }

    /**
     * @param op     The aggregate operator
     * @param column The column name, for error messages
     * @param values The group's values, nulls included
     * @return The aggregate value, or null when it is undefined
     */
    public static Object apply(AggregateOp op, String column, List<Object> values) {
        List<Object> present = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value != null && !(value instanceof Double d && d.isNaN())) {
                present.add(value);
            }
        }
        return switch (op) {
            case COUNT -> (long) present.size();
            case NUNIQUE -> {
                Set<Object> distinct = new HashSet<>();
                for (Object value : present) {
                    distinct.add(Values.keyOf(value));
                }
                yield (long) distinct.size();
            }
            case MIN -> present.isEmpty() ? null : Collections.min(present, Values.NATURAL);
            case MAX -> present.isEmpty() ? null : Collections.max(present, Values.NATURAL);
            case SUM -> sum(column, present);
            case MEAN, AVG -> present.isEmpty() ? null : (Object) (toDouble(column, present, op).stream()
                    .mapToDouble(Double::doubleValue).sum() / present.size());
            case MEDIAN -> median(toDouble(column, present, op));
            case STD -> stddev(toDouble(column, present, op));
        };
    }

    private static Object sum(String column, List<Object> present) {
        boolean integral = true;
        for (Object value : present) {
            integral &= value instanceof Long || value instanceof Boolean;
        }
        if (integral) {
            long total = 0L;
            for (Object value : present) {
                total += value instanceof Boolean b ? (b ? 1L : 0L) : (Long) value;
            }
            return total;
        }
        double total = 0.0;
        for (double d : toDouble(column, present, AggregateOp.SUM)) {
            total += d;
        }
        return total;
    }

    private static Object median(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    /**
     * Sample standard deviation (n - 1 denominator).
     */
    private static Object stddev(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return null;
        }
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= n;
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (n - 1));
    }

    private static List<Double> toDouble(String column, List<Object> present, AggregateOp op) {
        List<Double> doubles = new ArrayList<>(present.size());
        for (Object value : present) {
            if (!Values.isNumeric(value)) {
                throw new IllegalArgumentException("Cannot compute " + op.wireName()
                        + " of non-numeric column '" + column + "'");
            }
            doubles.add(Values.toDouble(value));
        }
        return doubles;
    }
}
