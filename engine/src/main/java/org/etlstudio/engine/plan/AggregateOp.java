package org.etlstudio.engine.plan;

import java.util.Locale;

/**
 * Aggregate operators supported by every backend.
 *
 * The wire name is what users type and what default output names are built
 * from ({@code op_column}).
 */
public enum AggregateOp {
    SUM("sum"),
    MEAN("mean"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),
    COUNT("count"),
    MEDIAN("median"),
    NUNIQUE("nunique"),
    STD("std");

    private final String wireName;

    AggregateOp(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AggregateOp fromWireName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (AggregateOp op : values()) {
                if (op.wireName.equals(normalized)) {
                    return op;
                }
            }
        }
        throw new GraphCompileException("Unsupported aggregate operator: " + name);
    }
}
