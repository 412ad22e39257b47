package org.etlstudio.engine.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Column list of a select node: either the wildcard or an ordered list of
 * names.
 *
 * @param columns The ordered column names; empty means wildcard
 */
public record ColumnSelection(List<String> columns) {

    public static final String WILDCARD = "*";

    private static final ColumnSelection ALL = new ColumnSelection(List.of());

    public ColumnSelection {
        Objects.requireNonNull(columns, "Columns cannot be null");
        columns = List.copyOf(columns);
    }

    public static ColumnSelection wildcard() {
        return ALL;
    }

    public static ColumnSelection of(String... columns) {
        return new ColumnSelection(List.of(columns));
    }

    /**
     * Parses {@code "*"}, a blank string, or a comma separated list of names.
     */
    public static ColumnSelection parse(String text) {
        if (text == null || text.isBlank() || text.trim().equals(WILDCARD)) {
            return ALL;
        }
        return new ColumnSelection(splitList(text));
    }

    public boolean isWildcard() {
        return columns.isEmpty();
    }

    /**
     * Members of this list that are also in {@code other}, in this list's
     * order. An empty intersection degenerates to the wildcard.
     */
    public ColumnSelection intersect(ColumnSelection other) {
        List<String> composed = new ArrayList<>();
        for (String column : columns) {
            if (other.columns.contains(column)) {
                composed.add(column);
            }
        }
        return composed.isEmpty() ? ALL : new ColumnSelection(composed);
    }

    /**
     * Splits a comma separated list, trimming entries and dropping blanks.
     */
    public static List<String> splitList(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String part : text.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return isWildcard() ? WILDCARD : String.join(",", columns);
    }
}
