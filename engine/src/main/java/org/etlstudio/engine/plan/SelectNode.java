package org.etlstudio.engine.plan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Projects the input onto a column list, or copies it for a wildcard, then
 * applies the column casts in order.
 *
 * @param id      The node id
 * @param label   The display label
 * @param columns The projected columns
 * @param casts   Column casts applied after the projection, one per column
 *                (the last given wins)
 */
public record SelectNode(String id, String label, ColumnSelection columns, List<ColumnCast> casts)
        implements PipelineNode {

    public SelectNode {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        label = label == null ? "" : label;
        casts = casts == null ? List.of() : lastPerColumn(casts);
    }

    public SelectNode(String id, String label, ColumnSelection columns) {
        this(id, label, columns, List.of());
    }

    public SelectNode withColumns(ColumnSelection newColumns) {
        return new SelectNode(id, label, newColumns, casts);
    }

    public boolean hasCasts() {
        return !casts.isEmpty();
    }

    /**
     * Casts that apply to the projected columns. For a wildcard every cast
     * applies; whether the input has the column is known only at run time.
     */
    public List<ColumnCast> effectiveCasts() {
        if (columns.isWildcard()) {
            return casts;
        }
        return casts.stream().filter(c -> columns.columns().contains(c.column())).toList();
    }

    /**
     * Keeps the last cast given for each column.
     */
    private static List<ColumnCast> lastPerColumn(List<ColumnCast> casts) {
        Map<String, ColumnCast> byColumn = new LinkedHashMap<>();
        for (ColumnCast cast : casts) {
            byColumn.remove(cast.column());
            byColumn.put(cast.column(), cast);
        }
        return List.copyOf(byColumn.values());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SELECT;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
