package org.etlstudio.engine.execution;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fully materialized, immutable table: ordered named columns and rows.
 *
 * Column names may repeat (a join can produce that); lookups by name
 * resolve to the first match.
 */
public record Table(List<Column> columns, List<Row> rows) {

    private static final Table EMPTY = new Table(List.of(), List.of());

    public Table {
        Objects.requireNonNull(columns, "Columns cannot be null");
        Objects.requireNonNull(rows, "Rows cannot be null");
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
        for (Row row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.size() + " values but table has " + columns.size() + " columns");
            }
        }
    }

    public static Table empty() {
        return EMPTY;
    }

    /**
     * Builds a table and infers each column's dtype from its values.
     */
    public static Table withInferredTypes(List<String> names, List<Row> rows) {
        List<Column> columns = new ArrayList<>(names.size());
        for (int c = 0; c < names.size(); c++) {
            List<Object> values = new ArrayList<>(rows.size());
            for (Row row : rows) {
                values.add(row.get(c));
            }
            columns.add(new Column(names.get(c), Column.inferDtype(values)));
        }
        return new Table(columns, rows);
    }

    // ==================== Accessors ====================

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name());
        }
        return names;
    }

    /**
     * @return The index of the first column with the given name, or -1
     */
    public int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @throws IllegalArgumentException if no column has the given name
     */
    public int requireColumn(String columnName) {
        int index = indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        return index;
    }

    public Object getValue(int rowIndex, int columnIndex) {
        return rows.get(rowIndex).get(columnIndex);
    }

    public Object getValue(int rowIndex, String columnName) {
        return rows.get(rowIndex).get(requireColumn(columnName));
    }

    /**
     * The first {@code n} rows.
     */
    public Table head(int n) {
        if (n >= rows.size()) {
            return this;
        }
        return new Table(columns, rows.subList(0, Math.max(0, n)));
    }

    /**
     * Same columns, different rows.
     */
    public Table withRows(List<Row> newRows) {
        return new Table(columns, newRows);
    }

    // ==================== Conversion ====================

    /**
     * Materializes a JDBC result set.
     */
    public static Table fromResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Column> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new Column(meta.getColumnLabel(i), Column.dtypeForJdbcType(meta.getColumnType(i))));
        }
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            rows.add(Row.fromResultSet(rs, columnCount));
        }
        return new Table(columns, rows);
    }

    /**
     * The {@code {columns, dtypes, data}} document shape used by the service
     * and by the Python harness.
     */
    public Map<String, Object> toJsonMap() {
        Map<String, Object> json = new LinkedHashMap<>();
        List<Object> dtypes = new ArrayList<>(columns.size());
        for (Column column : columns) {
            dtypes.add(column.dtype());
        }
        List<Object> data = new ArrayList<>(rows.size());
        for (Row row : rows) {
            data.add(row.values());
        }
        json.put("columns", new ArrayList<Object>(columnNames()));
        json.put("dtypes", dtypes);
        json.put("data", data);
        return json;
    }

    /**
     * Reads the {@code {columns, dtypes, data}} document shape.
     */
    @SuppressWarnings("unchecked")
    public static Table fromJsonMap(Map<String, Object> json) {
        List<Object> names = (List<Object>) json.getOrDefault("columns", List.of());
        List<Object> dtypes = (List<Object>) json.getOrDefault("dtypes", List.of());
        List<Object> data = (List<Object>) json.getOrDefault("data", List.of());
        List<Column> columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String dtype = i < dtypes.size() && dtypes.get(i) != null ? dtypes.get(i).toString() : null;
            columns.add(new Column(String.valueOf(names.get(i)), dtype));
        }
        List<Row> rows = new ArrayList<>(data.size());
        for (Object record : data) {
            List<Object> values = new ArrayList<>();
            for (Object value : (List<Object>) record) {
                values.add(Row.normalize(value));
            }
            rows.add(new Row(values));
        }
        return new Table(columns, rows);
    }
}
