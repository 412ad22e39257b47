package org.etlstudio.engine.service;

import org.etlstudio.engine.execution.Row;
import org.etlstudio.engine.execution.Table;
import org.etlstudio.engine.serialization.Json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interpreter preview of a pipeline together with its generated programs.
 *
 * @param preview    Leading rows of the result
 * @param rowCount   Total row count of the result
 * @param nodeErrors Node id to error text for nodes that failed
 * @param programs   Language to generated program text
 */
public record WorkflowRun(
        Table preview,
        long rowCount,
        Map<String, String> nodeErrors,
        Map<String, String> programs) {

    public static final int PREVIEW_ROWS = 200;

    public WorkflowRun {
        Objects.requireNonNull(preview, "Preview cannot be null");
        nodeErrors = nodeErrors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodeErrors));
        programs = programs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(programs));
    }

    public List<String> columns() {
        return preview.columnNames();
    }

    /**
     * Renders the preview document:
     * {@code {preview, rows, columns, node_errors, code_py, code_sql, code_spark}}.
     */
    public String toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("preview", records(preview));
        json.put("rows", rowCount);
        json.put("columns", new ArrayList<Object>(columns()));
        json.put("node_errors", new LinkedHashMap<String, Object>(nodeErrors));
        json.put("code_py", programs.getOrDefault("python", ""));
        json.put("code_sql", programs.getOrDefault("sql", ""));
        json.put("code_spark", programs.getOrDefault("spark", ""));
        return Json.toJson(json);
    }

    /**
     * One column-name to value map per row.
     */
    static List<Object> records(Table table) {
        List<String> names = table.columnNames();
        List<Object> records = new ArrayList<>(table.rowCount());
        for (Row row : table.rows()) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                record.put(names.get(i), row.get(i));
            }
            records.add(record);
        }
        return records;
    }
}
