package org.etlstudio.engine.validation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Comparable fingerprint of a result table.
 *
 * @param columns    Column names in order
 * @param dtypes     Type names in column order; reported but never compared
 * @param rowCount   Total number of rows
 * @param sampleHash MD5 hex of the canonical form of the leading rows
 */
public record TableSignature(List<String> columns, List<String> dtypes, long rowCount, String sampleHash) {

    public TableSignature {
        Objects.requireNonNull(columns, "Columns cannot be null");
        Objects.requireNonNull(dtypes, "Dtypes cannot be null");
        Objects.requireNonNull(sampleHash, "Sample hash cannot be null");
        columns = List.copyOf(columns);
        dtypes = List.copyOf(dtypes);
    }

    public Map<String, Object> toJsonMap() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("columns", columns);
        json.put("dtypes", dtypes);
        json.put("rowCount", rowCount);
        json.put("sampleHash", sampleHash);
        return json;
    }
}
