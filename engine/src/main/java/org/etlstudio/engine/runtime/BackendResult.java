package org.etlstudio.engine.runtime;

import org.etlstudio.engine.execution.Table;

import java.util.Objects;

/**
 * Table produced by a backend run.
 *
 * @param table    The leading rows of the result (all rows for in-process backends)
 * @param rowCount The total number of rows in the result
 */
public record BackendResult(Table table, long rowCount) {

    public BackendResult {
        Objects.requireNonNull(table, "Table cannot be null");
        if (rowCount < table.rowCount()) {
            throw new IllegalArgumentException("Row count " + rowCount + " is below the "
                    + table.rowCount() + " rows returned");
        }
    }

    public static BackendResult of(Table table) {
        return new BackendResult(table, table.rowCount());
    }
}
