package org.etlstudio.engine.runtime;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.etlstudio.engine.execution.Table;
import org.etlstudio.engine.staging.StagingArea;
import org.etlstudio.engine.transpiler.Backend;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Runs SQL scripts in a fresh in-memory DuckDB database per call.
 *
 * Statements run in order on one connection; the last statement that
 * returns rows supplies the result table.
 */
public final class DuckDbRuntime implements BackendRuntime {

    private static final Logger LOG = LogManager.getLogger(DuckDbRuntime.class);

    public static final String IN_MEMORY_URL = "jdbc:duckdb:";

    // Force-load the JDBC driver at class initialization
    static {
        try {
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            LOG.error("DuckDB driver not found in classpath");
        }
    }

    @Override
    public Backend backend() {
        return Backend.DUCKDB;
    }

    @Override
    public BackendResult execute(String programText, StagingArea staging) throws BackendExecutionException {
        List<String> statements = SqlScriptSplitter.split(programText);
        if (statements.isEmpty()) {
            throw new BackendExecutionException(Backend.DUCKDB, "SQL script contains no statements");
        }
        LOG.info("Running {} SQL statement(s) in DuckDB", statements.size());
        try (Connection conn = DriverManager.getConnection(IN_MEMORY_URL)) {
            Table last = null;
            for (String sql : statements) {
                Table table = executeStatement(conn, sql);
                if (table != null) {
                    last = table;
                }
            }
            if (last == null) {
                throw new BackendExecutionException(Backend.DUCKDB, "SQL script produced no result set");
            }
            return BackendResult.of(last);
        } catch (SQLException e) {
            throw new BackendExecutionException(Backend.DUCKDB, e.getMessage(), e);
        }
    }

    private static Table executeStatement(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            LOG.debug("Executing: {}", sql);
            if (!stmt.execute(sql)) {
                return null;
            }
            try (ResultSet rs = stmt.getResultSet()) {
                return Table.fromResultSet(rs);
            }
        }
    }
}
