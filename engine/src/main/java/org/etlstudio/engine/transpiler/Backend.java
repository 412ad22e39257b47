package org.etlstudio.engine.transpiler;

import java.util.Locale;
import java.util.Optional;

/**
 * Execution backends a pipeline can be lowered to.
 */
public enum Backend {
    /** Eager single-process dataframe engine (pandas). */
    PANDAS("python", "pandas"),
    /** Embedded columnar SQL engine (DuckDB). */
    DUCKDB("sql", "duckdb"),
    /** Distributed lazy dataframe engine (PySpark). */
    PYSPARK("spark", "pyspark");

    private final String language;
    private final String displayName;

    Backend(String language, String displayName) {
        this.language = language;
        this.displayName = displayName;
    }

    /**
     * @return The request-level language tag ("python", "sql", "spark")
     */
    public String language() {
        return language;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * The lowerer producing program text for this backend.
     */
    public PipelineLowerer lowerer() {
        return switch (this) {
            case PANDAS -> PandasLowerer.INSTANCE;
            case DUCKDB -> DuckDbSqlLowerer.INSTANCE;
            case PYSPARK -> PySparkLowerer.INSTANCE;
        };
    }

    /**
     * Resolves a language tag or backend name, case-insensitively.
     */
    public static Optional<Backend> fromLanguage(String language) {
        if (language == null) {
            return Optional.empty();
        }
        String normalized = language.trim().toLowerCase(Locale.ROOT);
        for (Backend backend : values()) {
            if (backend.language.equals(normalized) || backend.displayName.equals(normalized)) {
                return Optional.of(backend);
            }
        }
        return Optional.empty();
    }
}
