package org.etlstudio.engine.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Engine settings.
 *
 * Environment variables read by {@link #fromEnvironment()}:
 * - ETL_PYTHON: Python executable with pandas installed (default "python3")
 * - ETL_SPARK_PYTHON: Python executable with pyspark installed (default: ETL_PYTHON)
 * - ETL_BACKEND_TIMEOUT_SECONDS: limit for one backend run (default 120)
 * - ETL_SAMPLE_LIMIT: rows hashed into a table signature (default 200)
 * - ETL_WORKING_DIRECTORY: directory relative source paths resolve against (default ".")
 *
 * @param pythonExecutable      Executable for pandas programs
 * @param sparkPythonExecutable Executable for PySpark programs
 * @param backendTimeout        Limit for one backend run
 * @param sampleLimit           Leading rows compared by the validator
 * @param workingDirectory      Base for relative paths in the interpreter
 */
public record EngineConfig(
        String pythonExecutable,
        String sparkPythonExecutable,
        Duration backendTimeout,
        int sampleLimit,
        Path workingDirectory) {

    public static final String DEFAULT_PYTHON = "python3";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);
    public static final int DEFAULT_SAMPLE_LIMIT = 200;

    public EngineConfig {
        Objects.requireNonNull(pythonExecutable, "Python executable cannot be null");
        Objects.requireNonNull(backendTimeout, "Backend timeout cannot be null");
        Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
        sparkPythonExecutable = sparkPythonExecutable == null ? pythonExecutable : sparkPythonExecutable;
        if (sampleLimit <= 0) {
            throw new IllegalArgumentException("Sample limit must be positive: " + sampleLimit);
        }
        if (backendTimeout.isNegative() || backendTimeout.isZero()) {
            throw new IllegalArgumentException("Backend timeout must be positive: " + backendTimeout);
        }
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws IllegalArgumentException if a numeric variable is not a number
     */
    public static EngineConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String python = env.get("ETL_PYTHON");
        if (python != null && !python.isBlank()) {
            builder.pythonExecutable(python.trim());
        }
        String sparkPython = env.get("ETL_SPARK_PYTHON");
        if (sparkPython != null && !sparkPython.isBlank()) {
            builder.sparkPythonExecutable(sparkPython.trim());
        }
        String timeout = env.get("ETL_BACKEND_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            builder.backendTimeout(Duration.ofSeconds(parseNumber("ETL_BACKEND_TIMEOUT_SECONDS", timeout)));
        }
        String limit = env.get("ETL_SAMPLE_LIMIT");
        if (limit != null && !limit.isBlank()) {
            builder.sampleLimit(parseNumber("ETL_SAMPLE_LIMIT", limit));
        }
        String workDir = env.get("ETL_WORKING_DIRECTORY");
        if (workDir != null && !workDir.isBlank()) {
            builder.workingDirectory(Path.of(workDir.trim()));
        }
        return builder.build();
    }

    private static int parseNumber(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + " env var: " + value, e);
        }
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for EngineConfig.
     */
    public static class Builder {
        private String pythonExecutable = DEFAULT_PYTHON;
        private String sparkPythonExecutable;
        private Duration backendTimeout = DEFAULT_TIMEOUT;
        private int sampleLimit = DEFAULT_SAMPLE_LIMIT;
        private Path workingDirectory = Path.of("");

        public Builder pythonExecutable(String pythonExecutable) {
            this.pythonExecutable = pythonExecutable;
            return this;
        }

        public Builder sparkPythonExecutable(String sparkPythonExecutable) {
            this.sparkPythonExecutable = sparkPythonExecutable;
            return this;
        }

        public Builder backendTimeout(Duration backendTimeout) {
            this.backendTimeout = backendTimeout;
            return this;
        }

        public Builder sampleLimit(int sampleLimit) {
            this.sampleLimit = sampleLimit;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(pythonExecutable, sparkPythonExecutable, backendTimeout, sampleLimit,
                    workingDirectory);
        }
    }
}
