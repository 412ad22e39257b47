package org.etlstudio.engine.runtime;

import org.etlstudio.engine.transpiler.Backend;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The runtime for each backend.
 */
public final class BackendRuntimes {

    private final Map<Backend, BackendRuntime> runtimes;

    public BackendRuntimes(Map<Backend, BackendRuntime> runtimes) {
        Objects.requireNonNull(runtimes, "Runtimes cannot be null");
        this.runtimes = new EnumMap<>(Backend.class);
        for (Map.Entry<Backend, BackendRuntime> entry : runtimes.entrySet()) {
            if (entry.getValue().backend() != entry.getKey()) {
                throw new IllegalArgumentException("Runtime for " + entry.getValue().backend()
                        + " registered under " + entry.getKey());
            }
            this.runtimes.put(entry.getKey(), entry.getValue());
        }
    }

    /**
     * DuckDB in process; pandas and PySpark through the configured Python
     * executables.
     */
    public static BackendRuntimes fromConfig(EngineConfig config) {
        Map<Backend, BackendRuntime> runtimes = new EnumMap<>(Backend.class);
        runtimes.put(Backend.DUCKDB, new DuckDbRuntime());
        runtimes.put(Backend.PANDAS, new PythonProcessRuntime(Backend.PANDAS,
                config.pythonExecutable(), config.backendTimeout(), config.sampleLimit()));
        runtimes.put(Backend.PYSPARK, new PythonProcessRuntime(Backend.PYSPARK,
                config.sparkPythonExecutable(), config.backendTimeout(), config.sampleLimit()));
        return new BackendRuntimes(runtimes);
    }

    /**
     * @throws IllegalStateException if no runtime is registered for the backend
     */
    public BackendRuntime forBackend(Backend backend) {
        BackendRuntime runtime = runtimes.get(backend);
        if (runtime == null) {
            throw new IllegalStateException("No runtime registered for backend: " + backend.displayName());
        }
        return runtime;
    }
}
