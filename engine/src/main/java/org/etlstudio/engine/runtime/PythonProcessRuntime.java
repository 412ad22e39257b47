package org.etlstudio.engine.runtime;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.etlstudio.engine.execution.Table;
import org.etlstudio.engine.serialization.Json;
import org.etlstudio.engine.staging.StagingArea;
import org.etlstudio.engine.transpiler.Backend;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs Python programs (pandas or PySpark) in a new interpreter process per
 * call.
 *
 * The program and a small harness are written to the call's staging
 * directory. The harness executes the program, takes the DataFrame bound to
 * {@code result}, and writes its leading rows and total row count as JSON
 * next to the program. Standard error becomes the failure message.
 */
public final class PythonProcessRuntime implements BackendRuntime {

    private static final Logger LOG = LogManager.getLogger(PythonProcessRuntime.class);

    static final String HARNESS_RESOURCE = "harness.py";
    private static final int MAX_ERROR_CHARS = 4000;

    private final Backend backend;
    private final String pythonExecutable;
    private final Duration timeout;
    private final int sampleLimit;

    public PythonProcessRuntime(Backend backend, String pythonExecutable, Duration timeout, int sampleLimit) {
        this.backend = Objects.requireNonNull(backend, "Backend cannot be null");
        this.pythonExecutable = Objects.requireNonNull(pythonExecutable, "Python executable cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
        if (backend == Backend.DUCKDB) {
            throw new IllegalArgumentException("DuckDB scripts do not run in a Python process");
        }
        this.sampleLimit = sampleLimit;
    }

    @Override
    public Backend backend() {
        return backend;
    }

    @Override
    public BackendResult execute(String programText, StagingArea staging) throws BackendExecutionException {
        try {
            Path program = staging.writeFile("program.py", programText);
            Path harness = staging.writeFile("harness.py", harnessSource());
            Path output = staging.directory().resolve("result.json").toAbsolutePath();
            Path stdout = staging.directory().resolve("stdout.txt");
            Path stderr = staging.directory().resolve("stderr.txt");

            List<String> command = List.of(pythonExecutable, harness.toString(), program.toString(),
                    output.toString(), String.valueOf(sampleLimit));
            LOG.info("Running {} program with {}", backend.displayName(), pythonExecutable);
            Process process = new ProcessBuilder(command)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new BackendExecutionException(backend,
                        backend.displayName() + " program timed out after " + timeout.toSeconds() + "s");
            }
            int exit = process.exitValue();
            if (exit != 0 || !Files.exists(output)) {
                String message = errorText(stderr);
                throw new BackendExecutionException(backend,
                        message.isEmpty() ? backend.displayName() + " program exited with code " + exit : message);
            }
            return readResult(output);
        } catch (IOException e) {
            throw new BackendExecutionException(backend, "Cannot run " + pythonExecutable + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendExecutionException(backend, "Interrupted while running " + backend.displayName(), e);
        }
    }

    private BackendResult readResult(Path output) throws IOException, BackendExecutionException {
        Map<String, Object> document;
        try {
            document = Json.parseObject(Files.readString(output, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new BackendExecutionException(backend, "Unreadable result document: " + e.getMessage(), e);
        }
        Table table = Table.fromJsonMap(document);
        Integer rowCount = Json.getInt(document, "rowCount");
        return new BackendResult(table, rowCount == null ? table.rowCount() : rowCount);
    }

    private static String errorText(Path stderr) throws IOException {
        if (!Files.exists(stderr)) {
            return "";
        }
        String text = Files.readString(stderr, StandardCharsets.UTF_8).trim();
        return text.length() > MAX_ERROR_CHARS ? text.substring(text.length() - MAX_ERROR_CHARS) : text;
    }

    static String harnessSource() throws IOException {
        try (InputStream in = PythonProcessRuntime.class.getResourceAsStream(HARNESS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + HARNESS_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
