package org.etlstudio.engine.validation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.etlstudio.engine.execution.InterpretResult;
import org.etlstudio.engine.execution.PipelineInterpreter;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.runtime.BackendExecutionException;
import org.etlstudio.engine.runtime.BackendResult;
import org.etlstudio.engine.runtime.BackendRuntimes;
import org.etlstudio.engine.staging.SourceInputs;
import org.etlstudio.engine.staging.StagingArea;
import org.etlstudio.engine.transpiler.Backend;
import org.etlstudio.engine.transpiler.PipelineLowerer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a backend's generated program against the interpreter.
 *
 * The interpreter result for the (sub)graph is the expected signature. The
 * graph is lowered for the backend, its source reads are redirected to
 * staged copies, and the program runs under the backend's own runtime. The
 * two signatures are then compared.
 *
 * A mismatch is a normal result. A backend that fails to run the program
 * raises {@link BackendExecutionException}.
 */
public final class DifferentialValidator {

    private static final Logger LOG = LogManager.getLogger(DifferentialValidator.class);

    private final PipelineInterpreter interpreter;
    private final BackendRuntimes runtimes;
    private final Path workingDirectory;
    private final int sampleLimit;

    public DifferentialValidator(PipelineInterpreter interpreter, BackendRuntimes runtimes,
                                 Path workingDirectory, int sampleLimit) {
        this.interpreter = Objects.requireNonNull(interpreter, "Interpreter cannot be null");
        this.runtimes = Objects.requireNonNull(runtimes, "Runtimes cannot be null");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
        this.sampleLimit = sampleLimit;
    }

    /**
     * @param graph      The pipeline
     * @param language   Target language: python, sql or spark
     * @param previewId  Optional node to validate up to; null for the whole graph
     * @throws BackendExecutionException if the backend fails to run the generated program
     * @throws org.etlstudio.engine.plan.GraphCompileException if the preview id is unknown
     */
    public ValidationResult validate(PipelineGraph graph, String language, String previewId)
            throws BackendExecutionException {
        Optional<Backend> resolved = Backend.fromLanguage(language);
        if (resolved.isEmpty()) {
            LOG.info("Validation requested for unsupported language '{}'", language);
            return ValidationResult.unsupported(language);
        }
        Backend backend = resolved.get();
        PipelineGraph scoped = graph.subgraphUpTo(previewId);

        InterpretResult truth = interpreter.run(scoped);
        TableSignature expected = SignatureCalculator.signature(truth.table(), truth.table().rowCount(), sampleLimit);

        PipelineLowerer lowerer = backend.lowerer();
        String program = lowerer.lower(scoped);
        BackendResult actualResult = run(backend, lowerer, program, scoped);
        TableSignature actual = SignatureCalculator.signature(actualResult.table(), actualResult.rowCount(), sampleLimit);

        SignatureComparison comparison = SignatureCalculator.compare(expected, actual);
        LOG.info("Validation against {}: {} ({})", backend.displayName(),
                comparison.matches() ? "valid" : "invalid", comparison.reason());
        return new ValidationResult(backend.displayName(), comparison.matches(), comparison.reason(), expected, actual);
    }

    /**
     * Runs program text under a backend with the graph's sources staged.
     */
    public BackendResult run(Backend backend, PipelineLowerer lowerer, String program, PipelineGraph sources)
            throws BackendExecutionException {
        try (StagingArea staging = StagingArea.create()) {
            Map<String, String> replacements = SourceInputs.replacements(sources, staging, workingDirectory);
            String rewritten = lowerer.rewriteSourcePaths(program, replacements);
            return runtimes.forBackend(backend).execute(rewritten, staging);
        } catch (IOException e) {
            throw new BackendExecutionException(backend, "Cannot stage source files: " + e.getMessage(), e);
        }
    }
}
