package org.etlstudio.engine.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.etlstudio.engine.execution.InterpretResult;
import org.etlstudio.engine.execution.PipelineInterpreter;
import org.etlstudio.engine.optimizer.GraphOptimizer;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.runtime.BackendExecutionException;
import org.etlstudio.engine.runtime.BackendResult;
import org.etlstudio.engine.runtime.BackendRuntimes;
import org.etlstudio.engine.runtime.EngineConfig;
import org.etlstudio.engine.transpiler.Backend;
import org.etlstudio.engine.validation.DifferentialValidator;
import org.etlstudio.engine.validation.ValidationResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for callers of the engine.
 *
 * Each call is independent: nothing is kept between calls except the
 * configuration. Graphs are lowered or interpreted as given; callers that
 * want the optimized graph call {@link #optimize} first.
 */
public final class PipelineService {

    private static final Logger LOG = LogManager.getLogger(PipelineService.class);

    private final EngineConfig config;
    private final GraphOptimizer optimizer = new GraphOptimizer();
    private final PipelineInterpreter interpreter;
    private final DifferentialValidator validator;

    public PipelineService(EngineConfig config) {
        this(config, BackendRuntimes.fromConfig(config));
    }

    public PipelineService(EngineConfig config, BackendRuntimes runtimes) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.interpreter = new PipelineInterpreter(config.workingDirectory());
        this.validator = new DifferentialValidator(interpreter, runtimes, config.workingDirectory(),
                config.sampleLimit());
    }

    public PipelineService() {
        this(EngineConfig.defaults());
    }

    public EngineConfig config() {
        return config;
    }

    // ==================== Lowering ====================

    /**
     * Generates the program text for one language.
     *
     * @throws IllegalArgumentException if the language is not python, sql or spark
     */
    public String compile(PipelineGraph graph, String language) {
        return requireBackend(language).lowerer().lower(graph);
    }

    /**
     * Generates program text for every backend, keyed by language.
     */
    public Map<String, String> generateAll(PipelineGraph graph) {
        Map<String, String> programs = new LinkedHashMap<>();
        for (Backend backend : Backend.values()) {
            programs.put(backend.language(), backend.lowerer().lower(graph));
        }
        return programs;
    }

    // ==================== Optimization ====================

    public PipelineGraph optimize(PipelineGraph graph, String targetId) {
        return optimizer.optimize(graph, targetId);
    }

    // ==================== Execution ====================

    public InterpretResult interpret(PipelineGraph graph, String previewId) {
        return interpreter.run(graph, previewId);
    }

    /**
     * Interpreter preview of the (sub)graph plus the generated text for all
     * backends. Program text is generated from the whole graph.
     */
    public WorkflowRun runWorkflow(PipelineGraph graph, String previewId) {
        InterpretResult result = interpreter.run(graph, previewId);
        Map<String, String> programs = generateAll(graph);
        return new WorkflowRun(result.table().head(WorkflowRun.PREVIEW_ROWS), result.table().rowCount(),
                result.nodeErrors(), programs);
    }

    /**
     * @throws BackendExecutionException if the backend cannot run the generated program
     */
    public ValidationResult validate(PipelineGraph graph, String language, String previewId)
            throws BackendExecutionException {
        return validator.validate(graph, language, previewId);
    }

    /**
     * Runs caller-written program text under a backend. Source reads of
     * uploaded files named by the graph's load nodes are redirected to
     * staged copies first.
     *
     * @throws IllegalArgumentException  if the language is not python, sql or spark
     * @throws BackendExecutionException if the backend fails to run the text
     */
    public BackendResult executeUserText(String language, String programText, PipelineGraph sources)
            throws BackendExecutionException {
        Backend backend = requireBackend(language);
        Objects.requireNonNull(programText, "Program text cannot be null");
        LOG.info("Executing user-written {} program ({} chars)", backend.displayName(), programText.length());
        return validator.run(backend, backend.lowerer(), programText, sources == null ? PipelineGraph.empty() : sources);
    }

    private static Backend requireBackend(String language) {
        return Backend.fromLanguage(language)
                .orElseThrow(() -> new IllegalArgumentException("unsupported language: " + language));
    }
}
