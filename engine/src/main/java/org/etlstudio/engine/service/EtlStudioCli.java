package org.etlstudio.engine.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.etlstudio.engine.execution.InterpretResult;
import org.etlstudio.engine.plan.GraphCompileException;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.runtime.BackendExecutionException;
import org.etlstudio.engine.runtime.BackendResult;
import org.etlstudio.engine.runtime.EngineConfig;
import org.etlstudio.engine.serialization.Json;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line front end.
 *
 * Usage: {@code etl-studio <command> <request.json>}
 *
 * Commands:
 * - run       Interpreter preview plus generated programs
 * - interpret Interpreter preview and node errors only
 * - generate  Generated programs for every backend
 * - compile   Generated program for the request's {@code lang}
 * - optimize  Optimized graph in request form (up to {@code previewId} when given)
 * - validate  Differential check of {@code lang} against the interpreter
 * - execute   Runs the request's {@code code} under {@code lang}
 *
 * The response document is printed to stdout. Exit code 1 means the request
 * was rejected, 2 a backend failure.
 */
public final class EtlStudioCli {

    private static final Logger LOG = LogManager.getLogger(EtlStudioCli.class);

    private final PipelineService service;
    private final PrintStream out;

    public EtlStudioCli(PipelineService service, PrintStream out) {
        this.service = service;
        this.out = out;
    }

    public static void main(String[] args) {
        EtlStudioCli cli = new EtlStudioCli(new PipelineService(EngineConfig.fromEnvironment()), System.out);
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        if (args.length != 2) {
            System.err.println("Usage: etl-studio <run|interpret|generate|compile|optimize|validate|execute> <request.json>");
            return 1;
        }
        try {
            String body = Files.readString(Path.of(args[1]), StandardCharsets.UTF_8);
            out.println(handle(args[0], GraphJsonReader.readRequest(body)));
            return 0;
        } catch (IOException e) {
            LOG.error("Cannot read request {}: {}", args[1], e.getMessage());
            out.println(error(e.getMessage()));
            return 1;
        } catch (GraphCompileException | IllegalArgumentException e) {
            LOG.error("Rejected request: {}", e.getMessage());
            out.println(error(e.getMessage()));
            return 1;
        } catch (BackendExecutionException e) {
            LOG.error("{} failed: {}", e.backend().displayName(), e.getMessage());
            out.println(error(e.getMessage()));
            return 2;
        }
    }

    String handle(String command, PipelineRequest request) throws BackendExecutionException {
        PipelineGraph graph = request.graph();
        return switch (command) {
            case "run" -> service.runWorkflow(graph, request.previewId()).toJson();
            case "interpret" -> Json.toJson(interpretDocument(service.interpret(graph, request.previewId())));
            case "generate" -> Json.toJson(new LinkedHashMap<String, Object>(service.generateAll(graph)));
            case "compile" -> Json.toJson(Map.of("code", service.compile(graph, request.language())));
            case "optimize" -> Json.toJson(GraphJsonWriter.INSTANCE.toJsonMap(service.optimize(graph, request.previewId())));
            case "validate" -> Json.toJson(service.validate(graph, request.language(), request.previewId()).toJsonMap());
            case "execute" -> executeDocument(request);
            default -> throw new IllegalArgumentException("Unknown command: " + command);
        };
    }

    private String executeDocument(PipelineRequest request) throws BackendExecutionException {
        if (request.code() == null || request.code().isBlank()) {
            throw new IllegalArgumentException("Missing 'code' field");
        }
        BackendResult result = service.executeUserText(request.language(), request.code(), request.graph());
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("preview", WorkflowRun.records(result.table().head(WorkflowRun.PREVIEW_ROWS)));
        json.put("rows", result.rowCount());
        json.put("columns", List.copyOf(result.table().columnNames()));
        return Json.toJson(json);
    }

    static String error(String message) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("error", message == null ? "" : message);
        return Json.toJson(json);
    }

    static Map<String, Object> interpretDocument(InterpretResult result) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("preview", WorkflowRun.records(result.table().head(WorkflowRun.PREVIEW_ROWS)));
        json.put("rows", result.table().rowCount());
        json.put("node_errors", new LinkedHashMap<String, Object>(result.nodeErrors()));
        return json;
    }
}
