package org.etlstudio.engine.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of interpreting a pipeline.
 *
 * @param table         The table at the last node in order (empty for an empty graph)
 * @param nodeErrors    Node id to {@code "<node kind>: <message>"}, in execution order
 * @param orderFallback True when the graph had a cycle and nodes ran in caller order
 */
public record InterpretResult(Table table, Map<String, String> nodeErrors, boolean orderFallback) {

    public InterpretResult {
        Objects.requireNonNull(table, "Table cannot be null");
        nodeErrors = nodeErrors == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(nodeErrors));
    }

    public boolean hasErrors() {
        return !nodeErrors.isEmpty();
    }
}
