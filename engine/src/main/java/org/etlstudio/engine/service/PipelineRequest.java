package org.etlstudio.engine.service;

import org.etlstudio.engine.plan.PipelineGraph;

import java.util.Objects;

/**
 * A parsed request document.
 *
 * @param graph     The pipeline
 * @param language  Target language (python, sql, spark), or null
 * @param previewId Node to run up to, or null for the whole graph
 * @param code      User-written program text, or null
 */
public record PipelineRequest(PipelineGraph graph, String language, String previewId, String code) {

    public PipelineRequest {
        Objects.requireNonNull(graph, "Graph cannot be null");
    }
}
