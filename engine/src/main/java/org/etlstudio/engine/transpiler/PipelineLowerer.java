package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.PipelineGraph;

import java.util.Map;

/**
 * Translates a pipeline graph into program text for one backend.
 *
 * Running the text under the backend's own runtime, on the same inputs, must
 * produce the table the interpreter produces for the same graph: same
 * columns in the same order, same row count, same leading rows. Lowering
 * never executes anything.
 */
public interface PipelineLowerer {

    Backend backend();

    /**
     * @param graph The graph to lower
     * @return The program text; the final table is bound to {@code result}
     *         (Python) or returned by the last statement (SQL)
     */
    String lower(PipelineGraph graph);

    /**
     * Rewrites source reads in program text that reference an original path
     * to read the staged copy instead.
     *
     * @param programText  Generated or user-written program text
     * @param replacements Original path to staged path
     * @return The rewritten text
     */
    String rewriteSourcePaths(String programText, Map<String, String> replacements);
}
