package org.etlstudio.engine.optimizer;

import org.etlstudio.engine.plan.PipelineGraph;

import java.util.Set;

/**
 * Dead-node elimination against a single designated target node: keeps the
 * target and its ancestors, plus the edges whose endpoints both survive.
 */
public final class DeadNodeEliminator {

    public static final DeadNodeEliminator INSTANCE = new DeadNodeEliminator();

    private DeadNodeEliminator() {
    }

    /**
     * @param graph    The graph to prune
     * @param targetId The node whose ancestors are kept; null or blank is the identity
     * @return The pruned graph
     */
    public PipelineGraph prune(PipelineGraph graph, String targetId) {
        if (targetId == null || targetId.isBlank()) {
            return graph;
        }
        Set<String> keep = graph.ancestorsOf(targetId);
        return graph.restrictTo(keep);
    }
}
