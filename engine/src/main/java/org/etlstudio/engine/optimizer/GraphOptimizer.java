package org.etlstudio.engine.optimizer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.etlstudio.engine.plan.PipelineGraph;

/**
 * Composes the two optimizer passes: {@code fuse(pruneDead(graph, target))}.
 */
public final class GraphOptimizer {

    private static final Logger LOG = LogManager.getLogger(GraphOptimizer.class);

    private final DeadNodeEliminator eliminator;
    private final PeepholeFuser fuser;

    public GraphOptimizer() {
        this(DeadNodeEliminator.INSTANCE, PeepholeFuser.INSTANCE);
    }

    public GraphOptimizer(DeadNodeEliminator eliminator, PeepholeFuser fuser) {
        this.eliminator = eliminator;
        this.fuser = fuser;
    }

    /**
     * Fusion strategy.
     */
    public enum FusionMode {
        /**
         * One forward sweep in topological order. Rewrites land in the live
         * graph before later nodes are visited, so a chain of selects or
         * filters collapses in this single pass.
         */
        SINGLE_SWEEP,
        /** Sweeps until the graph stops changing; a second sweep finds nothing after a first. */
        FIXPOINT
    }

    /**
     * Prunes against {@code targetId} (if given) and runs one fusion sweep.
     */
    public PipelineGraph optimize(PipelineGraph graph, String targetId) {
        return optimize(graph, targetId, FusionMode.SINGLE_SWEEP);
    }

    public PipelineGraph optimize(PipelineGraph graph, String targetId, FusionMode mode) {
        PipelineGraph pruned = eliminator.prune(graph, targetId);
        PipelineGraph fused = switch (mode) {
            case SINGLE_SWEEP -> fuser.fuse(pruned);
            case FIXPOINT -> fuser.fuseToFixpoint(pruned);
        };
        LOG.debug("Optimized graph: {} -> {} nodes, {} -> {} edges",
                graph.nodes().size(), fused.nodes().size(), graph.edges().size(), fused.edges().size());
        return fused;
    }
}
