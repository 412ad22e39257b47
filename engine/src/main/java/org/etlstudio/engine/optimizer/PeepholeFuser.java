package org.etlstudio.engine.optimizer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.etlstudio.engine.plan.Edge;
import org.etlstudio.engine.plan.FilterNode;
import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.PipelineNode;
import org.etlstudio.engine.plan.SelectNode;
import org.etlstudio.engine.plan.TopologicalOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Local peephole rewrites over select and filter chains.
 *
 * One sweep visits the nodes once, in topological order, and applies:
 * <ol>
 * <li>select-select fusion: a wildcard parent is dropped in favour of an
 * explicit child, a wildcard child is dropped in favour of an explicit
 * parent, and two explicit lists are intersected into the parent (parent
 * order; an empty intersection becomes the wildcard);</li>
 * <li>filter-filter fusion: the predicates are conjoined into the parent;</li>
 * <li>identity-select elimination: a wildcard select with one parent and one
 * child is spliced out.</li>
 * </ol>
 *
 * A select that casts columns is never the node removed. The surviving
 * select keeps its own casts.
 *
 * A node is only removed when it has exactly one incoming and one outgoing
 * edge and the spliced edge does not already exist. Rules 1 and 2 rewrite
 * the surviving parent only if that parent feeds nothing but the fused
 * child and the child can be spliced; otherwise the rule is skipped and no
 * payload changes.
 */
public final class PeepholeFuser {

    private static final Logger LOG = LogManager.getLogger(PeepholeFuser.class);

    public static final PeepholeFuser INSTANCE = new PeepholeFuser();

    private PeepholeFuser() {
    }

    /**
     * Runs a single sweep.
     */
    public PipelineGraph fuse(PipelineGraph graph) {
        return sweep(graph).graph();
    }

    /**
     * Repeats the sweep until it no longer changes the graph. Each productive
     * sweep removes at least one node, so the loop is bounded by the node count.
     */
    public PipelineGraph fuseToFixpoint(PipelineGraph graph) {
        PipelineGraph current = graph;
        for (int i = 0; i <= graph.nodes().size(); i++) {
            SweepResult result = sweep(current);
            current = result.graph();
            if (!result.changed()) {
                break;
            }
        }
        return current;
    }

    private SweepResult sweep(PipelineGraph graph) {
        TopologicalOrder order = graph.topologicalOrder();
        Arena arena = new Arena(graph);
        boolean changed = false;

        for (String id : order.ids()) {
            PipelineNode node = arena.nodes.get(id);
            if (node == null) {
                continue;
            }
            List<String> parents = arena.parents(id);
            PipelineNode parent = parents.size() == 1 ? arena.nodes.get(parents.get(0)) : null;

            if (node instanceof SelectNode select && parent instanceof SelectNode parentSelect) {
                if (fuseSelects(arena, parentSelect, select)) {
                    changed = true;
                    if (!arena.nodes.containsKey(id)) {
                        continue;
                    }
                }
            }

            if (node instanceof FilterNode filter && parent instanceof FilterNode parentFilter) {
                if (arena.outDegree(parentFilter.id()) == 1 && arena.canSplice(id)) {
                    arena.nodes.put(parentFilter.id(),
                            parentFilter.withPredicate(parentFilter.predicate().and(filter.predicate())));
                    arena.splice(id);
                    LOG.debug("Fused filter {} into {}", id, parentFilter.id());
                    changed = true;
                    continue;
                }
            }

            PipelineNode current = arena.nodes.get(id);
            if (current instanceof SelectNode select && select.columns().isWildcard() && !select.hasCasts()
                    && arena.canSplice(id)) {
                arena.splice(id);
                LOG.debug("Removed identity select {}", id);
                changed = true;
            }
        }

        List<PipelineNode> nodesOut = new ArrayList<>();
        for (String id : order.ids()) {
            PipelineNode node = arena.nodes.get(id);
            if (node != null) {
                nodesOut.add(node);
            }
        }
        return new SweepResult(new PipelineGraph(nodesOut, dedupe(arena.edges, arena.nodes.keySet())), changed);
    }

    private boolean fuseSelects(Arena arena, SelectNode parent, SelectNode child) {
        boolean parentAll = parent.columns().isWildcard();
        boolean childAll = child.columns().isWildcard();

        if (parentAll && !childAll) {
            if (!parent.hasCasts() && arena.canSplice(parent.id())) {
                arena.splice(parent.id());
                LOG.debug("Dropped wildcard select {} above {}", parent.id(), child.id());
                return true;
            }
            return false;
        }
        if (!parentAll && childAll) {
            if (!child.hasCasts() && arena.canSplice(child.id())) {
                arena.splice(child.id());
                LOG.debug("Dropped wildcard select {} below {}", child.id(), parent.id());
                return true;
            }
            return false;
        }
        if (!parentAll) {
            if (!child.hasCasts() && arena.outDegree(parent.id()) == 1 && arena.canSplice(child.id())) {
                arena.nodes.put(parent.id(), parent.withColumns(parent.columns().intersect(child.columns())));
                arena.splice(child.id());
                LOG.debug("Fused select {} into {}", child.id(), parent.id());
                return true;
            }
        }
        return false;
    }

    private static List<Edge> dedupe(List<Edge> edges, Set<String> live) {
        Set<Edge> seen = new LinkedHashSet<>();
        for (Edge edge : edges) {
            if (live.contains(edge.source()) && live.contains(edge.target())) {
                seen.add(edge);
            }
        }
        return new ArrayList<>(seen);
    }

    private record SweepResult(PipelineGraph graph, boolean changed) {
    }

    /**
     * Working copy of the graph. Degrees are always read from the live edge
     * list, never cached across rewrites.
     */
    private static final class Arena {
        private final Map<String, PipelineNode> nodes = new LinkedHashMap<>();
        private final List<Edge> edges;

        Arena(PipelineGraph graph) {
            for (PipelineNode node : graph.nodes()) {
                nodes.put(node.id(), node);
            }
            this.edges = new ArrayList<>(new LinkedHashSet<>(graph.edges()));
        }

        List<String> parents(String id) {
            List<String> parents = new ArrayList<>();
            for (Edge edge : edges) {
                if (edge.target().equals(id)) {
                    parents.add(edge.source());
                }
            }
            return parents;
        }

        int inDegree(String id) {
            int count = 0;
            for (Edge edge : edges) {
                if (edge.target().equals(id)) {
                    count++;
                }
            }
            return count;
        }

        int outDegree(String id) {
            int count = 0;
            for (Edge edge : edges) {
                if (edge.source().equals(id)) {
                    count++;
                }
            }
            return count;
        }

        boolean canSplice(String id) {
            if (inDegree(id) != 1 || outDegree(id) != 1) {
                return false;
            }
            return !edges.contains(new Edge(incoming(id).source(), outgoing(id).target()));
        }

        /**
         * Removes a single-in/single-out node. The outgoing edge is rewritten
         * in place so the child's input order (join left/right) is preserved.
         */
        void splice(String id) {
            Edge in = incoming(id);
            Edge out = outgoing(id);
            int outIndex = edges.indexOf(out);
            edges.set(outIndex, new Edge(in.source(), out.target()));
            edges.remove(in);
            nodes.remove(id);
        }

        private Edge incoming(String id) {
            for (Edge edge : edges) {
                if (edge.target().equals(id)) {
                    return edge;
                }
            }
            throw new IllegalStateException("No incoming edge for " + id);
        }

        private Edge outgoing(String id) {
            for (Edge edge : edges) {
                if (edge.source().equals(id)) {
                    return edge;
                }
            }
            throw new IllegalStateException("No outgoing edge for " + id);
        }
    }
}
