package org.etlstudio.engine.plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable pipeline graph: nodes in caller order plus directed edges.
 *
 * Construction validates the graph and throws {@link GraphCompileException}
 * for duplicate node ids, edges that name unknown nodes, and nodes whose
 * number of distinct parents does not match their kind's arity.
 *
 * Example:
 *
 * <pre>
 * PipelineGraph graph = PipelineGraph.builder()
 *         .node(LoadNode.of("a", "People", "people.csv"))
 *         .node(new FilterNode("b", "Adults", PassthroughExpression.of("age >= 18")))
 *         .edge("a", "b")
 *         .build();
 * </pre>
 */
public record PipelineGraph(List<PipelineNode> nodes, List<Edge> edges) {

    private static final PipelineGraph EMPTY = new PipelineGraph(List.of(), List.of());

    public PipelineGraph {
        Objects.requireNonNull(nodes, "Nodes cannot be null");
        Objects.requireNonNull(edges, "Edges cannot be null");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        validate(nodes, edges);
    }

    public static PipelineGraph empty() {
        return EMPTY;
    }

    public static PipelineGraph of(List<PipelineNode> nodes, List<Edge> edges) {
        return new PipelineGraph(nodes, edges);
    }

    // ==================== Lookup ====================

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean contains(String id) {
        for (PipelineNode node : nodes) {
            if (node.id().equals(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Gets a node by id.
     *
     * @throws GraphCompileException if no such node exists
     */
    public PipelineNode node(String id) {
        for (PipelineNode node : nodes) {
            if (node.id().equals(id)) {
                return node;
            }
        }
        throw new GraphCompileException("Unknown node id: " + id);
    }

    public List<String> nodeIds() {
        List<String> ids = new ArrayList<>(nodes.size());
        for (PipelineNode node : nodes) {
            ids.add(node.id());
        }
        return ids;
    }

    /**
     * Node id to node, in caller order.
     */
    public Map<String, PipelineNode> nodesById() {
        Map<String, PipelineNode> byId = new LinkedHashMap<>();
        for (PipelineNode node : nodes) {
            byId.put(node.id(), node);
        }
        return byId;
    }

    /**
     * Distinct parents of a node in edge-list order. For a join the first
     * entry is the left input and the second the right input.
     */
    public List<String> parentsOf(String id) {
        Set<String> parents = new LinkedHashSet<>();
        for (Edge edge : edges) {
            if (edge.target().equals(id)) {
                parents.add(edge.source());
            }
        }
        return List.copyOf(parents);
    }

    /**
     * Distinct children of a node in edge-list order.
     */
    public List<String> childrenOf(String id) {
        Set<String> children = new LinkedHashSet<>();
        for (Edge edge : edges) {
            if (edge.source().equals(id)) {
                children.add(edge.target());
            }
        }
        return List.copyOf(children);
    }

    // ==================== Ordering & Reachability ====================

    public TopologicalOrder topologicalOrder() {
        return TopologicalOrder.compute(nodeIds(), edges);
    }

    /**
     * Backward reachability from {@code targetId} over predecessor edges,
     * including the target itself.
     *
     * @throws GraphCompileException if the target is not a node of this graph
     */
    public Set<String> ancestorsOf(String targetId) {
        if (!contains(targetId)) {
            throw new GraphCompileException("Unknown target node id: " + targetId);
        }
        Map<String, List<String>> preds = new HashMap<>();
        for (Edge edge : edges) {
            preds.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge.source());
        }
        Set<String> keep = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(targetId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!keep.add(current)) {
                continue;
            }
            for (String pred : preds.getOrDefault(current, List.of())) {
                stack.push(pred);
            }
        }
        return keep;
    }

    /**
     * The subgraph of {@code targetId} and its ancestors. A null target
     * returns this graph.
     */
    public PipelineGraph subgraphUpTo(String targetId) {
        if (targetId == null || targetId.isBlank()) {
            return this;
        }
        Set<String> keep = ancestorsOf(targetId);
        return restrictTo(keep);
    }

    /**
     * Keeps the given node ids and the edges with both endpoints kept.
     */
    public PipelineGraph restrictTo(Set<String> keep) {
        List<PipelineNode> keptNodes = new ArrayList<>();
        for (PipelineNode node : nodes) {
            if (keep.contains(node.id())) {
                keptNodes.add(node);
            }
        }
        List<Edge> keptEdges = new ArrayList<>();
        for (Edge edge : edges) {
            if (keep.contains(edge.source()) && keep.contains(edge.target())) {
                keptEdges.add(edge);
            }
        }
        return new PipelineGraph(keptNodes, keptEdges);
    }

    // ==================== Validation ====================

    private static void validate(List<PipelineNode> nodes, List<Edge> edges) {
        Map<String, PipelineNode> byId = new HashMap<>();
        for (PipelineNode node : nodes) {
            if (byId.put(node.id(), node) != null) {
                throw new GraphCompileException("Duplicate node id: " + node.id());
            }
        }
        Map<String, Set<String>> parents = new HashMap<>();
        for (Edge edge : edges) {
            if (!byId.containsKey(edge.source())) {
                throw new GraphCompileException("Edge " + edge + " references unknown source node: " + edge.source());
            }
            if (!byId.containsKey(edge.target())) {
                throw new GraphCompileException("Edge " + edge + " references unknown target node: " + edge.target());
            }
            parents.computeIfAbsent(edge.target(), k -> new LinkedHashSet<>()).add(edge.source());
        }
        for (PipelineNode node : nodes) {
            int actual = parents.getOrDefault(node.id(), Set.of()).size();
            int expected = node.kind().arity();
            if (actual != expected) {
                throw new GraphCompileException(String.format(
                        "Node '%s' (%s) expects %d input(s) but has %d",
                        node.id(), describeKind(node), expected, actual));
            }
        }
    }

    private static String describeKind(PipelineNode node) {
        if (node instanceof UnknownNode unknown && !unknown.rawKind().isEmpty()) {
            return unknown.rawKind();
        }
        return node.kind().wireName();
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for PipelineGraph.
     */
    public static class Builder {
        private final List<PipelineNode> nodes = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();

        public Builder node(PipelineNode node) {
            nodes.add(node);
            return this;
        }

        public Builder edge(String source, String target) {
            edges.add(new Edge(source, target));
            return this;
        }

        /**
         * Chains the given ids with edges {@code ids[0] -> ids[1] -> ...}.
         */
        public Builder chain(String... ids) {
            for (int i = 1; i < ids.length; i++) {
                edge(ids[i - 1], ids[i]);
            }
            return this;
        }

        public PipelineGraph build() {
            return new PipelineGraph(nodes, edges);
        }
    }
}
