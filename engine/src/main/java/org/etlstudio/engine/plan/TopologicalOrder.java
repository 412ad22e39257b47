package org.etlstudio.engine.plan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node ids in dependency order.
 *
 * When the graph contains a cycle the order is the caller's node order and
 * {@link #cyclic()} is set; consumers then run an unordered pass instead of
 * failing.
 *
 * @param ids    The ordered node ids
 * @param cyclic True when a cycle forced the insertion-order fallback
 */
public record TopologicalOrder(List<String> ids, boolean cyclic) {

    public TopologicalOrder {
        ids = List.copyOf(ids);
    }

    /**
     * Kahn's algorithm. The ready queue is FIFO and is seeded in the caller's
     * node order, so the result is reproducible for a fixed input ordering.
     *
     * @param nodeIds Node ids in caller order
     * @param edges   Edges between those ids
     * @return The ordering
     */
    public static TopologicalOrder compute(List<String> nodeIds, List<Edge> edges) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> outs = new HashMap<>();
        for (String id : nodeIds) {
            inDegree.put(id, 0);
            outs.put(id, new ArrayList<>());
        }
        for (Edge edge : edges) {
            inDegree.merge(edge.target(), 1, Integer::sum);
            outs.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
        }

        String[] queue = new String[nodeIds.size()];
        int head = 0;
        int tail = 0;
        for (String id : nodeIds) {
            if (inDegree.get(id) == 0) {
                queue[tail++] = id;
            }
        }

        List<String> order = new ArrayList<>(nodeIds.size());
        while (head < tail) {
            String current = queue[head++];
            order.add(current);
            for (String child : outs.getOrDefault(current, List.of())) {
                int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0 && tail < queue.length) {
                    queue[tail++] = child;
                }
            }
        }

        if (order.size() != nodeIds.size()) {
            return new TopologicalOrder(nodeIds, true);
        }
        return new TopologicalOrder(order, false);
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    /**
     * @return The last id in the order, or null for an empty graph
     */
    public String last() {
        return ids.isEmpty() ? null : ids.get(ids.size() - 1);
    }

    /**
     * Position of every id, for "appears before" checks.
     */
    public Map<String, Integer> positions() {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            positions.put(ids.get(i), i);
        }
        return positions;
    }

    public boolean contains(String id) {
        Objects.requireNonNull(id, "Id cannot be null");
        return ids.contains(id);
    }
}
