package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.PipelineNode;
import org.etlstudio.engine.plan.TopologicalOrder;

import java.util.List;
import java.util.Map;

/**
 * Per-call state shared by the lowerers: the graph, its order and the names
 * assigned to every node.
 */
final class LoweringContext {

    private final PipelineGraph graph;
    private final TopologicalOrder order;
    private final Map<String, String> names;

    LoweringContext(PipelineGraph graph) {
        this.graph = graph;
        this.order = graph.topologicalOrder();
        this.names = NameAssigner.assign(graph, order);
    }

    PipelineGraph graph() {
        return graph;
    }

    List<String> order() {
        return order.ids();
    }

    String nameOf(String id) {
        return names.get(id);
    }

    /**
     * Name of the single (or first) input of a node.
     */
    String input(PipelineNode node) {
        return inputAt(node, 0);
    }

    String inputAt(PipelineNode node, int index) {
        List<String> parents = graph.parentsOf(node.id());
        return names.get(parents.get(index));
    }

    /**
     * @return The name bound to the last node in order, or null for an empty graph
     */
    String resultName() {
        String last = order.last();
        return last == null ? null : names.get(last);
    }
}
