package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.PipelineGraph;
import org.etlstudio.engine.plan.PipelineNode;
import org.etlstudio.engine.plan.TopologicalOrder;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Assigns every node a program identifier derived from its label.
 *
 * Labels are lowercased, every run of characters outside {@code [a-z0-9]}
 * becomes one underscore, and leading/trailing underscores are stripped. An
 * empty result becomes {@value #PLACEHOLDER}; a leading digit gets the
 * {@code n_} prefix. Names are then made unique by visiting the nodes in
 * topological order and suffixing repeats with {@code _2}, {@code _3}, ...
 *
 * All lowerers call this with the same order, so cross-referenced names agree.
 */
public final class NameAssigner {

    public static final String PLACEHOLDER = "node";

    /**
     * Identifiers that generated programs already bind, plus Python keywords.
     */
    static final Set<String> RESERVED = Set.of(
            "pd", "np", "spark", "result",
            "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif",
            "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda",
            "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    private NameAssigner() {
    }

    /**
     * @param order  Node ids in visiting order
     * @param labels Node id to label
     * @return Node id to identifier, in visiting order
     */
    public static Map<String, String> assign(List<String> order, Map<String, String> labels) {
        Map<String, Integer> counts = new HashMap<>();
        Set<String> used = new HashSet<>(RESERVED);
        Map<String, String> names = new LinkedHashMap<>();
        for (String id : order) {
            String base = sanitize(labels.get(id));
            String candidate = base;
            int count = counts.merge(base, 1, Integer::sum);
            if (count > 1 || used.contains(candidate)) {
                count = Math.max(count, 2);
                candidate = base + "_" + count;
                while (used.contains(candidate)) {
                    count++;
                    candidate = base + "_" + count;
                }
                counts.put(base, count);
            }
            used.add(candidate);
            names.put(id, candidate);
        }
        return names;
    }

    /**
     * Names for a whole graph, visiting in its topological order.
     */
    public static Map<String, String> assign(PipelineGraph graph, TopologicalOrder order) {
        Map<String, String> labels = new HashMap<>();
        for (PipelineNode node : graph.nodes()) {
            labels.put(node.id(), node.label());
        }
        return assign(order.ids(), labels);
    }

    static String sanitize(String label) {
        String lower = label == null ? "" : label.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean pendingUnderscore = false;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                if (pendingUnderscore && sb.length() > 0) {
                    sb.append('_');
                }
                pendingUnderscore = false;
                sb.append(c);
            } else {
                pendingUnderscore = true;
            }
        }
        if (sb.length() == 0) {
            return PLACEHOLDER;
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, "n_");
        }
        return sb.toString();
    }
}
