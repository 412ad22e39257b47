package org.etlstudio.engine.plan;

import java.util.Objects;

/**
 * Directed edge from a producing node to a consuming node.
 */
public record Edge(String source, String target) {

    public Edge {
        Objects.requireNonNull(source, "Edge source cannot be null");
        Objects.requireNonNull(target, "Edge target cannot be null");
    }

    public static Edge of(String source, String target) {
        return new Edge(source, target);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
