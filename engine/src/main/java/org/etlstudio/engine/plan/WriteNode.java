package org.etlstudio.engine.plan;

import java.util.Objects;

/**
 * Writes its input to a CSV file, overwriting it, and passes the input on.
 *
 * @param id    The node id
 * @param label The display label
 * @param path  The output path
 */
public record WriteNode(String id, String label, String path) implements PipelineNode {

    public static final String DEFAULT_PATH = "out.csv";

    public WriteNode {
        Objects.requireNonNull(id, "Id cannot be null");
        label = label == null ? "" : label;
        path = path == null || path.isBlank() ? DEFAULT_PATH : path.trim();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WRITE;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
