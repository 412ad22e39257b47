package org.etlstudio.engine.plan;

import java.util.Objects;

/**
 * A node whose kind tag is not recognised. It copies its single input and
 * shows up as a placeholder in generated programs.
 *
 * @param id      The node id
 * @param label   The display label
 * @param rawKind The kind tag as received
 */
public record UnknownNode(String id, String label, String rawKind) implements PipelineNode {

    public UnknownNode {
        Objects.requireNonNull(id, "Id cannot be null");
        label = label == null ? "" : label;
        rawKind = rawKind == null ? "" : rawKind;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNKNOWN;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
