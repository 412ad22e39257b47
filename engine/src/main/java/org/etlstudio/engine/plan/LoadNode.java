package org.etlstudio.engine.plan;

import java.util.Objects;
import java.util.Optional;

/**
 * Reads a CSV file into a table.
 *
 * @param id      The node id
 * @param label   The display label
 * @param path    The file path, also the key under which inline content is staged
 * @param content Uploaded file text held in memory, or null when the path is read
 */
public record LoadNode(String id, String label, String path, String content) implements PipelineNode {

    public static final String DEFAULT_PATH = "uploaded.csv";

    public LoadNode {
        Objects.requireNonNull(id, "Id cannot be null");
        label = label == null ? "" : label;
        path = path == null || path.isBlank() ? DEFAULT_PATH : path.trim();
    }

    public static LoadNode of(String id, String label, String path) {
        return new LoadNode(id, label, path, null);
    }

    /**
     * @return The in-memory content, if the node carries any non-blank text
     */
    public Optional<String> inlineContent() {
        return content == null || content.isBlank() ? Optional.empty() : Optional.of(content);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOAD;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
