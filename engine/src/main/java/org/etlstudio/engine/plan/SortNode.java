package org.etlstudio.engine.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Orders the input by a list of keys. An empty key list is the identity.
 *
 * @param id    The node id
 * @param label The display label
 * @param keys  The sort keys, most significant first
 */
public record SortNode(String id, String label, List<SortKey> keys) implements PipelineNode {

    public SortNode {
        Objects.requireNonNull(id, "Id cannot be null");
        label = label == null ? "" : label;
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    /**
     * Represents a single sort key.
     */
    public record SortKey(String column, boolean descending) {
        public SortKey {
            Objects.requireNonNull(column, "Column cannot be null");
        }

        public static SortKey asc(String column) {
            return new SortKey(column, false);
        }

        public static SortKey desc(String column) {
            return new SortKey(column, true);
        }
    }

    /**
     * Parses sort keys such as {@code "region, revenue desc"}.
     * The first word of each token is the column; a trailing {@code desc}
     * (any case) selects descending order.
     */
    public static List<SortKey> parseKeys(String text) {
        List<SortKey> keys = new ArrayList<>();
        if (text == null) {
            return keys;
        }
        for (String token : text.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] words = trimmed.split("\\s+");
            boolean desc = words.length > 1
                    && words[words.length - 1].toLowerCase(Locale.ROOT).equals("desc");
            keys.add(new SortKey(words[0], desc));
        }
        return keys;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SORT;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
