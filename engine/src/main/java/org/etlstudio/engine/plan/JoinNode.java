package org.etlstudio.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Joins two inputs on pairwise key lists.
 *
 * The left input is the source of the first incoming edge, the right input
 * the source of the second. When the right key list is shorter than the left
 * one, positions past its end reuse its first key (see {@link #rightKeyAt}).
 *
 * @param id        The node id
 * @param label     The display label
 * @param joinType  The type of join
 * @param leftKeys  The key columns of the left input
 * @param rightKeys The key columns of the right input
 */
public record JoinNode(
        String id,
        String label,
        JoinType joinType,
        List<String> leftKeys,
        List<String> rightKeys) implements PipelineNode {

    public static final String DEFAULT_KEY = "id";

    public JoinNode {
        Objects.requireNonNull(id, "Id cannot be null");
        label = label == null ? "" : label;
        joinType = joinType == null ? JoinType.INNER : joinType;
        leftKeys = leftKeys == null || leftKeys.isEmpty() ? List.of(DEFAULT_KEY) : List.copyOf(leftKeys);
        rightKeys = rightKeys == null || rightKeys.isEmpty() ? List.of(DEFAULT_KEY) : List.copyOf(rightKeys);
    }

    /**
     * Number of key pairs; driven by the left key list.
     */
    public int keyCount() {
        return leftKeys.size();
    }

    /**
     * Right key paired with the left key at {@code index}. Indices beyond the
     * right list wrap to its first element.
     */
    public String rightKeyAt(int index) {
        return rightKeys.get(index < rightKeys.size() ? index : 0);
    }

    /**
     * Right keys aligned one-to-one with the left keys.
     */
    public List<String> pairedRightKeys() {
        String[] paired = new String[leftKeys.size()];
        for (int i = 0; i < paired.length; i++) {
            paired[i] = rightKeyAt(i);
        }
        return List.of(paired);
    }

    /**
     * True when every key pair uses the same column name on both sides.
     */
    public boolean sameNamedKeys() {
        for (int i = 0; i < leftKeys.size(); i++) {
            if (!leftKeys.get(i).equals(rightKeyAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Types of joins.
     */
    public enum JoinType {
        INNER("inner", "INNER JOIN"),
        LEFT("left", "LEFT OUTER JOIN"),
        RIGHT("right", "RIGHT OUTER JOIN"),
        OUTER("outer", "FULL OUTER JOIN");

        private final String wireName;
        private final String sql;

        JoinType(String wireName, String sql) {
            this.wireName = wireName;
            this.sql = sql;
        }

        public String wireName() {
            return wireName;
        }

        public String toSql() {
            return sql;
        }

        public static JoinType fromWireName(String name) {
            if (name == null || name.isBlank()) {
                return INNER;
            }
            for (JoinType type : values()) {
                if (type.wireName.equalsIgnoreCase(name.trim())) {
                    return type;
                }
            }
            if (name.trim().equalsIgnoreCase("full")) {
                return OUTER;
            }
            throw new GraphCompileException("Unsupported join type: " + name);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.JOIN;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
