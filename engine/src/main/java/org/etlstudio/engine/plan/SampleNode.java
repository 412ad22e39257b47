package org.etlstudio.engine.plan;

import java.util.Objects;

/**
 * Samples rows from the input.
 *
 * {@link SampleMode#ROWS} keeps exactly {@code min(n, rowCount)} rows;
 * {@link SampleMode#FRACTION} includes each row independently with
 * probability {@code fraction}.
 *
 * @param id       The node id
 * @param label    The display label
 * @param mode     The sampling mode
 * @param n        The row count for {@link SampleMode#ROWS}
 * @param fraction The inclusion probability for {@link SampleMode#FRACTION}
 * @param seed     Optional random seed, null for an unseeded draw
 */
public record SampleNode(
        String id,
        String label,
        SampleMode mode,
        int n,
        double fraction,
        Long seed) implements PipelineNode {

    public static final int DEFAULT_ROWS = 100;
    public static final double DEFAULT_FRACTION = 0.1;

    public SampleNode {
        Objects.requireNonNull(id, "Id cannot be null");
        label = label == null ? "" : label;
        mode = mode == null ? SampleMode.ROWS : mode;
        if (n < 0) {
            throw new GraphCompileException("Sample '" + id + "' has a negative row count: " + n);
        }
        if (fraction < 0.0 || fraction > 1.0 || Double.isNaN(fraction)) {
            throw new GraphCompileException("Sample '" + id + "' fraction must be within [0, 1]: " + fraction);
        }
    }

    /**
     * Sampling modes.
     */
    public enum SampleMode {
        ROWS, FRACTION;

        public static SampleMode fromWireName(String name) {
            if (name == null || name.isBlank() || name.trim().equalsIgnoreCase("rows")) {
                return ROWS;
            }
            if (name.trim().equalsIgnoreCase("fraction")) {
                return FRACTION;
            }
            throw new GraphCompileException("Unsupported sample mode: " + name);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SAMPLE;
    }

    @Override
    public <T> T accept(PipelineNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
