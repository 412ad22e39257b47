package org.etlstudio.engine.plan;

import java.util.Objects;

/**
 * Opaque expression text of a filter or derive node.
 *
 * The text is never parsed by the lowerers; it is handed to each backend as
 * is, escaped only for the target's literal syntax. Whether the same text
 * means the same thing in every backend dialect is up to the author of the
 * pipeline.
 *
 * @param text The raw expression text
 */
public record PassthroughExpression(String text) {

    public PassthroughExpression {
        text = text == null ? "" : text.trim();
    }

    public static PassthroughExpression of(String text) {
        return new PassthroughExpression(text);
    }

    public static PassthroughExpression empty() {
        return new PassthroughExpression("");
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    /**
     * Conjunction used by filter fusion: blank operands are dropped, two
     * non-blank operands become {@code (a) AND (b)}.
     */
    public PassthroughExpression and(PassthroughExpression other) {
        Objects.requireNonNull(other, "Other expression cannot be null");
        if (isBlank()) {
            return other;
        }
        if (other.isBlank()) {
            return this;
        }
        return new PassthroughExpression("(" + text + ") AND (" + other.text + ")");
    }

    @Override
    public String toString() {
        return text;
    }
}
