package org.etlstudio.engine.validation;

import java.util.Objects;

/**
 * Outcome of comparing two signatures.
 *
 * @param matches Whether columns, row count and sample hash agree
 * @param reason  "match", or the first dimension that differs with both values
 */
public record SignatureComparison(boolean matches, String reason) {

    public static final String MATCH = "match";

    public SignatureComparison {
        Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public static SignatureComparison match() {
        return new SignatureComparison(true, MATCH);
    }

    public static SignatureComparison mismatch(String reason) {
        return new SignatureComparison(false, reason);
    }
}
