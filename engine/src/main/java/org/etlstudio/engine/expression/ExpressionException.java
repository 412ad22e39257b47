package org.etlstudio.engine.expression;

/**
 * Exception thrown when an expression cannot be parsed or evaluated.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
