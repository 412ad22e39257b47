package org.etlstudio.engine.expression;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scalar function call. Function names are case-insensitive and stored in
 * lower case.
 *
 * @param functionName The function name
 * @param arguments    The call arguments
 */
public record FunctionExpression(String functionName, List<ScalarExpression> arguments) implements ScalarExpression {

    public FunctionExpression {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
        functionName = functionName.toLowerCase(Locale.ROOT);
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(ScalarExpressionVisitor<T> visitor) {
        return visitor.visitFunction(this);
    }
}
