package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.PassthroughExpression;

/**
 * Dialect for generated Python programs (pandas and PySpark).
 *
 * Column names travel as string literals and expressions are embedded as
 * double-quoted string arguments ({@code df.query("...")},
 * {@code F.expr("...")}), so both only need string escaping.
 */
public final class PythonDialect implements TargetDialect {

    public static final PythonDialect INSTANCE = new PythonDialect();

    private PythonDialect() {
    }

    @Override
    public String name() {
        return "Python";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return quoteStringLiteral(identifier);
    }

    @Override
    public String quoteStringLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    @Override
    public String formatBoolean(boolean value) {
        return value ? "True" : "False";
    }

    @Override
    public String formatNull() {
        return "None";
    }

    @Override
    public String renderExpression(PassthroughExpression expression) {
        return quoteStringLiteral(expression.text());
    }
}
