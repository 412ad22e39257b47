package org.etlstudio.engine.transpiler;

import org.etlstudio.engine.plan.PassthroughExpression;

/**
 * Literal and identifier syntax of a target program language.
 * Implementations handle the differences between backends.
 */
public interface TargetDialect {

    /**
     * @return The dialect name (e.g., "DuckDB", "Python")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    String quoteStringLiteral(String value);

    /**
     * Format a boolean literal.
     */
    String formatBoolean(boolean value);

    /**
     * Format a NULL literal.
     */
    default String formatNull() {
        return "NULL";
    }

    /**
     * Renders an opaque filter/derive expression in the form the target
     * embeds it. Only literal escaping is applied; operators, functions and
     * literals inside the expression are never translated.
     */
    String renderExpression(PassthroughExpression expression);
}
