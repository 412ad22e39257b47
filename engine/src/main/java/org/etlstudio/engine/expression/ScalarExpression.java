package org.etlstudio.engine.expression;

/**
 * Sealed interface for parsed row-level expressions, as used by filter
 * predicates and derived columns when a pipeline is interpreted in process.
 *
 * Includes:
 * - ColumnReference: reference to a column of the current row
 * - Literal: constant value
 * - ComparisonExpression: comparison operators and null tests
 * - LogicalExpression: boolean operators (AND, OR, NOT)
 * - ArithmeticExpression: +, -, *, /, //, %, **
 * - InExpression: membership in a literal list
 * - FunctionExpression: scalar function call
 */
public sealed interface ScalarExpression
        permits ColumnReference, Literal, ComparisonExpression, LogicalExpression, ArithmeticExpression,
        InExpression, FunctionExpression {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ScalarExpressionVisitor<T> visitor);
}
