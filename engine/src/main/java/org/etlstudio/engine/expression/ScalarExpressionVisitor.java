package org.etlstudio.engine.expression;

/**
 * Visitor over parsed row-level expressions.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ScalarExpressionVisitor<T> {

    T visitColumnReference(ColumnReference columnReference);

    T visitLiteral(Literal literal);

    T visitComparison(ComparisonExpression comparison);

    T visitLogical(LogicalExpression logical);

    T visitArithmetic(ArithmeticExpression arithmetic);

    T visitIn(InExpression in);

    T visitFunction(FunctionExpression function);
}
