package org.etlstudio.engine.expression;

import org.etlstudio.engine.expression.ArithmeticExpression.ArithmeticOperator;
import org.etlstudio.engine.expression.ComparisonExpression.ComparisonOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that converts the parse tree to {@link ScalarExpression} IR.
 *
 * The grammar structure:
 * - expression: conjunction (OR conjunction)*
 * - conjunction: negation (AND negation)*
 * - predicate: comparison, null test, IN list, or a plain value
 * - additive / multiplicative / unary / power: arithmetic by precedence
 * - primary: literal, function call, column reference, parenthesized
 */
final class ExpressionAstBuilder extends PipelineExpressionBaseVisitor<ScalarExpression> {

    // ========================================
    // BOOLEAN STRUCTURE
    // ========================================

    @Override
    public ScalarExpression visitParse(PipelineExpressionParser.ParseContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public ScalarExpression visitExpression(PipelineExpressionParser.ExpressionContext ctx) {
        if (ctx.conjunction().size() == 1) {
            return visit(ctx.conjunction(0));
        }
        List<ScalarExpression> operands = new ArrayList<>();
        for (PipelineExpressionParser.ConjunctionContext conjunction : ctx.conjunction()) {
            operands.add(visit(conjunction));
        }
        return LogicalExpression.or(operands);
    }

    @Override
    public ScalarExpression visitConjunction(PipelineExpressionParser.ConjunctionContext ctx) {
        if (ctx.negation().size() == 1) {
            return visit(ctx.negation(0));
        }
        List<ScalarExpression> operands = new ArrayList<>();
        for (PipelineExpressionParser.NegationContext negation : ctx.negation()) {
            operands.add(visit(negation));
        }
        return LogicalExpression.and(operands);
    }

    @Override
    public ScalarExpression visitNegation(PipelineExpressionParser.NegationContext ctx) {
        if (ctx.NOT() != null) {
            return LogicalExpression.not(visit(ctx.negation()));
        }
        return visit(ctx.predicate());
    }

    // ========================================
    // PREDICATES
    // ========================================

    @Override
    public ScalarExpression visitComparisonPredicate(PipelineExpressionParser.ComparisonPredicateContext ctx) {
        return new ComparisonExpression(
                visit(ctx.additive(0)),
                comparisonOperator(ctx.comparisonOperator()),
                visit(ctx.additive(1)));
    }

    @Override
    public ScalarExpression visitNullPredicate(PipelineExpressionParser.NullPredicateContext ctx) {
        return ComparisonExpression.isNull(visit(ctx.additive()), ctx.NOT() != null);
    }

    @Override
    public ScalarExpression visitInPredicate(PipelineExpressionParser.InPredicateContext ctx) {
        List<ScalarExpression> values = new ArrayList<>();
        for (PipelineExpressionParser.ExpressionContext value : ctx.valueList().expression()) {
            values.add(visit(value));
        }
        return new InExpression(visit(ctx.additive()), values, ctx.NOT() != null);
    }

    @Override
    public ScalarExpression visitValuePredicate(PipelineExpressionParser.ValuePredicateContext ctx) {
        return visit(ctx.additive());
    }

    private static ComparisonOperator comparisonOperator(PipelineExpressionParser.ComparisonOperatorContext ctx) {
        return switch (ctx.getStart().getType()) {
            case PipelineExpressionParser.EQ -> ComparisonOperator.EQUALS;
            case PipelineExpressionParser.NEQ -> ComparisonOperator.NOT_EQUALS;
            case PipelineExpressionParser.LT -> ComparisonOperator.LESS_THAN;
            case PipelineExpressionParser.LTE -> ComparisonOperator.LESS_THAN_OR_EQUALS;
            case PipelineExpressionParser.GT -> ComparisonOperator.GREATER_THAN;
            case PipelineExpressionParser.GTE -> ComparisonOperator.GREATER_THAN_OR_EQUALS;
            default -> throw new ExpressionException("Unknown comparison operator: " + ctx.getText());
        };
    }

    // ========================================
    // ARITHMETIC
    // ========================================

    @Override
    public ScalarExpression visitAdditive(PipelineExpressionParser.AdditiveContext ctx) {
        ScalarExpression result = visit(ctx.multiplicative(0));
        for (int i = 0; i < ctx.additiveOperator().size(); i++) {
            ArithmeticOperator operator = ctx.additiveOperator(i).PLUS() != null
                    ? ArithmeticOperator.ADD
                    : ArithmeticOperator.SUBTRACT;
            result = new ArithmeticExpression(result, operator, visit(ctx.multiplicative(i + 1)));
        }
        return result;
    }

    @Override
    public ScalarExpression visitMultiplicative(PipelineExpressionParser.MultiplicativeContext ctx) {
        ScalarExpression result = visit(ctx.unary(0));
        for (int i = 0; i < ctx.multiplicativeOperator().size(); i++) {
            ArithmeticOperator operator = switch (ctx.multiplicativeOperator(i).getStart().getType()) {
                case PipelineExpressionParser.STAR -> ArithmeticOperator.MULTIPLY;
                case PipelineExpressionParser.SLASH -> ArithmeticOperator.DIVIDE;
                case PipelineExpressionParser.FLOOR_DIV -> ArithmeticOperator.FLOOR_DIVIDE;
                default -> ArithmeticOperator.MODULO;
            };
            result = new ArithmeticExpression(result, operator, visit(ctx.unary(i + 1)));
        }
        return result;
    }

    @Override
    public ScalarExpression visitUnary(PipelineExpressionParser.UnaryContext ctx) {
        if (ctx.MINUS() != null) {
            ScalarExpression operand = visit(ctx.unary());
            // Fold negative numeric literals
            if (operand instanceof Literal literal && literal.value() instanceof Long l) {
                return Literal.of(-l);
            }
            if (operand instanceof Literal literal && literal.value() instanceof Double d) {
                return Literal.of(-d);
            }
            return ArithmeticExpression.negate(operand);
        }
        if (ctx.PLUS() != null) {
            return visit(ctx.unary());
        }
        return visit(ctx.power());
    }

    @Override
    public ScalarExpression visitPower(PipelineExpressionParser.PowerContext ctx) {
        ScalarExpression base = visit(ctx.primary());
        if (ctx.POW() == null) {
            return base;
        }
        return new ArithmeticExpression(base, ArithmeticOperator.POWER, visit(ctx.unary()));
    }

    // ========================================
    // PRIMARIES
    // ========================================

    @Override
    public ScalarExpression visitLiteralPrimary(PipelineExpressionParser.LiteralPrimaryContext ctx) {
        return visit(ctx.literal());
    }

    @Override
    public ScalarExpression visitFunctionCall(PipelineExpressionParser.FunctionCallContext ctx) {
        List<ScalarExpression> arguments = new ArrayList<>();
        for (PipelineExpressionParser.ExpressionContext argument : ctx.expression()) {
            arguments.add(visit(argument));
        }
        return new FunctionExpression(ctx.IDENTIFIER().getText(), arguments);
    }

    @Override
    public ScalarExpression visitColumnPrimary(PipelineExpressionParser.ColumnPrimaryContext ctx) {
        PipelineExpressionParser.ColumnReferenceContext ref = ctx.columnReference();
        if (ref.QUOTED_IDENTIFIER() != null) {
            String quoted = ref.QUOTED_IDENTIFIER().getText();
            return ColumnReference.of(quoted.substring(1, quoted.length() - 1));
        }
        return ColumnReference.of(ref.IDENTIFIER().getText());
    }

    @Override
    public ScalarExpression visitParenthesized(PipelineExpressionParser.ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }

    // ========================================
    // LITERALS
    // ========================================

    @Override
    public ScalarExpression visitIntegerLiteral(PipelineExpressionParser.IntegerLiteralContext ctx) {
        String text = ctx.INTEGER_LITERAL().getText();
        try {
            return Literal.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return Literal.of(Double.parseDouble(text));
        }
    }

    @Override
    public ScalarExpression visitDecimalLiteral(PipelineExpressionParser.DecimalLiteralContext ctx) {
        return Literal.of(Double.parseDouble(ctx.DECIMAL_LITERAL().getText()));
    }

    @Override
    public ScalarExpression visitStringLiteral(PipelineExpressionParser.StringLiteralContext ctx) {
        return Literal.of(unquote(ctx.STRING_LITERAL().getText()));
    }

    @Override
    public ScalarExpression visitTrueLiteral(PipelineExpressionParser.TrueLiteralContext ctx) {
        return Literal.of(Boolean.TRUE);
    }

    @Override
    public ScalarExpression visitFalseLiteral(PipelineExpressionParser.FalseLiteralContext ctx) {
        return Literal.of(Boolean.FALSE);
    }

    @Override
    public ScalarExpression visitNullLiteral(PipelineExpressionParser.NullLiteralContext ctx) {
        return Literal.nullLiteral();
    }

    /**
     * Strips the quotes of a string literal and resolves escapes. A doubled
     * single quote inside a single-quoted literal is one quote.
     */
    static String unquote(String text) {
        char quote = text.charAt(0);
        String body = text.substring(1, text.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char escaped = body.charAt(++i);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else if (c == quote && quote == '\'' && i + 1 < body.length() && body.charAt(i + 1) == '\'') {
                sb.append('\'');
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
