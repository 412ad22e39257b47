package org.etlstudio.engine.expression;

import org.etlstudio.engine.execution.Row;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a {@link ScalarExpression} against one row at a time.
 *
 * Semantics follow dataframe query evaluation:
 * - comparisons never yield null; a missing operand compares unequal
 * - arithmetic with a missing operand yields null
 * - {@code /} is true division; {@code //} and {@code %} floor
 * - AND/OR/NOT use three-valued logic over booleans and nulls
 *
 * Instances hold the current row and are not thread-safe.
 */
public final class RowEvaluator implements ScalarExpressionVisitor<Object> {

    private final Map<String, Integer> columnIndex;
    private Row current;

    /**
     * @param columnNames Column names of the rows to evaluate; the first of
     *                    duplicate names wins
     */
    public RowEvaluator(List<String> columnNames) {
        Objects.requireNonNull(columnNames, "Column names cannot be null");
        this.columnIndex = new HashMap<>();
        for (int i = 0; i < columnNames.size(); i++) {
            columnIndex.putIfAbsent(columnNames.get(i), i);
        }
    }

    public Object evaluate(ScalarExpression expression, Row row) {
        this.current = row;
        return expression.accept(this);
    }

    /**
     * Evaluates a predicate; only {@code true} keeps the row.
     *
     * @throws ExpressionException if the result is not a boolean or null
     */
    public boolean test(ScalarExpression predicate, Row row) {
        Object result = evaluate(predicate, row);
        if (result == null) {
            return false;
        }
        if (result instanceof Boolean b) {
            return b;
        }
        throw new ExpressionException("Filter expression must evaluate to a boolean, got "
                + typeName(result) + ": " + predicate);
    }

    // ==================== Visitor ====================

    @Override
    public Object visitColumnReference(ColumnReference columnReference) {
        Integer index = columnIndex.get(columnReference.columnName());
        if (index == null) {
            throw new ExpressionException("name '" + columnReference.columnName() + "' is not defined");
        }
        return current.get(index);
    }

    @Override
    public Object visitLiteral(Literal literal) {
        return literal.value();
    }

    @Override
    public Object visitComparison(ComparisonExpression comparison) {
        Object left = comparison.left().accept(this);
        switch (comparison.operator()) {
            case IS_NULL:
                return left == null;
            case IS_NOT_NULL:
                return left != null;
            default:
                break;
        }
        Object right = comparison.right().accept(this);
        if (left == null || right == null) {
            return comparison.operator() == ComparisonExpression.ComparisonOperator.NOT_EQUALS;
        }
        return switch (comparison.operator()) {
            case EQUALS -> valuesEqual(left, right);
            case NOT_EQUALS -> !valuesEqual(left, right);
            case LESS_THAN -> compare(left, right, comparison) < 0;
            case LESS_THAN_OR_EQUALS -> compare(left, right, comparison) <= 0;
            case GREATER_THAN -> compare(left, right, comparison) > 0;
            case GREATER_THAN_OR_EQUALS -> compare(left, right, comparison) >= 0;
            default -> throw new ExpressionException("Unsupported comparison: " + comparison.operator());
        };
    }

    @Override
    public Object visitLogical(LogicalExpression logical) {
        switch (logical.operator()) {
            case NOT: {
                Boolean value = asLogical(logical.operands().get(0).accept(this));
                return value == null ? null : !value;
            }
            case AND: {
                boolean sawNull = false;
                for (ScalarExpression operand : logical.operands()) {
                    Boolean value = asLogical(operand.accept(this));
                    if (value == null) {
                        sawNull = true;
                    } else if (!value) {
                        return false;
                    }
                }
                return sawNull ? null : Boolean.TRUE;
            }
            default: {
                boolean sawNull = false;
                for (ScalarExpression operand : logical.operands()) {
                    Boolean value = asLogical(operand.accept(this));
                    if (value == null) {
                        sawNull = true;
                    } else if (value) {
                        return true;
                    }
                }
                return sawNull ? null : Boolean.FALSE;
            }
        }
    }

    @Override
    public Object visitArithmetic(ArithmeticExpression arithmetic) {
        Object left = arithmetic.left().accept(this);
        Object right = arithmetic.right().accept(this);
        if (left == null || right == null) {
            return null;
        }
        if (arithmetic.operator() == ArithmeticExpression.ArithmeticOperator.ADD
                && left instanceof String l && right instanceof String r) {
            return l + r;
        }
        Number a = asNumber(left, arithmetic);
        Number b = asNumber(right, arithmetic);
        boolean integral = a instanceof Long && b instanceof Long;
        return switch (arithmetic.operator()) {
            case ADD -> integral ? (Object) (a.longValue() + b.longValue()) : (Object) (a.doubleValue() + b.doubleValue());
            case SUBTRACT -> integral ? (Object) (a.longValue() - b.longValue()) : (Object) (a.doubleValue() - b.doubleValue());
            case MULTIPLY -> integral ? (Object) (a.longValue() * b.longValue()) : (Object) (a.doubleValue() * b.doubleValue());
            case DIVIDE -> a.doubleValue() / b.doubleValue();
            case FLOOR_DIVIDE -> floorDivide(a, b, integral);
            case MODULO -> modulo(a, b, integral);
            case POWER -> power(a, b, integral);
        };
    }

    @Override
    public Object visitIn(InExpression in) {
        Object value = in.operand().accept(this);
        boolean found = false;
        if (value != null) {
            for (ScalarExpression candidate : in.values()) {
                Object candidateValue = candidate.accept(this);
                if (candidateValue != null && valuesEqual(value, candidateValue)) {
                    found = true;
                    break;
                }
            }
        }
        return in.negated() != found;
    }

    @Override
    public Object visitFunction(FunctionExpression function) {
        List<ScalarExpression> args = function.arguments();
        switch (function.functionName()) {
            case "abs": {
                requireArity(function, 1, 1);
                Object value = args.get(0).accept(this);
                if (value == null) {
                    return null;
                }
                Number n = asNumber(value, function);
                return n instanceof Long l ? (Object) Math.abs(l) : (Object) Math.abs(n.doubleValue());
            }
            case "round": {
                requireArity(function, 1, 2);
                Object value = args.get(0).accept(this);
                int digits = 0;
                if (args.size() == 2) {
                    Object d = args.get(1).accept(this);
                    digits = d == null ? 0 : asNumber(d, function).intValue();
                }
                if (value == null) {
                    return null;
                }
                Number n = asNumber(value, function);
                if (n instanceof Long) {
                    return n;
                }
                double dv = n.doubleValue();
                if (Double.isNaN(dv) || Double.isInfinite(dv)) {
                    return dv;
                }
                return BigDecimal.valueOf(dv).setScale(digits, RoundingMode.HALF_EVEN).doubleValue();
            }
            case "lower":
            case "upper": {
                requireArity(function, 1, 1);
                Object value = args.get(0).accept(this);
                if (value == null) {
                    return null;
                }
                String s = value.toString();
                return function.functionName().equals("lower")
                        ? s.toLowerCase(Locale.ROOT)
                        : s.toUpperCase(Locale.ROOT);
            }
            case "len":
            case "length": {
                requireArity(function, 1, 1);
                Object value = args.get(0).accept(this);
                return value == null ? null : (Object) (long) value.toString().length();
            }
            case "coalesce": {
                for (ScalarExpression arg : args) {
                    Object value = arg.accept(this);
                    if (value != null) {
                        return value;
                    }
                }
                return null;
            }
            default:
                throw new ExpressionException("Unknown function: " + function.functionName());
        }
    }

    // ==================== Helpers ====================

    private static void requireArity(FunctionExpression function, int min, int max) {
        int n = function.arguments().size();
        if (n < min || n > max) {
            throw new ExpressionException(function.functionName() + "() takes "
                    + (min == max ? String.valueOf(min) : min + " to " + max)
                    + " argument(s), got " + n);
        }
    }

    private static Boolean asLogical(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new ExpressionException("Logical operand must be a boolean, got " + typeName(value));
    }

    private static Number asNumber(Object value, ScalarExpression context) {
        if (value instanceof Long || value instanceof Double) {
            return (Number) value;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        throw new ExpressionException("Unsupported operand type " + typeName(value) + " in " + context);
    }

    private static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Long l && right instanceof Long r) {
            return l.longValue() == r.longValue();
        }
        if (isNumeric(left) && isNumeric(right)) {
            return numericValue(left) == numericValue(right);
        }
        return left.equals(right);
    }

    private static int compare(Object left, Object right, ComparisonExpression context) {
        if (isNumeric(left) && isNumeric(right)) {
            if (left instanceof Long l && right instanceof Long r) {
                return Long.compare(l, r);
            }
            return Double.compare(numericValue(left), numericValue(right));
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        throw new ExpressionException("'" + context.operator().symbol() + "' not supported between "
                + typeName(left) + " and " + typeName(right));
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }

    private static double numericValue(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return ((Number) value).doubleValue();
    }

    private static Object floorDivide(Number a, Number b, boolean integral) {
        if (integral) {
            return b.longValue() == 0 ? null : (Object) Math.floorDiv(a.longValue(), b.longValue());
        }
        return Math.floor(a.doubleValue() / b.doubleValue());
    }

    private static Object modulo(Number a, Number b, boolean integral) {
        if (integral) {
            return b.longValue() == 0 ? null : (Object) Math.floorMod(a.longValue(), b.longValue());
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        if (y == 0.0) {
            return Double.NaN;
        }
        return x - y * Math.floor(x / y);
    }

    private static Object power(Number a, Number b, boolean integral) {
        if (integral && b.longValue() >= 0 && b.longValue() < 64) {
            long base = a.longValue();
            long result = 1L;
            for (long i = 0; i < b.longValue(); i++) {
                result *= base;
            }
            return result;
        }
        return Math.pow(a.doubleValue(), b.doubleValue());
    }

    private static String typeName(Object value) {
        if (value instanceof Long) {
            return "int";
        }
        if (value instanceof Double) {
            return "float";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof String) {
            return "str";
        }
        return value.getClass().getSimpleName();
    }
}
