package com.featherplan.expression;

import com.featherplan.types.BooleanType;
import com.featherplan.types.DataType;
import com.featherplan.types.DoubleType;
import com.featherplan.types.IntegerType;
import com.featherplan.types.LongType;
import com.featherplan.types.StringType;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing an arithmetic, comparison or concatenation operator
 * with two operands.
 *
 * <p>Logical AND/OR are modeled by {@link And} and {@link Or} because the
 * optimizer rewrites them specifically.
 *
 * <p>Examples:
 * <pre>
 *   price * quantity           -- arithmetic
 *   age > 25                   -- comparison
 *   first_name || last_name    -- string concatenation
 * </pre>
 *
 * <p>Evaluation is null-propagating: if either operand is NULL the result is
 * NULL.
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Arithmetic operators
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),

        // Comparison operators
        EQUAL("="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),

        // String operators
        CONCAT("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == MODULO;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        if (operator.isComparison()) {
            return BooleanType.get();
        }
        if (operator == Operator.CONCAT) {
            return StringType.get();
        }
        // Analysis has already coerced both operands to a common type
        return left.dataType();
    }

    @Override
    public boolean nullable() {
        return left.nullable() || right.nullable();
    }

    @Override
    public Object eval(Row input) {
        Object l = left.eval(input);
        if (l == null) {
            return null;
        }
        Object r = right.eval(input);
        if (r == null) {
            return null;
        }
        if (operator.isComparison()) {
            return compareWith(compare(l, r));
        }
        if (operator == Operator.CONCAT) {
            return String.valueOf(l) + r;
        }
        if (!(l instanceof Number) || !(r instanceof Number)) {
            throw new EvaluationException(
                "Operator " + operator.symbol() + " requires numeric operands: " + this);
        }
        return arithmetic((Number) l, (Number) r);
    }

    private boolean compareWith(int cmp) {
        return switch (operator) {
            case EQUAL -> cmp == 0;
            case NOT_EQUAL -> cmp != 0;
            case LESS_THAN -> cmp < 0;
            case LESS_THAN_OR_EQUAL -> cmp <= 0;
            case GREATER_THAN -> cmp > 0;
            case GREATER_THAN_OR_EQUAL -> cmp >= 0;
            default -> throw new IllegalStateException("Not a comparison: " + operator);
        };
    }

    private int compare(Object l, Object r) {
        if (l instanceof Number a && r instanceof Number b) {
            if (a instanceof Double || a instanceof Float || b instanceof Double || b instanceof Float) {
                return Double.compare(a.doubleValue(), b.doubleValue());
            }
            return Long.compare(a.longValue(), b.longValue());
        }
        if (l instanceof String a && r instanceof String b) {
            return a.compareTo(b);
        }
        if (l instanceof Boolean a && r instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        throw new EvaluationException(
            "Cannot compare " + l.getClass().getSimpleName() + " with " + r.getClass().getSimpleName()
                + " in " + this);
    }

    private Object arithmetic(Number l, Number r) {
        DataType type = dataType();
        if (type instanceof IntegerType) {
            int a = l.intValue();
            int b = r.intValue();
            return switch (operator) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> a / nonZero(b);
                case MODULO -> a % nonZero(b);
                default -> throw new IllegalStateException("Not arithmetic: " + operator);
            };
        }
        if (type instanceof LongType) {
            long a = l.longValue();
            long b = r.longValue();
            return switch (operator) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> a / nonZero(b);
                case MODULO -> a % nonZero(b);
                default -> throw new IllegalStateException("Not arithmetic: " + operator);
            };
        }
        if (type instanceof DoubleType) {
            double a = l.doubleValue();
            double b = r.doubleValue();
            return switch (operator) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> a / b;
                case MODULO -> a % b;
                default -> throw new IllegalStateException("Not arithmetic: " + operator);
            };
        }
        throw new EvaluationException("Arithmetic is not defined for type " + type.typeName() + ": " + this);
    }

    private long nonZero(long divisor) {
        if (divisor == 0) {
            throw new EvaluationException("Division by zero: " + this);
        }
        return divisor;
    }

    private int nonZero(int divisor) {
        if (divisor == 0) {
            throw new EvaluationException("Division by zero: " + this);
        }
        return divisor;
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (newChildren.size() != 2) {
            throw new IllegalArgumentException("BinaryExpression expects exactly two children");
        }
        return new BinaryExpression(newChildren.get(0), operator, newChildren.get(1));
    }

    @Override
    public String toString() {
        return String.format("(%s %s %s)", left, operator.symbol(), right);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(left, that.left) &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.ADD, right);
    }

    public static BinaryExpression subtract(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.SUBTRACT, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.MULTIPLY, right);
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.DIVIDE, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.NOT_EQUAL, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN, right);
    }

    public static BinaryExpression greaterThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN_OR_EQUAL, right);
    }

    public static BinaryExpression concat(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.CONCAT, right);
    }
}
