package com.featherplan.expression;

import com.featherplan.types.BooleanType;
import com.featherplan.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a unary operation (operation with one operand).
 *
 * <p>Unary expressions include:
 * <ul>
 *   <li>Arithmetic negation: -a</li>
 *   <li>Logical negation: NOT a</li>
 *   <li>IS NULL: a IS NULL</li>
 *   <li>IS NOT NULL: a IS NOT NULL</li>
 * </ul>
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NEGATE("-"),
        NOT("NOT"),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isPrefix() {
            return this == NEGATE || this == NOT;
        }
    }

    private final Operator operator;
    private final Expression operand;

    /**
     * Creates a unary expression.
     *
     * @param operator the operator
     * @param operand the operand
     */
    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public DataType dataType() {
        if (operator == Operator.NEGATE) {
            return operand.dataType();
        }
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        // IS NULL and IS NOT NULL always return non-null boolean
        if (operator == Operator.IS_NULL || operator == Operator.IS_NOT_NULL) {
            return false;
        }
        return operand.nullable();
    }

    @Override
    public Object eval(Row input) {
        Object value = operand.eval(input);
        switch (operator) {
            case IS_NULL:
                return value == null;
            case IS_NOT_NULL:
                return value != null;
            default:
                break;
        }
        if (value == null) {
            return null;
        }
        if (operator == Operator.NOT) {
            if (!(value instanceof Boolean)) {
                throw new EvaluationException("NOT requires a boolean operand: " + this);
            }
            return !((Boolean) value);
        }
        if (value instanceof Integer i) {
            return -i;
        }
        if (value instanceof Long l) {
            return -l;
        }
        if (value instanceof Double d) {
            return -d;
        }
        throw new EvaluationException("Negation requires a numeric operand: " + this);
    }

    @Override
    public List<Expression> children() {
        return List.of(operand);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (newChildren.size() != 1) {
            throw new IllegalArgumentException("UnaryExpression expects exactly one child");
        }
        return new UnaryExpression(operator, newChildren.get(0));
    }

    @Override
    public String toString() {
        if (operator == Operator.NEGATE) {
            return String.format("(-%s)", operand);
        }
        if (operator.isPrefix()) {
            return String.format("(%s %s)", operator.symbol(), operand);
        }
        return String.format("(%s %s)", operand, operator.symbol());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression isNotNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NOT_NULL, operand);
    }
}
