package com.featherplan.expression;

import com.featherplan.types.BooleanType;
import com.featherplan.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Logical disjunction with SQL three-valued semantics: TRUE wins over NULL,
 * NULL wins over FALSE.
 */
public final class Or implements Expression {

    private final Expression left;
    private final Expression right;

    public Or(Expression left, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return left.nullable() || right.nullable();
    }

    @Override
    public Object eval(Row input) {
        Object l = left.eval(input);
        if (Boolean.TRUE.equals(l)) {
            return true;
        }
        Object r = right.eval(input);
        if (Boolean.TRUE.equals(r)) {
            return true;
        }
        if (l == null || r == null) {
            return null;
        }
        return false;
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        if (newChildren.size() != 2) {
            throw new IllegalArgumentException("Or expects exactly two children");
        }
        return new Or(newChildren.get(0), newChildren.get(1));
    }

    @Override
    public String toString() {
        return "(" + left + " OR " + right + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Or)) return false;
        Or that = (Or) obj;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("or", left, right);
    }
}
