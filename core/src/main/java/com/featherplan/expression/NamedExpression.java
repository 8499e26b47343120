package com.featherplan.expression;

/**
 * An expression that produces a named column: either a reference to an
 * existing column or an {@link Alias} defining a new one.
 */
public interface NamedExpression extends Expression {

    String name();

    /**
     * Returns the identity of the produced column.
     *
     * @return the expression id
     */
    ExprId exprId();

    /**
     * Returns the attribute that downstream operators use to read the column
     * produced by this expression.
     *
     * @return the output attribute
     */
    AttributeReference toAttribute();
}
