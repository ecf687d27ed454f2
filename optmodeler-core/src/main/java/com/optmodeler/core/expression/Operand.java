package com.optmodeler.core.expression;

/**
 * Anything that can take part in arithmetic: expressions, variables, parameters,
 * group members and set iterators.
 */
public interface Operand {

    /**
     * Returns the expression form of this operand.
     *
     * @return expression, never null
     */
    Expression toExpression();
}
