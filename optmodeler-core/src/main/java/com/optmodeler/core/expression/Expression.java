package com.optmodeler.core.expression;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable node of the expression algebra.
 *
 * <p>Expressions are built through {@link Expressions}, which keeps linear parts in
 * canonical form: like terms are merged, zero coefficients are dropped and a sum with a
 * single unit term collapses to that term. Nonlinear nodes are kept structurally.
 *
 * <p>Node types:
 * <ul>
 *   <li>{@link Constant} - numeric literal</li>
 *   <li>{@link Reference} - a symbol, optionally at an index key</li>
 *   <li>{@link Sum} - weighted terms plus a constant</li>
 *   <li>{@link Product}, {@link Quotient}, {@link Power} - binary nonlinear nodes</li>
 *   <li>{@link FunctionCall} - named function application</li>
 *   <li>{@link IteratedSum} - {@code sum {i in I} body}</li>
 * </ul>
 */
public interface Expression extends Operand {

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Adds every symbol this expression mentions, including iterators, to {@code out}.
     *
     * @param out destination set, kept in first-mention order
     */
    void collectSymbols(Set<Symbol> out);

    /**
     * Returns whether the expression is linear in its decision symbols.
     *
     * @return true if no two decision-bearing factors are multiplied or otherwise combined nonlinearly
     */
    boolean isLinear();

    @Override
    default Expression toExpression() {
        return this;
    }

    default boolean isConstant() {
        return this instanceof Constant;
    }

    /**
     * Returns every symbol referenced by this expression in first-mention order.
     *
     * @return set of symbols
     */
    default Set<Symbol> symbols() {
        Set<Symbol> out = new LinkedHashSet<>();
        collectSymbols(out);
        return out;
    }

    /**
     * Returns whether any referenced symbol is a decision symbol.
     *
     * @return true if the expression depends on variables
     */
    default boolean involvesDecision() {
        return symbols().stream().anyMatch(Symbol::isDecision);
    }
}
