package com.optmodeler.core.expression;

import java.util.Objects;
import java.util.Set;

/**
 * Product of two non-constant factors.
 *
 * @param left left factor
 * @param right right factor
 */
public record Product(Expression left, Expression right) implements Expression {

    public Product {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitProduct(this);
    }

    @Override
    public void collectSymbols(Set<Symbol> out) {
        left.collectSymbols(out);
        right.collectSymbols(out);
    }

    @Override
    public boolean isLinear() {
        return left.isLinear() && right.isLinear()
                && !(left.involvesDecision() && right.involvesDecision());
    }
}
