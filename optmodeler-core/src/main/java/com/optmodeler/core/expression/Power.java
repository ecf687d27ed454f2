package com.optmodeler.core.expression;

import java.util.Objects;
import java.util.Set;

/**
 * Exponentiation, rendered with the {@code ^} operator.
 *
 * @param base base
 * @param exponent exponent
 */
public record Power(Expression base, Expression exponent) implements Expression {

    public Power {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(exponent, "exponent must not be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPower(this);
    }

    @Override
    public void collectSymbols(Set<Symbol> out) {
        base.collectSymbols(out);
        exponent.collectSymbols(out);
    }

    @Override
    public boolean isLinear() {
        return !base.involvesDecision() && !exponent.involvesDecision();
    }
}
