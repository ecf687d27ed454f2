package com.optmodeler.core.expression;

import java.util.Objects;
import java.util.Set;

/**
 * Division by a non-constant denominator.
 *
 * @param numerator numerator
 * @param denominator denominator
 */
public record Quotient(Expression numerator, Expression denominator) implements Expression {

    public Quotient {
        Objects.requireNonNull(numerator, "numerator must not be null");
        Objects.requireNonNull(denominator, "denominator must not be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitQuotient(this);
    }

    @Override
    public void collectSymbols(Set<Symbol> out) {
        numerator.collectSymbols(out);
        denominator.collectSymbols(out);
    }

    @Override
    public boolean isLinear() {
        return numerator.isLinear() && !denominator.involvesDecision();
    }
}
