package com.optmodeler.core.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Linear combination of terms plus a constant.
 *
 * <p>Terms keep first-insertion order, which is the order they render in. Instances built
 * by {@link Expressions} never hold zero coefficients, nested sums or constants as terms.
 *
 * @param terms term to coefficient, in insertion order
 * @param constant constant part
 */
public record Sum(Map<Expression, Double> terms, double constant) implements Expression {

    public Sum {
        Objects.requireNonNull(terms, "terms must not be null");
        terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
        if (Double.isNaN(constant)) {
            throw new IllegalArgumentException("constant must not be NaN");
        }
    }

    public double coefficientOf(Expression term) {
        return terms.getOrDefault(term, 0.0);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSum(this);
    }

    @Override
    public void collectSymbols(Set<Symbol> out) {
        terms.keySet().forEach(t -> t.collectSymbols(out));
    }

    @Override
    public boolean isLinear() {
        return terms.keySet().stream().allMatch(Expression::isLinear);
    }
}
