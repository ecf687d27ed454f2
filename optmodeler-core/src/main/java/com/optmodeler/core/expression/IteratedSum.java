package com.optmodeler.core.expression;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Solver-side summation over one or more set iterators: {@code sum {i in I} body}.
 *
 * @param iterators bound iterators, in binding order
 * @param body summand, usually referring to the iterators
 */
public record IteratedSum(List<Symbol> iterators, Expression body) implements Expression {

    public IteratedSum {
        Objects.requireNonNull(body, "body must not be null");
        iterators = iterators == null ? List.of() : List.copyOf(iterators);
        if (iterators.isEmpty()) {
            throw new IllegalArgumentException("An iterated sum needs at least one iterator");
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIteratedSum(this);
    }

    @Override
    public void collectSymbols(Set<Symbol> out) {
        out.addAll(iterators);
        body.collectSymbols(out);
    }

    @Override
    public boolean isLinear() {
        return body.isLinear();
    }
}
