package com.optmodeler.core.expression;

import java.util.Set;

/**
 * Numeric literal. Infinite values are allowed and render as the solver's large-number constant.
 *
 * @param value numeric value, never NaN
 */
public record Constant(double value) implements Expression {

    public static final Constant ZERO = new Constant(0);
    public static final Constant ONE = new Constant(1);

    public Constant {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Constant must not be NaN");
        }
        if (value == 0.0) {
            value = 0.0;
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public void collectSymbols(Set<Symbol> out) {
        // no symbols
    }

    @Override
    public boolean isLinear() {
        return true;
    }
}
