package com.optmodeler.core.expression;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates weighted terms and builds a canonical linear expression.
 *
 * <p>Like terms are merged as they are added; zero coefficients are removed on
 * {@link #build()}. Nested sums are expanded and constants are folded into the
 * constant part.
 *
 * <pre>{@code
 * Expression e = Expressions.newSumBuilder()
 *         .addTerm(x, 2)
 *         .addTerm(x, 3)
 *         .add(5)
 *         .build();   // 5 * x + 5
 * }</pre>
 */
public final class SumBuilder {

    private final Map<Expression, Double> terms = new LinkedHashMap<>();
    private double constant;

    SumBuilder() {
    }

    public SumBuilder add(Operand operand) {
        return addTerm(operand, 1);
    }

    public SumBuilder add(double value) {
        checkFinite(value);
        constant += value;
        return this;
    }

    /**
     * Adds {@code coefficient * operand}.
     *
     * @param operand term
     * @param coefficient multiplier
     * @return this builder
     */
    public SumBuilder addTerm(Operand operand, double coefficient) {
        if (operand == null) {
            throw new IllegalArgumentException("operand must not be null");
        }
        if (Double.isNaN(coefficient)) {
            throw new IllegalArgumentException("coefficient must not be NaN");
        }
        Expression expression = operand.toExpression();
        if (expression instanceof Constant c) {
            constant += coefficient * c.value();
        } else if (expression instanceof Sum sum) {
            sum.terms().forEach((term, c) -> terms.merge(term, c * coefficient, Double::sum));
            constant += coefficient * sum.constant();
        } else {
            terms.merge(expression, coefficient, Double::sum);
        }
        return this;
    }

    /**
     * Builds the canonical expression.
     *
     * @return a {@link Constant} when no terms remain, the bare term when a single unit
     *     term remains with no constant, or a {@link Sum} otherwise
     */
    public Expression build() {
        Map<Expression, Double> nonZero = new LinkedHashMap<>();
        terms.forEach((term, c) -> {
            if (c != 0.0) {
                nonZero.put(term, c);
            }
        });
        if (nonZero.isEmpty()) {
            return new Constant(constant);
        }
        if (nonZero.size() == 1 && constant == 0.0) {
            Map.Entry<Expression, Double> only = nonZero.entrySet().iterator().next();
            if (only.getValue() == 1.0) {
                return only.getKey();
            }
        }
        return new Sum(nonZero, constant);
    }

    private static void checkFinite(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("value must not be NaN");
        }
    }
}
